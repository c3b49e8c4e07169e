package com.lumi.backend.modules.auth.application;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.function.Consumer;

import com.lumi.backend.global.async.BackgroundTaskRunner;
import com.lumi.backend.modules.audit.application.SecurityEventService;
import com.lumi.backend.modules.audit.application.SecurityEventService.SecurityEventCommand;
import com.lumi.backend.modules.auth.domain.DeviceMetadata;
import com.lumi.backend.modules.notification.application.AuthMailer;

import org.springframework.stereotype.Component;

/**
 * Side effects of auth flows. Everything goes through {@link BackgroundTaskRunner}, so it runs
 * after commit and a failure is only logged.
 */
@Component
public class AuthEventDispatcher {

    private final SecurityEventService securityEventService;
    private final AuthMailer authMailer;
    private final BackgroundTaskRunner backgroundTaskRunner;

    public AuthEventDispatcher(
            SecurityEventService securityEventService,
            AuthMailer authMailer,
            BackgroundTaskRunner backgroundTaskRunner
    ) {
        this.securityEventService = securityEventService;
        this.authMailer = authMailer;
        this.backgroundTaskRunner = backgroundTaskRunner;
    }

    public void securityEvent(String type, UUID userId, DeviceMetadata device, Map<String, Object> payload) {
        DeviceMetadata source = device != null ? device : DeviceMetadata.unknown();
        securityEvent(SecurityEventCommand.of(type, userId, source.ipAddress(), source.userAgent(), payload));
    }

    public void securityEvent(SecurityEventCommand command) {
        backgroundTaskRunner.dispatch("security-event:" + command.type(), () -> securityEventService.log(command));
    }

    public void email(String name, Consumer<AuthMailer> send) {
        backgroundTaskRunner.dispatch("email:" + name, () -> send.accept(authMailer));
    }

    /**
     * Builds an event payload from alternating keys and values, skipping null values.
     */
    public static Map<String, Object> payload(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("payload requires key/value pairs");
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            Object value = keyValues[i + 1];
            if (value != null) {
                payload.put(String.valueOf(keyValues[i]), value);
            }
        }
        return Collections.unmodifiableMap(payload);
    }
}
