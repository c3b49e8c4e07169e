package com.lumi.backend.modules.auth.domain;

/**
 * Client device as seen by the server. Either part may be null.
 */
public record DeviceMetadata(String ipAddress, String userAgent) {

    public static DeviceMetadata unknown() {
        return new DeviceMetadata(null, null);
    }

    public boolean isEmpty() {
        return isBlank(ipAddress) && isBlank(userAgent);
    }

    public String summary() {
        String agent = isBlank(userAgent) ? "Unknown device" : userAgent;
        return isBlank(ipAddress) ? agent : agent + " (" + ipAddress + ")";
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
