package com.lumi.backend.global.async;

import java.util.concurrent.Executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Runs fire-and-forget side effects (emails, security events) off the request path.
 * Inside a transaction the task is held until commit and dropped on rollback.
 * A failing task is logged and never reaches the caller.
 */
@Component
public class BackgroundTaskRunner {

    private static final Logger log = LoggerFactory.getLogger(BackgroundTaskRunner.class);

    private final Executor executor;

    public BackgroundTaskRunner(@Qualifier(BackgroundTaskConfig.BACKGROUND_TASK_EXECUTOR) Executor executor) {
        this.executor = executor;
    }

    public void dispatch(String taskName, Runnable task) {
        Runnable guarded = () -> {
            try {
                task.run();
            } catch (RuntimeException ex) {
                log.warn("Background task '{}' failed", taskName, ex);
            }
        };

        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    submit(taskName, guarded);
                }
            });
            return;
        }
        submit(taskName, guarded);
    }

    private void submit(String taskName, Runnable guarded) {
        try {
            executor.execute(guarded);
        } catch (TaskRejectedException ex) {
            log.warn("Background task '{}' rejected by executor", taskName, ex);
        }
    }
}
