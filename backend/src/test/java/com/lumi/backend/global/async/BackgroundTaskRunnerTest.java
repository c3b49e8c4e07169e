package com.lumi.backend.global.async;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

class BackgroundTaskRunnerTest {

    private final List<String> ran = new ArrayList<>();

    @AfterEach
    void clearSynchronization() {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.clearSynchronization();
        }
    }

    @Test
    void runsImmediatelyOutsideTransaction() {
        BackgroundTaskRunner runner = new BackgroundTaskRunner(new SyncTaskExecutor());

        runner.dispatch("email:test", () -> ran.add("email"));

        assertThat(ran).containsExactly("email");
    }

    @Test
    void waitsForCommitInsideTransaction() {
        BackgroundTaskRunner runner = new BackgroundTaskRunner(new SyncTaskExecutor());
        TransactionSynchronizationManager.initSynchronization();

        runner.dispatch("email:test", () -> ran.add("email"));
        assertThat(ran).isEmpty();

        List<TransactionSynchronization> synchronizations = TransactionSynchronizationManager.getSynchronizations();
        assertThat(synchronizations).hasSize(1);
        synchronizations.forEach(TransactionSynchronization::afterCommit);

        assertThat(ran).containsExactly("email");
    }

    @Test
    void failingTaskDoesNotReachCaller() {
        BackgroundTaskRunner runner = new BackgroundTaskRunner(new SyncTaskExecutor());

        assertThatCode(() -> runner.dispatch("email:broken", () -> {
            throw new IllegalStateException("smtp down");
        })).doesNotThrowAnyException();
    }

    @Test
    void rejectedTaskIsDropped() {
        BackgroundTaskRunner runner = new BackgroundTaskRunner(task -> {
            throw new TaskRejectedException("queue full");
        });

        assertThatCode(() -> runner.dispatch("security-event:logout", () -> ran.add("event")))
                .doesNotThrowAnyException();
        assertThat(ran).isEmpty();
    }
}
