package com.eyelevel.catalogingestion.service.asynctask;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Schedules background work that must only start once the current database transaction has
 * committed, so a parse job never looks for a session row that is not yet visible.
 */
@Slf4j
@Service
public class AsyncTaskManager {

    private final AsyncTaskExecutor taskExecutor;

    public AsyncTaskManager(@Qualifier("applicationTaskExecutor") AsyncTaskExecutor taskExecutor) {
        this.taskExecutor = taskExecutor;
    }

    /**
     * Submits {@code task} to the application executor after commit. Outside a transaction the task
     * is submitted immediately.
     *
     * @param uploadId The session the task works on, used for logging.
     * @param task     The work to run.
     * @param onReject Invoked when the executor refuses the task.
     */
    public void runAfterCommit(final String uploadId, final Runnable task, final Runnable onReject) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            submit(uploadId, task, onReject);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                log.info("DB transaction committed for upload {}. Submitting background task.", uploadId);
                submit(uploadId, task, onReject);
            }
        });
    }

    private void submit(final String uploadId, final Runnable task, final Runnable onReject) {
        try {
            taskExecutor.execute(task);
        } catch (TaskRejectedException e) {
            log.error("Executor rejected background task for upload {}.", uploadId, e);
            onReject.run();
        }
    }
}
