package com.moderator_backend.service.notification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Turns user mutations into {@link UpdateNotifier#updateHappened()} calls.
 * <p>
 * Inside a transaction all mutations collapse into one notification that is sent after commit
 * and dropped on rollback. Without a transaction the notification is sent right away.
 * A failing notifier is logged and never affects the write that triggered it.
 */
@Slf4j
@Component
public class UpdateNotificationScheduler {

    private final UpdateNotifier updateNotifier;
    private final TaskExecutor executor;

    public UpdateNotificationScheduler(UpdateNotifier updateNotifier,
                                       @Qualifier("updateNotifierExecutor") TaskExecutor executor) {
        this.updateNotifier = updateNotifier;
        this.executor = executor;
    }

    public void scheduleUpdateNotification() {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            dispatch();
            return;
        }
        if (isAlreadyScheduled()) {
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new AfterCommitNotification());
        log.debug("Update notification scheduled for transaction {}",
                TransactionSynchronizationManager.getCurrentTransactionName());
    }

    private boolean isAlreadyScheduled() {
        for (TransactionSynchronization synchronization : TransactionSynchronizationManager.getSynchronizations()) {
            if (synchronization instanceof AfterCommitNotification notification && notification.owner() == this) {
                return true;
            }
        }
        return false;
    }

    private void dispatch() {
        try {
            executor.execute(this::notifySafely);
        } catch (TaskRejectedException ex) {
            log.warn("Update notification rejected by executor", ex);
        }
    }

    private void notifySafely() {
        try {
            updateNotifier.updateHappened();
        } catch (Exception ex) {
            log.warn("Update notifier failed", ex);
        }
    }

    private final class AfterCommitNotification implements TransactionSynchronization {

        private UpdateNotificationScheduler owner() {
            return UpdateNotificationScheduler.this;
        }

        @Override
        public void afterCompletion(int status) {
            if (status == STATUS_COMMITTED) {
                dispatch();
            } else {
                log.debug("Transaction did not commit (status {}), update notification dropped", status);
            }
        }
    }
}
