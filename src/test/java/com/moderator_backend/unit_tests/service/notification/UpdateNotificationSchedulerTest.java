package com.moderator_backend.unit_tests.service.notification;

import com.moderator_backend.service.notification.UpdateNotificationScheduler;
import com.moderator_backend.service.notification.UpdateNotifier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class UpdateNotificationSchedulerTest {

    @Mock
    private UpdateNotifier updateNotifier;

    private UpdateNotificationScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new UpdateNotificationScheduler(updateNotifier, new SyncTaskExecutor());
    }

    @AfterEach
    void tearDown() {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.clearSynchronization();
        }
    }

    // what the transaction manager does on completion
    private static void complete(int status) {
        List<TransactionSynchronization> synchronizations = TransactionSynchronizationManager.getSynchronizations();
        TransactionSynchronizationManager.clearSynchronization();
        synchronizations.forEach(synchronization -> synchronization.afterCompletion(status));
    }

    @Test
    void outsideTransaction_notifiesImmediately() {
        scheduler.scheduleUpdateNotification();

        verify(updateNotifier, times(1)).updateHappened();
    }

    @Test
    void insideTransaction_notifiesOnceAfterCommit() {
        TransactionSynchronizationManager.initSynchronization();

        scheduler.scheduleUpdateNotification();
        scheduler.scheduleUpdateNotification();
        scheduler.scheduleUpdateNotification();

        verifyNoInteractions(updateNotifier);
        assertThat(TransactionSynchronizationManager.getSynchronizations()).hasSize(1);

        complete(TransactionSynchronization.STATUS_COMMITTED);

        verify(updateNotifier, times(1)).updateHappened();
    }

    @Test
    void rollback_dropsNotification() {
        TransactionSynchronizationManager.initSynchronization();
        scheduler.scheduleUpdateNotification();

        complete(TransactionSynchronization.STATUS_ROLLED_BACK);

        verifyNoInteractions(updateNotifier);
    }

    @Test
    void eachTransactionGetsItsOwnNotification() {
        TransactionSynchronizationManager.initSynchronization();
        scheduler.scheduleUpdateNotification();
        complete(TransactionSynchronization.STATUS_COMMITTED);

        TransactionSynchronizationManager.initSynchronization();
        scheduler.scheduleUpdateNotification();
        complete(TransactionSynchronization.STATUS_COMMITTED);

        verify(updateNotifier, times(2)).updateHappened();
    }

    @Test
    void failingNotifier_doesNotPropagate() {
        doThrow(new IllegalStateException("marker table locked")).when(updateNotifier).updateHappened();

        assertThatCode(() -> scheduler.scheduleUpdateNotification()).doesNotThrowAnyException();

        TransactionSynchronizationManager.initSynchronization();
        scheduler.scheduleUpdateNotification();
        assertThatCode(() -> complete(TransactionSynchronization.STATUS_COMMITTED)).doesNotThrowAnyException();
        verify(updateNotifier, times(2)).updateHappened();
    }

    @Test
    void rejectedDispatch_isLoggedNotThrown() {
        UpdateNotificationScheduler saturated = new UpdateNotificationScheduler(updateNotifier, task -> {
            throw new TaskRejectedException("queue full");
        });

        assertThatCode(saturated::scheduleUpdateNotification).doesNotThrowAnyException();
        verifyNoInteractions(updateNotifier);
    }
}
