package com.moderator_backend.entity.listener;

import com.moderator_backend.entity.User;
import com.moderator_backend.service.notification.UpdateNotificationScheduler;
import jakarta.persistence.PostPersist;
import jakarta.persistence.PostRemove;
import jakarta.persistence.PostUpdate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

/**
 * Reports every persisted user mutation to the {@link UpdateNotificationScheduler}. Hibernate
 * creates this listener through the Spring bean container; the scheduler is looked up lazily
 * because it depends on the entity manager factory that owns this listener.
 */
@Slf4j
@Component
public class UserChangeListener {

    private final ObjectProvider<UpdateNotificationScheduler> schedulerProvider;

    public UserChangeListener(ObjectProvider<UpdateNotificationScheduler> schedulerProvider) {
        this.schedulerProvider = schedulerProvider;
    }

    @PostPersist
    public void afterCreate(User user) {
        log.debug("User {} created", user.getId());
        schedule();
    }

    @PostUpdate
    public void afterUpdate(User user) {
        log.debug("User {} updated", user.getId());
        schedule();
    }

    @PostRemove
    public void afterDestroy(User user) {
        log.debug("User {} removed", user.getId());
        schedule();
    }

    private void schedule() {
        UpdateNotificationScheduler scheduler = schedulerProvider.getIfAvailable();
        if (scheduler == null) {
            log.warn("No update notification scheduler available, user change not reported");
            return;
        }
        scheduler.scheduleUpdateNotification();
    }
}
