package com.moderator_backend.service;

import com.moderator_backend.entity.LastUpdate;
import com.moderator_backend.repository.LastUpdateRepository;
import com.moderator_backend.service.notification.UpdateNotifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.ZonedDateTime;

/**
 * Default {@link UpdateNotifier}: moves the persisted "last update" marker forward.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LastUpdateService implements UpdateNotifier {

    private final LastUpdateRepository lastUpdateRepository;

    // may be invoked while the committing transaction is still bound to the thread
    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void updateHappened() {
        LastUpdate marker = lastUpdateRepository.findWithLockById(LastUpdate.SINGLETON_ID)
                .orElseGet(() -> new LastUpdate(LastUpdate.SINGLETON_ID, 0L, null));

        marker.setLastUpdate(marker.getLastUpdate() + 1);
        marker.setUpdatedAt(ZonedDateTime.now());
        lastUpdateRepository.save(marker);

        log.info("🔄 User data changed, last update is now {}", marker.getLastUpdate());
    }

    @Transactional(readOnly = true)
    public long getLastUpdate() {
        return lastUpdateRepository.findById(LastUpdate.SINGLETON_ID)
                .map(LastUpdate::getLastUpdate)
                .orElse(0L);
    }
}
