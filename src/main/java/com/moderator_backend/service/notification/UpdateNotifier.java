package com.moderator_backend.service.notification;

/**
 * Receives a signal whenever user data changed and the change is committed.
 */
public interface UpdateNotifier {

    void updateHappened();
}
