package com.moderator_backend.repository;

import com.moderator_backend.enumeration.UserGroupEnum;

public interface UserRepositoryCustom {

    /**
     * Sets {@code isActive} on every user of the given group in one statement.
     * Entity listeners are not invoked.
     *
     * @return number of rows changed
     */
    int bulkUpdateActive(UserGroupEnum group, boolean isActive);
}
