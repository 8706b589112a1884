package com.moderator_backend.repository;

import com.moderator_backend.entity.User;
import com.moderator_backend.enumeration.UserGroupEnum;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaUpdate;
import jakarta.persistence.criteria.Root;

public class UserRepositoryCustomImpl implements UserRepositoryCustom {

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public int bulkUpdateActive(UserGroupEnum group, boolean isActive) {
        // pending changes must reach the database before the bulk statement
        entityManager.flush();

        CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        CriteriaUpdate<User> update = cb.createCriteriaUpdate(User.class);
        Root<User> root = update.from(User.class);
        update.set(root.<Boolean>get("isActive"), isActive)
                .where(cb.and(
                        cb.equal(root.get("group"), group),
                        cb.notEqual(root.get("isActive"), isActive)
                ));

        int updated = entityManager.createQuery(update).executeUpdate();
        entityManager.clear();
        return updated;
    }
}
