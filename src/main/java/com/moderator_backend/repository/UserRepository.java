package com.moderator_backend.repository;

import com.moderator_backend.entity.User;
import com.moderator_backend.enumeration.UserGroupEnum;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface UserRepository extends JpaRepository<User, Integer>, UserRepositoryCustom {

    Optional<User> findByEmailAndGroup(String email, UserGroupEnum group);

    List<User> findAllByGroupOrderByIdAsc(UserGroupEnum group);

    boolean existsByEmailAndGroup(String email, UserGroupEnum group);

    // bypasses entity callbacks, callers report the change themselves
    @Modifying(clearAutomatically = true)
    @Query("DELETE FROM User u WHERE u.id IN :ids")
    int deleteAllByIdIn(@Param("ids") Collection<Integer> ids);
}
