package com.moderator_backend.repository;

import com.moderator_backend.entity.LastUpdate;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface LastUpdateRepository extends JpaRepository<LastUpdate, Integer> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    Optional<LastUpdate> findWithLockById(Integer id);
}
