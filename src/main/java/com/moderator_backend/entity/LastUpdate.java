package com.moderator_backend.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.ZonedDateTime;

/**
 * Single row marker that moves forward every time user data changes. Readers poll it to find out
 * whether their cached view of users is stale.
 */
@Entity
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "last_updates")
public class LastUpdate {

    public static final Integer SINGLETON_ID = 1;

    @Id
    private Integer id;

    @Column(name = "last_update", nullable = false)
    private Long lastUpdate;

    @Column(name = "updated_at", nullable = false)
    private ZonedDateTime updatedAt;
}
