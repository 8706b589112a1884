package com.moderator_backend.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.moderator_backend.entity.converter.UserExtraConverter;
import com.moderator_backend.entity.converter.UserGroupConverter;
import com.moderator_backend.entity.extra.UserExtra;
import com.moderator_backend.entity.listener.UserChangeListener;
import com.moderator_backend.enumeration.UserGroupEnum;
import com.moderator_backend.validation.validation.RequireEmailForHumans;
import com.moderator_backend.validation.validation.ValidUserExtra;
import jakarta.persistence.*;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.*;

import java.util.HashSet;
import java.util.Set;

@Entity
@Setter
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Table(name = "users",
        indexes = {
                @Index(name = "users_email", columnList = "email"),
                @Index(name = "group_index", columnList = "user_group"),
                @Index(name = "isActive_index", columnList = "is_active")
        },
        uniqueConstraints = {
                @UniqueConstraint(name = "users_email_group_unique", columnNames = {"email", "user_group"})
        })
@EntityListeners(UserChangeListener.class)
@RequireEmailForHumans
@ValidUserExtra
public class User {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Integer id;

    // "group" is reserved in SQL
    @NotNull(message = "User group is required")
    @Convert(converter = UserGroupConverter.class)
    @Column(name = "user_group", nullable = false, length = 32)
    private UserGroupEnum group;

    @NotNull(message = "Name is required")
    @Size(max = 255)
    @Column(nullable = false)
    private String name;

    @Size(max = 255)
    @Column
    private String email;

    @Builder.Default
    @Column(name = "is_active", nullable = false)
    private Boolean isActive = false;

    @Size(max = 255)
    @Column(name = "avatar_url")
    private String avatarURL;

    @Valid
    @JsonIgnore
    @Convert(converter = UserExtraConverter.class)
    @Column(length = 8192)
    private UserExtra extra;

    @JsonIgnore
    @Builder.Default
    @OneToMany(mappedBy = "user")
    private Set<UserCategoryAssignment> categoryAssignments = new HashSet<>();

    @JsonIgnore
    @Builder.Default
    @OneToMany(mappedBy = "user")
    private Set<ModeratorAssignment> articleAssignments = new HashSet<>();

    @PrePersist
    protected void onCreate() {
        if (isActive == null) {
            isActive = false;
        }
    }

    /**
     * Type guard for values of unknown origin. Hibernate proxies subclass {@code User}, so they pass too.
     */
    public static boolean isUser(Object candidate) {
        return candidate instanceof User user && user.getGroup() != null;
    }
}
