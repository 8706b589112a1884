package com.moderator_backend.enumeration;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum UserGroupEnum {
    GENERAL("general"),
    ADMIN("admin"),
    SERVICE("service"),
    YOUTUBE("youtube"),
    MODERATOR("moderator");

    @JsonValue
    private final String value;

    /**
     * Groups whose members are people and therefore must carry a valid email address.
     */
    public boolean isHuman() {
        return this == GENERAL || this == ADMIN;
    }

    @JsonCreator
    public static UserGroupEnum fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (UserGroupEnum group : values()) {
            if (group.value.equalsIgnoreCase(value.trim())) {
                return group;
            }
        }
        throw new IllegalArgumentException("Unknown user group: " + value);
    }
}
