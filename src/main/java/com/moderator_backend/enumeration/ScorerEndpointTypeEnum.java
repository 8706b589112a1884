package com.moderator_backend.enumeration;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ScorerEndpointTypeEnum {
    PERSPECTIVE_PROXY("perspective-proxy"),
    PERSPECTIVE_API("perspective-api");

    @JsonValue
    private final String value;

    @JsonCreator
    public static ScorerEndpointTypeEnum fromValue(String value) {
        for (ScorerEndpointTypeEnum type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown scorer endpoint type: " + value);
    }
}
