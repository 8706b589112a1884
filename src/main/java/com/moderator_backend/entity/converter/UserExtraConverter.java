package com.moderator_backend.entity.converter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.moderator_backend.entity.extra.UserExtra;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Persists the polymorphic {@link UserExtra} payload as JSON text. The variant is carried by the
 * {@code type} property so it can be restored without looking at the owning row.
 */
@Converter
public class UserExtraConverter implements AttributeConverter<UserExtra, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public String convertToDatabaseColumn(UserExtra extra) {
        if (extra == null) {
            return null;
        }
        try {
            return MAPPER.writerFor(UserExtra.class).writeValueAsString(extra);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Could not serialize user extra of type " + extra.typeTag(), e);
        }
    }

    @Override
    public UserExtra convertToEntityAttribute(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return MAPPER.readValue(json, UserExtra.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Stored user extra is not a recognised payload", e);
        }
    }
}
