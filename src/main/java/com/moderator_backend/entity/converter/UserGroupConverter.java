package com.moderator_backend.entity.converter;

import com.moderator_backend.enumeration.UserGroupEnum;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores {@link UserGroupEnum} as its lower-case value ("general", "admin", ...).
 */
@Converter
public class UserGroupConverter implements AttributeConverter<UserGroupEnum, String> {

    @Override
    public String convertToDatabaseColumn(UserGroupEnum group) {
        return group == null ? null : group.getValue();
    }

    @Override
    public UserGroupEnum convertToEntityAttribute(String value) {
        return UserGroupEnum.fromValue(value);
    }
}
