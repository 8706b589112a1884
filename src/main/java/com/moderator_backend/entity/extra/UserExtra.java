package com.moderator_backend.entity.extra;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.moderator_backend.enumeration.UserGroupEnum;

/**
 * Group specific payload kept in the {@code extra} column of a user.
 * The concrete variant is recorded in the {@code type} property of the stored JSON.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ScorerExtra.class, name = ScorerExtra.TYPE),
        @JsonSubTypes.Type(value = IntegrationExtra.class, name = IntegrationExtra.TYPE),
        @JsonSubTypes.Type(value = ServiceExtra.class, name = ServiceExtra.TYPE)
})
public interface UserExtra {

    /** The only group allowed to carry this variant. */
    UserGroupEnum owningGroup();

    String typeTag();
}
