package com.moderator_backend.entity.extra;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.moderator_backend.enumeration.UserGroupEnum;
import jakarta.validation.Valid;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * State of an external channel integration (YouTube): the OAuth token as returned by the
 * provider, the last synchronization error and whether syncing is switched on.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IntegrationExtra implements UserExtra {

    public static final String TYPE = "integration";

    // opaque to us, handed back to the provider client as is
    private JsonNode token;

    @Valid
    private ErrorDescriptor lastError;

    private Boolean isActive;

    @Override
    public UserGroupEnum owningGroup() {
        return UserGroupEnum.YOUTUBE;
    }

    @Override
    public String typeTag() {
        return TYPE;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorDescriptor {
        private String name;
        private String message;
    }
}
