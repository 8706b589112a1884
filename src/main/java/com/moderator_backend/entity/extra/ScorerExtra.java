package com.moderator_backend.entity.extra;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.moderator_backend.enumeration.ScorerEndpointTypeEnum;
import com.moderator_backend.enumeration.UserGroupEnum;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Connection details of an automated moderator that scores comments through Perspective,
 * either directly or through a proxy.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ScorerExtra implements UserExtra {

    public static final String TYPE = "scorer";

    @NotNull(message = "Endpoint type is required")
    private ScorerEndpointTypeEnum endpointType;

    @NotBlank(message = "API key is required")
    private String apiKey;

    @NotBlank(message = "Endpoint is required")
    private String endpoint;

    private String userAgent;

    // attribute name (TOXICITY, INSULT, ...) -> how to score it
    private Map<String, @Valid RequestedAttribute> attributes;

    @Override
    public UserGroupEnum owningGroup() {
        return UserGroupEnum.MODERATOR;
    }

    @Override
    public String typeTag() {
        return TYPE;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class RequestedAttribute {

        private String scoreType;

        @DecimalMin(value = "0.0", message = "Score threshold must be between 0 and 1")
        @DecimalMax(value = "1.0", message = "Score threshold must be between 0 and 1")
        private Double scoreThreshold;
    }
}
