package com.moderator_backend.unit_tests.entity;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.moderator_backend.entity.converter.UserExtraConverter;
import com.moderator_backend.entity.converter.UserGroupConverter;
import com.moderator_backend.entity.extra.IntegrationExtra;
import com.moderator_backend.entity.extra.ScorerExtra;
import com.moderator_backend.entity.extra.UserExtra;
import com.moderator_backend.enumeration.ScorerEndpointTypeEnum;
import com.moderator_backend.enumeration.UserGroupEnum;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UserExtraConverterTest {

    private final UserExtraConverter converter = new UserExtraConverter();

    @Test
    void scorerExtra_isStoredWithTypeTag() {
        ScorerExtra extra = ScorerExtra.builder()
                .endpointType(ScorerEndpointTypeEnum.PERSPECTIVE_PROXY)
                .apiKey("key-123")
                .endpoint("http://proxy.local/score")
                .attributes(Map.of("INSULT", new ScorerExtra.RequestedAttribute(null, 0.7)))
                .build();

        String json = converter.convertToDatabaseColumn(extra);

        assertThat(json)
                .contains("\"type\":\"scorer\"")
                .contains("\"endpointType\":\"perspective-proxy\"")
                .doesNotContain("userAgent");
        assertThat(converter.convertToEntityAttribute(json)).isEqualTo(extra);
    }

    @Test
    void integrationExtra_keepsOpaqueToken() {
        String json = """
                {"type":"integration","token":{"access_token":"abc","expiry_date":1700000000},
                 "lastError":{"name":"invalid_grant","message":"Token has been expired or revoked."},
                 "isActive":false}
                """;

        UserExtra extra = converter.convertToEntityAttribute(json);

        assertThat(extra).isInstanceOf(IntegrationExtra.class);
        IntegrationExtra integration = (IntegrationExtra) extra;
        assertThat(integration.getToken().get("access_token").asText()).isEqualTo("abc");
        assertThat(integration.getLastError().getName()).isEqualTo("invalid_grant");
        assertThat(integration.getIsActive()).isFalse();
        assertThat(integration.owningGroup()).isEqualTo(UserGroupEnum.YOUTUBE);
    }

    @Test
    void integrationExtra_writesTokenAsNestedObject() {
        ObjectNode token = JsonNodeFactory.instance.objectNode().put("refresh_token", "r-1");

        String json = converter.convertToDatabaseColumn(IntegrationExtra.builder().token(token).build());

        assertThat(json).contains("\"token\":{\"refresh_token\":\"r-1\"}");
    }

    @Test
    void emptyColumn_readsAsNoExtra() {
        assertThat(converter.convertToEntityAttribute(null)).isNull();
        assertThat(converter.convertToEntityAttribute("  ")).isNull();
        assertThat(converter.convertToDatabaseColumn(null)).isNull();
    }

    @Test
    void unknownVariant_isNotSilentlyDropped() {
        assertThatThrownBy(() -> converter.convertToEntityAttribute("{\"type\":\"mystery\",\"jwt\":\"x\"}"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> converter.convertToEntityAttribute("not json"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void groupConverter_storesLowerCaseValue() {
        UserGroupConverter groupConverter = new UserGroupConverter();

        assertThat(groupConverter.convertToDatabaseColumn(UserGroupEnum.MODERATOR)).isEqualTo("moderator");
        assertThat(groupConverter.convertToEntityAttribute("youtube")).isEqualTo(UserGroupEnum.YOUTUBE);
        assertThat(groupConverter.convertToEntityAttribute(null)).isNull();
        assertThatThrownBy(() -> groupConverter.convertToEntityAttribute("robots"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
