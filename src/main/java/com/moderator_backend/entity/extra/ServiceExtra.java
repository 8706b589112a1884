package com.moderator_backend.entity.extra;

import com.moderator_backend.enumeration.UserGroupEnum;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ServiceExtra implements UserExtra {

    public static final String TYPE = "service";

    @NotBlank(message = "Service token is required")
    private String jwt;

    @Override
    public UserGroupEnum owningGroup() {
        return UserGroupEnum.SERVICE;
    }

    @Override
    public String typeTag() {
        return TYPE;
    }
}
