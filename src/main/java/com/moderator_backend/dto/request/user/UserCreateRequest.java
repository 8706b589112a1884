package com.moderator_backend.dto.request.user;

import com.moderator_backend.entity.extra.UserExtra;
import com.moderator_backend.enumeration.UserGroupEnum;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UserCreateRequest {

    @NotNull
    private UserGroupEnum group;

    @NotNull
    @Size(max = 255)
    private String name;

    // required for general and admin users, checked on the entity
    @Size(max = 255)
    private String email;

    private Boolean isActive;

    @Size(max = 255)
    private String avatarURL;

    @Valid
    private UserExtra extra;
}
