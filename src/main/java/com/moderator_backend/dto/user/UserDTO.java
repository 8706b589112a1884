package com.moderator_backend.dto.user;

import com.moderator_backend.enumeration.UserGroupEnum;
import lombok.*;

/**
 * Outward view of a user. The extra payload holds credentials, so only its variant is exposed.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UserDTO {

    private Integer id;
    private UserGroupEnum group;
    private String name;
    private String email;
    private Boolean isActive;
    private String avatarURL;
    private String extraType;
}
