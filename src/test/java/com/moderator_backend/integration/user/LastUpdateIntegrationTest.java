package com.moderator_backend.integration.user;

import com.moderator_backend.dto.request.user.UserCreateRequest;
import com.moderator_backend.dto.user.UserDTO;
import com.moderator_backend.enumeration.UserGroupEnum;
import com.moderator_backend.repository.UserRepository;
import com.moderator_backend.service.LastUpdateService;
import com.moderator_backend.service.UserService;
import jakarta.validation.ConstraintViolationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
class LastUpdateIntegrationTest {

    @Autowired private UserService userService;
    @Autowired private UserRepository userRepository;
    @Autowired private LastUpdateService lastUpdateService;

    @BeforeEach
    void setUp() {
        userRepository.deleteAllInBatch();
    }

    private static UserCreateRequest request(UserGroupEnum group, String email, String name) {
        return UserCreateRequest.builder().group(group).email(email).name(name).isActive(true).build();
    }

    @Test
    void markerMovesOncePerCommittedBatch() {
        long before = lastUpdateService.getLastUpdate();

        UserDTO alice = userService.createUser(request(UserGroupEnum.GENERAL, "a@example.com", "Alice"));
        assertThat(lastUpdateService.getLastUpdate()).isEqualTo(before + 1);

        userService.bulkCreateUsers(List.of(
                request(UserGroupEnum.SERVICE, null, "svc-1"),
                request(UserGroupEnum.SERVICE, null, "svc-2")));
        assertThat(lastUpdateService.getLastUpdate()).isEqualTo(before + 2);

        userService.deleteUser(alice.getId());
        assertThat(lastUpdateService.getLastUpdate()).isEqualTo(before + 3);
    }

    @Test
    void failedWriteLeavesMarkerUntouched() {
        long before = lastUpdateService.getLastUpdate();

        assertThatThrownBy(() -> userService.createUser(request(UserGroupEnum.ADMIN, null, "Root")))
                .isInstanceOf(ConstraintViolationException.class);

        assertThat(lastUpdateService.getLastUpdate()).isEqualTo(before);
    }
}
