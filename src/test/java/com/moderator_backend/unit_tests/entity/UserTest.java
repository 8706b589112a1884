package com.moderator_backend.unit_tests.entity;

import com.moderator_backend.entity.Category;
import com.moderator_backend.entity.User;
import com.moderator_backend.enumeration.UserGroupEnum;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class UserTest {

    @Test
    void isUser_acceptsUserWithGroup() {
        User user = User.builder().group(UserGroupEnum.SERVICE).name("svc-bot").build();

        assertThat(User.isUser(user)).isTrue();
    }

    @Test
    void isUser_rejectsForeignValues() {
        assertThat(User.isUser(null)).isFalse();
        assertThat(User.isUser(new Object())).isFalse();
        assertThat(User.isUser("general")).isFalse();
        assertThat(User.isUser(Map.of("group", "general", "name", "Alice"))).isFalse();
        assertThat(User.isUser(new Category())).isFalse();
    }

    @Test
    void isUser_rejectsUserWithoutGroup() {
        assertThat(User.isUser(new User())).isFalse();
    }

    @Test
    void builder_defaultsToInactiveWithEmptyAssociations() {
        User user = User.builder().group(UserGroupEnum.GENERAL).name("Alice").build();

        assertThat(user.getIsActive()).isFalse();
        assertThat(user.getCategoryAssignments()).isEmpty();
        assertThat(user.getArticleAssignments()).isEmpty();
    }

    @Test
    void humanGroups_areGeneralAndAdmin() {
        assertThat(UserGroupEnum.GENERAL.isHuman()).isTrue();
        assertThat(UserGroupEnum.ADMIN.isHuman()).isTrue();
        assertThat(UserGroupEnum.SERVICE.isHuman()).isFalse();
        assertThat(UserGroupEnum.YOUTUBE.isHuman()).isFalse();
        assertThat(UserGroupEnum.MODERATOR.isHuman()).isFalse();
    }
}
