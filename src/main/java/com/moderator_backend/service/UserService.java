package com.moderator_backend.service;

import com.moderator_backend.dto.request.user.UserCreateRequest;
import com.moderator_backend.dto.request.user.UserUpdateRequest;
import com.moderator_backend.dto.user.UserDTO;
import com.moderator_backend.entity.User;
import com.moderator_backend.enumeration.UserGroupEnum;
import com.moderator_backend.exception.UserNotFoundException;
import com.moderator_backend.repository.ModeratorAssignmentRepository;
import com.moderator_backend.repository.UserCategoryAssignmentRepository;
import com.moderator_backend.repository.UserRepository;
import com.moderator_backend.service.notification.UpdateNotificationScheduler;
import com.moderator_backend.util.ValidationUtil;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.modelmapper.ModelMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Service
@RequiredArgsConstructor
@Slf4j
public class UserService {

    private final UserRepository userRepository;
    private final UserCategoryAssignmentRepository categoryAssignmentRepository;
    private final ModeratorAssignmentRepository moderatorAssignmentRepository;
    private final UpdateNotificationScheduler updateNotificationScheduler;
    private final ModelMapper modelMapper;
    private final Validator validator;

    @Transactional
    public UserDTO createUser(UserCreateRequest request) {
        User user = toEntity(request);
        validate(user);

        User saved = userRepository.save(user);
        log.info("✅ User {} created in group '{}'", saved.getId(), saved.getGroup().getValue());
        return toDto(saved);
    }

    /**
     * Creates all users or none of them. Subscribers hear about the batch once.
     */
    @Transactional
    public List<UserDTO> bulkCreateUsers(List<UserCreateRequest> requests) {
        List<User> users = requests.stream().map(this::toEntity).toList();
        users.forEach(this::validate);

        List<User> saved = userRepository.saveAll(users);
        log.info("✅ {} users created", saved.size());
        return saved.stream().map(this::toDto).toList();
    }

    @Transactional
    public UserDTO updateUser(Integer id, UserUpdateRequest request) {
        User user = userRepository.findById(id)
                .orElseThrow(() -> new UserNotFoundException("User not found with id: " + id));

        log.debug("Updating user {}", id);
        applyUserUpdates(user, request);
        validate(user);

        User saved = userRepository.saveAndFlush(user);
        log.info("User {} updated", id);
        return toDto(saved);
    }

    /**
     * Switches {@code isActive} for a whole group with one statement.
     *
     * @return number of users whose flag actually changed
     */
    @Transactional
    public int bulkUpdateActive(UserGroupEnum group, boolean isActive) {
        int updated = userRepository.bulkUpdateActive(group, isActive);
        if (updated > 0) {
            updateNotificationScheduler.scheduleUpdateNotification();
        }
        log.info("Set isActive={} on {} users of group '{}'", isActive, updated, group.getValue());
        return updated;
    }

    @Transactional
    public void deleteUser(Integer id) {
        User user = userRepository.findById(id)
                .orElseThrow(() -> new UserNotFoundException("User not found with id: " + id));

        // 1. Drop category and article assignments
        categoryAssignmentRepository.deleteAllByUserIdIn(List.of(id));
        moderatorAssignmentRepository.deleteAllByUserIdIn(List.of(id));

        // 2. Finally delete user
        userRepository.delete(user);
        userRepository.flush();
        log.info("❌ User {} deleted", id);
    }

    @Transactional
    public int bulkDeleteUsers(Collection<Integer> ids) {
        if (ids == null || ids.isEmpty()) {
            return 0;
        }
        Set<Integer> uniqueIds = new HashSet<>(ids);

        categoryAssignmentRepository.deleteAllByUserIdIn(uniqueIds);
        moderatorAssignmentRepository.deleteAllByUserIdIn(uniqueIds);
        int deleted = userRepository.deleteAllByIdIn(uniqueIds);

        if (deleted > 0) {
            updateNotificationScheduler.scheduleUpdateNotification();
        }
        log.info("❌ {} users deleted", deleted);
        return deleted;
    }

    @Transactional(readOnly = true)
    public UserDTO getUser(Integer id) {
        log.debug("Fetching user {}", id);
        return userRepository.findById(id)
                .map(this::toDto)
                .orElseThrow(() -> new UserNotFoundException("User not found with id: " + id));
    }

    @Transactional(readOnly = true)
    public UserDTO findByEmailAndGroup(String email, UserGroupEnum group) {
        log.debug("Fetching user {} in group '{}'", email, group.getValue());
        return userRepository.findByEmailAndGroup(email, group)
                .map(this::toDto)
                .orElseThrow(() -> new UserNotFoundException(
                        "User not found with email: " + email + " in group: " + group.getValue()));
    }

    @Transactional(readOnly = true)
    public List<UserDTO> getUsersByGroup(UserGroupEnum group) {
        List<UserDTO> users = userRepository.findAllByGroupOrderByIdAsc(group).stream()
                .map(this::toDto)
                .toList();
        log.debug("Retrieved {} users of group '{}'", users.size(), group.getValue());
        return users;
    }

    public UserDTO toDto(User user) {
        UserDTO dto = modelMapper.map(user, UserDTO.class);
        dto.setExtraType(user.getExtra() == null ? null : user.getExtra().typeTag());
        return dto;
    }

    private User toEntity(UserCreateRequest request) {
        return User.builder()
                .group(request.getGroup())
                .name(request.getName())
                .email(request.getEmail())
                .isActive(request.getIsActive() != null ? request.getIsActive() : false)
                .avatarURL(request.getAvatarURL())
                .extra(request.getExtra())
                .build();
    }

    private void applyUserUpdates(User user, UserUpdateRequest request) {
        if (request.getGroup() != null) {
            user.setGroup(request.getGroup());
        }
        if (ValidationUtil.stringExists(request.getName())) {
            user.setName(request.getName());
        }
        if (request.getEmail() != null) {
            user.setEmail(request.getEmail());
        }
        if (request.getIsActive() != null) {
            user.setIsActive(request.getIsActive());
        }
        if (request.getAvatarURL() != null) {
            user.setAvatarURL(request.getAvatarURL());
        }
        if (request.getExtra() != null) {
            user.setExtra(request.getExtra());
        }
    }

    private void validate(User user) {
        Set<ConstraintViolation<User>> violations = validator.validate(user);
        if (!violations.isEmpty()) {
            log.warn("Rejected user '{}': {}", user.getName(), ValidationUtil.describe(violations));
            throw new ConstraintViolationException(violations);
        }
    }
}
