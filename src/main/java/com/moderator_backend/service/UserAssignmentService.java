package com.moderator_backend.service;

import com.moderator_backend.entity.Article;
import com.moderator_backend.entity.Category;
import com.moderator_backend.entity.ModeratorAssignment;
import com.moderator_backend.entity.User;
import com.moderator_backend.entity.UserCategoryAssignment;
import com.moderator_backend.exception.UserNotFoundException;
import com.moderator_backend.repository.ArticleRepository;
import com.moderator_backend.repository.CategoryRepository;
import com.moderator_backend.repository.ModeratorAssignmentRepository;
import com.moderator_backend.repository.UserCategoryAssignmentRepository;
import com.moderator_backend.repository.UserRepository;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Categories a user watches and articles a moderator is assigned to.
 * <p>
 * Both relations allow repeated rows for the same pair; lookups and counts report distinct targets.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UserAssignmentService {

    private final UserRepository userRepository;
    private final CategoryRepository categoryRepository;
    private final ArticleRepository articleRepository;
    private final UserCategoryAssignmentRepository categoryAssignmentRepository;
    private final ModeratorAssignmentRepository moderatorAssignmentRepository;

    @Transactional
    public void assignCategory(Integer userId, Integer categoryId) {
        User user = findUser(userId);
        Category category = categoryRepository.findById(categoryId)
                .orElseThrow(() -> new EntityNotFoundException("Category not found with id: " + categoryId));

        UserCategoryAssignment assignment = UserCategoryAssignment.builder()
                .user(user)
                .category(category)
                .build();
        categoryAssignmentRepository.save(assignment);
        user.getCategoryAssignments().add(assignment);
        log.info("Category {} assigned to user {}", categoryId, userId);
    }

    /**
     * Removes every assignment row linking the pair.
     *
     * @return number of rows removed
     */
    @Transactional
    public int unassignCategory(Integer userId, Integer categoryId) {
        User user = findUser(userId);
        List<UserCategoryAssignment> assignments =
                categoryAssignmentRepository.findAllByUserIdAndCategoryId(userId, categoryId);

        assignments.forEach(user.getCategoryAssignments()::remove);
        categoryAssignmentRepository.deleteAll(assignments);
        log.info("Category {} unassigned from user {} ({} rows)", categoryId, userId, assignments.size());
        return assignments.size();
    }

    /**
     * Categories reached by walking the user's assignment collection.
     */
    @Transactional(readOnly = true)
    public List<Category> getCategories(Integer userId) {
        return findUser(userId).getCategoryAssignments().stream()
                .map(UserCategoryAssignment::getCategory)
                .filter(Objects::nonNull)
                .distinct()
                .sorted(Comparator.comparing(Category::getId))
                .toList();
    }

    @Transactional(readOnly = true)
    public List<Category> getAssignedCategories(Integer userId) {
        findUser(userId);
        return categoryAssignmentRepository.findDistinctCategoriesByUserId(userId);
    }

    @Transactional(readOnly = true)
    public long countAssignedCategories(Integer userId) {
        findUser(userId);
        return categoryAssignmentRepository.countDistinctCategoriesByUserId(userId);
    }

    @Transactional
    public void assignArticle(Integer userId, Integer articleId) {
        User user = findUser(userId);
        Article article = articleRepository.findById(articleId)
                .orElseThrow(() -> new EntityNotFoundException("Article not found with id: " + articleId));

        ModeratorAssignment assignment = ModeratorAssignment.builder()
                .user(user)
                .article(article)
                .build();
        moderatorAssignmentRepository.save(assignment);
        user.getArticleAssignments().add(assignment);
        log.info("Article {} assigned to user {}", articleId, userId);
    }

    @Transactional
    public int unassignArticle(Integer userId, Integer articleId) {
        User user = findUser(userId);
        List<ModeratorAssignment> assignments =
                moderatorAssignmentRepository.findAllByUserIdAndArticleId(userId, articleId);

        assignments.forEach(user.getArticleAssignments()::remove);
        moderatorAssignmentRepository.deleteAll(assignments);
        log.info("Article {} unassigned from user {} ({} rows)", articleId, userId, assignments.size());
        return assignments.size();
    }

    @Transactional(readOnly = true)
    public List<Article> getAssignedArticles(Integer userId) {
        findUser(userId);
        return moderatorAssignmentRepository.findDistinctArticlesByUserId(userId);
    }

    @Transactional(readOnly = true)
    public long countAssignedArticles(Integer userId) {
        findUser(userId);
        return moderatorAssignmentRepository.countDistinctArticlesByUserId(userId);
    }

    private User findUser(Integer userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> new UserNotFoundException("User not found with id: " + userId));
    }
}
