package com.moderator_backend.repository;

import com.moderator_backend.entity.Article;
import com.moderator_backend.entity.ModeratorAssignment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface ModeratorAssignmentRepository extends JpaRepository<ModeratorAssignment, Integer> {

    List<ModeratorAssignment> findAllByUserIdAndArticleId(Integer userId, Integer articleId);

    @Query("""
            SELECT DISTINCT article FROM ModeratorAssignment assignment
            JOIN assignment.article article
            WHERE assignment.user.id = :userId
            ORDER BY article.id
            """)
    List<Article> findDistinctArticlesByUserId(@Param("userId") Integer userId);

    @Query("SELECT COUNT(DISTINCT assignment.article.id) FROM ModeratorAssignment assignment WHERE assignment.user.id = :userId")
    long countDistinctArticlesByUserId(@Param("userId") Integer userId);

    @Modifying
    @Query("DELETE FROM ModeratorAssignment assignment WHERE assignment.user.id IN :userIds")
    int deleteAllByUserIdIn(@Param("userIds") Collection<Integer> userIds);
}
