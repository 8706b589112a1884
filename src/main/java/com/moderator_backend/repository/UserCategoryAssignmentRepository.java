package com.moderator_backend.repository;

import com.moderator_backend.entity.Category;
import com.moderator_backend.entity.UserCategoryAssignment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface UserCategoryAssignmentRepository extends JpaRepository<UserCategoryAssignment, Integer> {

    List<UserCategoryAssignment> findAllByUserIdAndCategoryId(Integer userId, Integer categoryId);

    @Query("""
            SELECT DISTINCT category FROM UserCategoryAssignment assignment
            JOIN assignment.category category
            WHERE assignment.user.id = :userId
            ORDER BY category.id
            """)
    List<Category> findDistinctCategoriesByUserId(@Param("userId") Integer userId);

    @Query("SELECT COUNT(DISTINCT assignment.category.id) FROM UserCategoryAssignment assignment WHERE assignment.user.id = :userId")
    long countDistinctCategoriesByUserId(@Param("userId") Integer userId);

    @Modifying
    @Query("DELETE FROM UserCategoryAssignment assignment WHERE assignment.user.id IN :userIds")
    int deleteAllByUserIdIn(@Param("userIds") Collection<Integer> userIds);
}
