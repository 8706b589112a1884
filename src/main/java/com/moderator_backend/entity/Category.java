package com.moderator_backend.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.*;

import java.util.HashSet;
import java.util.Set;

@Entity
@Table(name = "categories")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Category {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Integer id;

    @Column(nullable = false, unique = true, length = 255)
    private String label;

    // id of the category in the comment source, when it was imported
    @Column(name = "source_id")
    private String sourceId;

    @Builder.Default
    @Column(name = "is_active", nullable = false)
    private Boolean isActive = true;

    @JsonIgnore
    @Builder.Default
    @OneToMany(mappedBy = "category")
    private Set<UserCategoryAssignment> userAssignments = new HashSet<>();

    @JsonIgnore
    @Builder.Default
    @OneToMany(mappedBy = "category")
    private Set<Article> articles = new HashSet<>();
}
