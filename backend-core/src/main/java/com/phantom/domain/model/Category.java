package com.phantom.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.UUID;

@Getter
@Setter
@NoArgsConstructor
@Entity
@Table(name = "categories", indexes = {
        @Index(name = "idx_categories_name", columnList = "name", unique = true)
})
public class Category {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, unique = true, length = 50)
    private String name;

    @Column(name = "priority_level", nullable = false)
    private int priorityLevel;

    @Column(nullable = false, length = 7)
    private String color;

    @Column(columnDefinition = "text")
    private String description;

    public Category(String name, int priorityLevel, String color, String description) {
        this.name = name;
        this.priorityLevel = priorityLevel;
        this.color = color;
        this.description = description;
    }
}
