package com.phantom.repository;

import com.phantom.domain.model.Category;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface CategoryRepository extends JpaRepository<Category, UUID> {
    Optional<Category> findByName(String name);

    Optional<Category> findByNameIgnoreCase(String name);
}
