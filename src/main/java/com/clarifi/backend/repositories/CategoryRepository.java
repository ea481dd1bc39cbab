package com.clarifi.backend.repositories;

import org.springframework.data.jpa.repository.JpaRepository;

import com.clarifi.backend.entities.Category;

public interface CategoryRepository extends JpaRepository<Category, Integer> {
}
