package com.livemart.marketplace.service;

import com.livemart.marketplace.dto.CategoryRequest;
import com.livemart.marketplace.entity.Category;
import com.livemart.marketplace.repository.CategoryRepository;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;

@Service
public class CategoryService {

    private final CategoryRepository categoryRepository;

    public CategoryService(CategoryRepository categoryRepository) {
        this.categoryRepository = categoryRepository;
    }

    public List<Category> list() {
        return categoryRepository.findAll();
    }

    public Category save(CategoryRequest request) {
        String id = request.id() == null || request.id().isBlank()
                ? request.name().trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", "-")
                : request.id();
        return categoryRepository.save(new Category(id, request.name().trim()));
    }
}
