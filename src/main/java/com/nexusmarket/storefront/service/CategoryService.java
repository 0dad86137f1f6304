package com.nexusmarket.storefront.service;

import com.nexusmarket.storefront.domain.model.Category;
import com.nexusmarket.storefront.exception.ResourceNotFoundException;
import com.nexusmarket.storefront.repository.CategoryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Service for product categories.
 *
 * @author Storefront Team
 */
@Service
public class CategoryService {

    private static final Logger logger = LoggerFactory.getLogger(CategoryService.class);

    private final CategoryRepository categoryRepository;

    public CategoryService(CategoryRepository categoryRepository) {
        this.categoryRepository = categoryRepository;
    }

    @Transactional(readOnly = true)
    public List<Category> listCategories() {
        return categoryRepository.findAllByOrderByNameAsc();
    }

    /**
     * Create a category.
     *
     * @param parentId Parent category, or null for a top-level category
     * @throws ResourceNotFoundException if the parent does not exist
     */
    @Transactional
    public Category createCategory(String name, String description, String image, String parentId) {
        if (parentId != null && !categoryRepository.existsById(parentId)) {
            throw new ResourceNotFoundException("Category", parentId);
        }

        Category category = categoryRepository.save(Category.builder()
                .name(name)
                .description(description)
                .image(image)
                .parentId(parentId)
                .build());

        logger.info("Created category {} ({})", category.getCategoryId(), name);
        return category;
    }
}
