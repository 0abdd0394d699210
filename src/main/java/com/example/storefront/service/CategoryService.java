package com.example.storefront.service;

import com.example.storefront.exception.EmptyUpdateException;
import com.example.storefront.exception.NotFoundException;
import com.example.storefront.exception.SlugConflictException;
import com.example.storefront.model.CategoryDraft;
import com.example.storefront.model.CategoryUpdate;
import com.example.storefront.model.CategoryView;
import com.example.storefront.persistence.DocumentWriter;
import com.example.storefront.persistence.document.CategoryDocument;
import com.example.storefront.persistence.repository.CategoryRepository;
import com.example.storefront.util.IdCodec;
import com.example.storefront.util.Timestamps;
import lombok.RequiredArgsConstructor;
import org.bson.types.ObjectId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

@Service
@RequiredArgsConstructor
public class CategoryService {

    private static final Logger log = LoggerFactory.getLogger(CategoryService.class);
    private static final String NOT_FOUND = "Category not found";

    private final CategoryRepository categoryRepository;
    private final DocumentWriter documentWriter;
    private final Clock clock;

    public List<CategoryView> listCategories() {
        return categoryRepository.findAllByOrderByCreatedAtDesc().stream()
            .map(this::toView)
            .toList();
    }

    /**
     * Inserts a new category. A slug that is already taken is rejected up front; the unique index on
     * {@code slug} catches concurrent inserts of the same slug.
     */
    public CategoryView createCategory(CategoryDraft draft) {
        if (categoryRepository.existsBySlug(draft.getSlug())) {
            throw new SlugConflictException(draft.getSlug());
        }

        CategoryDocument document = CategoryDocument.builder()
            .name(draft.getName())
            .slug(draft.getSlug())
            .description(draft.getDescription())
            .active(draft.isActive())
            .createdAt(Timestamps.now(clock))
            .build();

        try {
            CategoryDocument saved = categoryRepository.insert(document);
            log.info("Created category {} ({})", saved.getSlug(), saved.getId());
            return toView(saved);
        } catch (DuplicateKeyException ex) {
            throw new SlugConflictException(draft.getSlug());
        }
    }

    public CategoryView updateCategory(String id, CategoryUpdate update) {
        if (update.isEmpty()) {
            throw new EmptyUpdateException();
        }
        ObjectId categoryId = IdCodec.decode(id);

        update.getSlug().ifPresent(slug -> {
            if (categoryRepository.existsBySlugAndIdNot(slug, categoryId)) {
                throw new SlugConflictException(slug);
            }
        });

        Update fields = new Update();
        update.getName().ifPresent(name -> fields.set("name", name));
        update.getSlug().ifPresent(slug -> fields.set("slug", slug));
        update.getDescription().ifPresent(description -> fields.set("description", description));
        update.getActive().ifPresent(active -> fields.set("active", active));

        boolean matched;
        try {
            matched = documentWriter.patch(CategoryDocument.class, categoryId, fields);
        } catch (DuplicateKeyException ex) {
            throw new SlugConflictException(update.getSlug().orElse(null));
        }
        if (!matched) {
            throw new NotFoundException(NOT_FOUND);
        }
        return categoryRepository.findById(categoryId)
            .map(this::toView)
            .orElseThrow(() -> new NotFoundException(NOT_FOUND));
    }

    /**
     * Hard delete. Products that still carry this category's slug are left as they are.
     */
    public void deleteCategory(String id) {
        ObjectId categoryId = IdCodec.decode(id);
        if (!documentWriter.remove(CategoryDocument.class, categoryId)) {
            throw new NotFoundException(NOT_FOUND);
        }
        log.info("Deleted category {}", categoryId);
    }

    public boolean slugExists(String slug) {
        return categoryRepository.existsBySlug(slug);
    }

    public CategoryView toView(CategoryDocument document) {
        return CategoryView.builder()
            .id(IdCodec.encode(document.getId()))
            .name(document.getName())
            .slug(document.getSlug())
            .description(document.getDescription())
            .isActive(document.isActive())
            .createdAt(Timestamps.format(document.getCreatedAt()))
            .updatedAt(Timestamps.format(document.getUpdatedAt()))
            .build();
    }
}
