package com.example.storefront.controller;

import com.example.storefront.model.CategoryDraft;
import com.example.storefront.model.CategoryUpdate;
import com.example.storefront.model.CategoryView;
import com.example.storefront.service.CategoryService;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Optional;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Validated
public class CategoryController {

    static final String SLUG_PATTERN = "[A-Za-z0-9][A-Za-z0-9_-]*";
    static final String SLUG_MESSAGE = "must contain only letters, digits, '-' and '_'";
    static final String NOT_BLANK_PATTERN = "(?s).*\\S.*";
    static final String NOT_BLANK_MESSAGE = "must not be blank";

    private final CategoryService categoryService;

    @GetMapping("/categories")
    public List<CategoryView> listCategories() {
        return categoryService.listCategories();
    }

    @PostMapping("/admin/categories")
    public ResponseEntity<CategoryView> create(@Valid @RequestBody CreateCategoryRequest request) {
        CategoryDraft draft = CategoryDraft.builder()
            .name(request.name())
            .slug(request.slug())
            .description(request.description())
            .active(request.isActive() == null || request.isActive())
            .build();
        return ResponseEntity.status(HttpStatus.CREATED).body(categoryService.createCategory(draft));
    }

    @PutMapping("/admin/categories/{id}")
    public CategoryView update(@PathVariable String id, @Valid @RequestBody UpdateCategoryRequest request) {
        return categoryService.updateCategory(id, request.toUpdate());
    }

    @DeleteMapping("/admin/categories/{id}")
    public DeleteResponse delete(@PathVariable String id) {
        categoryService.deleteCategory(id);
        return DeleteResponse.SUCCESS;
    }

    public record CreateCategoryRequest(
        @NotBlank String name,
        @NotNull @Pattern(regexp = SLUG_PATTERN, message = SLUG_MESSAGE) String slug,
        String description,
        @JsonProperty("is_active") Boolean isActive
    ) {
    }

    public record UpdateCategoryRequest(
        @Pattern(regexp = NOT_BLANK_PATTERN, message = NOT_BLANK_MESSAGE) String name,
        @Pattern(regexp = SLUG_PATTERN, message = SLUG_MESSAGE) String slug,
        String description,
        @JsonProperty("is_active") Boolean isActive
    ) {

        CategoryUpdate toUpdate() {
            return CategoryUpdate.builder()
                .name(Optional.ofNullable(name))
                .slug(Optional.ofNullable(slug))
                .description(Optional.ofNullable(description))
                .active(Optional.ofNullable(isActive))
                .build();
        }
    }
}
