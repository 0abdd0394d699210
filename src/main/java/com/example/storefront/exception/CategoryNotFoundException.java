package com.example.storefront.exception;

import org.springframework.http.HttpStatus;

/**
 * A product referenced a category slug that no stored category carries.
 */
public class CategoryNotFoundException extends ApiException {

    private final String categorySlug;

    public CategoryNotFoundException(String categorySlug) {
        super(HttpStatus.BAD_REQUEST, "category_not_found", "Category does not exist");
        this.categorySlug = categorySlug;
    }

    public String getCategorySlug() {
        return categorySlug;
    }
}
