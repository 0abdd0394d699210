package com.example.storefront.exception;

import org.springframework.http.HttpStatus;

public class SlugConflictException extends ApiException {

    private final String slug;

    public SlugConflictException(String slug) {
        super(HttpStatus.BAD_REQUEST, "slug_conflict", "Slug already exists");
        this.slug = slug;
    }

    public String getSlug() {
        return slug;
    }
}
