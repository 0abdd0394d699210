package com.example.storefront.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

@Builder
public record ProductView(
    String id,
    String title,
    String description,
    double price,
    @JsonProperty("category_slug") String categorySlug,
    @JsonProperty("image_url") String imageUrl,
    @JsonProperty("in_stock") boolean inStock,
    @JsonProperty("created_at") String createdAt,
    @JsonProperty("updated_at") String updatedAt
) {
}
