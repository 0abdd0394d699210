package com.example.storefront.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

@Builder
public record CategoryView(
    String id,
    String name,
    String slug,
    String description,
    @JsonProperty("is_active") boolean isActive,
    @JsonProperty("created_at") String createdAt,
    @JsonProperty("updated_at") String updatedAt
) {
}
