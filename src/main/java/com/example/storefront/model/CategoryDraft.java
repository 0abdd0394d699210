package com.example.storefront.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CategoryDraft {

    String name;
    String slug;
    String description;
    @Builder.Default
    boolean active = true;
}
