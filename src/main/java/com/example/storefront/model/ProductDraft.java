package com.example.storefront.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ProductDraft {

    String title;
    String description;
    double price;
    String categorySlug;
    String imageUrl;
    @Builder.Default
    boolean inStock = true;
}
