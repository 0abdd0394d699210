package com.example.storefront.model;

import lombok.Builder;
import lombok.Value;

import java.util.Optional;

/**
 * Field update set for a product. Only present fields take part in the merge.
 */
@Value
@Builder
public class ProductUpdate {

    @Builder.Default
    Optional<String> title = Optional.empty();
    @Builder.Default
    Optional<String> description = Optional.empty();
    @Builder.Default
    Optional<Double> price = Optional.empty();
    @Builder.Default
    Optional<String> categorySlug = Optional.empty();
    @Builder.Default
    Optional<String> imageUrl = Optional.empty();
    @Builder.Default
    Optional<Boolean> inStock = Optional.empty();

    public boolean isEmpty() {
        return title.isEmpty()
            && description.isEmpty()
            && price.isEmpty()
            && categorySlug.isEmpty()
            && imageUrl.isEmpty()
            && inStock.isEmpty();
    }
}
