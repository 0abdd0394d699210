package com.example.storefront.model;

import lombok.Builder;
import lombok.Value;

import java.util.Optional;

/**
 * Field update set for a category. Only present fields take part in the merge.
 */
@Value
@Builder
public class CategoryUpdate {

    @Builder.Default
    Optional<String> name = Optional.empty();
    @Builder.Default
    Optional<String> slug = Optional.empty();
    @Builder.Default
    Optional<String> description = Optional.empty();
    @Builder.Default
    Optional<Boolean> active = Optional.empty();

    public boolean isEmpty() {
        return name.isEmpty() && slug.isEmpty() && description.isEmpty() && active.isEmpty();
    }
}
