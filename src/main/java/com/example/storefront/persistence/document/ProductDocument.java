package com.example.storefront.persistence.document;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.bson.types.ObjectId;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "product")
public class ProductDocument {

    @Id
    private ObjectId id;

    private String title;
    private String description;
    private double price;

    @Indexed
    @Field("category_slug")
    private String categorySlug;

    @Field("image_url")
    private String imageUrl;

    @Field("in_stock")
    @Builder.Default
    private boolean inStock = true;

    @Indexed
    @Field("created_at")
    private Instant createdAt;

    @Field("updated_at")
    private Instant updatedAt;
}
