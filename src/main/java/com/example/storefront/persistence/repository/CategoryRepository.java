package com.example.storefront.persistence.repository;

import com.example.storefront.persistence.document.CategoryDocument;
import org.bson.types.ObjectId;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface CategoryRepository extends MongoRepository<CategoryDocument, ObjectId> {

    List<CategoryDocument> findAllByOrderByCreatedAtDesc();

    boolean existsBySlug(String slug);

    boolean existsBySlugAndIdNot(String slug, ObjectId id);
}
