package com.example.storefront.persistence.repository;

import com.example.storefront.persistence.document.ProductDocument;
import org.bson.types.ObjectId;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface ProductRepository extends MongoRepository<ProductDocument, ObjectId>, ProductListing {
}
