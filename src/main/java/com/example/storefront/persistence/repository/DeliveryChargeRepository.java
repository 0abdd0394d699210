package com.example.storefront.persistence.repository;

import com.example.storefront.persistence.document.DeliveryChargeDocument;
import org.bson.types.ObjectId;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

public interface DeliveryChargeRepository extends MongoRepository<DeliveryChargeDocument, ObjectId> {

    /**
     * The newest table. Tables stamped in the same millisecond are ordered by their ids.
     */
    Optional<DeliveryChargeDocument> findFirstByOrderByCreatedAtDescIdDesc();
}
