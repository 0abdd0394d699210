package com.example.storefront.persistence.repository;

import com.example.storefront.persistence.document.AdminSessionDocument;
import org.bson.types.ObjectId;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

public interface AdminSessionRepository extends MongoRepository<AdminSessionDocument, ObjectId> {

    Optional<AdminSessionDocument> findByToken(String token);
}
