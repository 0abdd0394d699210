package com.example.storefront.persistence;

import com.mongodb.client.result.DeleteResult;
import com.mongodb.client.result.UpdateResult;
import lombok.RequiredArgsConstructor;
import org.bson.types.ObjectId;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

/**
 * Single-document writes that need to report what they touched. Field names in {@link Update}s are
 * document property names; they are mapped onto stored field names by the template.
 */
@Component
@RequiredArgsConstructor
public class DocumentWriter {

    static final String UPDATED_AT = "updatedAt";

    private final MongoTemplate mongoTemplate;

    /**
     * Merges the given fields into one document and stamps {@code updated_at} in the same write.
     *
     * @return {@code true} when a document with the given id existed
     */
    public boolean patch(Class<?> documentType, ObjectId id, Update fields) {
        fields.currentDate(UPDATED_AT);
        UpdateResult result = mongoTemplate.updateFirst(byId(id), fields, documentType);
        return result.getMatchedCount() > 0;
    }

    /**
     * @return {@code true} when a document was removed
     */
    public boolean remove(Class<?> documentType, ObjectId id) {
        DeleteResult result = mongoTemplate.remove(byId(id), documentType);
        return result.getDeletedCount() > 0;
    }

    private Query byId(ObjectId id) {
        return Query.query(Criteria.where("_id").is(id));
    }
}
