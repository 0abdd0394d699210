package com.example.storefront.config;

import com.example.storefront.persistence.document.AdminSessionDocument;
import com.example.storefront.persistence.document.CategoryDocument;
import com.example.storefront.persistence.document.DeliveryChargeDocument;
import com.example.storefront.persistence.document.ProductDocument;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.IndexOperations;
import org.springframework.data.mongodb.core.index.MongoPersistentEntityIndexResolver;
import org.springframework.data.mongodb.core.mapping.MongoMappingContext;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Creates the indexes declared on the document classes once the application is up. A failure for one
 * collection is logged and the remaining collections are still attempted; request handling starts either way.
 */
@Component
@RequiredArgsConstructor
public class StoreIndexInitializer {

    private static final Logger log = LoggerFactory.getLogger(StoreIndexInitializer.class);

    private static final List<Class<?>> DOCUMENT_TYPES = List.of(
        CategoryDocument.class,
        ProductDocument.class,
        DeliveryChargeDocument.class,
        AdminSessionDocument.class
    );

    private final MongoTemplate mongoTemplate;
    private final MongoMappingContext mappingContext;

    @EventListener(ApplicationReadyEvent.class)
    public void ensureIndexes() {
        MongoPersistentEntityIndexResolver resolver = new MongoPersistentEntityIndexResolver(mappingContext);
        for (Class<?> type : DOCUMENT_TYPES) {
            try {
                ensureIndexes(resolver, type);
            } catch (DataAccessResourceFailureException ex) {
                log.warn("Could not create indexes for {}, store unavailable: {}", type.getSimpleName(), ex.getMessage());
            } catch (DataAccessException ex) {
                log.error("Could not create indexes for {}: {}", type.getSimpleName(), ex.getMessage());
            }
        }
    }

    private void ensureIndexes(MongoPersistentEntityIndexResolver resolver, Class<?> type) {
        IndexOperations indexOps = mongoTemplate.indexOps(type);
        resolver.resolveIndexFor(type).forEach(index -> {
            log.info("Ensuring index {} on {}", index.getIndexKeys().toJson(), type.getSimpleName());
            indexOps.ensureIndex(index);
        });
    }
}
