package com.example.storefront.config;

import com.example.storefront.persistence.document.AdminSessionDocument;
import com.example.storefront.persistence.document.CategoryDocument;
import com.example.storefront.persistence.document.DeliveryChargeDocument;
import com.example.storefront.persistence.document.ProductDocument;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.IndexDefinition;
import org.springframework.data.mongodb.core.index.IndexOperations;
import org.springframework.data.mongodb.core.mapping.MongoMappingContext;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("StoreIndexInitializer")
class StoreIndexInitializerTest {

    @Mock
    private MongoTemplate mongoTemplate;

    @Mock
    private IndexOperations categoryIndexes;

    @Mock
    private IndexOperations productIndexes;

    @Mock
    private IndexOperations deliveryIndexes;

    @Mock
    private IndexOperations sessionIndexes;

    private StoreIndexInitializer initializer;

    @BeforeEach
    void setUp() {
        when(mongoTemplate.indexOps(CategoryDocument.class)).thenReturn(categoryIndexes);
        when(mongoTemplate.indexOps(ProductDocument.class)).thenReturn(productIndexes);
        when(mongoTemplate.indexOps(DeliveryChargeDocument.class)).thenReturn(deliveryIndexes);
        when(mongoTemplate.indexOps(AdminSessionDocument.class)).thenReturn(sessionIndexes);
        initializer = new StoreIndexInitializer(mongoTemplate, new MongoMappingContext());
    }

    @Test
    @DisplayName("should create the unique slug index on categories")
    void shouldCreateUniqueSlugIndex() {
        initializer.ensureIndexes();

        ArgumentCaptor<IndexDefinition> captor = ArgumentCaptor.forClass(IndexDefinition.class);
        verify(categoryIndexes, atLeastOnce()).ensureIndex(captor.capture());
        IndexDefinition slugIndex = captor.getAllValues().stream()
            .filter(index -> index.getIndexKeys().containsKey("slug"))
            .findFirst()
            .orElseThrow();
        assertThat(slugIndex.getIndexOptions().getBoolean("unique")).isTrue();
    }

    @Test
    @DisplayName("should keep going after one collection's indexes fail to build")
    void shouldContinueAfterFailedIndex() {
        when(categoryIndexes.ensureIndex(any(IndexDefinition.class)))
            .thenThrow(new DuplicateKeyException("E11000 duplicate key error collection: category index: slug"));

        assertThatCode(() -> initializer.ensureIndexes()).doesNotThrowAnyException();

        verify(productIndexes, atLeastOnce()).ensureIndex(any(IndexDefinition.class));
        verify(deliveryIndexes, atLeastOnce()).ensureIndex(any(IndexDefinition.class));
        verify(sessionIndexes, atLeastOnce()).ensureIndex(any(IndexDefinition.class));
    }

    @Test
    @DisplayName("should not fail startup when the store is unreachable")
    void shouldTolerateUnavailableStore() {
        DataAccessResourceFailureException unavailable = new DataAccessResourceFailureException("Timed out after 30000 ms");
        when(categoryIndexes.ensureIndex(any(IndexDefinition.class))).thenThrow(unavailable);
        when(productIndexes.ensureIndex(any(IndexDefinition.class))).thenThrow(unavailable);
        when(deliveryIndexes.ensureIndex(any(IndexDefinition.class))).thenThrow(unavailable);
        when(sessionIndexes.ensureIndex(any(IndexDefinition.class))).thenThrow(unavailable);

        assertThatCode(() -> initializer.ensureIndexes()).doesNotThrowAnyException();
    }
}
