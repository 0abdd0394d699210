package com.example.storefront.service;

import com.example.storefront.exception.EmptyUpdateException;
import com.example.storefront.exception.InvalidIdentifierException;
import com.example.storefront.exception.NotFoundException;
import com.example.storefront.exception.SlugConflictException;
import com.example.storefront.model.CategoryDraft;
import com.example.storefront.model.CategoryUpdate;
import com.example.storefront.model.CategoryView;
import com.example.storefront.persistence.DocumentWriter;
import com.example.storefront.persistence.document.CategoryDocument;
import com.example.storefront.persistence.repository.CategoryRepository;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("CategoryService")
class CategoryServiceTest {

    private static final Instant NOW = Instant.parse("2026-01-15T09:30:00Z");

    @Mock
    private CategoryRepository categoryRepository;

    @Mock
    private DocumentWriter documentWriter;

    private CategoryService service;

    @BeforeEach
    void setUp() {
        service = new CategoryService(categoryRepository, documentWriter, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static CategoryDocument stored(String name, String slug) {
        return CategoryDocument.builder()
            .id(new ObjectId())
            .name(name)
            .slug(slug)
            .active(true)
            .createdAt(NOW)
            .build();
    }

    @Nested
    @DisplayName("createCategory")
    class CreateCategory {

        @Test
        @DisplayName("should insert with a creation timestamp and return the serialized category")
        void shouldInsertCategory() {
            when(categoryRepository.insert(any(CategoryDocument.class))).thenAnswer(invocation -> {
                CategoryDocument document = invocation.getArgument(0);
                document.setId(new ObjectId());
                return document;
            });

            CategoryView view = service.createCategory(CategoryDraft.builder()
                .name("Shoes")
                .slug("shoes")
                .description("All kinds of shoes")
                .build());

            assertThat(view.id()).hasSize(24);
            assertThat(view.name()).isEqualTo("Shoes");
            assertThat(view.slug()).isEqualTo("shoes");
            assertThat(view.description()).isEqualTo("All kinds of shoes");
            assertThat(view.isActive()).isTrue();
            assertThat(view.createdAt()).isEqualTo("2026-01-15T09:30:00Z");
            assertThat(view.updatedAt()).isNull();
        }

        @Test
        @DisplayName("should refuse a taken slug even when the store has no unique index")
        void shouldRejectTakenSlugBeforeInsert() {
            when(categoryRepository.existsBySlug("shoes")).thenReturn(true);

            assertThatThrownBy(() -> service.createCategory(CategoryDraft.builder().name("Shoes").slug("shoes").build()))
                .isInstanceOf(SlugConflictException.class)
                .hasMessage("Slug already exists");
            verify(categoryRepository, never()).insert(any(CategoryDocument.class));
        }

        @Test
        @DisplayName("should report a slug conflict when the unique index rejects a concurrent insert")
        void shouldRejectDuplicateSlug() {
            when(categoryRepository.existsBySlug("shoes")).thenReturn(false);
            when(categoryRepository.insert(any(CategoryDocument.class)))
                .thenThrow(new DuplicateKeyException("E11000 duplicate key error collection: category index: slug"));

            assertThatThrownBy(() -> service.createCategory(CategoryDraft.builder().name("Shoes").slug("shoes").build()))
                .isInstanceOf(SlugConflictException.class)
                .hasMessage("Slug already exists");
        }
    }

    @Nested
    @DisplayName("listCategories")
    class ListCategories {

        @Test
        @DisplayName("should return categories in the repository's newest-first order")
        void shouldListCategories() {
            when(categoryRepository.findAllByOrderByCreatedAtDesc())
                .thenReturn(List.of(stored("Hats", "hats"), stored("Shoes", "shoes")));

            List<CategoryView> categories = service.listCategories();

            assertThat(categories).extracting(CategoryView::slug).containsExactly("hats", "shoes");
        }
    }

    @Nested
    @DisplayName("updateCategory")
    class UpdateCategory {

        @Test
        @DisplayName("should reject an empty update before looking at the id or the store")
        void shouldRejectEmptyUpdate() {
            CategoryUpdate empty = CategoryUpdate.builder().build();

            assertThatThrownBy(() -> service.updateCategory("not-an-id", empty))
                .isInstanceOf(EmptyUpdateException.class)
                .hasMessage("No fields to update");
            assertThatThrownBy(() -> service.updateCategory(new ObjectId().toHexString(), empty))
                .isInstanceOf(EmptyUpdateException.class);

            verifyNoInteractions(categoryRepository, documentWriter);
        }

        @Test
        @DisplayName("should reject malformed ids")
        void shouldRejectMalformedId() {
            CategoryUpdate update = CategoryUpdate.builder().name(Optional.of("Boots")).build();

            assertThatThrownBy(() -> service.updateCategory("123", update))
                .isInstanceOf(InvalidIdentifierException.class);
        }

        @Test
        @DisplayName("should reject a slug used by another category")
        void shouldRejectTakenSlug() {
            ObjectId id = new ObjectId();
            when(categoryRepository.existsBySlugAndIdNot("hats", id)).thenReturn(true);

            CategoryUpdate update = CategoryUpdate.builder().slug(Optional.of("hats")).build();

            assertThatThrownBy(() -> service.updateCategory(id.toHexString(), update))
                .isInstanceOf(SlugConflictException.class);
            verify(documentWriter, never()).patch(any(), any(), any());
        }

        @Test
        @DisplayName("should treat a duplicate key from the store as a slug conflict")
        void shouldMapDuplicateKeyOnUpdate() {
            ObjectId id = new ObjectId();
            when(categoryRepository.existsBySlugAndIdNot("hats", id)).thenReturn(false);
            when(documentWriter.patch(eq(CategoryDocument.class), eq(id), any(Update.class)))
                .thenThrow(new DuplicateKeyException("E11000"));

            CategoryUpdate update = CategoryUpdate.builder().slug(Optional.of("hats")).build();

            assertThatThrownBy(() -> service.updateCategory(id.toHexString(), update))
                .isInstanceOf(SlugConflictException.class);
        }

        @Test
        @DisplayName("should fail with not found when no category matches")
        void shouldFailWhenMissing() {
            ObjectId id = new ObjectId();
            when(documentWriter.patch(eq(CategoryDocument.class), eq(id), any(Update.class))).thenReturn(false);

            CategoryUpdate update = CategoryUpdate.builder().active(Optional.of(false)).build();

            assertThatThrownBy(() -> service.updateCategory(id.toHexString(), update))
                .isInstanceOf(NotFoundException.class)
                .hasMessage("Category not found");
        }

        @Test
        @DisplayName("should merge only the present fields and return the re-read category")
        void shouldMergePresentFields() {
            CategoryDocument existing = stored("Boots", "shoes");
            existing.setUpdatedAt(NOW.plusSeconds(60));
            ObjectId id = existing.getId();
            when(documentWriter.patch(eq(CategoryDocument.class), eq(id), any(Update.class))).thenReturn(true);
            when(categoryRepository.findById(id)).thenReturn(Optional.of(existing));

            CategoryView view = service.updateCategory(id.toHexString(), CategoryUpdate.builder()
                .name(Optional.of("Boots"))
                .active(Optional.of(false))
                .build());

            ArgumentCaptor<Update> captor = ArgumentCaptor.forClass(Update.class);
            verify(documentWriter).patch(eq(CategoryDocument.class), eq(id), captor.capture());
            Document set = captor.getValue().getUpdateObject().get("$set", Document.class);
            assertThat(set).containsOnlyKeys("name", "active");
            assertThat(set).containsEntry("name", "Boots").containsEntry("active", false);

            assertThat(view.name()).isEqualTo("Boots");
            assertThat(view.updatedAt()).isEqualTo("2026-01-15T09:31:00Z");
        }
    }

    @Nested
    @DisplayName("deleteCategory")
    class DeleteCategory {

        @Test
        @DisplayName("should succeed once and then report not found")
        void shouldReportSecondDeleteAsNotFound() {
            ObjectId id = new ObjectId();
            when(documentWriter.remove(CategoryDocument.class, id)).thenReturn(true, false);

            service.deleteCategory(id.toHexString());

            assertThatThrownBy(() -> service.deleteCategory(id.toHexString()))
                .isInstanceOf(NotFoundException.class);
        }

        @Test
        @DisplayName("should remove only the category document")
        void shouldLeaveProductsUntouched() {
            ObjectId id = new ObjectId();
            when(documentWriter.remove(CategoryDocument.class, id)).thenReturn(true);

            service.deleteCategory(id.toHexString());

            verify(documentWriter).remove(CategoryDocument.class, id);
            verifyNoMoreInteractions(documentWriter);
            verifyNoInteractions(categoryRepository);
        }
    }
}
