package com.example.storefront.service;

import com.example.storefront.exception.CategoryNotFoundException;
import com.example.storefront.exception.EmptyUpdateException;
import com.example.storefront.exception.NotFoundException;
import com.example.storefront.model.ProductDraft;
import com.example.storefront.model.ProductUpdate;
import com.example.storefront.model.ProductView;
import com.example.storefront.persistence.DocumentWriter;
import com.example.storefront.persistence.document.ProductDocument;
import com.example.storefront.persistence.repository.ProductRepository;
import com.example.storefront.util.IdCodec;
import com.example.storefront.util.Timestamps;
import lombok.RequiredArgsConstructor;
import org.bson.types.ObjectId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

@Service
@RequiredArgsConstructor
public class ProductService {

    private static final Logger log = LoggerFactory.getLogger(ProductService.class);
    private static final String NOT_FOUND = "Product not found";

    private final ProductRepository productRepository;
    private final CategoryService categoryService;
    private final DocumentWriter documentWriter;
    private final Clock clock;

    /**
     * Products not explicitly marked out of stock, newest first.
     */
    public List<ProductView> listProducts(String categorySlug) {
        return productRepository.findListed(categorySlug).stream()
            .map(this::toView)
            .toList();
    }

    public ProductView getProduct(String id) {
        return productRepository.findById(IdCodec.decode(id))
            .map(this::toView)
            .orElseThrow(() -> new NotFoundException(NOT_FOUND));
    }

    public ProductView createProduct(ProductDraft draft) {
        requireCategory(draft.getCategorySlug());

        ProductDocument document = ProductDocument.builder()
            .title(draft.getTitle())
            .description(draft.getDescription())
            .price(draft.getPrice())
            .categorySlug(draft.getCategorySlug())
            .imageUrl(draft.getImageUrl())
            .inStock(draft.isInStock())
            .createdAt(Timestamps.now(clock))
            .build();

        ProductDocument saved = productRepository.insert(document);
        log.info("Created product {} in category {}", saved.getId(), saved.getCategorySlug());
        return toView(saved);
    }

    public ProductView updateProduct(String id, ProductUpdate update) {
        if (update.isEmpty()) {
            throw new EmptyUpdateException();
        }
        ObjectId productId = IdCodec.decode(id);
        update.getCategorySlug().ifPresent(this::requireCategory);

        Update fields = new Update();
        update.getTitle().ifPresent(title -> fields.set("title", title));
        update.getDescription().ifPresent(description -> fields.set("description", description));
        update.getPrice().ifPresent(price -> fields.set("price", price));
        update.getCategorySlug().ifPresent(slug -> fields.set("categorySlug", slug));
        update.getImageUrl().ifPresent(url -> fields.set("imageUrl", url));
        update.getInStock().ifPresent(inStock -> fields.set("inStock", inStock));

        if (!documentWriter.patch(ProductDocument.class, productId, fields)) {
            throw new NotFoundException(NOT_FOUND);
        }
        return getProduct(id);
    }

    public void deleteProduct(String id) {
        ObjectId productId = IdCodec.decode(id);
        if (!documentWriter.remove(ProductDocument.class, productId)) {
            throw new NotFoundException(NOT_FOUND);
        }
        log.info("Deleted product {}", productId);
    }

    private void requireCategory(String categorySlug) {
        if (!categoryService.slugExists(categorySlug)) {
            throw new CategoryNotFoundException(categorySlug);
        }
    }

    public ProductView toView(ProductDocument document) {
        return ProductView.builder()
            .id(IdCodec.encode(document.getId()))
            .title(document.getTitle())
            .description(document.getDescription())
            .price(document.getPrice())
            .categorySlug(document.getCategorySlug())
            .imageUrl(document.getImageUrl())
            .inStock(document.isInStock())
            .createdAt(Timestamps.format(document.getCreatedAt()))
            .updatedAt(Timestamps.format(document.getUpdatedAt()))
            .build();
    }
}
