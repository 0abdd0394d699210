package com.example.storefront.persistence.repository;

import com.example.storefront.persistence.document.ProductDocument;

import java.util.List;

public interface ProductListing {

    /**
     * Products whose {@code in_stock} is not {@code false}, newest first. Documents without the field are
     * listed. A blank category slug means no category filter.
     */
    List<ProductDocument> findListed(String categorySlug);
}
