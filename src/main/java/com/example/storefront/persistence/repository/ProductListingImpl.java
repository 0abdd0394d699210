package com.example.storefront.persistence.repository;

import com.example.storefront.persistence.document.ProductDocument;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.util.StringUtils;

import java.util.List;

@RequiredArgsConstructor
public class ProductListingImpl implements ProductListing {

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Direction.DESC, "createdAt");

    private final MongoTemplate mongoTemplate;

    @Override
    public List<ProductDocument> findListed(String categorySlug) {
        return mongoTemplate.find(listingQuery(categorySlug), ProductDocument.class);
    }

    static Query listingQuery(String categorySlug) {
        Criteria criteria = Criteria.where("inStock").ne(false);
        if (StringUtils.hasText(categorySlug)) {
            criteria = criteria.and("categorySlug").is(categorySlug);
        }
        return Query.query(criteria).with(NEWEST_FIRST);
    }
}
