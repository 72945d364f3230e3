package com.catalog.harvester.service;

import com.catalog.harvester.model.CanonicalProduct;
import com.catalog.harvester.model.ProductKey;

import java.util.Collection;
import java.util.Optional;

/**
 * Storage of canonical products, keyed by {@code (siteId, externalId)}.
 */
public interface ProductStore {

    /**
     * Inserts or replaces the product.
     *
     * @return {@code true} when no product with the same key existed before
     */
    boolean upsert(CanonicalProduct product);

    Optional<CanonicalProduct> find(ProductKey key);

    Collection<CanonicalProduct> findBySite(String siteId);
}
