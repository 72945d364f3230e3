package com.catalog.harvester.service;

import com.catalog.harvester.model.CanonicalProduct;
import com.catalog.harvester.model.ProductKey;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class InMemoryProductStore implements ProductStore {

    private final Map<ProductKey, CanonicalProduct> products = new ConcurrentHashMap<>();

    @Override
    public boolean upsert(final CanonicalProduct product) {
        return products.put(product.key(), product) == null;
    }

    @Override
    public Optional<CanonicalProduct> find(final ProductKey key) {
        return Optional.ofNullable(products.get(key));
    }

    @Override
    public Collection<CanonicalProduct> findBySite(final String siteId) {
        return products.values().stream()
                .filter(p -> siteId.equals(p.getSiteId()))
                .toList();
    }
}
