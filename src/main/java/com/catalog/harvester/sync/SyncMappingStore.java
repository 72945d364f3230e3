package com.catalog.harvester.sync;

import com.catalog.harvester.model.ProductKey;
import com.catalog.harvester.model.SyncMapping;

import java.util.Collection;
import java.util.Optional;

/**
 * Persistence of {@link SyncMapping}s, one per canonical product.
 */
public interface SyncMappingStore {

    Optional<SyncMapping> find(ProductKey key);

    void save(SyncMapping mapping);

    Collection<SyncMapping> all();
}
