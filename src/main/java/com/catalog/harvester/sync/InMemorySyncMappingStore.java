package com.catalog.harvester.sync;

import com.catalog.harvester.model.ProductKey;
import com.catalog.harvester.model.SyncMapping;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class InMemorySyncMappingStore implements SyncMappingStore {

    private final Map<ProductKey, SyncMapping> mappings = new ConcurrentHashMap<>();

    @Override
    public Optional<SyncMapping> find(final ProductKey key) {
        return Optional.ofNullable(mappings.get(key));
    }

    @Override
    public void save(final SyncMapping mapping) {
        mappings.put(mapping.key(), mapping);
    }

    @Override
    public Collection<SyncMapping> all() {
        return List.copyOf(mappings.values());
    }
}
