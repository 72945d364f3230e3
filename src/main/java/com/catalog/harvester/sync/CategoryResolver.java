package com.catalog.harvester.sync;

import com.catalog.harvester.config.CatalogProperties;
import com.catalog.harvester.exception.RemoteCatalogException;
import com.catalog.harvester.model.Slugs;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Picks the remote category of a product: {@code catalog.default-category} when set, the
 * site's display name otherwise. The category is looked up by name or slug and created when
 * missing. A failure leaves the product uncategorised instead of failing the sync.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CategoryResolver {

    private final RemoteCatalog catalog;

    private final CatalogProperties cfg;

    private final Map<String, Long> ids = new ConcurrentHashMap<>();

    public List<Long> resolve(final String siteDisplayName) {
        String name = StringUtils.defaultIfBlank(cfg.getDefaultCategory(), siteDisplayName);
        if (StringUtils.isBlank(name)) {
            return List.of();
        }
        String key = name.trim().toLowerCase(Locale.ROOT);
        Long cached = ids.get(key);
        if (cached != null) {
            return List.of(cached);
        }
        try {
            long id = find(name).orElseGet(() -> create(name));
            ids.putIfAbsent(key, id);
            return List.of(ids.get(key));
        } catch (RemoteCatalogException ex) {
            log.warn("Category '{}' unavailable, product stays uncategorised: {}", name, ex.getMessage());
            return List.of();
        }
    }

    private Optional<Long> find(final String name) {
        String slug = Slugs.slugify(name);
        return catalog.listCategories().stream()
                .filter(c -> name.trim().equalsIgnoreCase(c.path("name").asText("").trim())
                        || slug.equals(c.path("slug").asText("")))
                .map(c -> c.path("id").asLong(0))
                .filter(id -> id > 0)
                .findFirst();
    }

    private long create(final String name) {
        JsonNode created = catalog.createCategory(name, Slugs.slugify(name));
        long id = created.path("id").asLong(0);
        if (id == 0) {
            throw new RemoteCatalogException("Category create returned no id", 0, created.toString());
        }
        log.info("Created category '{}' as #{}", name, id);
        return id;
    }
}
