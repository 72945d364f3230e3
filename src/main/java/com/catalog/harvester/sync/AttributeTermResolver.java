package com.catalog.harvester.sync;

import com.catalog.harvester.config.CatalogProperties;
import com.catalog.harvester.exception.RemoteCatalogException;
import com.catalog.harvester.model.Slugs;
import com.catalog.harvester.model.VariantMatrix;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Resolves global attributes and their terms to remote ids, creating what is missing.
 * <p>
 * Lookup order for both kinds: local cache, remote by slug, remote by name, remote by slug
 * once more, create, and after a failed create a final remote recheck by slug. The caches
 * live as long as the bean and lookups of one name are serialised, so a name is created at
 * most once per process even when two products race for it.
 * </p>
 */
@Slf4j
@Component
public class AttributeTermResolver {

    /** Remote ids needed to attach colour and size to a variable product and its variations. */
    public record ProductAttributes(long colourAttributeId, long sizeAttributeId, ArrayNode payload) {
    }

    private final RemoteCatalog catalog;

    private final CatalogProperties cfg;

    private final ObjectMapper mapper;

    private final Map<String, Long> attributeIds = new ConcurrentHashMap<>();

    private final Map<Long, Map<String, Long>> termIds = new ConcurrentHashMap<>();

    /** One monitor per attribute or term name, held across lookup and create. */
    private final Map<String, Object> locks = new ConcurrentHashMap<>();

    public AttributeTermResolver(final RemoteCatalog catalog,
                                 final CatalogProperties cfg,
                                 @Qualifier("harvesterObjectMapper") final ObjectMapper mapper) {
        this.catalog = catalog;
        this.cfg = cfg;
        this.mapper = mapper;
    }

    /**
     * Ensures the colour/size attributes and every term of the matrix exist remotely and builds
     * the {@code attributes} array of the product payload.
     */
    public ProductAttributes prepare(final VariantMatrix matrix) {
        long colourId = resolveAttribute(cfg.getColourAttribute());
        long sizeId = resolveAttribute(cfg.getSizeAttribute());

        List<String> colours = matrix.colourLabels();
        List<String> sizes = new ArrayList<>(matrix.distinctSizes());
        colours.forEach(c -> resolveTerm(colourId, c));
        sizes.forEach(s -> resolveTerm(sizeId, s));

        ArrayNode payload = mapper.createArrayNode();
        payload.add(attributeNode(colourId, 0, colours));
        payload.add(attributeNode(sizeId, 1, sizes));
        return new ProductAttributes(colourId, sizeId, payload);
    }

    public long resolveAttribute(final String name) {
        String key = name.trim().toLowerCase(Locale.ROOT);
        Long cached = attributeIds.get(key);
        if (cached != null) {
            return cached;
        }
        synchronized (locks.computeIfAbsent("attribute|" + key, k -> new Object())) {
            cached = attributeIds.get(key);
            if (cached != null) {
                return cached;
            }
            String slug = Slugs.slugify(name);
            long id = resolve("attribute " + name, slug, name,
                    catalog::listAttributes,
                    () -> catalog.createAttribute(name, slug));
            attributeIds.put(key, id);
            return id;
        }
    }

    public long resolveTerm(final long attributeId, final String name) {
        Map<String, Long> terms = termIds.computeIfAbsent(attributeId, k -> new ConcurrentHashMap<>());
        String key = name.trim().toLowerCase(Locale.ROOT);
        Long cached = terms.get(key);
        if (cached != null) {
            return cached;
        }
        synchronized (locks.computeIfAbsent("term|" + attributeId + "|" + key, k -> new Object())) {
            cached = terms.get(key);
            if (cached != null) {
                return cached;
            }
            String slug = Slugs.slugify(name);
            long id = resolve("term " + name + " of attribute #" + attributeId, slug, name,
                    () -> catalog.listTerms(attributeId),
                    () -> catalog.createTerm(attributeId, name, slug));
            terms.put(key, id);
            return id;
        }
    }

    private long resolve(final String what,
                         final String slug,
                         final String name,
                         final Supplier<List<JsonNode>> lister,
                         final Supplier<JsonNode> creator) {
        List<JsonNode> remote = lister.get();
        Optional<Long> found = bySlug(remote, slug).or(() -> byName(remote, name));
        if (found.isPresent()) {
            return found.get();
        }
        found = bySlug(lister.get(), slug);
        if (found.isPresent()) {
            return found.get();
        }
        try {
            long created = idOf(creator.get());
            log.info("Created {} as #{}", what, created);
            return created;
        } catch (RemoteCatalogException ex) {
            Optional<Long> raced = bySlug(lister.get(), slug);
            if (raced.isPresent()) {
                log.info("Create of {} failed but it exists now as #{}", what, raced.get());
                return raced.get();
            }
            throw ex;
        }
    }

    private static Optional<Long> bySlug(final List<JsonNode> nodes, final String slug) {
        return nodes.stream()
                .filter(n -> slug.equals(normaliseSlug(n.path("slug").asText(""))))
                .map(AttributeTermResolver::idOf)
                .findFirst();
    }

    private static Optional<Long> byName(final List<JsonNode> nodes, final String name) {
        return nodes.stream()
                .filter(n -> name.trim().equalsIgnoreCase(n.path("name").asText("").trim()))
                .map(AttributeTermResolver::idOf)
                .findFirst();
    }

    /** Global attribute slugs come back prefixed with {@code pa_}. */
    static String normaliseSlug(final String slug) {
        return StringUtils.removeStart(slug.toLowerCase(Locale.ROOT), "pa_");
    }

    private static long idOf(final JsonNode node) {
        long id = node.path("id").asLong(0);
        if (id == 0) {
            throw new RemoteCatalogException("Remote entity without id: " + node, 0, node.toString());
        }
        return id;
    }

    private ObjectNode attributeNode(final long id, final int position, final List<String> options) {
        ObjectNode node = mapper.createObjectNode();
        node.put("id", id);
        node.put("position", position);
        node.put("visible", true);
        node.put("variation", true);
        ArrayNode opts = node.putArray("options");
        options.forEach(opts::add);
        return node;
    }

    /** Variation key used to match local colour/size pairs against remote variations. */
    static String variationKey(final String colour, final String size) {
        return colour.trim().toLowerCase(Locale.ROOT) + "|" + size.trim().toLowerCase(Locale.ROOT);
    }
}
