package com.catalog.harvester.parser;

import com.catalog.harvester.config.SiteCfg;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * <h2>Embedded-state shape search</h2>
 *
 * <p>Server-rendered product pages ship their state as a JSON blob in a script tag, but the
 * path to the interesting part changes from one page template to the next. Lookups here
 * therefore work in two steps:</p>
 * <ol>
 *   <li>a fast path over the known JSON pointers of the site profile;</li>
 *   <li>a bounded depth-first search over the whole tree that accepts the first node with
 *       the expected <em>shape</em>.</li>
 * </ol>
 *
 * <p>A colourway list is an array whose first element has an id, a colour-like field and a
 * {@code variants} array whose first entry has a {@code size} and a stock field. Flat variant
 * lists (each variant carrying its own colour) are grouped into that shape by
 * {@link #groupVariantsByColour(JsonNode)}.</p>
 */
@Slf4j
public class JsonShapeSearch {

    static final List<String> ID_FIELDS = List.of("id", "colourwayId", "colorwayId", "productId");

    static final List<String> COLOUR_FIELDS = List.of(
            "colour", "color", "label", "colourCode", "colorCode", "colourName", "colorName", "colorDescription");

    static final List<String> STOCK_FIELDS = List.of(
            "stockAvailability", "available", "inStock", "isAvailable", "availability", "stock");

    private static final List<String> VARIANT_ARRAYS = List.of("variants", "skus", "sizes");

    private final ObjectMapper mapper;

    public JsonShapeSearch(final ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Parses the embedded state script.
     *
     * @return the state tree, {@code null} when the page has none or it is not valid JSON
     */
    public JsonNode readEmbeddedState(final Document doc, final String scriptSelector) {
        if (doc == null || StringUtils.isBlank(scriptSelector)) {
            return null;
        }
        Element script = doc.selectFirst(scriptSelector);
        if (script == null || StringUtils.isBlank(script.data())) {
            return null;
        }
        try {
            return mapper.readTree(script.data().trim());
        } catch (JsonProcessingException ex) {
            log.debug("Embedded state is not valid JSON: {}", ex.getOriginalMessage());
            return null;
        }
    }

    /* ---- locators ----------------------------------------------------- */

    public JsonNode findColourways(final JsonNode root, final SiteCfg.Embedded cfg) {
        return locate(root, cfg.getColourwayPaths(), JsonShapeSearch::looksLikeColourways, cfg.getMaxDepth());
    }

    public JsonNode findCurrentProduct(final JsonNode root, final SiteCfg.Embedded cfg) {
        return locate(root, cfg.getProductPaths(), JsonShapeSearch::looksLikeProduct, cfg.getMaxDepth());
    }

    /**
     * @return the related-products array: a known path, else the first {@code relatedProducts}
     * field holding a non-empty array
     */
    public JsonNode findRelatedProducts(final JsonNode root, final SiteCfg.Embedded cfg) {
        for (String pointer : cfg.getRelatedProductPaths()) {
            JsonNode node = root.at(pointer);
            if (node.isArray() && !node.isEmpty()) {
                return node;
            }
        }
        JsonNode holder = search(root, 0, cfg.getMaxDepth(), n -> {
            JsonNode related = n.path("relatedProducts");
            return related.isArray() && !related.isEmpty();
        });
        return holder == null ? null : holder.path("relatedProducts");
    }

    private JsonNode locate(final JsonNode root, final List<String> pointers,
                            final Predicate<JsonNode> shape, final int maxDepth) {
        if (root == null) {
            return null;
        }
        for (String pointer : pointers) {
            JsonNode node = root.at(pointer);
            if (shape.test(node)) {
                log.debug("Embedded state matched known path {}", pointer);
                return node;
            }
        }
        return search(root, 0, maxDepth, shape);
    }

    /**
     * Depth-first search; {@code depth} counts containers entered from the root.
     *
     * @return the first node accepted by {@code shape}, {@code null} if none within {@code maxDepth}
     */
    static JsonNode search(final JsonNode node, final int depth, final int maxDepth,
                           final Predicate<JsonNode> shape) {
        if (node == null || depth > maxDepth) {
            return null;
        }
        if (shape.test(node)) {
            return node;
        }
        if (node.isContainerNode()) {
            Iterator<JsonNode> children = node.elements();
            while (children.hasNext()) {
                JsonNode hit = search(children.next(), depth + 1, maxDepth, shape);
                if (hit != null) {
                    return hit;
                }
            }
        }
        return null;
    }

    /* ---- shapes ------------------------------------------------------- */

    /** A non-empty array whose every element is a colourway holding size variants. */
    static boolean looksLikeColourways(final JsonNode node) {
        if (node == null || !node.isArray() || node.isEmpty()) {
            return false;
        }
        for (JsonNode entry : node) {
            if (!looksLikeColourway(entry)) {
                return false;
            }
        }
        return true;
    }

    private static boolean looksLikeColourway(final JsonNode entry) {
        if (!entry.isObject()) {
            return false;
        }
        JsonNode variants = variantArray(entry);
        return hasAny(entry, ID_FIELDS)
                && hasAny(entry, COLOUR_FIELDS)
                && variants != null
                && looksLikeSizeVariant(variants.get(0));
    }

    static boolean looksLikeSizeVariant(final JsonNode node) {
        return node != null && node.isObject() && node.has("size") && hasAny(node, STOCK_FIELDS);
    }

    /** A product object: an id, a name, and either colourways or a variant list. */
    static boolean looksLikeProduct(final JsonNode node) {
        if (node == null || !node.isObject()) {
            return false;
        }
        boolean named = node.has("name") || node.has("title") || node.has("displayName");
        boolean variantBearing = looksLikeColourways(node.path("colourways"))
                || looksLikeColourways(node.path("colorways"))
                || variantArray(node) != null;
        return hasAny(node, ID_FIELDS) && named && variantBearing;
    }

    static JsonNode variantArray(final JsonNode node) {
        for (String field : VARIANT_ARRAYS) {
            JsonNode arr = node.path(field);
            if (arr.isArray() && !arr.isEmpty()) {
                return arr;
            }
        }
        return null;
    }

    private static boolean hasAny(final JsonNode node, final List<String> fields) {
        for (String f : fields) {
            if (node.hasNonNull(f)) {
                return true;
            }
        }
        return false;
    }

    /* ---- grouping ----------------------------------------------------- */

    /**
     * Groups a flat variant array by its colour value into synthetic colourway records
     * ({@code {id, colour, variants:[...]}}), in first-seen colour order. Variants without
     * a colour are ignored.
     */
    public ArrayNode groupVariantsByColour(final JsonNode variants) {
        Map<String, ObjectNode> groups = new LinkedHashMap<>();
        if (variants != null && variants.isArray()) {
            for (JsonNode v : variants) {
                String colour = textOf(v, COLOUR_FIELDS);
                if (colour == null) {
                    continue;
                }
                ObjectNode group = groups.computeIfAbsent(colour, c -> {
                    ObjectNode g = mapper.createObjectNode();
                    g.put("id", c);
                    g.put("colour", c);
                    g.putArray("variants");
                    return g;
                });
                ((ArrayNode) group.get("variants")).add(v);
            }
        }
        ArrayNode out = mapper.createArrayNode();
        groups.values().forEach(out::add);
        return out;
    }

    /**
     * First non-blank textual value among {@code fields}; object values contribute their
     * {@code name}/{@code label}/{@code value}.
     */
    static String textOf(final JsonNode node, final List<String> fields) {
        if (node == null) {
            return null;
        }
        for (String f : fields) {
            JsonNode v = node.path(f);
            if (v.isObject()) {
                for (String inner : List.of("name", "label", "value", "displayName")) {
                    if (v.path(inner).isValueNode() && StringUtils.isNotBlank(v.path(inner).asText())) {
                        return v.path(inner).asText().trim();
                    }
                }
            } else if (v.isValueNode() && !v.isNull() && StringUtils.isNotBlank(v.asText())) {
                return v.asText().trim();
            }
        }
        return null;
    }
}
