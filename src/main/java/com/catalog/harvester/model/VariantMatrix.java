package com.catalog.harvester.model;

import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Ordered colour&nbsp;&times;&nbsp;size matrix of a variable product.
 *
 * <p>Instances are only created through {@link #of(List)}, which enforces:</p>
 * <ul>
 *   <li>every colourway has at least one size, empty ones are dropped;</li>
 *   <li>colour labels are unique, later duplicates (case-insensitive) are merged into the first.</li>
 * </ul>
 */
public final class VariantMatrix {

    private final List<ColorwayVariant> colourways;

    private VariantMatrix(final List<ColorwayVariant> colourways) {
        this.colourways = Collections.unmodifiableList(colourways);
    }

    public static VariantMatrix of(final List<ColorwayVariant> raw) {
        Map<String, ColorwayVariant> byLabel = new LinkedHashMap<>();
        for (ColorwayVariant cw : raw) {
            if (cw == null || StringUtils.isBlank(cw.getColourLabel())) {
                continue;
            }
            String key = cw.getColourLabel().trim().toLowerCase();
            byLabel.merge(key, cw, ColorwayVariant::mergeWith);
        }
        List<ColorwayVariant> kept = new ArrayList<>();
        for (ColorwayVariant cw : byLabel.values()) {
            if (!cw.getSizeVariants().isEmpty()) {
                kept.add(cw);
            }
        }
        return new VariantMatrix(kept);
    }

    public List<ColorwayVariant> colourways() {
        return colourways;
    }

    public boolean isEmpty() {
        return colourways.isEmpty();
    }

    public int sizeVariantCount() {
        return colourways.stream().mapToInt(c -> c.getSizeVariants().size()).sum();
    }

    public boolean anyInStock() {
        return colourways.stream().anyMatch(ColorwayVariant::anyInStock);
    }

    public List<String> colourLabels() {
        return colourways.stream().map(ColorwayVariant::getColourLabel).toList();
    }

    /** Distinct size labels across all colourways, first-seen order. */
    public Set<String> distinctSizes() {
        Set<String> sizes = new LinkedHashSet<>();
        colourways.forEach(c -> c.getSizeVariants().forEach(s -> sizes.add(s.size())));
        return sizes;
    }
}
