package com.catalog.harvester.parser;

import com.catalog.harvester.model.ProductImage;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Image list helpers: de-duplication by URL in first-seen order, primary flag on the first survivor.
 */
public final class ImageSets {

    private ImageSets() {
    }

    public static List<ProductImage> dedupe(final Collection<ProductImage> images) {
        Map<String, ProductImage> byUrl = new LinkedHashMap<>();
        for (ProductImage image : images) {
            if (image != null && StringUtils.isNotBlank(image.url())) {
                byUrl.putIfAbsent(image.url(), image);
            }
        }
        List<ProductImage> out = new ArrayList<>(byUrl.size());
        for (ProductImage image : byUrl.values()) {
            out.add(image.withPrimary(out.isEmpty()));
        }
        return out;
    }

    @SafeVarargs
    public static List<ProductImage> merge(final Collection<ProductImage>... parts) {
        List<ProductImage> all = new ArrayList<>();
        for (Collection<ProductImage> part : parts) {
            all.addAll(part);
        }
        return dedupe(all);
    }
}
