package com.catalog.harvester.model;

import java.math.BigDecimal;

/**
 * One size of one colourway.
 *
 * @param size           size label as shown by the retailer ("M", "10.5", "W30 L32")
 * @param sku            retailer SKU, may be {@code null}
 * @param stockAvailable whether the size can be bought
 * @param price          per-size price, overrides the colourway base price when present
 */
public record SizeVariant(String size, String sku, boolean stockAvailable, BigDecimal price) {

    public static SizeVariant of(final String size, final boolean stockAvailable) {
        return new SizeVariant(size, null, stockAvailable, null);
    }
}
