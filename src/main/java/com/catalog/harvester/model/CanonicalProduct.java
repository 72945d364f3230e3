package com.catalog.harvester.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Site-independent representation of one product, ready for synchronisation.
 * <p>
 * A {@code null} {@link #variantMatrix} means a single-SKU product. Meta values
 * are plain strings; structured values (colour lists) are stored JSON-encoded.
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class CanonicalProduct {

    String siteId;

    String externalId;

    String title;

    String description;

    String slug;

    BigDecimal price;

    String currency;

    ProductStatus status;

    @Builder.Default
    List<ProductImage> images = List.of();

    VariantMatrix variantMatrix;

    @Builder.Default
    Map<String, String> meta = Map.of();

    String sourceUrl;

    public ProductKey key() {
        return new ProductKey(siteId, externalId);
    }

    public boolean isVariable() {
        return variantMatrix != null && !variantMatrix.isEmpty();
    }
}
