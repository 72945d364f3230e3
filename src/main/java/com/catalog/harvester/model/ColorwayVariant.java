package com.catalog.harvester.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One colour option of a product together with its sizes and imagery.
 */
@Value
@Builder(toBuilder = true)
public class ColorwayVariant {

    String colourLabel;

    String colourSlug;

    String swatchUrl;

    /** Detail page dedicated to this colour, when the retailer has one. */
    String pageUrl;

    BigDecimal basePrice;

    String currency;

    BigDecimal discountPercentage;

    @Builder.Default
    List<ProductImage> images = List.of();

    @Builder.Default
    List<SizeVariant> sizeVariants = List.of();

    /**
     * Price of the given size: its own price when present, else this colourway's base price.
     *
     * @param size a size of this colourway
     * @return the resolved price, {@code null} when neither is known
     */
    public BigDecimal resolvePrice(final SizeVariant size) {
        return size.price() != null ? size.price() : basePrice;
    }

    public boolean anyInStock() {
        return sizeVariants.stream().anyMatch(SizeVariant::stockAvailable);
    }

    /**
     * Folds a later duplicate of the same colour into this one: sizes not yet
     * present are appended, images are appended, missing scalars are filled in.
     *
     * @param other colourway with the same label
     * @return the merged colourway
     */
    public ColorwayVariant mergeWith(final ColorwayVariant other) {
        Map<String, SizeVariant> sizes = new LinkedHashMap<>();
        sizeVariants.forEach(s -> sizes.put(s.size(), s));
        other.getSizeVariants().forEach(s -> sizes.putIfAbsent(s.size(), s));

        List<ProductImage> merged = new ArrayList<>(images);
        merged.addAll(other.getImages());

        return toBuilder()
                .swatchUrl(swatchUrl != null ? swatchUrl : other.getSwatchUrl())
                .pageUrl(pageUrl != null ? pageUrl : other.getPageUrl())
                .basePrice(basePrice != null ? basePrice : other.getBasePrice())
                .currency(currency != null ? currency : other.getCurrency())
                .discountPercentage(discountPercentage != null
                        ? discountPercentage : other.getDiscountPercentage())
                .images(List.copyOf(merged))
                .sizeVariants(List.copyOf(sizes.values()))
                .build();
    }
}
