package com.catalog.harvester.sync;

import com.catalog.harvester.model.CanonicalProduct;
import com.catalog.harvester.model.ColorwayVariant;
import com.catalog.harvester.model.ProductStatus;
import com.catalog.harvester.model.SizeVariant;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Builds WooCommerce product and variation payloads from canonical products.
 */
@Component
public class ProductPayloadBuilder {

    /** Meta keys that only feed the payload itself and are not copied to {@code meta_data}. */
    private static final List<String> INTERNAL_META = List.of("description_translated");

    private final PricingPolicy pricing;

    private final ProductWeightDetector weights;

    private final ObjectMapper mapper;

    public ProductPayloadBuilder(final PricingPolicy pricing,
                                 final ProductWeightDetector weights,
                                 @Qualifier("harvesterObjectMapper") final ObjectMapper mapper) {
        this.pricing = pricing;
        this.weights = weights;
        this.mapper = mapper;
    }

    /**
     * @param images      entries of the {@code images} array, already resolved to {@code {id}} or {@code {src}}
     * @param categoryIds remote category ids, may be empty
     * @param attributes  colour/size attributes, {@code null} for a simple product
     */
    public ObjectNode product(final CanonicalProduct product,
                              final List<ObjectNode> images,
                              final List<Long> categoryIds,
                              final AttributeTermResolver.ProductAttributes attributes) {
        boolean variable = attributes != null && product.isVariable();
        Map<String, String> meta = product.getMeta();

        ObjectNode p = mapper.createObjectNode();
        p.put("name", product.getTitle());
        if (StringUtils.isNotBlank(product.getSlug())) {
            p.put("slug", product.getSlug());
        }
        p.put("description", StringUtils.defaultIfBlank(meta.get("description_translated"),
                Objects.toString(product.getDescription(), "")));
        p.put("type", variable ? "variable" : "simple");
        p.put("status", remoteStatus(product.getStatus()));
        p.put("sku", product.getExternalId());
        p.put("weight", weight(product));

        if (variable) {
            p.put("manage_stock", false);
            p.set("attributes", attributes.payload());
        } else {
            String price = pricing.format(product.getPrice(), meta);
            if (price != null) {
                p.put("regular_price", price);
            }
            p.put("stock_status", product.getStatus() == ProductStatus.OUT_OF_STOCK ? "outofstock" : "instock");
        }

        if (!images.isEmpty()) {
            p.putArray("images").addAll(images);
        }
        if (!categoryIds.isEmpty()) {
            ArrayNode cats = p.putArray("categories");
            categoryIds.forEach(id -> cats.addObject().put("id", id));
        }
        p.set("meta_data", metaData(product));
        return p;
    }

    /**
     * @param mediaId remote image of the colourway, {@code null} when none could be uploaded
     */
    public ObjectNode variation(final CanonicalProduct product,
                                final ColorwayVariant colourway,
                                final SizeVariant size,
                                final AttributeTermResolver.ProductAttributes attributes,
                                final Long mediaId) {
        ObjectNode v = mapper.createObjectNode();
        ArrayNode attrs = v.putArray("attributes");
        attrs.addObject().put("id", attributes.colourAttributeId()).put("option", colourway.getColourLabel());
        attrs.addObject().put("id", attributes.sizeAttributeId()).put("option", size.size());

        BigDecimal source = colourway.resolvePrice(size);
        String price = pricing.format(source != null ? source : product.getPrice(), product.getMeta());
        if (price != null) {
            v.put("regular_price", price);
        }
        v.put("sku", StringUtils.isNotBlank(size.sku())
                ? size.sku()
                : fallbackSku(product.getExternalId(), colourway.getColourLabel(), size.size()));
        v.put("weight", weight(product));
        v.put("manage_stock", true);
        v.put("stock_quantity", size.stockAvailable() ? 1 : 0);
        v.put("stock_status", size.stockAvailable() ? "instock" : "outofstock");
        if (mediaId != null) {
            v.putObject("image").put("id", mediaId);
        }
        return v;
    }

    /** {@code externalId-COL-size}, COL being the first three letters of the colour, upper-cased. */
    static String fallbackSku(final String externalId, final String colour, final String size) {
        String col = StringUtils.left(StringUtils.deleteWhitespace(colour), 3).toUpperCase(Locale.ROOT);
        return externalId + "-" + col + "-" + StringUtils.deleteWhitespace(size);
    }

    static String remoteStatus(final ProductStatus status) {
        return status == ProductStatus.PUBLISHED ? "publish" : "draft";
    }

    private String weight(final CanonicalProduct product) {
        return weights.detect(product.getTitle()).stripTrailingZeros().toPlainString();
    }

    private ArrayNode metaData(final CanonicalProduct product) {
        ArrayNode meta = mapper.createArrayNode();
        product.getMeta().forEach((key, value) -> {
            if (!INTERNAL_META.contains(key) && value != null) {
                meta.addObject().put("key", key).put("value", value);
            }
        });
        if (StringUtils.isNotBlank(product.getSourceUrl())) {
            meta.addObject().put("key", "weblink").put("value", product.getSourceUrl());
        }
        return meta;
    }
}
