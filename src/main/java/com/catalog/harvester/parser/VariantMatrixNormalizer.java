package com.catalog.harvester.parser;

import com.catalog.harvester.model.ColorwayVariant;
import com.catalog.harvester.model.ProductImage;
import com.catalog.harvester.model.SizeVariant;
import com.catalog.harvester.model.Slugs;
import com.fasterxml.jackson.databind.JsonNode;
import org.apache.commons.lang3.StringUtils;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns raw colourway JSON (embedded state or render side channel) into {@link ColorwayVariant}s.
 *
 * <p>Field names differ per retailer, so every value is read from a list of candidates.
 * Prices may be numbers, strings or objects ({@code {"price": 45, "originalPrice": 60}}).</p>
 */
public class VariantMatrixNormalizer {

    private static final List<String> SIZE_FIELDS = List.of("size", "sizeLabel", "displaySize", "name");

    private static final List<String> SKU_FIELDS = List.of("id", "catentryId", "sku", "skuId", "partNumber");

    private static final List<String> AMOUNT_FIELDS = List.of(
            "price", "current", "currentPrice", "salePrice", "value", "amount");

    private static final List<String> ORIGINAL_FIELDS = List.of(
            "originalPrice", "wasPrice", "listPrice", "fullPrice", "initialPrice");

    private static final List<String> SWATCH_FIELDS = List.of("swatchUrl", "swatch", "swatchImage");

    private static final List<String> PAGE_FIELDS = List.of("url", "pdpUrl", "link", "href");

    private static final List<String> IMAGE_URL_FIELDS = List.of("url", "src", "href", "imageUrl");

    private static final List<String> IMAGE_ALT_FIELDS = List.of("alt", "altText", "title");

    public List<ColorwayVariant> fromColourways(final JsonNode colourways, final String currency) {
        List<ColorwayVariant> out = new ArrayList<>();
        if (colourways == null || !colourways.isArray()) {
            return out;
        }
        for (JsonNode cw : colourways) {
            ColorwayVariant normalized = normalizeColourway(cw, currency);
            if (normalized != null) {
                out.add(normalized);
            }
        }
        return out;
    }

    /**
     * @return the colourway, {@code null} when it has no colour label
     */
    public ColorwayVariant normalizeColourway(final JsonNode cw, final String currency) {
        String label = JsonShapeSearch.textOf(cw, JsonShapeSearch.COLOUR_FIELDS);
        if (label == null) {
            return null;
        }
        JsonNode priceNode = cw.path("price");
        BigDecimal base = amount(priceNode);
        BigDecimal original = firstAmount(priceNode, ORIGINAL_FIELDS);
        if (original == null) {
            original = firstAmount(cw, ORIGINAL_FIELDS);
        }
        BigDecimal discount = percent(cw.path("discountPercentage"));
        if (discount == null) {
            discount = PriceParser.discountPercent(base, original);
        }

        List<SizeVariant> sizes = new ArrayList<>();
        JsonNode variants = JsonShapeSearch.variantArray(cw);
        if (variants != null) {
            for (JsonNode v : variants) {
                String size = JsonShapeSearch.textOf(v, SIZE_FIELDS);
                if (size != null) {
                    sizes.add(new SizeVariant(size,
                            JsonShapeSearch.textOf(v, SKU_FIELDS),
                            stockOf(v),
                            amount(v.path("price"))));
                }
            }
        }

        String priceCurrency = JsonShapeSearch.textOf(priceNode, List.of("currency", "currencyCode"));
        return ColorwayVariant.builder()
                .colourLabel(label)
                .colourSlug(Slugs.slugify(label))
                .swatchUrl(absoluteImage(JsonShapeSearch.textOf(cw, SWATCH_FIELDS)))
                .pageUrl(JsonShapeSearch.textOf(cw, PAGE_FIELDS))
                .basePrice(base)
                .currency(priceCurrency != null ? priceCurrency : currency)
                .discountPercentage(discount)
                .images(images(cw.path("images")))
                .sizeVariants(sizes)
                .build();
    }

    /**
     * Side channel of the interactive renderer:
     * {@code {colour: {images, sizes: {available, unavailable}, price, discount_price, discount_percent}}}.
     * Sizes take the discounted price when there is one; the colourway keeps the list price.
     */
    public List<ColorwayVariant> fromSideChannel(final JsonNode side, final String currency) {
        List<ColorwayVariant> out = new ArrayList<>();
        if (side == null || !side.isObject()) {
            return out;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = side.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            String label = StringUtils.trimToNull(entry.getKey());
            JsonNode data = entry.getValue();
            if (label == null || !data.isObject()) {
                continue;
            }
            BigDecimal list = amount(data.path("price"));
            BigDecimal sale = amount(data.path("discount_price"));
            BigDecimal pct = percent(data.path("discount_percent"));
            if (pct == null) {
                pct = PriceParser.discountPercent(sale, list);
            }

            Map<String, SizeVariant> sizes = new LinkedHashMap<>();
            for (JsonNode s : data.path("sizes").path("available")) {
                if (StringUtils.isNotBlank(s.asText())) {
                    sizes.putIfAbsent(s.asText().trim(), new SizeVariant(s.asText().trim(), null, true, sale));
                }
            }
            for (JsonNode s : data.path("sizes").path("unavailable")) {
                if (StringUtils.isNotBlank(s.asText())) {
                    sizes.putIfAbsent(s.asText().trim(), new SizeVariant(s.asText().trim(), null, false, sale));
                }
            }

            out.add(ColorwayVariant.builder()
                    .colourLabel(label)
                    .colourSlug(Slugs.slugify(label))
                    .basePrice(list != null ? list : sale)
                    .currency(currency)
                    .discountPercentage(pct)
                    .images(images(data.path("images")))
                    .sizeVariants(new ArrayList<>(sizes.values()))
                    .build());
        }
        return out;
    }

    /* ---- value readers ------------------------------------------------ */

    /** Amount held by a number, a price string or a price object. */
    static BigDecimal amount(final JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        if (node.isTextual()) {
            return PriceParser.parse(node.asText());
        }
        if (node.isObject()) {
            return firstAmount(node, AMOUNT_FIELDS);
        }
        return null;
    }

    private static BigDecimal firstAmount(final JsonNode node, final List<String> fields) {
        for (String f : fields) {
            JsonNode v = node.path(f);
            if (v.isNumber() || v.isTextual()) {
                BigDecimal value = amount(v);
                if (value != null) {
                    return value;
                }
            }
        }
        return null;
    }

    private static BigDecimal percent(final JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        BigDecimal parsed = PriceParser.parsePercent(node.asText());
        return parsed != null ? parsed : PriceParser.parse(node.asText());
    }

    /**
     * Stock flag from a boolean, a count, or a status string such as {@code IN_STOCK},
     * {@code OUT_OF_STOCK} or {@code LOW_STOCK}. Missing means unavailable.
     */
    static boolean stockOf(final JsonNode variant) {
        for (String f : JsonShapeSearch.STOCK_FIELDS) {
            JsonNode v = variant.path(f);
            if (v.isBoolean()) {
                return v.booleanValue();
            }
            if (v.isNumber()) {
                return v.doubleValue() > 0;
            }
            if (v.isObject()) {
                v = v.path("status");
            }
            if (v.isTextual() && StringUtils.isNotBlank(v.asText())) {
                return stockText(v.asText());
            }
        }
        return false;
    }

    private static boolean stockText(final String raw) {
        String t = raw.toLowerCase(Locale.ROOT);
        if (t.contains("out") || t.contains("unavailable") || t.contains("sold")
                || t.contains("false") || t.startsWith("no")) {
            return false;
        }
        return t.contains("in_stock") || t.contains("instock") || t.contains("in stock")
                || t.contains("available") || t.contains("true") || t.contains("yes")
                || t.contains("low") || t.contains("limited");
    }

    static List<ProductImage> images(final JsonNode node) {
        List<ProductImage> out = new ArrayList<>();
        if (node == null || !node.isArray()) {
            return out;
        }
        for (JsonNode img : node) {
            String url = img.isTextual() ? img.asText() : JsonShapeSearch.textOf(img, IMAGE_URL_FIELDS);
            url = absoluteImage(url);
            if (url != null) {
                String alt = img.isObject() ? JsonShapeSearch.textOf(img, IMAGE_ALT_FIELDS) : null;
                out.add(ProductImage.of(url, alt));
            }
        }
        return ImageSets.dedupe(out);
    }

    private static String absoluteImage(final String url) {
        if (StringUtils.isBlank(url)) {
            return null;
        }
        String trimmed = url.trim();
        return trimmed.startsWith("//") ? "https:" + trimmed : trimmed;
    }
}
