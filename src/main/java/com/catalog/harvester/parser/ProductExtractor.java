package com.catalog.harvester.parser;

import com.catalog.harvester.config.SiteCfg;
import com.catalog.harvester.exception.MalformedSourceException;
import com.catalog.harvester.model.CanonicalProduct;
import com.catalog.harvester.model.ColorwayVariant;
import com.catalog.harvester.model.ProductImage;
import com.catalog.harvester.model.ProductStatus;
import com.catalog.harvester.model.SizeVariant;
import com.catalog.harvester.model.Slugs;
import com.catalog.harvester.model.VariantMatrix;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * <h2>Extractor / Normalizer</h2>
 *
 * <p>Builds a {@link CanonicalProduct} from a detail page (HTML, optionally carrying an
 * embedded JSON state blob) or from a JSON detail document. Pure CPU work: no I/O.</p>
 *
 * <h3>Sources, by authority</h3>
 * <ol>
 *   <li>render side channel: per-colour sizes, prices and images revealed by clicking
 *       through swatches;</li>
 *   <li>embedded state: colourways located by {@link JsonShapeSearch}, flat variants grouped
 *       by colour, related products as extra colourways;</li>
 *   <li>DOM: configured selector chains, then generic heuristics.</li>
 * </ol>
 * <p>When two sources describe the same colour, the first one wins and later ones only
 * contribute sizes and images it lacks.</p>
 *
 * <h3>Guarantees</h3>
 * <ul>
 *   <li>the external id is always set, or a {@link MalformedSourceException} is thrown;</li>
 *   <li>a variant matrix is either absent (single-SKU product) or non-empty, every colourway
 *       has at least one size and colour labels are unique;</li>
 *   <li>images are unique by URL, first-seen order, the first one primary;</li>
 *   <li>status is {@code out_of_stock} only when no size at all is available.</li>
 * </ul>
 */
@Slf4j
@Component
public class ProductExtractor {

    static final String DEFAULT_COLOUR = "Default";

    private static final List<String> NAME_FIELDS = List.of("name", "title", "displayName");

    private static final List<String> DESCRIPTION_FIELDS = List.of("description", "longDescription", "shortDescription");

    private static final List<String> PRODUCT_ID_FIELDS = List.of("productId", "id", "partNumber", "styleCode");

    private static final List<String> BRAND_FIELDS = List.of("brand", "brandName");

    private final ObjectMapper mapper;

    private final JsonShapeSearch shapes;

    private final VariantMatrixNormalizer normalizer = new VariantMatrixNormalizer();

    public ProductExtractor(@Qualifier("harvesterObjectMapper") final ObjectMapper mapper) {
        this.mapper = mapper;
        this.shapes = new JsonShapeSearch(mapper);
    }

    /**
     * @param body HTML page or JSON document
     * @param ctx  page context
     * @return the normalised product
     * @throws MalformedSourceException when no external id can be recovered
     */
    public CanonicalProduct extract(final String body, final ExtractionContext ctx) {
        if (StringUtils.isBlank(body)) {
            throw new MalformedSourceException("Empty body for " + ctx.url());
        }
        SiteCfg site = ctx.site();
        String pageUrl = ctx.pageUrl();

        boolean jsonBody = looksLikeJson(body);
        Document doc = jsonBody ? Document.createShell(pageUrl) : Jsoup.parse(body, pageUrl);
        JsonNode state = jsonBody ? readJson(body) : shapes.readEmbeddedState(doc, site.getEmbedded().getScriptSelector());
        JsonNode current = state == null ? null : shapes.findCurrentProduct(state, site.getEmbedded());
        HtmlFieldExtractor html = new HtmlFieldExtractor(doc, site.getSelectors());

        String externalId = firstNonBlank(
                html.externalId(),
                JsonShapeSearch.textOf(current, PRODUCT_ID_FIELDS),
                HtmlFieldExtractor.idFromUrl(pageUrl, site.getSelectors().getExternalIdUrlPattern()));
        if (externalId == null) {
            throw new MalformedSourceException("No product id found on " + pageUrl);
        }

        String title = firstNonBlank(
                JsonShapeSearch.textOf(current, NAME_FIELDS),
                html.title(),
                StringUtils.capitalize(Slugs.slugify(externalId).replace('-', ' ')));
        String description = firstNonBlank(JsonShapeSearch.textOf(current, DESCRIPTION_FIELDS), html.description());

        String jsonCurrency = current == null ? null
                : JsonShapeSearch.textOf(current.path("price"), List.of("currency", "currencyCode"));
        String currency = jsonCurrency != null ? jsonCurrency
                : PriceParser.detectCurrency(html.priceText(), site.getCurrency());

        BigDecimal domPrice = html.price();
        List<ColorwayVariant> colourways = new ArrayList<>();
        if (ctx.sideChannel() != null) {
            colourways.addAll(normalizer.fromSideChannel(ctx.sideChannel(), currency));
        }
        if (state != null) {
            colourways.addAll(embeddedColourways(state, current, site.getEmbedded(), currency));
        }
        if (colourways.isEmpty()) {
            List<SizeVariant> domSizes = html.sizes();
            if (!domSizes.isEmpty()) {
                colourways.add(ColorwayVariant.builder()
                        .colourLabel(StringUtils.defaultIfBlank(html.colourLabel(), DEFAULT_COLOUR))
                        .colourSlug(Slugs.slugify(StringUtils.defaultIfBlank(html.colourLabel(), DEFAULT_COLOUR)))
                        .pageUrl(pageUrl)
                        .basePrice(domPrice)
                        .currency(currency)
                        .images(html.images())
                        .sizeVariants(domSizes)
                        .build());
            }
        }
        VariantMatrix matrix = colourways.isEmpty() ? null : VariantMatrix.of(colourways);
        if (matrix != null && matrix.isEmpty()) {
            log.debug("Variant data on {} had no sizes, treating as single-SKU", pageUrl);
            matrix = null;
        }

        BigDecimal price = firstNonNull(
                current == null ? null : VariantMatrixNormalizer.amount(current.path("price")),
                domPrice,
                firstMatrixPrice(matrix));
        BigDecimal original = html.originalPrice();
        BigDecimal discount = firstNonNull(html.discountPercent(), PriceParser.discountPercent(price, original));

        List<ProductImage> images = ImageSets.merge(
                current == null ? List.of() : VariantMatrixNormalizer.images(current.path("images")),
                html.images(),
                colourwayImages(matrix));

        Map<String, String> meta = new LinkedHashMap<>(site.getMeta());
        putIfNotBlank(meta, "brand", firstNonBlank(site.getBrand(), JsonShapeSearch.textOf(current, BRAND_FIELDS)));
        if (discount != null && !meta.containsKey("discount")) {
            meta.put("discount", discount.stripTrailingZeros().toPlainString());
        }
        if (original != null) {
            meta.put("original_price", original.toPlainString());
        }
        putColourMeta(meta, matrix);

        ProductStatus status = statusOf(matrix, html.outOfStock());
        log.debug("Extracted {} '{}' from {}: {} colourways, {} sizes, status {}",
                externalId, title, pageUrl, matrix == null ? 0 : matrix.colourways().size(),
                matrix == null ? 0 : matrix.sizeVariantCount(), status.value());

        return CanonicalProduct.builder()
                .siteId(ctx.siteId())
                .externalId(externalId)
                .title(title)
                .description(description)
                .slug(StringUtils.defaultIfBlank(Slugs.slugify(title), Slugs.slugify(externalId)))
                .price(price)
                .currency(currency)
                .status(status)
                .images(images)
                .variantMatrix(matrix)
                .meta(meta)
                .sourceUrl(ctx.url())
                .build();
    }

    /**
     * Re-applies the matrix rules after colourways or images were added from other pages.
     *
     * @param product     product as first extracted
     * @param colourways  full colourway list (existing ones first)
     * @param extraImages images found on other pages
     * @return the updated product
     */
    public CanonicalProduct rebuild(final CanonicalProduct product,
                                    final List<ColorwayVariant> colourways,
                                    final List<ProductImage> extraImages) {
        VariantMatrix matrix = colourways.isEmpty() ? product.getVariantMatrix() : VariantMatrix.of(colourways);
        if (matrix != null && matrix.isEmpty()) {
            matrix = null;
        }
        Map<String, String> meta = new LinkedHashMap<>(product.getMeta());
        putColourMeta(meta, matrix);
        return product.toBuilder()
                .variantMatrix(matrix)
                .status(matrix == null ? product.getStatus() : statusOf(matrix, false))
                .images(ImageSets.merge(product.getImages(), extraImages, colourwayImages(matrix)))
                .meta(meta)
                .build();
    }

    /* ---- embedded state ------------------------------------------------- */

    private List<ColorwayVariant> embeddedColourways(final JsonNode state, final JsonNode current,
                                                     final SiteCfg.Embedded cfg, final String currency) {
        List<ColorwayVariant> out = new ArrayList<>();
        JsonNode colourways = shapes.findColourways(state, cfg);
        if (colourways != null) {
            out.addAll(normalizer.fromColourways(colourways, currency));
        } else if (current != null) {
            JsonNode flat = JsonShapeSearch.variantArray(current);
            if (flat != null) {
                out.addAll(normalizer.fromColourways(shapes.groupVariantsByColour(flat), currency));
            }
        }

        if (cfg.isRelatedAsColourways()) {
            JsonNode related = shapes.findRelatedProducts(state, cfg);
            if (related != null) {
                for (JsonNode product : related) {
                    out.addAll(relatedColourways(product, currency));
                }
            }
        }
        return out;
    }

    private List<ColorwayVariant> relatedColourways(final JsonNode product, final String currency) {
        for (String field : List.of("colourways", "colorways")) {
            if (JsonShapeSearch.looksLikeColourways(product.path(field))) {
                return normalizer.fromColourways(product.path(field), currency);
            }
        }
        JsonNode variants = JsonShapeSearch.variantArray(product);
        if (variants == null) {
            return List.of();
        }
        if (JsonShapeSearch.textOf(product, JsonShapeSearch.COLOUR_FIELDS) != null) {
            ColorwayVariant cw = normalizer.normalizeColourway(product, currency);
            return cw == null ? List.of() : List.of(cw);
        }
        return normalizer.fromColourways(shapes.groupVariantsByColour(variants), currency);
    }

    /* ---- helpers ------------------------------------------------------ */

    static ProductStatus statusOf(final VariantMatrix matrix, final boolean outOfStockMarker) {
        if (matrix != null) {
            return matrix.anyInStock() ? ProductStatus.PUBLISHED : ProductStatus.OUT_OF_STOCK;
        }
        return outOfStockMarker ? ProductStatus.OUT_OF_STOCK : ProductStatus.PUBLISHED;
    }

    private void putColourMeta(final Map<String, String> meta, final VariantMatrix matrix) {
        if (matrix == null) {
            return;
        }
        Map<String, List<String>> sizesByColour = new LinkedHashMap<>();
        for (ColorwayVariant cw : matrix.colourways()) {
            sizesByColour.put(cw.getColourLabel(), cw.getSizeVariants().stream()
                    .filter(SizeVariant::stockAvailable)
                    .map(SizeVariant::size)
                    .collect(Collectors.toList()));
        }
        try {
            meta.put("available_colours", mapper.writeValueAsString(matrix.colourLabels()));
            meta.put("available_sizes_by_colour", mapper.writeValueAsString(sizesByColour));
        } catch (JsonProcessingException ex) {
            log.warn("Could not encode colour meta: {}", ex.getOriginalMessage());
        }
    }

    private static List<ProductImage> colourwayImages(final VariantMatrix matrix) {
        if (matrix == null) {
            return List.of();
        }
        return matrix.colourways().stream()
                .map(ColorwayVariant::getImages)
                .flatMap(Collection::stream)
                .toList();
    }

    private static BigDecimal firstMatrixPrice(final VariantMatrix matrix) {
        if (matrix == null) {
            return null;
        }
        for (ColorwayVariant cw : matrix.colourways()) {
            for (SizeVariant size : cw.getSizeVariants()) {
                BigDecimal resolved = cw.resolvePrice(size);
                if (resolved != null) {
                    return resolved;
                }
            }
        }
        return null;
    }

    private JsonNode readJson(final String body) {
        try {
            return mapper.readTree(body);
        } catch (JsonProcessingException ex) {
            log.debug("Body looked like JSON but did not parse: {}", ex.getOriginalMessage());
            return null;
        }
    }

    private static boolean looksLikeJson(final String body) {
        String head = StringUtils.stripStart(body, null);
        return head.startsWith("{") || head.startsWith("[");
    }

    private static void putIfNotBlank(final Map<String, String> meta, final String key, final String value) {
        if (StringUtils.isNotBlank(value)) {
            meta.put(key, value);
        }
    }

    private static String firstNonBlank(final String... values) {
        String found = StringUtils.firstNonBlank(values);
        return found == null ? null : found.trim();
    }

    @SafeVarargs
    private static <T> T firstNonNull(final T... values) {
        for (T v : values) {
            if (v != null) {
                return v;
            }
        }
        return null;
    }
}
