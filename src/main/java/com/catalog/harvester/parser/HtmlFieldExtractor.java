package com.catalog.harvester.parser;

import com.catalog.harvester.config.SiteCfg;
import com.catalog.harvester.model.ProductImage;
import com.catalog.harvester.model.SizeVariant;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.jsoup.select.Selector;

import java.math.BigDecimal;
import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Field-by-field DOM extraction with explicit fallback chains.
 *
 * <p>Every accessor tries the site's configured selectors in order, then a generic
 * heuristic, and degrades to {@code null} (or an empty list) instead of throwing. A broken
 * selector in the site profile is logged and skipped.</p>
 */
@Slf4j
public class HtmlFieldExtractor {

    private static final List<String> GENERIC_TITLE = List.of(
            "meta[property=\"og:title\"]", "h1", "title");

    private static final List<String> GENERIC_DESCRIPTION = List.of(
            "meta[property=\"og:description\"]", "meta[name=description]");

    private static final List<String> GENERIC_PRICE = List.of(
            "[itemprop=price]", "meta[property=\"product:price:amount\"]",
            "[data-testid*=price]", "[class*=sale-price]", "[class*=price]");

    private static final List<String> GENERIC_ORIGINAL_PRICE = List.of(
            "[data-testid=initialPrice-container]", "s", "del", "[class*=strike]", "[class*=original-price]");

    private static final List<String> GENERIC_IMAGES = List.of(
            "meta[property=\"og:image\"]");

    private static final Pattern SRCSET_FIRST = Pattern.compile("^\\s*(\\S+)");

    private final Document doc;

    private final SiteCfg.Selectors selectors;

    public HtmlFieldExtractor(final Document doc, final SiteCfg.Selectors selectors) {
        this.doc = doc;
        this.selectors = selectors;
    }

    public String title() {
        return firstText(selectors.getTitle(), GENERIC_TITLE);
    }

    public String description() {
        return firstText(selectors.getDescription(), GENERIC_DESCRIPTION);
    }

    /** Current (possibly discounted) price, restricted to plausible amounts. */
    public BigDecimal price() {
        return firstMatch(concat(selectors.getPrice(), GENERIC_PRICE),
                el -> PriceParser.parsePlausible(textOrContent(el)));
    }

    /** Raw text of the price element, used for currency detection. */
    public String priceText() {
        return firstText(selectors.getPrice(), GENERIC_PRICE);
    }

    /** List price shown struck through next to a sale price. */
    public BigDecimal originalPrice() {
        return firstMatch(concat(selectors.getOriginalPrice(), GENERIC_ORIGINAL_PRICE),
                el -> PriceParser.parsePlausible(textOrContent(el)));
    }

    /** Discount badge ("-30%"), when the page shows one. */
    public BigDecimal discountPercent() {
        return firstMatch(selectors.getDiscount(), el -> PriceParser.parsePercent(el.text()));
    }

    public List<ProductImage> images() {
        List<ProductImage> out = new ArrayList<>();
        for (String selector : concat(selectors.getImages(), GENERIC_IMAGES)) {
            for (Element el : select(selector)) {
                String url = imageUrl(el);
                if (url != null) {
                    out.add(ProductImage.of(url, StringUtils.trimToNull(el.attr("alt"))));
                }
            }
            if (!out.isEmpty()) {
                return ImageSets.dedupe(out);
            }
        }
        return out;
    }

    /**
     * Size buttons of the current colour. An element (or an ancestor up to two levels)
     * matching the disabled selector is out of stock.
     */
    public List<SizeVariant> sizes() {
        for (String selector : selectors.getSizes()) {
            Map<String, SizeVariant> found = new LinkedHashMap<>();
            for (Element el : select(selector)) {
                String label = StringUtils.trimToNull(StringUtils.defaultIfBlank(el.text(), el.attr("aria-label")));
                if (label != null) {
                    found.putIfAbsent(label, SizeVariant.of(label, !isDisabled(el)));
                }
            }
            if (!found.isEmpty()) {
                return new ArrayList<>(found.values());
            }
        }
        return List.of();
    }

    public String colourLabel() {
        return firstText(selectors.getColourLabel(), List.of());
    }

    /** Absolute URLs of sibling colour pages. */
    public List<String> colourLinks() {
        List<String> out = new ArrayList<>();
        for (String selector : selectors.getColourLinks()) {
            for (Element el : select(selector)) {
                String href = el.absUrl("href");
                if (StringUtils.isNotBlank(href) && !out.contains(href)) {
                    out.add(href);
                }
            }
            if (!out.isEmpty()) {
                break;
            }
        }
        return out;
    }

    /** Product id from the configured selectors (attribute {@code content}, {@code data-*} or text). */
    public String externalId() {
        return firstText(selectors.getExternalId(), List.of());
    }

    /** Whether the single-SKU out-of-stock marker is present. */
    public boolean outOfStock() {
        return StringUtils.isNotBlank(selectors.getOutOfStock()) && !select(selectors.getOutOfStock()).isEmpty();
    }

    /* ---- helpers ---------------------------------------------------- */

    /**
     * Product id from the URL: group 1 of {@code pattern} when it matches, else the last
     * path segment without extension.
     */
    public static String idFromUrl(final String url, final String pattern) {
        if (StringUtils.isBlank(url)) {
            return null;
        }
        if (StringUtils.isNotBlank(pattern)) {
            Matcher m = Pattern.compile(pattern).matcher(url);
            if (m.find() && m.groupCount() >= 1) {
                return m.group(1);
            }
        }
        try {
            String path = URI.create(url).getPath();
            String last = StringUtils.substringAfterLast(StringUtils.removeEnd(path, "/"), "/");
            return StringUtils.trimToNull(StringUtils.substringBefore(last, "."));
        } catch (IllegalArgumentException ex) {
            return null;
        }
    }

    private String firstText(final List<String> configured, final List<String> generic) {
        return firstMatch(concat(configured, generic), el -> StringUtils.trimToNull(textOrContent(el)));
    }

    private <T> T firstMatch(final List<String> chain, final Function<Element, T> reader) {
        for (String selector : chain) {
            for (Element el : select(selector)) {
                T value = reader.apply(el);
                if (value != null) {
                    return value;
                }
            }
        }
        return null;
    }

    private Elements select(final String selector) {
        if (StringUtils.isBlank(selector)) {
            return new Elements();
        }
        try {
            return doc.select(selector);
        } catch (Selector.SelectorParseException ex) {
            log.debug("Invalid selector '{}': {}", selector, ex.getMessage());
            return new Elements();
        }
    }

    private boolean isDisabled(final Element el) {
        String disabled = selectors.getDisabledSize();
        if (StringUtils.isBlank(disabled)) {
            return false;
        }
        try {
            Element cursor = el;
            for (int i = 0; i < 3 && cursor != null; i++) {
                if (cursor.is(disabled)) {
                    return true;
                }
                cursor = cursor.parent();
            }
        } catch (Selector.SelectorParseException ex) {
            log.debug("Invalid disabled-size selector '{}': {}", disabled, ex.getMessage());
        }
        return false;
    }

    private static String textOrContent(final Element el) {
        if (el.hasAttr("content")) {
            return el.attr("content");
        }
        if ("title".equals(el.tagName())) {
            return el.text();
        }
        String text = el.text();
        if (StringUtils.isBlank(text)) {
            for (String attr : List.of("value", "data-value", "data-id", "data-product-id")) {
                if (el.hasAttr(attr)) {
                    return el.attr(attr);
                }
            }
        }
        return text;
    }

    private static String imageUrl(final Element el) {
        if (el.hasAttr("content")) {
            return StringUtils.trimToNull(el.absUrl("content").isEmpty() ? el.attr("content") : el.absUrl("content"));
        }
        for (String attr : List.of("src", "data-src", "data-original")) {
            String url = el.absUrl(attr);
            if (StringUtils.isNotBlank(url) && !url.startsWith("data:")) {
                return url;
            }
        }
        for (String attr : List.of("srcset", "data-srcset")) {
            if (el.hasAttr(attr)) {
                Matcher m = SRCSET_FIRST.matcher(el.attr(attr));
                if (m.find()) {
                    return m.group(1);
                }
            }
        }
        return null;
    }

    private static List<String> concat(final List<String> first, final List<String> second) {
        List<String> all = new ArrayList<>(first);
        all.addAll(second);
        return all;
    }
}
