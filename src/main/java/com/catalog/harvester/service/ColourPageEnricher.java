package com.catalog.harvester.service;

import com.catalog.harvester.config.SiteCfg;
import com.catalog.harvester.fetch.FetchEngine;
import com.catalog.harvester.model.CanonicalProduct;
import com.catalog.harvester.model.ColorwayVariant;
import com.catalog.harvester.model.FetchResult;
import com.catalog.harvester.model.ProductImage;
import com.catalog.harvester.model.SizeVariant;
import com.catalog.harvester.model.Slugs;
import com.catalog.harvester.parser.HtmlFieldExtractor;
import com.catalog.harvester.parser.ProductExtractor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Second pass over a product: fetches the pages of its other colours to pick up their images
 * and, where the detail page only listed a link, their sizes.
 * <p>
 * Candidate pages are the {@code pageUrl} of colourways that came without images plus the
 * colour links found on the detail page. Failed pages are skipped.
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ColourPageEnricher {

    private final FetchEngine fetchEngine;

    private final ProductExtractor productExtractor;

    public CanonicalProduct enrich(final CanonicalProduct product, final Document detail, final SiteCfg site) {
        List<ColorwayVariant> colourways = product.isVariable()
                ? new ArrayList<>(product.getVariantMatrix().colourways())
                : new ArrayList<>();

        Set<String> pages = new LinkedHashSet<>();
        colourways.stream()
                .filter(cw -> cw.getImages().isEmpty())
                .map(ColorwayVariant::getPageUrl)
                .filter(StringUtils::isNotBlank)
                .forEach(pages::add);
        if (detail != null) {
            pages.addAll(new HtmlFieldExtractor(detail, site.getSelectors()).colourLinks());
        }
        pages.remove(product.getSourceUrl());
        if (pages.isEmpty()) {
            return product;
        }

        Map<String, FetchResult> results = fetchEngine.fetchBatch(pages, Math.max(1, site.getColourPageConcurrency()));
        List<ProductImage> extraImages = new ArrayList<>();
        int used = 0;
        for (Map.Entry<String, FetchResult> e : results.entrySet()) {
            FetchResult result = e.getValue();
            if (!result.isSuccess()) {
                log.debug("Colour page {} skipped: {}", e.getKey(), Objects.toString(result.error(), "HTTP " + result.statusCode()));
                continue;
            }
            Document page = Jsoup.parse(result.body(), result.finalUrl());
            HtmlFieldExtractor html = new HtmlFieldExtractor(page, site.getSelectors());
            ColorwayVariant found = colourwayOf(html, e.getKey(), product.getCurrency());
            if (found == null) {
                extraImages.addAll(html.images());
                continue;
            }
            used++;
            if (!merge(colourways, found)) {
                extraImages.addAll(found.getImages());
            }
        }
        log.debug("Colour pages of {}: {}/{} used", product.getExternalId(), used, results.size());
        return productExtractor.rebuild(product, colourways, extraImages);
    }

    private static ColorwayVariant colourwayOf(final HtmlFieldExtractor html, final String pageUrl, final String currency) {
        String label = html.colourLabel();
        if (StringUtils.isBlank(label)) {
            return null;
        }
        List<SizeVariant> sizes = html.sizes();
        return ColorwayVariant.builder()
                .colourLabel(label)
                .colourSlug(Slugs.slugify(label))
                .pageUrl(pageUrl)
                .basePrice(html.price())
                .currency(currency)
                .discountPercentage(html.discountPercent())
                .images(html.images())
                .sizeVariants(sizes)
                .build();
    }

    /**
     * Same colour: images and missing sizes are merged in. A new colour is appended when it has sizes.
     *
     * @return {@code false} when the colourway was not kept
     */
    private static boolean merge(final List<ColorwayVariant> colourways, final ColorwayVariant found) {
        Map<String, Integer> byLabel = new LinkedHashMap<>();
        for (int i = 0; i < colourways.size(); i++) {
            byLabel.putIfAbsent(colourways.get(i).getColourLabel().trim().toLowerCase(Locale.ROOT), i);
        }
        Integer at = byLabel.get(found.getColourLabel().trim().toLowerCase(Locale.ROOT));
        if (at != null) {
            colourways.set(at, colourways.get(at).mergeWith(found));
            return true;
        }
        if (found.getSizeVariants().isEmpty()) {
            return false;
        }
        colourways.add(found);
        return true;
    }
}
