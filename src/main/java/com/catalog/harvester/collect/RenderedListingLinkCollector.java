package com.catalog.harvester.collect;

import com.catalog.harvester.config.SiteCfg;
import com.catalog.harvester.render.PageRenderer;
import com.catalog.harvester.render.RenderException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * <h2>Rendered HTML listing collector</h2>
 *
 * <p>For listings that only reveal their products through JavaScript:</p>
 * <ol>
 *   <li>render the seed page, waiting for the result counter ("44 of 306");</li>
 *   <li>re-render with the item-count parameter set to the total, leaving it to the render
 *       worker to lazy-scroll until every tile is present;</li>
 *   <li>collect product links through the configured selector chain, falling back to any
 *       anchor whose {@code href} contains the product path marker.</li>
 * </ol>
 * <p>When the counter is missing or the second render fails, the links of the first render
 * are used. The {@code concurrency} argument is irrelevant here: the whole listing is one page.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RenderedListingLinkCollector implements LinkCollector {

    private final PageRenderer renderer;

    @Override
    public SiteCfg.ListingType type() {
        return SiteCfg.ListingType.RENDERED;
    }

    @Override
    public Set<String> collect(final SiteCfg site, final String seed, final int concurrency) {
        SiteCfg.Listing listing = site.getListing();

        final String firstHtml;
        try {
            firstHtml = renderer.render(seed, listing.getCountSelector(), site.getRenderTimeout());
        } catch (RenderException ex) {
            log.warn("Listing {} could not be rendered: {}", seed, ex.getMessage());
            return new LinkedHashSet<>();
        }
        List<String> links = extractLinks(site, firstHtml);

        OptionalInt total = parseTotal(firstHtml, listing);
        if (total.isPresent() && total.getAsInt() > links.size()) {
            String fullUrl = UriComponentsBuilder.fromUriString(seed)
                    .replaceQueryParam(listing.getItemCountParam(), total.getAsInt())
                    .build(true)
                    .toUriString();
            log.info("Listing reports {} products, rendering {}", total.getAsInt(), fullUrl);
            try {
                List<String> full = extractLinks(site, renderer.render(fullUrl, null, site.getRenderTimeout()));
                if (!full.isEmpty()) {
                    links = full;
                }
            } catch (RenderException ex) {
                log.warn("Full listing render failed, keeping {} first-page links: {}", links.size(), ex.getMessage());
            }
        } else if (total.isEmpty()) {
            log.info("No product counter on {}, using first-page links only", seed);
        }

        Set<String> unique = UrlDeduplicator.dedupe(links, listing.isDedupeByBaseProduct());
        log.info("Collected {} product URLs from rendered listing {}", unique.size(), seed);
        return unique;
    }

    static OptionalInt parseTotal(final String html, final SiteCfg.Listing listing) {
        Document doc = Jsoup.parse(html);
        String text;
        if (StringUtils.isNotBlank(listing.getCountSelector())) {
            Element counter = doc.selectFirst(listing.getCountSelector());
            text = counter == null ? doc.text() : counter.text();
        } else {
            text = doc.text();
        }
        Matcher m = Pattern.compile(listing.getCountPattern()).matcher(text.replace(",", ""));
        if (!m.find()) {
            return OptionalInt.empty();
        }
        int total = NumberUtils.toInt(m.group(m.groupCount()), -1);
        if (total <= 0) {
            log.warn("Unusable item counter '{}' on listing", m.group());
            return OptionalInt.empty();
        }
        return OptionalInt.of(total);
    }

    private List<String> extractLinks(final SiteCfg site, final String html) {
        SiteCfg.Listing listing = site.getListing();
        Document doc = Jsoup.parse(html, StringUtils.defaultIfBlank(site.getBaseUrl(), ""));
        String marker = listing.getProductPathMarker();

        List<String> selectors = new ArrayList<>(listing.getLinkSelectors());
        if (StringUtils.isNotBlank(marker)) {
            selectors.add("a[href*=\"" + marker + "\"]");
        }
        for (String selector : selectors) {
            List<String> found = new ArrayList<>();
            for (Element a : doc.select(selector)) {
                String href = Links.absolute(site.getBaseUrl(), a.attr("href"));
                if (href != null && (StringUtils.isBlank(marker) || href.contains(marker))) {
                    found.add(href);
                }
            }
            if (!found.isEmpty()) {
                return found;
            }
        }
        return List.of();
    }
}
