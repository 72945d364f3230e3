package com.catalog.harvester.collect;

import com.catalog.harvester.config.SiteCfg;
import com.catalog.harvester.fetch.FetchEngine;
import com.catalog.harvester.fetch.FetchRequest;
import com.catalog.harvester.fetch.Pacing;
import com.catalog.harvester.model.FetchResult;
import com.catalog.harvester.parser.JsonPaths;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * <h2>Paged JSON API collector</h2>
 *
 * <p>Walks an offset-paginated listing API. Each round requests {@code concurrency}
 * consecutive pages in parallel (offsets {@code anchor, anchor + pageSize, ...}).</p>
 * <ul>
 *   <li>A round that brings at least one new link advances the anchor. Short pages do not
 *       end the crawl.</li>
 *   <li>A round in which every page succeeded and none brought a new link marks the end
 *       of the listing.</li>
 *   <li>A round with no new link but with failed pages is repeated (at most
 *       {@code listing.max-round-retries} times in a row) before it counts as the end.</li>
 * </ul>
 */
@Slf4j
@Component
public class PagedApiLinkCollector implements LinkCollector {

    private final FetchEngine fetchEngine;

    private final ObjectMapper mapper;

    public PagedApiLinkCollector(final FetchEngine fetchEngine,
                                 @Qualifier("harvesterObjectMapper") final ObjectMapper mapper) {
        this.fetchEngine = fetchEngine;
        this.mapper = mapper;
    }

    @Override
    public SiteCfg.ListingType type() {
        return SiteCfg.ListingType.API;
    }

    @Override
    public Set<String> collect(final SiteCfg site, final String seed, final int concurrency) {
        SiteCfg.Listing listing = site.getListing();
        int width = Math.max(1, concurrency);
        int pageSize = Math.max(1, listing.getPageSize());

        Set<String> links = new LinkedHashSet<>();
        int anchor = 0;
        int emptyRetries = 0;

        for (int round = 1; round <= listing.getMaxRounds(); round++) {
            List<FetchRequest> pages = new ArrayList<>();
            for (int i = 0; i < width; i++) {
                pages.add(FetchRequest.api(pageUrl(seed, listing, anchor + i * pageSize)));
            }
            Map<String, FetchResult> results = fetchEngine.fetchAll(pages, width);

            int fresh = 0;
            int failed = 0;
            for (FetchRequest page : pages) {
                FetchResult result = results.get(page.url());
                if (result == null || !result.isSuccess()) {
                    failed++;
                    log.warn("Listing page {} failed: {}", page.url(), result == null ? "no result" : result.error());
                    continue;
                }
                for (String link : extractLinks(site, result.body())) {
                    if (links.add(link)) {
                        fresh++;
                    }
                }
            }
            log.info("Listing round {} (anchor {}): {} new links, {} failed pages, {} total",
                    round, anchor, fresh, failed, links.size());

            if (fresh == 0) {
                if (failed > 0 && emptyRetries < listing.getMaxRoundRetries()) {
                    emptyRetries++;
                    log.warn("Round at anchor {} returned nothing but {} page(s) failed, retrying ({}/{})",
                            anchor, failed, emptyRetries, listing.getMaxRoundRetries());
                    Pacing.pause(listing.getRoundPause());
                    continue;
                }
                if (failed > 0) {
                    log.warn("Giving up on listing at anchor {}: pages keep failing", anchor);
                }
                break;
            }
            emptyRetries = 0;
            anchor += width * pageSize;
            Pacing.pause(listing.getRoundPause());
        }

        Set<String> unique = UrlDeduplicator.dedupe(links, listing.isDedupeByBaseProduct());
        log.info("Collected {} product URLs ({} before base-product dedup) from {}",
                unique.size(), links.size(), seed);
        return unique;
    }

    static String pageUrl(final String seed, final SiteCfg.Listing listing, final int offset) {
        return UriComponentsBuilder.fromUriString(seed)
                .replaceQueryParam(listing.getOffsetParam(), offset)
                .replaceQueryParam(listing.getPageSizeParam(), listing.getPageSize())
                .build(true)
                .toUriString();
    }

    private List<String> extractLinks(final SiteCfg site, final String body) {
        List<String> out = new ArrayList<>();
        if (StringUtils.isBlank(body)) {
            return out;
        }
        final JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (JsonProcessingException ex) {
            log.warn("Listing response is not JSON: {}", ex.getOriginalMessage());
            return out;
        }
        for (String path : site.getListing().getLinkPaths()) {
            for (String href : JsonPaths.texts(root, path)) {
                String url = Links.absolute(site.getBaseUrl(), href);
                if (url != null) {
                    out.add(url);
                }
            }
        }
        return out;
    }
}
