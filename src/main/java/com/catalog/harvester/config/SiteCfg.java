package com.catalog.harvester.config;

import lombok.Data;
import lombok.Getter;
import lombok.Setter;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parameterised profile of one retail site.
 * <p>
 * One engine serves every retailer; what differs between them (listing API shape,
 * selectors, embedded-state paths, concurrency) lives here.
 * </p>
 */
@Getter
@Setter
public class SiteCfg {

    /** Human-readable site name, also the fallback catalog category. */
    private String displayName;

    /** Scheme and host, used to absolutise relative links. For example "https://shop.lululemon.com". */
    private String baseUrl;

    private boolean enabled = true;

    /** Currency assumed when a price carries an ambiguous symbol or none. */
    private String currency = "USD";

    /** Written into the {@code brand} meta entry. */
    private String brand;

    /** Render detail pages through the headless browser instead of plain HTTP. */
    private boolean renderDetails = false;

    /** Use the interactive render flow that clicks through colour swatches. */
    private boolean interactiveRender = false;

    /** Optional selector the renderer waits for on detail pages. */
    private String detailWaitSelector;

    private Duration renderTimeout = Duration.ofMinutes(2);

    private int detailConcurrency = 20;

    /** Concurrency of per-colour page fetches; kept below {@link #detailConcurrency}. */
    private int colourPageConcurrency = 8;

    private boolean downloadImages = true;

    private boolean translateDescription = false;

    /** Fixed meta entries copied onto every product (e.g. {@code discount: 30}). */
    private Map<String, String> meta = new LinkedHashMap<>();

    private Listing listing = new Listing();

    private Selectors selectors = new Selectors();

    private Embedded embedded = new Embedded();

    /** How listing pages are turned into detail URLs. */
    public enum ListingType {
        /** Paginated JSON endpoint with an offset/anchor parameter. */
        API,
        /** HTML listing rendered once with an item-count parameter. */
        RENDERED
    }

    @Data
    public static class Listing {

        private ListingType type = ListingType.API;

        /** API endpoint or listing page the crawl starts from. */
        private String seedUrl;

        private String offsetParam = "anchor";

        private String pageSizeParam = "count";

        private int pageSize = 24;

        /** Pages requested in parallel per round. */
        private int concurrency = 4;

        /**
         * Path expressions locating product links inside one listing response, e.g.
         * {@code productGroupings[].products[].pdpUrl.url}.
         */
        private List<String> linkPaths = new ArrayList<>();

        /** Extra rounds granted when a round is empty only because requests failed. */
        private int maxRoundRetries = 1;

        private Duration roundPause = Duration.ofSeconds(1);

        /** Hard stop against listings that never run dry. */
        private int maxRounds = 500;

        private boolean dedupeByBaseProduct = true;

        /** Element holding the "44 of 306" style counter on rendered listings. */
        private String countSelector;

        private String countPattern = "(\\d+)\\s+of\\s+(\\d+)";

        /** Query parameter asking the listing for a given number of items. */
        private String itemCountParam = "sz";

        private List<String> linkSelectors = new ArrayList<>();

        /** Path fragment every product URL contains, e.g. "/p/". */
        private String productPathMarker = "/p/";
    }

    /**
     * CSS selector chains; each list is tried in order, the first non-empty match wins.
     */
    @Data
    public static class Selectors {

        private List<String> title = new ArrayList<>();

        private List<String> description = new ArrayList<>();

        private List<String> price = new ArrayList<>();

        private List<String> originalPrice = new ArrayList<>();

        private List<String> discount = new ArrayList<>();

        private List<String> images = new ArrayList<>();

        private List<String> sizes = new ArrayList<>();

        /** Marks a size element as unavailable when it (or its ancestors) match. */
        private String disabledSize = "[disabled], [aria-disabled=true], .disabled, .unavailable";

        private List<String> colourLabel = new ArrayList<>();

        /** Links to sibling colour pages of the same product. */
        private List<String> colourLinks = new ArrayList<>();

        private List<String> externalId = new ArrayList<>();

        /** Regex applied to the URL when no selector yields an id; group 1 is the id. */
        private String externalIdUrlPattern;

        /** Presence marks a single-SKU product as out of stock. */
        private String outOfStock;
    }

    @Data
    public static class Embedded {

        private String scriptSelector = "script#__NEXT_DATA__";

        /** JSON pointers tried before the recursive shape search. */
        private List<String> colourwayPaths = new ArrayList<>(List.of(
                "/props/pageProps/product/colourways",
                "/props/pageProps/colourways",
                "/props/pageProps/productData/colourways",
                "/query/product/colourways"));

        private List<String> productPaths = new ArrayList<>(List.of(
                "/props/pageProps/product",
                "/props/pageProps/productData",
                "/query/product"));

        private List<String> relatedProductPaths = new ArrayList<>(List.of(
                "/props/pageProps/relatedProducts",
                "/props/pageProps/product/relatedProducts"));

        private int maxDepth = 10;

        /** Treat related products (other colours sold as separate items) as extra colourways. */
        private boolean relatedAsColourways = true;
    }
}
