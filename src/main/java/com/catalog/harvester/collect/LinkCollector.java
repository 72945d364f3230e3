package com.catalog.harvester.collect;

import com.catalog.harvester.config.SiteCfg;

import java.util.Set;

/**
 * Turns a listing (category) source into the set of product detail URLs.
 */
public interface LinkCollector {

    /** Listing flavour this collector handles. */
    SiteCfg.ListingType type();

    /**
     * @param site        the site profile
     * @param seed        listing endpoint or page to start from
     * @param concurrency listing pages requested in parallel
     * @return de-duplicated absolute detail URLs in discovery order
     */
    Set<String> collect(SiteCfg site, String seed, int concurrency);
}
