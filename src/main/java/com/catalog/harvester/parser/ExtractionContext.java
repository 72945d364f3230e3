package com.catalog.harvester.parser;

import com.catalog.harvester.config.SiteCfg;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Everything the extractor knows about a page besides its body.
 *
 * @param siteId      site identifier, first half of the product's natural key
 * @param site        site profile with selectors and known JSON paths
 * @param url         requested URL
 * @param finalUrl    URL after redirects, used to resolve relative links
 * @param sideChannel per-colour data from an interactive render, may be {@code null}
 */
public record ExtractionContext(String siteId, SiteCfg site, String url, String finalUrl, JsonNode sideChannel) {

    public static ExtractionContext of(final String siteId, final SiteCfg site, final String url) {
        return new ExtractionContext(siteId, site, url, url, null);
    }

    public String pageUrl() {
        return finalUrl != null ? finalUrl : url;
    }
}
