package com.catalog.harvester.config;

import com.catalog.harvester.exception.ConfigurationException;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Produces validated {@link SiteCfg} instances for a site identifier.
 *
 * <pre>{@code
 * SiteCfg nike = siteConfigFactory.forSite("nike");
 * }</pre>
 */
@Component
@RequiredArgsConstructor
public class SiteConfigFactory {

    private final SiteProperties siteProps;

    /**
     * @param id site identifier, a key under <code>sites.configs</code>
     * @return the site's profile
     * @throws ConfigurationException if the section is missing or lacks a base URL or seed URL
     */
    public SiteCfg forSite(final String id) {
        SiteCfg cfg = Optional.ofNullable(siteProps.forName(id))
                .orElseThrow(() -> new ConfigurationException(
                        "No <sites.configs." + id + "> section found in application.yml"));
        if (StringUtils.isBlank(cfg.getBaseUrl())) {
            throw new ConfigurationException("sites.configs." + id + ".base-url is not set");
        }
        if (StringUtils.isBlank(cfg.getListing().getSeedUrl())) {
            throw new ConfigurationException("sites.configs." + id + ".listing.seed-url is not set");
        }
        if (StringUtils.isBlank(cfg.getDisplayName())) {
            cfg.setDisplayName(StringUtils.capitalize(id));
        }
        return cfg;
    }

    /** Identifiers of all sites with {@code enabled: true}. */
    public List<String> enabledSites() {
        return siteProps.getConfigs().entrySet().stream()
                .filter(e -> e.getValue().isEnabled())
                .map(Map.Entry::getKey)
                .toList();
    }

}
