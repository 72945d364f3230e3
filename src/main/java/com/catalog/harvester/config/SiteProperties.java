package com.catalog.harvester.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Binds per-site profiles from <code>application.yml</code> under the
 * <code>sites</code> prefix, keyed by site identifier.
 * <p>
 * Example YAML:
 * <pre>{@code
 * sites:
 *   configs:
 *     nike:
 *       base-url: https://www.nike.com
 *       listing:
 *         type: api
 *         seed-url: https://api.nike.com/cic/browse/v2?...
 * }</pre>
 */
@Component
@ConfigurationProperties(prefix = "sites")
@Getter
@Setter
public class SiteProperties {

    private final Map<String, SiteCfg> configs = new LinkedHashMap<>();

    public SiteCfg forName(final String name) {
        return configs.get(name);
    }

}
