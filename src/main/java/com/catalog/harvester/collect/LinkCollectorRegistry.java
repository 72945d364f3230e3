package com.catalog.harvester.collect;

import com.catalog.harvester.config.SiteCfg;
import com.catalog.harvester.exception.ConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Picks the {@link LinkCollector} matching a site's listing type.
 */
@Component
@Slf4j
public class LinkCollectorRegistry {

    private final Map<SiteCfg.ListingType, LinkCollector> byType = new EnumMap<>(SiteCfg.ListingType.class);

    public LinkCollectorRegistry(final List<LinkCollector> collectors) {
        collectors.forEach(c -> byType.put(c.type(), c));
        log.info("Registered link collectors: {}", byType.keySet());
    }

    public LinkCollector forSite(final SiteCfg site) {
        LinkCollector collector = byType.get(site.getListing().getType());
        if (collector == null) {
            throw new ConfigurationException("No link collector for listing type " + site.getListing().getType());
        }
        return collector;
    }
}
