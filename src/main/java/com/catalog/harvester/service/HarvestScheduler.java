package com.catalog.harvester.service;

import com.catalog.harvester.config.HarvestProperties;
import com.catalog.harvester.config.SiteConfigFactory;
import com.catalog.harvester.exception.ConfigurationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Harvests every enabled site on the {@code harvester.schedule.cron} schedule, one after another.
 * Active only with {@code harvester.schedule.enabled=true}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "harvester.schedule", name = "enabled", havingValue = "true")
public class HarvestScheduler {

    private final HarvestOrchestrator orchestrator;

    private final SiteConfigFactory sites;

    private final HarvestProperties props;

    @Scheduled(cron = "${harvester.schedule.cron:0 0 3 * * *}")
    public void harvestAll() {
        for (String siteId : sites.enabledSites()) {
            try {
                orchestrator.run(siteId, 0, props.getSchedule().isSync());
            } catch (ConfigurationException ex) {
                log.error("Scheduled harvest of {} skipped: {}", siteId, ex.getMessage());
            }
        }
    }
}
