package com.catalog.harvester.support;

import com.catalog.harvester.config.HarvestProperties;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Duration;

/** Fast, deterministic settings for unit tests. */
public final class TestConfigs {

    private TestConfigs() {
    }

    public static HarvestProperties.Fetch fastFetch(final int maxRetries) {
        HarvestProperties.Fetch cfg = new HarvestProperties.Fetch();
        cfg.setMaxRetries(maxRetries);
        cfg.setBackoffBase(2.0);
        cfg.setBackoffUnit(Duration.ofMillis(1));
        cfg.setJitterMin(0);
        cfg.setJitterMax(0);
        cfg.setRateLimitFloor(Duration.ZERO);
        cfg.setWavePause(Duration.ZERO);
        cfg.setRequestTimeout(Duration.ofSeconds(5));
        return cfg;
    }

    public static ObjectMapper mapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }
}
