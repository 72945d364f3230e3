package com.catalog.harvester.config;

import lombok.Data;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Connection and mapping settings of the remote WooCommerce catalog,
 * bound from the {@code catalog} prefix.
 */
@Component
@ConfigurationProperties(prefix = "catalog")
@Getter
@Setter
public class CatalogProperties {

    /** WordPress site root, e.g. "https://store.example.com". */
    private String baseUrl;

    private String consumerKey;

    private String consumerSecret;

    private String apiVersion = "wc/v3";

    /** WordPress user for media uploads; consumer credentials are used when blank. */
    private String wpUsername;

    private String wpAppPassword;

    /** Category given to every product; the site's display name is used when blank. */
    private String defaultCategory;

    /** Global attribute carrying the colour of a variation. */
    private String colourAttribute = "Color";

    /** Global attribute carrying the size of a variation. */
    private String sizeAttribute = "Size";

    private int perPage = 100;

    /** Pagination guard for listing endpoints. */
    private int maxPages = 200;

    private Duration timeout = Duration.ofSeconds(60);

    private Pricing pricing = new Pricing();

    /**
     * Retail price rule: {@code (price + profit + tax) * multiplier}, rounded to an integer.
     * The profit rate depends on the product's {@code discount} meta entry.
     */
    @Data
    public static class Pricing {

        private boolean enabled = false;

        private BigDecimal taxRate = new BigDecimal("0.13");

        private BigDecimal multiplier = BigDecimal.ONE;

        private List<Tier> tiers = new ArrayList<>(List.of(
                new Tier(1, 30, new BigDecimal("0.21")),
                new Tier(31, 60, new BigDecimal("0.27")),
                new Tier(61, 99, BigDecimal.ONE)));
    }

    @Data
    public static class Tier {

        private int minDiscount;

        private int maxDiscount;

        private BigDecimal profitRate;

        public Tier() {
        }

        public Tier(final int minDiscount, final int maxDiscount, final BigDecimal profitRate) {
            this.minDiscount = minDiscount;
            this.maxDiscount = maxDiscount;
            this.profitRate = profitRate;
        }
    }
}
