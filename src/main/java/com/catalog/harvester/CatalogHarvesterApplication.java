package com.catalog.harvester;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Entry point of the catalog harvester.
 *
 * <p>The application collects product links from configured retail sites, fetches
 * (or renders) every detail page, normalises each product into a colour&nbsp;&times;&nbsp;size
 * variant matrix and upserts the result into a WooCommerce-style remote catalog.</p>
 *
 * <p>Usage:
 * <pre>{@code
 *   mvn spring-boot:run
 *
 *   curl -X POST localhost:8080/api/harvest \
 *        -H 'Content-Type: application/json' \
 *        -d '{"site":"lululemon","maxItems":50,"sync":true}'
 * }</pre>
 */
@SpringBootApplication
@EnableScheduling
public class CatalogHarvesterApplication {

    /**
     * Bootstrap method to launch the Spring Boot application.
     *
     * @param args command-line arguments (ignored)
     */
    public static void main(final String[] args) {
        SpringApplication.run(CatalogHarvesterApplication.class, args);
    }
}
