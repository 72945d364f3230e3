package com.catalog.harvester.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * <h2>Resilience4j Configuration</h2>
 *
 * <p>
 * Exposes the global Resilience4j registries and the named policies guarding the
 * translation model. Per-URL retries of the fetch engine and the render bridge are
 * built per call (their wait depends on the previous outcome), so they do not live here.
 * </p>
 */
@Configuration
public class Resilience4jConfig {

    /** Name shared by the translation retry and circuit breaker. */
    public static final String TRANSLATION = "translation";

    @Bean
    public RetryRegistry retryRegistry() {
        return RetryRegistry.ofDefaults();
    }

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        return CircuitBreakerRegistry.ofDefaults();
    }

    /**
     * Three attempts, two seconds apart; translation is optional so there is no point
     * in waiting longer.
     *
     * @param registry the global {@link RetryRegistry}
     * @return the "translation" {@link Retry}
     */
    @Bean
    @Qualifier(TRANSLATION)
    public Retry translationRetry(final RetryRegistry registry) {
        return registry.retry(TRANSLATION, RetryConfig.custom()
                .maxAttempts(3)
                .waitDuration(Duration.ofSeconds(2))
                .build());
    }

    /**
     * Opens after half of the last ten calls failed and stays open for a minute,
     * which lets a whole batch skip translation while the model endpoint is down.
     *
     * @param registry the global {@link CircuitBreakerRegistry}
     * @return the "translation" {@link CircuitBreaker}
     */
    @Bean
    @Qualifier(TRANSLATION)
    public CircuitBreaker translationCircuitBreaker(final CircuitBreakerRegistry registry) {
        return registry.circuitBreaker(TRANSLATION, CircuitBreakerConfig.custom()
                .slidingWindowSize(10)
                .failureRateThreshold(50)
                .waitDurationInOpenState(Duration.ofMinutes(1))
                .build());
    }

}
