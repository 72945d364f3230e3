package com.catalog.harvester.fetch;

import com.catalog.harvester.config.HarvestProperties;
import com.catalog.harvester.exception.HarvestException;
import com.catalog.harvester.exception.TransientNetworkException;
import com.catalog.harvester.model.FetchResult;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.Exceptions;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * <h2>Fetch Engine</h2>
 *
 * <p>Issues many HTTP requests with bounded concurrency. A batch is cut into
 * <em>waves</em> of at most {@code concurrency} requests; a wave completes when every
 * request in it has settled, then the engine idles for {@code harvester.fetch.wave-pause}
 * before starting the next one.</p>
 *
 * <p>Per URL, attempts are strictly sequential and driven by a Resilience4j {@link Retry}:</p>
 * <ul>
 *   <li>retried: HTTP 429, 502, 503, 504, 520&ndash;524 and transport timeouts, DNS and TLS errors;</li>
 *   <li>not retried: any other 4xx/5xx;</li>
 *   <li>wait: {@link BackoffPolicy}, with the rate-limit floor after 429/503;</li>
 *   <li>ceiling: {@code max-retries} attempts in total, after which the URL is reported failed.</li>
 * </ul>
 *
 * <p>Redirects are followed here (not by the HTTP client) so that
 * {@link FetchResult#finalUrl()} is exact. Every request carries a header profile
 * from the {@link BrowserHeaderPool}.</p>
 */
@Slf4j
@Component
public class FetchEngine {

    private static final Set<Integer> RETRYABLE_STATUSES =
            Set.of(429, 502, 503, 504, 520, 521, 522, 523, 524);

    private final WebClient webClient;

    private final HarvestProperties.Fetch cfg;

    private final BackoffPolicy backoff;

    private final BrowserHeaderPool headerPool;

    private final AtomicLong waves = new AtomicLong();

    @Autowired
    public FetchEngine(@Qualifier("fetchWebClient") final WebClient webClient,
                       final HarvestProperties props) {
        this(webClient, props.getFetch(), new BrowserHeaderPool());
    }

    public FetchEngine(final WebClient webClient,
                       final HarvestProperties.Fetch cfg,
                       final BrowserHeaderPool headerPool) {
        this.webClient = webClient;
        this.cfg = cfg;
        this.backoff = BackoffPolicy.from(cfg);
        this.headerPool = headerPool;
    }

    /* ---- batch API ---------------------------------------------------- */

    /**
     * Fetches every URL with a plain GET.
     *
     * @param urls        URLs to fetch; duplicates are fetched once
     * @param concurrency maximum number of requests in flight
     * @return one result per distinct URL, in input order
     */
    public Map<String, FetchResult> fetchBatch(final Collection<String> urls, final int concurrency) {
        List<FetchRequest> requests = new LinkedHashSet<>(urls).stream()
                .map(FetchRequest::page)
                .toList();
        return fetchAll(requests, concurrency);
    }

    /**
     * Dispatches the requests in waves of at most {@code concurrency}.
     *
     * @return one result per distinct request URL, in input order
     */
    public Map<String, FetchResult> fetchAll(final List<FetchRequest> requests, final int concurrency) {
        int width = Math.max(1, concurrency);
        Map<String, FetchResult> results = new LinkedHashMap<>();

        for (int from = 0; from < requests.size(); from += width) {
            List<FetchRequest> wave = requests.subList(from, Math.min(from + width, requests.size()));

            List<FetchResult> settled = Flux.fromIterable(wave)
                    .flatMap(req -> Mono.fromCallable(() -> fetch(req))
                            .subscribeOn(Schedulers.boundedElastic()), width)
                    .collectList()
                    .block();

            Map<String, FetchResult> byUrl = settled == null ? Map.of() : settled.stream()
                    .collect(Collectors.toMap(FetchResult::url, Function.identity(), (a, b) -> a));
            wave.forEach(req -> results.putIfAbsent(req.url(), byUrl.get(req.url())));

            long done = waves.incrementAndGet();
            if (cfg.getProgressLogInterval() > 0 && done % cfg.getProgressLogInterval() == 0) {
                log.info("Fetch progress: {} waves completed, {}/{} URLs in current batch",
                        done, results.size(), requests.size());
            }
            if (from + width < requests.size()) {
                Pacing.pause(cfg.getWavePause());
            }
        }
        return results;
    }

    /* ---- single request ----------------------------------------------- */

    public FetchResult fetch(final String url) {
        return fetch(FetchRequest.page(url));
    }

    /**
     * Fetches one request with retry and backoff. Never throws for network or HTTP
     * failures; they are reported in the returned {@link FetchResult}.
     */
    public FetchResult fetch(final FetchRequest request) {
        AtomicInteger attempts = new AtomicInteger();
        AtomicInteger lastStatus = new AtomicInteger();

        Retry retry = Retry.of("fetch", RetryConfig.<Attempt>custom()
                .maxAttempts(Math.max(1, cfg.getMaxRetries()))
                .retryOnResult(Attempt::retryable)
                .retryOnException(TransientNetworkException.class::isInstance)
                .intervalFunction(n -> backoff.delayFor(n, lastStatus.get()).toMillis())
                .failAfterMaxAttempts(false)
                .build());
        retry.getEventPublisher().onRetry(e -> log.debug("Retry #{} of {} in {} ({})",
                e.getNumberOfRetryAttempts(), request.url(), e.getWaitInterval(),
                e.getLastThrowable() == null ? "HTTP " + lastStatus.get() : e.getLastThrowable().toString()));

        try {
            Attempt last = retry.executeSupplier(() -> attemptOnce(request, attempts, lastStatus));
            return toResult(request.url(), last, attempts.get());
        } catch (TransientNetworkException ex) {
            log.warn("Fetch failed for {} after {} attempts: {}", request.url(), attempts.get(), ex.getMessage());
            return FetchResult.failed(request.url(), 0, ex.getMessage(), attempts.get());
        } catch (RuntimeException ex) {
            log.warn("Fetch failed for {}: {}", request.url(), ex.getMessage());
            return FetchResult.failed(request.url(), 0, ex.getMessage(), attempts.get());
        }
    }

    /* ---- internals ---------------------------------------------------- */

    /**
     * Result of one attempt, redirects included. {@code error} is set for failures that
     * must not be retried (malformed URL, redirect loop).
     */
    record Attempt(String finalUrl, int status, String body, String error) {

        boolean retryable() {
            return error == null && RETRYABLE_STATUSES.contains(status);
        }
    }

    private Attempt attemptOnce(final FetchRequest request,
                                final AtomicInteger attempts,
                                final AtomicInteger lastStatus) {
        attempts.incrementAndGet();
        String current = request.url();
        HttpMethod method = request.method();
        String body = request.jsonBody();

        for (int hop = 0; hop <= cfg.getMaxRedirects(); hop++) {
            ResponseEntity<String> response = exchange(current, method, body, request.json(), lastStatus);
            int status = response.getStatusCode().value();
            lastStatus.set(status);

            String location = response.getHeaders().getFirst(HttpHeaders.LOCATION);
            if (response.getStatusCode().is3xxRedirection() && location != null) {
                current = URI.create(current).resolve(location.trim()).toString();
                if (status == 301 || status == 302 || status == 303) {
                    method = HttpMethod.GET;
                    body = null;
                }
                continue;
            }
            return new Attempt(current, status, response.getBody(), null);
        }
        return new Attempt(current, 0, null, "too many redirects (> " + cfg.getMaxRedirects() + ")");
    }

    private ResponseEntity<String> exchange(final String url, final HttpMethod method, final String body,
                                            final boolean json, final AtomicInteger lastStatus) {
        final URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException ex) {
            throw new HarvestException("malformed URL " + url, ex);
        }
        try {
            WebClient.RequestBodySpec spec = webClient.method(method)
                    .uri(uri)
                    .headers(h -> headerPool.apply(h, url, json));
            WebClient.RequestHeadersSpec<?> ready = body == null
                    ? spec
                    : spec.contentType(MediaType.APPLICATION_JSON).bodyValue(body);

            ResponseEntity<String> entity = ready
                    .exchangeToMono(resp -> resp.toEntity(String.class))
                    .timeout(cfg.getRequestTimeout())
                    .block();
            if (entity == null) {
                throw new TransientNetworkException("no response from " + url, null);
            }
            return entity;
        } catch (TransientNetworkException ex) {
            lastStatus.set(0);
            throw ex;
        } catch (RuntimeException ex) {
            Throwable cause = Exceptions.unwrap(ex);
            if (isTransient(ex) || isTransient(cause)) {
                lastStatus.set(0);
                throw new TransientNetworkException(url + ": " + cause, cause);
            }
            throw new HarvestException("request to " + url + " failed: " + cause, cause);
        }
    }

    private static boolean isTransient(final Throwable t) {
        return t instanceof WebClientRequestException
                || t instanceof TimeoutException
                || t instanceof IOException;
    }

    private static FetchResult toResult(final String url, final Attempt last, final int attempts) {
        if (last.error() != null) {
            return FetchResult.failed(url, last.status(), last.error(), attempts);
        }
        if (last.status() >= 200 && last.status() < 300) {
            return new FetchResult(url, last.finalUrl(), last.status(), last.body(), null, attempts);
        }
        String reason = RETRYABLE_STATUSES.contains(last.status())
                ? "HTTP " + last.status() + " after " + attempts + " attempts"
                : "HTTP " + last.status();
        log.warn("Fetch failed for {}: {}", url, reason);
        return new FetchResult(url, last.finalUrl(), last.status(), null, reason, attempts);
    }

    /** Utility for callers that want a batch split into the same waves the engine uses. */
    public static <T> List<List<T>> partition(final List<T> items, final int size) {
        List<List<T>> chunks = new ArrayList<>();
        int width = Math.max(1, size);
        for (int from = 0; from < items.size(); from += width) {
            chunks.add(items.subList(from, Math.min(from + width, items.size())));
        }
        return chunks;
    }
}
