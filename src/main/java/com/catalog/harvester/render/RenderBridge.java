package com.catalog.harvester.render;

import com.catalog.harvester.config.HarvestProperties;
import com.catalog.harvester.fetch.BackoffPolicy;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * <h2>Render Bridge</h2>
 *
 * <p>{@link PageRenderer} on top of an out-of-process {@link RenderWorker}. For every URL it:</p>
 * <ol>
 *   <li>runs the worker, which blocks until the page is rendered or the timeout plus grace elapses;</li>
 *   <li>retries worker failures whose diagnostics look transient (timeouts, {@code net::ERR_*},
 *       DNS and connection errors) as well as empty HTML, with the standard backoff;</li>
 *   <li>scans the HTML for bot-challenge markers and retries those with twice the standard wait;</li>
 *   <li>extracts side-channel JSON blocks from the worker's stderr.</li>
 * </ol>
 *
 * <p>All retries share the {@code harvester.render.max-retries} ceiling. A non-transient worker
 * failure fails the URL immediately. A missing worker is a configuration error and is never retried.</p>
 */
@Slf4j
@Component
public class RenderBridge implements PageRenderer {

    private static final List<String> RETRYABLE_DIAGNOSTICS = List.of(
            "timeout",
            "net::err",
            "err_name_not_resolved",
            "err_internet_disconnected",
            "econnrefused",
            "etimedout",
            "enotfound");

    private final RenderWorker worker;

    private final HarvestProperties.Render cfg;

    private final BackoffPolicy backoff;

    private final SideChannelExtractor sideChannel;

    @Autowired
    public RenderBridge(final RenderWorker worker,
                        final HarvestProperties props,
                        @Qualifier("harvesterObjectMapper") final ObjectMapper mapper) {
        this(worker, props.getRender(), BackoffPolicy.from(props.getFetch()), mapper);
    }

    public RenderBridge(final RenderWorker worker,
                        final HarvestProperties.Render cfg,
                        final BackoffPolicy backoff,
                        final ObjectMapper mapper) {
        this.worker = worker;
        this.cfg = cfg;
        this.backoff = backoff;
        this.sideChannel = new SideChannelExtractor(mapper,
                HarvestProperties.Render.blockPattern(cfg.getSideChannelStart(), cfg.getSideChannelEnd()),
                HarvestProperties.Render.blockPattern(cfg.getDebugStart(), cfg.getDebugEnd()));
    }

    @Override
    public RenderedPage render(final RenderRequest request) {
        AtomicInteger attempts = new AtomicInteger();
        AtomicBoolean challenged = new AtomicBoolean();

        Retry retry = Retry.of("render", RetryConfig.custom()
                .maxAttempts(Math.max(1, cfg.getMaxRetries()))
                .retryOnException(RenderBridge::isRetryable)
                .intervalFunction(n -> (challenged.get()
                        ? backoff.challengeDelayFor(n)
                        : backoff.delayFor(n, 0)).toMillis())
                .build());
        retry.getEventPublisher().onRetry(e -> log.info("Render retry #{} for {} in {}: {}",
                e.getNumberOfRetryAttempts(), request.url(), e.getWaitInterval(),
                e.getLastThrowable() == null ? "" : e.getLastThrowable().getMessage()));

        try {
            return retry.executeSupplier(() -> attemptOnce(request, attempts, challenged));
        } catch (RenderException ex) {
            log.warn("Render failed for {} after {} attempts: {}", request.url(), attempts.get(), ex.getMessage());
            throw ex;
        }
    }

    private RenderedPage attemptOnce(final RenderRequest request,
                                     final AtomicInteger attempts,
                                     final AtomicBoolean challenged) {
        attempts.incrementAndGet();
        challenged.set(false);

        WorkerOutput out = worker.execute(request);

        if (out.timedOut()) {
            throw new RenderException("Render of " + request.url() + " timed out", true);
        }
        if (out.exitCode() != 0) {
            throw new RenderException("Render worker exited with " + out.exitCode() + " for "
                    + request.url() + ": " + StringUtils.abbreviate(StringUtils.trim(out.stderr()), 500),
                    isTransientDiagnostic(out.stderr()));
        }
        String html = out.stdout();
        if (StringUtils.isBlank(html)) {
            throw new RenderException("Render worker returned empty HTML for " + request.url(), true);
        }
        if (ChallengeDetector.isChallenge(html)) {
            challenged.set(true);
            throw new ChallengeDetectedException(request.url());
        }

        JsonNode side = sideChannel.extract(out.stderr());
        log.debug("Rendered {} ({} chars, side channel: {}) in {} attempt(s)",
                request.url(), html.length(), side != null, attempts.get());
        return new RenderedPage(request.url(), html, side, attempts.get());
    }

    private static boolean isRetryable(final Throwable t) {
        return t instanceof RenderException && ((RenderException) t).isRetryable();
    }

    static boolean isTransientDiagnostic(final String stderr) {
        if (StringUtils.isBlank(stderr)) {
            return false;
        }
        String lower = stderr.toLowerCase(Locale.ROOT);
        return RETRYABLE_DIAGNOSTICS.stream().anyMatch(lower::contains);
    }
}
