package com.catalog.harvester.render;

import com.catalog.harvester.config.HarvestProperties;
import com.catalog.harvester.exception.ConfigurationException;
import com.catalog.harvester.fetch.BackoffPolicy;
import com.catalog.harvester.support.TestConfigs;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RenderBridgeTest {

    private static final String PAGE = "<html><body><h1>Tee</h1></body></html>";

    private static final String CHALLENGE = "<html><title>Just a moment...</title></html>";

    private static final RenderRequest REQUEST = RenderRequest.plain("https://shop.test/p/1", "h1", Duration.ofSeconds(5));

    private static RenderBridge bridge(final RenderWorker worker) {
        HarvestProperties.Render cfg = new HarvestProperties.Render();
        cfg.setMaxRetries(3);
        return new RenderBridge(worker, cfg,
                new BackoffPolicy(2.0, Duration.ofMillis(1), 0, 0, Duration.ZERO), TestConfigs.mapper());
    }

    @Test
    void returnsHtmlAndMergedSideChannel() {
        String stderr = "loading\nSIDE_CHANNEL_START\n{\"colourways\":[{\"colour\":\"Black\"}]}\nSIDE_CHANNEL_END\n"
                + "SIDE_CHANNEL_START\n{\"price\":45}\nSIDE_CHANNEL_END\n";
        RenderedPage page = bridge(req -> new WorkerOutput(0, PAGE, stderr, false)).render(REQUEST);

        assertThat(page.html()).isEqualTo(PAGE);
        assertThat(page.hasSideChannel()).isTrue();
        assertThat(page.sideChannel().path("colourways").get(0).path("colour").asText()).isEqualTo("Black");
        assertThat(page.sideChannel().path("price").asInt()).isEqualTo(45);
        assertThat(page.attempts()).isEqualTo(1);
    }

    @Test
    void persistentChallengeFailsAfterAllAttempts() {
        AtomicInteger calls = new AtomicInteger();
        RenderBridge bridge = bridge(req -> {
            calls.incrementAndGet();
            return new WorkerOutput(0, CHALLENGE, "", false);
        });

        assertThatThrownBy(() -> bridge.render(REQUEST)).isInstanceOf(ChallengeDetectedException.class);
        assertThat(calls).hasValue(3);
    }

    @Test
    void challengeThenContentSucceeds() {
        AtomicInteger calls = new AtomicInteger();
        RenderedPage page = bridge(req -> calls.incrementAndGet() == 1
                ? new WorkerOutput(0, CHALLENGE, "", false)
                : new WorkerOutput(0, PAGE, "", false)).render(REQUEST);

        assertThat(page.attempts()).isEqualTo(2);
        assertThat(page.hasSideChannel()).isFalse();
    }

    @Test
    void transientWorkerFailureIsRetried() {
        AtomicInteger calls = new AtomicInteger();
        RenderedPage page = bridge(req -> calls.incrementAndGet() == 1
                ? new WorkerOutput(1, "", "Error: net::ERR_CONNECTION_RESET at https://shop.test", false)
                : new WorkerOutput(0, PAGE, "", false)).render(REQUEST);

        assertThat(page.html()).isEqualTo(PAGE);
        assertThat(calls).hasValue(2);
    }

    @Test
    void scriptErrorFailsWithoutRetry() {
        AtomicInteger calls = new AtomicInteger();
        RenderBridge bridge = bridge(req -> {
            calls.incrementAndGet();
            return new WorkerOutput(2, "", "TypeError: cannot read properties of undefined", false);
        });

        assertThatThrownBy(() -> bridge.render(REQUEST))
                .isInstanceOf(RenderException.class)
                .hasMessageContaining("exited with 2");
        assertThat(calls).hasValue(1);
    }

    @Test
    void timeoutAndEmptyOutputAreRetried() {
        AtomicInteger calls = new AtomicInteger();
        RenderedPage page = bridge(req -> switch (calls.incrementAndGet()) {
            case 1 -> new WorkerOutput(-1, "", "", true);
            case 2 -> new WorkerOutput(0, "  ", "", false);
            default -> new WorkerOutput(0, PAGE, "", false);
        }).render(REQUEST);

        assertThat(page.attempts()).isEqualTo(3);
    }

    @Test
    void missingWorkerIsAConfigurationError() {
        AtomicInteger calls = new AtomicInteger();
        RenderBridge bridge = bridge(req -> {
            calls.incrementAndGet();
            throw new ConfigurationException("render script not found");
        });

        assertThatThrownBy(() -> bridge.render(REQUEST)).isInstanceOf(ConfigurationException.class);
        assertThat(calls).hasValue(1);
    }

    @Test
    void recognisesTransientDiagnostics() {
        assertThat(RenderBridge.isTransientDiagnostic("Navigation Timeout Exceeded: 30000 ms")).isTrue();
        assertThat(RenderBridge.isTransientDiagnostic("getaddrinfo ENOTFOUND shop.test")).isTrue();
        assertThat(RenderBridge.isTransientDiagnostic("SyntaxError: Unexpected token")).isFalse();
        assertThat(RenderBridge.isTransientDiagnostic(null)).isFalse();
    }
}
