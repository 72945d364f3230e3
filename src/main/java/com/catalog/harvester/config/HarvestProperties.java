package com.catalog.harvester.config;

import lombok.Data;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.regex.Pattern;

/**
 * Pipeline-wide tuning bound from the {@code harvester} prefix.
 * <p>
 * Example YAML:
 * <pre>{@code
 * harvester:
 *   fetch:
 *     max-retries: 5
 *     backoff-unit: 1s
 *   render:
 *     command: node
 *     script: scripts/render.js
 *   orchestrator:
 *     batch-size: 50
 * }</pre>
 */
@Component
@ConfigurationProperties(prefix = "harvester")
@Getter
@Setter
public class HarvestProperties {

    private Fetch fetch = new Fetch();

    private Render render = new Render();

    private Orchestrator orchestrator = new Orchestrator();

    private Schedule schedule = new Schedule();

    @Data
    public static class Fetch {

        /** Attempts per URL, the first one included. */
        private int maxRetries = 5;

        /** Exponential base: the wait before retry {@code n} is {@code base^n} units plus jitter. */
        private double backoffBase = 2.0;

        /** Length of one backoff unit; tests shrink it to milliseconds. */
        private Duration backoffUnit = Duration.ofSeconds(1);

        /** Jitter bounds, in backoff units, inclusive. */
        private int jitterMin = 1;

        private int jitterMax = 3;

        /** Extra wait added after a 429 or 503. */
        private Duration rateLimitFloor = Duration.ofSeconds(5);

        private Duration connectTimeout = Duration.ofSeconds(30);

        private Duration requestTimeout = Duration.ofSeconds(60);

        /** Idle pause between two waves of one batch. */
        private Duration wavePause = Duration.ofSeconds(1);

        private int maxRedirects = 5;

        /** A progress line is logged every this many waves. */
        private int progressLogInterval = 10;

        /** Upper bound of one buffered response body. */
        private int maxBodyBytes = 16 * 1024 * 1024;

        private int maxConnections = 100;
    }

    @Data
    public static class Render {

        /** Executable running the headless-browser scripts. */
        private String command = "node";

        /** Script rendering one page: {@code script url [waitSelector] timeoutMillis}. */
        private String script = "scripts/render.js";

        /** Script that clicks through colour swatches: {@code script url timeoutMillis}. */
        private String interactiveScript = "scripts/render-interactive.js";

        private Duration timeout = Duration.ofMinutes(5);

        /** Added to the render timeout before the worker process is killed. */
        private Duration grace = Duration.ofSeconds(10);

        private int maxRetries = 3;

        /** Render processes started in parallel for one batch of detail pages. */
        private int concurrency = 4;

        private String sideChannelStart = "SIDE_CHANNEL_START";

        private String sideChannelEnd = "SIDE_CHANNEL_END";

        private String debugStart = "DEBUG_START";

        private String debugEnd = "DEBUG_END";

        /**
         * @return a pattern capturing the JSON between a start and an end marker
         * placed on their own lines
         */
        public static Pattern blockPattern(final String start, final String end) {
            return Pattern.compile(Pattern.quote(start) + "\\s*\\n(.*?)\\n\\s*" + Pattern.quote(end),
                    Pattern.DOTALL);
        }
    }

    @Data
    public static class Orchestrator {

        /** Detail URLs processed per batch. */
        private int batchSize = 50;

        private Duration batchSleep = Duration.ofSeconds(2);

        /** Global cap on processed detail URLs, {@code 0} means unlimited. */
        private int maxItems = 0;

        /** Directory for the one-shot dump of the first detail response; blank disables it. */
        private String debugDumpDir = "";

        private int errorMessageLimit = 1000;

        /** Jobs submitted through the API that may run at the same time. */
        private int jobThreads = 2;
    }

    @Data
    public static class Schedule {

        private boolean enabled = false;

        private String cron = "0 0 3 * * *";

        /** Push harvested products to the remote catalog after each scheduled run. */
        private boolean sync = true;
    }
}
