package com.catalog.harvester.model;

import lombok.Data;

import java.time.Instant;

/**
 * Progress record of one harvest run for one site.
 * <p>
 * Individual item failures are visible only through {@link #totalFailed} and the logs;
 * {@link #errorMessage} is set only when the job as a whole failed.
 * </p>
 */
@Data
public class ScrapeJob {

    private static final String ELLIPSIS = "...";

    private long id;

    private String siteId;

    private volatile JobStatus status = JobStatus.PENDING;

    private Instant startedAt;

    private Instant finishedAt;

    private int totalFound;

    private int totalCreated;

    private int totalUpdated;

    private int totalFailed;

    private String errorMessage;

    public void markRunning() {
        this.status = JobStatus.RUNNING;
        this.startedAt = Instant.now();
    }

    public void markSuccess() {
        this.status = JobStatus.SUCCESS;
        this.finishedAt = Instant.now();
    }

    /**
     * @param message failure description
     * @param limit   maximum stored length; longer messages are cut and suffixed with "..."
     */
    public void markFailed(final String message, final int limit) {
        this.status = JobStatus.FAILED;
        this.finishedAt = Instant.now();
        this.errorMessage = truncate(message, limit);
    }

    static String truncate(final String message, final int limit) {
        if (message == null || message.length() <= limit) {
            return message;
        }
        return message.substring(0, limit) + ELLIPSIS;
    }
}
