package com.catalog.harvester.exception;

/**
 * Root of the unchecked exception hierarchy raised by the harvesting pipeline.
 * <p>
 * Every subtype is caught at the item boundary (one URL, one product) by the
 * orchestrator, except {@link ConfigurationException}, which aborts the job.
 * </p>
 */
public class HarvestException extends RuntimeException {

    public HarvestException(final String message) {
        super(message);
    }

    public HarvestException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
