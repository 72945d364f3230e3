package com.catalog.harvester.render;

import com.catalog.harvester.exception.HarvestException;
import lombok.Getter;

/**
 * Failure to render one URL. Retryable failures are attempted again by the
 * {@link RenderBridge}; the others fail the URL at once.
 */
@Getter
public class RenderException extends HarvestException {

    private final boolean retryable;

    public RenderException(final String message, final boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public RenderException(final String message, final boolean retryable, final Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }
}
