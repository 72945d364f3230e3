package com.catalog.harvester.exception;

/**
 * Transport-level failure (timeout, DNS, TLS, connection reset) that is worth
 * another attempt after a backoff.
 */
public class TransientNetworkException extends HarvestException {

    public TransientNetworkException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
