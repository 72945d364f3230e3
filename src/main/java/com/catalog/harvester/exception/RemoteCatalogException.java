package com.catalog.harvester.exception;

import lombok.Getter;

/**
 * Non-successful answer from the remote commerce catalog.
 * <p>
 * Carries the HTTP status and the raw response body so the caller can record
 * the error payload on the product's sync mapping.
 * </p>
 */
@Getter
public class RemoteCatalogException extends HarvestException {

    /** HTTP status returned by the catalog, {@code 0} for transport failures. */
    private final int status;

    /** Raw response body, may be empty. */
    private final String responseBody;

    public RemoteCatalogException(final String message, final int status, final String responseBody) {
        super(message);
        this.status = status;
        this.responseBody = responseBody == null ? "" : responseBody;
    }

    public RemoteCatalogException(final String message, final Throwable cause) {
        super(message, cause);
        this.status = 0;
        this.responseBody = "";
    }

    /**
     * @return {@code true} when the catalog rejected the request as a duplicate
     * (WooCommerce answers {@code 400 term_exists} / {@code woocommerce_rest_cannot_create})
     */
    public boolean isConflict() {
        return status == 400 || status == 409;
    }
}
