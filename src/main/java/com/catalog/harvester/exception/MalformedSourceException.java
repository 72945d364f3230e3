package com.catalog.harvester.exception;

/**
 * Raised when a detail page lacks a field the canonical model cannot do
 * without (the external id). The product is skipped, the batch continues.
 */
public class MalformedSourceException extends HarvestException {

    public MalformedSourceException(final String message) {
        super(message);
    }
}
