package com.catalog.harvester.model;

/**
 * Natural identity of a canonical product across runs.
 */
public record ProductKey(String siteId, String externalId) {
}
