package com.catalog.harvester.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Link between a canonical product and its remote catalog counterpart.
 * <p>
 * {@code remoteProductId} stays {@code null} until a create succeeds;
 * {@code lastSyncStatus} is {@code null} only while the very first attempt is in flight.
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class SyncMapping {

    String siteId;

    String canonicalProductExternalId;

    Long remoteProductId;

    SyncStatus lastSyncStatus;

    Instant lastSyncedAt;

    /** Payload sent on the last attempt, or the error payload when it failed. */
    String lastPayloadSnapshot;

    /** Variations that could not be created or updated on the last attempt. */
    int failedVariations;

    public ProductKey key() {
        return new ProductKey(siteId, canonicalProductExternalId);
    }
}
