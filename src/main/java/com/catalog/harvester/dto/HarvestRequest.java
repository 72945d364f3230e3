package com.catalog.harvester.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * Request payload for starting a harvest job.
 *
 * @param site     site identifier, a key under {@code sites.configs}; must not be blank
 * @param maxItems cap on detail URLs for this job; {@code null} or {@code 0} uses the configured default
 * @param sync     push harvested products to the remote catalog; {@code null} means {@code false}
 */
public record HarvestRequest(
        @NotBlank String site,
        @Min(0) Integer maxItems,
        Boolean sync
) {

    public int maxItemsOrDefault() {
        return maxItems == null ? 0 : maxItems;
    }

    public boolean syncRequested() {
        return Boolean.TRUE.equals(sync);
    }
}
