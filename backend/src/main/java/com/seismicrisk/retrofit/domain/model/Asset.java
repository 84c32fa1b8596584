package com.seismicrisk.retrofit.domain.model;

import jakarta.validation.constraints.NotBlank;

/**
 * Exposed asset. Treated as an opaque identifier with a location, an asset class
 * (taxonomy) used to pick the vulnerability function, a replacement value, and the
 * cost of retrofitting it.
 *
 * Replacement value and retrofit cost share the same monetary unit.
 */
public record Asset(
        @NotBlank String id,
        @NotBlank String taxonomy,
        @NotBlank String siteId,
        double value,
        double retrofitCost
) {}
