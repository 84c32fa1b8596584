package com.seismicrisk.retrofit.domain.model;

import jakarta.validation.constraints.NotBlank;

/**
 * Location at which hazard is computed.
 */
public record Site(
        @NotBlank String id,
        double longitude,
        double latitude
) {}
