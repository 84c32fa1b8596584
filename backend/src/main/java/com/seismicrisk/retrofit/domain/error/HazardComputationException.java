package com.seismicrisk.retrofit.domain.error;

import lombok.Getter;

/**
 * The hazard collaborator failed. Fails the whole batch, since no asset can be
 * analysed without hazard curves.
 */
@Getter
public class HazardComputationException extends RuntimeException {

    private final String cacheKey;

    public HazardComputationException(String cacheKey, String message, Throwable cause) {
        super(message, cause);
        this.cacheKey = cacheKey;
    }
}
