package com.seismicrisk.retrofit.hazard;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * SHA-256 hex fingerprint of the hazard-affecting parameters of a job.
 */
public record CacheKey(@JsonValue String value) {

    private static final Pattern HEX_SHA256 = Pattern.compile("[0-9a-f]{64}");

    public CacheKey {
        Objects.requireNonNull(value, "value");
        if (!HEX_SHA256.matcher(value).matches()) {
            throw new IllegalArgumentException("Not a cache key: " + value);
        }
    }

    public static CacheKey of(String value) {
        return new CacheKey(value);
    }

    /**
     * First 12 characters, for log lines.
     */
    public String shortForm() {
        return value.substring(0, 12);
    }

    @Override
    public String toString() {
        return value;
    }
}
