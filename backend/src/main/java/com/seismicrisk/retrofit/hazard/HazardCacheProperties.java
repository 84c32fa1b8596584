package com.seismicrisk.retrofit.hazard;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "hazard.cache")
public class HazardCacheProperties {

    /**
     * Upper bound on hazard computations running at the same time, across all keys.
     */
    private int maxConcurrentComputations = 2;

    /**
     * Mixed into every cache key. Bump it when the canonical form changes so that old
     * entries stop matching.
     */
    private int keySchemaVersion = 1;

    private String cacheName = "hazard-curve-stores";
}
