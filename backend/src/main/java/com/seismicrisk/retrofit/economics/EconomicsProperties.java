package com.seismicrisk.retrofit.economics;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "economics")
public class EconomicsProperties {

    /**
     * Decimals used when rendering results. Computation always keeps full precision.
     */
    private int displayPrecision = 4;
}
