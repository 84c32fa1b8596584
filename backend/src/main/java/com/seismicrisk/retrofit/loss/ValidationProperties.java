package com.seismicrisk.retrofit.loss;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "validation")
public class ValidationProperties {

    /**
     * Reject malformed curves instead of logging them.
     */
    private boolean strict = false;
}
