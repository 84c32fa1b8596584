package com.seismicrisk.retrofit.service;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "risk")
public class WorkerProperties {

    /**
     * Size of the risk worker pool. Zero or less means one worker per available processor.
     */
    private int workers = 0;

    public int effectiveWorkers() {
        return workers > 0 ? workers : Runtime.getRuntime().availableProcessors();
    }
}
