package com.seismicrisk.retrofit.config;

import com.seismicrisk.retrofit.adapters.HazardCalculator;
import com.seismicrisk.retrofit.adapters.synthetic.SyntheticHazardCalculator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Local development configuration.
 *
 * ENABLED WHEN: app.env=local (the default)
 *
 * This configuration:
 * 1. Supplies the deterministic synthetic hazard calculator
 * 2. Uses the H2 in-memory database for the hazard-run ledger
 * 3. Seeds demo vulnerability models (see {@link VulnerabilityDataLoader})
 *
 * NO HAZARD ENGINE REQUIRED!
 */
@Configuration
@ConditionalOnProperty(name = "app.env", havingValue = "local", matchIfMissing = true)
@Slf4j
public class LocalDevConfig {

    @Bean
    public HazardCalculator syntheticHazardCalculator(
            @Value("${hazard.synthetic.delay-ms:0}") long simulatedDelayMillis) {
        log.info("🌋 LOCAL MODE: Using SyntheticHazardCalculator (delay {} ms per site)", simulatedDelayMillis);
        return new SyntheticHazardCalculator(simulatedDelayMillis);
    }
}
