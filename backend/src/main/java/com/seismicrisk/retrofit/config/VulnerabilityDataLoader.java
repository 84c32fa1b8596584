package com.seismicrisk.retrofit.config;

import com.seismicrisk.retrofit.domain.model.VulnerabilityFunction;
import com.seismicrisk.retrofit.domain.model.VulnerabilityModel;
import com.seismicrisk.retrofit.domain.model.VulnerabilityVariant;
import com.seismicrisk.retrofit.domain.repository.VulnerabilityModelRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Loads demo vulnerability models on startup in local mode.
 *
 * Only seeds if the registry is empty.
 */
@Component
@ConditionalOnProperty(name = "app.env", havingValue = "local", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class VulnerabilityDataLoader implements CommandLineRunner {

    public static final String DEMO_ORIGINAL = "demo-original";
    public static final String DEMO_RETROFITTED = "demo-retrofitted";

    private static final double[] PGA_LEVELS = {0.1, 0.3, 0.5};

    private final VulnerabilityModelRegistry registry;

    @Override
    public void run(String... args) {
        if (!registry.isEmpty()) {
            log.info("Vulnerability models already registered, skipping seed");
            return;
        }

        log.info("Seeding demo vulnerability models...");

        // Unreinforced masonry and reinforced concrete frame, before retrofit
        registry.register(VulnerabilityModel.of(DEMO_ORIGINAL, VulnerabilityVariant.ORIGINAL,
                VulnerabilityFunction.deterministic("MUR", "PGA", PGA_LEVELS, new double[]{0.05, 0.2, 0.5}),
                new VulnerabilityFunction("RC-FRAME", "PGA", PGA_LEVELS,
                        new double[]{0.03, 0.15, 0.4}, new double[]{0.3, 0.3, 0.2})));

        // Same classes after retrofit
        registry.register(VulnerabilityModel.of(DEMO_RETROFITTED, VulnerabilityVariant.RETROFITTED,
                VulnerabilityFunction.deterministic("MUR", "PGA", PGA_LEVELS, new double[]{0.02, 0.1, 0.3}),
                new VulnerabilityFunction("RC-FRAME", "PGA", PGA_LEVELS,
                        new double[]{0.01, 0.08, 0.25}, new double[]{0.3, 0.3, 0.2})));

        log.info("Seeded {} vulnerability models", registry.findAll().size());
    }
}
