package com.seismicrisk.retrofit;

import com.seismicrisk.retrofit.config.VulnerabilityDataLoader;
import com.seismicrisk.retrofit.domain.model.Asset;
import com.seismicrisk.retrofit.domain.model.HazardRunStatus;
import com.seismicrisk.retrofit.domain.model.Site;
import com.seismicrisk.retrofit.domain.repository.HazardRunRepository;
import com.seismicrisk.retrofit.hazard.HazardSource;
import com.seismicrisk.retrofit.hazard.JobConfiguration;
import com.seismicrisk.retrofit.service.RetrofitAnalysisRequest;
import com.seismicrisk.retrofit.service.RetrofitAnalysisService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Local-mode application context: synthetic hazard, demo vulnerability models, H2 ledger.
 */
@SpringBootTest
class RetrofitAdvisorApplicationTest {

    @Autowired
    private RetrofitAnalysisService analysisService;

    @Autowired
    private HazardRunRepository hazardRunRepository;

    @Test
    @DisplayName("Analyzes the demo models end to end and reuses hazard on the rerun")
    void analyzesDemoPortfolio() {
        // Given
        var config = JobConfiguration.builder()
                .sourceModel("demo-source-model")
                .gmpeLogicTree("demo-gmpe-tree")
                .sites(List.of(new Site("demo-site", 12.5, 41.9)))
                .intensityMeasureLevels(Map.of("PGA", List.of(0.05, 0.1, 0.2, 0.3, 0.5, 0.8)))
                .originalVulnerabilityModel(VulnerabilityDataLoader.DEMO_ORIGINAL)
                .retrofittedVulnerabilityModel(VulnerabilityDataLoader.DEMO_RETROFITTED)
                .build();
        var assets = List.of(
                new Asset("school", "MUR", "demo-site", 2_000_000.0, 150_000.0),
                new Asset("clinic", "RC-FRAME", "demo-site", 1_500_000.0, 90_000.0));

        // When
        var first = analysisService.analyze(RetrofitAnalysisRequest.of(config, assets));
        var second = analysisService.analyze(RetrofitAnalysisRequest.of(config.toBuilder().interestRate(0.03).build(), assets));

        // Then
        assertThat(first.failureCount()).isZero();
        assertThat(first.outcomes().get("school").result().annualBenefit()).isPositive();
        assertThat(second.hazardSource()).isEqualTo(HazardSource.CACHE);
        assertThat(second.cacheKey()).isEqualTo(first.cacheKey());

        var run = hazardRunRepository.findByCacheKey(first.cacheKey()).orElseThrow();
        assertThat(run.getStatus()).isEqualTo(HazardRunStatus.COMPLETE);
        assertThat(run.getReuseCount()).isEqualTo(1L);
        assertThat(run.getRealizationCount()).isEqualTo(3);
    }
}
