package com.seismicrisk.retrofit.api;

import com.seismicrisk.retrofit.domain.error.HazardComputationException;
import com.seismicrisk.retrofit.domain.model.HazardRun;
import com.seismicrisk.retrofit.domain.model.HazardRunStatus;
import com.seismicrisk.retrofit.domain.model.VulnerabilityFunction;
import com.seismicrisk.retrofit.domain.model.VulnerabilityModel;
import com.seismicrisk.retrofit.domain.model.VulnerabilityVariant;
import com.seismicrisk.retrofit.domain.repository.VulnerabilityModelRegistry;
import com.seismicrisk.retrofit.hazard.CacheKey;
import com.seismicrisk.retrofit.hazard.HazardReuseController;
import com.seismicrisk.retrofit.hazard.JobConfiguration;
import com.seismicrisk.retrofit.service.RetrofitAnalysisRequest;
import com.seismicrisk.retrofit.service.RetrofitAnalysisResult;
import com.seismicrisk.retrofit.service.RetrofitAnalysisService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CancellationException;

/**
 * REST API for retrofit analyses and the hazard-run ledger.
 *
 * ENDPOINT DESIGN:
 * - Analyses run synchronously; the response carries every asset's outcome
 * - Per-asset failures are part of a 200 response, never an error status
 * - Bad configuration (unknown model, bad weights, invalid parameters) is a 400
 * - A failed or cancelled hazard computation fails the whole request
 */
@RestController
@RequestMapping("/api/retrofit")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Retrofit API", description = "Seismic retrofit benefit-cost analysis")
public class RetrofitAnalysisController {

    private final RetrofitAnalysisService analysisService;
    private final HazardReuseController hazardReuseController;
    private final VulnerabilityModelRegistry modelRegistry;

    @PostMapping("/analyze")
    @Operation(summary = "Run a retrofit analysis",
               description = "Computes or reuses hazard curves and returns the benefit-cost ratio of every asset")
    public ResponseEntity<RetrofitAnalysisResult> analyze(@Valid @RequestBody RetrofitAnalysisRequest request) {
        log.info("Retrofit analysis request for {} assets", request.assets().size());
        return ResponseEntity.ok(analysisService.analyze(request));
    }

    @GetMapping("/hazard-runs")
    @Operation(summary = "List hazard runs", description = "Hazard-run ledger, newest first")
    public ResponseEntity<List<HazardRunView>> listHazardRuns() {
        return ResponseEntity.ok(hazardReuseController.listRuns().stream()
                .map(HazardRunView::from)
                .toList());
    }

    @PostMapping("/hazard-runs/{cacheKey}/invalidate")
    @Operation(summary = "Invalidate cached hazard curves",
               description = "Evicts the stored curves so the next run with these hazard parameters recomputes them")
    public ResponseEntity<RunActionResponse> invalidate(@PathVariable String cacheKey) {
        boolean known = hazardReuseController.invalidate(CacheKey.of(cacheKey));
        if (!known) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(new RunActionResponse(cacheKey, false, "No hazard run with this key"));
        }
        return ResponseEntity.ok(new RunActionResponse(cacheKey, true, "Invalidated"));
    }

    @PostMapping("/hazard-runs/{cacheKey}/cancel")
    @Operation(summary = "Cancel a hazard computation", description = "Interrupts the in-flight computation for a key")
    public ResponseEntity<RunActionResponse> cancel(@PathVariable String cacheKey) {
        boolean cancelled = hazardReuseController.cancel(CacheKey.of(cacheKey));
        return ResponseEntity.ok(new RunActionResponse(cacheKey, cancelled,
                cancelled ? "Cancelled" : "No computation in flight"));
    }

    @PostMapping("/cache-key")
    @Operation(summary = "Preview a cache key",
               description = "Returns the key a configuration's hazard curves are stored under")
    public ResponseEntity<CacheKeyResponse> previewCacheKey(@Valid @RequestBody JobConfiguration configuration) {
        return ResponseEntity.ok(new CacheKeyResponse(hazardReuseController.previewKey(configuration).value()));
    }

    @GetMapping("/vulnerability-models")
    @Operation(summary = "List vulnerability models")
    public ResponseEntity<List<VulnerabilityModelSummary>> listModels() {
        return ResponseEntity.ok(modelRegistry.findAll().stream()
                .map(VulnerabilityModelSummary::from)
                .sorted(Comparator.comparing(VulnerabilityModelSummary::reference))
                .toList());
    }

    @PutMapping("/vulnerability-models")
    @Operation(summary = "Register a vulnerability model",
               description = "Adds or replaces a model; takes effect for analyses started afterwards")
    public ResponseEntity<VulnerabilityModelSummary> registerModel(@Valid @RequestBody VulnerabilityModelRequest request) {
        VulnerabilityModel model = modelRegistry.register(VulnerabilityModel.of(
                request.reference(), request.variant(), request.functions().toArray(VulnerabilityFunction[]::new)));
        return ResponseEntity.ok(VulnerabilityModelSummary.from(model));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleBadRequest(IllegalArgumentException e) {
        log.warn("Rejected request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(ErrorResponse.of("BAD_REQUEST", e.getMessage()));
    }

    @ExceptionHandler(HazardComputationException.class)
    public ResponseEntity<ErrorResponse> handleHazardFailure(HazardComputationException e) {
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(ErrorResponse.of("HAZARD_COMPUTATION_FAILED", e.getMessage()));
    }

    @ExceptionHandler(CancellationException.class)
    public ResponseEntity<ErrorResponse> handleCancelled(CancellationException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(ErrorResponse.of("CANCELLED", e.getMessage()));
    }

    // Request/Response DTOs

    public record VulnerabilityModelRequest(
            @NotBlank String reference,
            @NotNull VulnerabilityVariant variant,
            @NotEmpty List<VulnerabilityFunction> functions
    ) {}

    public record VulnerabilityModelSummary(
            String reference,
            VulnerabilityVariant variant,
            List<String> taxonomies
    ) {
        static VulnerabilityModelSummary from(VulnerabilityModel model) {
            return new VulnerabilityModelSummary(model.reference(), model.variant(),
                    model.functions().keySet().stream().sorted().toList());
        }
    }

    public record HazardRunView(
            String cacheKey,
            HazardRunStatus status,
            String checksum,
            Integer curveCount,
            Integer realizationCount,
            Long reuseCount,
            LocalDateTime startedAt,
            LocalDateTime completedAt,
            String failureReason
    ) {
        static HazardRunView from(HazardRun run) {
            return new HazardRunView(run.getCacheKey(), run.getStatus(), run.getChecksum(), run.getCurveCount(),
                    run.getRealizationCount(), run.getReuseCount(), run.getStartedAt(), run.getCompletedAt(),
                    run.getFailureReason());
        }
    }

    public record RunActionResponse(String cacheKey, boolean applied, String message) {}

    public record CacheKeyResponse(String cacheKey) {}

    public record ErrorResponse(String error, String message, LocalDateTime timestamp) {
        static ErrorResponse of(String error, String message) {
            return new ErrorResponse(error, message, LocalDateTime.now());
        }
    }
}
