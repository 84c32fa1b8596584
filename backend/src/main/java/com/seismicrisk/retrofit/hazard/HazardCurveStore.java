package com.seismicrisk.retrofit.hazard;

import com.seismicrisk.retrofit.domain.model.HazardCurve;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Immutable set of hazard curves for one cache key, indexed by site and
 * intensity-measure type, with the logic-tree weight of every realization.
 *
 * The checksum is computed once at build time over the full content (in sorted
 * order), and is what the run ledger records on publish. {@link #verifyIntegrity()}
 * recomputes it, so a store that no longer matches what was published can be detected.
 */
public final class HazardCurveStore {

    private final CacheKey cacheKey;
    private final Map<String, Map<String, List<HazardCurve>>> curvesBySiteAndImt;
    private final Map<String, Double> weights;
    private final String checksum;

    private HazardCurveStore(CacheKey cacheKey,
                             Map<String, Map<String, List<HazardCurve>>> curvesBySiteAndImt,
                             Map<String, Double> weights) {
        this.cacheKey = cacheKey;
        this.curvesBySiteAndImt = curvesBySiteAndImt;
        this.weights = weights;
        this.checksum = computeChecksum();
    }

    public static Builder builder(CacheKey cacheKey) {
        return new Builder(cacheKey);
    }

    public CacheKey cacheKey() {
        return cacheKey;
    }

    public String checksum() {
        return checksum;
    }

    public Set<String> siteIds() {
        return curvesBySiteAndImt.keySet();
    }

    /**
     * Intensity-measure types with curves at a site, in sorted order. Empty for an unknown site.
     */
    public List<String> intensityMeasureTypes(String siteId) {
        Map<String, List<HazardCurve>> byImt = curvesBySiteAndImt.get(siteId);
        return byImt == null ? List.of() : List.copyOf(byImt.keySet());
    }

    /**
     * Per-realization curves for one site and IMT, ordered by realization id.
     */
    public List<HazardCurve> curves(String siteId, String imt) {
        Map<String, List<HazardCurve>> byImt = curvesBySiteAndImt.get(siteId);
        if (byImt == null) {
            return List.of();
        }
        return byImt.getOrDefault(imt, List.of());
    }

    public Map<String, Double> weights() {
        return weights;
    }

    public int realizationCount() {
        return weights.size();
    }

    public int curveCount() {
        return curvesBySiteAndImt.values().stream()
                .flatMap(byImt -> byImt.values().stream())
                .mapToInt(List::size)
                .sum();
    }

    /**
     * True when the content still hashes to the build-time checksum and every curve
     * refers to a weighted realization.
     */
    public boolean verifyIntegrity() {
        for (Map<String, List<HazardCurve>> byImt : curvesBySiteAndImt.values()) {
            for (List<HazardCurve> curves : byImt.values()) {
                for (HazardCurve curve : curves) {
                    if (!weights.containsKey(curve.realizationId())) {
                        return false;
                    }
                }
            }
        }
        return checksum.equals(computeChecksum());
    }

    private String computeChecksum() {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
        digest.update(cacheKey.value().getBytes(StandardCharsets.UTF_8));
        for (Map.Entry<String, Double> weight : weights.entrySet()) {
            digest.update(weight.getKey().getBytes(StandardCharsets.UTF_8));
            digest.update(doubleBytes(weight.getValue()));
        }
        for (Map<String, List<HazardCurve>> byImt : curvesBySiteAndImt.values()) {
            for (List<HazardCurve> curves : byImt.values()) {
                for (HazardCurve curve : curves) {
                    digest.update(curve.siteId().getBytes(StandardCharsets.UTF_8));
                    digest.update(curve.intensityMeasureType().getBytes(StandardCharsets.UTF_8));
                    digest.update(curve.realizationId().getBytes(StandardCharsets.UTF_8));
                    for (int i = 0; i < curve.size(); i++) {
                        digest.update(doubleBytes(curve.levelAt(i)));
                        digest.update(doubleBytes(curve.poeAt(i)));
                    }
                }
            }
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    private static byte[] doubleBytes(double value) {
        return ByteBuffer.allocate(Double.BYTES).putDouble(value).array();
    }

    @Override
    public String toString() {
        return "HazardCurveStore[key=" + cacheKey.shortForm() + ", sites=" + curvesBySiteAndImt.size() +
               ", realizations=" + weights.size() + ", curves=" + curveCount() + "]";
    }

    public static final class Builder {

        private final CacheKey cacheKey;
        private final Map<String, Map<String, List<HazardCurve>>> curves = new TreeMap<>();
        private final Map<String, Double> weights = new TreeMap<>();

        private Builder(CacheKey cacheKey) {
            this.cacheKey = cacheKey;
        }

        public Builder weight(String realizationId, double weight) {
            weights.put(realizationId, weight);
            return this;
        }

        public Builder curve(HazardCurve curve) {
            curves.computeIfAbsent(curve.siteId(), s -> new TreeMap<>())
                    .computeIfAbsent(curve.intensityMeasureType(), i -> new ArrayList<>())
                    .add(curve);
            return this;
        }

        public Builder curves(Iterable<HazardCurve> toAdd) {
            toAdd.forEach(this::curve);
            return this;
        }

        public HazardCurveStore build() {
            Map<String, Map<String, List<HazardCurve>>> frozen = new TreeMap<>();
            curves.forEach((siteId, byImt) -> {
                Map<String, List<HazardCurve>> frozenByImt = new TreeMap<>();
                byImt.forEach((imt, list) -> {
                    List<HazardCurve> sorted = new ArrayList<>(list);
                    sorted.sort(Comparator.comparing(HazardCurve::realizationId));
                    for (int i = 1; i < sorted.size(); i++) {
                        if (sorted.get(i).realizationId().equals(sorted.get(i - 1).realizationId())) {
                            throw new IllegalArgumentException(String.format(
                                    "Duplicate curve for site %s, %s, realization %s",
                                    siteId, imt, sorted.get(i).realizationId()));
                        }
                    }
                    frozenByImt.put(imt, List.copyOf(sorted));
                });
                frozen.put(siteId, Collections.unmodifiableMap(frozenByImt));
            });
            return new HazardCurveStore(cacheKey,
                    Collections.unmodifiableMap(frozen),
                    Collections.unmodifiableMap(new TreeMap<>(weights)));
        }
    }
}
