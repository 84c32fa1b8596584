package com.seismicrisk.retrofit;

import com.seismicrisk.retrofit.adapters.HazardCalculator;
import com.seismicrisk.retrofit.domain.model.HazardCurve;
import com.seismicrisk.retrofit.domain.model.Site;
import com.seismicrisk.retrofit.hazard.CacheKey;
import com.seismicrisk.retrofit.hazard.HazardCurveStore;
import com.seismicrisk.retrofit.hazard.JobConfiguration;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Hazard calculator for tests. Produces a single realization "rlz-000" of weight 1.0
 * whose curves repeat {@link RetrofitFixtures#HAZARD_POES} (halving further for any
 * extra levels), counts its calls, and can be made to block or fail.
 */
public class StubHazardCalculator implements HazardCalculator {

    public static final String REALIZATION = "rlz-000";

    private final AtomicInteger calls = new AtomicInteger();
    private final CountDownLatch entered = new CountDownLatch(1);
    private volatile CountDownLatch gate;
    private volatile RuntimeException failure;

    /**
     * Makes the first call wait until {@link #release()}; an interrupt ends the wait.
     */
    public StubHazardCalculator blockFirstCall() {
        this.gate = new CountDownLatch(1);
        return this;
    }

    public StubHazardCalculator failWith(RuntimeException failure) {
        this.failure = failure;
        return this;
    }

    public void release() {
        CountDownLatch current = gate;
        if (current != null) {
            current.countDown();
        }
    }

    /**
     * Waits until the calculator has been entered at least once.
     */
    public boolean awaitEntered(long millis) throws InterruptedException {
        return entered.await(millis, TimeUnit.MILLISECONDS);
    }

    public int calls() {
        return calls.get();
    }

    @Override
    public String getName() {
        return "stub";
    }

    @Override
    public HazardCurveStore calculate(CacheKey cacheKey, JobConfiguration configuration) throws InterruptedException {
        int call = calls.incrementAndGet();
        entered.countDown();
        CountDownLatch current = gate;
        if (call == 1 && current != null) {
            current.await();
        }
        if (failure != null) {
            throw failure;
        }

        HazardCurveStore.Builder builder = HazardCurveStore.builder(cacheKey).weight(REALIZATION, 1.0);
        for (Site site : configuration.getSites()) {
            for (Map.Entry<String, List<Double>> imt : configuration.getIntensityMeasureLevels().entrySet()) {
                double[] levels = imt.getValue().stream().mapToDouble(Double::doubleValue).toArray();
                builder.curve(new HazardCurve(site.id(), imt.getKey(), REALIZATION, levels, poes(levels.length)));
            }
        }
        return builder.build();
    }

    private static double[] poes(int count) {
        double[] poes = new double[count];
        for (int i = 0; i < count; i++) {
            poes[i] = i < RetrofitFixtures.HAZARD_POES.length
                    ? RetrofitFixtures.HAZARD_POES[i]
                    : poes[i - 1] / 2.0;
        }
        return poes;
    }
}
