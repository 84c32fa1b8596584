package com.seismicrisk.retrofit.hazard;

import com.seismicrisk.retrofit.adapters.HazardCalculator;
import com.seismicrisk.retrofit.domain.error.CacheInconsistencyException;
import com.seismicrisk.retrofit.domain.error.HazardComputationException;
import com.seismicrisk.retrofit.domain.model.HazardRun;
import com.seismicrisk.retrofit.domain.model.HazardRunStatus;
import com.seismicrisk.retrofit.domain.repository.HazardRunRepository;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.FutureTask;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Computes hazard curves once per set of hazard-affecting parameters and serves
 * them to every later run whose hazard parameters are unchanged.
 *
 * CONSISTENCY MODEL:
 * - Lookup and publish for a key run under the same per-key lock, so a reader sees
 *   either no store or the complete store together with its COMPLETE ledger row
 * - A cached store is trusted only if the ledger row is COMPLETE, the checksums agree
 *   and the store passes its own integrity check; anything else is discarded and
 *   recomputed
 *
 * CONCURRENCY:
 * - At most one computation per key; concurrent requesters join it
 * - Computations run on a bounded executor shared by all keys
 * - A cancelled computation publishes nothing and its waiters get
 *   {@link CancellationException}
 */
@Service
@Slf4j
public class HazardReuseController {

    private final HazardCalculator calculator;
    private final HazardCurveStoreCache storeCache;
    private final HazardRunRepository runRepository;
    private final CacheKeyFactory keyFactory;
    private final ExecutorService hazardExecutor;

    private final ConcurrentHashMap<CacheKey, Object> keyLocks = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<CacheKey, InFlightComputation> inFlight = new ConcurrentHashMap<>();

    public HazardReuseController(HazardCalculator calculator,
                                 HazardCurveStoreCache storeCache,
                                 HazardRunRepository runRepository,
                                 CacheKeyFactory keyFactory,
                                 HazardCacheProperties properties) {
        this.calculator = calculator;
        this.storeCache = storeCache;
        this.runRepository = runRepository;
        this.keyFactory = keyFactory;
        this.hazardExecutor = Executors.newFixedThreadPool(
                Math.max(1, properties.getMaxConcurrentComputations()),
                namedDaemonThreads("hazard-calc-"));
        log.info("Hazard reuse controller using calculator {} with {} concurrent computations",
                calculator.getName(), properties.getMaxConcurrentComputations());
    }

    /**
     * Returns the hazard store for a job, from cache when its hazard parameters were
     * computed before, otherwise by computing (or joining a computation of) it.
     *
     * @throws HazardComputationException when the hazard calculator fails
     * @throws CancellationException      when the computation is cancelled
     */
    public HazardLookup obtain(JobConfiguration configuration) {
        CacheKey key = keyFactory.keyFor(configuration);
        boolean recovered = false;

        while (true) {
            Optional<HazardCurveStore> cached;
            try {
                cached = lookup(key);
            } catch (CacheInconsistencyException e) {
                log.warn("Discarding hazard cache entry: {}", e.getMessage());
                discard(key, e.getMessage());
                recovered = true;
                continue;
            }

            if (cached.isPresent()) {
                runRepository.incrementReuseCount(key.value());
                log.info("Reusing hazard curves {} ({})", key.shortForm(), cached.get());
                return new HazardLookup(key, cached.get(), HazardSource.CACHE, recovered);
            }

            // Recheck inside the mapping function: a computation that published and
            // deregistered after our lookup must not be repeated.
            InFlightComputation computation = inFlight.computeIfAbsent(key,
                    k -> storeCache.get(k).isPresent() ? null : new InFlightComputation(k, configuration));
            if (computation == null) {
                continue;
            }

            boolean started = computation.startIfNew();
            if (started) {
                log.info("Computing hazard curves {} with {}", key.shortForm(), calculator.getName());
            } else {
                log.info("Joining in-flight hazard computation {}", key.shortForm());
            }
            HazardCurveStore store = computation.await();
            return new HazardLookup(key, store, started ? HazardSource.COMPUTED : HazardSource.COALESCED, recovered);
        }
    }

    public CacheKey previewKey(JobConfiguration configuration) {
        return keyFactory.keyFor(configuration);
    }

    /**
     * Interrupts the in-flight computation for a key.
     *
     * @return true when a running or queued computation was cancelled
     */
    public boolean cancel(CacheKey key) {
        InFlightComputation computation = inFlight.remove(key);
        if (computation == null) {
            log.debug("No in-flight hazard computation for {}", key.shortForm());
            return false;
        }
        boolean cancelled = computation.cancel();
        markCancelled(key);
        log.info("Cancelled hazard computation {}", key.shortForm());
        return cancelled;
    }

    /**
     * Evicts the store for a key and marks its ledger row INVALIDATED.
     *
     * @return true when the key had a ledger row
     */
    public boolean invalidate(CacheKey key) {
        synchronized (lockFor(key)) {
            storeCache.evict(key);
            Optional<HazardRun> run = runRepository.findByCacheKey(key.value());
            run.ifPresent(r -> {
                r.setStatus(HazardRunStatus.INVALIDATED);
                r.setFailureReason("Invalidated on request");
                runRepository.save(r);
            });
            log.info("Invalidated hazard curves {}", key.shortForm());
            return run.isPresent();
        }
    }

    /**
     * Evicts an unusable store and records why on its ledger row.
     */
    public void discard(CacheKey key, String reason) {
        synchronized (lockFor(key)) {
            storeCache.evict(key);
            runRepository.findByCacheKey(key.value()).ifPresent(run -> {
                run.setStatus(HazardRunStatus.INVALIDATED);
                run.setFailureReason(truncate(reason));
                runRepository.save(run);
            });
        }
    }

    /**
     * Checks a COMPLETE key against the cache without touching reuse counters.
     *
     * @throws CacheInconsistencyException when the cache does not hold what the ledger says
     */
    public void verify(CacheKey key) {
        lookup(key);
    }

    public List<HazardRun> listRuns() {
        return runRepository.findAllByOrderByStartedAtDesc();
    }

    public boolean isInFlight(CacheKey key) {
        return inFlight.containsKey(key);
    }

    @PreDestroy
    public void shutdown() {
        hazardExecutor.shutdownNow();
    }

    private Optional<HazardCurveStore> lookup(CacheKey key) {
        synchronized (lockFor(key)) {
            Optional<HazardRun> run = runRepository.findByCacheKey(key.value());
            Optional<HazardCurveStore> store = storeCache.get(key);
            boolean complete = run.map(r -> r.getStatus() == HazardRunStatus.COMPLETE).orElse(false);

            if (!complete) {
                if (store.isPresent()) {
                    throw new CacheInconsistencyException(key.value(), "store is cached but the run is not COMPLETE");
                }
                return Optional.empty();
            }
            if (store.isEmpty()) {
                throw new CacheInconsistencyException(key.value(), "run is COMPLETE but no store is cached");
            }
            HazardCurveStore found = store.get();
            if (!found.cacheKey().equals(key)) {
                throw new CacheInconsistencyException(key.value(),
                        "cached store belongs to " + found.cacheKey().shortForm());
            }
            if (!Objects.equals(run.get().getChecksum(), found.checksum())) {
                throw new CacheInconsistencyException(key.value(), "checksum does not match the run ledger");
            }
            if (!found.verifyIntegrity()) {
                throw new CacheInconsistencyException(key.value(), "store failed its integrity check");
            }
            return store;
        }
    }

    private HazardCurveStore compute(InFlightComputation computation, JobConfiguration configuration) {
        CacheKey key = computation.key;
        try {
            markRunning(key);
            HazardCurveStore store = calculator.calculate(key, configuration);
            publish(computation, store);
            return store;
        } catch (InterruptedException | CancellationException e) {
            markCancelled(key);
            throw new CancellationException("Hazard computation " + key.shortForm() + " was cancelled");
        } catch (RuntimeException e) {
            markFailed(key, e);
            throw new HazardComputationException(key.value(),
                    "Hazard computation " + key.shortForm() + " failed: " + e.getMessage(), e);
        } finally {
            inFlight.remove(key, computation);
        }
    }

    private void publish(InFlightComputation computation, HazardCurveStore store) {
        CacheKey key = computation.key;
        if (!store.cacheKey().equals(key)) {
            throw new IllegalStateException("Calculator returned a store for " + store.cacheKey().shortForm());
        }
        synchronized (lockFor(key)) {
            if (computation.isCancelled()) {
                throw new CancellationException();
            }
            storeCache.put(key, store);
            HazardRun run = runRepository.findByCacheKey(key.value()).orElseGet(() -> newRun(key));
            run.setStatus(HazardRunStatus.COMPLETE);
            run.setChecksum(store.checksum());
            run.setCurveCount(store.curveCount());
            run.setRealizationCount(store.realizationCount());
            run.setCompletedAt(LocalDateTime.now());
            run.setFailureReason(null);
            runRepository.save(run);
        }
        log.info("Published hazard curves {} ({} curves, {} realizations)",
                key.shortForm(), store.curveCount(), store.realizationCount());
    }

    private void markRunning(CacheKey key) {
        synchronized (lockFor(key)) {
            HazardRun run = runRepository.findByCacheKey(key.value()).orElseGet(() -> newRun(key));
            run.setStatus(HazardRunStatus.RUNNING);
            run.setStartedAt(LocalDateTime.now());
            run.setCompletedAt(null);
            run.setChecksum(null);
            run.setFailureReason(null);
            runRepository.save(run);
        }
    }

    private void markCancelled(CacheKey key) {
        synchronized (lockFor(key)) {
            if (storeCache.get(key).isPresent()) {
                return;
            }
            HazardRun run = runRepository.findByCacheKey(key.value()).orElseGet(() -> newRun(key));
            run.setStatus(HazardRunStatus.CANCELLED);
            run.setCompletedAt(LocalDateTime.now());
            runRepository.save(run);
        }
    }

    private void markFailed(CacheKey key, Exception cause) {
        log.error("Hazard computation {} failed: {}", key.shortForm(), cause.getMessage(), cause);
        synchronized (lockFor(key)) {
            HazardRun run = runRepository.findByCacheKey(key.value()).orElseGet(() -> newRun(key));
            run.setStatus(HazardRunStatus.FAILED);
            run.setCompletedAt(LocalDateTime.now());
            run.setFailureReason(truncate(String.valueOf(cause.getMessage())));
            runRepository.save(run);
        }
    }

    private HazardRun newRun(CacheKey key) {
        return HazardRun.builder()
                .cacheKey(key.value())
                .status(HazardRunStatus.RUNNING)
                .startedAt(LocalDateTime.now())
                .reuseCount(0L)
                .build();
    }

    private Object lockFor(CacheKey key) {
        return keyLocks.computeIfAbsent(key, k -> new Object());
    }

    private static String truncate(String text) {
        return text.length() <= 1024 ? text : text.substring(0, 1024);
    }

    private static ThreadFactory namedDaemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * One hazard computation and everyone waiting on it.
     */
    private final class InFlightComputation {

        private final CacheKey key;
        private final FutureTask<HazardCurveStore> task;
        private final AtomicBoolean started = new AtomicBoolean();

        private InFlightComputation(CacheKey key, JobConfiguration configuration) {
            this.key = key;
            this.task = new FutureTask<>(() -> compute(this, configuration));
        }

        /**
         * Submits the task if nobody has yet.
         *
         * @return true for the caller that submitted it
         */
        boolean startIfNew() {
            if (started.compareAndSet(false, true)) {
                hazardExecutor.execute(task);
                return true;
            }
            return false;
        }

        boolean cancel() {
            return task.cancel(true);
        }

        boolean isCancelled() {
            return task.isCancelled();
        }

        HazardCurveStore await() {
            try {
                return task.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CancellationException("Interrupted while waiting for hazard computation " + key.shortForm());
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof RuntimeException runtime) {
                    throw runtime;
                }
                throw new HazardComputationException(key.value(),
                        "Hazard computation " + key.shortForm() + " failed", cause);
            }
        }
    }
}
