package com.seismicrisk.retrofit.service;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded pool for per-group aggregation and per-asset loss work.
 *
 * Tasks submitted here never block on other tasks of the same pool, so the pool
 * cannot deadlock however small it is configured.
 */
@Component
@Slf4j
public class RiskWorkerPool {

    private final ExecutorService executor;
    private final int size;

    public RiskWorkerPool(WorkerProperties properties) {
        this.size = properties.effectiveWorkers();
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(size, runnable -> {
            Thread thread = new Thread(runnable, "risk-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        log.info("Risk worker pool started with {} workers", size);
    }

    public Executor executor() {
        return executor;
    }

    public int size() {
        return size;
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }
}
