package com.updownbot.hft.controller.runner;

import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Drives {@link ControllerCycleRunner} on a single dedicated thread so cycles never overlap.
 */
@Slf4j
public class ControllerLoop {

    private final ControllerCycleRunner cycleRunner;
    private final ControllerMetrics metrics;
    private final ScheduledExecutorService executor;
    private final CountDownLatch stopped = new CountDownLatch(1);

    public ControllerLoop(ControllerCycleRunner cycleRunner, ControllerMetrics metrics) {
        this(cycleRunner, metrics, Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "updown-controller");
            t.setDaemon(true);
            return t;
        }));
    }

    ControllerLoop(ControllerCycleRunner cycleRunner, ControllerMetrics metrics, ScheduledExecutorService executor) {
        this.cycleRunner = Objects.requireNonNull(cycleRunner, "cycleRunner");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * Runs exactly one cycle on the loop thread and waits for it. Failures propagate.
     */
    public CycleResult runOnce() throws InterruptedException {
        try {
            return executor.submit(this::timedCycle).get();
        } catch (ExecutionException e) {
            metrics.cycleFailed();
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new IllegalStateException("controller cycle failed", cause);
        }
    }

    /**
     * Runs a cycle immediately and then every {@code intervalMillis} until {@code durationMillis} elapses
     * or {@link #stop()} is called. A duration of zero runs until stopped.
     */
    public void runFor(long intervalMillis, long durationMillis) throws InterruptedException {
        ScheduledFuture<?> task = executor.scheduleAtFixedRate(this::safeCycle, 0, intervalMillis, TimeUnit.MILLISECONDS);
        if (durationMillis > 0) {
            executor.schedule(this::stop, durationMillis, TimeUnit.MILLISECONDS);
        }
        try {
            stopped.await();
        } finally {
            task.cancel(false);
        }
        log.info("controller loop finished after {} ms", durationMillis);
    }

    public void stop() {
        stopped.countDown();
    }

    public void shutdown() {
        stop();
        executor.shutdownNow();
    }

    private CycleResult timedCycle() {
        Supplier<CycleResult> cycle = cycleRunner::runCycle;
        CycleResult result = metrics.cycleDuration().record(cycle);
        metrics.cycleCompleted();
        return result;
    }

    private void safeCycle() {
        try {
            timedCycle();
        } catch (Exception e) {
            metrics.cycleFailed();
            log.error("controller cycle failed", e);
        }
    }
}
