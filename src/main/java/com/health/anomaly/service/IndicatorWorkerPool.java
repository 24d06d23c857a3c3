package com.health.anomaly.service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Runs independent per-indicator units of work on a fixed number of threads.
 * With a single thread the units run in order on the caller's thread.
 */
final class IndicatorWorkerPool {

    private IndicatorWorkerPool() {}

    /**
     * @return one result per unit, in unit order
     * @throws RuntimeException the first failure, once queued units are dropped and running ones have ended
     */
    static <T, R> List<R> runAll(int threads, List<T> units, Function<T, R> work) {
        List<R> results = new ArrayList<>(units.size());
        if (threads <= 1 || units.size() <= 1) {
            for (T unit : units) {
                results.add(work.apply(unit));
            }
            return results;
        }

        AtomicInteger counter = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(threads, units.size()), r -> {
            Thread t = new Thread(r, "indicator-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        List<Future<R>> futures = new ArrayList<>(units.size());
        try {
            for (T unit : units) {
                futures.add(executor.submit(() -> work.apply(unit)));
            }
            for (Future<R> future : futures) {
                results.add(future.get());
            }
            return results;
        } catch (ExecutionException e) {
            abort(executor, futures);
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) throw (RuntimeException) cause;
            if (cause instanceof Error) throw (Error) cause;
            throw new IllegalStateException("Indicator unit failed", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abort(executor, futures);
            throw new IllegalStateException("Interrupted while waiting for indicator units", e);
        } finally {
            executor.shutdown();
        }
    }

    // Returns only after every started unit has ended. Queued units never start.
    private static <R> void abort(ExecutorService executor, List<Future<R>> futures) {
        futures.forEach(f -> f.cancel(true));
        executor.shutdownNow();
        boolean interrupted = Thread.interrupted();
        try {
            while (true) {
                try {
                    if (executor.awaitTermination(1, TimeUnit.SECONDS)) return;
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
        } finally {
            if (interrupted) Thread.currentThread().interrupt();
        }
    }
}
