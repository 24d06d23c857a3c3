package com.health.anomaly.service;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IndicatorWorkerPoolTest {

    @Test
    void singleThread_runsInOrderOnCaller() {
        Thread caller = Thread.currentThread();
        Set<Thread> seen = ConcurrentHashMap.newKeySet();

        List<Integer> results = IndicatorWorkerPool.runAll(1, List.of(1, 2, 3), unit -> {
            seen.add(Thread.currentThread());
            return unit * 10;
        });

        assertThat(results).containsExactly(10, 20, 30);
        assertThat(seen).containsExactly(caller);
    }

    @Test
    void multipleThreads_preserveUnitOrder() {
        List<String> results = IndicatorWorkerPool.runAll(4, List.of("a", "b", "c", "d", "e", "f"),
                String::toUpperCase);

        assertThat(results).containsExactly("A", "B", "C", "D", "E", "F");
    }

    @Test
    void multipleThreads_useNamedWorkers() {
        List<String> names = IndicatorWorkerPool.runAll(2, List.of(1, 2, 3),
                unit -> Thread.currentThread().getName());

        assertThat(names).allMatch(name -> name.startsWith("indicator-worker-"));
    }

    @Test
    void emptyUnits_returnEmpty() {
        assertThat(IndicatorWorkerPool.<String, String>runAll(4, List.of(), s -> s)).isEmpty();
    }

    @Test
    void failingUnit_rethrowsOriginalRuntimeException() {
        assertThatThrownBy(() -> IndicatorWorkerPool.runAll(3, List.of(1, 2, 3), unit -> {
            if (unit == 2) throw new IllegalArgumentException("bad unit " + unit);
            return unit;
        }))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("bad unit 2");
    }

    @Test
    void failingUnit_sequential_propagates() {
        assertThatThrownBy(() -> IndicatorWorkerPool.runAll(1, List.of(1), unit -> {
            throw new IllegalStateException("boom");
        }))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("boom");
    }

    @Test
    void failingUnit_waitsForRunningUnitsBeforeRethrowing() {
        CountDownLatch slowStarted = new CountDownLatch(1);
        AtomicBoolean slowFinished = new AtomicBoolean();

        assertThatThrownBy(() -> IndicatorWorkerPool.runAll(2, List.of("fail", "slow"), unit -> {
            if (unit.equals("slow")) {
                slowStarted.countDown();
                // busy wait so an interrupt cannot cut the unit short
                long end = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(300);
                while (System.nanoTime() < end) {
                    Thread.onSpinWait();
                }
                slowFinished.set(true);
                return unit;
            }
            try {
                slowStarted.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            throw new IllegalStateException("unit failed");
        }))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("unit failed");

        assertThat(slowFinished).isTrue();
    }

    @Test
    void failingUnit_queuedUnitsNeverStart() throws InterruptedException {
        CountDownLatch failing = new CountDownLatch(1);
        AtomicInteger started = new AtomicInteger();

        assertThatThrownBy(() -> IndicatorWorkerPool.runAll(2, List.of(0, 1, 2, 3, 4, 5, 6, 7), unit -> {
            started.incrementAndGet();
            if (unit == 0) {
                failing.countDown();
                throw new IllegalArgumentException("unit 0");
            }
            // hold the other worker until the failure is raised
            try {
                failing.await(5, TimeUnit.SECONDS);
                Thread.sleep(200);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return unit;
        }))
                .isInstanceOf(IllegalArgumentException.class);

        int startedAtFailure = started.get();
        assertThat(startedAtFailure).isLessThan(8);

        Thread.sleep(300);
        assertThat(started.get()).isEqualTo(startedAtFailure);
    }
}
