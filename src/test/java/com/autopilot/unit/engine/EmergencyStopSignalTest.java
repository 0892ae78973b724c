package com.autopilot.unit.engine;

import static org.assertj.core.api.Assertions.assertThat;

import com.autopilot.core.engine.EmergencyStopSignal;
import com.autopilot.domain.enums.StopOrigin;
import com.autopilot.domain.model.EmergencyStopRequest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class EmergencyStopSignalTest {

    private static final Instant NOW = Instant.parse("2026-03-11T15:00:00Z");

    private final EmergencyStopSignal signal = new EmergencyStopSignal(Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    @DisplayName("First trigger wins; later triggers keep the original request")
    void firstTriggerWins() {
        assertThat(signal.isRequested()).isFalse();

        assertThat(signal.trigger("runaway losses", StopOrigin.DASHBOARD)).isTrue();
        assertThat(signal.trigger("again", StopOrigin.OPERATOR_CLI)).isFalse();

        EmergencyStopRequest request = signal.current().orElseThrow();
        assertThat(request.getReason()).isEqualTo("runaway losses");
        assertThat(request.getOrigin()).isEqualTo(StopOrigin.DASHBOARD);
        assertThat(request.getRequestedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("The request is consumed exactly once but stays visible")
    void consumedOnce() {
        signal.trigger("halt", StopOrigin.DASHBOARD);

        assertThat(signal.consume()).isPresent();
        assertThat(signal.consume()).isEmpty();
        assertThat(signal.isRequested()).isTrue();
        assertThat(signal.current()).isPresent();
    }

    @Test
    @DisplayName("Concurrent triggers create exactly one request")
    void concurrentTriggers() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        try {
            for (int i = 0; i < 8; i++) {
                String reason = "click " + i;
                results.add(pool.submit(() -> {
                    start.await();
                    return signal.trigger(reason, StopOrigin.DASHBOARD);
                }));
            }
            start.countDown();
            int created = 0;
            for (Future<Boolean> result : results) {
                if (result.get(5, TimeUnit.SECONDS)) {
                    created++;
                }
            }
            assertThat(created).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("A trigger wakes a sleeping loop early")
    void triggerWakesAwait() throws Exception {
        Thread trigger = new Thread(() -> {
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            signal.trigger("wake up", StopOrigin.DASHBOARD);
        });
        long started = System.nanoTime();
        trigger.start();

        signal.await(Duration.ofSeconds(10));

        assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(5));
        trigger.join();
    }

    @Test
    @DisplayName("A wake before await is not lost")
    void pendingWake() throws Exception {
        signal.wake();
        long started = System.nanoTime();

        signal.await(Duration.ofSeconds(10));

        assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(5));
    }
}
