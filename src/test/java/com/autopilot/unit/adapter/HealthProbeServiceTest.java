package com.autopilot.unit.adapter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.autopilot.adapter.AdapterCallGuard;
import com.autopilot.adapter.AdapterHealthRegistry;
import com.autopilot.adapter.HealthProbeService;
import com.autopilot.audit.PersistenceAdapter;
import com.autopilot.broker.BrokerAdapter;
import com.autopilot.config.AdapterSettings;
import com.autopilot.config.SchedulerSettings;
import com.autopilot.domain.enums.AdapterName;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

@ExtendWith(MockitoExtension.class)
class HealthProbeServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-11T15:00:00Z");

    @Mock
    private BrokerAdapter brokerAdapter;

    @Mock
    private PersistenceAdapter persistenceAdapter;

    @Mock
    private ApplicationEventPublisher applicationEventPublisher;

    private ExecutorService adapterExecutor;
    private AdapterHealthRegistry adapterHealthRegistry;
    private HealthProbeService healthProbeService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        adapterExecutor = Executors.newCachedThreadPool();
        adapterHealthRegistry = new AdapterHealthRegistry(applicationEventPublisher);
        AdapterCallGuard adapterCallGuard = new AdapterCallGuard(
                AdapterSettings.builder()
                        .callTimeout(Duration.ofMillis(500))
                        .maxAttempts(2)
                        .initialBackoff(Duration.ofMillis(10))
                        .backoffMultiplier(2.0)
                        .build(),
                adapterHealthRegistry,
                adapterExecutor,
                clock);
        healthProbeService = new HealthProbeService(
                brokerAdapter,
                persistenceAdapter,
                adapterCallGuard,
                adapterHealthRegistry,
                SchedulerSettings.builder().healthCheckInterval(Duration.ofSeconds(60)).build(),
                clock);
    }

    @AfterEach
    void tearDown() {
        adapterExecutor.shutdownNow();
    }

    @Test
    @DisplayName("Adapters never checked are probed and marked connected")
    void probesUncheckedAdapters() {
        healthProbeService.probeStaleAdapters();

        verify(brokerAdapter).ping();
        verify(brokerAdapter).getPrices(List.of());
        verify(persistenceAdapter).ping();
        assertThat(adapterHealthRegistry.get(AdapterName.BROKER).isConnected()).isTrue();
        assertThat(adapterHealthRegistry.get(AdapterName.PERSISTENCE).getLastCheckedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("Adapters with a recent outcome are left alone")
    void skipsFreshAdapters() {
        adapterHealthRegistry.recordSuccess(AdapterName.BROKER, NOW.minusSeconds(30));
        adapterHealthRegistry.recordSuccess(AdapterName.MARKET_DATA, NOW.minusSeconds(30));
        adapterHealthRegistry.recordFailure(AdapterName.PERSISTENCE, NOW.minusSeconds(10), "disk full");

        healthProbeService.probeStaleAdapters();

        verify(brokerAdapter, never()).ping();
        verify(brokerAdapter, never()).getPrices(anyCollection());
        verify(persistenceAdapter, never()).ping();
    }

    @Test
    @DisplayName("The candidate source is never probed")
    void neverProbesCandidates() {
        healthProbeService.probeStaleAdapters();

        assertThat(adapterHealthRegistry.get(AdapterName.CANDIDATES).getLastCheckedAt()).isNull();
    }

    @Test
    @DisplayName("A failing probe is recorded without escaping the scheduled task")
    void failedProbeRecorded() {
        doThrow(new IllegalStateException("database locked")).when(persistenceAdapter).ping();

        assertThatCode(() -> healthProbeService.probeStaleAdapters()).doesNotThrowAnyException();

        assertThat(adapterHealthRegistry.get(AdapterName.PERSISTENCE).isConnected()).isFalse();
        assertThat(adapterHealthRegistry.get(AdapterName.PERSISTENCE).getConsecutiveFailures()).isEqualTo(1);
        assertThat(adapterHealthRegistry.get(AdapterName.BROKER).isConnected()).isTrue();
    }
}
