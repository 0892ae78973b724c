package com.autopilot.adapter;

import com.autopilot.audit.PersistenceAdapter;
import com.autopilot.broker.BrokerAdapter;
import com.autopilot.config.SchedulerSettings;
import com.autopilot.domain.enums.AdapterName;
import com.autopilot.exception.AdapterException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Keeps adapter connectivity fresh between cycles. Only adapters whose last recorded outcome is
 * older than the health-check interval are probed, so an active trading loop makes this a no-op.
 * The candidate source is never probed; it is fetched at most once per cycle.
 */
@Service
public class HealthProbeService {

    private static final Logger log = LoggerFactory.getLogger(HealthProbeService.class);

    private final BrokerAdapter brokerAdapter;
    private final PersistenceAdapter persistenceAdapter;
    private final AdapterCallGuard adapterCallGuard;
    private final AdapterHealthRegistry adapterHealthRegistry;
    private final SchedulerSettings schedulerSettings;
    private final Clock clock;

    public HealthProbeService(
            BrokerAdapter brokerAdapter,
            PersistenceAdapter persistenceAdapter,
            AdapterCallGuard adapterCallGuard,
            AdapterHealthRegistry adapterHealthRegistry,
            SchedulerSettings schedulerSettings,
            Clock clock) {
        this.brokerAdapter = brokerAdapter;
        this.persistenceAdapter = persistenceAdapter;
        this.adapterCallGuard = adapterCallGuard;
        this.adapterHealthRegistry = adapterHealthRegistry;
        this.schedulerSettings = schedulerSettings;
        this.clock = clock;
    }

    @Scheduled(
            initialDelayString = "${autopilot.scheduler.health-check-interval:60s}",
            fixedDelayString = "${autopilot.scheduler.health-check-interval:60s}")
    public void probeStaleAdapters() {
        Instant now = clock.instant();
        probeIfStale(AdapterName.BROKER, now, brokerAdapter::ping);
        probeIfStale(AdapterName.MARKET_DATA, now, () -> brokerAdapter.getPrices(List.of()));
        probeIfStale(AdapterName.PERSISTENCE, now, persistenceAdapter::ping);
    }

    private void probeIfStale(AdapterName adapter, Instant now, Runnable probe) {
        if (!adapterHealthRegistry.isStale(adapter, now, schedulerSettings.getHealthCheckInterval())) {
            return;
        }
        try {
            adapterCallGuard.callOnce(adapter, "probe", () -> {
                probe.run();
                return Boolean.TRUE;
            });
            log.debug("Probe of {} succeeded", adapter);
        } catch (AdapterException e) {
            log.debug("Probe of {} failed: {}", adapter, e.getMessage());
        }
    }
}
