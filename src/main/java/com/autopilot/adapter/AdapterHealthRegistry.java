package com.autopilot.adapter;

import com.autopilot.domain.enums.AdapterName;
import com.autopilot.event.AdapterStatusEvent;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Last known connectivity of each adapter, updated from real call outcomes and background probes.
 *
 * <p>The health endpoint reads this map and never calls an adapter itself. A connected ->
 * disconnected transition publishes an {@link AdapterStatusEvent}.
 */
@Component
public class AdapterHealthRegistry {

    private static final Logger log = LoggerFactory.getLogger(AdapterHealthRegistry.class);

    private final Map<AdapterName, AdapterStatus> statuses = new ConcurrentHashMap<>();
    private final ApplicationEventPublisher applicationEventPublisher;

    public AdapterHealthRegistry(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
        for (AdapterName adapter : AdapterName.values()) {
            statuses.put(adapter, AdapterStatus.unknown(adapter));
        }
    }

    public void recordSuccess(AdapterName adapter, Instant at) {
        AdapterStatus previous = statuses.put(adapter, AdapterStatus.builder()
                .adapter(adapter)
                .connected(true)
                .lastCheckedAt(at)
                .build());
        if (previous != null && previous.getLastCheckedAt() != null && !previous.isConnected()) {
            log.info("Adapter {} reconnected", adapter);
            applicationEventPublisher.publishEvent(new AdapterStatusEvent(this, adapter, true, null));
        }
    }

    public void recordFailure(AdapterName adapter, Instant at, String error) {
        AdapterStatus updated = statuses.compute(adapter, (name, previous) -> AdapterStatus.builder()
                .adapter(name)
                .connected(false)
                .lastCheckedAt(at)
                .lastError(error)
                .consecutiveFailures(previous == null ? 1 : previous.getConsecutiveFailures() + 1)
                .build());
        if (updated.getConsecutiveFailures() == 1) {
            log.warn("Adapter {} unavailable: {}", adapter, error);
            applicationEventPublisher.publishEvent(new AdapterStatusEvent(this, adapter, false, error));
        }
    }

    public AdapterStatus get(AdapterName adapter) {
        return statuses.get(adapter);
    }

    /** Copy of every adapter's status, in enum order. */
    public Map<AdapterName, AdapterStatus> snapshot() {
        return new EnumMap<>(statuses);
    }

    public boolean isStale(AdapterName adapter, Instant now, Duration maxAge) {
        AdapterStatus status = statuses.get(adapter);
        return status.getLastCheckedAt() == null || status.getLastCheckedAt().plus(maxAge).isBefore(now);
    }
}
