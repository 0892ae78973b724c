package com.autopilot.core.engine;

import com.autopilot.domain.enums.StopOrigin;
import com.autopilot.domain.model.EmergencyStopRequest;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Hand-off point between the control surface and the scheduling loop for emergency stops.
 *
 * <p>Only the first {@link #trigger} creates a request; later calls are acknowledged and ignored.
 * The scheduling loop checks {@link #isRequested()} between account steps and takes the request
 * exactly once through {@link #consume()}. A trigger also wakes the loop if it is idle.
 */
@Component
public class EmergencyStopSignal {

    private static final Logger log = LoggerFactory.getLogger(EmergencyStopSignal.class);

    private final Clock clock;
    private final AtomicReference<EmergencyStopRequest> request = new AtomicReference<>();
    private final AtomicBoolean consumed = new AtomicBoolean(false);

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition wakeUp = lock.newCondition();
    private boolean wakeUpPending;

    public EmergencyStopSignal(Clock clock) {
        this.clock = clock;
    }

    /** Returns true when this call created the request, false when one already existed. */
    public boolean trigger(String reason, StopOrigin origin) {
        EmergencyStopRequest created = new EmergencyStopRequest(reason, origin, clock.instant());
        if (!request.compareAndSet(null, created)) {
            log.warn("Emergency stop already requested, ignoring trigger from {}: {}", origin, reason);
            return false;
        }
        log.error("EMERGENCY STOP requested by {}: {}", origin, reason);
        wake();
        return true;
    }

    public boolean isRequested() {
        return request.get() != null;
    }

    /** The request, exactly once. Empty if none was triggered or it was already consumed. */
    public Optional<EmergencyStopRequest> consume() {
        EmergencyStopRequest pending = request.get();
        if (pending == null || !consumed.compareAndSet(false, true)) {
            return Optional.empty();
        }
        return Optional.of(pending);
    }

    public Optional<EmergencyStopRequest> current() {
        return Optional.ofNullable(request.get());
    }

    /** Wakes a loop blocked in {@link #await}. Also used for manual resets and shutdown. */
    public void wake() {
        lock.lock();
        try {
            wakeUpPending = true;
            wakeUp.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /** Sleeps up to {@code timeout}, returning early on {@link #wake()}. */
    public void await(Duration timeout) throws InterruptedException {
        lock.lock();
        try {
            long remaining = timeout.toNanos();
            while (!wakeUpPending && remaining > 0) {
                remaining = wakeUp.awaitNanos(remaining);
            }
            wakeUpPending = false;
        } finally {
            lock.unlock();
        }
    }
}
