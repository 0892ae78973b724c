package com.autopilot.adapter;

import com.autopilot.config.AdapterSettings;
import com.autopilot.domain.enums.AdapterName;
import com.autopilot.exception.AdapterException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import java.time.Clock;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Every call from the control core into an adapter goes through here.
 *
 * <ul>
 *   <li>Deadline: the call runs on an {@code adapter-} thread and is abandoned (interrupted) after
 *       {@code adapters.call-timeout}.</li>
 *   <li>Retry ({@link #call} only): transient {@link AdapterException}s and timeouts are retried with
 *       exponential backoff, up to {@code adapters.max-attempts} in total.</li>
 *   <li>Outcome: recorded in {@link AdapterHealthRegistry}; failures surface as
 *       {@link AdapterException}.</li>
 * </ul>
 *
 * <p>{@link #callOnce} applies the deadline without retry. Order submission uses it: a submit that
 * timed out may have reached the broker, so it is reported as failed, never resent.
 */
@Component
public class AdapterCallGuard {

    private static final Logger log = LoggerFactory.getLogger(AdapterCallGuard.class);

    private final AdapterSettings adapterSettings;
    private final AdapterHealthRegistry adapterHealthRegistry;
    private final ExecutorService adapterExecutor;
    private final Clock clock;
    private final RetryRegistry retryRegistry;
    private final TimeLimiter timeLimiter;

    public AdapterCallGuard(
            AdapterSettings adapterSettings,
            AdapterHealthRegistry adapterHealthRegistry,
            @Qualifier("adapterExecutor") ExecutorService adapterExecutor,
            Clock clock) {
        this.adapterSettings = adapterSettings;
        this.adapterHealthRegistry = adapterHealthRegistry;
        this.adapterExecutor = adapterExecutor;
        this.clock = clock;
        this.retryRegistry = RetryRegistry.of(RetryConfig.custom()
                .maxAttempts(adapterSettings.getMaxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        adapterSettings.getInitialBackoff(), adapterSettings.getBackoffMultiplier()))
                .retryOnException(AdapterCallGuard::isRetryable)
                .build());
        this.retryRegistry.getEventPublisher().onEntryAdded(added -> added.getAddedEntry()
                .getEventPublisher()
                .onRetry(event -> log.warn(
                        "Retrying {} (attempt {}) in {}: {}",
                        event.getName(),
                        event.getNumberOfRetryAttempts(),
                        event.getWaitInterval(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown")));
        this.timeLimiter = TimeLimiter.of(
                "adapters",
                TimeLimiterConfig.custom()
                        .timeoutDuration(adapterSettings.getCallTimeout())
                        .cancelRunningFuture(true)
                        .build());
    }

    /** Deadline plus retry on transient failures. */
    public <T> T call(AdapterName adapter, String operation, Supplier<T> supplier) {
        Retry retry = retryFor(adapter);
        Callable<T> guarded = Retry.decorateCallable(retry, withDeadline(supplier));
        return execute(adapter, operation, guarded);
    }

    /** Deadline only. */
    public <T> T callOnce(AdapterName adapter, String operation, Supplier<T> supplier) {
        return execute(adapter, operation, withDeadline(supplier));
    }

    public void run(AdapterName adapter, String operation, Runnable runnable) {
        call(adapter, operation, () -> {
            runnable.run();
            return null;
        });
    }

    private <T> Callable<T> withDeadline(Supplier<T> supplier) {
        return TimeLimiter.decorateFutureSupplier(timeLimiter, () -> adapterExecutor.submit(supplier::get));
    }

    private <T> T execute(AdapterName adapter, String operation, Callable<T> callable) {
        try {
            T result = callable.call();
            adapterHealthRegistry.recordSuccess(adapter, clock.instant());
            return result;
        } catch (Exception e) {
            AdapterException failure = translate(adapter, operation, e);
            adapterHealthRegistry.recordFailure(adapter, clock.instant(), failure.getMessage());
            throw failure;
        }
    }

    private AdapterException translate(AdapterName adapter, String operation, Exception e) {
        if (e instanceof AdapterException adapterException) {
            return adapterException;
        }
        if (e instanceof TimeoutException) {
            return new AdapterException(
                    adapter,
                    adapter + "." + operation + " timed out after " + adapterSettings.getCallTimeout().toMillis() + "ms",
                    true,
                    e);
        }
        if (e instanceof InterruptedException) {
            Thread.currentThread().interrupt();
            return new AdapterException(adapter, adapter + "." + operation + " interrupted", true, e);
        }
        return new AdapterException(adapter, adapter + "." + operation + " failed: " + e.getMessage(), false, e);
    }

    private Retry retryFor(AdapterName adapter) {
        return retryRegistry.retry(adapter.name());
    }

    static boolean isRetryable(Throwable throwable) {
        if (throwable instanceof TimeoutException) {
            return true;
        }
        return throwable instanceof AdapterException adapterException && adapterException.isTransientFailure();
    }
}
