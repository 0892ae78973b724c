package com.autopilot.config;

import java.lang.reflect.Method;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pools outside the scheduling loop.
 *
 * <ul>
 *   <li>{@code eventExecutor}: {@code @Async} event listeners (notifications). When the queue is
 *       full the event is dropped and logged; it never runs on the publishing thread, which is
 *       usually the scheduling loop.</li>
 *   <li>{@code adapterExecutor}: runs guarded adapter calls so the caller can enforce a deadline.
 *       Unbounded, so a hung call never starves the next one.</li>
 *   <li>{@code accountExecutor}: per-account steps when {@code scheduler.parallel-accounts} is on</li>
 * </ul>
 */
@Configuration
public class AsyncConfig implements AsyncConfigurer {

    @Value("${executors.event-core-pool-size:2}")
    private int eventCorePoolSize;

    @Value("${executors.event-max-pool-size:4}")
    private int eventMaxPoolSize;

    @Value("${executors.event-queue-capacity:500}")
    private int eventQueueCapacity;

    @Value("${executors.account-pool-size:4}")
    private int accountPoolSize;

    @Bean("eventExecutor")
    public ThreadPoolTaskExecutor eventExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(eventCorePoolSize);
        executor.setMaxPoolSize(eventMaxPoolSize);
        executor.setQueueCapacity(eventQueueCapacity);
        executor.setThreadNamePrefix("event-");
        executor.setRejectedExecutionHandler(new DiscardAndLogPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }

    @Bean(name = "adapterExecutor", destroyMethod = "shutdownNow")
    public ExecutorService adapterExecutor() {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("adapter-");
        threadFactory.setDaemon(true);
        return Executors.newCachedThreadPool(threadFactory);
    }

    @Bean(name = "accountExecutor", destroyMethod = "shutdown")
    public ExecutorService accountExecutor() {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("account-");
        threadFactory.setDaemon(true);
        return Executors.newFixedThreadPool(accountPoolSize, threadFactory);
    }

    @Override
    public Executor getAsyncExecutor() {
        return eventExecutor();
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return (Throwable throwable, Method method, Object... params) -> {
            Logger logger = LoggerFactory.getLogger(method.getDeclaringClass());
            logger.error("Async error in method {}: {}", method.getName(), throwable.getMessage(), throwable);
        };
    }

    /** Drops a task rejected by a saturated pool and counts it. */
    public static class DiscardAndLogPolicy implements RejectedExecutionHandler {

        private static final Logger log = LoggerFactory.getLogger(DiscardAndLogPolicy.class);

        private final AtomicLong discarded = new AtomicLong();

        @Override
        public void rejectedExecution(Runnable task, ThreadPoolExecutor executor) {
            long total = discarded.incrementAndGet();
            log.warn(
                    "Event executor saturated ({} active, {} queued), discarded event task ({} so far)",
                    executor.getActiveCount(),
                    executor.getQueue().size(),
                    total);
        }

        public long getDiscarded() {
            return discarded.get();
        }
    }
}
