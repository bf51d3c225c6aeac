package io.github.byzatic.pushscheduler.config;

import io.github.byzatic.pushscheduler.facade.PushSchedulerFacade;
import io.github.byzatic.pushscheduler.job_store.InMemoryJobStore;
import io.github.byzatic.pushscheduler.job_store.JobStore;
import io.github.byzatic.pushscheduler.notifier.HttpPushNotifier;
import io.github.byzatic.pushscheduler.notifier.Notifier;
import io.github.byzatic.pushscheduler.scheduler.PushScheduler;
import io.github.byzatic.pushscheduler.time_source.SystemTimeSource;
import io.github.byzatic.pushscheduler.time_source.TimeSource;
import io.github.byzatic.pushscheduler.timer.DelayQueueTimerFacility;
import io.github.byzatic.pushscheduler.timer.VirtualTime;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Owns one complete scheduler: store, time source, notifier, scheduler and the facade over them.
 * Independent contexts share nothing.
 */
public final class PushSchedulerContext implements AutoCloseable {
    private final static Logger logger = LoggerFactory.getLogger(PushSchedulerContext.class);

    private final JobStore jobStore;
    private final TimeSource timeSource;
    private final Notifier notifier;
    private final PushScheduler scheduler;
    private final PushSchedulerFacade facade;

    private PushSchedulerContext(JobStore jobStore, TimeSource timeSource, Notifier notifier, PushScheduler scheduler) {
        this.jobStore = jobStore;
        this.timeSource = timeSource;
        this.notifier = notifier;
        this.scheduler = scheduler;
        this.facade = new PushSchedulerFacade(scheduler, timeSource);
    }

    /**
     * Wall-clock context delivering through {@link HttpPushNotifier}.
     */
    public static @NotNull PushSchedulerContext create(@NotNull PushSchedulerConfig config) {
        Objects.requireNonNull(config);
        logger.info("Starting push scheduler with {}", config);
        Notifier notifier = new HttpPushNotifier.Builder()
                .baseUrl(config.getBaseUrl())
                .query(config.getQuery())
                .requestTimeout(config.getRequestTimeout())
                .connectTimeout(config.getConnectTimeout())
                .build();
        TimeSource timeSource = new SystemTimeSource();
        JobStore store = new InMemoryJobStore();
        PushScheduler scheduler = new PushScheduler.Builder()
                .jobStore(store)
                .timeSource(timeSource)
                .timerFacility(new DelayQueueTimerFacility.Builder()
                        .timeSource(timeSource)
                        .workerThreads(config.getWorkerThreads())
                        .build())
                .notifier(notifier)
                .build();
        return new PushSchedulerContext(store, timeSource, notifier, scheduler);
    }

    /**
     * Context driven by a virtual clock, with the given notifier.
     */
    public static @NotNull PushSchedulerContext create(@NotNull VirtualTime virtualTime, @NotNull Notifier notifier) {
        JobStore store = new InMemoryJobStore();
        PushScheduler scheduler = new PushScheduler.Builder()
                .jobStore(store)
                .virtualTime(virtualTime)
                .notifier(notifier)
                .build();
        return new PushSchedulerContext(store, virtualTime, notifier, scheduler);
    }

    public @NotNull JobStore getJobStore() {
        return jobStore;
    }

    public @NotNull TimeSource getTimeSource() {
        return timeSource;
    }

    public @NotNull Notifier getNotifier() {
        return notifier;
    }

    public @NotNull PushScheduler getScheduler() {
        return scheduler;
    }

    public @NotNull PushSchedulerFacade getFacade() {
        return facade;
    }

    @Override
    public void close() {
        logger.info("Stopping push scheduler");
        scheduler.close();
    }
}
