package io.github.byzatic.pushscheduler.timer;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.errorprone.annotations.ThreadSafe;
import io.github.byzatic.pushscheduler.time_source.SystemTimeSource;
import io.github.byzatic.pushscheduler.time_source.TimeSource;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.DelayQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Wall-clock timer facility.
 * - One daemon dispatcher thread blocks on a {@link DelayQueue} until the earliest deadline.
 * - Due actions are handed to a worker pool, so a slow action never delays other deadlines.
 * - Cancelled entries are removed from the queue eagerly.
 */
@ThreadSafe
public final class DelayQueueTimerFacility implements TimerFacility {
    private final static Logger logger = LoggerFactory.getLogger(DelayQueueTimerFacility.class);

    private final ThreadPoolExecutor executor;
    private final TimeSource timeSource;
    private final DelayQueue<ScheduledEntry> queue = new DelayQueue<>();
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicBoolean running = new AtomicBoolean(true);
    private final Thread dispatcher;

    private DelayQueueTimerFacility(ThreadPoolExecutor executor, TimeSource timeSource) {
        this.executor = executor;
        this.timeSource = timeSource;

        this.dispatcher = new Thread(this::dispatchLoop, "push-timer-dispatcher");
        this.dispatcher.setDaemon(true);
        this.dispatcher.start();
    }

    public static final class Builder {
        private ThreadPoolExecutor executor;
        private TimeSource timeSource = new SystemTimeSource();
        private int workerThreads = Math.max(2, Runtime.getRuntime().availableProcessors());

        /**
         * Provide your own worker pool for firing actions.
         */
        public Builder executor(ThreadPoolExecutor executor) {
            this.executor = Objects.requireNonNull(executor);
            return this;
        }

        /**
         * Must track the wall clock; the dispatcher sleeps in real time.
         */
        public Builder timeSource(TimeSource timeSource) {
            this.timeSource = Objects.requireNonNull(timeSource);
            return this;
        }

        public Builder workerThreads(int workerThreads) {
            if (workerThreads < 1) throw new IllegalArgumentException("workerThreads must be >= 1");
            this.workerThreads = workerThreads;
            return this;
        }

        public DelayQueueTimerFacility build() {
            if (executor == null) {
                executor = new ThreadPoolExecutor(
                        workerThreads,
                        workerThreads,
                        60, TimeUnit.SECONDS,
                        new LinkedBlockingQueue<>(),
                        new ThreadFactoryBuilder()
                                .setNameFormat("push-timer-exec-%d")
                                .setDaemon(false)
                                .setUncaughtExceptionHandler((th, ex) ->
                                        logger.error("Uncaught in {}", th.getName(), ex))
                                .build(),
                        new ThreadPoolExecutor.CallerRunsPolicy()
                );
                executor.allowCoreThreadTimeOut(true);
            }
            return new DelayQueueTimerFacility(executor, timeSource);
        }
    }

    @Override
    public @NotNull TimerHandle arm(@NotNull Instant deadline, @NotNull Runnable action) {
        Objects.requireNonNull(deadline);
        Objects.requireNonNull(action);
        if (!running.get()) throw new IllegalStateException("Timer facility is closed");

        ScheduledEntry entry = new ScheduledEntry(deadline, sequence.incrementAndGet(), action, timeSource, queue::remove);
        queue.offer(entry);
        logger.debug("Armed timer #{} for {}", entry.sequence, deadline);
        return entry;
    }

    @Override
    public int pendingCount() {
        return queue.size();
    }

    @Override
    public void close() {
        if (!running.compareAndSet(true, false)) return;
        dispatcher.interrupt();

        List<ScheduledEntry> left = new ArrayList<>();
        queue.drainTo(left);
        // drainTo only takes expired entries
        left.addAll(queue);
        queue.clear();
        for (ScheduledEntry e : left) e.markCancelled();
        if (!left.isEmpty()) logger.debug("Disarmed {} pending timers on close", left.size());

        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    private void dispatchLoop() {
        while (running.get()) {
            try {
                ScheduledEntry entry = queue.take(); // blocks until the earliest deadline
                if (!entry.markFired()) continue; // cancelled while being taken
                executor.execute(() -> runAction(entry));
            } catch (InterruptedException ie) {
                if (!running.get()) break;
            } catch (RuntimeException e) {
                logger.error("Timer dispatcher error, keep running", e);
            }
        }
    }

    private void runAction(ScheduledEntry entry) {
        try {
            entry.action.run();
        } catch (RuntimeException e) {
            logger.error("Timer action #{} failed", entry.sequence, e);
        } catch (Error e) {
            logger.error("Timer action #{} failed with error", entry.sequence, e);
            throw e;
        }
    }
}
