package io.github.byzatic.pushscheduler.timer;

import org.jetbrains.annotations.NotNull;

import java.time.Instant;

/**
 * Runs one-shot actions at absolute deadlines.
 */
public interface TimerFacility extends AutoCloseable {

    /**
     * Arms {@code action} to run once at {@code deadline}. A deadline already in the past fires as soon
     * as possible.
     *
     * @throws IllegalStateException if the facility was closed
     */
    @NotNull TimerHandle arm(@NotNull Instant deadline, @NotNull Runnable action);

    /**
     * Number of timers armed and not yet fired or cancelled.
     */
    int pendingCount();

    /**
     * Disarms every pending timer and releases threads. Running actions are allowed to finish.
     */
    @Override
    void close();
}
