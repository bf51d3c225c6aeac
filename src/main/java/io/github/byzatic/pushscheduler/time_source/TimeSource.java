package io.github.byzatic.pushscheduler.time_source;

import org.jetbrains.annotations.NotNull;

import java.time.Instant;

/**
 * Current time as seen by the scheduler.
 */
@FunctionalInterface
public interface TimeSource {
    @NotNull Instant now();
}
