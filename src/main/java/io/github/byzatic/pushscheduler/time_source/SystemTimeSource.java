package io.github.byzatic.pushscheduler.time_source;

import org.jetbrains.annotations.NotNull;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

public final class SystemTimeSource implements TimeSource {
    private final Clock clock;

    public SystemTimeSource() {
        this(Clock.systemUTC());
    }

    public SystemTimeSource(@NotNull Clock clock) {
        this.clock = Objects.requireNonNull(clock);
    }

    @Override
    public @NotNull Instant now() {
        return clock.instant();
    }
}
