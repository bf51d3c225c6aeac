package io.github.byzatic.pushscheduler.job;

import org.jetbrains.annotations.NotNull;

/**
 * Lifecycle of a scheduled push.
 * <p>
 * {@code SCHEDULED -> COMPLETING | CANCELLED}, {@code COMPLETING -> COMPLETED | FAILED}.
 * {@code COMPLETING} is held only while the notifier call is in flight.
 */
public enum JobStatus {
    SCHEDULED,
    COMPLETING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(@NotNull JobStatus next) {
        switch (this) {
            case SCHEDULED:
                return next == COMPLETING || next == CANCELLED;
            case COMPLETING:
                return next == COMPLETED || next == FAILED;
            default:
                return false;
        }
    }

    /**
     * Lower-case name used in responses.
     */
    public @NotNull String label() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }
}
