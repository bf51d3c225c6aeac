package io.github.byzatic.pushscheduler.base_exceptions;

import org.jetbrains.annotations.NotNull;

/**
 * The requested trigger time cannot be admitted. The caller has to resubmit with a corrected time.
 */
public class InvalidScheduleException extends PushSchedulerException {

    public enum Reason {
        /** Trigger time is not strictly after the current time. */
        NOT_IN_FUTURE
    }

    private final Reason reason;

    public InvalidScheduleException(@NotNull Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public @NotNull Reason getReason() {
        return reason;
    }
}
