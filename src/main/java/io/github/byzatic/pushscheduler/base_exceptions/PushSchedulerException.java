package io.github.byzatic.pushscheduler.base_exceptions;

/**
 * Root of the checked exceptions raised by the push scheduler.
 */
public class PushSchedulerException extends Exception {
    public PushSchedulerException(String message) {
        super(message);
    }

    public PushSchedulerException(Throwable cause) {
        super(cause);
    }

    public PushSchedulerException(String message, Throwable cause) {
        super(message, cause);
    }

    public PushSchedulerException(Throwable cause, String message) {
        super(message, cause);
    }
}
