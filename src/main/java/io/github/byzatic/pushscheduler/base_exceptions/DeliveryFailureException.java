package io.github.byzatic.pushscheduler.base_exceptions;

public class DeliveryFailureException extends PushSchedulerException {
    public DeliveryFailureException(String message) {
        super(message);
    }

    public DeliveryFailureException(Throwable cause) {
        super(cause);
    }

    public DeliveryFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
