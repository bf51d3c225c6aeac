package io.github.byzatic.pushscheduler.base_exceptions;

public class DeliveryTimedOutException extends DeliveryFailureException {
    public DeliveryTimedOutException(String message) {
        super(message);
    }

    public DeliveryTimedOutException(String message, Throwable cause) {
        super(message, cause);
    }
}
