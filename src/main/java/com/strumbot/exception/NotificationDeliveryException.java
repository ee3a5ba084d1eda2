package com.strumbot.exception;

/**
 * Outbound notification could not be delivered.
 * Status is -1 when no HTTP response was received.
 */
public class NotificationDeliveryException extends StrumbotException {

    private final int status;

    public NotificationDeliveryException(int status, String message) {
        super(message);
        this.status = status;
    }

    public NotificationDeliveryException(String message, Throwable cause) {
        super(message, cause);
        this.status = -1;
    }

    public int getStatus() {
        return status;
    }

    /**
     * Factory method for a rejected webhook call.
     */
    public static NotificationDeliveryException rejected(int status, String body) {
        return new NotificationDeliveryException(status,
                "Webhook rejected notification with status " + status + ": " + body);
    }

    /**
     * Factory method for a webhook call that never got a response.
     */
    public static NotificationDeliveryException unreachable(Throwable cause) {
        return new NotificationDeliveryException("Webhook unreachable", cause);
    }
}
