package jobrelay.relay.hub;

/**
 * Raised by a {@link JobSubscriber} whose connection can no longer take events.
 * Always handled inside the hub by detaching the subscriber.
 */
public class SubscriberGoneException extends Exception {

    public SubscriberGoneException(String message) {
        super(message);
    }

    public SubscriberGoneException(String message, Throwable cause) {
        super(message, cause);
    }
}
