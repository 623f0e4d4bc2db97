package jobrelay.relay.notify;

/**
 * Side-effect sink told about finished jobs. Delivery is the implementation's business;
 * the relay neither waits for nor depends on it.
 */
@FunctionalInterface
public interface JobNotifier {

    void notify(String userId, Notification notification);
}
