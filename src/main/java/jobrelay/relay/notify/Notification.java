package jobrelay.relay.notify;

/**
 * Push notification payload handed to the {@link JobNotifier}.
 */
public record Notification(String title, String body, String tag, boolean requireInteraction) {
}
