package jobrelay.relay.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default notifier: records the notification in the log.
 */
public class LoggingJobNotifier implements JobNotifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingJobNotifier.class);

    @Override
    public void notify(String userId, Notification notification) {
        log.info("Notify user {} [{}]: {} - {}", userId, notification.tag(), notification.title(),
                notification.body());
    }
}
