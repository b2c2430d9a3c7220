package aquabase.app.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Used when no message broker is configured.
 */
public class LoggingNotifier implements Notifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotifier.class);

    @Override
    public void notify(Notification notification) {
        log.info("Notification {} for {}: {} {}", notification.type(), notification.ownerId(), notification.message(), notification.data());
    }
}
