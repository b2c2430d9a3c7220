package aquabase.app.notification;

/**
 * Hands notifications to whatever delivers them to users. Fire and forget:
 * implementations never throw back into the caller.
 */
public interface Notifier {

    void notify(Notification notification);
}
