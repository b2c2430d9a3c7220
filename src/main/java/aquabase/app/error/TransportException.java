package aquabase.app.error;

/**
 * A publish could not be handed to the transport. Says nothing about whether a
 * device would have received it.
 */
public class TransportException extends AutomationException {

    public TransportException(String message) {
        super(Kind.TRANSPORT, message);
    }

    public TransportException(String message, Throwable cause) {
        super(Kind.TRANSPORT, message, cause);
    }
}
