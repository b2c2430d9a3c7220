package aquabase.app.message;

import aquabase.app.error.TransportException;

/**
 * Handle on the pub/sub transport. Connection lifecycle belongs to whoever
 * created the handle.
 */
public interface DeviceTransport extends AutoCloseable {

    /**
     * Fire and forget. Returning normally means the transport accepted the
     * message, not that a device received it.
     */
    void publish(String topic, byte[] payload) throws TransportException;

    boolean isConnected();

    @Override
    void close();
}
