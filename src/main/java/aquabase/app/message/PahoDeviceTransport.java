package aquabase.app.message;

import java.util.List;

import org.eclipse.paho.client.mqttv3.IMqttClient;
import org.eclipse.paho.client.mqttv3.MqttCallback;
import org.eclipse.paho.client.mqttv3.MqttConnectOptions;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.eclipse.paho.client.mqttv3.MqttMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import aquabase.app.error.TransportException;

public class PahoDeviceTransport implements DeviceTransport {

    private static Logger log = null;

    public static final int QOS = 0;

    private final IMqttClient mqttClient;

    public PahoDeviceTransport(IMqttClient mqttClient) {
        if (log == null) {
            log = LoggerFactory.getLogger(PahoDeviceTransport.class);
        }
        this.mqttClient = mqttClient;
    }

    /**
     * Connects and subscribes to every inbound topic of every thing.
     */
    public void connect(MqttCallback callback, int connectionTimeoutSeconds) throws MqttException {
        final MqttConnectOptions options = new MqttConnectOptions();
        options.setAutomaticReconnect(true);
        options.setCleanSession(true);
        options.setConnectionTimeout(connectionTimeoutSeconds);
        mqttClient.setCallback(callback);
        mqttClient.connect(options);
        subscribeInbound();
    }

    /**
     * Clean sessions drop subscriptions, so this runs again after every reconnect.
     */
    public void subscribeInbound() throws MqttException {
        final List<String> filters = inboundFilters();
        for (String filter : filters) {
            mqttClient.subscribe(filter, QOS);
        }
        log.info("Connected to {} and subscribed to {}.", mqttClient.getServerURI(), filters);
    }

    static List<String> inboundFilters() {
        return List.of(
            Topic.UPDATE.filter(),
            Topic.ALIVE_REPLY.filter(),
            Topic.HEALTH_REPLY.filter(),
            Topic.SLAVE_RESPONSE.filter());
    }

    @Override
    public void publish(String topic, byte[] payload) throws TransportException {
        if (!mqttClient.isConnected()) {
            throw new TransportException(String.format("MQTT client is not connected, cannot publish to %s", topic));
        }
        final MqttMessage message = new MqttMessage(payload);
        message.setQos(QOS);
        try {
            mqttClient.publish(topic, message);
        } catch (MqttException e) {
            throw new TransportException(String.format("Publish to %s failed: %s", topic, e.getMessage()), e);
        }
    }

    @Override
    public boolean isConnected() {
        return mqttClient.isConnected();
    }

    @Override
    public void close() {
        try {
            // disconnect tends to block irrespective of timeout while a connect
            // is still in progress
            if (mqttClient.isConnected()) {
                mqttClient.disconnect(10);
            }
        } catch (MqttException e) {
            log.warn("During disconnect of MQTT client: {}", e.getMessage());
        } finally {
            try {
                mqttClient.close();
            } catch (MqttException e) {
                log.warn("During closing of MQTT client: {}", e.getMessage());
            }
        }
    }
}
