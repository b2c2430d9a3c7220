package aquabase.app.message;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;

import org.eclipse.paho.client.mqttv3.IMqttDeliveryToken;
import org.eclipse.paho.client.mqttv3.MqttCallbackExtended;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.eclipse.paho.client.mqttv3.MqttMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import aquabase.app.provider.Metrics;
import io.sentry.Sentry;

/**
 * Receives device reports from the broker. Parsing happens on the client thread;
 * handling is submitted to the event executor, one task per message.
 */
public class Mqtt implements MqttCallbackExtended {

    private static Logger log = null;

    private Metrics metrics = null;

    private final ExecutorService srv;
    private final DeviceMessageHandler handler;
    private final PahoDeviceTransport transport;
    private final ObjectMapper mapper;

    public Mqtt(ExecutorService srv, DeviceMessageHandler handler, PahoDeviceTransport transport) {
        if (log == null) {
            log = LoggerFactory.getLogger(Mqtt.class);
        }
        this.srv = srv;
        this.handler = handler;
        this.transport = transport;
        this.mapper = new ObjectMapper();
        this.metrics = Metrics.getInstance();
    }

    @Override
    public void messageArrived(String topic, MqttMessage message) throws Exception {
        metrics.postMetric("message", Map.of("type", "mqtt"));
        final byte[] payload = message.getPayload();
        try {
            final Optional<Topic> kind = Topic.matchInbound(topic);
            if (kind.isEmpty()) {
                log.warn("{} ignored.", topic);
                return;
            }
            if (payload.length == 0) {
                log.warn("{} ignored with no payload.", topic);
                return;
            }
            if (payload[0] != '{') {
                log.warn("{} unassigned payload: {}", topic, new String(payload, StandardCharsets.UTF_8));
                return;
            }
            final JsonNode root;
            try {
                root = mapper.readTree(payload);
            } catch (JsonProcessingException e) {
                log.warn("{} JSON issue with {}", topic, new String(payload, StandardCharsets.UTF_8), e);
                return;
            }
            final String thingName = kind.get().thingNameOf(topic).orElse(null);
            log.debug("{}: {}", topic, root);
            srv.submit(new InboundMessage(handler, kind.get(), thingName, root));
        } catch (Exception e) {
            metrics.postMetric("error", Map.of(
                "class", this.getClass().getSimpleName(),
                "exception", e.getClass().getSimpleName()));
            log.error("{} event issue ({} bytes).", topic, payload.length, e);
            Sentry.captureException(e);
        }
    }

    @Override
    public void connectComplete(boolean reconnect, String serverURI) {
        if (!reconnect) {
            return;
        }
        log.info("Reconnected to {}.", serverURI);
        try {
            transport.subscribeInbound();
        } catch (MqttException e) {
            log.error("Cannot resubscribe after reconnect to {}.", serverURI, e);
            Sentry.captureException(e);
        }
    }

    @Override
    public void connectionLost(Throwable cause) {
        log.error("MQTT connection lost, waiting for automatic reconnect.", cause);
        metrics.postMetric("error", Map.of(
            "class", this.getClass().getSimpleName(),
            "exception", cause.getClass().getSimpleName()));
    }

    @Override
    public void deliveryComplete(IMqttDeliveryToken token) { }
}
