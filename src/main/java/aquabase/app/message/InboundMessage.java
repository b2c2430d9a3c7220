package aquabase.app.message;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;

import aquabase.app.provider.Metrics;
import io.sentry.Sentry;

/**
 * One parsed device message, handled on the event executor.
 */
public class InboundMessage implements Runnable {

    private static Logger log = null;

    protected final DeviceMessageHandler handler;
    protected final Topic topic;
    protected final String thingName;
    protected final JsonNode message;
    protected final long initTime;

    public InboundMessage(DeviceMessageHandler handler, Topic topic, String thingName, JsonNode message) {
        if (log == null) {
            log = LoggerFactory.getLogger(InboundMessage.class);
        }
        this.handler = handler;
        this.topic = topic;
        this.thingName = thingName;
        this.message = message;
        this.initTime = System.currentTimeMillis();
    }

    @Override
    public void run() {
        final Metrics metrics = Metrics.getInstance();
        metrics.postMetric("event_queue_time", System.currentTimeMillis() - initTime);
        try {
            handler.handle(topic, thingName, message);
        } catch (Exception e) {
            log.error("{} from {} could not be handled: {}", topic, thingName, message, e);
            metrics.postMetric("error", Map.of(
                "class", this.getClass().getSimpleName(),
                "exception", e.getClass().getSimpleName()));
            Sentry.captureException(e);
        }
    }

    @Override
    public String toString() {
        return "InboundMessage [topic=" + topic + ", thing=" + thingName + ", message=" + message + "]";
    }
}
