package aquabase.app.message;

import java.util.Map;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import aquabase.app.error.TransportException;
import aquabase.app.provider.Metrics;

/**
 * Sends addressed JSON commands to a thing. There is no acknowledgement; the only
 * errors are transport-level ones, reported synchronously.
 */
public class CommandPublisher {

    private static Logger log = null;

    private final DeviceTransport transport;
    private final ObjectMapper mapper;
    private final Metrics metrics;

    public CommandPublisher(DeviceTransport transport, ObjectMapper mapper) {
        if (log == null) {
            log = LoggerFactory.getLogger(CommandPublisher.class);
        }
        this.transport = transport;
        this.mapper = mapper;
        this.metrics = Metrics.getInstance();
    }

    /**
     * @return the topic the payload went to
     */
    public String publish(String thingName, Topic topic, Object payload) throws TransportException {
        if (topic.isInbound()) {
            throw new IllegalArgumentException(String.format("%s is not a command topic.", topic));
        }
        if (StringUtils.isBlank(thingName)) {
            throw new TransportException(String.format("No transport address to publish %s.", topic));
        }
        final String topicName = topic.forThing(thingName);
        final byte[] wireCommand;
        try {
            wireCommand = mapper.writeValueAsBytes(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(String.format("Cannot serialize payload for %s.", topicName), e);
        }
        log.info("Publishing to {} ({} bytes on the wire).", topicName, wireCommand.length);
        try {
            transport.publish(topicName, wireCommand);
        } catch (TransportException e) {
            metrics.postMetric("publish_failed", Map.of("topic", topic.name().toLowerCase()));
            throw e;
        }
        metrics.postMetric("published", Map.of("topic", topic.name().toLowerCase()));
        return topicName;
    }
}
