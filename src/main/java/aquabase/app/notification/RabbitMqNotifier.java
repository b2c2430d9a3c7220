package aquabase.app.notification;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.TimeoutException;

import org.msgpack.jackson.dataformat.MessagePackMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.AMQP.BasicProperties;
import com.rabbitmq.client.BuiltinExchangeType;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;

import io.sentry.Sentry;
import aquabase.app.provider.Metrics;

/**
 * Publishes notifications as MessagePack to a topic exchange, routed by
 * {@code notification.<type>}. The broker connection is opened on first use.
 */
public class RabbitMqNotifier implements Notifier, AutoCloseable {

    private static Logger log = null;

    private final ConnectionFactory connectionFactory;
    private final String exchangeName;
    private final BasicProperties properties;
    private final ObjectMapper mapper;
    private final Metrics metrics;
    private Connection connection;

    public RabbitMqNotifier(ConnectionFactory connectionFactory, String exchangeName, int expiryMs) {
        if (log == null) {
            log = LoggerFactory.getLogger(RabbitMqNotifier.class);
        }
        this.connectionFactory = connectionFactory;
        this.exchangeName = exchangeName;
        this.properties = new AMQP.BasicProperties.Builder()
            .expiration(String.valueOf(expiryMs))
            .build();
        this.mapper = new MessagePackMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.metrics = Metrics.getInstance();
    }

    public static String routingKey(NotificationType type) {
        return "notification." + type.name().toLowerCase();
    }

    @Override
    public void notify(Notification notification) {
        final String routingKey = routingKey(notification.type());
        try {
            final byte[] wireMessage = mapper.writeValueAsBytes(notification);
            final Channel channel = connection().createChannel();
            try {
                channel.exchangeDeclare(exchangeName, BuiltinExchangeType.TOPIC);
                channel.basicPublish(exchangeName, routingKey, properties, wireMessage);
            } finally {
                channel.close();
            }
            log.debug("Notification {} on exchange {} ({} bytes on the wire).", routingKey, exchangeName, wireMessage.length);
            metrics.postMetric("notification", Map.of("type", routingKey));
        } catch (IOException | TimeoutException | RuntimeException e) {
            log.warn("Cannot deliver notification {} for {}: {}", routingKey, notification.ownerId(), e.getMessage());
            metrics.postError(getClass(), e);
            Sentry.captureException(e);
        }
    }

    private synchronized Connection connection() throws IOException, TimeoutException {
        if (connection == null || !connection.isOpen()) {
            connection = connectionFactory.newConnection();
        }
        return connection;
    }

    @Override
    public synchronized void close() {
        if (connection != null) {
            try {
                connection.close();
            } catch (Exception e) {
                log.warn("During shutdown of RabbitMQ connection: {}", e.getMessage());
            }
        }
    }
}
