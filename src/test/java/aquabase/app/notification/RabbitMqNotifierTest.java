package aquabase.app.notification;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.time.Instant;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.msgpack.jackson.dataformat.MessagePackMapper;

import com.fasterxml.jackson.databind.JsonNode;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.BuiltinExchangeType;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;

class RabbitMqNotifierTest {

    private ConnectionFactory factory;
    private Connection connection;
    private Channel channel;
    private RabbitMqNotifier notifier;

    @BeforeEach
    void setUp() throws Exception {
        factory = mock(ConnectionFactory.class);
        connection = mock(Connection.class);
        channel = mock(Channel.class);
        when(factory.newConnection()).thenReturn(connection);
        when(connection.isOpen()).thenReturn(true);
        when(connection.createChannel()).thenReturn(channel);
        notifier = new RabbitMqNotifier(factory, "test_notification_exchange", 30000);
    }

    private static Notification online() {
        return Notification.of(NotificationType.DEVICE_ONLINE, "owner-1", "Pump is now online",
            Map.of("device_id", "B1"), Instant.parse("2024-05-01T08:00:00Z"));
    }

    @Test
    void testPublishesMessagePackByType() throws Exception {
        notifier.notify(online());
        notifier.notify(online());

        final ArgumentCaptor<AMQP.BasicProperties> properties = ArgumentCaptor.forClass(AMQP.BasicProperties.class);
        final ArgumentCaptor<byte[]> body = ArgumentCaptor.forClass(byte[].class);
        verify(channel, times(2)).exchangeDeclare("test_notification_exchange", BuiltinExchangeType.TOPIC);
        verify(channel, times(2)).basicPublish(eq("test_notification_exchange"), eq("notification.device_online"),
            properties.capture(), body.capture());
        verify(factory, times(1)).newConnection();
        assertEquals("30000", properties.getValue().getExpiration());

        final JsonNode decoded = new MessagePackMapper().readTree(body.getValue());
        assertEquals("DEVICE_ONLINE", decoded.get("type").asText());
        assertEquals("Device Online", decoded.get("title").asText());
        assertEquals("B1", decoded.get("data").get("device_id").asText());
    }

    @Test
    void testBrokerFailureIsNotThrown() throws Exception {
        when(connection.createChannel()).thenThrow(new IOException("broker gone"));

        notifier.notify(online());
        verify(channel, never()).basicPublish(any(), any(), any(), any());
    }
}
