package aquabase.app.message;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;

import aquabase.app.error.TransportException;

class CommandPublisherTest {

    private FakeDeviceTransport transport;
    private CommandPublisher publisher;

    @BeforeEach
    void setUp() {
        transport = new FakeDeviceTransport();
        publisher = new CommandPublisher(transport, new ObjectMapper());
    }

    @Test
    void testPublishesJsonToThingTopic() {
        final String topic = publisher.publish("thing-b1", Topic.RESET, Map.of("deviceid", "B1", "slave_no", "TM1", "slaveid", "T1"));

        assertEquals("mqtt/device/thing-b1/reset", topic);
        assertEquals(Map.of("deviceid", "B1", "slave_no", "TM1", "slaveid", "T1"), transport.payloadsTo(topic).get(0));
    }

    @Test
    void testTransportErrorsAreSynchronous() {
        assertThrows(TransportException.class, () -> publisher.publish(null, Topic.CONTROL, Map.of()));
        assertThrows(TransportException.class, () -> publisher.publish(" ", Topic.CONTROL, Map.of()));
        transport.setConnected(false);
        final TransportException e = assertThrows(TransportException.class, () -> publisher.publish("thing-b1", Topic.CONTROL, Map.of()));
        assertEquals("not connected", e.getMessage());
        assertTrue(transport.sent().isEmpty());
    }

    @Test
    void testInboundTopicIsNotACommand() {
        assertThrows(IllegalArgumentException.class, () -> publisher.publish("thing-b1", Topic.UPDATE, Map.of()));
    }
}
