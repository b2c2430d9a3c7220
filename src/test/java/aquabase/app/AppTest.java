package aquabase.app;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

import java.time.Duration;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.test.context.SpringBootTest;

import aquabase.app.control.CorrelationTimeouts;
import aquabase.app.message.PahoDeviceTransport;
import aquabase.app.notification.LoggingNotifier;
import aquabase.app.notification.Notifier;

@SpringBootTest
class AppTest {

    @Autowired
    private AppProperties appProperties;

    @Autowired
    private Notifier notifier;

    @Autowired
    private PahoDeviceTransport deviceTransport;

    @Value("${management.endpoints.web.exposure.include}")
    private String managementSettings;

    @Test
    void testManagementSettings() {
        assertEquals("health,info,loggers", managementSettings);
    }

    @Test
    void testAppProperties() {
        assertEquals("test_notification_exchange", appProperties.getNotificationExchangeName());
        assertEquals(30000, appProperties.getNotificationExpiryMs());
        assertEquals("test_project", appProperties.getProjectName());
        assertEquals(1883, appProperties.getMqttServerPort());
    }

    @Test
    void testCorrelationTimeouts() {
        final CorrelationTimeouts timeouts = appProperties.correlationTimeouts();
        assertEquals(Duration.ofSeconds(10), timeouts.freshness());
        assertEquals(Duration.ofSeconds(1), timeouts.slaveDeadline());
        assertEquals(Duration.ofSeconds(1), timeouts.aliveDeadline());
        assertEquals(Duration.ofSeconds(1), timeouts.tankDeadline());
    }

    @Test
    void testNoBrokersConfigured() {
        assertInstanceOf(LoggingNotifier.class, notifier);
        assertFalse(deviceTransport.isConnected());
    }
}
