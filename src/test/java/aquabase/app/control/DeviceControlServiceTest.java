package aquabase.app.control;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;

import aquabase.app.Fixtures;
import aquabase.app.correlation.CorrelationResult;
import aquabase.app.correlation.InMemoryResponseStore;
import aquabase.app.correlation.ResponseCorrelator;
import aquabase.app.correlation.ResponseKind;
import aquabase.app.correlation.ResponseRecord;
import aquabase.app.device.SwitchNo;
import aquabase.app.device.SwitchStatus;
import aquabase.app.device.TopologyService;
import aquabase.app.error.NotFoundException;
import aquabase.app.error.TransportException;
import aquabase.app.error.ValidationException;
import aquabase.app.message.CommandPublisher;
import aquabase.app.message.FakeDeviceTransport;
import aquabase.app.notification.NotificationType;
import aquabase.app.notification.RecordingNotifier;
import aquabase.app.provider.InMemoryAccountRepository;
import aquabase.app.setup.ActionExecutor;
import aquabase.app.setup.RuleEvaluator;

class DeviceControlServiceTest {

    private static final CorrelationTimeouts SHORT = new CorrelationTimeouts(
        Duration.ofSeconds(10), Duration.ofMillis(300), Duration.ofMillis(300), Duration.ofMillis(300));

    private Clock clock;
    private InMemoryAccountRepository accounts;
    private InMemoryResponseStore responses;
    private FakeDeviceTransport transport;
    private RecordingNotifier notifier;
    private ScheduledExecutorService scheduler;
    private DeviceControlService control;

    @BeforeEach
    void setUp() {
        clock = Clock.systemUTC();
        accounts = new InMemoryAccountRepository();
        responses = new InMemoryResponseStore(clock, Duration.ofMinutes(10));
        transport = new FakeDeviceTransport();
        notifier = new RecordingNotifier();
        scheduler = Executors.newSingleThreadScheduledExecutor();
        final CommandPublisher publisher = new CommandPublisher(transport, new ObjectMapper());
        final RuleEvaluator evaluator = new RuleEvaluator(accounts, new ActionExecutor(accounts, publisher, notifier, clock), clock);
        control = new DeviceControlService(new TopologyService(accounts, clock), accounts, publisher,
            new ResponseCorrelator(responses, scheduler, clock, Duration.ofMillis(50)), evaluator, notifier, clock, SHORT);
        Fixtures.seed(accounts);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    @Test
    void testControlPublishesThenPersists() {
        final String topic = control.control(Fixtures.OWNER, Fixtures.BASE, SwitchNo.BM1, SwitchStatus.ON, "app");

        assertEquals("mqtt/device/thing-b1/control", topic);
        final Map<String, Object> command = transport.payloadsTo(topic).get(0);
        assertEquals("B1", command.get("deviceid"));
        assertEquals("BM1", command.get("switch_no"));
        assertEquals("on", command.get("status"));
        assertEquals("app", command.get("requestedBy"));
        assertEquals(SwitchStatus.ON, Fixtures.base(accounts).getStatus(SwitchNo.BM1));
        assertEquals(1, notifier.ofType(NotificationType.BASE_STATUS_CHANGE).size());

        control.control(Fixtures.OWNER, Fixtures.BASE, SwitchNo.BM1, SwitchStatus.ON, "app");
        assertEquals(2, transport.sent().size());
        assertEquals(1, notifier.ofType(NotificationType.BASE_STATUS_CHANGE).size());
    }

    @Test
    void testControlFailureLeavesStateUntouched() {
        transport.setConnected(false);

        assertThrows(TransportException.class, () -> control.control(Fixtures.OWNER, Fixtures.BASE, SwitchNo.BM1, SwitchStatus.ON, "app"));
        assertEquals(SwitchStatus.OFF, Fixtures.base(accounts).getStatus(SwitchNo.BM1));
        assertTrue(notifier.all().isEmpty());
    }

    @Test
    void testControlRejectsBadRequests() {
        assertThrows(ValidationException.class, () -> control.control(Fixtures.OWNER, " ", SwitchNo.BM1, SwitchStatus.ON, "app"));
        assertThrows(ValidationException.class, () -> control.control(Fixtures.OWNER, Fixtures.BASE, null, SwitchStatus.ON, "app"));
        assertThrows(ValidationException.class, () -> control.control(Fixtures.OWNER, Fixtures.BASE, SwitchNo.BM1, null, "app"));
        assertThrows(ValidationException.class, () -> control.control(Fixtures.OWNER, Fixtures.TANK, SwitchNo.BM1, SwitchStatus.ON, "app"));
        assertThrows(NotFoundException.class, () -> control.control(Fixtures.OWNER, "B9", SwitchNo.BM1, SwitchStatus.ON, "app"));
        assertTrue(transport.sent().isEmpty());
    }

    @Test
    void testSettingForTankGoesToItsBase() {
        assertEquals("mqtt/device/thing-b1/setting", control.setting(Fixtures.TANK, Map.of("deviceid", "T1")));
        assertThrows(NotFoundException.class, () -> control.setting("B9", Map.of()));
    }

    @Test
    void testSlaveRequestReturnsSlaveResponse() throws Exception {
        final CompletableFuture<CorrelationResult> pending = control.slaveRequest(Fixtures.OWNER,
            Map.of("deviceid", "B1", "slaveid", "T1", "sensor_no", "TM1"));
        assertEquals(List.of("mqtt/device/thing-b1/slave_request"), transport.topics());

        responses.append(new ResponseRecord(Fixtures.BASE_THING, Fixtures.BASE, "TM1", ResponseKind.SLAVE_RESPONSE, clock.instant(),
            Map.of("slaveid", "T1", "channel", 11)));

        final CorrelationResult result = pending.get(2, TimeUnit.SECONDS);
        assertEquals(11, result.response().get().responseData().get("channel"));
    }

    @Test
    void testSlaveRequestChecksOwnership() {
        assertThrows(ValidationException.class, () -> control.slaveRequest(Fixtures.OWNER, Map.of("slaveid", "T1")));
        assertThrows(NotFoundException.class, () -> control.slaveRequest(Fixtures.OTHER_OWNER, Map.of("deviceid", "B1")));
    }

    @Test
    void testReset() {
        final String topic = control.reset(Fixtures.OWNER, Fixtures.BASE, "TM1", Fixtures.TANK);

        assertEquals(Map.of("deviceid", "B1", "slave_no", "TM1", "slaveid", "T1"), transport.payloadsTo(topic).get(0));
        assertThrows(ValidationException.class, () -> control.reset(Fixtures.OWNER, Fixtures.BASE, "", Fixtures.TANK));
    }

    @Test
    void testRespondedChecks() throws Exception {
        responses.append(new ResponseRecord(Fixtures.BASE_THING, Fixtures.BASE, null, ResponseKind.ALIVE_REPLY, clock.instant(), Map.of()));

        assertTrue(control.isBaseResponded(Fixtures.BASE).get(2, TimeUnit.SECONDS).isResponded());
        assertInstanceOf(CorrelationResult.TimedOut.class, control.isTankResponded(Fixtures.TANK, "TM1").get(2, TimeUnit.SECONDS));
        assertThrows(ValidationException.class, () -> control.isTankResponded(Fixtures.TANK, " "));
    }

    @Test
    void testLatestReadingPollsTankThroughItsBase() {
        responses.append(new ResponseRecord(Fixtures.BASE_THING, Fixtures.TANK, "TM1", ResponseKind.UPDATE, clock.instant().minusSeconds(5),
            Map.of("deviceid", "T1", "level", 40)));
        responses.append(new ResponseRecord(Fixtures.BASE_THING, Fixtures.TANK, "TM1", ResponseKind.UPDATE, clock.instant(),
            Map.of("deviceid", "T1", "level", 45)));

        final Optional<ResponseRecord> latest = control.latestReading(Fixtures.OWNER, Fixtures.TANK, "TM1");

        assertEquals(45, latest.get().responseData().get("level"));
        final Map<String, Object> poll = transport.payloadsTo("$aws/things/thing-b1/update").get(0);
        assertEquals("B1", poll.get("deviceid"));
        assertEquals("tank", poll.get("device"));
        assertEquals("TM1", poll.get("sensor_no"));
        assertEquals("T1", poll.get("slaveid"));
        assertEquals("BM1", poll.get("switch_no"));
        assertEquals("poll", poll.get("request_type"));
    }

    @Test
    void testLatestReadingPollsBaseSwitch() {
        final Optional<ResponseRecord> latest = control.latestReading(Fixtures.OWNER, Fixtures.BASE, "BM2");

        assertTrue(latest.isEmpty());
        final Map<String, Object> poll = transport.payloadsTo("$aws/things/thing-b1/update").get(0);
        assertEquals("base", poll.get("device"));
        assertEquals("BM2", poll.get("switch_no"));
        assertEquals("off", poll.get("status"));
        assertEquals("0", poll.get("value"));
    }

    @Test
    void testLatestReadingSurvivesFailedPoll() {
        responses.append(new ResponseRecord(Fixtures.BASE_THING, Fixtures.TANK, "TM1", ResponseKind.UPDATE, clock.instant(),
            Map.of("level", 12)));
        transport.setConnected(false);

        assertEquals(12, control.latestReading(Fixtures.OWNER, Fixtures.TANK, "TM1").get().responseData().get("level"));
        assertTrue(control.latestReading(Fixtures.OWNER, Fixtures.TANK, "TM2").isEmpty());
    }

    @Test
    void testLatestReadingChecks() {
        assertThrows(ValidationException.class, () -> control.latestReading(Fixtures.OWNER, Fixtures.TANK, " "));
        assertThrows(NotFoundException.class, () -> control.latestReading(Fixtures.OTHER_OWNER, Fixtures.TANK, "TM1"));
        assertTrue(control.latestReading(Fixtures.OWNER, "X9", "TM1").isEmpty());
        assertTrue(transport.sent().isEmpty());
    }
}
