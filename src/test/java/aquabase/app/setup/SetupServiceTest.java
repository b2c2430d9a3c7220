package aquabase.app.setup;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;

import aquabase.app.Fixtures;
import aquabase.app.MutableClock;
import aquabase.app.control.CorrelationTimeouts;
import aquabase.app.control.DeviceControlService;
import aquabase.app.correlation.InMemoryResponseStore;
import aquabase.app.correlation.ResponseCorrelator;
import aquabase.app.device.SwitchNo;
import aquabase.app.device.SwitchStatus;
import aquabase.app.device.TopologyService;
import aquabase.app.error.NotFoundException;
import aquabase.app.error.ValidationException;
import aquabase.app.message.CommandPublisher;
import aquabase.app.message.FakeDeviceTransport;
import aquabase.app.notification.RecordingNotifier;
import aquabase.app.provider.InMemoryAccountRepository;

class SetupServiceTest {

    private static final String SETTING_TOPIC = "mqtt/device/" + Fixtures.BASE_THING + "/setting";

    private InMemoryAccountRepository accounts;
    private FakeDeviceTransport transport;
    private ScheduledExecutorService scheduler;
    private SetupService setups;

    @BeforeEach
    void setUp() {
        accounts = new InMemoryAccountRepository();
        transport = new FakeDeviceTransport();
        scheduler = Executors.newSingleThreadScheduledExecutor();
        final MutableClock clock = new MutableClock();
        final RecordingNotifier notifier = new RecordingNotifier();
        final CommandPublisher publisher = new CommandPublisher(transport, new ObjectMapper());
        final RuleEvaluator evaluator = new RuleEvaluator(accounts, new ActionExecutor(accounts, publisher, notifier, clock), clock);
        final ResponseCorrelator correlator = new ResponseCorrelator(new InMemoryResponseStore(clock, Duration.ofMinutes(10)),
            scheduler, clock, ResponseCorrelator.DEFAULT_POLL_INTERVAL);
        final DeviceControlService control = new DeviceControlService(new TopologyService(accounts, clock), accounts, publisher,
            correlator, evaluator, notifier, clock, CorrelationTimeouts.DEFAULTS);
        setups = new SetupService(accounts, control, clock);
        Fixtures.seed(accounts);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    private static Setup request(String name, Condition condition, Action... actions) {
        final Setup request = new Setup();
        request.setName(name);
        request.setCondition(condition);
        request.setActions(List.of(actions));
        return request;
    }

    @Test
    void testCreateTankSetupPushesThresholds() {
        final Setup created = setups.createSetup(Fixtures.OWNER, Fixtures.SPACE, request(null,
            new TankCondition(Fixtures.TANK, 20, 90, Operator.LT),
            new Action(Fixtures.BASE, SwitchNo.BM1, SwitchStatus.ON)));

        assertNotNull(created.getId());
        assertEquals("Setup 1", created.getName());
        assertTrue(created.isActive());
        assertNotNull(created.getCreatedAt());
        final List<Map<String, Object>> settings = transport.payloadsTo(SETTING_TOPIC);
        assertEquals(1, settings.size());
        assertEquals(Map.of(
            "deviceid", Fixtures.TANK,
            "sensor_no", "TM1",
            "switch_no", "BM1",
            "maximum", "90",
            "minimum", "20"), settings.get(0));
        assertEquals(1, setups.getSetups(Fixtures.OWNER, Fixtures.SPACE).size());
    }

    @Test
    void testCreateBaseSetupPushesActions() {
        final Setup created = setups.createSetup(Fixtures.OWNER, Fixtures.SPACE, request("Mirror",
            new BaseCondition(Fixtures.BASE, SwitchNo.BM1, SwitchStatus.ON),
            new Action(Fixtures.BASE, SwitchNo.BM2, SwitchStatus.ON, 30)));

        final Map<String, Object> setting = transport.payloadsTo(SETTING_TOPIC).get(0);
        assertEquals(Fixtures.BASE, setting.get("deviceid"));
        assertEquals("on", setting.get("status"));
        assertEquals(created.getId(), setting.get("setup_id"));
        assertEquals("Mirror", setting.get("setup_name"));
        assertEquals(List.of(Map.of("device_id", Fixtures.BASE, "switch_no", "BM2", "set_status", "on", "delay", 30)),
            setting.get("actions"));
    }

    @Test
    void testSetupSavedWhenSettingsCannotBeSent() {
        transport.setConnected(false);
        final Setup created = setups.createSetup(Fixtures.OWNER, Fixtures.SPACE, request("Offline",
            new TankCondition(Fixtures.TANK, 20, 90, Operator.LT),
            new Action(Fixtures.BASE, SwitchNo.BM1, SwitchStatus.ON)));

        assertEquals(created.getId(), setups.getSetup(Fixtures.OWNER, Fixtures.SPACE, created.getId()).getId());
    }

    @Test
    void testValidation() {
        assertEquals("Device type mismatch. Device 'T1' is of type 'tank', not 'base'",
            assertThrows(ValidationException.class, () -> setups.createSetup(Fixtures.OWNER, Fixtures.SPACE, request("x",
                new BaseCondition(Fixtures.TANK, SwitchNo.BM1, SwitchStatus.ON),
                new Action(Fixtures.BASE, SwitchNo.BM1, SwitchStatus.ON)))).getMessage());
        assertEquals("Device 'T1' must be of type 'base' to be used in actions",
            assertThrows(ValidationException.class, () -> setups.createSetup(Fixtures.OWNER, Fixtures.SPACE, request("x",
                new TankCondition(Fixtures.TANK, 20, 90, Operator.LT),
                new Action(Fixtures.TANK, SwitchNo.BM1, SwitchStatus.ON)))).getMessage());
        assertEquals("At least one action is required",
            assertThrows(ValidationException.class, () -> setups.createSetup(Fixtures.OWNER, Fixtures.SPACE, request("x",
                new TankCondition(Fixtures.TANK, 20, 90, Operator.LT)))).getMessage());
        assertThrows(NotFoundException.class, () -> setups.createSetup(Fixtures.OWNER, Fixtures.SPACE, request("x",
            new TankCondition(Fixtures.TANK, 20, 90, Operator.LT),
            new Action("B9", SwitchNo.BM1, SwitchStatus.ON))));
        assertThrows(ValidationException.class, () -> setups.createSetup(Fixtures.OWNER, Fixtures.SPACE, request("x",
            new TankCondition(Fixtures.TANK, 90, 20, Operator.LT),
            new Action(Fixtures.BASE, SwitchNo.BM1, SwitchStatus.ON))));
        assertTrue(setups.getSetups(Fixtures.OWNER, Fixtures.SPACE).isEmpty());
        assertTrue(transport.sent().isEmpty());
    }

    @Test
    void testUpdateMergesAndRevalidates() {
        final Setup created = setups.createSetup(Fixtures.OWNER, Fixtures.SPACE, request("Low",
            new TankCondition(Fixtures.TANK, 20, 90, Operator.LT),
            new Action(Fixtures.BASE, SwitchNo.BM1, SwitchStatus.ON)));
        final Setup changes = new Setup();
        changes.setName("Very low");

        final Setup updated = setups.updateSetup(Fixtures.OWNER, Fixtures.SPACE, created.getId(), changes);

        assertEquals("Very low", updated.getName());
        assertEquals(created.getCondition(), updated.getCondition());
        assertEquals(1, transport.sent().size());

        final Setup invalid = new Setup();
        invalid.setCondition(new TankCondition(Fixtures.TANK, 50, 40, Operator.LT));
        assertThrows(ValidationException.class, () -> setups.updateSetup(Fixtures.OWNER, Fixtures.SPACE, created.getId(), invalid));
        assertEquals("Very low", setups.getSetup(Fixtures.OWNER, Fixtures.SPACE, created.getId()).getName());
    }

    @Test
    void testStatusAndDelete() {
        final Setup created = setups.createSetup(Fixtures.OWNER, Fixtures.SPACE, request("Low",
            new TankCondition(Fixtures.TANK, 20, 90, Operator.LT),
            new Action(Fixtures.BASE, SwitchNo.BM1, SwitchStatus.ON)));

        assertFalse(setups.updateSetupStatus(Fixtures.OWNER, Fixtures.SPACE, created.getId(), false).isActive());
        assertFalse(setups.getSetup(Fixtures.OWNER, Fixtures.SPACE, created.getId()).isActive());

        setups.deleteSetup(Fixtures.OWNER, Fixtures.SPACE, created.getId());
        assertThrows(NotFoundException.class, () -> setups.getSetup(Fixtures.OWNER, Fixtures.SPACE, created.getId()));
        assertThrows(NotFoundException.class, () -> setups.deleteSetup(Fixtures.OWNER, Fixtures.SPACE, created.getId()));
    }
}
