package aquabase.app.message;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import aquabase.app.correlation.ResponseKind;
import aquabase.app.correlation.ResponseRecord;
import aquabase.app.correlation.ResponseStore;
import aquabase.app.device.Account;
import aquabase.app.device.BaseDevice;
import aquabase.app.device.Device;
import aquabase.app.device.DeviceState;
import aquabase.app.device.SlaveName;
import aquabase.app.device.Space;
import aquabase.app.device.SwitchNo;
import aquabase.app.device.SwitchStatus;
import aquabase.app.device.TankDevice;
import aquabase.app.liveness.LivenessTracker;
import aquabase.app.notification.Notification;
import aquabase.app.notification.NotificationType;
import aquabase.app.notification.Notifier;
import aquabase.app.provider.AccountRepository;
import aquabase.app.provider.Metrics;
import aquabase.app.setup.RuleEvaluator;

/**
 * Applies what devices report: stores the response for correlation, updates the
 * stored device, notifies the owner and runs the setups watching the device.
 */
public class DeviceMessageHandler {

    private static Logger log = null;

    public static final String POLL_REQUEST = "poll";

    private static final TypeReference<Map<String, Object>> RAW_MESSAGE = new TypeReference<Map<String, Object>>() { };

    private final AccountRepository accounts;
    private final ResponseStore responses;
    private final LivenessTracker liveness;
    private final RuleEvaluator ruleEvaluator;
    private final Notifier notifier;
    private final Clock clock;
    private final ObjectMapper mapper;
    private final Metrics metrics;

    public DeviceMessageHandler(AccountRepository accounts, ResponseStore responses, LivenessTracker liveness,
            RuleEvaluator ruleEvaluator, Notifier notifier, Clock clock) {
        if (log == null) {
            log = LoggerFactory.getLogger(DeviceMessageHandler.class);
        }
        this.accounts = accounts;
        this.responses = responses;
        this.liveness = liveness;
        this.ruleEvaluator = ruleEvaluator;
        this.notifier = notifier;
        this.clock = clock;
        this.mapper = new ObjectMapper();
        this.metrics = Metrics.getInstance();
    }

    public void handle(Topic topic, String thingName, JsonNode message) {
        final String deviceId = text(message, "deviceid");
        if (deviceId == null) {
            log.error("{} message from {} is missing deviceid: {}", topic, thingName, message);
            return;
        }
        if (POLL_REQUEST.equals(text(message, "request_type"))) {
            log.debug("Ignoring echo of our own poll request for {} on {}.", deviceId, thingName);
            return;
        }
        metrics.postMetric("inbound", Map.of("topic", topic.name().toLowerCase()));
        liveness.recordSeen(deviceId);
        switch (topic) {
            case UPDATE:
                handleUpdate(thingName, deviceId, message);
                break;
            case ALIVE_REPLY:
                handleAlive(thingName, deviceId, message);
                break;
            case HEALTH_REPLY:
                handleHealth(thingName, deviceId, message);
                break;
            case SLAVE_RESPONSE:
                handleSlaveResponse(thingName, deviceId, message);
                break;
            default:
                log.debug("{} from {} not handled.", topic, thingName);
        }
    }

    void handleUpdate(String thingName, String deviceId, JsonNode message) {
        final String sensorNo = text(message, "sensor_no");
        final Instant now = clock.instant();
        store(thingName, deviceId, sensorNo, ResponseKind.UPDATE, message, now);
        final Optional<Account> holder = accounts.findByDeviceId(deviceId);
        if (holder.isEmpty()) {
            log.error("No account holds device {}.", deviceId);
            return;
        }
        final Account account = holder.get();
        final Space space = account.spaceOfDevice(deviceId).get();
        final Device device = space.requireDevice(deviceId);
        final Double level = number(message, "level").orElse(number(message, "value").orElse(null));
        final SwitchStatus status = SwitchStatus.parse(message.get("status"));
        if (device instanceof TankDevice && level != null) {
            applyLevel(account, space, (TankDevice) device, level, now);
        } else if (device instanceof BaseDevice && level != null && sensorNo != null) {
            // level relayed by the base on behalf of one of its slaves
            final SlaveName slaveName = SlaveName.parse(sensorNo);
            final Optional<TankDevice> tank = space.tanksAttachedTo(deviceId).stream()
                .filter(t -> t.getSlaveName() == slaveName)
                .findFirst();
            if (tank.isEmpty()) {
                log.warn("{} relayed a level for {} but no tank holds that slot.", deviceId, sensorNo);
                return;
            }
            applyLevel(account, space, tank.get(), level, now);
        } else if (device instanceof BaseDevice && status != null) {
            final SwitchNo switchNo = Optional.ofNullable(SwitchNo.parse(text(message, "switch_no"))).orElse(SwitchNo.BM1);
            applyStatus(account, space, (BaseDevice) device, switchNo, status, now);
        } else {
            log.warn("Device {} found but no updates were made.", deviceId);
        }
    }

    void handleAlive(String thingName, String deviceId, JsonNode message) {
        final Instant now = clock.instant();
        store(thingName, deviceId, null, ResponseKind.ALIVE_REPLY, message, now);
        final Optional<Account> holder = accounts.findByDeviceId(deviceId);
        if (holder.isEmpty()) {
            log.error("No account holds device {}.", deviceId);
            return;
        }
        final Account account = holder.get();
        final Space space = account.spaceOfDevice(deviceId).get();
        final Device device = space.requireDevice(deviceId);
        final String firmware = StringUtils.defaultIfBlank(text(message, "firmware"), text(message, "firmware_version"));
        final boolean cameOnline = !device.isOnline();
        final boolean firmwareChanged = firmware != null && !firmware.equals(device.getFirmwareVersion());
        if (!cameOnline && !firmwareChanged) {
            return;
        }
        device.setOnline(true);
        if (firmwareChanged) {
            device.setFirmwareVersion(firmware);
        }
        device.touch(now);
        accounts.save(account);
        if (cameOnline) {
            log.info("Device {} is now online.", deviceId);
            final Map<String, Object> data = new LinkedHashMap<>();
            data.put("device_id", deviceId);
            data.put("device_name", device.getDeviceName());
            data.put("device_type", device.getDeviceType().wireName());
            data.put("space_name", space.getSpaceName());
            data.put("space_id", space.getSpaceId());
            notifier.notify(Notification.of(NotificationType.DEVICE_ONLINE, account.getOwnerId(),
                String.format("%s is now online", device.getDeviceName()), data, now));
        }
    }

    void handleHealth(String thingName, String deviceId, JsonNode message) {
        log.info("Received health message from device {}.", deviceId);
        store(thingName, deviceId, null, ResponseKind.HEALTH_REPLY, message, clock.instant());
    }

    /**
     * Slave responses are stored under the thing id of the base, which is what a
     * pending slave request waits on.
     */
    void handleSlaveResponse(String thingName, String baseId, JsonNode message) {
        final String slaveId = text(message, "slaveid");
        final String sensorNo = text(message, "sensor_no");
        if (slaveId == null || sensorNo == null) {
            log.error("Slave response from {} missing required fields: {}", baseId, message);
            return;
        }
        final Optional<Account> holder = accounts.findByDeviceId(baseId);
        if (holder.isEmpty()) {
            log.error("No account holds base device {}.", baseId);
            return;
        }
        final Account account = holder.get();
        final Optional<Device> base = account.findDevice(baseId);
        String thingId = thingName;
        if (base.isPresent() && base.get() instanceof BaseDevice) {
            thingId = StringUtils.defaultIfBlank(((BaseDevice) base.get()).getThingName(), thingName);
        }
        if (thingId == null) {
            log.error("No thing id for base device {}.", baseId);
            return;
        }
        final Instant now = clock.instant();
        // keyed on the registered thing name only; a thingId in the payload does not override it
        append(thingId, baseId, sensorNo, ResponseKind.SLAVE_RESPONSE, message, now);
        final Optional<Space> space = account.spaceOfDevice(slaveId);
        if (space.isEmpty() || !(space.get().requireDevice(slaveId) instanceof TankDevice)) {
            log.warn("Slave response from {} names unknown tank {}.", baseId, slaveId);
            return;
        }
        final TankDevice tank = (TankDevice) space.get().requireDevice(slaveId);
        final Integer channel = number(message, "channel").map(Double::intValue).orElse(null);
        tank.updateLink(channel, text(message, "address_l"), text(message, "address_h"));
        tank.touch(now);
        accounts.save(account);
        log.info("Tank {} connection info updated from base {}.", slaveId, baseId);
        final Map<String, Object> data = new LinkedHashMap<>();
        data.put("device_id", slaveId);
        data.put("device_name", tank.getDeviceName());
        data.put("base_device_id", baseId);
        data.put("sensor_no", sensorNo);
        data.put("space_name", space.get().getSpaceName());
        data.put("space_id", space.get().getSpaceId());
        notifier.notify(Notification.of(NotificationType.TANK_CONNECTED, account.getOwnerId(),
            String.format("Tank %s successfully connected to base", tank.getDeviceName()), data, now));
    }

    private void applyLevel(Account account, Space space, TankDevice tank, double level, Instant now) {
        final Double previous = tank.getLevel();
        tank.setLevel(level);
        tank.touch(now);
        accounts.save(account);
        log.info("Updated tank device {} level from {}% to {}%.", tank.getDeviceId(), previous, level);
        metrics.postMetric("tank_level", level, Map.of("device_id", tank.getDeviceId()));
        final Map<String, Object> data = new LinkedHashMap<>();
        data.put("device_id", tank.getDeviceId());
        data.put("device_name", tank.getDeviceName());
        data.put("device_type", tank.getDeviceType().wireName());
        data.put("level", level);
        data.put("previous_level", previous);
        data.put("space_name", space.getSpaceName());
        data.put("space_id", space.getSpaceId());
        notifier.notify(Notification.of(NotificationType.TANK_LEVEL_CHANGE, account.getOwnerId(),
            String.format("Tank %s level changed to %s%%", tank.getDeviceName(), formatLevel(level)), data, now));
        ruleEvaluator.evaluate(account.getOwnerId(), space.getSpaceId(), DeviceState.ofLevel(tank.getDeviceId(), level));
    }

    private void applyStatus(Account account, Space space, BaseDevice base, SwitchNo switchNo, SwitchStatus status, Instant now) {
        final SwitchStatus previous = base.getStatus(switchNo);
        base.setStatus(switchNo, status);
        base.touch(now);
        accounts.save(account);
        log.info("Updated base device {}/{} status from {} to {}.", base.getDeviceId(), switchNo, previous.wireName(), status.wireName());
        final Map<String, Object> data = new LinkedHashMap<>();
        data.put("device_id", base.getDeviceId());
        data.put("device_name", base.getDeviceName());
        data.put("device_type", base.getDeviceType().wireName());
        data.put("switch_no", switchNo.name());
        data.put("status", status.wireName());
        data.put("previous_status", previous.wireName());
        data.put("space_name", space.getSpaceName());
        data.put("space_id", space.getSpaceId());
        notifier.notify(Notification.of(NotificationType.BASE_STATUS_CHANGE, account.getOwnerId(),
            String.format("Base device %s is now %s", base.getDeviceName(), status.wireName()), data, now));
        ruleEvaluator.evaluate(account.getOwnerId(), space.getSpaceId(), DeviceState.ofSwitch(base.getDeviceId(), switchNo, status));
    }

    private void store(String thingName, String deviceId, String sensorNo, ResponseKind kind, JsonNode message, Instant now) {
        append(StringUtils.defaultIfBlank(text(message, "thingId"), thingName), deviceId, sensorNo, kind, message, now);
    }

    private void append(String thingId, String deviceId, String sensorNo, ResponseKind kind, JsonNode message, Instant now) {
        final Map<String, Object> data = mapper.convertValue(message, RAW_MESSAGE);
        responses.append(new ResponseRecord(thingId, deviceId, sensorNo, kind, now, data));
    }

    private static String text(JsonNode message, String field) {
        final JsonNode node = message.get(field);
        if (node == null || node.isNull() || node.isContainerNode()) {
            return null;
        }
        return StringUtils.trimToNull(node.asText());
    }

    /**
     * Firmware sends numbers either as JSON numbers or as strings.
     */
    private static Optional<Double> number(JsonNode message, String field) {
        final JsonNode node = message.get(field);
        if (node == null || node.isNull()) {
            return Optional.empty();
        }
        if (node.isNumber()) {
            return Optional.of(node.doubleValue());
        }
        final String value = StringUtils.trimToNull(node.asText());
        if (value == null || !NumberUtils.isCreatable(value)) {
            return Optional.empty();
        }
        return Optional.of(NumberUtils.createDouble(value));
    }

    private static String formatLevel(double level) {
        if (level == Math.rint(level)) {
            return Long.toString((long) level);
        }
        return Double.toString(level);
    }
}
