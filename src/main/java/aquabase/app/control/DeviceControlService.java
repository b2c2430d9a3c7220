package aquabase.app.control;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import aquabase.app.correlation.CorrelationKey;
import aquabase.app.correlation.CorrelationResult;
import aquabase.app.correlation.ResponseCorrelator;
import aquabase.app.correlation.ResponseRecord;
import aquabase.app.device.Account;
import aquabase.app.device.BaseDevice;
import aquabase.app.device.Device;
import aquabase.app.device.DeviceState;
import aquabase.app.device.Space;
import aquabase.app.device.SwitchNo;
import aquabase.app.device.SwitchStatus;
import aquabase.app.device.TankDevice;
import aquabase.app.device.TopologyService;
import aquabase.app.error.NotFoundException;
import aquabase.app.error.TransportException;
import aquabase.app.error.ValidationException;
import aquabase.app.message.CommandPublisher;
import aquabase.app.message.DeviceMessageHandler;
import aquabase.app.message.Topic;
import aquabase.app.notification.Notification;
import aquabase.app.notification.NotificationType;
import aquabase.app.notification.Notifier;
import aquabase.app.provider.AccountRepository;
import aquabase.app.setup.RuleEvaluator;

/**
 * User initiated commands to devices, and the checks that wait for a device to
 * answer.
 */
public class DeviceControlService {

    private static Logger log = null;

    private final TopologyService topology;
    private final AccountRepository accounts;
    private final CommandPublisher publisher;
    private final ResponseCorrelator correlator;
    private final RuleEvaluator ruleEvaluator;
    private final Notifier notifier;
    private final Clock clock;
    private final CorrelationTimeouts timeouts;

    public DeviceControlService(TopologyService topology, AccountRepository accounts, CommandPublisher publisher,
            ResponseCorrelator correlator, RuleEvaluator ruleEvaluator, Notifier notifier, Clock clock, CorrelationTimeouts timeouts) {
        if (log == null) {
            log = LoggerFactory.getLogger(DeviceControlService.class);
        }
        this.topology = topology;
        this.accounts = accounts;
        this.publisher = publisher;
        this.correlator = correlator;
        this.ruleEvaluator = ruleEvaluator;
        this.notifier = notifier;
        this.clock = clock;
        this.timeouts = timeouts;
    }

    /**
     * Switches one output of a base device. The new status is only recorded once
     * the command has been handed to the transport.
     *
     * @return the topic the command was published to
     */
    public String control(String ownerId, String deviceId, SwitchNo switchNo, SwitchStatus status, String requestedBy) {
        if (StringUtils.isBlank(deviceId)) {
            throw new ValidationException("Missing deviceid in request");
        }
        if (switchNo == null) {
            throw new ValidationException("switch_no must be 'BM1' or 'BM2'");
        }
        if (status == null) {
            throw new ValidationException("status must be 'on' or 'off'");
        }
        final Account account = topology.requireAccount(ownerId);
        final Space space = account.spaceOfDevice(deviceId).orElseThrow(() -> NotFoundException.of("Device", deviceId));
        final Device device = space.requireDevice(deviceId);
        if (!(device instanceof BaseDevice)) {
            throw new ValidationException(String.format("Device '%s' is not a base device", deviceId));
        }
        final BaseDevice base = (BaseDevice) device;
        final Instant now = clock.instant();
        final Map<String, Object> command = new LinkedHashMap<>();
        command.put("deviceid", deviceId);
        command.put("switch_no", switchNo.name());
        command.put("status", status.wireName());
        command.put("requestedBy", requestedBy);
        command.put("timestamp", now.toString());
        final String topic = publisher.publish(base.getThingName(switchNo), Topic.CONTROL, command);

        final SwitchStatus previous = base.getStatus(switchNo);
        base.setStatus(switchNo, status);
        base.touch(now);
        accounts.save(account);
        log.info("{}/{} switched {} by {} (was {}).", deviceId, switchNo, status.wireName(), requestedBy, previous.wireName());
        if (previous != status) {
            final Map<String, Object> data = new LinkedHashMap<>();
            data.put("device_id", deviceId);
            data.put("device_name", base.getDeviceName());
            data.put("device_type", base.getDeviceType().wireName());
            data.put("switch_no", switchNo.name());
            data.put("status", status.wireName());
            data.put("previous_status", previous.wireName());
            data.put("space_name", space.getSpaceName());
            data.put("space_id", space.getSpaceId());
            notifier.notify(Notification.of(NotificationType.BASE_STATUS_CHANGE, ownerId,
                String.format("Base device %s is now %s", base.getDeviceName(), status.wireName()), data, now));
        }
        ruleEvaluator.evaluate(ownerId, space.getSpaceId(), DeviceState.ofSwitch(deviceId, switchNo, status));
        return topic;
    }

    /**
     * Pushes threshold settings to the thing serving {@code deviceId}.
     */
    public String setting(String deviceId, Map<String, Object> payload) {
        final String thingName = topology.resolveTransportAddress(deviceId);
        return publisher.publish(thingName, Topic.SETTING, payload);
    }

    /**
     * Asks a base device to pair a slave and waits for its slave response.
     */
    public CompletableFuture<CorrelationResult> slaveRequest(String ownerId, Map<String, Object> request) {
        final Object baseId = request.get("deviceid");
        if (baseId == null || StringUtils.isBlank(baseId.toString())) {
            throw new ValidationException("Missing deviceid in request");
        }
        final String deviceId = baseId.toString();
        requireOwned(ownerId, deviceId);
        final String thingName = topology.resolveTransportAddress(deviceId);
        publisher.publish(thingName, Topic.SLAVE_REQUEST, request);
        return correlator.awaitResponse(CorrelationKey.slaveResponse(thingName), timeouts.freshness(), timeouts.slaveDeadline());
    }

    public String reset(String ownerId, String baseId, String slaveNo, String slaveId) {
        if (StringUtils.isAnyBlank(baseId, slaveNo, slaveId)) {
            throw new ValidationException("deviceid, slave_no and slaveid are required");
        }
        requireOwned(ownerId, baseId);
        final Map<String, Object> command = new LinkedHashMap<>();
        command.put("deviceid", baseId);
        command.put("slave_no", slaveNo);
        command.put("slaveid", slaveId);
        return publisher.publish(topology.resolveTransportAddress(baseId), Topic.RESET, command);
    }

    public CompletableFuture<CorrelationResult> isBaseResponded(String deviceId) {
        if (StringUtils.isBlank(deviceId)) {
            throw new ValidationException("Device ID is required.");
        }
        return correlator.awaitResponse(CorrelationKey.aliveReply(deviceId), timeouts.freshness(), timeouts.aliveDeadline());
    }

    public CompletableFuture<CorrelationResult> isTankResponded(String deviceId, String sensorNo) {
        if (StringUtils.isAnyBlank(deviceId, sensorNo)) {
            throw new ValidationException("Device ID and Sensor Number is required.");
        }
        return correlator.awaitResponse(CorrelationKey.sensorUpdate(deviceId, sensorNo), timeouts.freshness(), timeouts.tankDeadline());
    }

    /**
     * Asks the device for a fresh reading, then answers with the latest reading
     * already held for {@code (deviceId, sensorNo)}. The fresh reading lands in a
     * later call. A failed poll does not stop the lookup.
     */
    public Optional<ResponseRecord> latestReading(String ownerId, String deviceId, String sensorNo) {
        if (StringUtils.isAnyBlank(deviceId, sensorNo)) {
            throw new ValidationException("deviceId and sensorNumber are required.");
        }
        final Optional<Account> holder = accounts.findByDeviceId(deviceId);
        if (holder.isPresent()) {
            if (!holder.get().getOwnerId().equals(ownerId)) {
                throw NotFoundException.of("Device", deviceId);
            }
            poll(holder.get(), deviceId, sensorNo);
        }
        return correlator.latest(CorrelationKey.sensorUpdate(deviceId, sensorNo));
    }

    private void poll(Account account, String deviceId, String sensorNo) {
        final Device device = account.findDevice(deviceId).get();
        final Map<String, Object> request = new LinkedHashMap<>();
        final String thingName;
        if (device instanceof TankDevice) {
            final TankDevice tank = (TankDevice) device;
            final Optional<Device> parent = tank.getParentDeviceId() == null ? Optional.empty() : account.findDevice(tank.getParentDeviceId());
            if (parent.isEmpty() || !(parent.get() instanceof BaseDevice)) {
                log.warn("Tank {} has no base to poll through.", deviceId);
                return;
            }
            thingName = ((BaseDevice) parent.get()).getThingName(tank.getParentSwitchNo());
            request.put("deviceid", tank.getParentDeviceId());
            request.put("device", tank.getDeviceType().wireName());
            request.put("sensor_no", sensorNo);
            request.put("slaveid", deviceId);
            request.put("switch_no", tank.getParentSwitchNo() == null ? null : tank.getParentSwitchNo().name());
        } else {
            // a base is polled per switch, the sensor number naming the switch
            final BaseDevice base = (BaseDevice) device;
            final SwitchNo switchNo = SwitchNo.parse(sensorNo);
            final SwitchStatus status = switchNo == null ? SwitchStatus.OFF : base.getStatus(switchNo);
            thingName = base.getThingName(switchNo);
            request.put("deviceid", deviceId);
            request.put("device", base.getDeviceType().wireName());
            request.put("switch_no", sensorNo);
            request.put("status", status.wireName());
            request.put("sensor_no", sensorNo);
            request.put("value", status.isOn() ? "1" : "0");
        }
        request.put("request_type", DeviceMessageHandler.POLL_REQUEST);
        if (StringUtils.isBlank(thingName)) {
            log.warn("No thing name to poll {} through.", deviceId);
            return;
        }
        try {
            publisher.publish(thingName, Topic.POLL, request);
            log.info("Published poll request for {}/{} via {}.", deviceId, sensorNo, thingName);
        } catch (TransportException e) {
            log.error("Poll request for {}/{} not published: {}", deviceId, sensorNo, e.getMessage());
        }
    }

    private void requireOwned(String ownerId, String deviceId) {
        topology.requireAccount(ownerId).findDevice(deviceId)
            .orElseThrow(() -> NotFoundException.of("Device", deviceId));
    }
}
