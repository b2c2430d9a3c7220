package aquabase.app.setup;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import aquabase.app.control.DeviceControlService;
import aquabase.app.device.Account;
import aquabase.app.device.Device;
import aquabase.app.device.DeviceType;
import aquabase.app.device.SlaveName;
import aquabase.app.device.Space;
import aquabase.app.device.TankDevice;
import aquabase.app.error.AutomationException;
import aquabase.app.error.NotFoundException;
import aquabase.app.error.ValidationException;
import aquabase.app.provider.AccountRepository;
import io.sentry.Sentry;

/**
 * Setups of a space. A saved setup is also pushed to the device as settings; a
 * failed push is logged and the saved setup stands.
 */
public class SetupService {

    private static Logger log = null;

    private final AccountRepository accounts;
    private final DeviceControlService control;
    private final Clock clock;

    public SetupService(AccountRepository accounts, DeviceControlService control, Clock clock) {
        if (log == null) {
            log = LoggerFactory.getLogger(SetupService.class);
        }
        this.accounts = accounts;
        this.control = control;
        this.clock = clock;
    }

    public Setup createSetup(String ownerId, String spaceId, Setup request) {
        final Account account = requireAccount(ownerId);
        final Space space = account.requireSpace(spaceId);
        validate(space, request.getCondition(), request.getActions());
        final Instant now = clock.instant();
        final Setup setup = new Setup(
            StringUtils.defaultIfBlank(request.getName(), "Setup " + (space.getSetups().size() + 1)),
            request.getCondition(),
            request.getActions());
        setup.setId(UUID.randomUUID().toString());
        setup.setDescription(request.getDescription());
        setup.setActive(request.getActiveFlag() == null ? Boolean.TRUE : request.getActiveFlag());
        setup.setCreatedAt(now);
        setup.setUpdatedAt(now);
        space.addSetup(setup);
        accounts.save(account);
        log.info("Setup {} ({}) saved for space {}.", setup.getName(), setup.getId(), spaceId);
        pushSettings(space, setup);
        return setup;
    }

    public List<Setup> getSetups(String ownerId, String spaceId) {
        return requireAccount(ownerId).requireSpace(spaceId).getSetups().stream()
            .filter(s -> s.getCondition() != null)
            .collect(Collectors.toList());
    }

    public Setup getSetup(String ownerId, String spaceId, String setupId) {
        return requireAccount(ownerId).requireSpace(spaceId).requireSetup(setupId);
    }

    /**
     * Replaces the fields present in {@code changes}; absent fields keep their
     * stored value. The merged setup is validated as a whole.
     */
    public Setup updateSetup(String ownerId, String spaceId, String setupId, Setup changes) {
        final Account account = requireAccount(ownerId);
        final Space space = account.requireSpace(spaceId);
        final Setup setup = space.requireSetup(setupId);
        final Condition condition = changes.getCondition() != null ? changes.getCondition() : setup.getCondition();
        final List<Action> actions = changes.getActions().isEmpty() ? setup.getActions() : changes.getActions();
        validate(space, condition, actions);
        if (changes.getName() != null) {
            setup.setName(changes.getName());
        }
        if (changes.getDescription() != null && !changes.getDescription().isEmpty()) {
            setup.setDescription(changes.getDescription());
        }
        if (changes.getActiveFlag() != null) {
            setup.setActive(changes.getActiveFlag());
        }
        setup.setCondition(condition);
        setup.setActions(actions);
        setup.setUpdatedAt(clock.instant());
        accounts.save(account);
        log.info("Setup {} ({}) updated in space {}.", setup.getName(), setupId, spaceId);
        if (changes.getCondition() != null || !changes.getActions().isEmpty()) {
            pushSettings(space, setup);
        }
        return setup;
    }

    public Setup updateSetupStatus(String ownerId, String spaceId, String setupId, boolean active) {
        final Account account = requireAccount(ownerId);
        final Setup setup = account.requireSpace(spaceId).requireSetup(setupId);
        setup.setActive(Boolean.valueOf(active));
        setup.setUpdatedAt(clock.instant());
        accounts.save(account);
        log.info("Setup {} status updated to {}.", setupId, active);
        return setup;
    }

    public void deleteSetup(String ownerId, String spaceId, String setupId) {
        final Account account = requireAccount(ownerId);
        final Space space = account.requireSpace(spaceId);
        space.requireSetup(setupId);
        space.removeSetup(setupId);
        accounts.save(account);
        log.info("Setup {} deleted from space {}.", setupId, spaceId);
    }

    void validate(Space space, Condition condition, List<Action> actions) {
        if (condition == null) {
            throw new ValidationException("Condition is required");
        }
        if (StringUtils.isBlank(condition.deviceId())) {
            throw new ValidationException("Condition device_id is required");
        }
        final Device conditionDevice = space.findDevice(condition.deviceId()).orElseThrow(() -> new NotFoundException(
            String.format("Condition device with ID '%s' not found in this space", condition.deviceId())));
        if (conditionDevice.getDeviceType() != condition.getDeviceType()) {
            throw new ValidationException(String.format("Device type mismatch. Device '%s' is of type '%s', not '%s'",
                condition.deviceId(), conditionDevice.getDeviceType().wireName(), condition.getDeviceType().wireName()));
        }
        condition.validate();
        if (actions == null || actions.isEmpty()) {
            throw new ValidationException("At least one action is required");
        }
        for (Action action : actions) {
            if (StringUtils.isBlank(action.deviceId())) {
                throw new ValidationException("Action device_id is required");
            }
            final Device actionDevice = space.findDevice(action.deviceId()).orElseThrow(() -> new NotFoundException(
                String.format("Action device with ID '%s' not found in this space", action.deviceId())));
            if (actionDevice.getDeviceType() != DeviceType.BASE) {
                throw new ValidationException(String.format("Device '%s' must be of type 'base' to be used in actions", action.deviceId()));
            }
            action.validate();
        }
    }

    private void pushSettings(Space space, Setup setup) {
        final Condition condition = setup.getCondition();
        final Map<String, Object> payload = new LinkedHashMap<>();
        final String target;
        if (condition instanceof TankCondition) {
            final TankCondition tank = (TankCondition) condition;
            final Action first = setup.getActions().get(0);
            final SlaveName slaveName = space.findDevice(tank.deviceId())
                .filter(TankDevice.class::isInstance)
                .map(d -> ((TankDevice) d).getSlaveName())
                .orElse(null);
            payload.put("deviceid", tank.deviceId());
            payload.put("sensor_no", slaveName == null ? SlaveName.TM1.name() : slaveName.name());
            payload.put("switch_no", first.switchNo().name());
            payload.put("maximum", formatLevel(tank.maximum()));
            payload.put("minimum", formatLevel(tank.minimum()));
            target = first.deviceId();
        } else {
            final BaseCondition base = (BaseCondition) condition;
            payload.put("deviceid", base.deviceId());
            payload.put("switch_no", base.switchNo().name());
            payload.put("status", base.status().wireName());
            payload.put("setup_id", setup.getId());
            payload.put("setup_name", setup.getName());
            payload.put("actions", setup.getActions().stream().map(a -> {
                final Map<String, Object> action = new LinkedHashMap<>();
                action.put("device_id", a.deviceId());
                action.put("switch_no", a.switchNo().name());
                action.put("set_status", a.setStatus().wireName());
                action.put("delay", a.delaySeconds());
                return action;
            }).collect(Collectors.toList()));
            target = base.deviceId();
        }
        try {
            control.setting(target, payload);
        } catch (AutomationException e) {
            log.error("Settings for setup {} not sent to {}, setup was saved: {}", setup.getId(), target, e.getMessage());
            Sentry.captureException(e);
        }
    }

    private Account requireAccount(String ownerId) {
        return accounts.findById(ownerId).orElseThrow(() -> NotFoundException.of("User", ownerId));
    }

    private static String formatLevel(Double level) {
        if (level == null) {
            return null;
        }
        if (level.doubleValue() == Math.rint(level.doubleValue())) {
            return Long.toString(level.longValue());
        }
        return level.toString();
    }
}
