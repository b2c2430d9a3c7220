package aquabase.app.setup;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import aquabase.app.device.Account;
import aquabase.app.device.BaseDevice;
import aquabase.app.device.Device;
import aquabase.app.device.Space;
import aquabase.app.device.SwitchStatus;
import aquabase.app.error.NotFoundException;
import aquabase.app.error.TransportException;
import aquabase.app.message.CommandPublisher;
import aquabase.app.message.Topic;
import aquabase.app.notification.Notification;
import aquabase.app.notification.NotificationType;
import aquabase.app.notification.Notifier;
import aquabase.app.provider.AccountRepository;
import aquabase.app.provider.Metrics;

/**
 * Runs the actions of a triggered setup against the base devices of its space.
 * <p>
 * Actions run strictly in order. Each one is recorded on the in-memory account
 * before its command is published and undone if the publish fails, so a failed
 * action never leaves a status behind. The account is saved once after the last
 * action and notifications go out only after that save.
 */
public class ActionExecutor {

    private static Logger log = null;

    private final AccountRepository accounts;
    private final CommandPublisher publisher;
    private final Notifier notifier;
    private final Clock clock;
    private final Metrics metrics;

    public ActionExecutor(AccountRepository accounts, CommandPublisher publisher, Notifier notifier, Clock clock) {
        if (log == null) {
            log = LoggerFactory.getLogger(ActionExecutor.class);
        }
        this.accounts = accounts;
        this.publisher = publisher;
        this.notifier = notifier;
        this.clock = clock;
        this.metrics = Metrics.getInstance();
    }

    public ExecutionReport execute(String ownerId, String spaceId, Setup setup) {
        final Account account = accounts.findById(ownerId).orElseThrow(() -> NotFoundException.of("User", ownerId));
        final Space space = account.requireSpace(spaceId);
        final List<ExecutionReport.ActionOutcome> outcomes = new ArrayList<>();
        final List<Notification> pending = new ArrayList<>();
        for (Action action : setup.getActions()) {
            outcomes.add(apply(account, space, setup, action, pending));
        }
        final ExecutionReport report = new ExecutionReport(setup.getId(), setup.getName(), outcomes);
        if (report.anyApplied()) {
            accounts.save(account);
        }
        pending.forEach(notifier::notify);
        log.info("Setup {} ({}) ran {} actions: {} applied, {} unchanged, {} rolled back.", setup.getName(), setup.getId(),
            outcomes.size(), report.count(ExecutionReport.Status.APPLIED), report.count(ExecutionReport.Status.SKIPPED_UNCHANGED),
            report.count(ExecutionReport.Status.ROLLED_BACK));
        return report;
    }

    private ExecutionReport.ActionOutcome apply(Account account, Space space, Setup setup, Action action, List<Notification> pending) {
        final Optional<Device> target = space.findDevice(action.deviceId());
        if (target.isEmpty()) {
            log.error("Action device {} of setup {} not found in space {}.", action.deviceId(), setup.getId(), space.getSpaceId());
            return outcome(action, ExecutionReport.Status.DEVICE_NOT_FOUND, "Action device not found");
        }
        if (!(target.get() instanceof BaseDevice)) {
            log.error("Setup {} cannot control non-base device {}.", setup.getId(), action.deviceId());
            return outcome(action, ExecutionReport.Status.NOT_BASE_DEVICE, "Only base devices can be controlled");
        }
        final BaseDevice device = (BaseDevice) target.get();
        final SwitchStatus previous = device.getStatus(action.switchNo());
        if (previous == action.setStatus()) {
            log.info("{}/{} already {}.", action.deviceId(), action.switchNo(), action.setStatus().wireName());
            return outcome(action, ExecutionReport.Status.SKIPPED_UNCHANGED, "Already in target state");
        }
        final Instant previousUpdate = device.getLastUpdated();
        final Instant now = clock.instant();
        device.setStatus(action.switchNo(), action.setStatus());
        device.touch(now);
        final Map<String, Object> command = new LinkedHashMap<>();
        command.put("deviceid", action.deviceId());
        command.put("switch_no", action.switchNo().name());
        command.put("status", action.setStatus().wireName());
        command.put("triggered_by", "setup:" + setup.getId());
        try {
            publisher.publish(device.getThingName(action.switchNo()), Topic.CONTROL, command);
        } catch (TransportException e) {
            device.setStatus(action.switchNo(), previous);
            device.touch(previousUpdate);
            log.error("Control for {}/{} from setup {} not sent, status kept {}: {}", action.deviceId(), action.switchNo(),
                setup.getId(), previous.wireName(), e.getMessage());
            metrics.postMetric("action", Map.of("outcome", "rolled_back"));
            return outcome(action, ExecutionReport.Status.ROLLED_BACK, e.getMessage());
        }
        metrics.postMetric("action", Map.of("outcome", "applied"));
        final Map<String, Object> data = new LinkedHashMap<>();
        data.put("device_id", action.deviceId());
        data.put("device_name", device.getDeviceName());
        data.put("switch_no", action.switchNo().name());
        data.put("previous_status", previous.wireName());
        data.put("new_status", action.setStatus().wireName());
        data.put("rule_name", setup.getName());
        data.put("setup_id", setup.getId());
        data.put("space_id", space.getSpaceId());
        data.put("space_name", space.getSpaceName());
        data.put("automated", Boolean.TRUE);
        pending.add(Notification.of(NotificationType.SETUP_ACTION, account.getOwnerId(),
            String.format("Device %s turned %s by automation", device.getDeviceName(), action.setStatus().wireName()), data, now));
        return outcome(action, ExecutionReport.Status.APPLIED, null);
    }

    private static ExecutionReport.ActionOutcome outcome(Action action, ExecutionReport.Status status, String detail) {
        return new ExecutionReport.ActionOutcome(action, status, detail);
    }
}
