package aquabase.app.liveness;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import aquabase.app.device.Account;
import aquabase.app.device.Device;
import aquabase.app.notification.Notification;
import aquabase.app.notification.NotificationType;
import aquabase.app.notification.Notifier;
import aquabase.app.provider.AccountRepository;
import aquabase.app.provider.Metrics;
import io.sentry.Sentry;

/**
 * Tracks when each device was last heard from. A device that stays silent past the
 * offline timeout is marked offline once and then forgotten until it reports again.
 * <p>
 * The last-seen map is process local and starts empty, so devices are presumed
 * online until swept.
 */
public class LivenessTracker {

    private static Logger log = null;

    public static final Duration DEFAULT_OFFLINE_TIMEOUT = Duration.ofSeconds(300);

    private final AccountRepository accounts;
    private final Notifier notifier;
    private final Clock clock;
    private final Duration offlineTimeout;
    private final Map<String, Instant> lastSeen;
    private final Metrics metrics;

    public LivenessTracker(AccountRepository accounts, Notifier notifier, Clock clock, Duration offlineTimeout) {
        if (log == null) {
            log = LoggerFactory.getLogger(LivenessTracker.class);
        }
        this.accounts = accounts;
        this.notifier = notifier;
        this.clock = clock;
        this.offlineTimeout = offlineTimeout;
        this.lastSeen = new ConcurrentHashMap<>();
        this.metrics = Metrics.getInstance();
    }

    /**
     * Stamps the device as heard from now. A device stored as offline is brought
     * back online on first sight.
     *
     * @return true when this sighting brought the device back online
     */
    public boolean recordSeen(String deviceId) {
        if (deviceId == null || deviceId.isBlank()) {
            return false;
        }
        final Instant now = clock.instant();
        final Instant previous = lastSeen.put(deviceId, now);
        if (previous != null) {
            return false;
        }
        final Optional<Account> holder = accounts.findByDeviceId(deviceId);
        if (holder.isEmpty()) {
            log.debug("Seen unregistered device {}.", deviceId);
            return false;
        }
        final Account account = holder.get();
        final Device device = account.findDevice(deviceId).get();
        if (device.isOnline()) {
            return false;
        }
        device.setOnline(true);
        device.touch(now);
        accounts.save(account);
        log.info("{} is back online.", deviceId);
        metrics.postMetric("device_online", Map.of("device_type", device.getDeviceType().wireName()));
        notifier.notify(Notification.of(NotificationType.DEVICE_ONLINE, account.getOwnerId(),
            String.format("%s is now online", device.getDeviceName()),
            Map.of("device_id", deviceId, "device_name", device.getDeviceName()), now));
        return true;
    }

    /**
     * Marks every device silent for longer than the offline timeout as offline.
     *
     * @return ids of the devices marked offline by this sweep
     */
    public List<String> sweep() {
        final Instant cutoff = clock.instant().minus(offlineTimeout);
        final List<String> expired = new ArrayList<>();
        lastSeen.forEach((deviceId, seenAt) -> {
            if (seenAt.isBefore(cutoff)) {
                expired.add(deviceId);
            }
        });
        final List<String> markedOffline = new ArrayList<>();
        for (String deviceId : expired) {
            // a message may have arrived since the scan
            final Instant seenAt = lastSeen.get(deviceId);
            if (seenAt == null || !seenAt.isBefore(cutoff) || !lastSeen.remove(deviceId, seenAt)) {
                continue;
            }
            try {
                if (markOffline(deviceId)) {
                    markedOffline.add(deviceId);
                }
            } catch (RuntimeException e) {
                log.error("Cannot mark {} offline.", deviceId, e);
                metrics.postError(LivenessTracker.class, e);
                Sentry.captureException(e);
            }
        }
        metrics.postMetric("tracked_devices", lastSeen.size());
        if (!markedOffline.isEmpty()) {
            log.info("Marked {} offline after {}s of silence.", markedOffline, offlineTimeout.toSeconds());
        }
        return markedOffline;
    }

    public int trackedCount() {
        return lastSeen.size();
    }

    public Optional<Instant> lastSeen(String deviceId) {
        return Optional.ofNullable(lastSeen.get(deviceId));
    }

    private boolean markOffline(String deviceId) {
        final Optional<Account> holder = accounts.findByDeviceId(deviceId);
        if (holder.isEmpty()) {
            log.debug("{} went silent but is no longer registered.", deviceId);
            return false;
        }
        final Account account = holder.get();
        final Device device = account.findDevice(deviceId).get();
        if (!device.isOnline()) {
            return false;
        }
        final Instant now = clock.instant();
        device.setOnline(false);
        device.touch(now);
        accounts.save(account);
        metrics.postMetric("device_offline", Map.of("device_type", device.getDeviceType().wireName()));
        notifier.notify(Notification.of(NotificationType.DEVICE_OFFLINE, account.getOwnerId(),
            String.format("%s is now offline", device.getDeviceName()),
            Map.of("device_id", deviceId, "device_name", device.getDeviceName()), now));
        return true;
    }
}
