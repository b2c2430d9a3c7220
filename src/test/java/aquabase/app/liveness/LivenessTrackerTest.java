package aquabase.app.liveness;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import aquabase.app.Fixtures;
import aquabase.app.MutableClock;
import aquabase.app.notification.NotificationType;
import aquabase.app.notification.RecordingNotifier;
import aquabase.app.provider.InMemoryAccountRepository;

class LivenessTrackerTest {

    private InMemoryAccountRepository accounts;
    private RecordingNotifier notifier;
    private MutableClock clock;
    private LivenessTracker tracker;

    @BeforeEach
    void setUp() {
        accounts = new InMemoryAccountRepository();
        notifier = new RecordingNotifier();
        clock = new MutableClock();
        tracker = new LivenessTracker(accounts, notifier, clock, LivenessTracker.DEFAULT_OFFLINE_TIMEOUT);
        Fixtures.seed(accounts);
    }

    @Test
    void testSilentDeviceGoesOfflineOnce() {
        tracker.recordSeen(Fixtures.BASE);
        clock.advance(Duration.ofSeconds(301));

        assertEquals(List.of(Fixtures.BASE), tracker.sweep());
        assertFalse(Fixtures.base(accounts).isOnline());
        assertEquals(1, notifier.ofType(NotificationType.DEVICE_OFFLINE).size());
        assertEquals(Fixtures.BASE, notifier.ofType(NotificationType.DEVICE_OFFLINE).get(0).data().get("device_id"));
        assertEquals(0, tracker.trackedCount());

        clock.advance(Duration.ofSeconds(60));
        assertTrue(tracker.sweep().isEmpty());
        assertEquals(1, notifier.ofType(NotificationType.DEVICE_OFFLINE).size());
    }

    @Test
    void testRecentlySeenDeviceStaysOnline() {
        tracker.recordSeen(Fixtures.BASE);
        clock.advance(Duration.ofSeconds(200));
        tracker.recordSeen(Fixtures.BASE);
        clock.advance(Duration.ofSeconds(200));

        assertTrue(tracker.sweep().isEmpty());
        assertTrue(Fixtures.base(accounts).isOnline());
        assertEquals(clock.instant().minusSeconds(200), tracker.lastSeen(Fixtures.BASE).get());
    }

    @Test
    void testOfflineDeviceComesBackOnFirstSight() {
        tracker.recordSeen(Fixtures.TANK);
        clock.advance(Duration.ofSeconds(301));
        tracker.sweep();
        assertFalse(Fixtures.tank(accounts).isOnline());

        assertTrue(tracker.recordSeen(Fixtures.TANK));
        assertTrue(Fixtures.tank(accounts).isOnline());
        assertEquals(1, notifier.ofType(NotificationType.DEVICE_ONLINE).size());

        assertFalse(tracker.recordSeen(Fixtures.TANK));
        assertEquals(1, notifier.ofType(NotificationType.DEVICE_ONLINE).size());
    }

    @Test
    void testUnknownDevicesAreTrackedButNeverPersisted() {
        assertFalse(tracker.recordSeen("ghost"));
        assertFalse(tracker.recordSeen(" "));
        assertEquals(1, tracker.trackedCount());
        clock.advance(Duration.ofSeconds(301));

        assertTrue(tracker.sweep().isEmpty());
        assertTrue(notifier.all().isEmpty());
    }
}
