package aquabase.app.correlation;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import aquabase.app.provider.Metrics;

/**
 * Matches an outbound command with a response that arrives out of band, by
 * polling the shared response store until a fresh match shows up or the deadline
 * passes.
 * <p>
 * Polls run on the scheduler, so the caller is never blocked. Concurrent waits on
 * the same key are independent and may all see the same record. Once started a
 * wait always runs to a match or to its deadline.
 */
public class ResponseCorrelator {

    private static Logger log = null;

    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(500);

    private final ResponseStore store;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;
    private final Duration pollInterval;
    private final Metrics metrics;

    public ResponseCorrelator(ResponseStore store, ScheduledExecutorService scheduler, Clock clock, Duration pollInterval) {
        if (log == null) {
            log = LoggerFactory.getLogger(ResponseCorrelator.class);
        }
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("Poll interval must be positive.");
        }
        this.store = store;
        this.scheduler = scheduler;
        this.clock = clock;
        this.pollInterval = pollInterval;
        this.metrics = Metrics.getInstance();
    }

    public CompletableFuture<CorrelationResult> awaitResponse(CorrelationKey key, Duration freshnessWindow, Duration deadline) {
        final CompletableFuture<CorrelationResult> result = new CompletableFuture<>();
        final Instant startedAt = clock.instant();
        log.debug("Awaiting {} for {} (freshness {}, deadline {}).", key.kind().wireName(), key.identity(), freshnessWindow, deadline);
        schedulePoll(key, freshnessWindow, deadline, startedAt, result, 0L);
        return result;
    }

    /**
     * The most recent response still held for the key, without waiting.
     */
    public Optional<ResponseRecord> latest(CorrelationKey key) {
        return store.findRecent(key, Instant.EPOCH).stream().findFirst();
    }

    private void schedulePoll(CorrelationKey key, Duration freshnessWindow, Duration deadline, Instant startedAt,
            CompletableFuture<CorrelationResult> result, long delayMillis) {
        try {
            scheduler.schedule(() -> poll(key, freshnessWindow, deadline, startedAt, result), delayMillis, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(e);
        }
    }

    private void poll(CorrelationKey key, Duration freshnessWindow, Duration deadline, Instant startedAt,
            CompletableFuture<CorrelationResult> result) {
        try {
            final Instant now = clock.instant();
            final List<ResponseRecord> matches = store.findRecent(key, now.minus(freshnessWindow));
            if (!matches.isEmpty()) {
                final ResponseRecord newest = matches.get(0);
                log.info("{} from {} matched after {}ms.", key.kind().wireName(), key.identity(),
                    Duration.between(startedAt, now).toMillis());
                metrics.postMetric("correlation", Map.of("kind", key.kind().wireName(), "outcome", "responded"));
                result.complete(new CorrelationResult.Responded(key, newest));
                return;
            }
            final Duration waited = Duration.between(startedAt, now);
            if (waited.compareTo(deadline) >= 0) {
                log.info("No {} from {} within {}ms.", key.kind().wireName(), key.identity(), deadline.toMillis());
                metrics.postMetric("correlation", Map.of("kind", key.kind().wireName(), "outcome", "timeout"));
                result.complete(new CorrelationResult.TimedOut(key, waited));
                return;
            }
            final long remaining = deadline.minus(waited).toMillis();
            schedulePoll(key, freshnessWindow, deadline, startedAt, result, Math.max(1L, Math.min(pollInterval.toMillis(), remaining)));
        } catch (RuntimeException e) {
            log.error("Polling for {} from {} failed.", key.kind().wireName(), key.identity(), e);
            result.completeExceptionally(e);
        }
    }
}
