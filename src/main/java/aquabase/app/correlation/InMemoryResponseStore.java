package aquabase.app.correlation;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded in-process response log. Records older than the retention window are
 * pruned on append.
 */
public class InMemoryResponseStore implements ResponseStore {

    private static Logger log = null;

    private final Clock clock;
    private final Duration retention;
    private final Deque<ResponseRecord> records;

    public InMemoryResponseStore(Clock clock, Duration retention) {
        if (log == null) {
            log = LoggerFactory.getLogger(InMemoryResponseStore.class);
        }
        this.clock = clock;
        this.retention = retention;
        this.records = new ArrayDeque<>();
    }

    @Override
    public synchronized void append(ResponseRecord record) {
        records.addLast(record);
        prune();
        log.debug("Stored {} for {} ({} records held).", record.kind().wireName(), record.kind().identityOf(record), records.size());
    }

    @Override
    public synchronized List<ResponseRecord> findRecent(CorrelationKey key, Instant since) {
        final List<ResponseRecord> matches = new ArrayList<>();
        final Iterator<ResponseRecord> newestFirst = records.descendingIterator();
        while (newestFirst.hasNext()) {
            final ResponseRecord record = newestFirst.next();
            if (record.insertedAt().isBefore(since)) {
                continue;
            }
            if (key.matches(record)) {
                matches.add(record);
            }
        }
        // insertion order is not guaranteed to be time order across writers
        matches.sort((a, b) -> b.insertedAt().compareTo(a.insertedAt()));
        return matches;
    }

    public synchronized int size() {
        return records.size();
    }

    private void prune() {
        final Instant cutoff = clock.instant().minus(retention);
        while (!records.isEmpty() && records.peekFirst().insertedAt().isBefore(cutoff)) {
            records.removeFirst();
        }
    }
}
