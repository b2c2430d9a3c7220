package aquabase.app.correlation;

import java.time.Duration;
import java.util.Optional;

/**
 * Outcome of waiting for a device response. A timeout is a normal result: the
 * response may still arrive later.
 */
public sealed interface CorrelationResult permits CorrelationResult.Responded, CorrelationResult.TimedOut {

    CorrelationKey key();

    default boolean isResponded() {
        return this instanceof Responded;
    }

    default Optional<ResponseRecord> response() {
        if (this instanceof Responded responded) {
            return Optional.of(responded.record());
        }
        return Optional.empty();
    }

    record Responded(CorrelationKey key, ResponseRecord record) implements CorrelationResult { }

    record TimedOut(CorrelationKey key, Duration waited) implements CorrelationResult { }
}
