package aquabase.app.control;

import java.time.Duration;

/**
 * How long a device response stays fresh and how long each kind of request waits
 * for one.
 */
public record CorrelationTimeouts(Duration freshness, Duration slaveDeadline, Duration aliveDeadline, Duration tankDeadline) {

    public static final CorrelationTimeouts DEFAULTS = new CorrelationTimeouts(
        Duration.ofSeconds(10), Duration.ofSeconds(5), Duration.ofSeconds(5), Duration.ofSeconds(10));
}
