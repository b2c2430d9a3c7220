package aquabase.app.correlation;

import java.time.Instant;
import java.util.List;

/**
 * Shared store of device responses, written by inbound message handling and read
 * by correlators.
 */
public interface ResponseStore {

    void append(ResponseRecord record);

    /**
     * @return records matching the key inserted at or after {@code since}, most
     *         recent first
     */
    List<ResponseRecord> findRecent(CorrelationKey key, Instant since);
}
