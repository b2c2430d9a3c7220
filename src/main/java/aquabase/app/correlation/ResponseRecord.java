package aquabase.app.correlation;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One response written by the inbound side. Records are a log: reading one does
 * not consume it.
 */
public record ResponseRecord(
    String thingId,
    String deviceId,
    String sensorNo,
    ResponseKind kind,
    Instant insertedAt,
    Map<String, Object> responseData) {

    public ResponseRecord {
        responseData = responseData == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(responseData));
    }
}
