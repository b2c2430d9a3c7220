package aquabase.app.correlation;

import java.util.Objects;

/**
 * What an awaited response must look like.
 *
 * @param identity thing id for slave responses, device id otherwise
 * @param sensorNo only matched when set
 */
public record CorrelationKey(ResponseKind kind, String identity, String sensorNo) {

    public CorrelationKey {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(identity, "identity");
    }

    public static CorrelationKey slaveResponse(String thingId) {
        return new CorrelationKey(ResponseKind.SLAVE_RESPONSE, thingId, null);
    }

    public static CorrelationKey aliveReply(String deviceId) {
        return new CorrelationKey(ResponseKind.ALIVE_REPLY, deviceId, null);
    }

    public static CorrelationKey sensorUpdate(String deviceId, String sensorNo) {
        return new CorrelationKey(ResponseKind.UPDATE, deviceId, sensorNo);
    }

    public boolean matches(ResponseRecord record) {
        if (record.kind() != kind || !identity.equals(kind.identityOf(record))) {
            return false;
        }
        return sensorNo == null || sensorNo.equalsIgnoreCase(record.sensorNo());
    }
}
