package aquabase.app.setup;

import org.apache.commons.lang3.StringUtils;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import aquabase.app.device.DeviceState;
import aquabase.app.device.DeviceType;
import aquabase.app.error.ValidationException;

/**
 * Level window on a tank. The operator compares the level against {@code level}
 * when one is configured, otherwise against {@code minimum} for {@code <} and
 * {@code <=} and against {@code maximum} for the rest.
 */
public record TankCondition(
    @JsonProperty("device_id") String deviceId,
    @JsonProperty("minimum") Double minimum,
    @JsonProperty("maximum") Double maximum,
    @JsonProperty("operator") Operator operator,
    @JsonProperty("level") Double level) implements Condition {

    public static final double LEVEL_MIN = 0d;
    public static final double LEVEL_MAX = 100d;

    public TankCondition(String deviceId, double minimum, double maximum, Operator operator) {
        this(deviceId, Double.valueOf(minimum), Double.valueOf(maximum), operator, null);
    }

    @Override
    @JsonIgnore
    public DeviceType getDeviceType() {
        return DeviceType.TANK;
    }

    /**
     * Unset operators default to {@code <}.
     */
    @JsonIgnore
    public Operator effectiveOperator() {
        if (operator == null) {
            return Operator.LT;
        }
        return operator;
    }

    @JsonIgnore
    public double threshold() {
        if (level != null) {
            return level.doubleValue();
        }
        if (effectiveOperator().isLowerBound()) {
            return minimum.doubleValue();
        }
        return maximum.doubleValue();
    }

    @Override
    public void validate() {
        if (StringUtils.isBlank(deviceId)) {
            throw new ValidationException("Condition device_id is required");
        }
        if (maximum == null || maximum < LEVEL_MIN || maximum > LEVEL_MAX) {
            throw new ValidationException("Maximum must be a number between 0 and 100 for tank devices");
        }
        if (minimum == null || minimum < LEVEL_MIN || minimum > LEVEL_MAX) {
            throw new ValidationException("Minimum must be a number between 0 and 100 for tank devices");
        }
        if (minimum >= maximum) {
            throw new ValidationException("Minimum must be less than maximum");
        }
        if (level != null && (level < LEVEL_MIN || level > LEVEL_MAX)) {
            throw new ValidationException("Level must be a number between 0 and 100 for tank devices");
        }
    }

    @Override
    public boolean isSatisfiedBy(DeviceState state) {
        if (state == null || state.deviceType() != DeviceType.TANK || !deviceId.equals(state.deviceId())) {
            return false;
        }
        if (state.level() == null) {
            return false;
        }
        return effectiveOperator().apply(state.level().doubleValue(), threshold());
    }
}
