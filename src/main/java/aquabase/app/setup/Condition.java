package aquabase.app.setup;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import aquabase.app.device.DeviceState;
import aquabase.app.device.DeviceType;

/**
 * What a setup watches. One variant per device type.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "device_type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = BaseCondition.class, name = "base"),
    @JsonSubTypes.Type(value = TankCondition.class, name = "tank")
})
public sealed interface Condition permits BaseCondition, TankCondition {

    String deviceId();

    @JsonIgnore
    DeviceType getDeviceType();

    /**
     * @throws aquabase.app.error.ValidationException when a required field is
     *         missing or out of range
     */
    void validate();

    boolean isSatisfiedBy(DeviceState state);
}
