package aquabase.app.setup;

import org.apache.commons.lang3.StringUtils;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import aquabase.app.device.DeviceState;
import aquabase.app.device.DeviceType;
import aquabase.app.device.SwitchNo;
import aquabase.app.device.SwitchStatus;
import aquabase.app.error.ValidationException;

public record BaseCondition(
    @JsonProperty("device_id") String deviceId,
    @JsonProperty("switch_no") SwitchNo switchNo,
    @JsonProperty("status") SwitchStatus status) implements Condition {

    @Override
    @JsonIgnore
    public DeviceType getDeviceType() {
        return DeviceType.BASE;
    }

    @Override
    public void validate() {
        if (StringUtils.isBlank(deviceId)) {
            throw new ValidationException("Condition device_id is required");
        }
        if (status == null) {
            throw new ValidationException("Status field is required and must be 'on' or 'off' for base devices");
        }
        if (switchNo == null) {
            throw new ValidationException("switch_no field is required and must be 'BM1' or 'BM2' for base devices");
        }
    }

    /**
     * A change on the other switch of the same base does not count.
     */
    @Override
    public boolean isSatisfiedBy(DeviceState state) {
        if (state == null || state.deviceType() != DeviceType.BASE || !deviceId.equals(state.deviceId())) {
            return false;
        }
        if (state.switchNo() != null && state.switchNo() != switchNo) {
            return false;
        }
        return status == state.status();
    }
}
