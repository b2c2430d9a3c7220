package aquabase.app.setup;

import org.apache.commons.lang3.StringUtils;

import com.fasterxml.jackson.annotation.JsonProperty;

import aquabase.app.device.SwitchNo;
import aquabase.app.device.SwitchStatus;
import aquabase.app.error.ValidationException;

/**
 * Switch one base output. {@code delay} is in seconds and is carried to the
 * device in the setting payload.
 */
public record Action(
    @JsonProperty("device_id") String deviceId,
    @JsonProperty("switch_no") SwitchNo switchNo,
    @JsonProperty("set_status") SwitchStatus setStatus,
    @JsonProperty("delay") Integer delay) {

    public Action(String deviceId, SwitchNo switchNo, SwitchStatus setStatus) {
        this(deviceId, switchNo, setStatus, Integer.valueOf(0));
    }

    public int delaySeconds() {
        if (delay == null) {
            return 0;
        }
        return delay.intValue();
    }

    public void validate() {
        if (StringUtils.isBlank(deviceId)) {
            throw new ValidationException("Action device_id is required");
        }
        if (setStatus == null) {
            throw new ValidationException("set_status field is required and must be 'on' or 'off' for actions");
        }
        if (switchNo == null) {
            throw new ValidationException("switch_no field is required and must be 'BM1' or 'BM2' for each action");
        }
        if (delay != null && delay.intValue() < 0) {
            throw new ValidationException("delay must not be negative");
        }
    }
}
