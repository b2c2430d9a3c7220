package aquabase.app.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import aquabase.app.device.BaseDevice;
import aquabase.app.device.SwitchNo;
import aquabase.app.device.TankDevice;
import jakarta.validation.constraints.NotBlank;

/**
 * Request bodies of the topology endpoints.
 */
public final class DeviceRequests {

    private DeviceRequests() { }

    public record CreateAccount(@JsonProperty("mobile_number") String mobileNumber) { }

    public record CreateSpace(@JsonProperty("space_name") @NotBlank String spaceName) { }

    public record AddBase(
        @JsonProperty("device_id") @NotBlank String deviceId,
        @JsonProperty("device_name") String deviceName,
        @JsonProperty("thing_name") String thingName,
        @JsonProperty("connection_type") String connectionType,
        @JsonProperty("ssid") String ssid) {

        public BaseDevice toDevice() {
            final BaseDevice device = new BaseDevice(deviceId, deviceName, thingName);
            device.setConnectionType(connectionType);
            device.setSsid(ssid);
            return device;
        }
    }

    public record AttachTank(
        @JsonProperty("device_id") @NotBlank String deviceId,
        @JsonProperty("device_name") String deviceName,
        @JsonProperty("switch_no") SwitchNo switchNo,
        @JsonProperty("capacity") Double capacity,
        @JsonProperty("connection_mode") Integer connectionMode) {

        public TankDevice toDevice() {
            final TankDevice device = new TankDevice(deviceId, deviceName);
            device.setCapacity(capacity);
            device.setConnectionMode(connectionMode == null ? Integer.valueOf(TankDevice.MODE_WIFI) : connectionMode);
            return device;
        }
    }
}
