package aquabase.app.device;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A device registered in a space. The concrete type is carried on the wire as
 * {@code device_type}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "device_type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = BaseDevice.class, name = "base"),
    @JsonSubTypes.Type(value = TankDevice.class, name = "tank")
})
public abstract class Device {

    @JsonProperty("device_id")
    protected String deviceId;
    @JsonProperty("device_name")
    protected String deviceName;
    @JsonProperty("online_status")
    protected Boolean onlineStatus;
    @JsonProperty("firmware_version")
    protected String firmwareVersion;
    @JsonProperty("last_updated")
    protected Instant lastUpdated;

    protected Device() { }

    protected Device(String deviceId, String deviceName) {
        this.deviceId = deviceId;
        this.deviceName = deviceName;
    }

    @JsonIgnore
    public abstract DeviceType getDeviceType();

    @JsonIgnore
    public String getDeviceId() {
        return deviceId;
    }
    @JsonIgnore
    public String getDeviceName() {
        if (deviceName == null) {
            return deviceId;
        }
        return deviceName;
    }
    public void setDeviceName(String deviceName) {
        this.deviceName = deviceName;
    }
    /**
     * Devices are presumed online until a liveness sweep says otherwise.
     */
    @JsonIgnore
    public boolean isOnline() {
        if (onlineStatus == null) {
            return true;
        }
        return onlineStatus.booleanValue();
    }
    public void setOnline(boolean online) {
        this.onlineStatus = Boolean.valueOf(online);
    }
    @JsonIgnore
    public String getFirmwareVersion() {
        return firmwareVersion;
    }
    public void setFirmwareVersion(String firmwareVersion) {
        this.firmwareVersion = firmwareVersion;
    }
    @JsonIgnore
    public Instant getLastUpdated() {
        return lastUpdated;
    }
    public void touch(Instant when) {
        this.lastUpdated = when;
    }
}
