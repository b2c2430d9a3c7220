package aquabase.app.device;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Level sensor attached to one switch of a base device.
 */
public class TankDevice extends Device {

    public static final int MODE_WIFI = 1;
    public static final int MODE_WITHOUT_WIFI = 3;

    @JsonProperty("parent_device_id")
    protected String parentDeviceId;
    @JsonProperty("parent_switch_no")
    protected SwitchNo parentSwitchNo;
    @JsonProperty("slave_name")
    protected SlaveName slaveName;
    @JsonProperty
    protected Double level;
    @JsonProperty
    protected Double capacity;
    @JsonProperty("connection_mode")
    protected Integer connectionMode;
    @JsonProperty
    protected Integer channel;
    @JsonProperty("address_l")
    protected String addressL;
    @JsonProperty("address_h")
    protected String addressH;

    public TankDevice() { }

    public TankDevice(String deviceId, String deviceName) {
        super(deviceId, deviceName);
    }

    @Override
    public DeviceType getDeviceType() {
        return DeviceType.TANK;
    }
    @JsonIgnore
    public String getParentDeviceId() {
        return parentDeviceId;
    }
    @JsonIgnore
    public SwitchNo getParentSwitchNo() {
        return parentSwitchNo;
    }
    @JsonIgnore
    public SlaveName getSlaveName() {
        return slaveName;
    }
    public void attachTo(String parentDeviceId, SwitchNo parentSwitchNo, SlaveName slaveName) {
        this.parentDeviceId = parentDeviceId;
        this.parentSwitchNo = parentSwitchNo;
        this.slaveName = slaveName;
    }
    @JsonIgnore
    public boolean isAttachedTo(String baseDeviceId) {
        return parentDeviceId != null && parentDeviceId.equals(baseDeviceId);
    }
    @JsonIgnore
    public boolean isAttachedTo(String baseDeviceId, SwitchNo switchNo) {
        return isAttachedTo(baseDeviceId) && parentSwitchNo == switchNo;
    }
    @JsonIgnore
    public Double getLevel() {
        return level;
    }
    public void setLevel(Double level) {
        this.level = level;
    }
    @JsonIgnore
    public Double getCapacity() {
        return capacity;
    }
    public void setCapacity(Double capacity) {
        this.capacity = capacity;
    }
    @JsonIgnore
    public Integer getConnectionMode() {
        return connectionMode;
    }
    public void setConnectionMode(Integer connectionMode) {
        this.connectionMode = connectionMode;
    }
    @JsonIgnore
    public Integer getChannel() {
        return channel;
    }
    @JsonIgnore
    public String getAddressL() {
        return addressL;
    }
    @JsonIgnore
    public String getAddressH() {
        return addressH;
    }
    /**
     * Radio link reported by the base in a slave response. Absent fields keep the
     * previous value.
     */
    public void updateLink(Integer channel, String addressL, String addressH) {
        if (channel != null) {
            this.channel = channel;
        }
        if (addressL != null) {
            this.addressL = addressL;
        }
        if (addressH != null) {
            this.addressH = addressH;
        }
    }
    @Override
    public String toString() {
        return "TankDevice [device_id=" + deviceId + ", device_name=" + deviceName + ", parent_device_id="
                + parentDeviceId + ", parent_switch_no=" + parentSwitchNo + ", slave_name=" + slaveName
                + ", level=" + level + ", online_status=" + onlineStatus + "]";
    }
}
