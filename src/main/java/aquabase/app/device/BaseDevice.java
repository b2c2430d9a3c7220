package aquabase.app.device;

import java.util.EnumMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Base station controller with two switch outputs.
 */
public class BaseDevice extends Device {

    public static final String CONNECTION_WIFI = "wifi";

    @JsonProperty("thing_name")
    protected String thingName;
    @JsonProperty("connection_type")
    protected String connectionType;
    @JsonProperty
    protected String ssid;
    @JsonProperty
    protected Map<SwitchNo, SwitchSlot> switches;

    public BaseDevice() {
        this.switches = new EnumMap<>(SwitchNo.class);
    }

    public BaseDevice(String deviceId, String deviceName, String thingName) {
        super(deviceId, deviceName);
        this.thingName = thingName;
        this.switches = new EnumMap<>(SwitchNo.class);
    }

    @Override
    public DeviceType getDeviceType() {
        return DeviceType.BASE;
    }
    @JsonIgnore
    public String getThingName() {
        return thingName;
    }
    @JsonIgnore
    public String getConnectionType() {
        return connectionType;
    }
    public void setConnectionType(String connectionType) {
        this.connectionType = connectionType;
    }
    @JsonIgnore
    public String getSsid() {
        return ssid;
    }
    public void setSsid(String ssid) {
        this.ssid = ssid;
    }
    /**
     * Both slots always exist; a slot never written reads as off.
     */
    @JsonIgnore
    public SwitchSlot getSwitch(SwitchNo switchNo) {
        if (switches == null) {
            switches = new EnumMap<>(SwitchNo.class);
        }
        return switches.computeIfAbsent(switchNo, s -> new SwitchSlot());
    }
    @JsonIgnore
    public SwitchStatus getStatus(SwitchNo switchNo) {
        return getSwitch(switchNo).getStatus();
    }
    public void setStatus(SwitchNo switchNo, SwitchStatus status) {
        getSwitch(switchNo).setStatus(status);
    }
    /**
     * Transport address for one switch: the slot address when set, otherwise the
     * device address.
     */
    @JsonIgnore
    public String getThingName(SwitchNo switchNo) {
        if (switchNo != null) {
            final String slotThing = getSwitch(switchNo).getThingName();
            if (slotThing != null && !slotThing.isBlank()) {
                return slotThing;
            }
        }
        return thingName;
    }
    @Override
    public String toString() {
        return "BaseDevice [device_id=" + deviceId + ", device_name=" + deviceName + ", thing_name=" + thingName
                + ", switches=" + switches + ", online_status=" + onlineStatus + "]";
    }
}
