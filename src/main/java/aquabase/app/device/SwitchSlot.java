package aquabase.app.device;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

public class SwitchSlot {
    @JsonProperty
    protected SwitchStatus status;
    @JsonProperty("thing_name")
    protected String thingName;

    public SwitchSlot() {
        this.status = SwitchStatus.OFF;
    }
    public SwitchSlot(SwitchStatus status, String thingName) {
        this.status = status;
        this.thingName = thingName;
    }
    @JsonIgnore
    public SwitchStatus getStatus() {
        if (status == null) {
            return SwitchStatus.OFF;
        }
        return status;
    }
    public void setStatus(SwitchStatus status) {
        this.status = status;
    }
    @JsonIgnore
    public String getThingName() {
        return thingName;
    }
    public void setThingName(String thingName) {
        this.thingName = thingName;
    }
    @Override
    public String toString() {
        return "SwitchSlot [status=" + status + ", thing_name=" + thingName + "]";
    }
}
