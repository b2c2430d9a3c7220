package aquabase.app.device;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import aquabase.app.error.NotFoundException;
import aquabase.app.setup.Setup;

public class Space {
    @JsonProperty("space_id")
    protected String spaceId;
    @JsonProperty("space_name")
    protected String spaceName;
    @JsonProperty
    protected List<Device> devices;
    @JsonProperty
    protected List<Setup> setups;

    public Space() {
        this.devices = new ArrayList<>();
        this.setups = new ArrayList<>();
    }
    public Space(String spaceId, String spaceName) {
        this();
        this.spaceId = spaceId;
        this.spaceName = spaceName;
    }
    @JsonIgnore
    public String getSpaceId() {
        return spaceId;
    }
    @JsonIgnore
    public String getSpaceName() {
        return spaceName;
    }
    @JsonIgnore
    public List<Device> getDevices() {
        if (devices == null) {
            devices = new ArrayList<>();
        }
        return devices;
    }
    /**
     * Setups in insertion order.
     */
    @JsonIgnore
    public List<Setup> getSetups() {
        if (setups == null) {
            setups = new ArrayList<>();
        }
        return setups;
    }
    public Optional<Device> findDevice(String deviceId) {
        return getDevices().stream().filter(d -> d.getDeviceId().equals(deviceId)).findFirst();
    }
    public Device requireDevice(String deviceId) {
        return findDevice(deviceId).orElseThrow(() -> new NotFoundException(
            String.format("Device '%s' not found in this space", deviceId)));
    }
    public Device addDevice(Device device) {
        getDevices().add(device);
        return device;
    }
    public boolean removeDevice(String deviceId) {
        return getDevices().removeIf(d -> d.getDeviceId().equals(deviceId));
    }
    public List<TankDevice> tanksAttachedTo(String baseDeviceId) {
        return getDevices().stream()
            .filter(TankDevice.class::isInstance)
            .map(TankDevice.class::cast)
            .filter(t -> t.isAttachedTo(baseDeviceId))
            .collect(Collectors.toList());
    }
    public Optional<Setup> findSetup(String setupId) {
        return getSetups().stream().filter(s -> s.getId().equals(setupId)).findFirst();
    }
    public Setup requireSetup(String setupId) {
        return findSetup(setupId).orElseThrow(() -> NotFoundException.of("Setup", setupId));
    }
    public Setup addSetup(Setup setup) {
        getSetups().add(setup);
        return setup;
    }
    public boolean removeSetup(String setupId) {
        return getSetups().removeIf(s -> s.getId().equals(setupId));
    }
    @Override
    public String toString() {
        return "Space [space_id=" + spaceId + ", space_name=" + spaceName + ", devices=" + getDevices().size()
                + ", setups=" + getSetups().size() + "]";
    }
}
