package aquabase.app.device;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import aquabase.app.error.NotFoundException;

/**
 * Aggregate root: everything one owner has registered. Read, changed and saved
 * back as a single document.
 */
public class Account {
    @JsonProperty("owner_id")
    protected String ownerId;
    @JsonProperty("mobile_number")
    protected String mobileNumber;
    @JsonProperty
    protected List<Space> spaces;

    public Account() {
        this.spaces = new ArrayList<>();
    }
    public Account(String ownerId, String mobileNumber) {
        this();
        this.ownerId = ownerId;
        this.mobileNumber = mobileNumber;
    }
    @JsonIgnore
    public String getOwnerId() {
        return ownerId;
    }
    @JsonIgnore
    public String getMobileNumber() {
        return mobileNumber;
    }
    @JsonIgnore
    public List<Space> getSpaces() {
        if (spaces == null) {
            spaces = new ArrayList<>();
        }
        return spaces;
    }
    public Optional<Space> findSpace(String spaceId) {
        return getSpaces().stream().filter(s -> s.getSpaceId().equals(spaceId)).findFirst();
    }
    public Space requireSpace(String spaceId) {
        return findSpace(spaceId).orElseThrow(() -> NotFoundException.of("Space", spaceId));
    }
    public Optional<Space> spaceOfDevice(String deviceId) {
        return getSpaces().stream().filter(s -> s.findDevice(deviceId).isPresent()).findFirst();
    }
    public Optional<Device> findDevice(String deviceId) {
        return spaceOfDevice(deviceId).flatMap(s -> s.findDevice(deviceId));
    }
    @Override
    public String toString() {
        return "Account [owner_id=" + ownerId + ", spaces=" + getSpaces() + "]";
    }
}
