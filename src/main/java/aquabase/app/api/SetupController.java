package aquabase.app.api;

import java.util.List;
import java.util.Map;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import com.fasterxml.jackson.annotation.JsonProperty;

import aquabase.app.setup.Setup;
import aquabase.app.setup.SetupService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

@RestController
@RequestMapping("/api/spaces/{spaceId}/setups")
public class SetupController {

    public record StatusRequest(@JsonProperty("active") @NotNull Boolean active) { }

    @Autowired
    private SetupService setups;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Setup createSetup(@RequestHeader(ControlController.OWNER_HEADER) String ownerId, @PathVariable("spaceId") String spaceId,
            @RequestBody Setup request) {
        return setups.createSetup(ownerId, spaceId, request);
    }

    @GetMapping
    public List<Setup> getSetups(@RequestHeader(ControlController.OWNER_HEADER) String ownerId, @PathVariable("spaceId") String spaceId) {
        return setups.getSetups(ownerId, spaceId);
    }

    @GetMapping("/{setupId}")
    public Setup getSetup(@RequestHeader(ControlController.OWNER_HEADER) String ownerId, @PathVariable("spaceId") String spaceId,
            @PathVariable("setupId") String setupId) {
        return setups.getSetup(ownerId, spaceId, setupId);
    }

    @PutMapping("/{setupId}")
    public Setup updateSetup(@RequestHeader(ControlController.OWNER_HEADER) String ownerId, @PathVariable("spaceId") String spaceId,
            @PathVariable("setupId") String setupId, @RequestBody Setup changes) {
        return setups.updateSetup(ownerId, spaceId, setupId, changes);
    }

    @PatchMapping("/{setupId}/status")
    public Setup updateSetupStatus(@RequestHeader(ControlController.OWNER_HEADER) String ownerId, @PathVariable("spaceId") String spaceId,
            @PathVariable("setupId") String setupId, @Valid @RequestBody StatusRequest request) {
        return setups.updateSetupStatus(ownerId, spaceId, setupId, request.active().booleanValue());
    }

    @DeleteMapping("/{setupId}")
    public Map<String, Object> deleteSetup(@RequestHeader(ControlController.OWNER_HEADER) String ownerId, @PathVariable("spaceId") String spaceId,
            @PathVariable("setupId") String setupId) {
        setups.deleteSetup(ownerId, spaceId, setupId);
        return Map.of("success", true, "message", "Setup deleted successfully");
    }
}
