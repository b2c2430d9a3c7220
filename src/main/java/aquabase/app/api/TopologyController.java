package aquabase.app.api;

import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import aquabase.app.device.Account;
import aquabase.app.device.Device;
import aquabase.app.device.Space;
import aquabase.app.device.TopologyService;
import jakarta.validation.Valid;

@RestController
@RequestMapping("/api")
public class TopologyController {

    @Autowired
    private Logger log;

    @Autowired
    private TopologyService topology;

    @PostMapping("/accounts")
    @ResponseStatus(HttpStatus.CREATED)
    public Account registerAccount(@RequestHeader(ControlController.OWNER_HEADER) String ownerId,
            @RequestBody DeviceRequests.CreateAccount request) {
        return topology.registerAccount(ownerId, request.mobileNumber());
    }

    @PostMapping("/spaces")
    @ResponseStatus(HttpStatus.CREATED)
    public Space createSpace(@RequestHeader(ControlController.OWNER_HEADER) String ownerId,
            @Valid @RequestBody DeviceRequests.CreateSpace request) {
        return topology.createSpace(ownerId, request.spaceName());
    }

    @GetMapping("/spaces/{spaceId}/devices")
    public List<Device> listDevices(@RequestHeader(ControlController.OWNER_HEADER) String ownerId, @PathVariable("spaceId") String spaceId) {
        return topology.listDevices(ownerId, spaceId);
    }

    @GetMapping("/spaces/{spaceId}/devices/{deviceId}")
    public Device getDevice(@RequestHeader(ControlController.OWNER_HEADER) String ownerId, @PathVariable("spaceId") String spaceId,
            @PathVariable("deviceId") String deviceId) {
        return topology.getDevice(ownerId, spaceId, deviceId);
    }

    @PostMapping("/spaces/{spaceId}/devices")
    @ResponseStatus(HttpStatus.CREATED)
    public Device addDevice(@RequestHeader(ControlController.OWNER_HEADER) String ownerId, @PathVariable("spaceId") String spaceId,
            @Valid @RequestBody DeviceRequests.AddBase request) {
        return topology.addDevice(ownerId, spaceId, request.toDevice());
    }

    @PostMapping("/devices/{baseId}/tanks")
    @ResponseStatus(HttpStatus.CREATED)
    public Device attachTank(@RequestHeader(ControlController.OWNER_HEADER) String ownerId, @PathVariable("baseId") String baseId,
            @Valid @RequestBody DeviceRequests.AttachTank request) {
        return topology.attachTank(ownerId, baseId, request.switchNo(), request.toDevice());
    }

    @DeleteMapping("/devices/{deviceId}")
    public Map<String, Object> detachDevice(@RequestHeader(ControlController.OWNER_HEADER) String ownerId,
            @PathVariable("deviceId") String deviceId) {
        topology.detachDevice(ownerId, deviceId);
        log.info("{} removed device {}.", ownerId, deviceId);
        return Map.of("success", true, "message", "Device removed successfully");
    }
}
