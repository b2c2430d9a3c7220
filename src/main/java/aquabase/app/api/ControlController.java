package aquabase.app.api;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import org.apache.commons.lang3.math.NumberUtils;
import org.slf4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import aquabase.app.control.DeviceControlService;
import aquabase.app.correlation.CorrelationResult;
import aquabase.app.correlation.ResponseRecord;
import jakarta.validation.Valid;

@RestController
@RequestMapping("/api/control")
public class ControlController {

    public static final String OWNER_HEADER = "X-Owner-Id";

    @Autowired
    private Logger log;

    @Autowired
    private DeviceControlService control;

    @PostMapping
    public Map<String, Object> control(@RequestHeader(OWNER_HEADER) String ownerId, @Valid @RequestBody ControlRequest request) {
        final String topic = control.control(ownerId, request.deviceId(), request.switchNo(), request.status(), ownerId);
        return Map.of("success", true, "message", "Published successfully", "topic", topic);
    }

    @PostMapping("/slave-request")
    public CompletableFuture<Map<String, Object>> slaveRequest(@RequestHeader(OWNER_HEADER) String ownerId,
            @RequestBody Map<String, Object> request) {
        return control.slaveRequest(ownerId, request).thenApply(result -> {
            final Map<String, Object> body = new LinkedHashMap<>();
            body.put("success", true);
            body.put("message", result.isResponded() ? "Published and response received" : "Published, no response received");
            body.put("data", result.response().map(ControlController::slaveData).orElse(null));
            log.info("Slave request for {} {}.", request.get("deviceid"), result.isResponded() ? "answered" : "timed out");
            return body;
        });
    }

    @PostMapping("/reset")
    public Map<String, Object> reset(@RequestHeader(OWNER_HEADER) String ownerId, @Valid @RequestBody ResetRequest request) {
        final String topic = control.reset(ownerId, request.deviceId(), request.slaveNo(), request.slaveId());
        return Map.of("success", true, "message", "Published successfully", "topic", topic);
    }

    @GetMapping("/base/{deviceid}/responded")
    public CompletableFuture<ResponseEntity<Map<String, Object>>> isBaseResponded(@PathVariable("deviceid") String deviceId) {
        return control.isBaseResponded(deviceId)
            .thenApply(result -> responded(result, "Base responded successfully.", "Base is not responded."));
    }

    @GetMapping("/tank/{deviceid}/{sensorNumber}/responded")
    public CompletableFuture<ResponseEntity<Map<String, Object>>> isTankResponded(@PathVariable("deviceid") String deviceId,
            @PathVariable("sensorNumber") String sensorNumber) {
        return control.isTankResponded(deviceId, sensorNumber)
            .thenApply(result -> responded(result, "Tank responded successfully.", "Tank is not responded."));
    }

    /**
     * A timeout answers 404 with its own message, distinct from an unknown device.
     */
    private static ResponseEntity<Map<String, Object>> responded(CorrelationResult result, String yes, String no) {
        if (result.isResponded()) {
            return ResponseEntity.ok(Map.of("success", true, "message", yes));
        }
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("success", false, "message", no));
    }

    private static Map<String, Object> slaveData(ResponseRecord record) {
        final Map<String, Object> data = new LinkedHashMap<>(record.responseData());
        final Object channel = data.get("channel");
        if (channel instanceof String && NumberUtils.isDigits(((String) channel).trim())) {
            data.put("channel", NumberUtils.toInt(((String) channel).trim()));
        }
        return data;
    }
}
