package aquabase.app.api;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import aquabase.app.control.DeviceControlService;
import aquabase.app.correlation.ResponseRecord;
import aquabase.app.error.NotFoundException;

@RestController
@RequestMapping("/api/tank-data")
public class TankDataController {

    @Autowired
    private Logger log;

    @Autowired
    private DeviceControlService control;

    @GetMapping("/latest/{deviceid}/{sensorNumber}")
    public Map<String, Object> latest(@RequestHeader(ControlController.OWNER_HEADER) String ownerId,
            @PathVariable("deviceid") String deviceId, @PathVariable("sensorNumber") String sensorNumber) {
        final ResponseRecord reading = control.latestReading(ownerId, deviceId, sensorNumber)
            .orElseThrow(() -> new NotFoundException("No data found for the given sensor."));
        log.debug("Latest reading for {}/{} is from {}.", deviceId, sensorNumber, reading.insertedAt());
        return Map.of("success", true, "data", List.of(reading(reading)));
    }

    private static Map<String, Object> reading(ResponseRecord record) {
        final Map<String, Object> raw = record.responseData();
        final Object level = raw.get("level");
        final Map<String, Object> data = new LinkedHashMap<>();
        data.put("deviceid", record.deviceId());
        data.put("sensor_no", record.sensorNo());
        data.put("switch_no", raw.get("switch_no"));
        data.put("level", level);
        data.put("value", raw.get("value") != null ? raw.get("value") : level);
        data.put("status", raw.get("status"));
        data.put("message_type", record.kind().wireName());
        data.put("timestamp", record.insertedAt().toString());
        data.put("thingid", record.thingId());
        return data;
    }
}
