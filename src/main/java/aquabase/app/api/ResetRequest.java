package aquabase.app.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.NotBlank;

public record ResetRequest(
    @JsonProperty("deviceid") @NotBlank String deviceId,
    @JsonProperty("slave_no") @NotBlank String slaveNo,
    @JsonProperty("slaveid") @NotBlank String slaveId) { }
