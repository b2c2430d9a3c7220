package aquabase.app.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import aquabase.app.device.SwitchNo;
import aquabase.app.device.SwitchStatus;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record ControlRequest(
    @JsonProperty("deviceid") @NotBlank String deviceId,
    @JsonProperty("switch_no") @NotNull SwitchNo switchNo,
    @JsonProperty("status") @NotNull SwitchStatus status) { }
