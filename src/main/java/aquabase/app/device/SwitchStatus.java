package aquabase.app.device;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;

public enum SwitchStatus {
    ON,
    OFF;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    public boolean isOn() {
        return this == ON;
    }

    public static SwitchStatus of(boolean on) {
        return on ? ON : OFF;
    }

    /**
     * Lenient parse of "on"/"off", "1"/"0" and "true"/"false". Returns null for
     * anything else.
     */
    @JsonCreator
    public static SwitchStatus parse(String value) {
        if (value == null) {
            return null;
        }
        switch (value.trim().toLowerCase()) {
            case "on":
            case "1":
            case "true":
                return ON;
            case "off":
            case "0":
            case "false":
                return OFF;
            default:
                return null;
        }
    }

    public static SwitchStatus parse(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isBoolean()) {
            return of(node.booleanValue());
        }
        return parse(node.asText());
    }
}
