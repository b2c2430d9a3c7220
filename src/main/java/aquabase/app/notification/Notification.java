package aquabase.app.notification;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

public record Notification(
    @JsonProperty("type") NotificationType type,
    @JsonProperty("title") String title,
    @JsonProperty("message") String message,
    @JsonProperty("owner_id") String ownerId,
    @JsonProperty("data") Map<String, Object> data,
    @JsonProperty("timestamp") Instant timestamp) {

    public Notification {
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public static Notification of(NotificationType type, String ownerId, String message, Map<String, Object> data, Instant timestamp) {
        return new Notification(type, type.getTitle(), message, ownerId, data, timestamp);
    }
}
