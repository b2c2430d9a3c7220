package aquabase.app.message;

import java.util.Optional;

/**
 * Topic catalogue shared with the device firmware. Outbound topics carry commands
 * to a thing, inbound topics carry what the thing reports.
 */
public enum Topic {
    CONTROL("mqtt/device/", "/control", false),
    SETTING("mqtt/device/", "/setting", false),
    SLAVE_REQUEST("mqtt/device/", "/slave_request", false),
    RESET("mqtt/device/", "/reset", false),
    CONFIG("mqtt/device/", "/config", false),
    // poll requests go out on the same shadow topic the thing reports on
    POLL("$aws/things/", "/update", false),
    UPDATE("$aws/things/", "/update", true),
    ALIVE_REPLY("$aws/things/", "/alive_reply", true),
    HEALTH_REPLY("$aws/things/", "/health_reply", true),
    SLAVE_RESPONSE("$aws/things/", "/slave_response", true),
    OTA_VALIDATE("$aws/things/", "/ota/validate", true);

    private final String prefix;
    private final String suffix;
    private final boolean inbound;

    Topic(String prefix, String suffix, boolean inbound) {
        this.prefix = prefix;
        this.suffix = suffix;
        this.inbound = inbound;
    }

    public boolean isInbound() {
        return inbound;
    }

    public String forThing(String thingName) {
        if (thingName == null || thingName.isBlank()) {
            throw new IllegalArgumentException("Thing name is required to build a topic.");
        }
        return prefix + thingName + suffix;
    }

    /**
     * Subscription filter covering this topic for every thing.
     */
    public String filter() {
        return prefix + "+" + suffix;
    }

    /**
     * @return the inbound topic kind of a concrete topic name
     */
    public static Optional<Topic> matchInbound(String topic) {
        if (topic == null) {
            return Optional.empty();
        }
        for (Topic candidate : values()) {
            if (candidate.inbound && candidate.matches(topic)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    public boolean matches(String topic) {
        return topic.startsWith(prefix) && topic.endsWith(suffix) && topic.length() > prefix.length() + suffix.length();
    }

    public Optional<String> thingNameOf(String topic) {
        if (topic == null || !matches(topic)) {
            return Optional.empty();
        }
        return Optional.of(topic.substring(prefix.length(), topic.length() - suffix.length()));
    }
}
