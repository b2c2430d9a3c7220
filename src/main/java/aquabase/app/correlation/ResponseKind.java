package aquabase.app.correlation;

/**
 * Kind of a stored device response, as tagged by {@code response_type}.
 */
public enum ResponseKind {
    SLAVE_RESPONSE("slave_response", true),
    ALIVE_REPLY("alive_reply", false),
    UPDATE("update", false),
    HEALTH_REPLY("health_reply", false);

    private final String wireName;
    private final boolean keyedByThing;

    ResponseKind(String wireName, boolean keyedByThing) {
        this.wireName = wireName;
        this.keyedByThing = keyedByThing;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Slave responses are correlated by thing id, everything else by device id.
     */
    public String identityOf(ResponseRecord record) {
        if (keyedByThing) {
            return record.thingId();
        }
        return record.deviceId();
    }
}
