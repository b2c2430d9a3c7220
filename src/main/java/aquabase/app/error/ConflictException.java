package aquabase.app.error;

/**
 * Raised when a registration would break a uniqueness or capacity invariant.
 */
public class ConflictException extends AutomationException {

    public enum Reason {
        DUPLICATE_DEVICE,
        SLOTS_FULL,
        NAME_COLLISION
    }

    /**
     * Who already holds the conflicting resource, for caller messaging.
     */
    public enum Ownership {
        SAME_OWNER,
        OTHER_OWNER,
        NOT_APPLICABLE
    }

    private final Reason reason;
    private final Ownership ownership;

    public ConflictException(Reason reason, Ownership ownership, String message) {
        super(Kind.CONFLICT, message);
        this.reason = reason;
        this.ownership = ownership;
    }

    public ConflictException(Reason reason, String message) {
        this(reason, Ownership.NOT_APPLICABLE, message);
    }

    public static ConflictException duplicateDevice(String deviceId, boolean sameOwner) {
        if (sameOwner) {
            return new ConflictException(Reason.DUPLICATE_DEVICE, Ownership.SAME_OWNER,
                String.format("Device '%s' is already registered to your account", deviceId));
        }
        return new ConflictException(Reason.DUPLICATE_DEVICE, Ownership.OTHER_OWNER,
            String.format("Device '%s' is already registered to another account", deviceId));
    }

    public Reason getReason() {
        return reason;
    }

    public Ownership getOwnership() {
        return ownership;
    }
}
