package aquabase.app.device;

/**
 * Slave slot of a tank sensor on one base switch.
 */
public enum SlaveName {
    TM1,
    TM2;

    public static SlaveName parse(String value) {
        if (value == null) {
            return null;
        }
        try {
            return SlaveName.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
