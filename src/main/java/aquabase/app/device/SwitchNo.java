package aquabase.app.device;

/**
 * The two independently switchable outputs of a base device.
 */
public enum SwitchNo {
    BM1,
    BM2;

    public static SwitchNo parse(String value) {
        if (value == null) {
            return null;
        }
        try {
            return SwitchNo.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
