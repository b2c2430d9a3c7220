package aquabase.app.device;

public enum DeviceType {
    BASE,
    TANK;

    public String wireName() {
        return name().toLowerCase();
    }

    public static DeviceType parse(String value) {
        if (value == null) {
            return null;
        }
        try {
            return DeviceType.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
