package aquabase.app.notification;

public enum NotificationType {
    SETUP_ACTION("Automated Action"),
    TANK_LEVEL_CHANGE("Tank Level Changed"),
    BASE_STATUS_CHANGE("Base Device Status Changed"),
    DEVICE_ONLINE("Device Online"),
    DEVICE_OFFLINE("Device Offline"),
    TANK_CONNECTED("Tank Device Connected");

    private final String title;

    NotificationType(String title) {
        this.title = title;
    }

    public String getTitle() {
        return title;
    }
}
