package aquabase.app.device;

/**
 * A freshly received value for one device, as handed to rule evaluation.
 *
 * @param switchNo the switch the status belongs to, null for tanks
 * @param status   switch status for base devices, null for tanks
 * @param level    fill level for tank devices, null for base devices
 */
public record DeviceState(
    String deviceId,
    DeviceType deviceType,
    SwitchNo switchNo,
    SwitchStatus status,
    Double level) {

    public static DeviceState ofSwitch(String deviceId, SwitchNo switchNo, SwitchStatus status) {
        return new DeviceState(deviceId, DeviceType.BASE, switchNo, status, null);
    }

    public static DeviceState ofLevel(String deviceId, double level) {
        return new DeviceState(deviceId, DeviceType.TANK, null, null, Double.valueOf(level));
    }
}
