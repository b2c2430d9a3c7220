package aquabase.app.device;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * First-available slot assignment over an occupancy set. Holds no state.
 */
public final class SlotAllocator {

    public static final int SLAVES_PER_SWITCH = SlaveName.values().length;

    private SlotAllocator() { }

    public static Optional<SlaveName> firstFreeSlave(Collection<SlaveName> occupied) {
        if (occupied.size() >= SLAVES_PER_SWITCH) {
            return Optional.empty();
        }
        for (SlaveName candidate : SlaveName.values()) {
            if (!occupied.contains(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * @param attachedCount number of tanks already attached per switch; missing
     *                      switches count as empty
     */
    public static Optional<SwitchNo> firstSwitchWithCapacity(Map<SwitchNo, Integer> attachedCount) {
        for (SwitchNo candidate : SwitchNo.values()) {
            final Integer count = attachedCount.get(candidate);
            if (count == null || count.intValue() < SLAVES_PER_SWITCH) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
