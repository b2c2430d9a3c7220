package aquabase.app.device;

import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import aquabase.app.error.ConflictException;
import aquabase.app.error.DependencyException;
import aquabase.app.error.NotFoundException;
import aquabase.app.error.ValidationException;
import aquabase.app.provider.AccountRepository;

/**
 * Spaces and the devices in them. Every change reads the owner's account, applies
 * the change and saves the account back.
 */
public class TopologyService {

    private static Logger log = null;

    private final AccountRepository accounts;
    private final Clock clock;

    public TopologyService(AccountRepository accounts, Clock clock) {
        if (log == null) {
            log = LoggerFactory.getLogger(TopologyService.class);
        }
        this.accounts = accounts;
        this.clock = clock;
    }

    public Account requireAccount(String ownerId) {
        return accounts.findById(ownerId).orElseThrow(() -> NotFoundException.of("User", ownerId));
    }

    /**
     * Accounts are created on first use of an owner id.
     */
    public Account registerAccount(String ownerId, String mobileNumber) {
        final Optional<Account> existing = accounts.findById(ownerId);
        if (existing.isPresent()) {
            return existing.get();
        }
        final Account account = new Account(ownerId, mobileNumber);
        accounts.save(account);
        log.info("Registered account {}.", ownerId);
        return account;
    }

    public Space createSpace(String ownerId, String spaceName) {
        if (StringUtils.isBlank(spaceName)) {
            throw new ValidationException("space_name is required");
        }
        final Account account = requireAccount(ownerId);
        final boolean taken = account.getSpaces().stream().anyMatch(s -> spaceName.equals(s.getSpaceName()));
        if (taken) {
            throw new ConflictException(ConflictException.Reason.NAME_COLLISION,
                String.format("Space with name '%s' already exists for this user", spaceName));
        }
        final Space space = new Space(UUID.randomUUID().toString(), spaceName);
        account.getSpaces().add(space);
        accounts.save(account);
        log.info("Created space {} ({}) for {}.", spaceName, space.getSpaceId(), ownerId);
        return space;
    }

    public List<Device> listDevices(String ownerId, String spaceId) {
        return requireAccount(ownerId).requireSpace(spaceId).getDevices();
    }

    public Device getDevice(String ownerId, String spaceId, String deviceId) {
        return requireAccount(ownerId).requireSpace(spaceId).findDevice(deviceId)
            .orElseThrow(() -> NotFoundException.of("Device", deviceId));
    }

    /**
     * Provisions a base device.
     */
    public BaseDevice addDevice(String ownerId, String spaceId, BaseDevice device) {
        if (StringUtils.isBlank(device.getDeviceId())) {
            throw new ValidationException("device_id is required");
        }
        if (BaseDevice.CONNECTION_WIFI.equalsIgnoreCase(device.getConnectionType()) && StringUtils.isBlank(device.getSsid())) {
            throw new ValidationException("SSID and password are required for WiFi devices");
        }
        final Account account = requireAccount(ownerId);
        final Space space = account.requireSpace(spaceId);
        rejectRegistered(ownerId, device.getDeviceId());
        device.touch(clock.instant());
        space.addDevice(device);
        accounts.save(account);
        log.info("Added base device {} to space {} of {}.", device.getDeviceId(), spaceId, ownerId);
        return device;
    }

    /**
     * Attaches a tank sensor to a base switch, assigning the first free slave
     * slot. A null {@code switchNo} picks the first switch with room.
     */
    public TankDevice attachTank(String ownerId, String parentId, SwitchNo switchNo, TankDevice tank) {
        if (StringUtils.isBlank(tank.getDeviceId())) {
            throw new ValidationException("device_id is required");
        }
        final Account account = requireAccount(ownerId);
        final Space space = account.spaceOfDevice(parentId)
            .orElseThrow(() -> NotFoundException.of("Base device", parentId));
        final Device parent = space.requireDevice(parentId);
        if (!(parent instanceof BaseDevice)) {
            throw new ValidationException(String.format("Device '%s' is not a base device", parentId));
        }
        rejectRegistered(ownerId, tank.getDeviceId());
        final List<TankDevice> attached = space.tanksAttachedTo(parentId);
        final SwitchNo targetSwitch = switchNo != null ? switchNo : SlotAllocator.firstSwitchWithCapacity(countBySwitch(attached))
            .orElseThrow(() -> new ConflictException(ConflictException.Reason.SLOTS_FULL,
                String.format("All switches of base '%s' already have %d tanks", parentId, SlotAllocator.SLAVES_PER_SWITCH)));
        final Set<SlaveName> occupied = attached.stream()
            .filter(t -> t.getParentSwitchNo() == targetSwitch)
            .map(TankDevice::getSlaveName)
            .collect(Collectors.toSet());
        final long onSwitch = attached.stream().filter(t -> t.getParentSwitchNo() == targetSwitch).count();
        if (onSwitch >= SlotAllocator.SLAVES_PER_SWITCH) {
            throw new ConflictException(ConflictException.Reason.SLOTS_FULL,
                String.format("Switch %s of base '%s' already has %d tanks", targetSwitch, parentId, onSwitch));
        }
        final SlaveName slaveName = SlotAllocator.firstFreeSlave(occupied)
            .orElseThrow(() -> new ConflictException(ConflictException.Reason.SLOTS_FULL,
                String.format("No free slave slot on %s of base '%s'", targetSwitch, parentId)));
        tank.attachTo(parentId, targetSwitch, slaveName);
        tank.touch(clock.instant());
        space.addDevice(tank);
        accounts.save(account);
        log.info("Attached tank {} to {}/{} as {}.", tank.getDeviceId(), parentId, targetSwitch, slaveName);
        return tank;
    }

    /**
     * Removes a device. A base device with tanks still attached is refused.
     */
    public void detachDevice(String ownerId, String deviceId) {
        final Account account = requireAccount(ownerId);
        final Space space = account.spaceOfDevice(deviceId)
            .orElseThrow(() -> NotFoundException.of("Device", deviceId));
        final Device device = space.requireDevice(deviceId);
        if (device instanceof BaseDevice) {
            final List<TankDevice> dependents = space.tanksAttachedTo(deviceId);
            if (!dependents.isEmpty()) {
                throw new DependencyException(deviceId,
                    dependents.stream().map(Device::getDeviceId).collect(Collectors.toList()));
            }
        }
        space.removeDevice(deviceId);
        accounts.save(account);
        log.info("Removed device {} from space {} of {}.", deviceId, space.getSpaceId(), ownerId);
    }

    public String resolveTransportAddress(String deviceId) {
        return resolveTransportAddress(deviceId, null);
    }

    /**
     * Tanks resolve through the base they are attached to.
     */
    public String resolveTransportAddress(String deviceId, SwitchNo switchNo) {
        final Account account = accounts.findByDeviceId(deviceId)
            .orElseThrow(() -> NotFoundException.of("Device", deviceId));
        Device device = account.findDevice(deviceId).get();
        SwitchNo addressSwitch = switchNo;
        if (device instanceof TankDevice) {
            final TankDevice tank = (TankDevice) device;
            addressSwitch = tank.getParentSwitchNo();
            device = account.findDevice(tank.getParentDeviceId())
                .orElseThrow(() -> NotFoundException.of("Base device", tank.getParentDeviceId()));
        }
        final String thingName = ((BaseDevice) device).getThingName(addressSwitch);
        if (StringUtils.isBlank(thingName)) {
            throw new NotFoundException(String.format("No thing name registered for device '%s'", deviceId));
        }
        return thingName;
    }

    private void rejectRegistered(String ownerId, String deviceId) {
        accounts.findByDeviceId(deviceId).ifPresent(holder -> {
            throw ConflictException.duplicateDevice(deviceId, holder.getOwnerId().equals(ownerId));
        });
    }

    private static Map<SwitchNo, Integer> countBySwitch(List<TankDevice> attached) {
        final Map<SwitchNo, Integer> counts = new EnumMap<>(SwitchNo.class);
        attached.forEach(t -> counts.merge(t.getParentSwitchNo(), 1, Integer::sum));
        return counts;
    }
}
