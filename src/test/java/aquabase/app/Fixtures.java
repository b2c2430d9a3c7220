package aquabase.app;

import aquabase.app.device.Account;
import aquabase.app.device.BaseDevice;
import aquabase.app.device.SlaveName;
import aquabase.app.device.Space;
import aquabase.app.device.SwitchNo;
import aquabase.app.device.SwitchStatus;
import aquabase.app.device.TankDevice;
import aquabase.app.provider.AccountRepository;

/**
 * One owner with one space holding base B1 and tank T1 on B1/BM1 as TM1.
 */
public final class Fixtures {

    public static final String OWNER = "owner-1";
    public static final String OTHER_OWNER = "owner-2";
    public static final String SPACE = "space-1";
    public static final String SPACE_NAME = "Home";
    public static final String BASE = "B1";
    public static final String BASE_THING = "thing-b1";
    public static final String TANK = "T1";

    private Fixtures() { }

    public static Account account() {
        final Account account = new Account(OWNER, "+15550100");
        final Space space = new Space(SPACE, SPACE_NAME);
        final BaseDevice base = new BaseDevice(BASE, "Pump", BASE_THING);
        base.setStatus(SwitchNo.BM1, SwitchStatus.OFF);
        base.setStatus(SwitchNo.BM2, SwitchStatus.OFF);
        space.addDevice(base);
        final TankDevice tank = new TankDevice(TANK, "Roof tank");
        tank.attachTo(BASE, SwitchNo.BM1, SlaveName.TM1);
        tank.setLevel(50d);
        space.addDevice(tank);
        account.getSpaces().add(space);
        return account;
    }

    public static Account seed(AccountRepository repository) {
        final Account account = account();
        repository.save(account);
        return account;
    }

    public static BaseDevice base(AccountRepository repository) {
        return (BaseDevice) repository.findById(OWNER).get().findDevice(BASE).get();
    }

    public static TankDevice tank(AccountRepository repository) {
        return (TankDevice) repository.findById(OWNER).get().findDevice(TANK).get();
    }
}
