package aquabase.app.provider;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import aquabase.app.Fixtures;
import aquabase.app.device.Account;
import aquabase.app.device.BaseDevice;
import aquabase.app.device.SlaveName;
import aquabase.app.device.SwitchNo;
import aquabase.app.device.SwitchStatus;
import aquabase.app.device.TankDevice;

class InMemoryAccountRepositoryTest {

    private InMemoryAccountRepository repository;

    @BeforeEach
    void setUp() {
        repository = new InMemoryAccountRepository();
        Fixtures.seed(repository);
    }

    @Test
    void testReadsAreCopies() {
        final Account first = repository.findById(Fixtures.OWNER).get();
        ((BaseDevice) first.findDevice(Fixtures.BASE).get()).setStatus(SwitchNo.BM1, SwitchStatus.ON);

        assertEquals(SwitchStatus.OFF, Fixtures.base(repository).getStatus(SwitchNo.BM1));
        repository.save(first);
        assertEquals(SwitchStatus.ON, Fixtures.base(repository).getStatus(SwitchNo.BM1));
    }

    @Test
    void testDocumentKeepsDeviceTypes() {
        final Account account = repository.findByDeviceId(Fixtures.TANK).get();
        assertEquals(Fixtures.OWNER, account.getOwnerId());
        final TankDevice tank = assertInstanceOf(TankDevice.class, account.findDevice(Fixtures.TANK).get());
        assertEquals(SlaveName.TM1, tank.getSlaveName());
        assertEquals(Fixtures.BASE, tank.getParentDeviceId());
        assertEquals(50d, tank.getLevel());
        assertInstanceOf(BaseDevice.class, account.findDevice(Fixtures.BASE).get());
    }

    @Test
    void testLookupsAndOwners() {
        assertTrue(repository.findById("nobody").isEmpty());
        assertTrue(repository.findById(null).isEmpty());
        assertTrue(repository.findByDeviceId("B9").isEmpty());
        assertEquals(List.of(Fixtures.OWNER), repository.ownerIds());
        assertThrows(IllegalArgumentException.class, () -> repository.save(new Account(null, null)));
    }
}
