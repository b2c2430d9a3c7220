package aquabase.app.provider;

import java.util.List;
import java.util.Optional;

import aquabase.app.device.Account;

/**
 * Persistence of account documents. Every read hands out a private copy; a change
 * is only visible to others once it is saved back.
 */
public interface AccountRepository {

    Optional<Account> findById(String ownerId);

    /**
     * @return the account holding the device in any of its spaces
     */
    Optional<Account> findByDeviceId(String deviceId);

    List<String> ownerIds();

    void save(Account account);
}
