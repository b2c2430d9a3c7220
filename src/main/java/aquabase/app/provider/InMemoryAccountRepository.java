package aquabase.app.provider;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import aquabase.app.device.Account;

/**
 * Document store held in process memory. Accounts are kept serialized so that
 * callers never share mutable state with the store or with each other.
 */
public class InMemoryAccountRepository implements AccountRepository {

    private static Logger log = null;

    private final ObjectMapper mapper;
    private final Map<String, byte[]> documents;

    public InMemoryAccountRepository() {
        if (log == null) {
            log = LoggerFactory.getLogger(InMemoryAccountRepository.class);
        }
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        documents = new ConcurrentHashMap<>(100);
    }

    @Override
    public Optional<Account> findById(String ownerId) {
        if (ownerId == null) {
            return Optional.empty();
        }
        final byte[] document = documents.get(ownerId);
        if (document == null) {
            return Optional.empty();
        }
        return Optional.of(read(document));
    }

    @Override
    public Optional<Account> findByDeviceId(String deviceId) {
        if (deviceId == null) {
            return Optional.empty();
        }
        for (byte[] document : documents.values()) {
            final Account account = read(document);
            if (account.findDevice(deviceId).isPresent()) {
                return Optional.of(account);
            }
        }
        return Optional.empty();
    }

    @Override
    public List<String> ownerIds() {
        return new ArrayList<>(documents.keySet());
    }

    @Override
    public void save(Account account) {
        if (account.getOwnerId() == null) {
            throw new IllegalArgumentException("Cannot save an account without owner id.");
        }
        try {
            documents.put(account.getOwnerId(), mapper.writeValueAsBytes(account));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        log.debug("Saved account {}.", account.getOwnerId());
    }

    private Account read(byte[] document) {
        try {
            return mapper.readValue(document, Account.class);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
