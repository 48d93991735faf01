package warden.core.port.in;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import warden.core.model.session.VaultStatus;

/**
 * Port for the bounded, inactivity-expiring session vault.
 */
public interface SecureSessionStorage {

    /**
     * Store a payload under a thread id.
     *
     * <p>A new id stored at capacity evicts the least recently accessed record.
     *
     * @param threadId the key
     * @param payload  the payload; sensitive fields are redacted before storage
     */
    void put(String threadId, Map<String, Object> payload);

    /**
     * Read a payload and refresh its last-access time.
     *
     * @param threadId the key
     * @return the payload, or empty if absent or inactive for longer than the expiration window
     */
    Optional<Map<String, Object>> get(String threadId);

    /**
     * Remove a record.
     *
     * @param threadId the key
     * @return true if a record was removed
     */
    boolean delete(String threadId);

    /**
     * Remove every record.
     *
     * @return number of removed records
     */
    int clearAll();

    List<String> threadIds();

    /**
     * Remove records inactive for longer than the expiration window.
     *
     * @return number of removed records
     */
    int sweepExpired();

    VaultStatus status();
}
