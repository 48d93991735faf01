package warden.core.port.out;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import warden.core.model.credential.Credential;

/**
 * Port interface for credential persistence.
 *
 * <p>Implementations store only hashed secrets, never plaintext.
 */
public interface CredentialRepository {

    /**
     * Insert a credential unless its owner already holds {@code maxActive}
     * active credentials.
     *
     * <p>The count and the insert form one atomic unit per subject: concurrent
     * calls for the same subject never leave more than {@code maxActive}
     * active credentials.
     *
     * @param credential the credential to insert
     * @param maxActive  the per-subject cap on active credentials
     * @param now        the time used to decide whether existing credentials are still active
     * @return true if inserted, false if the cap was reached
     */
    Uni<Boolean> insertIfBelowLimit(Credential credential, int maxActive, Instant now);

    /**
     * Find a credential by the hash of its secret.
     *
     * @param keyHash SHA-256 hex digest
     * @return the credential if present
     */
    Uni<Optional<Credential>> findByHash(String keyHash);

    Uni<Optional<Credential>> findById(String credentialId);

    /**
     * Return every credential (active or not) owned by a subject.
     *
     * @param userId the subject
     * @return the credentials in no particular order
     */
    Uni<List<Credential>> findByUserId(String userId);

    /**
     * Increment the usage counter and set the last-used time.
     *
     * @param credentialId the credential
     * @param usedAt       time of use
     * @return true if the credential exists
     */
    Uni<Boolean> recordUsage(String credentialId, Instant usedAt);

    /**
     * Mark a credential inactive.
     *
     * @param credentialId the credential
     * @return the credential as it was before the update, if it exists
     */
    Uni<Optional<Credential>> deactivate(String credentialId);

    /**
     * Delete every credential whose expiry lies before {@code now}.
     *
     * @param now the current time
     * @return number of deleted credentials
     */
    Uni<Integer> deleteExpired(Instant now);
}
