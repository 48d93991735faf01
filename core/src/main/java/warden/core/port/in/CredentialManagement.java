package warden.core.port.in;

import java.util.List;
import java.util.Set;

import io.smallrye.mutiny.Uni;

import warden.core.model.credential.CredentialIssueResult;
import warden.core.model.credential.CredentialSummary;
import warden.core.model.credential.CredentialValidation;
import warden.core.model.credential.IssueCredentialRequest;

/**
 * Port for the API credential lifecycle.
 *
 * <p>Rejected credentials are reported as {@link CredentialValidation} values,
 * never as failures. Store failures fail the returned {@link Uni} with
 * {@link warden.spi.StorageUnavailableException}.
 */
public interface CredentialManagement {

    /**
     * Issue a new credential.
     *
     * <p>The plaintext secret is returned only once in the result.
     *
     * @param request issuance parameters
     * @return Uni with the secret and stored record; fails with
     *         {@link warden.core.model.credential.CredentialLimitExceededException}
     *         when the subject already holds the maximum number of active credentials
     */
    Uni<CredentialIssueResult> issue(IssueCredentialRequest request);

    /**
     * Validate a presented bearer secret.
     *
     * @param secret the plaintext secret (may be null)
     * @return Uni with the outcome
     */
    Uni<CredentialValidation> validate(String secret);

    /**
     * Validate a secret and check it against the caller's IP, required permissions
     * and the credential's request rate limit, in that order.
     *
     * <p>Only requests that pass the IP and permission checks count against the
     * rate limit. Usage is recorded when the credential is accepted.
     *
     * @param secret              the plaintext secret
     * @param clientIp            the caller's IP address
     * @param requiredPermissions permissions the credential must hold (empty = none)
     * @return Uni with the outcome
     */
    Uni<CredentialValidation> authorize(String secret, String clientIp, Set<String> requiredPermissions);

    /**
     * Record a successful use. Never fails.
     *
     * @param credentialId the credential
     * @return Uni completing when the usage was recorded or the failure logged
     */
    Uni<Void> recordUsage(String credentialId);

    /**
     * Revoke a credential owned by the given subject.
     *
     * @param credentialId the credential
     * @param subjectId    the subject requesting revocation
     * @return Uni with true if the credential exists and belongs to the subject
     */
    Uni<Boolean> revoke(String credentialId, String subjectId);

    /**
     * List a subject's credentials, oldest first.
     *
     * @param subjectId the subject
     * @return Uni with display views of every credential the subject owns
     */
    Uni<List<CredentialSummary>> listForSubject(String subjectId);

    /**
     * Delete credentials whose expiry has passed.
     *
     * @return Uni with the number of deleted credentials
     */
    Uni<Integer> sweepExpired();
}
