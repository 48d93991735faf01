package warden.spi;

import java.time.Instant;

/**
 * Sealed interface representing security-relevant outcomes of the trust boundary.
 *
 * <p>Events are delivered to registered {@link AuditEventHandler} implementations.
 * No event carries a plaintext secret: credentials are identified by id, or by
 * an 8-character hash prefix when no record was matched.
 *
 * <p>Event types:
 * <ul>
 *   <li>{@link CredentialIssued} - {@code credential.issued}</li>
 *   <li>{@link CredentialRevoked} - {@code credential.revoked}</li>
 *   <li>{@link CredentialValidationFailed} - {@code credential.validation_failed}</li>
 *   <li>{@link CredentialsExpiredSwept} - {@code credential.expired_swept}</li>
 *   <li>{@link CsrfValidationFailed} - {@code csrf.validation_failed}</li>
 *   <li>{@link SessionExpired} - {@code session.expired}</li>
 *   <li>{@link SessionEvicted} - {@code session.evicted}</li>
 *   <li>{@link SessionCleared} - {@code session.cleared}</li>
 * </ul>
 */
public sealed interface AuditEvent {

    String SUCCESS = "success";
    String FAILURE = "failure";

    /**
     * Return the dotted event type, e.g. {@code credential.issued}.
     *
     * @return event type
     */
    String type();

    Instant timestamp();

    /**
     * Return the subject the event concerns.
     *
     * @return subject id, or null when unknown
     */
    String subjectId();

    /**
     * Return the identifier of the affected resource.
     *
     * @return credential id, hash prefix, thread id or vault id
     */
    String resourceId();

    /**
     * Return the outcome, {@link #SUCCESS} or {@link #FAILURE}.
     *
     * @return outcome
     */
    String outcome();

    /**
     * A credential was issued.
     *
     * @param timestamp    issuance time
     * @param subjectId    owning subject
     * @param credentialId the new credential
     * @param keyPrefix    display prefix of the secret
     */
    record CredentialIssued(Instant timestamp, String subjectId, String credentialId, String keyPrefix)
            implements AuditEvent {

        @Override
        public String type() {
            return "credential.issued";
        }

        @Override
        public String resourceId() {
            return credentialId;
        }

        @Override
        public String outcome() {
            return SUCCESS;
        }
    }

    /**
     * A credential moved from active to revoked.
     */
    record CredentialRevoked(Instant timestamp, String subjectId, String credentialId) implements AuditEvent {

        @Override
        public String type() {
            return "credential.revoked";
        }

        @Override
        public String resourceId() {
            return credentialId;
        }

        @Override
        public String outcome() {
            return SUCCESS;
        }
    }

    /**
     * A presented credential was rejected.
     *
     * @param timestamp  when the rejection happened
     * @param subjectId  owner of the matched credential, or null when none matched
     * @param resourceId matched credential id, or the 8-character hash prefix
     * @param reason     lowercase failure code (e.g. "expired")
     */
    record CredentialValidationFailed(Instant timestamp, String subjectId, String resourceId, String reason)
            implements AuditEvent {

        @Override
        public String type() {
            return "credential.validation_failed";
        }

        @Override
        public String outcome() {
            return FAILURE;
        }
    }

    /**
     * The expiry sweep deleted credentials.
     *
     * @param timestamp sweep time
     * @param count     number of deleted records
     */
    record CredentialsExpiredSwept(Instant timestamp, int count) implements AuditEvent {

        @Override
        public String type() {
            return "credential.expired_swept";
        }

        @Override
        public String subjectId() {
            return null;
        }

        @Override
        public String resourceId() {
            return "credentials";
        }

        @Override
        public String outcome() {
            return SUCCESS;
        }
    }

    /**
     * A CSRF token was rejected.
     */
    record CsrfValidationFailed(Instant timestamp, String subjectId, String reason) implements AuditEvent {

        @Override
        public String type() {
            return "csrf.validation_failed";
        }

        @Override
        public String resourceId() {
            return subjectId;
        }

        @Override
        public String outcome() {
            return FAILURE;
        }
    }

    /**
     * A session record exceeded its inactivity window and was removed.
     */
    record SessionExpired(Instant timestamp, String threadId) implements AuditEvent {

        @Override
        public String type() {
            return "session.expired";
        }

        @Override
        public String subjectId() {
            return null;
        }

        @Override
        public String resourceId() {
            return threadId;
        }

        @Override
        public String outcome() {
            return SUCCESS;
        }
    }

    /**
     * A session record was evicted to make room for a new one.
     */
    record SessionEvicted(Instant timestamp, String threadId) implements AuditEvent {

        @Override
        public String type() {
            return "session.evicted";
        }

        @Override
        public String subjectId() {
            return null;
        }

        @Override
        public String resourceId() {
            return threadId;
        }

        @Override
        public String outcome() {
            return SUCCESS;
        }
    }

    /**
     * The session vault was emptied.
     *
     * @param timestamp when the vault was cleared
     * @param vaultId   the vault instance
     * @param count     number of removed records
     */
    record SessionCleared(Instant timestamp, String vaultId, int count) implements AuditEvent {

        @Override
        public String type() {
            return "session.cleared";
        }

        @Override
        public String subjectId() {
            return null;
        }

        @Override
        public String resourceId() {
            return vaultId;
        }

        @Override
        public String outcome() {
            return SUCCESS;
        }
    }
}
