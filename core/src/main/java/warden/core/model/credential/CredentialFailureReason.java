package warden.core.model.credential;

/**
 * Why a presented credential was rejected.
 */
public enum CredentialFailureReason {
    /** No secret was supplied. */
    MISSING,
    /** No credential has the supplied secret's hash. */
    NOT_FOUND,
    /** The credential was revoked. */
    REVOKED,
    /** The credential's expiry has passed. */
    EXPIRED,
    /** The client IP is not on the credential's allowlist. */
    IP_NOT_ALLOWED,
    /** The credential lacks a required permission. */
    INSUFFICIENT_PERMISSIONS,
    /** The credential used up its requests for the current window. */
    RATE_LIMITED;

    /**
     * Return the lowercase code used in audit events and metrics.
     *
     * @return e.g. "not_found"
     */
    public String code() {
        return name().toLowerCase();
    }
}
