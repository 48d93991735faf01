package warden.core.model.csrf;

/**
 * Why a CSRF token was rejected.
 */
public enum CsrfFailureReason {
    MISSING,
    NOT_FOUND,
    MISMATCH,
    EXPIRED;

    public String code() {
        return name().toLowerCase();
    }
}
