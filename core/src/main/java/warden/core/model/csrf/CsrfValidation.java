package warden.core.model.csrf;

import java.util.Optional;

/**
 * Outcome of a CSRF token check.
 *
 * @param valid  true if the token matched the subject's live token
 * @param reason why it was rejected (present when invalid)
 */
public record CsrfValidation(boolean valid, Optional<CsrfFailureReason> reason) {

    private static final CsrfValidation VALID = new CsrfValidation(true, Optional.empty());

    public static CsrfValidation accepted() {
        return VALID;
    }

    public static CsrfValidation rejected(CsrfFailureReason reason) {
        return new CsrfValidation(false, Optional.of(reason));
    }

    public CsrfFailureReason reasonOrNull() {
        return reason.orElse(null);
    }
}
