package warden.core.model.credential;

import java.util.Optional;

/**
 * Outcome of presenting a bearer secret.
 *
 * <p>Rejections are ordinary values, never exceptions. A valid outcome carries
 * the stored record; the plaintext secret is never echoed.
 *
 * @param valid      true if the secret was accepted
 * @param credential the matched record (present when valid)
 * @param reason     why it was rejected (present when invalid)
 */
public record CredentialValidation(boolean valid, Optional<Credential> credential, Optional<CredentialFailureReason> reason) {

    public static CredentialValidation accepted(Credential credential) {
        return new CredentialValidation(true, Optional.of(credential), Optional.empty());
    }

    public static CredentialValidation rejected(CredentialFailureReason reason) {
        return new CredentialValidation(false, Optional.empty(), Optional.of(reason));
    }

    /**
     * Rejection that still identifies the matched record, for audit purposes.
     *
     * @param reason     why it was rejected
     * @param credential the record that was matched
     * @return the outcome
     */
    public static CredentialValidation rejected(CredentialFailureReason reason, Credential credential) {
        return new CredentialValidation(false, Optional.of(credential), Optional.of(reason));
    }

    /**
     * Return the rejection reason, or null if the secret was accepted.
     *
     * @return the reason or null
     */
    public CredentialFailureReason reasonOrNull() {
        return reason.orElse(null);
    }
}
