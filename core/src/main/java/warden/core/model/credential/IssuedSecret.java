package warden.core.model.credential;

/**
 * A freshly generated bearer secret.
 *
 * <p>{@code plaintext} must be handed to the caller once and then discarded;
 * only {@code hash} and {@code displayPrefix} are persisted.
 *
 * @param plaintext     the full secret, e.g. "ak_test_Q2x..."
 * @param hash          SHA-256 hex digest of {@code plaintext}
 * @param displayPrefix recognizable but non-reversible prefix
 */
public record IssuedSecret(String plaintext, String hash, String displayPrefix) {

    @Override
    public String toString() {
        return "IssuedSecret[displayPrefix=" + displayPrefix + "]";
    }
}
