package warden.core.service.credential;

import java.security.SecureRandom;
import java.util.Base64;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import warden.core.config.CredentialConfig;
import warden.core.model.credential.IssuedSecret;
import warden.core.util.SecureHash;

/**
 * Generates bearer secrets and derives their storage hash.
 *
 * <p>Secrets have the form {@code <scopePrefix>_<base64url of 32 random bytes>}.
 * Only the SHA-256 digest of the full text is ever persisted.
 */
@ApplicationScoped
public class SecretHasher {

    static final int SECRET_LENGTH_BYTES = 32;
    static final int DISPLAY_HASH_CHARS = 8;
    private static final String KEY_FAMILY = "ak";

    private final SecureRandom secureRandom;
    private final String defaultScopePrefix;

    @Inject
    public SecretHasher(CredentialConfig config) {
        this(new SecureRandom(), config.environmentTag());
    }

    public SecretHasher(SecureRandom secureRandom, String environmentTag) {
        if (environmentTag == null || environmentTag.isBlank()) {
            throw new IllegalArgumentException("Environment tag cannot be null or blank");
        }
        this.secureRandom = secureRandom;
        this.defaultScopePrefix = KEY_FAMILY + "_" + environmentTag;
    }

    /**
     * Generate a secret with the configured scope prefix ({@code ak_<environment>}).
     *
     * @return the issued secret
     */
    public IssuedSecret issue() {
        return issue(defaultScopePrefix);
    }

    /**
     * Generate a secret with an explicit scope prefix.
     *
     * @param scopePrefix prefix such as {@code ak_live}
     * @return the issued secret
     */
    public IssuedSecret issue(String scopePrefix) {
        final var bytes = new byte[SECRET_LENGTH_BYTES];
        secureRandom.nextBytes(bytes);
        final var plaintext = scopePrefix + "_" + Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
        final var hash = SecureHash.sha256Hex(plaintext);
        return new IssuedSecret(plaintext, hash, displayPrefix(scopePrefix, hash));
    }

    /**
     * Recompute the storage hash of a candidate secret.
     *
     * @param candidate the presented secret
     * @return 64-character hex SHA-256 digest
     */
    public String verify(String candidate) {
        return SecureHash.sha256Hex(candidate);
    }

    public String defaultScopePrefix() {
        return defaultScopePrefix;
    }

    static String displayPrefix(String scopePrefix, String hash) {
        return scopePrefix + "_" + hash.substring(0, DISPLAY_HASH_CHARS) + "...";
    }
}
