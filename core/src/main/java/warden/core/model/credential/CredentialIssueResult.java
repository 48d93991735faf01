package warden.core.model.credential;

/**
 * Result of issuing a new credential.
 *
 * <p>This is the only time the plaintext secret is available. After issuance,
 * only the hash is stored and the secret cannot be retrieved.
 *
 * @param plaintextSecret the bearer secret (only returned once!)
 * @param credential      the stored record
 */
public record CredentialIssueResult(String plaintextSecret, Credential credential) {

    public CredentialIssueResult {
        if (plaintextSecret == null || plaintextSecret.isBlank()) {
            throw new IllegalArgumentException("Plaintext secret cannot be null or blank");
        }
        if (credential == null) {
            throw new IllegalArgumentException("Credential cannot be null");
        }
    }

    @Override
    public String toString() {
        return "CredentialIssueResult[credentialId=" + credential.id() + ", keyPrefix=" + credential.keyPrefix() + "]";
    }
}
