package warden.core.model.credential;

import java.util.Set;

/**
 * Parameters for issuing a credential.
 *
 * @param userId      the subject the credential belongs to
 * @param name        display name
 * @param permissions scopes to grant
 * @param ipAllowlist client IPs or CIDR ranges (null or empty = any)
 * @param rateLimit   requests per window (null = configured default)
 * @param expiresIn   expiry policy
 */
public record IssueCredentialRequest(
        String userId,
        String name,
        Set<String> permissions,
        Set<String> ipAllowlist,
        Integer rateLimit,
        ExpiryPolicy expiresIn) {

    public IssueCredentialRequest {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("Subject cannot be null or blank");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Credential name cannot be null or blank");
        }
        permissions = permissions == null ? Set.of() : Set.copyOf(permissions);
        ipAllowlist = ipAllowlist == null ? Set.of() : Set.copyOf(ipAllowlist);
        if (expiresIn == null) {
            expiresIn = ExpiryPolicy.NEVER;
        }
    }

    /**
     * Convenience factory for a request with default allowlist and rate limit.
     *
     * @param userId      the subject
     * @param name        display name
     * @param permissions scopes to grant
     * @param expiresIn   expiry code ("never", "7d", "30d", "90d", "1y")
     * @return the request
     */
    public static IssueCredentialRequest of(String userId, String name, Set<String> permissions, String expiresIn) {
        return new IssueCredentialRequest(userId, name, permissions, Set.of(), null, ExpiryPolicy.fromCode(expiresIn));
    }
}
