package warden.core.model.credential;

import java.time.Instant;
import java.util.Set;

/**
 * Display view of a {@link Credential}. Carries no hash and no secret.
 *
 * @param id          credential identifier
 * @param userId      owning subject
 * @param keyPrefix   safe-to-display prefix
 * @param name        display name
 * @param permissions granted scopes
 * @param ipAllowlist allowed client IPs or CIDR ranges
 * @param rateLimit   requests per window
 * @param createdAt   issuance time
 * @param expiresAt   expiry (null = never)
 * @param lastUsedAt  last use (null = never)
 * @param usageCount  recorded uses
 * @param active      false once revoked
 */
public record CredentialSummary(
        String id,
        String userId,
        String keyPrefix,
        String name,
        Set<String> permissions,
        Set<String> ipAllowlist,
        int rateLimit,
        Instant createdAt,
        Instant expiresAt,
        Instant lastUsedAt,
        long usageCount,
        boolean active) {}
