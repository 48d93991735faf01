package warden.core.model.credential;

import java.time.Instant;
import java.util.Set;

/**
 * A stored API credential.
 *
 * <p>The plaintext secret is never stored; only its SHA-256 hash is kept for
 * lookup. Records are immutable: usage recording and revocation produce copies.
 *
 * @param id          unique identifier used for revocation and usage tracking
 * @param userId      the owning subject
 * @param keyHash     SHA-256 hex digest of the full secret
 * @param keyPrefix   safe-to-display prefix (e.g. "ak_live_3f9a12bc...")
 * @param name        display name chosen by the owner
 * @param permissions scopes granted to the credential
 * @param ipAllowlist client IPs or CIDR ranges allowed to present it (empty = any)
 * @param rateLimit   requests allowed per rate-limit window
 * @param createdAt   when the credential was issued
 * @param expiresAt   when it expires (null = never)
 * @param lastUsedAt  last successful use (null = never used)
 * @param usageCount  number of recorded uses
 * @param active      false once revoked
 */
public record Credential(
        String id,
        String userId,
        String keyHash,
        String keyPrefix,
        String name,
        Set<String> permissions,
        Set<String> ipAllowlist,
        int rateLimit,
        Instant createdAt,
        Instant expiresAt,
        Instant lastUsedAt,
        long usageCount,
        boolean active) {

    public Credential {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Credential ID cannot be null or blank");
        }
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("Credential owner cannot be null or blank");
        }
        if (keyHash == null || keyHash.isBlank()) {
            throw new IllegalArgumentException("Credential hash cannot be null or blank");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("Credential creation time cannot be null");
        }
        if (name == null || name.isBlank()) {
            name = id;
        }
        permissions = permissions == null ? Set.of() : Set.copyOf(permissions);
        ipAllowlist = ipAllowlist == null ? Set.of() : Set.copyOf(ipAllowlist);
    }

    /**
     * Check whether the credential has expired.
     *
     * @param now the current time
     * @return true if an expiry is set and lies before {@code now}
     */
    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && expiresAt.isBefore(now);
    }

    /**
     * Check whether the credential can authenticate at the given time.
     *
     * @param now the current time
     * @return true if active and not expired
     */
    public boolean isUsableAt(Instant now) {
        return active && !isExpiredAt(now);
    }

    /**
     * Creates a revoked copy of this credential.
     *
     * @return a copy with {@code active=false}
     */
    public Credential revoke() {
        return new Credential(
                id, userId, keyHash, keyPrefix, name, permissions, ipAllowlist, rateLimit, createdAt, expiresAt,
                lastUsedAt, usageCount, false);
    }

    /**
     * Creates a copy with one more recorded use.
     *
     * @param usedAt time of use
     * @return a copy with incremented usage count and updated last-used time
     */
    public Credential recordUse(Instant usedAt) {
        return new Credential(
                id, userId, keyHash, keyPrefix, name, permissions, ipAllowlist, rateLimit, createdAt, expiresAt,
                usedAt, usageCount + 1, active);
    }

    /**
     * Return the display view of this credential, without the hash.
     *
     * @return the summary
     */
    public CredentialSummary toSummary() {
        return new CredentialSummary(
                id, userId, keyPrefix, name, permissions, ipAllowlist, rateLimit, createdAt, expiresAt, lastUsedAt,
                usageCount, active);
    }

    public static Builder builder(String id, String keyHash) {
        return new Builder(id, keyHash);
    }

    public static class Builder {
        private final String id;
        private final String keyHash;
        private String userId;
        private String keyPrefix;
        private String name;
        private Set<String> permissions = Set.of();
        private Set<String> ipAllowlist = Set.of();
        private int rateLimit;
        private Instant createdAt;
        private Instant expiresAt;
        private Instant lastUsedAt;
        private long usageCount;
        private boolean active = true;

        private Builder(String id, String keyHash) {
            this.id = id;
            this.keyHash = keyHash;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder keyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder permissions(Set<String> permissions) {
            this.permissions = permissions;
            return this;
        }

        public Builder ipAllowlist(Set<String> ipAllowlist) {
            this.ipAllowlist = ipAllowlist;
            return this;
        }

        public Builder rateLimit(int rateLimit) {
            this.rateLimit = rateLimit;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder expiresAt(Instant expiresAt) {
            this.expiresAt = expiresAt;
            return this;
        }

        public Builder lastUsedAt(Instant lastUsedAt) {
            this.lastUsedAt = lastUsedAt;
            return this;
        }

        public Builder usageCount(long usageCount) {
            this.usageCount = usageCount;
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public Credential build() {
            return new Credential(
                    id, userId, keyHash, keyPrefix, name, permissions, ipAllowlist, rateLimit, createdAt, expiresAt,
                    lastUsedAt, usageCount, active);
        }
    }
}
