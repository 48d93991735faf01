package warden.core.cache;

import java.time.Duration;
import java.time.Instant;

/**
 * Immutable snapshot of a value held by an {@link ExpiringStore}.
 *
 * @param value          the stored value
 * @param createdAt      when the value was written
 * @param lastAccessedAt last read or write of the key
 * @param expiresAt      instant after which the entry is expired
 * @param <V>            the value type
 */
public record StoreEntry<V>(V value, Instant createdAt, Instant lastAccessedAt, Instant expiresAt) {

    /**
     * Check whether the entry has expired.
     *
     * <p>An entry is still live at exactly {@code expiresAt}.
     *
     * @param now the current time
     * @return true if {@code now} is after {@code expiresAt}
     */
    public boolean isExpiredAt(Instant now) {
        return now.isAfter(expiresAt);
    }

    StoreEntry<V> touched(Instant now, ExpirationPolicy policy, Duration ttl) {
        final var newExpiry = policy == ExpirationPolicy.AFTER_ACCESS ? now.plus(ttl) : expiresAt;
        return new StoreEntry<>(value, createdAt, now, newExpiry);
    }
}
