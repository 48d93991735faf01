package warden.core.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import warden.core.redaction.SanitizingLogger;

/**
 * Bounded in-memory map with per-entry expiry and least-recently-accessed eviction.
 *
 * <p>Entries are kept in access order: every read or write moves the key to the
 * most-recent end, so capacity eviction always removes the entry whose last
 * access is oldest, even when several accesses share the same clock reading.
 *
 * <p>All mutations are serialized on a single lock. The store is expected to be
 * small (tens to a few hundred thousand keys), so sweeps and eviction scan the
 * map while holding it. Removal listeners run after the lock is released.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public final class ExpiringStore<K, V> {

    private static final SanitizingLogger LOG = SanitizingLogger.getLogger(ExpiringStore.class);

    private final Clock clock;
    private final int capacity;
    private final Duration ttl;
    private final ExpirationPolicy policy;
    private final RemovalListener<K, V> listener;
    private final Map<K, StoreEntry<V>> entries = new LinkedHashMap<>();
    private final Object lock = new Object();

    /**
     * Create a store without a removal listener.
     *
     * @param clock    time source for expiry computations
     * @param capacity maximum number of entries (must be positive)
     * @param ttl      expiry window (must be positive)
     * @param policy   whether reads extend the expiry
     */
    public ExpiringStore(Clock clock, int capacity, Duration ttl, ExpirationPolicy policy) {
        this(clock, capacity, ttl, policy, (key, entry, cause) -> {});
    }

    /**
     * Create a store that reports removals to the given listener.
     *
     * @param clock    time source for expiry computations
     * @param capacity maximum number of entries (must be positive)
     * @param ttl      expiry window (must be positive)
     * @param policy   whether reads extend the expiry
     * @param listener notified after each removal
     */
    public ExpiringStore(
            Clock clock, int capacity, Duration ttl, ExpirationPolicy policy, RemovalListener<K, V> listener) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Capacity must be positive, got " + capacity);
        }
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("TTL must be positive, got " + ttl);
        }
        this.clock = clock;
        this.capacity = capacity;
        this.ttl = ttl;
        this.policy = policy;
        this.listener = listener;
    }

    /**
     * Store a value, replacing any previous value for the key.
     *
     * <p>If the key is new and the store is full, the least recently accessed
     * entry is evicted first.
     *
     * @param key   the key
     * @param value the value
     */
    public void put(K key, V value) {
        final var now = clock.instant();
        final var removed = new ArrayList<Removal<K, V>>(1);
        synchronized (lock) {
            final var previous = entries.remove(key);
            if (previous != null) {
                removed.add(new Removal<>(key, previous, RemovalCause.REPLACED));
            } else if (entries.size() >= capacity) {
                final var eldest = entries.entrySet().iterator().next();
                entries.remove(eldest.getKey());
                removed.add(new Removal<>(eldest.getKey(), eldest.getValue(), RemovalCause.SIZE));
            }
            entries.put(key, new StoreEntry<>(value, now, now, now.plus(ttl)));
        }
        notifyRemovals(removed);
    }

    /**
     * Read a live value and record the access.
     *
     * <p>An entry whose expiry has passed is removed and reported as absent.
     *
     * @param key the key
     * @return the value, or empty if absent or expired
     */
    public Optional<V> get(K key) {
        final var now = clock.instant();
        Removal<K, V> expired = null;
        V value = null;
        synchronized (lock) {
            final var entry = entries.get(key);
            if (entry != null) {
                entries.remove(key);
                if (entry.isExpiredAt(now)) {
                    expired = new Removal<>(key, entry, RemovalCause.EXPIRED);
                } else {
                    entries.put(key, entry.touched(now, policy, ttl));
                    value = entry.value();
                }
            }
        }
        if (expired != null) {
            notifyRemovals(List.of(expired));
        }
        return Optional.ofNullable(value);
    }

    /**
     * Read an entry without recording an access and without expiring it.
     *
     * @param key the key
     * @return the entry snapshot, which may already be expired
     */
    public Optional<StoreEntry<V>> peek(K key) {
        synchronized (lock) {
            return Optional.ofNullable(entries.get(key));
        }
    }

    /**
     * Remove the entry for the key if its expiry has passed.
     *
     * @param key the key
     * @return true if an expired entry was removed
     */
    public boolean expireIfStale(K key) {
        final var now = clock.instant();
        StoreEntry<V> entry;
        synchronized (lock) {
            entry = entries.get(key);
            if (entry == null || !entry.isExpiredAt(now)) {
                return false;
            }
            entries.remove(key);
        }
        notifyRemovals(List.of(new Removal<>(key, entry, RemovalCause.EXPIRED)));
        return true;
    }

    /**
     * Remove the entry for the key.
     *
     * @param key the key
     * @return the removed value, or empty if absent
     */
    public Optional<V> remove(K key) {
        StoreEntry<V> entry;
        synchronized (lock) {
            entry = entries.remove(key);
        }
        if (entry == null) {
            return Optional.empty();
        }
        notifyRemovals(List.of(new Removal<>(key, entry, RemovalCause.EXPLICIT)));
        return Optional.of(entry.value());
    }

    /**
     * Remove every entry.
     *
     * @return the number of entries removed
     */
    public int clear() {
        final var removed = new ArrayList<Removal<K, V>>();
        synchronized (lock) {
            entries.forEach((key, entry) -> removed.add(new Removal<>(key, entry, RemovalCause.EXPLICIT)));
            entries.clear();
        }
        notifyRemovals(removed);
        return removed.size();
    }

    /**
     * Remove every entry whose expiry has passed.
     *
     * <p>Idempotent: a second sweep at the same instant removes nothing.
     *
     * @return the keys that were removed
     */
    public List<K> sweepExpired() {
        final var now = clock.instant();
        final var removed = new ArrayList<Removal<K, V>>();
        synchronized (lock) {
            final var iterator = entries.entrySet().iterator();
            while (iterator.hasNext()) {
                final var entry = iterator.next();
                if (entry.getValue().isExpiredAt(now)) {
                    iterator.remove();
                    removed.add(new Removal<>(entry.getKey(), entry.getValue(), RemovalCause.EXPIRED));
                }
            }
        }
        notifyRemovals(removed);
        return removed.stream().map(Removal::key).toList();
    }

    /**
     * Return the keys in access order, least recently accessed first.
     *
     * @return snapshot of the current keys
     */
    public List<K> keys() {
        synchronized (lock) {
            return List.copyOf(entries.keySet());
        }
    }

    /**
     * Return the last access time of the least recently accessed entry.
     *
     * @return the oldest access instant, or empty if the store is empty
     */
    public Optional<Instant> oldestAccess() {
        synchronized (lock) {
            if (entries.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(entries.values().iterator().next().lastAccessedAt());
        }
    }

    public int size() {
        synchronized (lock) {
            return entries.size();
        }
    }

    public int capacity() {
        return capacity;
    }

    public Duration ttl() {
        return ttl;
    }

    private void notifyRemovals(List<Removal<K, V>> removals) {
        for (final var removal : removals) {
            try {
                listener.onRemoval(removal.key(), removal.entry(), removal.cause());
            } catch (RuntimeException e) {
                LOG.warnf(e, "Removal listener failed for cause %s", removal.cause());
            }
        }
    }

    private record Removal<K, V>(K key, StoreEntry<V> entry, RemovalCause cause) {}
}
