package warden.core.cache;

/**
 * Callback notified after an entry leaves an {@link ExpiringStore}.
 *
 * <p>Invoked on the thread that caused the removal, after the store's lock has
 * been released. Exceptions thrown by the listener are logged and ignored.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
@FunctionalInterface
public interface RemovalListener<K, V> {

    /**
     * Handle a removed entry.
     *
     * @param key   the removed key
     * @param entry the removed entry snapshot
     * @param cause why the entry was removed
     */
    void onRemoval(K key, StoreEntry<V> entry, RemovalCause cause);
}
