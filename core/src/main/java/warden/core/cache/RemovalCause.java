package warden.core.cache;

/**
 * Why an entry left an {@link ExpiringStore}.
 */
public enum RemovalCause {

    /** Removed by an explicit delete or clear. */
    EXPLICIT,

    /** Replaced by a newer value for the same key. */
    REPLACED,

    /** Removed because its expiry had passed. */
    EXPIRED,

    /** Evicted as the least recently accessed entry to make room. */
    SIZE;

    /**
     * Return whether the removal happened without the caller asking for it.
     *
     * @return true for {@link #EXPIRED} and {@link #SIZE}
     */
    public boolean wasEvicted() {
        return this == EXPIRED || this == SIZE;
    }
}
