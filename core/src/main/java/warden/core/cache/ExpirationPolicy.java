package warden.core.cache;

/**
 * How an {@link ExpiringStore} entry's expiry moves over its lifetime.
 */
public enum ExpirationPolicy {

    /** Expiry is fixed when the entry is written; reads never extend it. */
    AFTER_WRITE,

    /** Expiry slides forward on every read or write (inactivity timeout). */
    AFTER_ACCESS
}
