package warden.spi;

import java.time.Clock;
import java.time.Duration;

import warden.core.port.out.CredentialRateLimiter;

/**
 * Service Provider Interface for per-credential rate limiters.
 *
 * <p>Discovered via {@link java.util.ServiceLoader}, selected the same way as
 * {@link CredentialStorageProvider}: by {@code warden.credentials.rate-limit.provider}
 * when set, otherwise by highest priority. Register implementations in
 * {@code META-INF/services/warden.spi.CredentialRateLimiterProvider}.
 */
public interface CredentialRateLimiterProvider {

    String name();

    default String description() {
        return name() + " credential rate limiter";
    }

    /**
     * Priority for auto-selection. Higher values win; the in-memory limiter uses 0.
     *
     * @return the provider priority
     */
    default int priority() {
        return 0;
    }

    default boolean isAvailable() {
        return true;
    }

    /**
     * Create the rate limiter.
     *
     * <p>Called once at startup. The returned instance must be thread-safe.
     *
     * @param window  length of each fixed window
     * @param enabled false to allow every request
     * @param clock   time source for window boundaries
     * @param config  access to provider-specific configuration
     * @return the rate limiter
     * @throws StorageProviderException if initialization fails
     */
    CredentialRateLimiter createRateLimiter(
            Duration window, boolean enabled, Clock clock, StorageAdapterConfig config);
}
