package warden.spi;

import java.time.Duration;
import java.util.Optional;

/**
 * Configuration access for credential storage providers.
 *
 * <p>Providers read their own settings through this interface without
 * coupling to a specific configuration framework.
 */
public interface StorageAdapterConfig {

    /**
     * Get a required configuration value.
     *
     * @param key the configuration key
     * @return the value
     * @throws StorageProviderException if not configured
     */
    String getRequired(String key);

    /**
     * Get an optional configuration value.
     *
     * @param key the configuration key
     * @return the value if present
     */
    Optional<String> get(String key);

    /**
     * Get a configuration value with a default.
     *
     * @param key          the configuration key
     * @param defaultValue value used when the key is absent
     * @return the value or the default
     */
    String getOrDefault(String key, String defaultValue);

    Optional<Integer> getInt(String key);

    Optional<Boolean> getBoolean(String key);

    /**
     * Get a duration value, e.g. {@code PT5S}.
     *
     * @param key the configuration key
     * @return the duration if present
     */
    Optional<Duration> getDuration(String key);
}
