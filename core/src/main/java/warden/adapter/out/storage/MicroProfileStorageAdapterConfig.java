package warden.adapter.out.storage;

import java.time.Duration;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.config.Config;

import warden.spi.StorageAdapterConfig;
import warden.spi.StorageProviderException;

/**
 * {@link StorageAdapterConfig} backed by the application's MicroProfile Config,
 * so storage providers see the same sources and profiles as the rest of Warden.
 *
 * <p>Typed lookups use the registered converters: durations accept both
 * ISO-8601 ({@code PT5S}) and the short form ({@code 5s}).
 */
@ApplicationScoped
public class MicroProfileStorageAdapterConfig implements StorageAdapterConfig {

    private final Config config;

    @Inject
    public MicroProfileStorageAdapterConfig(Config config) {
        this.config = config;
    }

    @Override
    public String getRequired(String key) {
        return get(key).orElseThrow(
                () -> new StorageProviderException("Storage provider requires configuration key " + key));
    }

    @Override
    public Optional<String> get(String key) {
        return lookup(key, String.class).filter(value -> !value.isBlank());
    }

    @Override
    public String getOrDefault(String key, String defaultValue) {
        return get(key).orElse(defaultValue);
    }

    @Override
    public Optional<Integer> getInt(String key) {
        return lookup(key, Integer.class);
    }

    @Override
    public Optional<Boolean> getBoolean(String key) {
        return lookup(key, Boolean.class);
    }

    @Override
    public Optional<Duration> getDuration(String key) {
        return lookup(key, Duration.class);
    }

    private <T> Optional<T> lookup(String key, Class<T> type) {
        try {
            return config.getOptionalValue(key, type);
        } catch (IllegalArgumentException e) {
            throw new StorageProviderException("Invalid value for storage configuration key " + key, e);
        }
    }
}
