package warden.spi;

import warden.core.port.out.CredentialRepository;

/**
 * Service Provider Interface for credential storage backends.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader} at
 * startup. A distributed backend (shared across nodes) is plugged in here.
 *
 * <h2>How to Create a Custom Provider</h2>
 * <ol>
 *   <li>Implement this interface</li>
 *   <li>Create META-INF/services/warden.spi.CredentialStorageProvider</li>
 *   <li>Add your fully qualified class name to the file</li>
 *   <li>Configure: warden.credentials.storage.provider=your-provider-name</li>
 * </ol>
 *
 * <p>Repositories must make {@link CredentialRepository#insertIfBelowLimit}
 * atomic per subject.
 */
public interface CredentialStorageProvider {

    /**
     * Unique name identifying this provider.
     *
     * <p>Used in configuration: warden.credentials.storage.provider={name}
     *
     * @return the provider name
     */
    String name();

    default String description() {
        return name() + " credential storage provider";
    }

    /**
     * Priority for auto-selection when no explicit provider is configured.
     *
     * <p>Higher values win. The built-in in-memory provider uses 0.
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
     * Create the repository implementation.
     *
     * <p>Called once at startup. The returned instance must be thread-safe.
     *
     * @param config access to configuration properties
     * @return the repository
     * @throws StorageProviderException if initialization fails
     */
    CredentialRepository createRepository(StorageAdapterConfig config);
}
