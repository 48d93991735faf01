package warden.adapter.out.storage.memory;

import warden.core.port.out.CredentialRepository;
import warden.spi.CredentialStorageProvider;
import warden.spi.StorageAdapterConfig;

/**
 * In-memory storage provider for credentials.
 *
 * <p>Non-persistent; the default when no other provider is on the classpath.
 */
public class InMemoryCredentialStorageProvider implements CredentialStorageProvider {

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public String description() {
        return "In-memory credential storage (non-persistent)";
    }

    @Override
    public int priority() {
        return 0; // Lowest priority, used as fallback
    }

    @Override
    public CredentialRepository createRepository(StorageAdapterConfig config) {
        return new InMemoryCredentialRepository();
    }
}
