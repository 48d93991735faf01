package warden.adapter.out.storage;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import warden.core.config.CredentialConfig;
import warden.core.port.out.CredentialRepository;
import warden.spi.CredentialStorageProvider;
import warden.spi.StorageAdapterConfig;
import warden.spi.StorageProviderException;

/**
 * Discovers credential storage providers via ServiceLoader and produces the
 * {@link CredentialRepository} bean.
 *
 * <p>Provider selection:
 * <ol>
 *   <li>If warden.credentials.storage.provider is set, use that provider</li>
 *   <li>Otherwise, select the highest priority available provider</li>
 * </ol>
 */
@ApplicationScoped
public class CredentialStorageProviderLoader {

    private static final Logger LOG = Logger.getLogger(CredentialStorageProviderLoader.class);

    private final Optional<String> configuredProvider;
    private final StorageAdapterConfig config;

    @Inject
    public CredentialStorageProviderLoader(CredentialConfig credentialConfig, StorageAdapterConfig config) {
        this.configuredProvider = credentialConfig.storage().provider();
        this.config = config;
    }

    @Produces
    @ApplicationScoped
    public CredentialRepository credentialRepository() {
        final var providers = new ArrayList<CredentialStorageProvider>();
        ServiceLoader.load(CredentialStorageProvider.class).forEach(providers::add);
        final var provider = selectProvider(providers, configuredProvider.orElse(null));
        LOG.infof("Creating credential repository from provider: %s (%s)", provider.name(), provider.description());
        return provider.createRepository(config);
    }

    /**
     * Pick the provider to use.
     *
     * @param providers  discovered providers
     * @param configured explicitly configured provider name, or null
     * @return the selected provider
     * @throws StorageProviderException if none is found or the configured one is missing
     */
    static CredentialStorageProvider selectProvider(List<CredentialStorageProvider> providers, String configured) {
        if (providers.isEmpty()) {
            throw new StorageProviderException(
                    "No credential storage providers found. Ensure a provider JAR is on the classpath.");
        }

        LOG.infof(
                "Found %d credential storage provider(s): %s",
                providers.size(),
                providers.stream().map(CredentialStorageProvider::name).toList());

        if (configured != null && !configured.isBlank()) {
            return providers.stream()
                    .filter(p -> p.name().equals(configured))
                    .findFirst()
                    .orElseThrow(() -> new StorageProviderException("Configured storage provider not found: "
                            + configured + ". Available: "
                            + providers.stream().map(CredentialStorageProvider::name).toList()));
        }

        return providers.stream()
                .filter(CredentialStorageProvider::isAvailable)
                .max(Comparator.comparingInt(CredentialStorageProvider::priority))
                .orElseThrow(() -> new StorageProviderException("No available credential storage providers"));
    }
}
