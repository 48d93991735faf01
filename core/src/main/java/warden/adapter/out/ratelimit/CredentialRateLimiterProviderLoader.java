package warden.adapter.out.ratelimit;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.ServiceLoader;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import warden.core.config.CredentialConfig;
import warden.core.port.out.CredentialRateLimiter;
import warden.spi.CredentialRateLimiterProvider;
import warden.spi.StorageAdapterConfig;
import warden.spi.StorageProviderException;

/**
 * Discovers rate limiter providers via ServiceLoader and produces the
 * {@link CredentialRateLimiter} bean.
 *
 * <p>Uses {@code warden.credentials.rate-limit.provider} when set, otherwise the
 * highest priority available provider.
 */
@ApplicationScoped
public class CredentialRateLimiterProviderLoader {

    private static final Logger LOG = Logger.getLogger(CredentialRateLimiterProviderLoader.class);

    private final CredentialConfig.RateLimitConfig rateLimitConfig;
    private final StorageAdapterConfig adapterConfig;
    private final Clock clock;

    @Inject
    public CredentialRateLimiterProviderLoader(
            CredentialConfig credentialConfig, StorageAdapterConfig adapterConfig, Clock clock) {
        this.rateLimitConfig = credentialConfig.rateLimit();
        this.adapterConfig = adapterConfig;
        this.clock = clock;
    }

    @Produces
    @ApplicationScoped
    public CredentialRateLimiter credentialRateLimiter() {
        final var providers = new ArrayList<CredentialRateLimiterProvider>();
        ServiceLoader.load(CredentialRateLimiterProvider.class).forEach(providers::add);
        final var provider = selectProvider(providers, rateLimitConfig.provider().orElse(null));
        if (rateLimitConfig.enabled()) {
            LOG.infof(
                    "Creating credential rate limiter from provider: %s (window %s)",
                    provider.name(), rateLimitConfig.window());
        } else {
            LOG.info("Credential rate limiting is disabled");
        }
        return provider.createRateLimiter(rateLimitConfig.window(), rateLimitConfig.enabled(), clock, adapterConfig);
    }

    static CredentialRateLimiterProvider selectProvider(
            List<CredentialRateLimiterProvider> providers, String configured) {
        if (configured != null && !configured.isBlank()) {
            return providers.stream()
                    .filter(p -> p.name().equals(configured))
                    .findFirst()
                    .orElseThrow(() -> new StorageProviderException("Configured rate limiter provider not found: "
                            + configured + ". Available: "
                            + providers.stream().map(CredentialRateLimiterProvider::name).toList()));
        }
        return providers.stream()
                .filter(CredentialRateLimiterProvider::isAvailable)
                .max(Comparator.comparingInt(CredentialRateLimiterProvider::priority))
                .orElseThrow(() -> new StorageProviderException("No available credential rate limiter providers"));
    }
}
