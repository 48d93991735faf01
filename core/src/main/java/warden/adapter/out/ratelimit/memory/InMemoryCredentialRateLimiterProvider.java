package warden.adapter.out.ratelimit.memory;

import java.time.Clock;
import java.time.Duration;

import warden.core.port.out.CredentialRateLimiter;
import warden.spi.CredentialRateLimiterProvider;
import warden.spi.StorageAdapterConfig;

/**
 * Built-in rate limiter provider, single instance only.
 */
public class InMemoryCredentialRateLimiterProvider implements CredentialRateLimiterProvider {

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public String description() {
        return "In-memory fixed-window rate limiter (not shared across instances)";
    }

    @Override
    public CredentialRateLimiter createRateLimiter(
            Duration window, boolean enabled, Clock clock, StorageAdapterConfig config) {
        return new InMemoryCredentialRateLimiter(clock, window, enabled);
    }
}
