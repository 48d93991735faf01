package warden.adapter.out.ratelimit.memory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import io.smallrye.mutiny.Uni;

import warden.core.model.ratelimit.RateLimitDecision;
import warden.core.port.out.CredentialRateLimiter;

/**
 * Fixed-window rate limiter held in process memory.
 *
 * <p>The first request for a credential opens a window of the configured
 * length. Requests are allowed while fewer than {@code limit} have been counted
 * in the window; a window is still current at exactly its reset instant.
 *
 * <p>State is not shared across instances and is lost on restart. Ended windows
 * stay in memory until {@link #removeEndedWindows()} runs.
 */
public final class InMemoryCredentialRateLimiter implements CredentialRateLimiter {

    private final ConcurrentMap<String, Window> windows = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration windowLength;
    private final boolean enabled;

    private record Window(int count, Instant resetAt) {

        boolean endedAt(Instant now) {
            return resetAt.isBefore(now);
        }
    }

    public InMemoryCredentialRateLimiter(Clock clock, Duration windowLength, boolean enabled) {
        if (windowLength == null || windowLength.isNegative() || windowLength.isZero()) {
            throw new IllegalArgumentException("Rate limit window must be positive");
        }
        this.clock = clock;
        this.windowLength = windowLength;
        this.enabled = enabled;
    }

    @Override
    public Uni<RateLimitDecision> checkAndConsume(String credentialId, int limit) {
        if (!enabled) {
            return Uni.createFrom().item(RateLimitDecision.unlimited());
        }
        final var now = clock.instant();
        final var decision = new RateLimitDecision[1];

        windows.compute(credentialId, (id, current) -> {
            if (current == null || current.endedAt(now)) {
                final var opened = new Window(1, now.plus(windowLength));
                decision[0] = RateLimitDecision.allow(limit - 1L, limit, opened.resetAt());
                return opened;
            }
            if (current.count() >= limit) {
                decision[0] = RateLimitDecision.rejected(limit, current.resetAt());
                return current;
            }
            final var counted = new Window(current.count() + 1, current.resetAt());
            decision[0] = RateLimitDecision.allow((long) limit - counted.count(), limit, counted.resetAt());
            return counted;
        });

        return Uni.createFrom().item(decision[0]);
    }

    @Override
    public Uni<Void> reset(String credentialId) {
        windows.remove(credentialId);
        return Uni.createFrom().voidItem();
    }

    @Override
    public Uni<Integer> removeEndedWindows() {
        final var now = clock.instant();
        var removed = 0;
        for (final var entry : windows.entrySet()) {
            if (entry.getValue().endedAt(now) && windows.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        return Uni.createFrom().item(removed);
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    int windowCount() {
        return windows.size();
    }
}
