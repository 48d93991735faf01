package warden.core.model.ratelimit;

import java.time.Instant;

/**
 * Result of a per-credential rate limit check.
 *
 * @param allowed   whether the request may proceed
 * @param remaining requests left in the current window
 * @param limit     requests permitted per window
 * @param resetAt   when the current window ends
 */
public record RateLimitDecision(boolean allowed, long remaining, long limit, Instant resetAt) {

    /**
     * Decision used when rate limiting is switched off.
     *
     * @return an allowed decision with no bound
     */
    public static RateLimitDecision unlimited() {
        return new RateLimitDecision(true, Long.MAX_VALUE, Long.MAX_VALUE, Instant.MAX);
    }

    public static RateLimitDecision allow(long remaining, long limit, Instant resetAt) {
        return new RateLimitDecision(true, remaining, limit, resetAt);
    }

    public static RateLimitDecision rejected(long limit, Instant resetAt) {
        return new RateLimitDecision(false, 0, limit, resetAt);
    }
}
