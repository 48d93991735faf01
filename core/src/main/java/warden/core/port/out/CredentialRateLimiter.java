package warden.core.port.out;

import io.smallrye.mutiny.Uni;

import warden.core.model.ratelimit.RateLimitDecision;

/**
 * Port for counting credential use against each credential's request budget.
 *
 * <p>Implementations must make check-and-consume atomic per credential.
 */
public interface CredentialRateLimiter {

    /**
     * Count one request against the credential's window.
     *
     * <p>A rejected request does not consume from the window.
     *
     * @param credentialId the credential
     * @param limit        requests permitted per window
     * @return Uni with the decision
     */
    Uni<RateLimitDecision> checkAndConsume(String credentialId, int limit);

    /**
     * Forget the credential's current window.
     *
     * @param credentialId the credential
     * @return Uni completing when done
     */
    Uni<Void> reset(String credentialId);

    /**
     * Drop windows that have already ended.
     *
     * @return Uni with the number of windows dropped
     */
    Uni<Integer> removeEndedWindows();

    boolean isEnabled();
}
