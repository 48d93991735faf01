package warden.core.service.csrf;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.scheduler.Scheduled;

import warden.core.cache.ExpirationPolicy;
import warden.core.cache.ExpiringStore;
import warden.core.config.CsrfConfig;
import warden.core.model.csrf.CsrfFailureReason;
import warden.core.model.csrf.CsrfValidation;
import warden.core.port.in.CsrfTokenManagement;
import warden.core.port.out.AuditSink;
import warden.core.redaction.SanitizingLogger;
import warden.core.util.SecureHash;
import warden.spi.AuditEvent;

/**
 * Issues and checks per-subject CSRF tokens.
 *
 * <p>Each subject holds at most one live token; issuing again replaces it.
 * Validation never extends a token's lifetime. Tokens are compared in
 * constant time.
 */
@ApplicationScoped
public class CsrfTokenService implements CsrfTokenManagement {

    private static final SanitizingLogger LOG = SanitizingLogger.getLogger(CsrfTokenService.class);
    private static final int TOKEN_LENGTH_BYTES = 32;
    private static final Set<String> SAFE_METHODS = Set.of("GET", "HEAD", "OPTIONS");

    private final ExpiringStore<String, String> tokens;
    private final AuditSink auditSink;
    private final Clock clock;
    private final SecureRandom secureRandom = new SecureRandom();

    @Inject
    public CsrfTokenService(CsrfConfig config, AuditSink auditSink, Clock clock) {
        this.tokens = new ExpiringStore<>(clock, config.maxTokens(), config.tokenTtl(), ExpirationPolicy.AFTER_WRITE);
        this.auditSink = auditSink;
        this.clock = clock;
    }

    @Override
    public String issue(String subjectId) {
        if (subjectId == null || subjectId.isBlank()) {
            throw new IllegalArgumentException("Subject cannot be null or blank");
        }
        final var bytes = new byte[TOKEN_LENGTH_BYTES];
        secureRandom.nextBytes(bytes);
        final var token = HexFormat.of().formatHex(bytes);
        tokens.put(subjectId, token);
        LOG.debugf("Issued CSRF token for subject %s", subjectId);
        return token;
    }

    @Override
    public CsrfValidation validate(String subjectId, String token) {
        if (subjectId == null || subjectId.isBlank() || token == null || token.isEmpty()) {
            return reject(subjectId, CsrfFailureReason.MISSING);
        }
        final var entry = tokens.peek(subjectId);
        if (entry.isEmpty()) {
            return reject(subjectId, CsrfFailureReason.NOT_FOUND);
        }
        final var expired = entry.get().isExpiredAt(clock.instant());
        if (expired) {
            // any attempt that observes expiry removes the record, matching or not
            tokens.expireIfStale(subjectId);
        }
        if (!SecureHash.constantTimeEquals(entry.get().value(), token)) {
            return reject(subjectId, CsrfFailureReason.MISMATCH);
        }
        if (expired) {
            return reject(subjectId, CsrfFailureReason.EXPIRED);
        }
        return CsrfValidation.accepted();
    }

    @Override
    public boolean invalidate(String subjectId) {
        final var removed = tokens.remove(subjectId).isPresent();
        if (removed) {
            LOG.debugf("Invalidated CSRF token for subject %s", subjectId);
        }
        return removed;
    }

    @Override
    public boolean requiresValidation(String httpMethod) {
        if (httpMethod == null) {
            return true;
        }
        return !SAFE_METHODS.contains(httpMethod.toUpperCase(Locale.ROOT));
    }

    @Override
    public int sweepExpired() {
        final var removed = tokens.sweepExpired().size();
        if (removed > 0) {
            LOG.debugf("Swept %d expired CSRF token(s)", removed);
        }
        return removed;
    }

    @Scheduled(every = "${warden.csrf.sweep-interval:5m}", concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void scheduledSweep() {
        sweepExpired();
    }

    int liveTokenCount() {
        return tokens.size();
    }

    private CsrfValidation reject(String subjectId, CsrfFailureReason reason) {
        LOG.debugf("CSRF validation failed for subject %s: %s", subjectId, reason);
        auditSink.emit(new AuditEvent.CsrfValidationFailed(clock.instant(), subjectId, reason.code()));
        return CsrfValidation.rejected(reason);
    }
}
