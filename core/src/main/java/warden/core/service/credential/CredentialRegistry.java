package warden.core.service.credential;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.scheduler.Scheduled;
import io.smallrye.mutiny.Uni;

import warden.core.config.CredentialConfig;
import warden.core.model.credential.Credential;
import warden.core.model.credential.CredentialFailureReason;
import warden.core.model.credential.CredentialIssueResult;
import warden.core.model.credential.CredentialLimitExceededException;
import warden.core.model.credential.CredentialSummary;
import warden.core.model.credential.CredentialValidation;
import warden.core.model.credential.IssueCredentialRequest;
import warden.core.port.in.CredentialManagement;
import warden.core.port.out.AuditSink;
import warden.core.port.out.CredentialRateLimiter;
import warden.core.port.out.CredentialRepository;
import warden.core.redaction.SanitizingLogger;
import warden.core.util.IpAllowlistMatcher;
import warden.spi.AuditEvent;

/**
 * Issues, validates, revokes and expires API credentials.
 *
 * <p>Secrets are stored as SHA-256 hashes only; the plaintext is returned once
 * at issuance. Every store call is bounded by the configured storage timeout and
 * failures surface as {@link warden.spi.StorageUnavailableException}, except for
 * usage recording which is best effort.
 */
@ApplicationScoped
public class CredentialRegistry implements CredentialManagement {

    private static final SanitizingLogger LOG = SanitizingLogger.getLogger(CredentialRegistry.class);
    private static final int AUDIT_HASH_PREFIX_CHARS = 8;
    private static final Comparator<Credential> OLDEST_FIRST =
            Comparator.comparing(Credential::createdAt).thenComparing(Credential::id);

    private final CredentialRepository repository;
    private final CredentialRateLimiter rateLimiter;
    private final SecretHasher hasher;
    private final IpAllowlistMatcher ipMatcher;
    private final AuditSink auditSink;
    private final CredentialConfig config;
    private final Clock clock;
    private final StorageGuard storage;

    @Inject
    public CredentialRegistry(
            CredentialRepository repository,
            CredentialRateLimiter rateLimiter,
            SecretHasher hasher,
            IpAllowlistMatcher ipMatcher,
            AuditSink auditSink,
            CredentialConfig config,
            Clock clock) {
        this.repository = repository;
        this.rateLimiter = rateLimiter;
        this.hasher = hasher;
        this.ipMatcher = ipMatcher;
        this.auditSink = auditSink;
        this.config = config;
        this.clock = clock;
        this.storage = new StorageGuard(config.storage().timeout());
    }

    @Override
    public Uni<CredentialIssueResult> issue(IssueCredentialRequest request) {
        final var now = clock.instant();
        final var secret = hasher.issue();
        final var credential = Credential.builder(UUID.randomUUID().toString(), secret.hash())
                .userId(request.userId())
                .keyPrefix(secret.displayPrefix())
                .name(request.name())
                .permissions(request.permissions())
                .ipAllowlist(request.ipAllowlist())
                .rateLimit(effectiveRateLimit(request.rateLimit()))
                .createdAt(now)
                .expiresAt(request.expiresIn().expiresAt(now))
                .active(true)
                .build();
        final var limit = config.maxActivePerSubject();

        return storage.guarded(repository.insertIfBelowLimit(credential, limit, now), "issue")
                .map(inserted -> {
                    if (!inserted) {
                        LOG.infof("Credential limit of %d reached for subject %s", limit, request.userId());
                        throw new CredentialLimitExceededException(request.userId(), limit);
                    }
                    LOG.infof(
                            "Issued credential %s (%s) for subject %s, expiry policy %s",
                            credential.id(),
                            credential.keyPrefix(),
                            credential.userId(),
                            request.expiresIn().code());
                    auditSink.emit(new AuditEvent.CredentialIssued(
                            now, credential.userId(), credential.id(), credential.keyPrefix()));
                    return new CredentialIssueResult(secret.plaintext(), credential);
                });
    }

    @Override
    public Uni<CredentialValidation> validate(String secret) {
        if (secret == null || secret.isBlank()) {
            return Uni.createFrom().item(reject(CredentialFailureReason.MISSING, null, null));
        }
        final var hash = hasher.verify(secret);
        return storage.guarded(repository.findByHash(hash), "validate").map(found -> {
            if (found.isEmpty()) {
                return reject(CredentialFailureReason.NOT_FOUND, null, hash.substring(0, AUDIT_HASH_PREFIX_CHARS));
            }
            final var credential = found.get();
            if (!credential.active()) {
                return reject(CredentialFailureReason.REVOKED, credential, credential.id());
            }
            if (credential.isExpiredAt(clock.instant())) {
                return reject(CredentialFailureReason.EXPIRED, credential, credential.id());
            }
            return CredentialValidation.accepted(credential);
        });
    }

    @Override
    public Uni<CredentialValidation> authorize(String secret, String clientIp, Set<String> requiredPermissions) {
        return validate(secret).flatMap(validation -> {
            if (!validation.valid()) {
                return Uni.createFrom().item(validation);
            }
            final var credential = validation.credential().orElseThrow();
            if (!ipMatcher.isAllowed(clientIp, credential.ipAllowlist())) {
                return Uni.createFrom()
                        .item(reject(CredentialFailureReason.IP_NOT_ALLOWED, credential, credential.id()));
            }
            if (requiredPermissions != null && !credential.permissions().containsAll(requiredPermissions)) {
                return Uni.createFrom()
                        .item(reject(CredentialFailureReason.INSUFFICIENT_PERMISSIONS, credential, credential.id()));
            }
            return storage.guarded(rateLimiter.checkAndConsume(credential.id(), credential.rateLimit()), "rateLimit")
                    .flatMap(decision -> {
                        if (!decision.allowed()) {
                            LOG.debugf(
                                    "Credential %s exceeded %d request(s) per window, resets at %s",
                                    credential.id(),
                                    decision.limit(),
                                    decision.resetAt());
                            return Uni.createFrom()
                                    .item(reject(CredentialFailureReason.RATE_LIMITED, credential, credential.id()));
                        }
                        return recordUsage(credential.id()).replaceWith(validation);
                    });
        });
    }

    @Override
    public Uni<Void> recordUsage(String credentialId) {
        final Uni<Boolean> update;
        try {
            update = repository.recordUsage(credentialId, clock.instant());
        } catch (RuntimeException e) {
            LOG.warnf("Could not record usage of credential %s: %s", credentialId, e.getMessage());
            return Uni.createFrom().voidItem();
        }
        return storage.silent(update, "recordUsage");
    }

    @Override
    public Uni<Boolean> revoke(String credentialId, String subjectId) {
        return storage.guarded(repository.findById(credentialId), "revoke")
                .flatMap(found -> {
                    if (found.isEmpty() || !found.get().userId().equals(subjectId)) {
                        LOG.debugf("Revocation of %s by %s ignored: not found or not owned", credentialId, subjectId);
                        return Uni.createFrom().item(false);
                    }
                    return storage.guarded(repository.deactivate(credentialId), "revoke")
                            .map(previous -> {
                                if (previous.map(Credential::active).orElse(false)) {
                                    LOG.infof("Revoked credential %s of subject %s", credentialId, subjectId);
                                    auditSink.emit(
                                            new AuditEvent.CredentialRevoked(clock.instant(), subjectId, credentialId));
                                }
                                return previous.isPresent();
                            });
                });
    }

    @Override
    public Uni<List<CredentialSummary>> listForSubject(String subjectId) {
        return storage.guarded(repository.findByUserId(subjectId), "listForSubject")
                .map(credentials -> credentials.stream()
                        .sorted(OLDEST_FIRST)
                        .map(Credential::toSummary)
                        .toList());
    }

    @Override
    public Uni<Integer> sweepExpired() {
        final var now = clock.instant();
        return storage.guarded(repository.deleteExpired(now), "sweepExpired").invoke(count -> {
            if (count > 0) {
                LOG.infof("Swept %d expired credential(s)", count);
                auditSink.emit(new AuditEvent.CredentialsExpiredSwept(now, count));
            }
        });
    }

    /**
     * Periodic expired-credential sweep, which also drops ended rate limit windows.
     *
     * <p>A failed sweep is logged and retried on the next tick.
     */
    @Scheduled(
            every = "${warden.credentials.sweep-interval:1h}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    Uni<Void> scheduledSweep() {
        return sweepExpired()
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnf(error, "Expired credential sweep failed, retrying next interval");
                    return 0;
                })
                .flatMap(ignored -> rateLimiter.removeEndedWindows())
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnf(error, "Rate limit window cleanup failed, retrying next interval");
                    return 0;
                })
                .replaceWithVoid();
    }

    private int effectiveRateLimit(Integer requested) {
        return requested == null || requested <= 0 ? config.defaultRateLimit() : requested;
    }

    private CredentialValidation reject(CredentialFailureReason reason, Credential credential, String resourceId) {
        final var subjectId = Optional.ofNullable(credential).map(Credential::userId).orElse(null);
        LOG.debugf("Credential rejected (%s), resource %s", reason, resourceId);
        auditSink.emit(new AuditEvent.CredentialValidationFailed(clock.instant(), subjectId, resourceId, reason.code()));
        return credential == null
                ? CredentialValidation.rejected(reason)
                : CredentialValidation.rejected(reason, credential);
    }
}
