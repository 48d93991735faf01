package warden.core.service.session;

import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.scheduler.Scheduled;

import warden.core.cache.ExpirationPolicy;
import warden.core.cache.ExpiringStore;
import warden.core.cache.RemovalCause;
import warden.core.cache.StoreEntry;
import warden.core.config.SessionVaultConfig;
import warden.core.model.session.VaultStatus;
import warden.core.port.in.SecureSessionStorage;
import warden.core.port.out.AuditSink;
import warden.core.redaction.Redactor;
import warden.core.redaction.SanitizingLogger;
import warden.spi.AuditEvent;

/**
 * Bounded in-memory store for short-lived per-thread session data.
 *
 * <p>Records expire after a configurable period of inactivity; reads refresh
 * the period. When the vault is full, storing a new thread id evicts the least
 * recently accessed record. Payloads are redacted before they are stored, and
 * the vault is emptied when the application shuts down.
 *
 * <p>Data is NOT persisted and is never shared between nodes.
 */
@ApplicationScoped
public class SessionVault implements SecureSessionStorage {

    private static final SanitizingLogger LOG = SanitizingLogger.getLogger(SessionVault.class);

    private final String vaultId = UUID.randomUUID().toString();
    private final ExpiringStore<String, Map<String, Object>> threads;
    private final Redactor redactor;
    private final AuditSink auditSink;
    private final Clock clock;
    private final boolean sanitizePayloads;

    @Inject
    public SessionVault(SessionVaultConfig config, Redactor redactor, AuditSink auditSink, Clock clock) {
        this.threads = new ExpiringStore<>(
                clock, config.maxThreads(), config.expiration(), ExpirationPolicy.AFTER_ACCESS, this::onRemoval);
        this.redactor = redactor;
        this.auditSink = auditSink;
        this.clock = clock;
        this.sanitizePayloads = config.sanitizePayloads();
        LOG.infof(
                "Session vault %s ready (max %d threads, %s inactivity expiration)",
                vaultId,
                config.maxThreads(),
                config.expiration());
    }

    @Override
    public void put(String threadId, Map<String, Object> payload) {
        if (threadId == null || threadId.isBlank()) {
            throw new IllegalArgumentException("Thread ID cannot be null or blank");
        }
        threads.put(threadId, sanitize(payload));
    }

    @Override
    public Optional<Map<String, Object>> get(String threadId) {
        if (threadId == null) {
            return Optional.empty();
        }
        return threads.get(threadId);
    }

    @Override
    public boolean delete(String threadId) {
        if (threadId == null) {
            return false;
        }
        return threads.remove(threadId).isPresent();
    }

    @Override
    public int clearAll() {
        final var count = threads.clear();
        LOG.infof("Cleared %d thread(s) from session vault %s", count, vaultId);
        auditSink.emit(new AuditEvent.SessionCleared(clock.instant(), vaultId, count));
        return count;
    }

    @Override
    public List<String> threadIds() {
        return threads.keys();
    }

    @Override
    public int sweepExpired() {
        final var removed = threads.sweepExpired().size();
        if (removed > 0) {
            LOG.debugf("Swept %d inactive thread(s) from session vault %s", removed, vaultId);
        }
        return removed;
    }

    @Override
    public VaultStatus status() {
        final var oldestAge = threads.oldestAccess()
                .map(oldest -> Duration.between(oldest, clock.instant()).toMinutes())
                .orElse(null);
        return new VaultStatus(vaultId, threads.size(), oldestAge);
    }

    public String vaultId() {
        return vaultId;
    }

    @Scheduled(
            every = "${warden.session-vault.sweep-interval:60s}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void scheduledSweep() {
        sweepExpired();
    }

    void onShutdown(@Observes ShutdownEvent event) {
        clearAll();
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> sanitize(Map<String, Object> payload) {
        if (payload == null) {
            return Map.of();
        }
        if (!sanitizePayloads) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        }
        return Collections.unmodifiableMap((Map<String, Object>) redactor.sanitizeValue(payload));
    }

    private void onRemoval(String threadId, StoreEntry<Map<String, Object>> entry, RemovalCause cause) {
        final var now = clock.instant();
        if (cause == RemovalCause.EXPIRED) {
            LOG.debugf("Session thread %s expired after inactivity", threadId);
            auditSink.emit(new AuditEvent.SessionExpired(now, threadId));
        } else if (cause == RemovalCause.SIZE) {
            LOG.debugf("Session thread %s evicted, vault at capacity", threadId);
            auditSink.emit(new AuditEvent.SessionEvicted(now, threadId));
        }
    }
}
