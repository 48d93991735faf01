package warden.core.service.credential;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.security.SecureRandom;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import warden.adapter.out.ratelimit.memory.InMemoryCredentialRateLimiter;
import warden.adapter.out.storage.memory.InMemoryCredentialRepository;
import warden.core.config.CredentialConfig;
import warden.core.model.credential.CredentialFailureReason;
import warden.core.model.credential.CredentialIssueResult;
import warden.core.model.credential.CredentialLimitExceededException;
import warden.core.model.credential.CredentialValidation;
import warden.core.model.credential.ExpiryPolicy;
import warden.core.model.credential.IssueCredentialRequest;
import warden.core.port.out.CredentialRepository;
import warden.core.util.IpAllowlistMatcher;
import warden.mock.MutableClock;
import warden.mock.RecordingAuditSink;
import warden.spi.AuditEvent;
import warden.spi.StorageUnavailableException;

@DisplayName("CredentialRegistry")
class CredentialRegistryTest {

    private static final String SUBJECT = "user-1";

    private MutableClock clock;
    private InMemoryCredentialRepository repository;
    private InMemoryCredentialRateLimiter rateLimiter;
    private RecordingAuditSink audit;
    private CredentialConfig config;
    private CredentialRegistry registry;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2025-03-01T12:00:00Z");
        repository = new InMemoryCredentialRepository();
        rateLimiter = new InMemoryCredentialRateLimiter(clock, Duration.ofMinutes(1), true);
        audit = new RecordingAuditSink();
        config = mockConfig();
        registry = registryWith(repository);
    }

    private CredentialConfig mockConfig() {
        final var credentialConfig = mock(CredentialConfig.class);
        final var storageConfig = mock(CredentialConfig.StorageConfig.class);
        when(credentialConfig.maxActivePerSubject()).thenReturn(10);
        when(credentialConfig.defaultRateLimit()).thenReturn(1000);
        when(credentialConfig.environmentTag()).thenReturn("test");
        when(credentialConfig.storage()).thenReturn(storageConfig);
        when(storageConfig.timeout()).thenReturn(Duration.ofSeconds(5));
        return credentialConfig;
    }

    private CredentialRegistry registryWith(CredentialRepository repo) {
        return new CredentialRegistry(
                repo,
                rateLimiter,
                new SecretHasher(new SecureRandom(), "test"),
                new IpAllowlistMatcher(),
                audit,
                config,
                clock);
    }

    private CredentialIssueResult issue(String subject, String expiresIn) {
        return registry.issue(IssueCredentialRequest.of(subject, "key", Set.of("read"), expiresIn))
                .await()
                .indefinitely();
    }

    @Nested
    @DisplayName("issue")
    class IssueTests {

        @Test
        @DisplayName("should return plaintext once and store only the hash")
        void shouldStoreOnlyHash() {
            final var result = issue(SUBJECT, "never");

            assertTrue(result.plaintextSecret().startsWith("ak_test_"));
            assertEquals(64, result.credential().keyHash().length());
            assertFalse(result.credential().keyHash().contains(result.plaintextSecret()));
            assertTrue(result.credential().keyPrefix().startsWith("ak_test_"));
            assertTrue(result.credential().keyPrefix().endsWith("..."));
            assertTrue(result.credential().active());
            assertNull(result.credential().expiresAt());
            assertEquals(0, result.credential().usageCount());
        }

        @Test
        @DisplayName("should apply the default rate limit when absent or non-positive")
        void shouldApplyDefaultRateLimit() {
            final var absent = registry.issue(new IssueCredentialRequest(
                            SUBJECT, "a", Set.of(), Set.of(), null, ExpiryPolicy.NEVER))
                    .await()
                    .indefinitely();
            final var zero = registry.issue(new IssueCredentialRequest(
                            SUBJECT, "b", Set.of(), Set.of(), 0, ExpiryPolicy.NEVER))
                    .await()
                    .indefinitely();
            final var explicit = registry.issue(new IssueCredentialRequest(
                            SUBJECT, "c", Set.of(), Set.of(), 50, ExpiryPolicy.NEVER))
                    .await()
                    .indefinitely();

            assertEquals(1000, absent.credential().rateLimit());
            assertEquals(1000, zero.credential().rateLimit());
            assertEquals(50, explicit.credential().rateLimit());
        }

        @Test
        @DisplayName("should compute expiry from the policy code")
        void shouldComputeExpiry() {
            assertEquals(
                    Instant.parse("2025-03-08T12:00:00Z"),
                    issue(SUBJECT, "7d").credential().expiresAt());
            assertEquals(
                    Instant.parse("2025-03-31T12:00:00Z"),
                    issue(SUBJECT, "bogus").credential().expiresAt());
            assertEquals(
                    Instant.parse("2026-03-01T12:00:00Z"),
                    issue(SUBJECT, "1y").credential().expiresAt());
        }

        @Test
        @DisplayName("should emit credential.issued")
        void shouldEmitIssued() {
            final var result = issue(SUBJECT, "30d");

            final var issued = audit.eventsOf(AuditEvent.CredentialIssued.class);
            assertEquals(1, issued.size());
            assertEquals(SUBJECT, issued.get(0).subjectId());
            assertEquals(result.credential().id(), issued.get(0).resourceId());
        }

        @Test
        @DisplayName("should fail when the subject holds the maximum active credentials")
        void shouldEnforceLimit() {
            for (var i = 0; i < 10; i++) {
                issue(SUBJECT, "never");
            }

            final var error = assertThrows(CredentialLimitExceededException.class, () -> issue(SUBJECT, "never"));

            assertEquals(10, error.limit());
            assertEquals(10, registry.listForSubject(SUBJECT).await().indefinitely().size());
            assertNotNull(issue("user-2", "never"));
        }

        @Test
        @DisplayName("should free a slot when a credential is revoked")
        void shouldFreeSlotOnRevoke() {
            final var first = issue(SUBJECT, "never");
            for (var i = 1; i < 10; i++) {
                issue(SUBJECT, "never");
            }

            registry.revoke(first.credential().id(), SUBJECT).await().indefinitely();

            assertNotNull(issue(SUBJECT, "never"));
        }

        @Test
        @DisplayName("should never exceed the limit under concurrent issuance")
        void shouldHoldLimitUnderConcurrency() throws Exception {
            final var threads = 32;
            final var executor = Executors.newFixedThreadPool(threads);
            final var start = new CountDownLatch(1);
            final var tasks = new ArrayList<Callable<Boolean>>();
            for (var i = 0; i < threads; i++) {
                tasks.add(() -> {
                    start.await();
                    try {
                        issue(SUBJECT, "never");
                        return true;
                    } catch (CredentialLimitExceededException e) {
                        return false;
                    }
                });
            }

            try {
                final var futures = tasks.stream().map(executor::submit).toList();
                start.countDown();
                var succeeded = 0;
                for (final var future : futures) {
                    if (future.get(10, TimeUnit.SECONDS)) {
                        succeeded++;
                    }
                }

                assertEquals(10, succeeded);
                assertEquals(
                        10,
                        registry.listForSubject(SUBJECT).await().indefinitely().stream()
                                .filter(c -> c.active())
                                .count());
            } finally {
                executor.shutdownNow();
            }
        }
    }

    @Nested
    @DisplayName("validate")
    class ValidateTests {

        @Test
        @DisplayName("should accept the issued secret")
        void shouldAcceptIssuedSecret() {
            final var result = issue(SUBJECT, "30d");

            final var validation = registry.validate(result.plaintextSecret()).await().indefinitely();

            assertTrue(validation.valid());
            assertEquals(result.credential().id(), validation.credential().orElseThrow().id());
        }

        @Test
        @DisplayName("should report MISSING for blank input")
        void shouldReportMissing() {
            assertEquals(
                    CredentialFailureReason.MISSING,
                    registry.validate(null).await().indefinitely().reasonOrNull());
            assertEquals(
                    CredentialFailureReason.MISSING,
                    registry.validate("  ").await().indefinitely().reasonOrNull());
        }

        @Test
        @DisplayName("should report NOT_FOUND for a single-character mutation")
        void shouldRejectMutatedSecret() {
            final var secret = issue(SUBJECT, "30d").plaintextSecret();
            final var last = secret.charAt(secret.length() - 1);
            final var mutated = secret.substring(0, secret.length() - 1) + (last == 'A' ? 'B' : 'A');

            final var validation = registry.validate(mutated).await().indefinitely();

            assertFalse(validation.valid());
            assertEquals(CredentialFailureReason.NOT_FOUND, validation.reasonOrNull());
            final var failure = audit.eventsOf(AuditEvent.CredentialValidationFailed.class).get(0);
            assertEquals("not_found", failure.reason());
            assertEquals(8, failure.resourceId().length());
            assertFalse(failure.resourceId().contains(mutated));
        }

        @Test
        @DisplayName("should report REVOKED after revocation")
        void shouldReportRevoked() {
            final var result = issue(SUBJECT, "30d");
            registry.revoke(result.credential().id(), SUBJECT).await().indefinitely();

            final var validation = registry.validate(result.plaintextSecret()).await().indefinitely();

            assertEquals(CredentialFailureReason.REVOKED, validation.reasonOrNull());
        }

        @Test
        @DisplayName("should accept a 7d credential at T+6d and reject it as EXPIRED at T+8d")
        void shouldExpireSevenDayCredential() {
            final var secret = issue(SUBJECT, "7d").plaintextSecret();

            clock.advance(Duration.ofDays(6));
            assertTrue(registry.validate(secret).await().indefinitely().valid());

            clock.advance(Duration.ofDays(2));
            final var validation = registry.validate(secret).await().indefinitely();
            assertEquals(CredentialFailureReason.EXPIRED, validation.reasonOrNull());
            assertEquals(SUBJECT, audit.eventsOf(AuditEvent.CredentialValidationFailed.class).get(0).subjectId());
        }

        @Test
        @DisplayName("should still accept a credential at exactly its expiry instant")
        void shouldAcceptAtExpiryInstant() {
            final var secret = issue(SUBJECT, "7d").plaintextSecret();

            clock.advance(Duration.ofDays(7));

            assertTrue(registry.validate(secret).await().indefinitely().valid());
        }

        @Test
        @DisplayName("should surface store failures as StorageUnavailableException")
        void shouldSurfaceStoreFailures() {
            final var failing = mock(CredentialRepository.class);
            when(failing.findByHash(anyString()))
                    .thenReturn(Uni.createFrom().failure(new IllegalStateException("connection refused")));
            final var failingRegistry = registryWith(failing);

            final var error = assertThrows(
                    StorageUnavailableException.class,
                    () -> failingRegistry.validate("ak_test_whatever").await().indefinitely());

            assertInstanceOf(IllegalStateException.class, error.getCause());
        }
    }

    @Nested
    @DisplayName("authorize")
    class AuthorizeTests {

        private CredentialIssueResult restricted() {
            return registry.issue(new IssueCredentialRequest(
                            SUBJECT,
                            "restricted",
                            Set.of("read", "write"),
                            Set.of("10.0.0.0/8", "192.168.1.5"),
                            null,
                            ExpiryPolicy.THIRTY_DAYS))
                    .await()
                    .indefinitely();
        }

        @Test
        @DisplayName("should accept allowed IP with sufficient permissions and record usage")
        void shouldAcceptAndRecordUsage() {
            final var result = restricted();
            clock.advance(Duration.ofMinutes(5));

            final var validation = registry.authorize(result.plaintextSecret(), "10.1.2.3", Set.of("read"))
                    .await()
                    .indefinitely();

            assertTrue(validation.valid());
            final var stored = repository.findById(result.credential().id()).await().indefinitely().orElseThrow();
            assertEquals(1, stored.usageCount());
            assertEquals(clock.instant(), stored.lastUsedAt());
        }

        @Test
        @DisplayName("should reject an IP outside the allowlist")
        void shouldRejectDisallowedIp() {
            final var result = restricted();

            final var validation = registry.authorize(result.plaintextSecret(), "172.16.0.1", Set.of())
                    .await()
                    .indefinitely();

            assertEquals(CredentialFailureReason.IP_NOT_ALLOWED, validation.reasonOrNull());
        }

        @Test
        @DisplayName("should reject missing permissions")
        void shouldRejectMissingPermissions() {
            final var result = restricted();

            final var validation = registry.authorize(result.plaintextSecret(), "192.168.1.5", Set.of("admin"))
                    .await()
                    .indefinitely();

            assertEquals(CredentialFailureReason.INSUFFICIENT_PERMISSIONS, validation.reasonOrNull());
            assertEquals(
                    0,
                    repository.findById(result.credential().id()).await().indefinitely().orElseThrow().usageCount());
        }

        @Test
        @DisplayName("should reject requests beyond the credential's rate limit until the window ends")
        void shouldEnforceRateLimitWindow() {
            final var secret = limited(2).plaintextSecret();

            assertTrue(authorize(secret).valid());
            clock.advance(Duration.ofSeconds(30));
            assertTrue(authorize(secret).valid());
            assertEquals(CredentialFailureReason.RATE_LIMITED, authorize(secret).reasonOrNull());

            // window opened at T, still current at exactly T+60s
            clock.advance(Duration.ofSeconds(30));
            assertEquals(CredentialFailureReason.RATE_LIMITED, authorize(secret).reasonOrNull());

            clock.advance(Duration.ofMillis(1));
            assertTrue(authorize(secret).valid());
        }

        @Test
        @DisplayName("should not record usage for rate-limited requests")
        void shouldNotRecordUsageWhenRateLimited() {
            final var result = limited(1);

            authorize(result.plaintextSecret());
            final var rejected = authorize(result.plaintextSecret());

            assertFalse(rejected.valid());
            assertEquals(
                    1,
                    repository.findById(result.credential().id()).await().indefinitely().orElseThrow().usageCount());
            final var failures = audit.eventsOf(AuditEvent.CredentialValidationFailed.class);
            assertEquals("rate_limited", failures.get(failures.size() - 1).reason());
            assertEquals(result.credential().id(), failures.get(failures.size() - 1).resourceId());
        }

        @Test
        @DisplayName("should not count requests rejected for IP or permissions against the rate limit")
        void shouldNotCountEarlierRejections() {
            final var secret = limited(1).plaintextSecret();

            registry.authorize(secret, "10.0.0.1", Set.of("admin")).await().indefinitely();

            assertTrue(authorize(secret).valid());
        }

        @Test
        @DisplayName("should pass through validation failures")
        void shouldPassThroughValidationFailures() {
            final var validation = registry.authorize("ak_test_unknown", "10.0.0.1", Set.of())
                    .await()
                    .indefinitely();

            assertEquals(CredentialFailureReason.NOT_FOUND, validation.reasonOrNull());
        }
    }

    private CredentialIssueResult limited(int rateLimit) {
        return registry.issue(new IssueCredentialRequest(
                        SUBJECT, "limited", Set.of("read"), Set.of(), rateLimit, ExpiryPolicy.NEVER))
                .await()
                .indefinitely();
    }

    private CredentialValidation authorize(String secret) {
        return registry.authorize(secret, "10.0.0.1", Set.of("read")).await().indefinitely();
    }

    @Nested
    @DisplayName("recordUsage")
    class RecordUsageTests {

        @Test
        @DisplayName("should increment usage and set last-used time")
        void shouldIncrementUsage() {
            final var id = issue(SUBJECT, "never").credential().id();

            registry.recordUsage(id).await().indefinitely();
            clock.advance(Duration.ofSeconds(30));
            registry.recordUsage(id).await().indefinitely();

            final var stored = repository.findById(id).await().indefinitely().orElseThrow();
            assertEquals(2, stored.usageCount());
            assertEquals(clock.instant(), stored.lastUsedAt());
        }

        @Test
        @DisplayName("should never fail when the store fails")
        void shouldSwallowStoreFailures() {
            final var failing = mock(CredentialRepository.class);
            when(failing.recordUsage(anyString(), any()))
                    .thenReturn(Uni.createFrom().failure(new IllegalStateException("down")));

            registryWith(failing).recordUsage("id-1").await().indefinitely();
        }

        @Test
        @DisplayName("should never fail when the store throws synchronously")
        void shouldSwallowSynchronousFailures() {
            final var failing = mock(CredentialRepository.class);
            when(failing.recordUsage(anyString(), any())).thenThrow(new IllegalStateException("down"));

            registryWith(failing).recordUsage("id-1").await().indefinitely();
        }
    }

    @Nested
    @DisplayName("revoke")
    class RevokeTests {

        @Test
        @DisplayName("should revoke an owned credential once and stay idempotent")
        void shouldRevokeIdempotently() {
            final var id = issue(SUBJECT, "never").credential().id();

            assertTrue(registry.revoke(id, SUBJECT).await().indefinitely());
            assertTrue(registry.revoke(id, SUBJECT).await().indefinitely());

            assertEquals(1, audit.eventsOf(AuditEvent.CredentialRevoked.class).size());
            assertFalse(repository.findById(id).await().indefinitely().orElseThrow().active());
        }

        @Test
        @DisplayName("should refuse to revoke another subject's credential")
        void shouldCheckOwnership() {
            final var id = issue(SUBJECT, "never").credential().id();

            assertFalse(registry.revoke(id, "intruder").await().indefinitely());
            assertTrue(repository.findById(id).await().indefinitely().orElseThrow().active());
            assertTrue(audit.eventsOf(AuditEvent.CredentialRevoked.class).isEmpty());
        }

        @Test
        @DisplayName("should report false for unknown credentials")
        void shouldReportUnknown() {
            assertFalse(registry.revoke("missing", SUBJECT).await().indefinitely());
        }
    }

    @Nested
    @DisplayName("listForSubject")
    class ListTests {

        @Test
        @DisplayName("should list only the subject's credentials, oldest first")
        void shouldListOldestFirst() {
            final var first = issue(SUBJECT, "never");
            clock.advance(Duration.ofMinutes(1));
            final var second = issue(SUBJECT, "never");
            issue("user-2", "never");

            final var listed = registry.listForSubject(SUBJECT).await().indefinitely();

            assertEquals(
                    List.of(first.credential().id(), second.credential().id()),
                    listed.stream().map(c -> c.id()).toList());
            assertEquals(first.credential().keyPrefix(), listed.get(0).keyPrefix());
        }

        @Test
        @DisplayName("should return an empty list for unknown subjects")
        void shouldReturnEmptyList() {
            assertTrue(registry.listForSubject("nobody").await().indefinitely().isEmpty());
        }
    }

    @Nested
    @DisplayName("sweepExpired")
    class SweepTests {

        @Test
        @DisplayName("should delete expired credentials only")
        void shouldDeleteExpired() {
            final var shortLived = issue(SUBJECT, "7d");
            final var longLived = issue(SUBJECT, "90d");
            clock.advance(Duration.ofDays(8));

            assertEquals(1, registry.sweepExpired().await().indefinitely());
            assertEquals(0, registry.sweepExpired().await().indefinitely());

            assertTrue(repository.findById(shortLived.credential().id()).await().indefinitely().isEmpty());
            assertTrue(repository.findById(longLived.credential().id()).await().indefinitely().isPresent());
            assertEquals(
                    CredentialFailureReason.NOT_FOUND,
                    registry.validate(shortLived.plaintextSecret()).await().indefinitely().reasonOrNull());
            assertEquals(1, audit.eventsOf(AuditEvent.CredentialsExpiredSwept.class).size());
        }

        @Test
        @DisplayName("scheduled sweep should swallow store failures")
        void scheduledSweepShouldRecover() {
            final var failing = mock(CredentialRepository.class);
            when(failing.deleteExpired(any()))
                    .thenReturn(Uni.createFrom().failure(new IllegalStateException("down")));

            registryWith(failing).scheduledSweep().await().indefinitely();
        }
    }
}
