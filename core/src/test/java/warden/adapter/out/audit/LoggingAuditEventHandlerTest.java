package warden.adapter.out.audit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import java.time.Instant;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import warden.spi.AuditEvent;

@DisplayName("LoggingAuditEventHandler")
class LoggingAuditEventHandlerTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

    @Test
    @DisplayName("should describe failures with their reason")
    void shouldIncludeReason() {
        final var context = LoggingAuditEventHandler.context(
                new AuditEvent.CredentialValidationFailed(NOW, null, "2cf24dba", "not_found"));

        assertEquals("failure", context.get("outcome"));
        assertEquals("2cf24dba", context.get("resource"));
        assertEquals("not_found", context.get("reason"));
        assertFalse(context.containsKey("subject"));
    }

    @Test
    @DisplayName("should include counts for bulk events")
    void shouldIncludeCounts() {
        final var context = LoggingAuditEventHandler.context(new AuditEvent.CredentialsExpiredSwept(NOW, 4));

        assertEquals(4, context.get("count"));
        assertEquals("2025-03-01T12:00:00Z", context.get("timestamp"));
    }

    @Test
    @DisplayName("should handle every event type without failing")
    void shouldHandleEveryEventType() {
        final var handler = new LoggingAuditEventHandler();

        handler.handle(new AuditEvent.CredentialIssued(NOW, "user-1", "id-1", "ak_test_2cf24dba..."));
        handler.handle(new AuditEvent.CredentialRevoked(NOW, "user-1", "id-1"));
        handler.handle(new AuditEvent.CsrfValidationFailed(NOW, "user-1", "expired"));
        handler.handle(new AuditEvent.SessionExpired(NOW, "thread-1"));
        handler.handle(new AuditEvent.SessionEvicted(NOW, "thread-2"));
        handler.handle(new AuditEvent.SessionCleared(NOW, "vault-1", 0));
    }
}
