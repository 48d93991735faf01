package warden.adapter.out.audit;

import java.util.LinkedHashMap;
import java.util.Map;

import org.jboss.logging.Logger;

import warden.core.redaction.Redactor;
import warden.core.redaction.SanitizingLogger;
import warden.spi.AuditEvent;
import warden.spi.AuditEventHandler;

/**
 * Audit handler that writes each event as a structured, redacted log line.
 *
 * <p>Built-in handler with priority 0. Failures are logged at WARN, everything
 * else at INFO, under the {@code warden.audit} category.
 */
public class LoggingAuditEventHandler implements AuditEventHandler {

    private static final SanitizingLogger LOG =
            SanitizingLogger.getLogger("warden.audit", Redactor.defaults());

    @Override
    public String name() {
        return "logging";
    }

    @Override
    public String description() {
        return "Logs audit events using JBoss Logging";
    }

    @Override
    public int priority() {
        return 0;
    }

    @Override
    public void handle(AuditEvent event) {
        final var level = AuditEvent.FAILURE.equals(event.outcome()) ? Logger.Level.WARN : Logger.Level.INFO;
        LOG.event(level, event.type(), context(event));
    }

    static Map<String, Object> context(AuditEvent event) {
        final var context = new LinkedHashMap<String, Object>();
        context.put("timestamp", event.timestamp().toString());
        context.put("outcome", event.outcome());
        if (event.subjectId() != null) {
            context.put("subject", event.subjectId());
        }
        context.put("resource", event.resourceId());
        if (event instanceof AuditEvent.CredentialValidationFailed failed) {
            context.put("reason", failed.reason());
        } else if (event instanceof AuditEvent.CsrfValidationFailed failed) {
            context.put("reason", failed.reason());
        } else if (event instanceof AuditEvent.CredentialIssued issued) {
            context.put("display_prefix", issued.keyPrefix());
        } else if (event instanceof AuditEvent.CredentialsExpiredSwept swept) {
            context.put("count", swept.count());
        } else if (event instanceof AuditEvent.SessionCleared cleared) {
            context.put("count", cleared.count());
        }
        return context;
    }
}
