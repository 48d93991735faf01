package warden.core.port.out;

import warden.spi.AuditEvent;

/**
 * Port for emitting security audit events.
 *
 * <p>Implementations must not block the caller on slow consumers and must not
 * propagate handler failures.
 */
public interface AuditSink {

    void emit(AuditEvent event);
}
