package warden.mock;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import warden.core.port.out.AuditSink;
import warden.spi.AuditEvent;

/**
 * Audit sink that keeps every emitted event for assertions.
 */
public class RecordingAuditSink implements AuditSink {

    private final List<AuditEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void emit(AuditEvent event) {
        events.add(event);
    }

    public List<AuditEvent> events() {
        return List.copyOf(events);
    }

    public List<String> types() {
        return events.stream().map(AuditEvent::type).toList();
    }

    public <T extends AuditEvent> List<T> eventsOf(Class<T> type) {
        return events.stream().filter(type::isInstance).map(type::cast).toList();
    }

    public void clear() {
        events.clear();
    }
}
