package warden.adapter.out.audit;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import warden.spi.AuditEvent;
import warden.spi.AuditEventHandler;

/**
 * Audit handler that records events as Micrometer metrics.
 *
 * <p>Built-in handler with priority 10.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code warden.audit.events.total} - all events by type and outcome</li>
 *   <li>{@code warden.audit.validation.failures} - rejected credentials and CSRF
 *       tokens by component and reason</li>
 * </ul>
 */
public class MetricsAuditEventHandler implements AuditEventHandler {

    private MeterRegistry registry;

    public MetricsAuditEventHandler() {
        // Default constructor for ServiceLoader
    }

    public MetricsAuditEventHandler(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Set the meter registry.
     *
     * <p>Called by the dispatcher after ServiceLoader instantiation.
     *
     * @param registry the Micrometer registry
     */
    public void setMeterRegistry(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public String name() {
        return "metrics";
    }

    @Override
    public String description() {
        return "Records audit events as Micrometer metrics";
    }

    @Override
    public int priority() {
        return 10;
    }

    @Override
    public boolean isAvailable() {
        return registry != null;
    }

    @Override
    public void handle(AuditEvent event) {
        if (registry == null) {
            return;
        }

        Counter.builder("warden.audit.events.total")
                .description("Total audit events")
                .tag("type", event.type())
                .tag("outcome", event.outcome())
                .register(registry)
                .increment();

        if (event instanceof AuditEvent.CredentialValidationFailed failed) {
            recordValidationFailure("credential", failed.reason());
        } else if (event instanceof AuditEvent.CsrfValidationFailed failed) {
            recordValidationFailure("csrf", failed.reason());
        }
    }

    private void recordValidationFailure(String component, String reason) {
        Counter.builder("warden.audit.validation.failures")
                .description("Rejected credentials and CSRF tokens")
                .tag("component", component)
                .tag("reason", reason != null ? reason : "unknown")
                .register(registry)
                .increment();
    }
}
