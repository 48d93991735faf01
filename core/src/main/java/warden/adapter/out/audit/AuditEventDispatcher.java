package warden.adapter.out.audit;

import java.util.Comparator;
import java.util.List;
import java.util.ServiceLoader;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.MeterRegistry;

import warden.core.config.AuditConfig;
import warden.core.port.out.AuditSink;
import warden.core.redaction.SanitizingLogger;
import warden.spi.AuditEvent;
import warden.spi.AuditEventHandler;

/**
 * Default {@link AuditSink}: fans events out to registered handlers.
 *
 * <p>Handlers are discovered via {@link ServiceLoader} and invoked in priority order
 * (highest priority first). With {@code warden.audit.async=true} events are delivered
 * on a single background thread, preserving emission order, so that slow handlers
 * never block the caller. A failing handler is logged and skipped.
 *
 * <p>When auditing is disabled, events are silently dropped.
 */
@ApplicationScoped
public class AuditEventDispatcher implements AuditSink {

    private static final SanitizingLogger LOG = SanitizingLogger.getLogger(AuditEventDispatcher.class);

    private final MeterRegistry meterRegistry;
    private final boolean enabled;
    private final boolean async;

    private List<AuditEventHandler> handlers;
    private ExecutorService executor;

    @Inject
    public AuditEventDispatcher(AuditConfig config, MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.enabled = config != null && config.enabled();
        this.async = config != null && config.async();
    }

    @PostConstruct
    void init() {
        if (!enabled) {
            LOG.debugf("Auditing is disabled - audit dispatcher inactive");
            return;
        }

        final var loadedHandlers = ServiceLoader.load(AuditEventHandler.class).stream()
                .map(ServiceLoader.Provider::get)
                .toList();

        for (final var handler : loadedHandlers) {
            if (handler instanceof MetricsAuditEventHandler metricsHandler) {
                metricsHandler.setMeterRegistry(meterRegistry);
            }
        }

        handlers = loadedHandlers.stream()
                .filter(AuditEventHandler::isAvailable)
                .sorted(Comparator.comparingInt(AuditEventHandler::priority).reversed())
                .toList();

        if (handlers.isEmpty()) {
            LOG.warnf("No audit event handlers found - events will not be processed");
        } else {
            LOG.infof(
                    "Loaded %d audit event handler(s): %s",
                    handlers.size(),
                    handlers.stream()
                            .map(h -> h.name() + "(priority=" + h.priority() + ")")
                            .toList());
        }

        if (async) {
            executor = Executors.newSingleThreadExecutor(r -> {
                final var thread = new Thread(r, "audit-event-dispatcher");
                thread.setDaemon(true);
                return thread;
            });
        }
    }

    @PreDestroy
    void shutdown() {
        if (executor != null) {
            executor.shutdown();
        }
        if (handlers != null) {
            handlers.forEach(handler -> {
                try {
                    handler.close();
                } catch (Exception e) {
                    LOG.warnf(e, "Error closing audit handler %s", handler.name());
                }
            });
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Deliver an event to every available handler.
     *
     * @param event the event
     */
    @Override
    public void emit(AuditEvent event) {
        if (!enabled || handlers == null || handlers.isEmpty()) {
            return;
        }
        if (executor == null) {
            deliver(event);
            return;
        }
        try {
            executor.submit(() -> deliver(event));
        } catch (RejectedExecutionException e) {
            LOG.debugf("Audit event %s dropped after shutdown", event.type());
        }
    }

    public List<AuditEventHandler> getHandlers() {
        return handlers != null ? handlers : List.of();
    }

    private void deliver(AuditEvent event) {
        for (final var handler : handlers) {
            try {
                handler.handle(event);
            } catch (Exception e) {
                LOG.warnf(e, "Audit handler %s failed to process %s", handler.name(), event.type());
            }
        }
    }
}
