package warden.spi;

/**
 * SPI for consuming audit events.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader} and
 * can forward events to SIEM pipelines, alerting or storage.
 *
 * <p>Built-in handlers:
 * <ul>
 *   <li>{@code logging} - writes a structured, redacted log line (priority 0)</li>
 *   <li>{@code metrics} - records Micrometer counters (priority 10)</li>
 * </ul>
 *
 * <p>Register implementations in:
 * {@code META-INF/services/warden.spi.AuditEventHandler}
 */
public interface AuditEventHandler {

    /**
     * Returns the unique name of this handler.
     *
     * @return handler name (e.g., "siem", "webhook")
     */
    String name();

    default String description() {
        return name() + " audit event handler";
    }

    /**
     * Returns the priority of this handler. Higher priority handlers are invoked first.
     *
     * @return priority value
     */
    default int priority() {
        return 0;
    }

    /**
     * Returns whether this handler should receive events.
     *
     * @return true if available
     */
    default boolean isAvailable() {
        return true;
    }

    /**
     * Handle an audit event.
     *
     * <p>Exceptions thrown here are logged by the dispatcher and do not
     * prevent other handlers from receiving the event.
     *
     * @param event the event
     */
    void handle(AuditEvent event);

    /**
     * Called during shutdown to release any resources.
     */
    default void close() {}
}
