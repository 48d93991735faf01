package warden.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for audit event dispatch.
 *
 * <p>Configuration prefix: {@code warden.audit}
 */
@ConfigMapping(prefix = "warden.audit")
public interface AuditConfig {

    /**
     * Dispatch audit events to handlers.
     *
     * <p>When disabled, events are dropped.
     *
     * @return true if enabled (default: true)
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * Deliver events on a background thread instead of the caller's.
     *
     * @return true for asynchronous delivery (default: true)
     */
    @WithDefault("true")
    boolean async();
}
