package warden.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration prefix: {@code warden.redaction}
 */
@ConfigMapping(prefix = "warden.redaction")
public interface RedactionConfig {

    /**
     * Include sanitized stack traces when exceptions are redacted.
     *
     * <p>Leave disabled in production.
     *
     * @return true to include stack traces (default: false)
     */
    @WithDefault("false")
    boolean includeStackTraces();
}
