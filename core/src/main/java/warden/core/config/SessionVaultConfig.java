package warden.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for the ephemeral session vault.
 *
 * <p>Configuration prefix: {@code warden.session-vault}
 */
@ConfigMapping(prefix = "warden.session-vault")
public interface SessionVaultConfig {

    /**
     * Maximum number of threads held at once.
     *
     * @return capacity (default: 10)
     */
    @WithDefault("10")
    int maxThreads();

    /**
     * Inactivity window after which a thread is removed.
     *
     * @return expiration (default: 30 minutes)
     */
    @WithDefault("PT30M")
    Duration expiration();

    /**
     * Interval between inactivity sweeps.
     *
     * @return sweep interval (default: 60 seconds)
     */
    @WithDefault("60s")
    String sweepInterval();

    /**
     * Run payloads through the redactor before storing them.
     *
     * @return true if payloads are sanitized (default: true)
     */
    @WithDefault("true")
    boolean sanitizePayloads();
}
