package warden.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for CSRF token issuance.
 *
 * <p>Configuration prefix: {@code warden.csrf}
 */
@ConfigMapping(prefix = "warden.csrf")
public interface CsrfConfig {

    /**
     * Lifetime of an issued token.
     *
     * @return token TTL (default: 1 hour)
     */
    @WithDefault("PT1H")
    Duration tokenTtl();

    /**
     * Maximum number of subjects holding a live token.
     *
     * <p>When full, issuing for a new subject evicts the least recently
     * issued or validated token.
     *
     * @return capacity (default: 100000)
     */
    @WithDefault("100000")
    int maxTokens();

    /**
     * Interval between expired-token sweeps.
     *
     * @return sweep interval (default: 5 minutes)
     */
    @WithDefault("5m")
    String sweepInterval();
}
