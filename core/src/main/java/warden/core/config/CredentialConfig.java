package warden.core.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for API credential issuance and storage.
 *
 * <p>Configuration prefix: {@code warden.credentials}
 *
 * <h2>Example</h2>
 * <pre>
 * warden.credentials.max-active-per-subject=10
 * warden.credentials.environment-tag=live
 * warden.credentials.storage.provider=memory
 * warden.credentials.rate-limit.window=PT1M
 * </pre>
 */
@ConfigMapping(prefix = "warden.credentials")
public interface CredentialConfig {

    /**
     * Maximum number of simultaneously active credentials a subject may hold.
     *
     * @return the cap (default: 10)
     */
    @WithDefault("10")
    int maxActivePerSubject();

    /**
     * Rate limit stored on credentials issued without an explicit one.
     *
     * @return requests per window (default: 1000)
     */
    @WithDefault("1000")
    int defaultRateLimit();

    /**
     * Environment tag embedded in issued secrets ({@code ak_<tag>_...}).
     *
     * @return the tag (default: test)
     */
    @WithDefault("test")
    String environmentTag();

    /**
     * Interval between expired-credential sweeps.
     *
     * <p>Read by the scheduler through the property expression on the sweep job.
     *
     * @return sweep interval (default: 1 hour)
     */
    @WithDefault("1h")
    String sweepInterval();

    /**
     * Backing store configuration.
     */
    StorageConfig storage();

    /**
     * Per-credential request rate limiting.
     */
    RateLimitConfig rateLimit();

    /**
     * Rate limit enforcement configuration.
     *
     * <p>Each credential's own {@code rateLimit} is the number of requests
     * permitted per window.
     */
    interface RateLimitConfig {

        /**
         * Enforce credential rate limits during authorization.
         *
         * @return true if enabled (default: true)
         */
        @WithDefault("true")
        boolean enabled();

        /**
         * Length of each fixed counting window.
         *
         * @return window length (default: 1 minute)
         */
        @WithDefault("PT1M")
        Duration window();

        /**
         * Rate limiter provider name.
         *
         * <p>When empty, the highest priority available provider is used.
         *
         * @return provider name (optional)
         */
        Optional<String> provider();
    }

    /**
     * Credential storage configuration.
     */
    interface StorageConfig {

        /**
         * Storage provider name.
         *
         * <p>When empty, the highest priority available provider is used.
         *
         * @return provider name (optional)
         */
        Optional<String> provider();

        /**
         * Upper bound a caller should wait on store I/O before treating the
         * store as unavailable.
         *
         * @return timeout (default: 5 seconds)
         */
        @WithDefault("PT5S")
        Duration timeout();
    }
}
