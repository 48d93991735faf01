package warden.core.model.credential;

import java.time.Instant;
import java.time.ZoneOffset;

/**
 * Supported credential lifetimes.
 */
public enum ExpiryPolicy {
    NEVER("never"),
    SEVEN_DAYS("7d"),
    THIRTY_DAYS("30d"),
    NINETY_DAYS("90d"),
    ONE_YEAR("1y");

    private final String code;

    ExpiryPolicy(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * Resolve an expiry code.
     *
     * <p>A null or blank code means {@link #NEVER}; an unrecognized code falls
     * back to {@link #THIRTY_DAYS}.
     *
     * @param code the code (e.g. "7d")
     * @return the policy
     */
    public static ExpiryPolicy fromCode(String code) {
        if (code == null || code.isBlank()) {
            return NEVER;
        }
        for (final var policy : values()) {
            if (policy.code.equalsIgnoreCase(code.trim())) {
                return policy;
            }
        }
        return THIRTY_DAYS;
    }

    /**
     * Compute the expiry instant for a credential issued at {@code issuedAt}.
     *
     * <p>A year is one calendar year in UTC.
     *
     * @param issuedAt issuance time
     * @return the expiry, or null for {@link #NEVER}
     */
    public Instant expiresAt(Instant issuedAt) {
        return switch (this) {
            case NEVER -> null;
            case SEVEN_DAYS -> issuedAt.atOffset(ZoneOffset.UTC).plusDays(7).toInstant();
            case THIRTY_DAYS -> issuedAt.atOffset(ZoneOffset.UTC).plusDays(30).toInstant();
            case NINETY_DAYS -> issuedAt.atOffset(ZoneOffset.UTC).plusDays(90).toInstant();
            case ONE_YEAR -> issuedAt.atOffset(ZoneOffset.UTC).plusYears(1).toInstant();
        };
    }
}
