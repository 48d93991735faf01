package warden.core.redaction;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Recognizes structured-record keys whose values must never be logged.
 *
 * <p>Matching is a case-insensitive search anywhere in the key, so
 * {@code apiKey}, {@code X-Auth-Header} and {@code userPassword} all match.
 */
public final class SensitiveFieldMatcher {

    private static final List<Pattern> DEFAULT_PATTERNS = List.of(
            Pattern.compile("password", Pattern.CASE_INSENSITIVE),
            Pattern.compile("secret", Pattern.CASE_INSENSITIVE),
            Pattern.compile("token", Pattern.CASE_INSENSITIVE),
            Pattern.compile("key", Pattern.CASE_INSENSITIVE),
            Pattern.compile("api[-_]?key", Pattern.CASE_INSENSITIVE),
            Pattern.compile("auth", Pattern.CASE_INSENSITIVE),
            Pattern.compile("credential", Pattern.CASE_INSENSITIVE),
            Pattern.compile("private", Pattern.CASE_INSENSITIVE),
            Pattern.compile("ssn", Pattern.CASE_INSENSITIVE),
            Pattern.compile("credit[-_]?card", Pattern.CASE_INSENSITIVE));

    private static final SensitiveFieldMatcher DEFAULT = new SensitiveFieldMatcher(DEFAULT_PATTERNS);

    private final List<Pattern> patterns;

    public SensitiveFieldMatcher(List<Pattern> patterns) {
        this.patterns = List.copyOf(patterns);
    }

    public static SensitiveFieldMatcher defaults() {
        return DEFAULT;
    }

    /**
     * Check whether a field name denotes sensitive data.
     *
     * @param fieldName the record key (null never matches)
     * @return true if any pattern is found in the name
     */
    public boolean isSensitive(String fieldName) {
        if (fieldName == null) {
            return false;
        }
        for (final var pattern : patterns) {
            if (pattern.matcher(fieldName).find()) {
                return true;
            }
        }
        return false;
    }
}
