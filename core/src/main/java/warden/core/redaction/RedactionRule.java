package warden.core.redaction;

import java.util.function.Function;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A single string-content redaction: every match of {@code pattern} is replaced.
 *
 * <p>Rules in a {@link RedactionRules} table must target disjoint token formats
 * and their replacements must not match any rule again, so that the table can be
 * applied in any order and re-applied without further change.
 *
 * @param name     short identifier used in diagnostics (e.g. "jwt")
 * @param pattern  the token format to find
 * @param replacer produces the literal replacement for a match
 */
public record RedactionRule(String name, Pattern pattern, Function<MatchResult, String> replacer) {

    public RedactionRule {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Rule name cannot be null or blank");
        }
        if (pattern == null || replacer == null) {
            throw new IllegalArgumentException("Rule pattern and replacer are required");
        }
    }

    /**
     * Create a rule that replaces every match with a fixed marker.
     *
     * @param name   rule name
     * @param regex  pattern source
     * @param marker literal replacement
     * @return the rule
     */
    public static RedactionRule fixed(String name, String regex, String marker) {
        return new RedactionRule(name, Pattern.compile(regex), match -> marker);
    }

    /**
     * Apply this rule to the input.
     *
     * @param input text to redact
     * @return text with every match replaced
     */
    public String apply(String input) {
        final var matcher = pattern.matcher(input);
        if (!matcher.find()) {
            return input;
        }
        matcher.reset();
        return matcher.replaceAll(match -> Matcher.quoteReplacement(replacer.apply(match)));
    }
}
