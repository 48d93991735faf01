package warden.core.redaction;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Ordered table of string redaction rules.
 *
 * <p>New sensitive token formats are added here (or via {@link #with}) and are
 * picked up by every {@link Redactor} built from the table.
 */
public final class RedactionRules {

    private static final RedactionRules DEFAULTS = new RedactionRules(List.of(
            RedactionRule.fixed("live-key", "\\b(ak_[a-zA-Z0-9_-]{20,})\\b", "ak_[REDACTED]"),
            RedactionRule.fixed("secret-key", "\\b(sk_[a-zA-Z0-9_-]{20,})\\b", "sk_[REDACTED]"),
            RedactionRule.fixed("public-key", "\\b(pk_[a-zA-Z0-9_-]{20,})\\b", "pk_[REDACTED]"),
            RedactionRule.fixed(
                    "jwt", "\\beyJ[a-zA-Z0-9_-]+\\.[a-zA-Z0-9_-]+\\.[a-zA-Z0-9_-]+\\b", "[JWT_REDACTED]"),
            new RedactionRule(
                    "email",
                    Pattern.compile("(?<![@\\w.%+-])([a-zA-Z0-9._%+-]+)@([a-zA-Z0-9.-]+\\.[a-zA-Z]{2,})"),
                    match -> "[EMAIL]@" + match.group(2)),
            RedactionRule.fixed("credit-card", "\\b\\d{4}[\\s-]?\\d{4}[\\s-]?\\d{4}[\\s-]?\\d{4}\\b", "[CC_REDACTED]"),
            RedactionRule.fixed("ssn", "\\b\\d{3}-\\d{2}-\\d{4}\\b", "[SSN_REDACTED]"),
            new RedactionRule(
                    "ipv4",
                    Pattern.compile("\\b(\\d{1,3})\\.(\\d{1,3})\\.(\\d{1,3})\\.(\\d{1,3})\\b"),
                    match -> match.group(1) + "." + match.group(2) + ".[REDACTED].[REDACTED]")));

    private final List<RedactionRule> rules;

    private RedactionRules(List<RedactionRule> rules) {
        this.rules = List.copyOf(rules);
    }

    /**
     * Return the built-in rule table: prefixed bearer keys, JWTs, email
     * addresses, card numbers, SSNs and IPv4 addresses.
     *
     * @return the default rules
     */
    public static RedactionRules defaults() {
        return DEFAULTS;
    }

    /**
     * Create a rule table from an explicit list.
     *
     * @param rules rules in application order
     * @return the table
     */
    public static RedactionRules of(List<RedactionRule> rules) {
        return new RedactionRules(rules);
    }

    /**
     * Return a copy of this table with an additional rule appended.
     *
     * @param rule the rule to add
     * @return a new table
     */
    public RedactionRules with(RedactionRule rule) {
        final var extended = new ArrayList<>(rules);
        extended.add(rule);
        return new RedactionRules(extended);
    }

    public List<RedactionRule> rules() {
        return rules;
    }

    /**
     * Apply every rule in order.
     *
     * @param input text to redact
     * @return redacted text
     */
    public String apply(String input) {
        var result = input;
        for (final var rule : rules) {
            result = rule.apply(result);
        }
        return result;
    }
}
