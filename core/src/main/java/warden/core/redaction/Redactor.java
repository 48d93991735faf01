package warden.core.redaction;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import warden.core.config.RedactionConfig;

/**
 * Sanitizes strings and structured values before they leave the process.
 *
 * <p>String content is rewritten by the {@link RedactionRules} table. Structured
 * values (maps, collections, arrays, Jackson trees, exceptions) are walked
 * recursively; any map key recognized by the {@link SensitiveFieldMatcher} has
 * its value replaced wholesale with {@value #REDACTED} without inspecting it.
 *
 * <p>Instances hold no mutable state and are safe for concurrent use.
 */
@ApplicationScoped
public class Redactor {

    public static final String REDACTED = "[REDACTED]";

    static final String TRUNCATED = "[TRUNCATED]";
    private static final int MAX_DEPTH = 32;
    private static final Redactor DEFAULT =
            new Redactor(RedactionRules.defaults(), SensitiveFieldMatcher.defaults(), false);

    private final RedactionRules rules;
    private final SensitiveFieldMatcher fieldMatcher;
    private final boolean includeStackTraces;

    @Inject
    public Redactor(RedactionConfig config) {
        this(RedactionRules.defaults(), SensitiveFieldMatcher.defaults(), config.includeStackTraces());
    }

    public Redactor(RedactionRules rules, SensitiveFieldMatcher fieldMatcher, boolean includeStackTraces) {
        this.rules = rules;
        this.fieldMatcher = fieldMatcher;
        this.includeStackTraces = includeStackTraces;
    }

    /**
     * Return a redactor with the built-in rules that never emits stack traces.
     *
     * @return the shared default redactor
     */
    public static Redactor defaults() {
        return DEFAULT;
    }

    /**
     * Redact sensitive tokens inside free text.
     *
     * @param input the text (null is returned unchanged)
     * @return the redacted text
     */
    public String sanitizeString(String input) {
        if (input == null || input.isEmpty()) {
            return input;
        }
        return rules.apply(input);
    }

    /**
     * Redact a structured value.
     *
     * <p>Exceptions become a map of {@code message} and {@code name} (plus
     * {@code stack} when stack traces are enabled). Values of unrecognized
     * types are returned as-is.
     *
     * @param value the value to sanitize
     * @return a sanitized copy; the input is never modified
     */
    public Object sanitizeValue(Object value) {
        return sanitize(value, 0);
    }

    /**
     * Check whether a record key would be redacted wholesale.
     *
     * @param fieldName the key
     * @return true if the key is sensitive
     */
    public boolean isSensitiveField(String fieldName) {
        return fieldMatcher.isSensitive(fieldName);
    }

    private Object sanitize(Object value, int depth) {
        if (value == null) {
            return null;
        }
        if (depth > MAX_DEPTH) {
            return TRUNCATED;
        }
        if (value instanceof CharSequence text) {
            return sanitizeString(text.toString());
        }
        if (value instanceof Throwable error) {
            return sanitizeThrowable(error);
        }
        if (value instanceof JsonNode node) {
            return sanitizeNode(node, depth);
        }
        if (value instanceof Map<?, ?> map) {
            final var sanitized = new LinkedHashMap<String, Object>();
            map.forEach((key, entryValue) -> {
                final var name = String.valueOf(key);
                sanitized.put(name, fieldMatcher.isSensitive(name) ? REDACTED : sanitize(entryValue, depth + 1));
            });
            return sanitized;
        }
        if (value instanceof Collection<?> collection) {
            final var sanitized = new ArrayList<Object>(collection.size());
            for (final var item : collection) {
                sanitized.add(sanitize(item, depth + 1));
            }
            return sanitized;
        }
        if (value instanceof Object[] array) {
            final var sanitized = new ArrayList<Object>(array.length);
            for (final var item : array) {
                sanitized.add(sanitize(item, depth + 1));
            }
            return sanitized;
        }
        return value;
    }

    private Map<String, Object> sanitizeThrowable(Throwable error) {
        final var sanitized = new LinkedHashMap<String, Object>();
        sanitized.put("message", sanitizeString(error.getMessage()));
        sanitized.put("name", error.getClass().getName());
        if (includeStackTraces) {
            final var writer = new StringWriter();
            error.printStackTrace(new PrintWriter(writer));
            sanitized.put("stack", sanitizeString(writer.toString()));
        }
        return sanitized;
    }

    private JsonNode sanitizeNode(JsonNode node, int depth) {
        final var factory = JsonNodeFactory.instance;
        if (depth > MAX_DEPTH) {
            return factory.textNode(TRUNCATED);
        }
        if (node.isTextual()) {
            return factory.textNode(sanitizeString(node.asText()));
        }
        if (node.isObject()) {
            final ObjectNode sanitized = factory.objectNode();
            node.fields().forEachRemaining(field -> sanitized.set(
                    field.getKey(),
                    fieldMatcher.isSensitive(field.getKey())
                            ? factory.textNode(REDACTED)
                            : sanitizeNode(field.getValue(), depth + 1)));
            return sanitized;
        }
        if (node.isArray()) {
            final ArrayNode sanitized = factory.arrayNode();
            node.forEach(item -> sanitized.add(sanitizeNode(item, depth + 1)));
            return sanitized;
        }
        return node;
    }

    List<String> ruleNames() {
        return rules.rules().stream().map(RedactionRule::name).toList();
    }
}
