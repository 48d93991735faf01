package warden.core.redaction;

import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;

/**
 * JBoss Logging wrapper that passes every log line through a {@link Redactor}.
 *
 * <p>Format arguments are sanitized structurally, the formatted message is
 * sanitized again as text, and throwables are reduced to their redacted message
 * and type. Nothing reaches the underlying logger unredacted.
 *
 * <p>{@link #event} writes a single JSON line with a sanitized context map,
 * for log pipelines that index structured fields.
 */
public final class SanitizingLogger {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Logger delegate;
    private final Redactor redactor;

    private SanitizingLogger(Logger delegate, Redactor redactor) {
        this.delegate = delegate;
        this.redactor = redactor;
    }

    /**
     * Create a sanitizing logger backed by the default redaction rules.
     *
     * @param type the logging category
     * @return the logger
     */
    public static SanitizingLogger getLogger(Class<?> type) {
        return new SanitizingLogger(Logger.getLogger(type), Redactor.defaults());
    }

    /**
     * Create a sanitizing logger for a named category.
     *
     * @param category the logging category
     * @param redactor the redactor to apply
     * @return the logger
     */
    public static SanitizingLogger getLogger(String category, Redactor redactor) {
        return new SanitizingLogger(Logger.getLogger(category), redactor);
    }

    public boolean isDebugEnabled() {
        return delegate.isDebugEnabled();
    }

    public void debugf(String format, Object... params) {
        logf(Logger.Level.DEBUG, null, format, params);
    }

    public void infof(String format, Object... params) {
        logf(Logger.Level.INFO, null, format, params);
    }

    public void warnf(String format, Object... params) {
        logf(Logger.Level.WARN, null, format, params);
    }

    public void warnf(Throwable error, String format, Object... params) {
        logf(Logger.Level.WARN, error, format, params);
    }

    public void errorf(Throwable error, String format, Object... params) {
        logf(Logger.Level.ERROR, error, format, params);
    }

    /**
     * Write a structured log line.
     *
     * @param level   log level
     * @param message event message
     * @param context fields to include; sensitive keys are redacted
     */
    public void event(Logger.Level level, String message, Map<String, ?> context) {
        if (!delegate.isEnabled(level)) {
            return;
        }
        final var line = new LinkedHashMap<String, Object>();
        line.put("message", redactor.sanitizeString(message));
        if (context != null) {
            line.put("context", redactor.sanitizeValue(context));
        }
        try {
            delegate.log(level, MAPPER.writeValueAsString(line));
        } catch (JsonProcessingException e) {
            delegate.logf(level, "%s (context not serializable: %s)", line.get("message"), e.getOriginalMessage());
        }
    }

    private void logf(Logger.Level level, Throwable error, String format, Object... params) {
        if (!delegate.isEnabled(level)) {
            return;
        }
        final var sanitizedParams = new Object[params.length];
        for (var i = 0; i < params.length; i++) {
            sanitizedParams[i] = sanitizeParam(params[i]);
        }
        var message = redactor.sanitizeString(String.format(format, sanitizedParams));
        if (error != null) {
            message = message + " [" + describe(error) + "]";
        }
        delegate.log(level, message);
    }

    private Object sanitizeParam(Object param) {
        if (param == null || param instanceof Number || param instanceof Boolean || param instanceof Enum<?>) {
            return param;
        }
        if (param instanceof Throwable error) {
            return describe(error);
        }
        return String.valueOf(redactor.sanitizeValue(param));
    }

    private String describe(Throwable error) {
        final var sanitized = (Map<?, ?>) redactor.sanitizeValue(error);
        return sanitized.get("name") + ": " + sanitized.get("message");
    }
}
