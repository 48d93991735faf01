package warden.core.service.credential;

import java.time.Duration;

import io.smallrye.mutiny.Uni;

import warden.core.redaction.SanitizingLogger;
import warden.spi.StorageUnavailableException;

/**
 * Applies the store timeout and failure translation to credential repository calls.
 *
 * <ul>
 *   <li>{@link #guarded} - fail-fast: any failure or timeout becomes a
 *       {@link StorageUnavailableException}.</li>
 *   <li>{@link #silent} - fire-and-forget: failures and timeouts are logged and
 *       the returned Uni completes normally.</li>
 * </ul>
 */
class StorageGuard {

    private static final SanitizingLogger LOG = SanitizingLogger.getLogger(StorageGuard.class);

    private final Duration timeout;

    StorageGuard(Duration timeout) {
        this.timeout = timeout;
    }

    <T> Uni<T> guarded(Uni<T> operation, String operationName) {
        return operation
                .ifNoItem()
                .after(timeout)
                .failWith(() -> new StorageUnavailableException(
                        "Credential store timed out during " + operationName + " after " + timeout))
                .onFailure(error -> !(error instanceof StorageUnavailableException))
                .transform(error -> {
                    LOG.warnf("Credential store failure during %s: %s", operationName, error.getMessage());
                    return new StorageUnavailableException("Credential store failed during " + operationName, error);
                });
    }

    <T> Uni<Void> silent(Uni<T> operation, String operationName) {
        return operation
                .ifNoItem()
                .after(timeout)
                .recoverWithItem(() -> {
                    LOG.warnf("Credential store timed out during %s after %s (ignored)", operationName, timeout);
                    return null;
                })
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnf("Credential store failure during %s (ignored): %s", operationName, error.getMessage());
                    return null;
                })
                .replaceWithVoid();
    }
}
