package warden.spi;

/**
 * Thrown when the credential backing store cannot complete an operation.
 *
 * <p>Wraps the underlying failure. Operations that fail this way have no
 * partial effect visible to the caller and are not retried.
 */
public class StorageUnavailableException extends RuntimeException {

    public StorageUnavailableException(String message) {
        super(message);
    }

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
