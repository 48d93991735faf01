package warden.core.model.credential;

/**
 * Thrown when a subject already holds the maximum number of active credentials.
 *
 * <p>User-correctable: the caller should revoke an existing credential first.
 */
public class CredentialLimitExceededException extends RuntimeException {

    private final String userId;
    private final int limit;

    public CredentialLimitExceededException(String userId, int limit) {
        super("Maximum number of API keys reached (" + limit + ")");
        this.userId = userId;
        this.limit = limit;
    }

    public String userId() {
        return userId;
    }

    public int limit() {
        return limit;
    }
}
