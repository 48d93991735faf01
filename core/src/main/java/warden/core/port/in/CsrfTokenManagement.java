package warden.core.port.in;

import warden.core.model.csrf.CsrfValidation;

/**
 * Port for per-subject CSRF tokens.
 */
public interface CsrfTokenManagement {

    /**
     * Issue a token for a subject, replacing any previous one.
     *
     * @param subjectId the subject
     * @return the token (64 hex characters)
     */
    String issue(String subjectId);

    /**
     * Check a supplied token against the subject's live token.
     *
     * @param subjectId the subject
     * @param token     the supplied token (may be null)
     * @return the outcome
     */
    CsrfValidation validate(String subjectId, String token);

    /**
     * Drop the subject's token, e.g. on logout.
     *
     * @param subjectId the subject
     * @return true if a token was removed
     */
    boolean invalidate(String subjectId);

    /**
     * Check whether requests with the given method must carry a CSRF token.
     *
     * @param httpMethod the request method
     * @return false for GET, HEAD and OPTIONS
     */
    boolean requiresValidation(String httpMethod);

    /**
     * Remove expired tokens.
     *
     * @return number of removed tokens
     */
    int sweepExpired();
}
