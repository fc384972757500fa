package com.franchise.resolution.lookup;

/**
 * Thrown when the external franchise lookup fails (transport error, timeout,
 * authentication, unexpected status). Distinct from a "not found" answer,
 * which is returned as a negative {@link com.franchise.resolution.core.model.ResolutionResult}.
 */
public class LookupException extends RuntimeException {

    private final int statusCode;

    public LookupException(String message) {
        this(message, -1, null);
    }

    public LookupException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public LookupException(String message, int statusCode) {
        this(message, statusCode, null);
    }

    private LookupException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * HTTP status returned by the lookup service, or -1 if the failure was not an HTTP answer.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
