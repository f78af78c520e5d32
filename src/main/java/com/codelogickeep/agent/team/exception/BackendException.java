package com.codelogickeep.agent.team.exception;

/**
 * Failure of a reasoning backend call: auth, quota, network, timeout or a response that
 * could not be parsed. Never retried by the scheduler.
 */
public class BackendException extends OrchestrationException {

    public BackendException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public BackendException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, null, cause);
    }

    public BackendException(ErrorCode errorCode, String message, String context, Throwable cause) {
        super(errorCode, message, context, cause);
    }

    /**
     * Maps an HTTP status code returned by a provider to a backend error.
     */
    public static BackendException fromStatus(int statusCode, String body) {
        ErrorCode code;
        if (statusCode == 401 || statusCode == 403) {
            code = ErrorCode.BACKEND_AUTH;
        } else if (statusCode == 429) {
            code = ErrorCode.BACKEND_QUOTA;
        } else if (statusCode == 408) {
            code = ErrorCode.BACKEND_TIMEOUT;
        } else if (statusCode >= 500) {
            code = ErrorCode.BACKEND_UNAVAILABLE;
        } else {
            code = ErrorCode.BACKEND_REQUEST_FAILED;
        }
        return new BackendException(code, "API error: " + statusCode, truncate(body), null);
    }

    public boolean isCancellation() {
        return getErrorCode() == ErrorCode.BACKEND_CANCELLED;
    }

    private static String truncate(String body) {
        if (body == null) {
            return null;
        }
        return body.length() > 500 ? body.substring(0, 500) + "..." : body;
    }
}
