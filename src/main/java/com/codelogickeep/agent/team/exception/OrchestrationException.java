package com.codelogickeep.agent.team.exception;

/**
 * Base class for every error raised by the orchestration core.
 * Carries a structured error code, optional context and a suggestion for the operator.
 */
public class OrchestrationException extends RuntimeException {

    private final ErrorCode errorCode;
    private final String context;
    private final String suggestion;

    public OrchestrationException(ErrorCode errorCode, String message) {
        this(errorCode, message, null, null);
    }

    public OrchestrationException(ErrorCode errorCode, String message, String context) {
        this(errorCode, message, context, null);
    }

    public OrchestrationException(ErrorCode errorCode, String message, String context, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.context = context;
        this.suggestion = errorCode.getSuggestion();
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public String getContext() {
        return context;
    }

    public String getSuggestion() {
        return suggestion;
    }

    /**
     * Formats the error for display on the console: code, message, context and suggestion.
     */
    public String toDisplayMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("ERROR [").append(errorCode.getCode()).append("]: ").append(getMessage());

        if (context != null && !context.isEmpty()) {
            sb.append("\nContext: ").append(context);
        }

        if (suggestion != null && !suggestion.isEmpty()) {
            sb.append("\nSuggestion: ").append(suggestion);
        }

        return sb.toString();
    }

    @Override
    public String toString() {
        return toDisplayMessage();
    }

    /**
     * Error codes grouped by category.
     */
    public enum ErrorCode {
        // Reasoning backend errors (1xx)
        BACKEND_AUTH("E101", "Backend rejected the credentials", "Check the API key and its permissions."),
        BACKEND_QUOTA("E102", "Backend quota or rate limit exceeded", "Wait a moment or check the account quota, then ask again."),
        BACKEND_NETWORK("E103", "Backend could not be reached", "Check the network connection and the base URL."),
        BACKEND_TIMEOUT("E104", "Backend call timed out", "Increase llm.timeout or try a shorter question."),
        BACKEND_UNAVAILABLE("E105", "Backend reported a server error", "The provider is having trouble, try again later."),
        BACKEND_MALFORMED_RESPONSE("E106", "Backend response could not be understood", "Check that the protocol matches the endpoint."),
        BACKEND_CANCELLED("E107", "Backend call was cancelled", null),
        BACKEND_REQUEST_FAILED("E108", "Backend rejected the request", "Check the model name and request parameters."),

        // Configuration errors (2xx)
        CONFIG_NOT_FOUND("E201", "Configuration file not found", "Create an agent.yml or use --config to specify one."),
        CONFIG_INVALID("E202", "Invalid configuration", "Check the configuration file for syntax errors."),
        CONFIG_MISSING_FIELD("E203", "Required configuration field missing", "Ensure all required fields are set in agent.yml or on the command line."),

        // Conversation errors (3xx)
        CONVERSATION_ABORTED("E301", "Conversation aborted", "Rephrase the question or check the backend connection, then ask again."),
        CONVERSATION_CANCELLED("E302", "Conversation cancelled", null);

        private final String code;
        private final String description;
        private final String suggestion;

        ErrorCode(String code, String description, String suggestion) {
            this.code = code;
            this.description = description;
            this.suggestion = suggestion;
        }

        public String getCode() {
            return code;
        }

        public String getDescription() {
            return description;
        }

        public String getSuggestion() {
            return suggestion;
        }
    }
}
