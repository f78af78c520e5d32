package com.codelogickeep.agent.team.exception;

/**
 * Missing or invalid process configuration. Raised before any team is built and fatal
 * to the whole invocation.
 */
public class ConfigurationException extends OrchestrationException {

    public ConfigurationException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public ConfigurationException(ErrorCode errorCode, String message, String context) {
        super(errorCode, message, context);
    }

    public ConfigurationException(ErrorCode errorCode, String message, String context, Throwable cause) {
        super(errorCode, message, context, cause);
    }
}
