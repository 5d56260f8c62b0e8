package com.company.correlation.exception;

public class RuleConfigurationException extends RuntimeException {
    public RuleConfigurationException(String ruleName, String reason) {
        super("Invalid correlation rule '" + ruleName + "': " + reason);
    }

    public RuleConfigurationException(String ruleName, String reason, Throwable cause) {
        super("Invalid correlation rule '" + ruleName + "': " + reason, cause);
    }
}
