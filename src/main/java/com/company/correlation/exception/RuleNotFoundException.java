package com.company.correlation.exception;

public class RuleNotFoundException extends RuntimeException {
    public RuleNotFoundException(String ruleName) {
        super("Correlation rule not found: " + ruleName);
    }
}
