package com.example.summarizer.config;

/**
 * Raised when a configuration variable is missing or cannot be coerced.
 */
public class SettingsException extends RuntimeException {

    private final String variable;

    public SettingsException(String variable, String message) {
        super(variable + ": " + message);
        this.variable = variable;
    }

    public String getVariable() {
        return variable;
    }
}
