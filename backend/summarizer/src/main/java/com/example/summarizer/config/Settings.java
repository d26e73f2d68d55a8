package com.example.summarizer.config;

import com.example.summarizer.db.DatabaseUrl;

/**
 * Immutable process configuration.
 *
 * @param environment deployment name, {@code dev} unless overridden
 * @param testing     whether the process runs under a test harness
 * @param databaseUrl connection string the ORM is bound to
 */
public record Settings(String environment, boolean testing, String databaseUrl) {

    public static final String DEFAULT_ENVIRONMENT = "dev";

    public Settings {
        if (environment == null || environment.isBlank()) {
            environment = DEFAULT_ENVIRONMENT;
        }
        if (databaseUrl == null || databaseUrl.isBlank()) {
            throw new SettingsException(SettingsResolver.DATABASE_URL, "required but not set");
        }
    }

    @Override
    public String toString() {
        return "Settings[environment=" + environment
                + ", testing=" + testing
                + ", databaseUrl=" + DatabaseUrl.redact(databaseUrl) + "]";
    }
}
