package com.example.summarizer.config;

import lombok.extern.slf4j.Slf4j;

import java.util.Locale;
import java.util.Optional;

/**
 * Builds {@link Settings} from environment variables.
 * <p>
 * The first {@link #resolve()} constructs the value; later calls on the same
 * resolver return that identical instance.
 */
@Slf4j
public class SettingsResolver {

    public static final String ENVIRONMENT = "ENVIRONMENT";
    public static final String TESTING = "TESTING";
    public static final String DATABASE_URL = "DATABASE_URL";

    private final EnvironmentReader env;
    private volatile Settings resolved;

    public SettingsResolver(EnvironmentReader env) {
        this.env = env;
    }

    public Settings resolve() {
        Settings s = resolved;
        if (s == null) {
            synchronized (this) {
                s = resolved;
                if (s == null) {
                    log.info("Loading configuration...");
                    s = new Settings(
                            text(ENVIRONMENT).orElse(Settings.DEFAULT_ENVIRONMENT),
                            text(TESTING).map(v -> parseFlag(TESTING, v)).orElse(false),
                            text(DATABASE_URL).orElse(null));
                    resolved = s;
                }
            }
        }
        return s;
    }

    private Optional<String> text(String key) {
        return env.get(key).map(String::trim).filter(v -> !v.isEmpty());
    }

    static boolean parseFlag(String key, String value) {
        switch (value.toLowerCase(Locale.ROOT)) {
            case "true": case "1": case "yes": case "on":
                return true;
            case "false": case "0": case "no": case "off":
                return false;
            default:
                throw new SettingsException(key, "not a boolean: '" + value + "'");
        }
    }
}
