package com.example.summarizer.config;

import java.util.Optional;

/**
 * Looks up a named variable from whatever backs the process configuration.
 */
@FunctionalInterface
public interface EnvironmentReader {

    Optional<String> get(String key);
}
