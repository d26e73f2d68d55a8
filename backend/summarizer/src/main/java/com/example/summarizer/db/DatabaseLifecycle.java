package com.example.summarizer.db;

import com.example.summarizer.config.Settings;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Startup and shutdown hooks for the database binding.
 * <p>
 * {@link #startup()} runs while the context refreshes, i.e. before the web
 * server starts accepting requests, so no handler can reach an unchecked pool.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DatabaseLifecycle {
    static final int VALIDATION_TIMEOUT_SECONDS = 5;

    private final DataSource dataSource;
    private final Settings settings;

    private volatile boolean started;

    @PostConstruct
    public void startup() {
        String url = DatabaseUrl.redact(settings.databaseUrl());
        try (Connection c = dataSource.getConnection()) {
            if (!c.isValid(VALIDATION_TIMEOUT_SECONDS)) {
                throw new DataAccessResourceFailureException("Database connection is not valid: " + url);
            }
            log.info("Database binding ready: {} {} at {}",
                    c.getMetaData().getDatabaseProductName(),
                    c.getMetaData().getDatabaseProductVersion(),
                    url);
        } catch (SQLException e) {
            throw new DataAccessResourceFailureException("Cannot connect to database " + url, e);
        }
        started = true;
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down database binding...");
    }

    public boolean isStarted() {
        return started;
    }
}
