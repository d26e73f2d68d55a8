package com.example.summarizer.db;

import com.example.summarizer.config.Settings;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * Points the ORM at {@link Settings#databaseUrl()}. JPA and Flyway
 * auto-configuration pick up this pool instead of {@code spring.datasource.*}.
 */
@Slf4j
@Configuration
public class DatabaseConfig {

    @Bean(destroyMethod = "close")
    DataSource dataSource(Settings settings) {
        DatabaseUrl url = DatabaseUrl.parse(settings.databaseUrl());
        log.info("Binding database {} (environment={})", DatabaseUrl.redact(url.jdbcUrl()), settings.environment());

        HikariDataSource ds = new HikariDataSource();
        ds.setPoolName("summarizer-" + settings.environment());
        ds.setJdbcUrl(url.jdbcUrl());
        if (url.username() != null) ds.setUsername(url.username());
        if (url.password() != null) ds.setPassword(url.password());
        return ds;
    }
}
