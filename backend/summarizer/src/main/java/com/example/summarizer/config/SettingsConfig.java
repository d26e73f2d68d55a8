package com.example.summarizer.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.util.Optional;

@Configuration
public class SettingsConfig {

    // OS variables, system properties and test overrides all resolve here
    @Bean
    SettingsResolver settingsResolver(Environment environment) {
        return new SettingsResolver(key -> Optional.ofNullable(environment.getProperty(key)));
    }

    @Bean
    Settings settings(SettingsResolver resolver) {
        return resolver.resolve();
    }
}
