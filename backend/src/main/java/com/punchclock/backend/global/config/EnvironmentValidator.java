package com.punchclock.backend.global.config;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Fails startup when required settings are missing or unusable.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    private static final String[] REQUIRED_PROPERTIES = {
            "spring.datasource.url",
            "app.attendance.default-zone",
            "app.attendance.expected-seconds-per-weekday"
    };

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = validate();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Invalid configuration: {}", problem));
            throw new IllegalStateException("Configuration validation failed: " + String.join("; ", problems));
        }
        log.info("Configuration validated");
    }

    List<String> validate() {
        List<String> problems = new ArrayList<>();

        for (String property : REQUIRED_PROPERTIES) {
            Optional<String> value = Optional.ofNullable(environment.getProperty(property));
            if (value.map(String::trim).orElse("").isEmpty()) {
                problems.add(property + " is missing");
            }
        }

        String zone = environment.getProperty("app.attendance.default-zone");
        if (zone != null && !zone.isBlank()) {
            try {
                ZoneId.of(zone.trim());
            } catch (DateTimeException e) {
                problems.add("app.attendance.default-zone: unknown zone id '" + zone + "'");
            }
        }

        String expected = environment.getProperty("app.attendance.expected-seconds-per-weekday");
        if (expected != null && !expected.isBlank()) {
            try {
                long seconds = Long.parseLong(expected.trim());
                if (seconds < 0 || seconds > 86_400) {
                    problems.add("app.attendance.expected-seconds-per-weekday: must be within 0-86400");
                }
            } catch (NumberFormatException e) {
                problems.add("app.attendance.expected-seconds-per-weekday: must be a number");
            }
        }

        return problems;
    }
}
