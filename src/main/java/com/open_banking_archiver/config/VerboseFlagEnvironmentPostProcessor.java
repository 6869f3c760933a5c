package com.open_banking_archiver.config;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.env.EnvironmentPostProcessor;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.MapPropertySource;

import java.util.Map;

/**
 * {@code --verbose} switches the {@code cli} log format to DEBUG. The {@code formatted} format only follows
 * {@code archiver.log-level}.
 */
public class VerboseFlagEnvironmentPostProcessor implements EnvironmentPostProcessor {

    static final String PROPERTY_SOURCE_NAME = "verboseFlag";

    @Override
    public void postProcessEnvironment(ConfigurableEnvironment environment, SpringApplication application) {
        String verbose = environment.getProperty("verbose");
        if (verbose == null || "false".equalsIgnoreCase(verbose)) {
            return;
        }
        if (!"cli".equalsIgnoreCase(environment.getProperty("archiver.log-format", "cli"))) {
            return;
        }
        environment.getPropertySources().addFirst(
                new MapPropertySource(PROPERTY_SOURCE_NAME, Map.of("archiver.log-level", "DEBUG")));
    }
}
