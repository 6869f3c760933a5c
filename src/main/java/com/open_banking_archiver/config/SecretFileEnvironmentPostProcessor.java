package com.open_banking_archiver.config;

import org.apache.commons.logging.Log;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.env.EnvironmentPostProcessor;
import org.springframework.boot.logging.DeferredLogFactory;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.MapPropertySource;
import org.springframework.core.env.StandardEnvironment;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Lets every {@code NAME} environment variable be given as a file instead, through {@code NAME_FILE}
 * (Docker / Kubernetes secrets). The file content wins over a plain {@code NAME} variable.
 */
public class SecretFileEnvironmentPostProcessor implements EnvironmentPostProcessor {

    static final String PROPERTY_SOURCE_NAME = "secretFiles";
    private static final String SUFFIX = "_FILE";

    private final Log log;

    public SecretFileEnvironmentPostProcessor(DeferredLogFactory logFactory) {
        this.log = logFactory.getLog(SecretFileEnvironmentPostProcessor.class);
    }

    @Override
    public void postProcessEnvironment(ConfigurableEnvironment environment, SpringApplication application) {
        Map<String, Object> secrets = readSecretFiles(environment.getSystemEnvironment());
        if (secrets.isEmpty()) {
            return;
        }
        log.debug("Read " + secrets.keySet() + " from *_FILE secret files");
        environment.getPropertySources().addBefore(
                StandardEnvironment.SYSTEM_ENVIRONMENT_PROPERTY_SOURCE_NAME,
                new MapPropertySource(PROPERTY_SOURCE_NAME, secrets));
    }

    static Map<String, Object> readSecretFiles(Map<String, Object> env) {
        Map<String, Object> secrets = new LinkedHashMap<>();
        env.forEach((name, value) -> {
            if (!name.endsWith(SUFFIX) || name.length() == SUFFIX.length() || value == null) {
                return;
            }
            Path path = Path.of(value.toString());
            try {
                // Secret files usually end with a newline that is not part of the secret
                secrets.put(name.substring(0, name.length() - SUFFIX.length()),
                        Files.readString(path, StandardCharsets.UTF_8).stripTrailing());
            } catch (IOException e) {
                throw new IllegalStateException("Cannot read " + name + " secret file " + path, e);
            }
        });
        return secrets;
    }
}
