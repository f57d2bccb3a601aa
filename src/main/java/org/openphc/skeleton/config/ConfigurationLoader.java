package org.openphc.skeleton.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the {@link AppConfiguration} snapshot: .env overrides → environment variables →
 * config/&lt;environment&gt;.json → validation. Any failure is a {@link ConfigurationException}.
 */
@Slf4j
public class ConfigurationLoader {

    static final String ENV_FILE = ".env";
    static final String CONFIG_DIRECTORY = "config";
    static final String ENVIRONMENT_VARIABLE = "APP_ENV";

    private static final List<String> REQUIRED_KEYS = List.of("port", "databaseUrl", "jwtSecret");
    private static final List<String> DATABASE_SCHEMES = List.of("mongodb://", "postgres://");

    private static final Map<String, String> ENVIRONMENT_KEYS = new LinkedHashMap<>();

    static {
        ENVIRONMENT_KEYS.put("PORT", "port");
        ENVIRONMENT_KEYS.put("HOST", "host");
        ENVIRONMENT_KEYS.put("DATABASE_URL", "databaseUrl");
        ENVIRONMENT_KEYS.put("JWT_SECRET", "jwtSecret");
        ENVIRONMENT_KEYS.put("JWT_EXPIRATION", "jwtExpiration");
        ENVIRONMENT_KEYS.put("SESSION_SECRET", "sessionSecret");
        ENVIRONMENT_KEYS.put("SSL_ENABLED", "sslEnabled");
    }

    private final Path baseDirectory;
    private final Map<String, String> environment;
    private final ObjectMapper objectMapper;

    public ConfigurationLoader(Path baseDirectory, Map<String, String> environment, ObjectMapper objectMapper) {
        this.baseDirectory = baseDirectory;
        this.environment = environment;
        this.objectMapper = objectMapper;
    }

    /**
     * Loader bound to the process working directory and environment.
     */
    public static ConfigurationLoader forCurrentProcess() {
        return new ConfigurationLoader(Path.of("").toAbsolutePath(), System.getenv(), new ObjectMapper());
    }

    public AppConfiguration load() {
        Map<String, String> effectiveEnvironment = new HashMap<>(environment);
        effectiveEnvironment.putAll(readEnvFile());

        String environmentName = effectiveEnvironment.get(ENVIRONMENT_VARIABLE);
        if (environmentName == null || environmentName.isBlank()) {
            environmentName = AppConfiguration.DEVELOPMENT;
        }

        Map<String, Object> values = new LinkedHashMap<>();
        ENVIRONMENT_KEYS.forEach((variable, key) -> {
            String value = effectiveEnvironment.get(variable);
            if (value != null && !value.isBlank()) {
                values.put(key, value);
            }
        });
        values.putAll(readEnvironmentFile(environmentName));

        validate(values);

        log.info("Configuration loaded for environment '{}'", environmentName);
        return AppConfiguration.of(environmentName, values);
    }

    /**
     * Parse the optional flat key=value override file. Absent file is not an error.
     */
    Map<String, String> readEnvFile() {
        Path envPath = baseDirectory.resolve(ENV_FILE);
        if (Files.notExists(envPath)) {
            log.warn(".env file not found, using process environment variables");
            return Map.of();
        }

        List<String> lines;
        try {
            lines = Files.readAllLines(envPath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read .env file: " + e.getMessage(), e);
        }

        Map<String, String> overrides = new LinkedHashMap<>();
        for (String line : lines) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            int separator = trimmed.indexOf('=');
            String key = separator < 0 ? trimmed : trimmed.substring(0, separator).trim();
            String value = separator < 0 ? "" : trimmed.substring(separator + 1).trim().replaceAll("['\"]", "");
            overrides.put(key, value);
        }
        return overrides;
    }

    /**
     * Read config/&lt;environment&gt;.json. Absent file falls back to environment variables;
     * malformed content is fatal.
     */
    Map<String, Object> readEnvironmentFile(String environmentName) {
        Path configPath = baseDirectory.resolve(CONFIG_DIRECTORY).resolve(environmentName + ".json");
        if (Files.notExists(configPath)) {
            log.warn("Configuration file for '{}' not found at {}", environmentName, configPath);
            return Map.of();
        }

        try {
            JsonNode root = objectMapper.readTree(configPath.toFile());
            if (root == null || !root.isObject()) {
                throw new ConfigurationException(
                        "Failed to load environment configuration: " + configPath + " must contain a JSON object");
            }
            return objectMapper.convertValue(root, new TypeReference<LinkedHashMap<String, Object>>() {});
        } catch (JsonProcessingException e) {
            throw new ConfigurationException(
                    "Failed to load environment configuration: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ConfigurationException(
                    "Failed to load environment configuration: " + e.getMessage(), e);
        }
    }

    void validate(Map<String, Object> values) {
        List<String> missing = new ArrayList<>();
        for (String key : REQUIRED_KEYS) {
            if (isBlank(values.get(key))) {
                missing.add(key);
            }
        }
        if (!missing.isEmpty()) {
            throw new ConfigurationException("Incomplete configuration. Missing: " + String.join(", ", missing));
        }

        if (!isValidPort(values.get("port"))) {
            throw new ConfigurationException("Invalid port. Must be between 1 and 65535");
        }

        if (!(values.get("databaseUrl") instanceof String databaseUrl)
                || DATABASE_SCHEMES.stream().noneMatch(databaseUrl::startsWith)) {
            throw new ConfigurationException("Invalid database URL. Must be MongoDB or PostgreSQL");
        }

        if (!(values.get("jwtSecret") instanceof String)) {
            throw new ConfigurationException("Invalid jwtSecret. Must be a string");
        }

        Object jwtExpiration = values.get("jwtExpiration");
        if (jwtExpiration != null && !isWholeSeconds(jwtExpiration)) {
            throw new ConfigurationException("jwtExpiration must be a valid number");
        }
    }

    private static boolean isBlank(Object value) {
        return value == null || (value instanceof String s && s.isBlank());
    }

    private static boolean isValidPort(Object value) {
        long port;
        if (value instanceof Number n) {
            if (n.doubleValue() != Math.rint(n.doubleValue())) {
                return false;
            }
            port = n.longValue();
        } else {
            try {
                port = Long.parseLong(String.valueOf(value).trim());
            } catch (NumberFormatException e) {
                return false;
            }
        }
        return port >= 1 && port <= 65535;
    }

    /**
     * Finite whole number of seconds within int range; rejects NaN, infinities, fractions and suffixes.
     */
    private static boolean isWholeSeconds(Object value) {
        try {
            new BigDecimal(String.valueOf(value).trim()).intValueExact();
            return true;
        } catch (NumberFormatException | ArithmeticException e) {
            return false;
        }
    }
}
