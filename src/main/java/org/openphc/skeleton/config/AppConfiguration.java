package org.openphc.skeleton.config;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable configuration snapshot, loaded once at startup by {@link ConfigurationLoader}
 * and injected wherever settings are needed.
 */
public final class AppConfiguration {

    public static final String DEVELOPMENT = "development";
    public static final String PRODUCTION = "production";

    static final int DEFAULT_PORT = 3000;
    static final String DEFAULT_HOST = "localhost";
    static final long DEFAULT_JWT_EXPIRATION_SECONDS = 24 * 60 * 60;
    static final String DEFAULT_SESSION_SECRET = "default-session-secret";

    private final String environment;
    private final Map<String, Object> values;

    private AppConfiguration(String environment, Map<String, Object> values) {
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.put("environment", environment);
        this.environment = environment;
        this.values = Collections.unmodifiableMap(copy);
    }

    /**
     * Wrap already-validated values. {@link ConfigurationLoader#load()} is the normal entry point.
     */
    public static AppConfiguration of(String environment, Map<String, Object> values) {
        return new AppConfiguration(environment, values);
    }

    public String getEnvironment() {
        return environment;
    }

    public boolean isDevelopment() {
        return DEVELOPMENT.equals(environment);
    }

    public boolean isProduction() {
        return PRODUCTION.equals(environment);
    }

    public Object get(String key) {
        return values.get(key);
    }

    public Object get(String key, Object defaultValue) {
        Object value = values.get(key);
        return value != null ? value : defaultValue;
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public ServerSettings getServer() {
        return new ServerSettings(
                intValue(get("port", DEFAULT_PORT)),
                String.valueOf(get("host", DEFAULT_HOST)),
                booleanValue(get("sslEnabled", false)));
    }

    public DatabaseSettings getDatabase() {
        Map<String, Object> options = new LinkedHashMap<>();
        if (get("databaseOptions") instanceof Map<?, ?> m) {
            m.forEach((key, value) -> options.put(String.valueOf(key), value));
        }
        return new DatabaseSettings((String) get("databaseUrl"), Collections.unmodifiableMap(options));
    }

    public SecuritySettings getSecurity() {
        return new SecuritySettings(
                (String) get("jwtSecret"),
                longValue(get("jwtExpiration", DEFAULT_JWT_EXPIRATION_SECONDS)),
                String.valueOf(get("sessionSecret", DEFAULT_SESSION_SECRET)));
    }

    static int intValue(Object value) {
        if (value instanceof Number n) {
            return n.intValue();
        }
        return Integer.parseInt(String.valueOf(value).trim());
    }

    static long longValue(Object value) {
        if (value instanceof Number n) {
            return n.longValue();
        }
        return new BigDecimal(String.valueOf(value).trim()).longValueExact();
    }

    static boolean booleanValue(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        return Boolean.parseBoolean(String.valueOf(value).trim());
    }

    public record ServerSettings(int port, String host, boolean sslEnabled) {}

    public record DatabaseSettings(String url, Map<String, Object> options) {}

    public record SecuritySettings(String jwtSecret, long jwtExpirationSeconds, String sessionSecret) {}
}
