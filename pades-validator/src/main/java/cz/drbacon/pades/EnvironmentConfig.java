package cz.drbacon.pades;

import cz.drbacon.pades.tsp.TsaConfig;
import cz.drbacon.pades.tsp.TsaFailoverConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * TSA settings of the command line tool, read from environment variables.
 *
 * Environment variables:
 *   TSA_URL            - primary timestamp authority (default: https://timestamp.digicert.com)
 *   TSA_FALLBACK_URLS  - comma separated fallback TSAs, tried in order
 *   TSA_USERNAME       - HTTP basic auth user, applied to every TSA
 *   TSA_PASSWORD       - HTTP basic auth password, required together with TSA_USERNAME
 *   TSA_TIMEOUT_MS     - connect/read timeout per request (default 30000)
 *   TSA_RETRY_ATTEMPTS - attempts per TSA (default 3)
 */
public final class EnvironmentConfig {

    private static final Logger LOG = LoggerFactory.getLogger(EnvironmentConfig.class);

    static final String DEFAULT_TSA_URL = "https://timestamp.digicert.com";

    private final TsaFailoverConfig failoverConfig;

    private EnvironmentConfig(TsaFailoverConfig failoverConfig) {
        this.failoverConfig = failoverConfig;
    }

    public static EnvironmentConfig fromSystemEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * @throws IllegalArgumentException naming the offending variable when a value cannot be used
     */
    public static EnvironmentConfig fromEnvironment(Map<String, String> env) {
        String primaryUrl = value(env, "TSA_URL");
        if (primaryUrl == null) {
            primaryUrl = DEFAULT_TSA_URL;
        }
        int timeoutMs = intValue(env, "TSA_TIMEOUT_MS", TsaConfig.DEFAULT_TIMEOUT_MS);
        int retryAttempts = intValue(env, "TSA_RETRY_ATTEMPTS", TsaConfig.DEFAULT_RETRY_ATTEMPTS);
        String username = value(env, "TSA_USERNAME");
        String password = value(env, "TSA_PASSWORD");
        if ((username == null) != (password == null)) {
            throw new IllegalArgumentException("TSA_USERNAME and TSA_PASSWORD must be set together");
        }

        TsaConfig primary = server("TSA_URL", primaryUrl, username, password, timeoutMs, retryAttempts);
        List<TsaConfig> fallbacks = new ArrayList<>();
        String fallbackUrls = value(env, "TSA_FALLBACK_URLS");
        if (fallbackUrls != null) {
            for (String url : fallbackUrls.split(",")) {
                if (!url.isBlank()) {
                    fallbacks.add(server("TSA_FALLBACK_URLS", url.trim(), username, password, timeoutMs, retryAttempts));
                }
            }
        }
        LOG.info("TSA configuration: primary={}, fallbacks={}, timeout={}ms, attempts={}",
            primary.getUrl(), fallbacks.size(), timeoutMs, retryAttempts);
        return new EnvironmentConfig(new TsaFailoverConfig(primary, fallbacks));
    }

    private static TsaConfig server(String variable, String url, String username, String password,
                                    int timeoutMs, int retryAttempts) {
        TsaConfig config;
        try {
            config = TsaConfig.of(url).withTimeoutMs(timeoutMs).withRetryAttempts(retryAttempts);
            if (username != null) {
                config = config.withCredentials(username, password.toCharArray());
            }
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(variable + ": " + e.getMessage(), e);
        }
        if (url.startsWith("http://")) {
            LOG.warn("{} uses HTTP instead of HTTPS - consider using HTTPS for security: {}", variable, url);
        }
        return config;
    }

    private static String value(Map<String, String> env, String name) {
        String value = env.get(name);
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static int intValue(Map<String, String> env, String name, int defaultValue) {
        String value = value(env, name);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " is not a number: " + value, e);
        }
    }

    public TsaFailoverConfig getFailoverConfig() {
        return failoverConfig;
    }

    public TsaConfig getPrimary() {
        return failoverConfig.getPrimary();
    }
}
