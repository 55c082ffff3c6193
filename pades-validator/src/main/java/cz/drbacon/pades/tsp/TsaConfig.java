package cz.drbacon.pades.tsp;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Objects;

/**
 * Connection settings for one Time-Stamp Authority. Immutable; build one per request.
 */
public final class TsaConfig {

    public static final int DEFAULT_TIMEOUT_MS = 30_000;
    public static final int DEFAULT_RETRY_ATTEMPTS = 3;

    private final String url;
    private final String username;
    private final char[] password;
    private final int timeoutMs;
    private final int retryAttempts;

    private TsaConfig(String url, String username, char[] password, int timeoutMs, int retryAttempts) {
        this.url = validateUrl(url);
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("TSA timeout must be positive, got " + timeoutMs);
        }
        if (retryAttempts < 1) {
            throw new IllegalArgumentException("TSA retry attempts must be at least 1, got " + retryAttempts);
        }
        if ((username == null) != (password == null)) {
            throw new IllegalArgumentException("TSA credentials need both username and password");
        }
        this.username = username;
        this.password = password == null ? null : password.clone();
        this.timeoutMs = timeoutMs;
        this.retryAttempts = retryAttempts;
    }

    public static TsaConfig of(String url) {
        return new TsaConfig(url, null, null, DEFAULT_TIMEOUT_MS, DEFAULT_RETRY_ATTEMPTS);
    }

    public TsaConfig withCredentials(String newUsername, char[] newPassword) {
        return new TsaConfig(url, newUsername, newPassword, timeoutMs, retryAttempts);
    }

    public TsaConfig withTimeoutMs(int newTimeoutMs) {
        return new TsaConfig(url, username, password, newTimeoutMs, retryAttempts);
    }

    public TsaConfig withRetryAttempts(int newRetryAttempts) {
        return new TsaConfig(url, username, password, timeoutMs, newRetryAttempts);
    }

    private static String validateUrl(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("TSA URL must not be empty");
        }
        try {
            URI uri = new URI(url.trim());
            String scheme = uri.getScheme();
            if (uri.getHost() == null || scheme == null
                || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
                throw new IllegalArgumentException("TSA URL must be an absolute http(s) URL: " + url);
            }
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Malformed TSA URL: " + url, e);
        }
        return url.trim();
    }

    public String getUrl() {
        return url;
    }

    public String getUsername() {
        return username;
    }

    public char[] getPassword() {
        return password == null ? null : password.clone();
    }

    public boolean hasCredentials() {
        return username != null;
    }

    public int getTimeoutMs() {
        return timeoutMs;
    }

    public int getRetryAttempts() {
        return retryAttempts;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TsaConfig)) return false;
        TsaConfig that = (TsaConfig) o;
        return timeoutMs == that.timeoutMs && retryAttempts == that.retryAttempts
            && url.equals(that.url) && Objects.equals(username, that.username);
    }

    @Override
    public int hashCode() {
        return Objects.hash(url, username, timeoutMs, retryAttempts);
    }

    @Override
    public String toString() {
        // credentials stay out of logs
        return "TsaConfig{" + url + ", timeout=" + timeoutMs + "ms, attempts=" + retryAttempts
            + (hasCredentials() ? ", auth=basic" : "") + "}";
    }
}
