package cz.drbacon.pades.tsp;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One request/response exchange with a TSA.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class TsaAttempt {

    @JsonProperty("tsa_url")
    private final String tsaUrl;

    @JsonProperty("attempt")
    private final int attempt;

    @JsonProperty("success")
    private final boolean success;

    @JsonProperty("error_type")
    private final TsaErrorType errorType;

    @JsonProperty("error")
    private final String error;

    @JsonProperty("duration_ms")
    private final long durationMs;

    private TsaAttempt(String tsaUrl, int attempt, boolean success, TsaErrorType errorType, String error, long durationMs) {
        this.tsaUrl = tsaUrl;
        this.attempt = attempt;
        this.success = success;
        this.errorType = errorType;
        this.error = error;
        this.durationMs = durationMs;
    }

    static TsaAttempt succeeded(String tsaUrl, int attempt, long durationMs) {
        return new TsaAttempt(tsaUrl, attempt, true, TsaErrorType.NONE, null, durationMs);
    }

    static TsaAttempt failed(String tsaUrl, int attempt, TsaErrorType errorType, String error, long durationMs) {
        return new TsaAttempt(tsaUrl, attempt, false, errorType, error, durationMs);
    }

    public String getTsaUrl() {
        return tsaUrl;
    }

    public int getAttempt() {
        return attempt;
    }

    public boolean isSuccess() {
        return success;
    }

    public TsaErrorType getErrorType() {
        return errorType;
    }

    public String getError() {
        return error;
    }

    public long getDurationMs() {
        return durationMs;
    }

    @Override
    public String toString() {
        if (success) {
            return String.format("OK: %s %dms", tsaUrl, durationMs);
        }
        return String.format("FAIL: %s %s %dms %s", tsaUrl, errorType, durationMs, error);
    }
}
