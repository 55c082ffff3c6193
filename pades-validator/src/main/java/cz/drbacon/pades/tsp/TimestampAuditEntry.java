package cz.drbacon.pades.tsp;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.UUID;

/**
 * Audit record for one timestamp operation.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class TimestampAuditEntry {

    @JsonProperty("id")
    private final String id;

    @JsonProperty("operation")
    private final TimestampOperation operation;

    @JsonProperty("tsa_url")
    private final String tsaUrl;

    @JsonProperty("result")
    private final String result;

    @JsonProperty("success")
    private final boolean success;

    @JsonProperty("error")
    private final String error;

    @JsonProperty("duration_ms")
    private final long durationMs;

    @JsonProperty("created_at")
    private final Instant createdAt;

    private TimestampAuditEntry(TimestampOperation operation, String tsaUrl, String result, boolean success,
                                String error, long durationMs, Instant createdAt) {
        this.id = UUID.randomUUID().toString();
        this.operation = operation;
        this.tsaUrl = tsaUrl;
        this.result = result;
        this.success = success;
        this.error = error;
        this.durationMs = durationMs;
        this.createdAt = createdAt;
    }

    public static TimestampAuditEntry success(TimestampOperation operation, String tsaUrl, String result,
                                              long durationMs, Instant createdAt) {
        return new TimestampAuditEntry(operation, tsaUrl, result, true, null, durationMs, createdAt);
    }

    public static TimestampAuditEntry failure(TimestampOperation operation, String tsaUrl, String error,
                                              long durationMs, Instant createdAt) {
        return new TimestampAuditEntry(operation, tsaUrl, "failed", false, error, durationMs, createdAt);
    }

    public String getId() {
        return id;
    }

    public TimestampOperation getOperation() {
        return operation;
    }

    public String getTsaUrl() {
        return tsaUrl;
    }

    public String getResult() {
        return result;
    }

    public boolean isSuccess() {
        return success;
    }

    public String getError() {
        return error;
    }

    public long getDurationMs() {
        return durationMs;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    @Override
    public String toString() {
        return operation + (success ? " OK " : " FAIL ") + (tsaUrl != null ? tsaUrl + " " : "")
            + (success ? result : error);
    }
}
