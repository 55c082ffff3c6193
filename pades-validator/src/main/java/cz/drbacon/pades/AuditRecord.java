package cz.drbacon.pades;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import cz.drbacon.pades.tsp.TsaAttempt;

import java.io.File;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Audit record for one command line run (validation or timestamping).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AuditRecord {

    @JsonProperty("session_id")
    private String sessionId;

    @JsonProperty("command")
    private String command;

    @JsonProperty("started_at")
    private Instant startedAt;

    @JsonProperty("input_file")
    private String inputFile;

    @JsonProperty("output_file")
    private String outputFile;

    @JsonProperty("trusted_roots_file")
    private String trustedRootsFile;

    @JsonProperty("document_sha256")
    private String documentSha256;

    @JsonProperty("document_valid")
    private Boolean documentValid;

    @JsonProperty("signature_count")
    private Integer signatureCount;

    @JsonProperty("valid_signature_count")
    private Integer validSignatureCount;

    @JsonProperty("tsa_url")
    private String tsaUrl;

    @JsonProperty("tsa_fallback_used")
    private Boolean tsaFallbackUsed;

    @JsonProperty("tsa_attempts")
    private List<TsaAttempt> tsaAttempts;

    @JsonProperty("tsa_gen_time")
    private Instant tsaGenTime;

    @JsonProperty("tsa_serial_number")
    private String tsaSerialNumber;

    @JsonProperty("tsa_latency_ms")
    private Long tsaLatencyMs;

    @JsonProperty("user_agent")
    private String userAgent;

    @JsonProperty("success")
    private boolean success;

    @JsonProperty("errors")
    private List<String> errors = new ArrayList<>();

    public AuditRecord() {
        this.sessionId = UUID.randomUUID().toString();
        this.startedAt = Instant.now();
        this.userAgent = "pades-validator/1.0.0";
    }

    // Getters and setters

    public String getSessionId() {
        return sessionId;
    }

    public String getCommand() {
        return command;
    }

    public void setCommand(String command) {
        this.command = command;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public String getInputFile() {
        return inputFile;
    }

    public void setInputFile(String inputFile) {
        this.inputFile = inputFile;
    }

    public String getOutputFile() {
        return outputFile;
    }

    public void setOutputFile(String outputFile) {
        this.outputFile = outputFile;
    }

    public String getTrustedRootsFile() {
        return trustedRootsFile;
    }

    public void setTrustedRootsFile(String trustedRootsFile) {
        this.trustedRootsFile = trustedRootsFile;
    }

    public String getDocumentSha256() {
        return documentSha256;
    }

    public void setDocumentSha256(String documentSha256) {
        this.documentSha256 = documentSha256;
    }

    public Boolean getDocumentValid() {
        return documentValid;
    }

    public void setDocumentValid(Boolean documentValid) {
        this.documentValid = documentValid;
    }

    public Integer getSignatureCount() {
        return signatureCount;
    }

    public void setSignatureCount(Integer signatureCount) {
        this.signatureCount = signatureCount;
    }

    public Integer getValidSignatureCount() {
        return validSignatureCount;
    }

    public void setValidSignatureCount(Integer validSignatureCount) {
        this.validSignatureCount = validSignatureCount;
    }

    public String getTsaUrl() {
        return tsaUrl;
    }

    public void setTsaUrl(String tsaUrl) {
        this.tsaUrl = tsaUrl;
    }

    public Boolean getTsaFallbackUsed() {
        return tsaFallbackUsed;
    }

    public void setTsaFallbackUsed(Boolean tsaFallbackUsed) {
        this.tsaFallbackUsed = tsaFallbackUsed;
    }

    public List<TsaAttempt> getTsaAttempts() {
        return tsaAttempts;
    }

    public void setTsaAttempts(List<TsaAttempt> tsaAttempts) {
        this.tsaAttempts = tsaAttempts;
    }

    public Instant getTsaGenTime() {
        return tsaGenTime;
    }

    public void setTsaGenTime(Instant tsaGenTime) {
        this.tsaGenTime = tsaGenTime;
    }

    public String getTsaSerialNumber() {
        return tsaSerialNumber;
    }

    public void setTsaSerialNumber(String tsaSerialNumber) {
        this.tsaSerialNumber = tsaSerialNumber;
    }

    public Long getTsaLatencyMs() {
        return tsaLatencyMs;
    }

    public void setTsaLatencyMs(Long tsaLatencyMs) {
        this.tsaLatencyMs = tsaLatencyMs;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public boolean isSuccess() {
        return success;
    }

    public void setSuccess(boolean success) {
        this.success = success;
    }

    public List<String> getErrors() {
        return errors;
    }

    public void addError(String error) {
        this.errors.add(error);
    }

    /**
     * Write audit record to JSON file.
     */
    public void writeToFile(String path) throws IOException {
        JsonSupport.mapper().writeValue(new File(path), this);
    }
}
