package cz.drbacon.pades.cms;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import cz.drbacon.pades.cert.CertificateInfo;
import cz.drbacon.pades.cert.CertificateValidationResult;
import cz.drbacon.pades.tsp.TimestampVerificationResult;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of validating one signature field. Valid iff the digest, the signature value,
 * the signer's certificate chain and (when present) the embedded timestamp all check out.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class SignatureValidationResult {

    @JsonProperty("field_name")
    private final String fieldName;

    @JsonProperty("valid")
    private final boolean valid;

    @JsonProperty("digest_valid")
    private final boolean digestValid;

    @JsonProperty("signature_valid")
    private final boolean signatureValid;

    @JsonProperty("certificate_chain_valid")
    private final boolean certificateChainValid;

    @JsonProperty("timestamp_valid")
    private final Boolean timestampValid;

    @JsonProperty("digest_algorithm")
    private final String digestAlgorithm;

    @JsonProperty("byte_range")
    private final String byteRange;

    @JsonProperty("covers_whole_document")
    private final boolean coversWholeDocument;

    @JsonProperty("signer")
    private final CertificateInfo signer;

    @JsonProperty("signer_name")
    private final String signerName;

    @JsonProperty("reason")
    private final String reason;

    @JsonProperty("location")
    private final String location;

    @JsonProperty("sign_date")
    private final Instant signDate;

    @JsonProperty("sub_filter")
    private final String subFilter;

    @JsonProperty("certificate_validation")
    private final CertificateValidationResult certificateValidation;

    @JsonProperty("timestamp_verification")
    private final TimestampVerificationResult timestampVerification;

    @JsonProperty("errors")
    private final List<String> errors;

    @JsonProperty("warnings")
    private final List<String> warnings;

    private SignatureValidationResult(Builder builder) {
        this.fieldName = builder.fieldName;
        this.digestValid = builder.digestValid;
        this.signatureValid = builder.signatureValid;
        this.certificateChainValid = builder.certificateChainValid;
        this.timestampValid = builder.timestampVerification == null ? null : builder.timestampVerification.isValid();
        this.digestAlgorithm = builder.digestAlgorithm;
        this.byteRange = builder.byteRange;
        this.coversWholeDocument = builder.coversWholeDocument;
        this.signer = builder.signer;
        this.signerName = builder.signerName;
        this.reason = builder.reason;
        this.location = builder.location;
        this.signDate = builder.signDate;
        this.subFilter = builder.subFilter;
        this.certificateValidation = builder.certificateValidation;
        this.timestampVerification = builder.timestampVerification;
        this.errors = Collections.unmodifiableList(new ArrayList<>(builder.errors));
        this.warnings = Collections.unmodifiableList(new ArrayList<>(builder.warnings));
        this.valid = errors.isEmpty();
    }

    public String getFieldName() {
        return fieldName;
    }

    public boolean isValid() {
        return valid;
    }

    public boolean isDigestValid() {
        return digestValid;
    }

    public boolean isSignatureValid() {
        return signatureValid;
    }

    public boolean isCertificateChainValid() {
        return certificateChainValid;
    }

    /**
     * @return null when the signature carries no timestamp
     */
    public Boolean getTimestampValid() {
        return timestampValid;
    }

    public boolean hasTimestamp() {
        return timestampVerification != null;
    }

    public String getDigestAlgorithm() {
        return digestAlgorithm;
    }

    public String getByteRange() {
        return byteRange;
    }

    public boolean isCoversWholeDocument() {
        return coversWholeDocument;
    }

    public CertificateInfo getSigner() {
        return signer;
    }

    public String getSignerName() {
        return signerName;
    }

    public String getReason() {
        return reason;
    }

    public String getLocation() {
        return location;
    }

    public Instant getSignDate() {
        return signDate;
    }

    public String getSubFilter() {
        return subFilter;
    }

    public CertificateValidationResult getCertificateValidation() {
        return certificateValidation;
    }

    public TimestampVerificationResult getTimestampVerification() {
        return timestampVerification;
    }

    public List<String> getErrors() {
        return errors;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    static Builder builder(ExtractedSignature extracted) {
        return new Builder(extracted);
    }

    static final class Builder {
        private final String fieldName;
        private final String byteRange;
        private final boolean coversWholeDocument;
        private final String signerName;
        private final String reason;
        private final String location;
        private final Instant signDate;
        private final String subFilter;
        private boolean digestValid;
        private boolean signatureValid;
        private boolean certificateChainValid;
        private String digestAlgorithm;
        private CertificateInfo signer;
        private CertificateValidationResult certificateValidation;
        private TimestampVerificationResult timestampVerification;
        private final List<String> errors = new ArrayList<>();
        private final List<String> warnings = new ArrayList<>();

        private Builder(ExtractedSignature extracted) {
            this.fieldName = extracted.getFieldName();
            this.byteRange = extracted.getByteRange() == null ? null : extracted.getByteRange().toString();
            this.coversWholeDocument = extracted.isCoversWholeDocument();
            this.signerName = extracted.getSignerName();
            this.reason = extracted.getReason();
            this.location = extracted.getLocation();
            this.signDate = extracted.getSignDate();
            this.subFilter = extracted.getSubFilter();
            this.warnings.addAll(extracted.getWarnings());
        }

        Builder digestValid(boolean digestValid) {
            this.digestValid = digestValid;
            return this;
        }

        Builder signatureValid(boolean signatureValid) {
            this.signatureValid = signatureValid;
            return this;
        }

        Builder certificateChainValid(boolean certificateChainValid) {
            this.certificateChainValid = certificateChainValid;
            return this;
        }

        Builder digestAlgorithm(String digestAlgorithm) {
            this.digestAlgorithm = digestAlgorithm;
            return this;
        }

        Builder signer(CertificateInfo signer) {
            this.signer = signer;
            return this;
        }

        Builder certificateValidation(CertificateValidationResult certificateValidation) {
            this.certificateValidation = certificateValidation;
            return this;
        }

        Builder timestampVerification(TimestampVerificationResult timestampVerification) {
            this.timestampVerification = timestampVerification;
            return this;
        }

        Builder error(String error) {
            this.errors.add(error);
            return this;
        }

        Builder warning(String warning) {
            this.warnings.add(warning);
            return this;
        }

        Builder warnings(List<String> more) {
            this.warnings.addAll(more);
            return this;
        }

        SignatureValidationResult build() {
            return new SignatureValidationResult(this);
        }
    }
}
