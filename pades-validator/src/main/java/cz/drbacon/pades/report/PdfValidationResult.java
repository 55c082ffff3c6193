package cz.drbacon.pades.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import cz.drbacon.pades.pdf.StructureValidationResult;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Aggregated validation report of one PDF. This is the value handed to result sinks.
 *
 * {@code valid} is true iff {@link #getErrors()} is empty. A document without signatures
 * is not an error; its validity is decided by the structure check alone.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class PdfValidationResult {

    @JsonProperty("valid")
    private final boolean valid;

    @JsonProperty("has_signatures")
    private final boolean hasSignatures;

    @JsonProperty("pdf_version")
    private final String pdfVersion;

    @JsonProperty("page_count")
    private final Integer pageCount;

    @JsonProperty("encrypted")
    private final Boolean encrypted;

    @JsonProperty("has_form_fields")
    private final Boolean hasFormFields;

    @JsonProperty("document_sha256")
    private final String documentSha256;

    @JsonProperty("structure_validation")
    private final StructureValidationResult structureValidation;

    @JsonProperty("signature_validation")
    private final SignatureValidationSummary signatureValidation;

    @JsonProperty("certificate_validation")
    private final CertificateValidationSummary certificateValidation;

    @JsonProperty("timestamp_validation")
    private final TimestampValidationSummary timestampValidation;

    @JsonProperty("errors")
    private final List<String> errors;

    @JsonProperty("warnings")
    private final List<String> warnings;

    @JsonProperty("validated_at")
    private final Instant validatedAt;

    private PdfValidationResult(Builder builder) {
        this.hasSignatures = builder.signatureValidation != null
            && builder.signatureValidation.getTotalSignatures() > 0;
        this.pdfVersion = builder.structureValidation == null ? null : builder.structureValidation.getPdfVersion();
        this.pageCount = builder.pageCount;
        this.encrypted = builder.encrypted;
        this.hasFormFields = builder.hasFormFields;
        this.documentSha256 = builder.documentSha256;
        this.structureValidation = builder.structureValidation;
        this.signatureValidation = builder.signatureValidation;
        this.certificateValidation = builder.certificateValidation;
        this.timestampValidation = builder.timestampValidation;
        this.errors = Collections.unmodifiableList(new ArrayList<>(builder.errors));
        this.warnings = Collections.unmodifiableList(new ArrayList<>(builder.warnings));
        this.validatedAt = builder.validatedAt;
        this.valid = errors.isEmpty();
    }

    public boolean isValid() {
        return valid;
    }

    public boolean isHasSignatures() {
        return hasSignatures;
    }

    public String getPdfVersion() {
        return pdfVersion;
    }

    /**
     * @return null when the document was not loaded (fatal structure error, unreadable file)
     */
    public Integer getPageCount() {
        return pageCount;
    }

    public Boolean getEncrypted() {
        return encrypted;
    }

    public Boolean getHasFormFields() {
        return hasFormFields;
    }

    public String getDocumentSha256() {
        return documentSha256;
    }

    public StructureValidationResult getStructureValidation() {
        return structureValidation;
    }

    public SignatureValidationSummary getSignatureValidation() {
        return signatureValidation;
    }

    public CertificateValidationSummary getCertificateValidation() {
        return certificateValidation;
    }

    public TimestampValidationSummary getTimestampValidation() {
        return timestampValidation;
    }

    public List<String> getErrors() {
        return errors;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public Instant getValidatedAt() {
        return validatedAt;
    }

    public static Builder builder(Instant validatedAt) {
        return new Builder(validatedAt);
    }

    public static final class Builder {
        private final Instant validatedAt;
        private Integer pageCount;
        private Boolean encrypted;
        private Boolean hasFormFields;
        private String documentSha256;
        private StructureValidationResult structureValidation;
        private SignatureValidationSummary signatureValidation;
        private CertificateValidationSummary certificateValidation;
        private TimestampValidationSummary timestampValidation;
        private final List<String> errors = new ArrayList<>();
        private final List<String> warnings = new ArrayList<>();

        private Builder(Instant validatedAt) {
            this.validatedAt = validatedAt;
        }

        public Builder pageCount(int pageCount) {
            this.pageCount = pageCount;
            return this;
        }

        public Builder encrypted(boolean encrypted) {
            this.encrypted = encrypted;
            return this;
        }

        public Builder hasFormFields(boolean hasFormFields) {
            this.hasFormFields = hasFormFields;
            return this;
        }

        public Builder documentSha256(String documentSha256) {
            this.documentSha256 = documentSha256;
            return this;
        }

        public Builder structureValidation(StructureValidationResult structureValidation) {
            this.structureValidation = structureValidation;
            return this;
        }

        public Builder signatureValidation(SignatureValidationSummary signatureValidation) {
            this.signatureValidation = signatureValidation;
            return this;
        }

        public Builder certificateValidation(CertificateValidationSummary certificateValidation) {
            this.certificateValidation = certificateValidation;
            return this;
        }

        public Builder timestampValidation(TimestampValidationSummary timestampValidation) {
            this.timestampValidation = timestampValidation;
            return this;
        }

        public Builder error(String error) {
            this.errors.add(error);
            return this;
        }

        public Builder warning(String warning) {
            this.warnings.add(warning);
            return this;
        }

        public PdfValidationResult build() {
            return new PdfValidationResult(this);
        }
    }
}
