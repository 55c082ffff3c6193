package cz.drbacon.pades.pdf;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;

/**
 * Result of the textual structure scan of a PDF file.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class StructureValidationResult {

    @JsonProperty("valid")
    private final boolean valid;

    @JsonProperty("pdf_version")
    private final String pdfVersion;

    @JsonProperty("header_valid")
    private final boolean headerValid;

    @JsonProperty("cross_reference_valid")
    private final boolean crossReferenceValid;

    @JsonProperty("trailer_valid")
    private final boolean trailerValid;

    @JsonProperty("objects_valid")
    private final boolean objectsValid;

    @JsonProperty("object_count")
    private final int objectCount;

    @JsonProperty("errors")
    private final List<String> errors;

    @JsonProperty("warnings")
    private final List<String> warnings;

    StructureValidationResult(String pdfVersion, boolean headerValid, boolean crossReferenceValid,
                              boolean trailerValid, boolean objectsValid, int objectCount,
                              List<String> errors, List<String> warnings) {
        this.pdfVersion = pdfVersion;
        this.headerValid = headerValid;
        this.crossReferenceValid = crossReferenceValid;
        this.trailerValid = trailerValid;
        this.objectsValid = objectsValid;
        this.objectCount = objectCount;
        this.errors = Collections.unmodifiableList(errors);
        this.warnings = Collections.unmodifiableList(warnings);
        this.valid = errors.isEmpty();
    }

    public boolean isValid() {
        return valid;
    }

    /**
     * @return "major.minor" from the header, null when no header was found
     */
    public String getPdfVersion() {
        return pdfVersion;
    }

    public boolean isHeaderValid() {
        return headerValid;
    }

    public boolean isCrossReferenceValid() {
        return crossReferenceValid;
    }

    public boolean isTrailerValid() {
        return trailerValid;
    }

    public boolean isObjectsValid() {
        return objectsValid;
    }

    public int getObjectCount() {
        return objectCount;
    }

    public List<String> getErrors() {
        return errors;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    /**
     * Signature work is pointless when the header cannot be trusted.
     */
    @JsonIgnore
    public boolean isFatal() {
        return !headerValid;
    }
}
