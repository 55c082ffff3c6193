package cz.drbacon.pades.cms;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One signature field of a document with its CMS signature and the bytes it covers.
 *
 * When the field could not be read (broken /ByteRange, contents that are not CMS) the
 * signature is null and {@link #getExtractionProblem()} says why; such a signature
 * never validates, but does not stop extraction of its siblings.
 */
public final class ExtractedSignature {

    private final String fieldName;
    private final CmsSignature signature;
    private final ByteRange byteRange;
    private final String signerName;
    private final String reason;
    private final String location;
    private final Instant signDate;
    private final String subFilter;
    private final boolean coversWholeDocument;
    private final String extractionProblem;
    private final List<String> warnings;

    private ExtractedSignature(Builder builder) {
        this.fieldName = builder.fieldName;
        this.signature = builder.signature;
        this.byteRange = builder.byteRange;
        this.signerName = builder.signerName;
        this.reason = builder.reason;
        this.location = builder.location;
        this.signDate = builder.signDate;
        this.subFilter = builder.subFilter;
        this.coversWholeDocument = builder.coversWholeDocument;
        this.extractionProblem = builder.extractionProblem;
        this.warnings = Collections.unmodifiableList(new ArrayList<>(builder.warnings));
    }

    public String getFieldName() {
        return fieldName;
    }

    /**
     * @return the parsed signature, null when extraction failed
     */
    public CmsSignature getSignature() {
        return signature;
    }

    public ByteRange getByteRange() {
        return byteRange;
    }

    /** /Name of the signature dictionary. */
    public String getSignerName() {
        return signerName;
    }

    public String getReason() {
        return reason;
    }

    public String getLocation() {
        return location;
    }

    /** /M of the signature dictionary, as claimed by the signer. */
    public Instant getSignDate() {
        return signDate;
    }

    public String getSubFilter() {
        return subFilter;
    }

    public boolean isCoversWholeDocument() {
        return coversWholeDocument;
    }

    public String getExtractionProblem() {
        return extractionProblem;
    }

    public boolean isExtracted() {
        return signature != null;
    }

    /**
     * Findings about the byte range (incremental updates, odd gaps).
     */
    public List<String> getWarnings() {
        return warnings;
    }

    @Override
    public String toString() {
        return "ExtractedSignature{" + fieldName + ", range=" + byteRange
            + (extractionProblem != null ? ", problem=" + extractionProblem : "") + "}";
    }

    static Builder builder(String fieldName) {
        return new Builder(fieldName);
    }

    static final class Builder {
        private final String fieldName;
        private CmsSignature signature;
        private ByteRange byteRange;
        private String signerName;
        private String reason;
        private String location;
        private Instant signDate;
        private String subFilter;
        private boolean coversWholeDocument;
        private String extractionProblem;
        private final List<String> warnings = new ArrayList<>();

        private Builder(String fieldName) {
            this.fieldName = fieldName;
        }

        Builder signature(CmsSignature signature) {
            this.signature = signature;
            return this;
        }

        Builder byteRange(ByteRange byteRange) {
            this.byteRange = byteRange;
            return this;
        }

        Builder signerName(String signerName) {
            this.signerName = signerName;
            return this;
        }

        Builder reason(String reason) {
            this.reason = reason;
            return this;
        }

        Builder location(String location) {
            this.location = location;
            return this;
        }

        Builder signDate(Instant signDate) {
            this.signDate = signDate;
            return this;
        }

        Builder subFilter(String subFilter) {
            this.subFilter = subFilter;
            return this;
        }

        Builder coversWholeDocument(boolean coversWholeDocument) {
            this.coversWholeDocument = coversWholeDocument;
            return this;
        }

        Builder extractionProblem(String extractionProblem) {
            this.extractionProblem = extractionProblem;
            return this;
        }

        Builder warning(String warning) {
            this.warnings.add(warning);
            return this;
        }

        ExtractedSignature build() {
            return new ExtractedSignature(this);
        }
    }
}
