package cz.drbacon.pades.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import cz.drbacon.pades.cms.SignatureValidationResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Per-document roll-up of signature results.
 */
public final class SignatureValidationSummary {

    @JsonProperty("total_signatures")
    private final int totalSignatures;

    @JsonProperty("valid_signatures")
    private final int validSignatures;

    @JsonProperty("all_signatures_valid")
    private final boolean allSignaturesValid;

    @JsonProperty("signatures")
    private final List<SignatureValidationResult> signatures;

    public SignatureValidationSummary(List<SignatureValidationResult> signatures) {
        this.signatures = Collections.unmodifiableList(new ArrayList<>(signatures));
        int valid = 0;
        for (SignatureValidationResult signature : signatures) {
            if (signature.isValid()) {
                valid++;
            }
        }
        this.totalSignatures = signatures.size();
        this.validSignatures = valid;
        this.allSignaturesValid = valid == totalSignatures;
    }

    public int getTotalSignatures() {
        return totalSignatures;
    }

    public int getValidSignatures() {
        return validSignatures;
    }

    /** True for a document without signatures. */
    public boolean isAllSignaturesValid() {
        return allSignaturesValid;
    }

    public List<SignatureValidationResult> getSignatures() {
        return signatures;
    }
}
