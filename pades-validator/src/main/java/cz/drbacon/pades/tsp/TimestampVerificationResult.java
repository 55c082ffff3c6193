package cz.drbacon.pades.tsp;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of checking a timestamp token against the data it claims to cover.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class TimestampVerificationResult {

    @JsonProperty("valid")
    private final boolean valid;

    @JsonProperty("imprint_matches")
    private final boolean imprintMatches;

    @JsonProperty("signature_verified")
    private final boolean signatureVerified;

    @JsonProperty("gen_time")
    private final Instant genTime;

    @JsonProperty("accuracy")
    private final TimestampAccuracy accuracy;

    @JsonProperty("policy_oid")
    private final String policyOid;

    @JsonProperty("serial_number")
    private final String serialNumber;

    @JsonProperty("tsa_name")
    private final String tsaName;

    @JsonProperty("tsa_certificate_subject")
    private final String tsaCertificateSubject;

    @JsonProperty("errors")
    private final List<String> errors;

    @JsonProperty("warnings")
    private final List<String> warnings;

    TimestampVerificationResult(boolean imprintMatches, boolean signatureVerified, TstInfo info,
                                String tsaCertificateSubject, List<String> errors, List<String> warnings) {
        this.imprintMatches = imprintMatches;
        this.signatureVerified = signatureVerified;
        this.genTime = info == null ? null : info.getGenTime();
        this.accuracy = info == null ? null : info.getAccuracy();
        this.policyOid = info == null ? null : info.getPolicyOid();
        this.serialNumber = info == null ? null : info.getSerialNumber();
        this.tsaName = info == null ? null : info.getTsaName();
        this.tsaCertificateSubject = tsaCertificateSubject;
        this.errors = Collections.unmodifiableList(errors);
        this.warnings = Collections.unmodifiableList(warnings);
        this.valid = errors.isEmpty();
    }

    static TimestampVerificationResult failed(String error) {
        return new TimestampVerificationResult(false, false, null, null,
            Collections.singletonList(error), Collections.emptyList());
    }

    public boolean isValid() {
        return valid;
    }

    public boolean isImprintMatches() {
        return imprintMatches;
    }

    public boolean isSignatureVerified() {
        return signatureVerified;
    }

    public Instant getGenTime() {
        return genTime;
    }

    public TimestampAccuracy getAccuracy() {
        return accuracy;
    }

    public String getPolicyOid() {
        return policyOid;
    }

    public String getSerialNumber() {
        return serialNumber;
    }

    public String getTsaName() {
        return tsaName;
    }

    public String getTsaCertificateSubject() {
        return tsaCertificateSubject;
    }

    public List<String> getErrors() {
        return errors;
    }

    public List<String> getWarnings() {
        return warnings;
    }
}
