package cz.drbacon.pades.cert;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of building and checking one certificate path.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class CertificateValidationResult {

    @JsonProperty("valid")
    private final boolean valid;

    @JsonProperty("certificate")
    private final CertificateInfo certificate;

    @JsonProperty("chain_valid")
    private final boolean chainValid;

    @JsonProperty("not_expired")
    private final boolean notExpired;

    @JsonProperty("trusted_root")
    private final boolean trustedRoot;

    @JsonProperty("revocation_checked")
    private final boolean revocationChecked;

    @JsonProperty("chain")
    private final List<CertificateInfo> chain;

    @JsonProperty("violations")
    private final List<ChainViolation> violations;

    @JsonProperty("errors")
    private final List<String> errors;

    @JsonProperty("warnings")
    private final List<String> warnings;

    CertificateValidationResult(CertificateInfo certificate, boolean chainValid, boolean notExpired,
                                boolean trustedRoot, boolean revocationChecked, List<CertificateInfo> chain,
                                List<ChainViolation> violations, List<String> errors, List<String> warnings) {
        this.certificate = certificate;
        this.chainValid = chainValid;
        this.notExpired = notExpired;
        this.trustedRoot = trustedRoot;
        this.revocationChecked = revocationChecked;
        this.chain = Collections.unmodifiableList(chain);
        this.violations = Collections.unmodifiableList(violations);
        this.errors = Collections.unmodifiableList(errors);
        this.warnings = Collections.unmodifiableList(warnings);
        this.valid = errors.isEmpty();
    }

    public boolean isValid() {
        return valid;
    }

    public CertificateInfo getCertificate() {
        return certificate;
    }

    public boolean isChainValid() {
        return chainValid;
    }

    public boolean isNotExpired() {
        return notExpired;
    }

    public boolean isTrustedRoot() {
        return trustedRoot;
    }

    public boolean isRevocationChecked() {
        return revocationChecked;
    }

    public List<CertificateInfo> getChain() {
        return chain;
    }

    public List<ChainViolation> getViolations() {
        return violations;
    }

    public boolean hasViolation(ChainRule rule) {
        for (ChainViolation violation : violations) {
            if (violation.getRule() == rule) {
                return true;
            }
        }
        return false;
    }

    public List<String> getErrors() {
        return errors;
    }

    public List<String> getWarnings() {
        return warnings;
    }
}
