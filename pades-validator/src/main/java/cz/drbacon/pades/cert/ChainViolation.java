package cz.drbacon.pades.cert;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One broken rule, naming the certificate it was found on.
 */
public final class ChainViolation {

    @JsonProperty("rule")
    private final ChainRule rule;

    @JsonProperty("subject")
    private final String subject;

    @JsonProperty("fingerprint_sha256")
    private final String fingerprint;

    @JsonProperty("message")
    private final String message;

    public ChainViolation(ChainRule rule, CertificateInfo certificate, String message) {
        this.rule = rule;
        this.subject = certificate.getSubject();
        this.fingerprint = certificate.getFingerprint();
        this.message = message;
    }

    public ChainRule getRule() {
        return rule;
    }

    public String getSubject() {
        return subject;
    }

    public String getFingerprint() {
        return fingerprint;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return rule + ": " + message;
    }
}
