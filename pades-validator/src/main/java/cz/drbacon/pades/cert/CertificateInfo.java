package cz.drbacon.pades.cert;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.security.cert.X509Certificate;
import java.time.Instant;

/**
 * Immutable, serializable view of a parsed X.509 certificate.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class CertificateInfo {

    @JsonProperty("subject")
    private final String subject;

    @JsonProperty("issuer")
    private final String issuer;

    @JsonProperty("common_name")
    private final String commonName;

    @JsonProperty("serial_number")
    private final String serialNumber;

    @JsonProperty("not_before")
    private final Instant notBefore;

    @JsonProperty("not_after")
    private final Instant notAfter;

    @JsonProperty("fingerprint_sha256")
    private final String fingerprint;

    @JsonProperty("key_algorithm")
    private final String keyAlgorithm;

    @JsonProperty("self_signed")
    private final boolean selfSigned;

    @JsonIgnore
    private final X509Certificate certificate;

    CertificateInfo(X509Certificate certificate, String commonName, String fingerprint) {
        this.certificate = certificate;
        this.subject = certificate.getSubjectX500Principal().getName();
        this.issuer = certificate.getIssuerX500Principal().getName();
        this.commonName = commonName;
        this.serialNumber = certificate.getSerialNumber().toString(16);
        this.notBefore = certificate.getNotBefore().toInstant();
        this.notAfter = certificate.getNotAfter().toInstant();
        this.fingerprint = fingerprint;
        this.keyAlgorithm = certificate.getPublicKey().getAlgorithm();
        this.selfSigned = certificate.getSubjectX500Principal().equals(certificate.getIssuerX500Principal());
    }

    public String getSubject() {
        return subject;
    }

    public String getIssuer() {
        return issuer;
    }

    public String getCommonName() {
        return commonName;
    }

    public String getSerialNumber() {
        return serialNumber;
    }

    public Instant getNotBefore() {
        return notBefore;
    }

    public Instant getNotAfter() {
        return notAfter;
    }

    public String getFingerprint() {
        return fingerprint;
    }

    public String getKeyAlgorithm() {
        return keyAlgorithm;
    }

    public boolean isSelfSigned() {
        return selfSigned;
    }

    public X509Certificate getCertificate() {
        return certificate;
    }

    /**
     * Short label for messages: common name when present, fingerprint otherwise.
     */
    @JsonIgnore
    public String getDisplayName() {
        return commonName != null ? commonName : fingerprint;
    }

    public boolean isValidAt(Instant instant) {
        return !instant.isBefore(notBefore) && !instant.isAfter(notAfter);
    }

    @Override
    public String toString() {
        return subject + " [" + fingerprint + "]";
    }
}
