package cz.drbacon.pades.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import cz.drbacon.pades.cert.CertificateValidationResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Results for every distinct certificate seen in the document's signatures.
 */
public final class CertificateValidationSummary {

    @JsonProperty("total_certificates")
    private final int totalCertificates;

    @JsonProperty("valid_certificates")
    private final int validCertificates;

    @JsonProperty("all_certificates_valid")
    private final boolean allCertificatesValid;

    @JsonProperty("certificates")
    private final List<CertificateValidationResult> certificates;

    public CertificateValidationSummary(List<CertificateValidationResult> certificates) {
        this.certificates = Collections.unmodifiableList(new ArrayList<>(certificates));
        int valid = 0;
        for (CertificateValidationResult certificate : certificates) {
            if (certificate.isValid()) {
                valid++;
            }
        }
        this.totalCertificates = certificates.size();
        this.validCertificates = valid;
        this.allCertificatesValid = valid == totalCertificates;
    }

    public int getTotalCertificates() {
        return totalCertificates;
    }

    public int getValidCertificates() {
        return validCertificates;
    }

    public boolean isAllCertificatesValid() {
        return allCertificatesValid;
    }

    public List<CertificateValidationResult> getCertificates() {
        return certificates;
    }
}
