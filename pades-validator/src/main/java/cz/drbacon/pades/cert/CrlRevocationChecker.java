package cz.drbacon.pades.cert;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.GeneralSecurityException;
import java.security.cert.X509CRL;
import java.security.cert.X509Certificate;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Revocation checks against a fixed set of CRLs supplied by the caller.
 *
 * A CRL is only used when it was issued by the certificate's issuer, its signature verifies
 * with the issuer key, and {@code at} falls before its next update. Otherwise the status is UNKNOWN.
 */
public class CrlRevocationChecker implements RevocationChecker {

    private static final Logger LOG = LoggerFactory.getLogger(CrlRevocationChecker.class);

    private final List<X509CRL> crls;

    public CrlRevocationChecker(Collection<X509CRL> crls) {
        this.crls = new ArrayList<>(crls);
    }

    @Override
    public RevocationStatus check(X509Certificate certificate, X509Certificate issuer, Instant at) {
        for (X509CRL crl : crls) {
            if (!crl.getIssuerX500Principal().equals(certificate.getIssuerX500Principal())) {
                continue;
            }
            try {
                crl.verify(issuer.getPublicKey());
            } catch (GeneralSecurityException e) {
                LOG.warn("CRL from {} does not verify with issuer key: {}", crl.getIssuerX500Principal(), e.getMessage());
                continue;
            }
            if (crl.getNextUpdate() != null && at.isAfter(crl.getNextUpdate().toInstant())) {
                LOG.warn("CRL from {} is stale (next update {})", crl.getIssuerX500Principal(), crl.getNextUpdate());
                continue;
            }
            return crl.isRevoked(certificate) ? RevocationStatus.REVOKED : RevocationStatus.GOOD;
        }
        return RevocationStatus.UNKNOWN;
    }
}
