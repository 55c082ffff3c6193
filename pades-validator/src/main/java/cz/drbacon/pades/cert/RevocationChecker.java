package cz.drbacon.pades.cert;

import java.security.cert.X509Certificate;
import java.time.Instant;

/**
 * Revocation lookup for one certificate of a path. Implementations may use CRLs, OCSP or a local cache.
 */
public interface RevocationChecker {

    /**
     * @param certificate certificate to check
     * @param issuer      its issuer on the built path
     * @param at          validation time
     */
    RevocationStatus check(X509Certificate certificate, X509Certificate issuer, Instant at);
}
