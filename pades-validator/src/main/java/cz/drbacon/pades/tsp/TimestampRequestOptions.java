package cz.drbacon.pades.tsp;

import cz.drbacon.pades.digest.MessageImprintBuilder;
import eu.europa.esig.dss.enumerations.DigestAlgorithm;

import java.util.Objects;

/**
 * Options for building an RFC 3161 request. Defaults: SHA-256, random nonce, certReq set, no policy.
 */
public final class TimestampRequestOptions {

    private final DigestAlgorithm hashAlgorithm;
    private final String policyOid;
    private final boolean includeNonce;
    private final boolean certificateRequested;

    private TimestampRequestOptions(DigestAlgorithm hashAlgorithm, String policyOid,
                                    boolean includeNonce, boolean certificateRequested) {
        this.hashAlgorithm = Objects.requireNonNull(hashAlgorithm, "hashAlgorithm");
        this.policyOid = policyOid;
        this.includeNonce = includeNonce;
        this.certificateRequested = certificateRequested;
    }

    public static TimestampRequestOptions defaults() {
        return new TimestampRequestOptions(MessageImprintBuilder.DEFAULT_ALGORITHM, null, true, true);
    }

    public TimestampRequestOptions withHashAlgorithm(DigestAlgorithm algorithm) {
        return new TimestampRequestOptions(algorithm, policyOid, includeNonce, certificateRequested);
    }

    public TimestampRequestOptions withHashAlgorithm(String nameOrOid) {
        return withHashAlgorithm(MessageImprintBuilder.resolve(nameOrOid));
    }

    public TimestampRequestOptions withPolicyOid(String oid) {
        return new TimestampRequestOptions(hashAlgorithm, oid, includeNonce, certificateRequested);
    }

    public TimestampRequestOptions withNonce(boolean nonce) {
        return new TimestampRequestOptions(hashAlgorithm, policyOid, nonce, certificateRequested);
    }

    public TimestampRequestOptions withCertificateRequested(boolean certReq) {
        return new TimestampRequestOptions(hashAlgorithm, policyOid, includeNonce, certReq);
    }

    public DigestAlgorithm getHashAlgorithm() {
        return hashAlgorithm;
    }

    public String getPolicyOid() {
        return policyOid;
    }

    public boolean isIncludeNonce() {
        return includeNonce;
    }

    public boolean isCertificateRequested() {
        return certificateRequested;
    }
}
