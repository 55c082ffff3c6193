package cz.drbacon.pades.cert;

/**
 * Rule broken at one hop of a certificate path.
 */
public enum ChainRule {
    ISSUER_MISMATCH,      // child issuer != parent subject
    SIGNATURE_INVALID,    // parent key does not verify child
    NOT_YET_VALID,
    EXPIRED,
    UNTRUSTED_ROOT,       // path does not end in a supplied root
    REVOKED,
    PATH_TOO_LONG
}
