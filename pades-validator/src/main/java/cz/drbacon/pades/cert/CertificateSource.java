package cz.drbacon.pades.cert;

/**
 * Where a stored certificate came from. Decides whether it is used as an anchor, as an
 * issuer candidate during path building, or only kept for lookup.
 */
public enum CertificateSource {
    TRUSTED_ROOT,
    INTERMEDIATE,
    DOCUMENT
}
