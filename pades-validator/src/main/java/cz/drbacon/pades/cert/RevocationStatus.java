package cz.drbacon.pades.cert;

public enum RevocationStatus {
    GOOD,
    REVOKED,
    UNKNOWN
}
