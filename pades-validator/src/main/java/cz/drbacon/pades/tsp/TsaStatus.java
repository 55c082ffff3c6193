package cz.drbacon.pades.tsp;

/**
 * PKIStatus values of a TimeStampResp (RFC 3161 section 2.4.2).
 */
public enum TsaStatus {
    GRANTED(0),
    GRANTED_WITH_MODS(1),
    REJECTION(2),
    WAITING(3),
    REVOCATION_WARNING(4),
    REVOCATION_NOTIFICATION(5),
    UNKNOWN(-1);

    private final int code;

    TsaStatus(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public boolean isGranted() {
        return this == GRANTED || this == GRANTED_WITH_MODS;
    }

    public static TsaStatus fromCode(int code) {
        for (TsaStatus status : values()) {
            if (status.code == code) {
                return status;
            }
        }
        return UNKNOWN;
    }
}
