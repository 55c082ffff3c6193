package cz.drbacon.pades.tsp;

import org.bouncycastle.asn1.cmp.PKIFailureInfo;
import org.bouncycastle.tsp.TSPException;
import org.bouncycastle.tsp.TimeStampResponse;
import org.bouncycastle.tsp.TimeStampToken;

import java.io.IOException;

/**
 * A parsed RFC 3161 TimeStampResp: status plus the token when granted.
 */
public final class TimestampResponse {

    private final TimeStampResponse response;
    private final TsaStatus status;
    private final String statusString;
    private final byte[] encoded;
    private final String tsaUrl;
    private final Timestamp timestamp;

    private TimestampResponse(TimeStampResponse response, byte[] encoded, String tsaUrl) {
        this.response = response;
        this.status = TsaStatus.fromCode(response.getStatus());
        this.statusString = response.getStatusString();
        this.encoded = encoded.clone();
        this.tsaUrl = tsaUrl;
        TimeStampToken token = response.getTimeStampToken();
        this.timestamp = token == null ? null : new Timestamp(token, tsaUrl);
    }

    /**
     * @param encoded DER {@code application/timestamp-reply} body
     * @param tsaUrl  server that produced it, may be null
     * @throws TsaResponseException when the body is not a TimeStampResp
     */
    public static TimestampResponse parse(byte[] encoded, String tsaUrl) {
        if (encoded == null || encoded.length == 0) {
            throw new TsaResponseException("Empty response from TSA " + tsaUrl, TsaErrorType.TSA_INVALID_RESPONSE, null);
        }
        try {
            return new TimestampResponse(new TimeStampResponse(encoded), encoded, tsaUrl);
        } catch (TSPException | IOException | RuntimeException e) {
            throw new TsaResponseException("Unparseable response from TSA " + tsaUrl + ": " + e.getMessage(),
                TsaErrorType.TSA_INVALID_RESPONSE, null, e);
        }
    }

    TimeStampResponse toBouncyCastle() {
        return response;
    }

    public TsaStatus getStatus() {
        return status;
    }

    public boolean isGranted() {
        return status.isGranted();
    }

    public String getStatusString() {
        return statusString;
    }

    /**
     * @return PKIFailureInfo bits, 0 when none were sent
     */
    public int getFailInfo() {
        PKIFailureInfo failInfo = response.getFailInfo();
        return failInfo == null ? 0 : failInfo.intValue();
    }

    /**
     * @return the granted token, or null for rejected requests
     */
    public Timestamp getTimestamp() {
        return timestamp;
    }

    public String getTsaUrl() {
        return tsaUrl;
    }

    public byte[] getEncoded() {
        return encoded.clone();
    }
}
