package cz.drbacon.pades.tsp;

import cz.drbacon.pades.digest.MessageImprint;
import org.bouncycastle.tsp.TimeStampRequest;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigInteger;

/**
 * An encoded RFC 3161 TimeStampReq together with the imprint it asks to be timestamped.
 */
public final class TimestampRequest {

    private final MessageImprint messageImprint;
    private final String policyOid;
    private final BigInteger nonce;
    private final boolean certificateRequested;
    private final TimeStampRequest request;

    TimestampRequest(MessageImprint messageImprint, TimeStampRequest request) {
        this.messageImprint = messageImprint;
        this.request = request;
        this.policyOid = request.getReqPolicy() == null ? null : request.getReqPolicy().getId();
        this.nonce = request.getNonce();
        this.certificateRequested = request.getCertReq();
    }

    public MessageImprint getMessageImprint() {
        return messageImprint;
    }

    public String getPolicyOid() {
        return policyOid;
    }

    /**
     * @return the nonce, or null when the request was built without one
     */
    public BigInteger getNonce() {
        return nonce;
    }

    public boolean isCertificateRequested() {
        return certificateRequested;
    }

    TimeStampRequest toBouncyCastle() {
        return request;
    }

    /**
     * DER bytes as sent with content type {@code application/timestamp-query}.
     */
    public byte[] getEncoded() {
        try {
            return request.getEncoded();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to encode timestamp request", e);
        }
    }
}
