package cz.drbacon.pades.tsp;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.bouncycastle.tsp.TimeStampTokenInfo;

import java.math.BigInteger;
import java.time.Instant;
import java.util.HexFormat;

/**
 * The signed payload of a timestamp token.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class TstInfo {

    @JsonProperty("policy_oid")
    private final String policyOid;

    @JsonProperty("imprint_algorithm_oid")
    private final String imprintAlgorithmOid;

    @JsonIgnore
    private final byte[] imprintDigest;

    @JsonProperty("serial_number")
    private final String serialNumber;

    @JsonProperty("gen_time")
    private final Instant genTime;

    @JsonProperty("accuracy")
    private final TimestampAccuracy accuracy;

    @JsonProperty("nonce")
    private final String nonce;

    @JsonProperty("tsa_name")
    private final String tsaName;

    @JsonProperty("ordered")
    private final boolean ordered;

    TstInfo(TimeStampTokenInfo info) {
        this.policyOid = info.getPolicy() == null ? null : info.getPolicy().getId();
        this.imprintAlgorithmOid = info.getMessageImprintAlgOID().getId();
        this.imprintDigest = info.getMessageImprintDigest();
        this.serialNumber = info.getSerialNumber().toString(16);
        this.genTime = info.getGenTime().toInstant();
        this.accuracy = TimestampAccuracy.from(info.getGenTimeAccuracy());
        BigInteger rawNonce = info.getNonce();
        this.nonce = rawNonce == null ? null : rawNonce.toString(16);
        this.tsaName = info.getTsa() == null ? null : info.getTsa().getName().toString();
        this.ordered = info.isOrdered();
    }

    public String getPolicyOid() {
        return policyOid;
    }

    public String getImprintAlgorithmOid() {
        return imprintAlgorithmOid;
    }

    public byte[] getImprintDigest() {
        return imprintDigest.clone();
    }

    @JsonProperty("imprint_digest")
    public String getImprintDigestHex() {
        return HexFormat.of().formatHex(imprintDigest);
    }

    public String getSerialNumber() {
        return serialNumber;
    }

    public Instant getGenTime() {
        return genTime;
    }

    public TimestampAccuracy getAccuracy() {
        return accuracy;
    }

    public String getNonce() {
        return nonce;
    }

    public String getTsaName() {
        return tsaName;
    }

    public boolean isOrdered() {
        return ordered;
    }
}
