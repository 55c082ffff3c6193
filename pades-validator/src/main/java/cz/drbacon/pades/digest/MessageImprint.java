package cz.drbacon.pades.digest;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import eu.europa.esig.dss.enumerations.DigestAlgorithm;

import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Hash algorithm plus digest value identifying a piece of data (RFC 3161 MessageImprint).
 */
public final class MessageImprint {

    private final DigestAlgorithm hashAlgorithm;
    private final byte[] hashedMessage;

    public MessageImprint(DigestAlgorithm hashAlgorithm, byte[] hashedMessage) {
        Objects.requireNonNull(hashAlgorithm, "hashAlgorithm");
        Objects.requireNonNull(hashedMessage, "hashedMessage");
        int expected = MessageImprintBuilder.digestLength(hashAlgorithm);
        if (hashedMessage.length != expected) {
            throw new IllegalArgumentException(String.format(
                "Digest length %d does not match %s (expected %d bytes)",
                hashedMessage.length, hashAlgorithm.getName(), expected));
        }
        this.hashAlgorithm = hashAlgorithm;
        this.hashedMessage = hashedMessage.clone();
    }

    @JsonIgnore
    public DigestAlgorithm getHashAlgorithm() {
        return hashAlgorithm;
    }

    @JsonProperty("hash_algorithm")
    public String getAlgorithmName() {
        return hashAlgorithm.getName();
    }

    @JsonProperty("hash_algorithm_oid")
    public String getAlgorithmOid() {
        return hashAlgorithm.getOid();
    }

    @JsonIgnore
    public byte[] getHashedMessage() {
        return hashedMessage.clone();
    }

    @JsonProperty("hashed_message")
    public String getHashedMessageHex() {
        return HexFormat.of().formatHex(hashedMessage);
    }

    /**
     * Constant-time comparison against a raw digest value.
     */
    public boolean matches(byte[] otherDigest) {
        return otherDigest != null && MessageDigest.isEqual(hashedMessage, otherDigest);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MessageImprint)) return false;
        MessageImprint that = (MessageImprint) o;
        return hashAlgorithm == that.hashAlgorithm && MessageDigest.isEqual(hashedMessage, that.hashedMessage);
    }

    @Override
    public int hashCode() {
        return 31 * hashAlgorithm.hashCode() + java.util.Arrays.hashCode(hashedMessage);
    }

    @Override
    public String toString() {
        return hashAlgorithm.getName() + ":" + getHashedMessageHex();
    }
}
