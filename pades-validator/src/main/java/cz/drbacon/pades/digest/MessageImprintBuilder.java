package cz.drbacon.pades.digest;

import eu.europa.esig.dss.enumerations.DigestAlgorithm;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Computes message imprints and maps algorithm names and OIDs onto DSS {@link DigestAlgorithm} values.
 *
 * Accepted spellings: "SHA-256", "sha256", "SHA_256", the DSS enum name, or the dotted OID.
 */
public class MessageImprintBuilder {

    public static final DigestAlgorithm DEFAULT_ALGORITHM = DigestAlgorithm.SHA256;

    private static final Set<DigestAlgorithm> SUPPORTED = Collections.unmodifiableSet(EnumSet.of(
        DigestAlgorithm.SHA1,
        DigestAlgorithm.SHA224,
        DigestAlgorithm.SHA256,
        DigestAlgorithm.SHA384,
        DigestAlgorithm.SHA512,
        DigestAlgorithm.SHA3_256,
        DigestAlgorithm.SHA3_384,
        DigestAlgorithm.SHA3_512
    ));

    private static final Map<DigestAlgorithm, Integer> LENGTHS = new EnumMap<>(DigestAlgorithm.class);

    static {
        for (DigestAlgorithm algorithm : SUPPORTED) {
            try {
                LENGTHS.put(algorithm, MessageDigest.getInstance(algorithm.getJavaName()).getDigestLength());
            } catch (NoSuchAlgorithmException e) {
                throw new ExceptionInInitializerError(e);
            }
        }
    }

    public static Set<DigestAlgorithm> supportedAlgorithms() {
        return SUPPORTED;
    }

    /**
     * Resolve a hash algorithm from a name or a dotted OID.
     *
     * @throws IllegalArgumentException for unknown or unsupported algorithms
     */
    public static DigestAlgorithm resolve(String nameOrOid) {
        if (nameOrOid == null || nameOrOid.isBlank()) {
            throw new IllegalArgumentException("Hash algorithm must not be empty");
        }
        String trimmed = nameOrOid.trim();
        String normalized = normalize(trimmed);
        for (DigestAlgorithm algorithm : SUPPORTED) {
            if (trimmed.equals(algorithm.getOid())
                || normalized.equals(normalize(algorithm.getName()))
                || normalized.equals(normalize(algorithm.getJavaName()))
                || normalized.equals(normalize(algorithm.name()))) {
                return algorithm;
            }
        }
        throw new IllegalArgumentException("Unsupported hash algorithm: " + nameOrOid);
    }

    public static int digestLength(DigestAlgorithm algorithm) {
        Integer length = LENGTHS.get(Objects.requireNonNull(algorithm, "algorithm"));
        if (length == null) {
            throw new IllegalArgumentException("Unsupported hash algorithm: " + algorithm.getName());
        }
        return length;
    }

    public MessageImprint build(byte[] data) {
        return build(data, DEFAULT_ALGORITHM);
    }

    public MessageImprint build(byte[] data, DigestAlgorithm algorithm) {
        Objects.requireNonNull(data, "data");
        return new MessageImprint(algorithm, digest(data, algorithm));
    }

    public MessageImprint build(byte[] data, String nameOrOid) {
        return build(data, resolve(nameOrOid));
    }

    public byte[] digest(byte[] data, DigestAlgorithm algorithm) {
        digestLength(algorithm);
        try {
            return MessageDigest.getInstance(algorithm.getJavaName()).digest(data);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Digest " + algorithm.getJavaName() + " not available", e);
        }
    }

    private static String normalize(String name) {
        return name.replace("-", "").replace("_", "").toUpperCase(Locale.ROOT);
    }
}
