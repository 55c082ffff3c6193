package cz.drbacon.pades.testsupport;

import cz.drbacon.pades.BouncyCastleSupport;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x509.BasicConstraints;
import org.bouncycastle.asn1.x509.CRLReason;
import org.bouncycastle.asn1.x509.ExtendedKeyUsage;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.KeyPurposeId;
import org.bouncycastle.asn1.x509.KeyUsage;
import org.bouncycastle.cert.X509v2CRLBuilder;
import org.bouncycastle.cert.jcajce.JcaX509CRLConverter;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.cert.jcajce.JcaX509v2CRLBuilder;
import org.bouncycastle.cert.jcajce.JcaX509v3CertificateBuilder;
import org.bouncycastle.openssl.jcajce.JcaPEMWriter;
import org.bouncycastle.operator.ContentSigner;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;

import java.io.StringWriter;
import java.math.BigInteger;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.cert.X509CRL;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Date;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A small certificate hierarchy for tests: root CA, intermediate CA, signer leaf,
 * expired leaf and a TSA certificate, all RSA 2048.
 */
public final class TestPki {

    private static final AtomicLong SERIALS = new AtomicLong(1000);
    private static TestPki instance;

    public final KeyPair rootKey;
    public final X509Certificate root;
    public final KeyPair intermediateKey;
    public final X509Certificate intermediate;
    public final KeyPair leafKey;
    public final X509Certificate leaf;
    public final KeyPair expiredLeafKey;
    public final X509Certificate expiredLeaf;
    public final KeyPair tsaKey;
    public final X509Certificate tsa;
    public final KeyPair otherCaKey;
    public final X509Certificate otherCa;

    private TestPki() throws Exception {
        BouncyCastleSupport.ensureProvider();
        Instant now = Instant.now();
        Instant from = now.minus(Duration.ofDays(1));
        Instant to = now.plus(Duration.ofDays(365));

        rootKey = newKeyPair();
        root = issue("CN=Test Root CA,O=DrBacon Test,C=CZ", rootKey.getPublic(), null, rootKey.getPrivate(),
            from, to, true, false);
        intermediateKey = newKeyPair();
        intermediate = issue("CN=Test Intermediate CA,O=DrBacon Test,C=CZ", intermediateKey.getPublic(), root,
            rootKey.getPrivate(), from, to, true, false);
        leafKey = newKeyPair();
        leaf = issue("CN=Test Signer,O=DrBacon Test,C=CZ", leafKey.getPublic(), intermediate,
            intermediateKey.getPrivate(), from, to, false, false);
        expiredLeafKey = newKeyPair();
        expiredLeaf = issue("CN=Expired Signer,O=DrBacon Test,C=CZ", expiredLeafKey.getPublic(), intermediate,
            intermediateKey.getPrivate(), now.minus(Duration.ofDays(30)), now.minus(Duration.ofDays(1)), false, false);
        tsaKey = newKeyPair();
        tsa = issue("CN=Test TSA,O=DrBacon Test,C=CZ", tsaKey.getPublic(), root, rootKey.getPrivate(),
            from, to, false, true);
        otherCaKey = newKeyPair();
        otherCa = issue("CN=Unrelated CA,O=Elsewhere,C=DE", otherCaKey.getPublic(), null, otherCaKey.getPrivate(),
            from, to, true, false);
    }

    /**
     * Key generation is slow, so the hierarchy is built once per test JVM.
     */
    public static synchronized TestPki get() {
        if (instance == null) {
            try {
                instance = new TestPki();
            } catch (Exception e) {
                throw new IllegalStateException("Cannot create test PKI", e);
            }
        }
        return instance;
    }

    public List<X509Certificate> signerChain() {
        return Arrays.asList(leaf, intermediate);
    }

    public List<X509Certificate> roots() {
        return Arrays.asList(root);
    }

    public static KeyPair newKeyPair() throws Exception {
        KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
        generator.initialize(2048);
        return generator.generateKeyPair();
    }

    public static X509Certificate issue(String subject, PublicKey publicKey, X509Certificate issuer, PrivateKey issuerKey,
                                        Instant notBefore, Instant notAfter, boolean ca, boolean timeStamping)
            throws Exception {
        X500Name subjectName = new X500Name(subject);
        X500Name issuerName = issuer == null
            ? subjectName
            : X500Name.getInstance(issuer.getSubjectX500Principal().getEncoded());
        JcaX509v3CertificateBuilder builder = new JcaX509v3CertificateBuilder(issuerName,
            BigInteger.valueOf(SERIALS.incrementAndGet()), Date.from(notBefore), Date.from(notAfter),
            subjectName, publicKey);
        builder.addExtension(Extension.basicConstraints, true, new BasicConstraints(ca));
        builder.addExtension(Extension.keyUsage, true, ca
            ? new KeyUsage(KeyUsage.keyCertSign | KeyUsage.cRLSign)
            : new KeyUsage(KeyUsage.digitalSignature | KeyUsage.nonRepudiation));
        if (timeStamping) {
            builder.addExtension(Extension.extendedKeyUsage, true, new ExtendedKeyUsage(KeyPurposeId.id_kp_timeStamping));
        }
        ContentSigner signer = new JcaContentSignerBuilder("SHA256withRSA")
            .setProvider(BouncyCastleSupport.PROVIDER).build(issuerKey);
        return new JcaX509CertificateConverter().setProvider(BouncyCastleSupport.PROVIDER)
            .getCertificate(builder.build(signer));
    }

    /**
     * CRL of the intermediate CA listing {@code revoked}, valid for one more day.
     */
    public X509CRL intermediateCrl(X509Certificate... revoked) throws Exception {
        Date now = new Date();
        X509v2CRLBuilder builder = new JcaX509v2CRLBuilder(intermediate, now);
        builder.setNextUpdate(Date.from(now.toInstant().plus(Duration.ofDays(1))));
        for (X509Certificate certificate : revoked) {
            builder.addCRLEntry(certificate.getSerialNumber(), now, CRLReason.keyCompromise);
        }
        ContentSigner signer = new JcaContentSignerBuilder("SHA256withRSA")
            .setProvider(BouncyCastleSupport.PROVIDER).build(intermediateKey.getPrivate());
        return new JcaX509CRLConverter().setProvider(BouncyCastleSupport.PROVIDER).getCRL(builder.build(signer));
    }

    public static String toPem(Object... objects) throws Exception {
        StringWriter out = new StringWriter();
        try (JcaPEMWriter writer = new JcaPEMWriter(out)) {
            for (Object object : objects) {
                writer.writeObject(object);
            }
        }
        return out.toString();
    }
}
