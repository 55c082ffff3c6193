package cz.drbacon.pades.testsupport;

import cz.drbacon.pades.BouncyCastleSupport;
import cz.drbacon.pades.tsp.TimestampTransport;
import org.bouncycastle.asn1.ASN1ObjectIdentifier;
import org.bouncycastle.asn1.cmp.PKIFailureInfo;
import org.bouncycastle.asn1.cmp.PKIStatus;
import org.bouncycastle.asn1.oiw.OIWObjectIdentifiers;
import org.bouncycastle.asn1.x509.AlgorithmIdentifier;
import org.bouncycastle.cert.jcajce.JcaCertStore;
import org.bouncycastle.cms.jcajce.JcaSimpleSignerInfoGeneratorBuilder;
import org.bouncycastle.operator.DigestCalculator;
import org.bouncycastle.operator.jcajce.JcaDigestCalculatorProviderBuilder;
import org.bouncycastle.tsp.TSPAlgorithms;
import org.bouncycastle.tsp.TimeStampRequest;
import org.bouncycastle.tsp.TimeStampResponseGenerator;
import org.bouncycastle.tsp.TimeStampTokenGenerator;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigInteger;
import java.util.Collections;
import java.util.Date;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process RFC 3161 authority signing with the {@link TestPki} TSA certificate.
 */
public final class TestTsa {

    public static final String POLICY_OID = "1.2.3.4.1";

    private final TimeStampResponseGenerator responseGenerator;
    private final AtomicLong serials = new AtomicLong(1);

    public TestTsa(TestPki pki) {
        try {
            DigestCalculator certIdDigest = new JcaDigestCalculatorProviderBuilder().build()
                .get(new AlgorithmIdentifier(OIWObjectIdentifiers.idSHA1));
            TimeStampTokenGenerator tokenGenerator = new TimeStampTokenGenerator(
                new JcaSimpleSignerInfoGeneratorBuilder().setProvider(BouncyCastleSupport.PROVIDER)
                    .build("SHA256withRSA", pki.tsaKey.getPrivate(), pki.tsa),
                certIdDigest, new ASN1ObjectIdentifier(POLICY_OID));
            tokenGenerator.setAccuracySeconds(1);
            tokenGenerator.addCertificates(new JcaCertStore(Collections.singletonList(pki.tsa)));
            this.responseGenerator = new TimeStampResponseGenerator(tokenGenerator, TSPAlgorithms.ALLOWED);
        } catch (Exception e) {
            throw new IllegalStateException("Cannot create test TSA", e);
        }
    }

    public byte[] respond(byte[] encodedRequest) {
        try {
            TimeStampRequest request = new TimeStampRequest(encodedRequest);
            return responseGenerator.generate(request, BigInteger.valueOf(serials.getAndIncrement()), new Date())
                .getEncoded();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        } catch (Exception e) {
            throw new IllegalStateException("Test TSA failed: " + e.getMessage(), e);
        }
    }

    /**
     * A well-formed "rejection" response.
     */
    public byte[] rejection() {
        try {
            return responseGenerator.generateFailResponse(PKIStatus.REJECTION, PKIFailureInfo.badAlg,
                "algorithm not supported").getEncoded();
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }

    public TimestampTransport transport() {
        return (config, request) -> respond(request);
    }
}
