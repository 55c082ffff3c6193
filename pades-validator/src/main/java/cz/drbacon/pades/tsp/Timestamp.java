package cz.drbacon.pades.tsp;

import cz.drbacon.pades.BouncyCastleSupport;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.cms.CMSException;
import org.bouncycastle.cms.CMSSignedData;
import org.bouncycastle.tsp.TSPException;
import org.bouncycastle.tsp.TimeStampToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import java.time.Instant;
import java.util.Collection;

/**
 * A timestamp token obtained earlier, with its TSA certificate (if embedded) and raw encoding.
 */
public final class Timestamp {

    private static final Logger LOG = LoggerFactory.getLogger(Timestamp.class);

    private final TimeStampToken token;
    private final TstInfo info;
    private final String tsaUrl;
    private final X509Certificate tsaCertificate;

    Timestamp(TimeStampToken token, String tsaUrl) {
        this.token = token;
        this.info = new TstInfo(token.getTimeStampInfo());
        this.tsaUrl = tsaUrl;
        this.tsaCertificate = findSignerCertificate(token);
    }

    /**
     * Parse a DER encoded TimeStampToken (a CMS ContentInfo).
     *
     * @throws TimestampValidationException if the bytes are not a timestamp token
     */
    public static Timestamp fromEncoded(byte[] encoded, String tsaUrl) {
        try {
            return new Timestamp(new TimeStampToken(new CMSSignedData(encoded)), tsaUrl);
        } catch (CMSException | TSPException | IOException | IllegalArgumentException e) {
            throw new TimestampValidationException("Malformed timestamp token: " + e.getMessage(), e);
        }
    }

    private static X509Certificate findSignerCertificate(TimeStampToken token) {
        Collection<X509CertificateHolder> matches = token.getCertificates().getMatches(token.getSID());
        if (matches.isEmpty()) {
            return null;
        }
        try {
            BouncyCastleSupport.ensureProvider();
            return new JcaX509CertificateConverter().setProvider(BouncyCastleSupport.PROVIDER)
                .getCertificate(matches.iterator().next());
        } catch (CertificateException e) {
            LOG.warn("TSA certificate in token cannot be decoded: {}", e.getMessage());
            return null;
        }
    }

    public TimeStampToken getToken() {
        return token;
    }

    public TstInfo getInfo() {
        return info;
    }

    public Instant getGenTime() {
        return info.getGenTime();
    }

    public String getSerialNumber() {
        return info.getSerialNumber();
    }

    /**
     * @return URL the token was obtained from, null for tokens read from a signature
     */
    public String getTsaUrl() {
        return tsaUrl;
    }

    /**
     * @return the TSA signing certificate, or null when the TSA did not embed it
     */
    public X509Certificate getTsaCertificate() {
        return tsaCertificate;
    }

    public byte[] getEncoded() {
        try {
            return token.getEncoded();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to encode timestamp token", e);
        }
    }
}
