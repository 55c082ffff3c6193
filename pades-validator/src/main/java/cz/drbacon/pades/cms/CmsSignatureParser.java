package cz.drbacon.pades.cms;

import cz.drbacon.pades.BouncyCastleSupport;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.cms.CMSException;
import org.bouncycastle.cms.CMSProcessableByteArray;
import org.bouncycastle.cms.CMSSignedData;
import org.bouncycastle.cms.SignerInformation;
import org.bouncycastle.util.Store;

import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;

/**
 * Parses the /Contents of a PDF signature as detached CMS SignedData.
 */
public class CmsSignatureParser {

    private final JcaX509CertificateConverter converter;

    public CmsSignatureParser() {
        BouncyCastleSupport.ensureProvider();
        this.converter = new JcaX509CertificateConverter().setProvider(BouncyCastleSupport.PROVIDER);
    }

    /**
     * @param cmsBytes DER CMS, trailing zero padding from the PDF placeholder is tolerated
     * @param content  the detached content (covered byte range); may be null
     * @throws SignatureExtractionException if the bytes are not a CMS SignedData with a signer
     */
    public CmsSignature parse(byte[] cmsBytes, byte[] content) {
        if (cmsBytes == null || cmsBytes.length == 0) {
            throw new SignatureExtractionException("Signature contents are empty");
        }
        CMSSignedData signedData;
        try {
            signedData = content != null
                ? new CMSSignedData(new CMSProcessableByteArray(content), cmsBytes)
                : new CMSSignedData(cmsBytes);
        } catch (CMSException | RuntimeException e) {
            throw new SignatureExtractionException("Contents are not a CMS SignedData structure: " + e.getMessage(), e);
        }

        Collection<SignerInformation> signers = signedData.getSignerInfos().getSigners();
        if (signers.isEmpty()) {
            throw new SignatureExtractionException("CMS SignedData has no signer");
        }
        SignerInformation signer = signers.iterator().next();
        List<X509Certificate> certificates = orderedCertificates(signedData, signer);
        X509Certificate signerCertificate = null;
        if (!certificates.isEmpty() && signer.getSID().match(toHolder(certificates.get(0)))) {
            signerCertificate = certificates.get(0);
        }
        return new CmsSignature(signedData, signer, signerCertificate, certificates, content, null);
    }

    private static X509CertificateHolder toHolder(X509Certificate certificate) {
        try {
            return new X509CertificateHolder(certificate.getEncoded());
        } catch (java.io.IOException | java.security.cert.CertificateEncodingException e) {
            throw new SignatureExtractionException("Embedded certificate cannot be encoded: " + e.getMessage(), e);
        }
    }

    private List<X509Certificate> orderedCertificates(CMSSignedData signedData, SignerInformation signer) {
        Store<X509CertificateHolder> store = signedData.getCertificates();
        List<X509Certificate> result = new ArrayList<>();
        try {
            Collection<X509CertificateHolder> matches = store.getMatches(signer.getSID());
            X509CertificateHolder signerHolder = matches.isEmpty() ? null : matches.iterator().next();
            if (signerHolder != null) {
                result.add(converter.getCertificate(signerHolder));
            }
            Iterator<X509CertificateHolder> all = store.getMatches(null).iterator();
            while (all.hasNext()) {
                X509CertificateHolder holder = all.next();
                if (!holder.equals(signerHolder)) {
                    result.add(converter.getCertificate(holder));
                }
            }
        } catch (CertificateException e) {
            throw new SignatureExtractionException("Embedded certificate cannot be decoded: " + e.getMessage(), e);
        }
        return result;
    }
}
