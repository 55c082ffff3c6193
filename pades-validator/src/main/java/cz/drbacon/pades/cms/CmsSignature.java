package cz.drbacon.pades.cms;

import cz.drbacon.pades.tsp.Timestamp;
import org.bouncycastle.asn1.cms.AttributeTable;
import org.bouncycastle.cms.CMSSignedData;
import org.bouncycastle.cms.SignerInformation;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A parsed detached CMS signature with the content it was made over.
 * At most one timestamp is attached, taken from the signer's unsigned attributes.
 */
public final class CmsSignature {

    private final CMSSignedData signedData;
    private final SignerInformation signerInformation;
    private final X509Certificate signerCertificate;
    private final List<X509Certificate> certificates;
    private final byte[] content;
    private final Timestamp timestamp;

    CmsSignature(CMSSignedData signedData, SignerInformation signerInformation, X509Certificate signerCertificate,
                 List<X509Certificate> certificates, byte[] content, Timestamp timestamp) {
        this.signedData = Objects.requireNonNull(signedData, "signedData");
        this.signerInformation = Objects.requireNonNull(signerInformation, "signerInformation");
        this.signerCertificate = signerCertificate;
        this.certificates = Collections.unmodifiableList(new ArrayList<>(certificates));
        this.content = content;
        this.timestamp = timestamp;
    }

    public CMSSignedData getSignedData() {
        return signedData;
    }

    public SignerInformation getSignerInformation() {
        return signerInformation;
    }

    public AttributeTable getSignedAttributes() {
        return signerInformation.getSignedAttributes();
    }

    public AttributeTable getUnsignedAttributes() {
        return signerInformation.getUnsignedAttributes();
    }

    /**
     * Signer certificate first (when embedded), then the remaining embedded certificates.
     */
    public List<X509Certificate> getCertificates() {
        return certificates;
    }

    /**
     * @return the signer certificate, or null if the CMS did not carry it
     */
    public X509Certificate getSignerCertificate() {
        return signerCertificate;
    }

    public boolean hasSignerCertificate() {
        return signerCertificate != null;
    }

    public byte[] getContent() {
        return content == null ? null : content.clone();
    }

    /**
     * The raw signature value; this is what a signature timestamp is computed over.
     */
    public byte[] getSignatureValue() {
        return signerInformation.getSignature();
    }

    public String getDigestAlgorithmOid() {
        return signerInformation.getDigestAlgOID();
    }

    public Timestamp getTimestamp() {
        return timestamp;
    }

    public boolean hasTimestamp() {
        return timestamp != null;
    }

    public CmsSignature withTimestamp(Timestamp newTimestamp) {
        return new CmsSignature(signedData, signerInformation, signerCertificate, certificates, content, newTimestamp);
    }

    /**
     * Replace the CMS structure, keeping certificates and content. Used after unsigned attributes change.
     */
    public CmsSignature withSignedData(CMSSignedData newSignedData, SignerInformation newSigner, Timestamp newTimestamp) {
        return new CmsSignature(newSignedData, newSigner, signerCertificate, certificates, content, newTimestamp);
    }

    public byte[] getEncoded() {
        try {
            return signedData.getEncoded();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to encode CMS signature", e);
        }
    }
}
