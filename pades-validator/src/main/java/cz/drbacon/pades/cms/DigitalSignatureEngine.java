package cz.drbacon.pades.cms;

import cz.drbacon.pades.BouncyCastleSupport;
import cz.drbacon.pades.cert.CertificateManager;
import cz.drbacon.pades.cert.CertificateValidationResult;
import cz.drbacon.pades.digest.MessageImprintBuilder;
import cz.drbacon.pades.tsp.Timestamp;
import cz.drbacon.pades.tsp.TimestampServerManager;
import cz.drbacon.pades.tsp.TimestampVerificationResult;
import eu.europa.esig.dss.enumerations.DigestAlgorithm;
import org.apache.pdfbox.cos.COSBase;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.cos.COSString;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.interactive.digitalsignature.PDSignature;
import org.apache.pdfbox.pdmodel.interactive.form.PDSignatureField;
import org.bouncycastle.asn1.ASN1OctetString;
import org.bouncycastle.asn1.cms.Attribute;
import org.bouncycastle.asn1.cms.AttributeTable;
import org.bouncycastle.asn1.cms.CMSAttributes;
import org.bouncycastle.cms.SignerInformation;
import org.bouncycastle.cms.SignerInformationVerifier;
import org.bouncycastle.cms.jcajce.JcaSimpleSignerInfoVerifierBuilder;
import org.bouncycastle.operator.ContentVerifier;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.operator.RuntimeOperatorException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.security.MessageDigest;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.Calendar;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Finds the signatures of a PDF and checks each one against its own byte range.
 *
 * Validation of a signature consists of four checks, each reported separately:
 * <ol>
 *   <li>the digest of the covered bytes equals the {@code messageDigest} signed attribute,</li>
 *   <li>the signature value verifies over the DER signed attributes with the signer's key,</li>
 *   <li>the signer's certificate chain leads to a trusted root,</li>
 *   <li>the embedded signature timestamp, if any, covers the signature value.</li>
 * </ol>
 */
public class DigitalSignatureEngine {

    private static final Logger LOG = LoggerFactory.getLogger(DigitalSignatureEngine.class);

    private final CertificateManager certificateManager;
    private final TimestampServerManager timestampManager;
    private final Collection<X509Certificate> trustedRoots;
    private final CmsSignatureParser parser = new CmsSignatureParser();
    private final MessageImprintBuilder imprintBuilder = new MessageImprintBuilder();

    public DigitalSignatureEngine(CertificateManager certificateManager, TimestampServerManager timestampManager,
                                  Collection<X509Certificate> trustedRoots) {
        BouncyCastleSupport.ensureProvider();
        this.certificateManager = certificateManager;
        this.timestampManager = timestampManager;
        this.trustedRoots = trustedRoots == null
            ? Collections.emptyList()
            : Collections.unmodifiableList(new ArrayList<>(trustedRoots));
    }

    // ---------------------------------------------------------------- extraction

    /**
     * @throws SignatureExtractionException if PDFBox cannot open the document
     */
    public List<ExtractedSignature> extractSignatures(byte[] pdf) {
        try (PDDocument document = PDDocument.load(pdf)) {
            return extractSignatures(document, pdf);
        } catch (IOException e) {
            throw new SignatureExtractionException("Cannot read PDF: " + e.getMessage(), e);
        }
    }

    /**
     * @param document an already loaded view of {@code pdf}; it is not closed
     * @param pdf      the exact bytes the byte ranges refer to
     */
    public List<ExtractedSignature> extractSignatures(PDDocument document, byte[] pdf) {
        List<PDSignatureField> fields;
        try {
            fields = document.getSignatureFields();
        } catch (IOException e) {
            throw new SignatureExtractionException("Cannot read signature fields: " + e.getMessage(), e);
        }

        List<ExtractedSignature> result = new ArrayList<>();
        for (PDSignatureField field : fields) {
            PDSignature signature = field.getSignature();
            if (signature == null) {
                LOG.debug("Signature field '{}' is not signed", field.getFullyQualifiedName());
                continue;
            }
            result.add(extract(field.getFullyQualifiedName(), signature, pdf));
        }
        LOG.info("Found {} signature(s) in {} signature field(s)", result.size(), fields.size());
        return result;
    }

    private ExtractedSignature extract(String fieldName, PDSignature dictionary, byte[] pdf) {
        ExtractedSignature.Builder builder = ExtractedSignature.builder(fieldName)
            .signerName(dictionary.getName())
            .reason(dictionary.getReason())
            .location(dictionary.getLocation())
            .subFilter(dictionary.getSubFilter());
        Calendar signDate = dictionary.getSignDate();
        if (signDate != null) {
            builder.signDate(signDate.toInstant());
        }

        ByteRange byteRange;
        try {
            byteRange = ByteRange.parse(dictionary.getByteRange(), pdf.length);
        } catch (IllegalArgumentException e) {
            LOG.warn("Signature '{}' has an unusable byte range: {}", fieldName, e.getMessage());
            return builder.extractionProblem("Invalid byte range: " + e.getMessage()).build();
        }
        builder.byteRange(byteRange);

        boolean whole = byteRange.coversWholeDocument(pdf.length);
        builder.coversWholeDocument(whole);
        if (!whole) {
            builder.warning("Signature covers " + byteRange.coveredLength() + " of " + pdf.length
                + " bytes; the document was changed by a later incremental update");
        }
        if (byteRange.gapCount() == 0) {
            builder.warning("Byte range " + byteRange + " excludes no signature contents");
        }
        for (String gap : byteRange.suspiciousGaps(pdf)) {
            builder.warning(gap);
        }

        byte[] contents = contentsOf(dictionary);
        if (contents == null) {
            return builder.extractionProblem("Signature dictionary has no /Contents").build();
        }

        CmsSignature cms;
        try {
            cms = parser.parse(contents, byteRange.signedContent(pdf));
        } catch (SignatureExtractionException e) {
            LOG.warn("Signature '{}' cannot be parsed: {}", fieldName, e.getMessage());
            return builder.extractionProblem(e.getMessage()).build();
        }

        Optional<Timestamp> timestamp = timestampManager.extractTimestamp(cms);
        if (timestamp.isPresent()) {
            cms = cms.withTimestamp(timestamp.get());
        }
        return builder.signature(cms).build();
    }

    private static byte[] contentsOf(PDSignature dictionary) {
        COSBase contents = dictionary.getCOSObject().getDictionaryObject(COSName.CONTENTS);
        if (!(contents instanceof COSString)) {
            return null;
        }
        byte[] bytes = ((COSString) contents).getBytes();
        return bytes.length == 0 ? null : bytes;
    }

    // ---------------------------------------------------------------- validation

    public SignatureValidationResult validateSignature(ExtractedSignature extracted) {
        return validateSignature(extracted, new HashMap<>());
    }

    /**
     * Validate signatures in order. A chain shared by several signatures is validated once.
     * An unexpected failure in one signature becomes that signature's error.
     */
    public List<SignatureValidationResult> validateSignatures(List<ExtractedSignature> signatures) {
        Map<String, CertificateValidationResult> chains = new HashMap<>();
        List<SignatureValidationResult> results = new ArrayList<>(signatures.size());
        for (ExtractedSignature signature : signatures) {
            try {
                results.add(validateSignature(signature, chains));
            } catch (RuntimeException e) {
                LOG.warn("Signature '{}' could not be validated", signature.getFieldName(), e);
                SignatureValidationResult failed = SignatureValidationResult.builder(signature)
                    .error("Signature could not be validated: " + e.getMessage())
                    .build();
                results.add(finish(signature, failed));
            }
        }
        return results;
    }

    private SignatureValidationResult validateSignature(ExtractedSignature extracted,
                                                        Map<String, CertificateValidationResult> chains) {
        SignatureValidationResult.Builder result = SignatureValidationResult.builder(extracted);
        if (!extracted.isExtracted()) {
            result.error("Signature could not be extracted: " + extracted.getExtractionProblem());
            return finish(extracted, result.build());
        }

        CmsSignature signature = extracted.getSignature();
        SignerInformation signer = signature.getSignerInformation();
        X509Certificate signerCertificate = signature.getSignerCertificate();
        if (signerCertificate != null) {
            result.signer(certificateManager.getCertificateInfo(signerCertificate));
        }

        DigestAlgorithm digestAlgorithm = null;
        try {
            digestAlgorithm = MessageImprintBuilder.resolve(signer.getDigestAlgOID());
            result.digestAlgorithm(digestAlgorithm.getName());
        } catch (IllegalArgumentException e) {
            result.digestAlgorithm(signer.getDigestAlgOID());
        }

        checkDigest(signature, digestAlgorithm, result);
        checkSignatureValue(signer, signerCertificate, result);
        checkCertificateChain(signature, chains, result);

        if (signature.hasTimestamp()) {
            TimestampVerificationResult timestamp = timestampManager.verifyTimestamp(
                signature.getTimestamp(), signature.getSignatureValue());
            result.timestampVerification(timestamp);
            if (!timestamp.isValid()) {
                result.error("Timestamp invalid: " + String.join("; ", timestamp.getErrors()));
            }
            result.warnings(timestamp.getWarnings());
        }

        return finish(extracted, result.build());
    }

    private void checkDigest(CmsSignature signature, DigestAlgorithm algorithm, SignatureValidationResult.Builder result) {
        if (algorithm == null) {
            result.error("Digest mismatch: unsupported digest algorithm "
                + signature.getSignerInformation().getDigestAlgOID());
            return;
        }
        byte[] expected = messageDigestAttribute(signature.getSignedAttributes());
        if (expected == null) {
            result.error("Digest mismatch: signer carries no usable messageDigest signed attribute");
            return;
        }
        byte[] computed = imprintBuilder.digest(signature.getContent(), algorithm);
        if (MessageDigest.isEqual(expected, computed)) {
            result.digestValid(true);
        } else {
            result.error("Digest mismatch: covered bytes do not hash to the signed messageDigest");
        }
    }

    private static byte[] messageDigestAttribute(AttributeTable signedAttributes) {
        if (signedAttributes == null) {
            return null;
        }
        Attribute attribute = signedAttributes.get(CMSAttributes.messageDigest);
        if (attribute == null || attribute.getAttrValues().size() != 1) {
            return null;
        }
        try {
            return ASN1OctetString.getInstance(attribute.getAttrValues().getObjectAt(0)).getOctets();
        } catch (IllegalArgumentException e) {
            LOG.debug("messageDigest attribute is not an OCTET STRING: {}", e.getMessage());
            return null;
        }
    }

    private void checkSignatureValue(SignerInformation signer, X509Certificate certificate,
                                     SignatureValidationResult.Builder result) {
        if (certificate == null) {
            result.error("Signature mismatch: signer certificate is not embedded");
            return;
        }
        try {
            SignerInformationVerifier verifier = new JcaSimpleSignerInfoVerifierBuilder()
                .setProvider(BouncyCastleSupport.PROVIDER)
                .build(certificate);
            ContentVerifier contentVerifier = verifier.getContentVerifier(
                signer.toASN1Structure().getDigestEncryptionAlgorithm(), signer.getDigestAlgorithmID());
            byte[] signedAttributes = signer.getEncodedSignedAttributes();
            if (signedAttributes == null) {
                result.error("Signature mismatch: no signed attributes to verify");
                return;
            }
            try (OutputStream out = contentVerifier.getOutputStream()) {
                out.write(signedAttributes);
            }
            if (contentVerifier.verify(signer.getSignature())) {
                result.signatureValid(true);
            } else {
                result.error("Signature mismatch: signature value does not verify with the signer's public key");
            }
        } catch (OperatorCreationException | IOException | RuntimeOperatorException e) {
            result.error("Signature mismatch: " + e.getMessage());
        }
    }

    /**
     * Chain warnings stay on the chain result; only the verdict is reported on the signature.
     */
    private void checkCertificateChain(CmsSignature signature, Map<String, CertificateValidationResult> chains,
                                       SignatureValidationResult.Builder result) {
        if (!signature.hasSignerCertificate()) {
            result.error("Certificate chain invalid: signer certificate is not embedded");
            return;
        }
        if (trustedRoots.isEmpty()) {
            result.error("Certificate chain invalid: no trusted roots configured");
            return;
        }
        List<X509Certificate> certificates = signature.getCertificates();
        String key = chainKey(certificates);
        CertificateValidationResult chain = chains.get(key);
        if (chain == null) {
            chain = certificateManager.validateCertificateChain(certificates, trustedRoots);
            chains.put(key, chain);
        }
        result.certificateValidation(chain);
        if (chain.isValid()) {
            result.certificateChainValid(true);
        } else {
            result.error("Certificate chain invalid: " + String.join("; ", chain.getErrors()));
        }
    }

    private static String chainKey(List<X509Certificate> certificates) {
        StringBuilder key = new StringBuilder();
        for (X509Certificate certificate : certificates) {
            key.append(CertificateManager.fingerprint(certificate)).append('/');
        }
        return key.toString();
    }

    private static SignatureValidationResult finish(ExtractedSignature extracted, SignatureValidationResult result) {
        if (result.isValid()) {
            LOG.info("SIGNATURE_OK: '{}'", extracted.getFieldName());
        } else {
            LOG.info("SIGNATURE_FAIL: '{}' {}", extracted.getFieldName(), result.getErrors());
        }
        return result;
    }
}
