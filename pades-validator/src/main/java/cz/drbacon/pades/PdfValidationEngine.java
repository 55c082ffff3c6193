package cz.drbacon.pades;

import cz.drbacon.pades.cert.CertificateManager;
import cz.drbacon.pades.cert.CertificateValidationResult;
import cz.drbacon.pades.cms.CmsSignature;
import cz.drbacon.pades.cms.DigitalSignatureEngine;
import cz.drbacon.pades.cms.ExtractedSignature;
import cz.drbacon.pades.cms.SignatureExtractionException;
import cz.drbacon.pades.cms.SignatureValidationResult;
import cz.drbacon.pades.digest.MessageImprintBuilder;
import cz.drbacon.pades.pdf.PdfStructureValidator;
import cz.drbacon.pades.pdf.StructureValidationResult;
import cz.drbacon.pades.report.CertificateValidationSummary;
import cz.drbacon.pades.report.PdfValidationResult;
import cz.drbacon.pades.report.SignatureValidationSummary;
import cz.drbacon.pades.report.TimestampValidationSummary;
import cz.drbacon.pades.tsp.TimestampServerManager;
import cz.drbacon.pades.tsp.TimestampVerificationResult;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.apache.pdfbox.pdmodel.interactive.form.PDAcroForm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.security.cert.X509Certificate;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs structure, signature, certificate and timestamp validation over one PDF and merges
 * the partial results into a {@link PdfValidationResult}.
 *
 * Only a fatal structure error (unreadable header) stops the run early. Every error and
 * warning of the components is forwarded once, with a prefix naming the signature field or
 * certificate it belongs to.
 *
 * Instances keep no state between calls. Use one instance per thread, or share one if the
 * injected managers are shared safely.
 */
public class PdfValidationEngine {

    private static final Logger LOG = LoggerFactory.getLogger(PdfValidationEngine.class);

    private final PdfStructureValidator structureValidator;
    private final DigitalSignatureEngine signatureEngine;
    private final CertificateManager certificateManager;
    private final Collection<X509Certificate> trustedRoots;
    private final Clock clock;
    private final MessageImprintBuilder imprintBuilder = new MessageImprintBuilder();

    public PdfValidationEngine(Collection<X509Certificate> trustedRoots) {
        this(new CertificateManager(), new TimestampServerManager(), trustedRoots);
    }

    public PdfValidationEngine(CertificateManager certificateManager, TimestampServerManager timestampManager,
                               Collection<X509Certificate> trustedRoots) {
        this(new PdfStructureValidator(),
            new DigitalSignatureEngine(certificateManager, timestampManager, trustedRoots),
            certificateManager, trustedRoots, Clock.systemUTC());
    }

    public PdfValidationEngine(PdfStructureValidator structureValidator, DigitalSignatureEngine signatureEngine,
                               CertificateManager certificateManager, Collection<X509Certificate> trustedRoots,
                               Clock clock) {
        this.structureValidator = structureValidator;
        this.signatureEngine = signatureEngine;
        this.certificateManager = certificateManager;
        this.trustedRoots = trustedRoots == null
            ? Collections.emptyList()
            : Collections.unmodifiableList(new ArrayList<>(trustedRoots));
        this.clock = clock;
    }

    public PdfValidationResult validatePdf(byte[] pdf) {
        PdfValidationResult.Builder report = PdfValidationResult.builder(clock.instant());
        if (pdf == null) {
            pdf = new byte[0];
        }
        report.documentSha256(HexFormat.of().formatHex(
            imprintBuilder.digest(pdf, MessageImprintBuilder.DEFAULT_ALGORITHM)));

        StructureValidationResult structure = structureValidator.validate(pdf);
        report.structureValidation(structure);
        for (String error : structure.getErrors()) {
            report.error("Structure: " + error);
        }
        for (String warning : structure.getWarnings()) {
            report.warning("Structure: " + warning);
        }
        if (structure.isFatal()) {
            LOG.warn("VALIDATION_FAIL: fatal structure error, signatures not examined");
            return finish(report);
        }

        List<ExtractedSignature> extracted;
        try (PDDocument document = PDDocument.load(pdf)) {
            report.pageCount(document.getNumberOfPages());
            report.encrypted(document.isEncrypted());
            PDAcroForm form = document.getDocumentCatalog().getAcroForm();
            report.hasFormFields(form != null && !form.getFields().isEmpty());
            extracted = signatureEngine.extractSignatures(document, pdf);
        } catch (InvalidPasswordException e) {
            report.error("PDF is encrypted and cannot be opened without a password");
            return finish(report);
        } catch (IOException | SignatureExtractionException e) {
            report.error("PDF could not be loaded: " + e.getMessage());
            return finish(report);
        }

        List<SignatureValidationResult> signatures = signatureEngine.validateSignatures(extracted);
        report.signatureValidation(new SignatureValidationSummary(signatures));
        for (SignatureValidationResult signature : signatures) {
            for (String error : signature.getErrors()) {
                report.error("Signature '" + signature.getFieldName() + "' is invalid: " + error);
            }
            for (String warning : signature.getWarnings()) {
                report.warning("Signature '" + signature.getFieldName() + "': " + warning);
            }
        }

        Set<String> signerChains = new HashSet<>();
        for (SignatureValidationResult signature : signatures) {
            if (signature.getCertificateValidation() != null) {
                signerChains.add(signature.getCertificateValidation().getCertificate().getFingerprint());
            }
        }
        List<CertificateValidationResult> certificates = validateCertificates(extracted, signatures);
        report.certificateValidation(new CertificateValidationSummary(certificates));
        boolean revocationNoted = false;
        for (CertificateValidationResult certificate : certificates) {
            String name = certificate.getCertificate().getDisplayName();
            // signer chain errors are already part of the signature's errors
            if (!signerChains.contains(certificate.getCertificate().getFingerprint())) {
                for (String error : certificate.getErrors()) {
                    report.error("Certificate " + name + " is invalid: " + error);
                }
            }
            for (String warning : certificate.getWarnings()) {
                if (CertificateManager.REVOCATION_NOT_CHECKED.equals(warning)) {
                    if (!revocationNoted) {
                        report.warning("Certificates: " + warning);
                        revocationNoted = true;
                    }
                } else {
                    report.warning("Certificate " + name + ": " + warning);
                }
            }
        }

        // timestamp errors and warnings are reported with their signature
        List<TimestampVerificationResult> timestamps = new ArrayList<>();
        for (SignatureValidationResult signature : signatures) {
            if (signature.getTimestampVerification() != null) {
                timestamps.add(signature.getTimestampVerification());
            }
        }
        report.timestampValidation(new TimestampValidationSummary(timestamps));

        return finish(report);
    }

    /**
     * Every distinct certificate across all signatures, validated once. Signer chains already
     * checked by the signature engine are reused.
     */
    private List<CertificateValidationResult> validateCertificates(List<ExtractedSignature> extracted,
                                                                   List<SignatureValidationResult> signatures) {
        Map<String, CertificateValidationResult> byFingerprint = new LinkedHashMap<>();
        for (SignatureValidationResult signature : signatures) {
            CertificateValidationResult chain = signature.getCertificateValidation();
            if (chain != null) {
                byFingerprint.putIfAbsent(chain.getCertificate().getFingerprint(), chain);
            }
        }
        if (trustedRoots.isEmpty()) {
            return new ArrayList<>(byFingerprint.values());
        }

        for (ExtractedSignature signature : extracted) {
            CmsSignature cms = signature.getSignature();
            if (cms == null) {
                continue;
            }
            List<X509Certificate> embedded = cms.getCertificates();
            for (X509Certificate certificate : embedded) {
                String fingerprint = CertificateManager.fingerprint(certificate);
                if (byFingerprint.containsKey(fingerprint)) {
                    continue;
                }
                List<X509Certificate> chain = new ArrayList<>();
                chain.add(certificate);
                for (X509Certificate other : embedded) {
                    if (!other.equals(certificate)) {
                        chain.add(other);
                    }
                }
                byFingerprint.put(fingerprint, certificateManager.validateCertificateChain(chain, trustedRoots));
            }
        }
        return new ArrayList<>(byFingerprint.values());
    }

    /**
     * Read a stored document, validate it and hand the report to {@code sink}.
     *
     * @throws IOException if the document cannot be read or the report cannot be stored
     */
    public PdfValidationResult validateStoredDocument(String documentId, DocumentBytesProvider documents,
                                                      ValidationResultSink sink) throws IOException {
        byte[] pdf = documents.readDocument(documentId);
        LOG.info("Validating stored document {} ({} bytes)", documentId, pdf.length);
        PdfValidationResult result = validatePdf(pdf);
        sink.store(documentId, result);
        return result;
    }

    private static PdfValidationResult finish(PdfValidationResult.Builder report) {
        PdfValidationResult result = report.build();
        if (result.isValid()) {
            LOG.info("VALIDATION_OK: {} signature(s), {} warning(s)",
                result.getSignatureValidation() == null ? 0 : result.getSignatureValidation().getTotalSignatures(),
                result.getWarnings().size());
        } else {
            LOG.info("VALIDATION_FAIL: {} error(s)", result.getErrors().size());
        }
        return result;
    }
}
