package cz.drbacon.pades;

import cz.drbacon.pades.cert.CertificateManager;
import cz.drbacon.pades.cms.DigitalSignatureEngine;
import cz.drbacon.pades.pdf.PdfStructureValidator;
import cz.drbacon.pades.report.PdfValidationResult;
import cz.drbacon.pades.testsupport.TestPdfs;
import cz.drbacon.pades.testsupport.TestPki;
import cz.drbacon.pades.testsupport.TestTsa;
import cz.drbacon.pades.tsp.InMemoryTimestampAuditLog;
import cz.drbacon.pades.tsp.TimestampServerManager;
import cz.drbacon.pades.tsp.TsaConfig;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.encryption.AccessPermission;
import org.apache.pdfbox.pdmodel.encryption.StandardProtectionPolicy;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.HexFormat;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

class PdfValidationEngineTest {

    private static final TestPki PKI = TestPki.get();

    private static TimestampServerManager timestampManager;
    private static byte[] blankPdf;
    private static byte[] stampedPdf;
    private static byte[] twiceSignedPdf;

    @BeforeAll
    static void createDocuments() throws Exception {
        timestampManager = new TimestampServerManager(new TestTsa(PKI).transport(), new InMemoryTimestampAuditLog());
        blankPdf = TestPdfs.blank(2);
        stampedPdf = TestPdfs.signed(blankPdf, PKI.leafKey.getPrivate(), PKI.signerChain(), "Approved",
            timestampManager, TsaConfig.of("https://tsa.test"));
        byte[] once = TestPdfs.signed(blankPdf, PKI.leafKey.getPrivate(), PKI.signerChain(), "FirstReason");
        twiceSignedPdf = TestPdfs.signed(once, PKI.leafKey.getPrivate(), PKI.signerChain(), "SecondReason");
    }

    private static PdfValidationEngine engine() {
        return new PdfValidationEngine(new CertificateManager(), timestampManager, PKI.roots());
    }

    @Test
    void unsignedDocumentIsValid() throws Exception {
        PdfValidationResult result = engine().validatePdf(blankPdf);

        assertTrue(result.isValid(), result.getErrors().toString());
        assertFalse(result.isHasSignatures());
        assertEquals(Integer.valueOf(2), result.getPageCount());
        assertEquals(Boolean.FALSE, result.getEncrypted());
        assertEquals("1.4", result.getPdfVersion());
        assertEquals(0, result.getSignatureValidation().getTotalSignatures());
        assertTrue(result.getSignatureValidation().isAllSignaturesValid());
        assertEquals(HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(blankPdf)),
            result.getDocumentSha256());
    }

    @Test
    void signedAndTimestampedDocumentIsValid() {
        PdfValidationResult result = engine().validatePdf(stampedPdf);

        assertTrue(result.isValid(), result.getErrors().toString());
        assertTrue(result.isHasSignatures());
        assertTrue(result.getStructureValidation().isValid());
        assertEquals(1, result.getSignatureValidation().getTotalSignatures());
        assertTrue(result.getSignatureValidation().isAllSignaturesValid());
        assertEquals(1, result.getTimestampValidation().getTotalTimestamps());
        assertTrue(result.getTimestampValidation().isAllTimestampsValid());
        // signer chain plus the intermediate on its own
        assertEquals(2, result.getCertificateValidation().getTotalCertificates());
        assertTrue(result.getCertificateValidation().isAllCertificatesValid());
        assertTrue(result.getHasFormFields());
        assertEquals(1, result.getWarnings().stream()
            .filter(w -> w.contains(CertificateManager.REVOCATION_NOT_CHECKED)).count(), result.getWarnings().toString());
        assertTrue(result.getWarnings().contains("Certificates: " + CertificateManager.REVOCATION_NOT_CHECKED));
    }

    @Test
    void untrustedSignerIsReportedOnce() {
        PdfValidationEngine engine = new PdfValidationEngine(new CertificateManager(), timestampManager,
            Collections.singletonList(PKI.otherCa));

        PdfValidationResult result = engine.validatePdf(stampedPdf);

        assertFalse(result.isValid());
        List<String> chainErrors = result.getErrors().stream()
            .filter(e -> e.startsWith("Signature 'Signature1' is invalid: Certificate chain invalid: "))
            .collect(Collectors.toList());
        assertEquals(1, chainErrors.size(), result.getErrors().toString());
        assertTrue(result.getErrors().stream().noneMatch(e -> e.startsWith("Certificate Test Signer")),
            result.getErrors().toString());
        assertTrue(result.getErrors().stream().anyMatch(e -> e.startsWith("Certificate Test Intermediate CA is invalid: ")),
            result.getErrors().toString());
        assertTrue(result.getErrors().stream().noneMatch(e -> e.startsWith("Timestamp for signature")));
    }

    @Test
    void tamperedSecondSignatureIsReported() {
        byte[] tampered = TestPdfs.replace(twiceSignedPdf, "SecondReason", "TecondReason");

        PdfValidationResult result = engine().validatePdf(tampered);

        assertFalse(result.isValid());
        assertTrue(result.getStructureValidation().isValid());
        assertEquals(2, result.getSignatureValidation().getTotalSignatures());
        assertEquals(1, result.getSignatureValidation().getValidSignatures());
        assertFalse(result.getSignatureValidation().isAllSignaturesValid());
        assertTrue(result.getErrors().stream().allMatch(e -> e.startsWith("Signature 'Signature2' is invalid: ")),
            result.getErrors().toString());
        assertTrue(result.getErrors().get(0).contains("Digest mismatch"));
    }

    @Test
    void fatalStructureSkipsSignatureChecks() {
        byte[] broken = TestPdfs.replace(blankPdf, "%PDF-1.4", "%PDF-3.7");
        DigitalSignatureEngine signatureEngine = mock(DigitalSignatureEngine.class);
        PdfValidationEngine engine = new PdfValidationEngine(new PdfStructureValidator(), signatureEngine,
            new CertificateManager(), PKI.roots(), Clock.systemUTC());

        PdfValidationResult result = engine.validatePdf(broken);

        assertFalse(result.isValid());
        assertFalse(result.isHasSignatures());
        assertNull(result.getSignatureValidation());
        assertNull(result.getPageCount());
        assertTrue(result.getErrors().get(0).startsWith("Structure: Invalid PDF header"));
        verifyNoInteractions(signatureEngine);
    }

    @Test
    void emptyInputIsInvalid() {
        PdfValidationResult result = engine().validatePdf(new byte[0]);

        assertFalse(result.isValid());
        assertEquals("Structure: Document is empty", result.getErrors().get(0));
    }

    @Test
    void passwordProtectedDocumentCannotBeInspected() throws Exception {
        byte[] encrypted;
        try (PDDocument document = new PDDocument()) {
            document.addPage(new PDPage());
            StandardProtectionPolicy policy = new StandardProtectionPolicy("owner", "user", new AccessPermission());
            policy.setEncryptionKeyLength(128);
            document.protect(policy);
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            document.save(out);
            encrypted = out.toByteArray();
        }

        PdfValidationResult result = engine().validatePdf(encrypted);

        assertFalse(result.isValid());
        assertTrue(result.getErrors().contains("PDF is encrypted and cannot be opened without a password"),
            result.getErrors().toString());
    }

    @Test
    void repeatedValidationGivesSameVerdict() {
        Clock clock = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);
        PdfValidationEngine engine = new PdfValidationEngine(new PdfStructureValidator(),
            new DigitalSignatureEngine(new CertificateManager(), timestampManager, PKI.roots()),
            new CertificateManager(), PKI.roots(), clock);
        byte[] tampered = TestPdfs.replace(twiceSignedPdf, "SecondReason", "TecondReason");

        PdfValidationResult first = engine.validatePdf(tampered);
        PdfValidationResult second = engine.validatePdf(tampered);

        assertEquals(first.isValid(), second.isValid());
        assertEquals(first.getErrors(), second.getErrors());
        assertEquals(first.getWarnings(), second.getWarnings());
        assertEquals(first.getValidatedAt(), second.getValidatedAt());
    }

    @Test
    void storedDocumentReportIsWritten(@TempDir Path dir) throws Exception {
        Files.write(dir.resolve("contract.pdf"), stampedPdf);

        PdfValidationResult result = engine().validateStoredDocument("contract.pdf",
            new FileSystemDocumentProvider(dir), new JsonFileResultSink(dir.resolve("reports")));

        assertTrue(result.isValid());
        String json = new String(Files.readAllBytes(dir.resolve("reports").resolve("contract.pdf.validation.json")),
            StandardCharsets.UTF_8);
        assertTrue(json.contains("\"valid\" : true"), json);
        assertTrue(json.contains("\"field_name\" : \"Signature1\""), json);
    }
}
