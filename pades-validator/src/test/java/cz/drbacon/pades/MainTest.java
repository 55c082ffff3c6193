package cz.drbacon.pades;

import cz.drbacon.pades.testsupport.TestPdfs;
import cz.drbacon.pades.testsupport.TestPki;
import cz.drbacon.pades.testsupport.TestTsa;
import cz.drbacon.pades.tsp.InMemoryTimestampAuditLog;
import cz.drbacon.pades.tsp.Timestamp;
import cz.drbacon.pades.tsp.TimestampServerManager;
import eu.europa.esig.dss.model.DSSException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Collections;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    private static final TestPki PKI = TestPki.get();
    private static final Map<String, String> ENV = Collections.singletonMap("TSA_URL", "https://tsa.test");

    @TempDir
    Path dir;

    private TimestampServerManager timestampManager;
    private String audit;

    @BeforeEach
    void setUp() {
        timestampManager = new TimestampServerManager(new TestTsa(PKI).transport(), new InMemoryTimestampAuditLog());
        audit = dir.resolve("audit.json").toString();
    }

    private String auditJson() throws Exception {
        return new String(Files.readAllBytes(Path.of(audit)), StandardCharsets.UTF_8);
    }

    private Path rootsFile() throws Exception {
        Path roots = dir.resolve("roots.pem");
        Files.write(roots, TestPki.toPem(PKI.root).getBytes(StandardCharsets.US_ASCII));
        return roots;
    }

    @Test
    void missingArgumentsIsUsageError() throws Exception {
        assertEquals(Main.EXIT_USAGE_ERROR, Main.run(new String[] {"validate"}, ENV, timestampManager, audit));
        assertTrue(auditJson().contains("USAGE_ERROR"));
        assertEquals(Main.EXIT_USAGE_ERROR, Main.run(new String[] {"sign", "a", "b"}, ENV, timestampManager, audit));
    }

    @Test
    void validSignedDocument() throws Exception {
        Path pdf = dir.resolve("signed.pdf");
        Files.write(pdf, TestPdfs.signed(TestPdfs.blank(1), PKI.leafKey.getPrivate(), PKI.signerChain(), "ok"));

        int exit = Main.run(new String[] {"validate", pdf.toString(), rootsFile().toString()},
            ENV, timestampManager, audit);

        assertEquals(Main.EXIT_SUCCESS, exit);
        assertTrue(Files.isRegularFile(dir.resolve("signed.pdf.validation.json")));
        String json = auditJson();
        assertTrue(json.contains("\"success\" : true"), json);
        assertTrue(json.contains("\"signature_count\" : 1"), json);
    }

    @Test
    void tamperedDocumentIsInvalid() throws Exception {
        byte[] signed = TestPdfs.signed(TestPdfs.blank(1), PKI.leafKey.getPrivate(), PKI.signerChain(), "Approved");
        Path pdf = dir.resolve("tampered.pdf");
        Files.write(pdf, TestPdfs.replace(signed, "Approved", "Rejected"));
        Path report = dir.resolve("reports").resolve("tampered.json");

        int exit = Main.run(new String[] {"validate", pdf.toString(), rootsFile().toString(), report.toString()},
            ENV, timestampManager, audit);

        assertEquals(Main.EXIT_INVALID_DOCUMENT, exit);
        assertTrue(Files.isRegularFile(report));
        assertTrue(auditJson().contains("VALIDATION_ERROR"));
    }

    @Test
    void unreadableRootsIsConfigError() throws Exception {
        Path pdf = dir.resolve("blank.pdf");
        Files.write(pdf, TestPdfs.blank(1));
        Path roots = dir.resolve("roots.pem");
        Files.write(roots, "nothing here".getBytes(StandardCharsets.US_ASCII));

        assertEquals(Main.EXIT_CONFIG_ERROR,
            Main.run(new String[] {"validate", pdf.toString(), roots.toString()}, ENV, timestampManager, audit));
    }

    @Test
    void missingDocumentIsPdfError() throws Exception {
        assertEquals(Main.EXIT_PDF_ERROR, Main.run(
            new String[] {"validate", dir.resolve("none.pdf").toString(), rootsFile().toString()},
            ENV, timestampManager, audit));
    }

    @Test
    void timestampsFile() throws Exception {
        Path input = dir.resolve("data.txt");
        Files.write(input, "payload".getBytes(StandardCharsets.UTF_8));
        Path token = dir.resolve("data.tst");

        int exit = Main.run(new String[] {"timestamp", input.toString(), token.toString()},
            ENV, timestampManager, audit);

        assertEquals(Main.EXIT_SUCCESS, exit);
        Timestamp timestamp = Timestamp.fromEncoded(Files.readAllBytes(token), null);
        assertTrue(timestampManager.verifyTimestamp(timestamp, Files.readAllBytes(input)).isValid());
        String json = auditJson();
        assertTrue(json.contains("\"tsa_url\" : \"https://tsa.test\""), json);
        assertTrue(json.contains("\"tsa_fallback_used\" : false"), json);
    }

    @Test
    void unreachableTsaIsTsaError() throws Exception {
        Path input = dir.resolve("data.txt");
        Files.write(input, "payload".getBytes(StandardCharsets.UTF_8));
        TimestampServerManager offline = new TimestampServerManager((config, request) -> {
            throw new DSSException("Connection refused");
        }, new InMemoryTimestampAuditLog(), millis -> { }, Clock.systemUTC(), Runnable::run);

        int exit = Main.run(new String[] {"timestamp", input.toString(), dir.resolve("data.tst").toString()},
            ENV, offline, audit);

        assertEquals(Main.EXIT_TSA_ERROR, exit);
        assertTrue(auditJson().contains("\"tsa_attempts\""));
    }

    @Test
    void badTsaSettingIsConfigError() throws Exception {
        Path input = dir.resolve("data.txt");
        Files.write(input, "payload".getBytes(StandardCharsets.UTF_8));

        int exit = Main.run(new String[] {"timestamp", input.toString(), dir.resolve("data.tst").toString()},
            Collections.singletonMap("TSA_TIMEOUT_MS", "later"), timestampManager, audit);

        assertEquals(Main.EXIT_CONFIG_ERROR, exit);
        assertTrue(auditJson().contains("TSA_TIMEOUT_MS is not a number"));
    }
}
