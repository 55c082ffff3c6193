package cz.drbacon.pades;

import cz.drbacon.pades.cert.CertificateLoadException;
import cz.drbacon.pades.cert.CertificateManager;
import cz.drbacon.pades.digest.MessageImprintBuilder;
import cz.drbacon.pades.report.PdfValidationResult;
import cz.drbacon.pades.tsp.FallbackTSPSource;
import cz.drbacon.pades.tsp.Timestamp;
import cz.drbacon.pades.tsp.TimestampServerManager;
import cz.drbacon.pades.tsp.TimestampVerificationResult;
import cz.drbacon.pades.tsp.TsaException;
import cz.drbacon.pades.tsp.TsaFailoverConfig;
import eu.europa.esig.dss.model.TimestampBinary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.cert.X509Certificate;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;

/**
 * PAdES signature validator and RFC 3161 timestamp client.
 *
 * Usage:
 *   java -jar pades-validator.jar validate  document.pdf trusted-roots.pem [report.json]
 *   java -jar pades-validator.jar timestamp input-file token.tst
 *
 * TSA settings come from the environment, see {@link EnvironmentConfig}.
 *
 * Exit codes:
 *   0 - Success
 *   1 - Usage error (wrong arguments)
 *   2 - Config error (bad TSA settings, unreadable trusted roots)
 *   3 - Document invalid (validation found errors)
 *   4 - TSA/network error (timestamp server unavailable)
 *   5 - PDF error (file not found, read/write error)
 */
public class Main {

    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    // Exit codes for different error types
    static final int EXIT_SUCCESS = 0;
    static final int EXIT_USAGE_ERROR = 1;
    static final int EXIT_CONFIG_ERROR = 2;
    static final int EXIT_INVALID_DOCUMENT = 3;
    static final int EXIT_TSA_ERROR = 4;
    static final int EXIT_PDF_ERROR = 5;

    static final String AUDIT_FILE = "audit.json";

    private static final String USAGE = "Usage: java -jar pades-validator.jar validate <document.pdf> <trusted-roots.pem> [report.json]\n"
        + "       java -jar pades-validator.jar timestamp <input-file> <token.tst>";

    public static void main(String[] args) {
        int exitCode = run(args, System.getenv(), new TimestampServerManager(), AUDIT_FILE);
        if (exitCode != EXIT_SUCCESS) {
            System.exit(exitCode);
        }
    }

    static int run(String[] args, Map<String, String> env, TimestampServerManager timestampManager, String auditPath) {
        AuditRecord audit = new AuditRecord();
        int exitCode;

        try {
            if (args.length < 3) {
                System.err.println(USAGE);
                audit.addError("USAGE_ERROR: Missing required arguments");
                exitCode = EXIT_USAGE_ERROR;
            } else if ("validate".equals(args[0])) {
                audit.setCommand("validate");
                exitCode = validate(args, timestampManager, audit);
            } else if ("timestamp".equals(args[0])) {
                audit.setCommand("timestamp");
                exitCode = timestamp(args, env, timestampManager, audit);
            } else {
                System.err.println(USAGE);
                audit.addError("USAGE_ERROR: Unknown command " + args[0]);
                exitCode = EXIT_USAGE_ERROR;
            }
        } catch (IllegalArgumentException | CertificateLoadException e) {
            LOG.error("Configuration error", e);
            audit.addError("CONFIG_ERROR: " + e.getMessage());
            exitCode = EXIT_CONFIG_ERROR;
        } catch (TsaException e) {
            LOG.error("TSA error", e);
            audit.addError("TSA_ERROR: " + e.getMessage());
            audit.setTsaAttempts(e.getAttempts());
            exitCode = EXIT_TSA_ERROR;
        } catch (IOException e) {
            LOG.error("PDF/IO error", e);
            audit.addError("PDF_ERROR: " + e.getMessage());
            exitCode = EXIT_PDF_ERROR;
        }

        audit.setSuccess(exitCode == EXIT_SUCCESS);
        writeAudit(audit, auditPath);
        return exitCode;
    }

    private static int validate(String[] args, TimestampServerManager timestampManager, AuditRecord audit)
            throws IOException {
        Path document = Paths.get(args[1]);
        Path rootsFile = Paths.get(args[2]);
        Path reportFile = args.length > 3
            ? Paths.get(args[3])
            : document.resolveSibling(JsonFileResultSink.fileNameFor(document.getFileName().toString()));

        LOG.info("=== PAdES Validator ===");
        LOG.info("Document: {}", document);
        LOG.info("Roots:    {}", rootsFile);
        LOG.info("Report:   {}", reportFile);
        audit.setInputFile(document.toString());
        audit.setTrustedRootsFile(rootsFile.toString());
        audit.setOutputFile(reportFile.toString());

        CertificateManager certificateManager = new CertificateManager();
        List<X509Certificate> roots = certificateManager.loadCertificates(
            new String(Files.readAllBytes(rootsFile), StandardCharsets.US_ASCII));
        LOG.info("Loaded {} trusted root(s)", roots.size());

        Path directory = document.toAbsolutePath().getParent();
        PdfValidationEngine engine = new PdfValidationEngine(certificateManager, timestampManager, roots);
        PdfValidationResult result = engine.validateStoredDocument(document.getFileName().toString(),
            new FileSystemDocumentProvider(directory), JsonFileResultSink.toFile(reportFile));

        audit.setDocumentSha256(result.getDocumentSha256());
        audit.setDocumentValid(result.isValid());
        if (result.getSignatureValidation() != null) {
            audit.setSignatureCount(result.getSignatureValidation().getTotalSignatures());
            audit.setValidSignatureCount(result.getSignatureValidation().getValidSignatures());
        }
        if (!result.isValid()) {
            for (String error : result.getErrors()) {
                audit.addError("VALIDATION_ERROR: " + error);
            }
            LOG.warn("=== Document is NOT valid ({} error(s)) ===", result.getErrors().size());
            return EXIT_INVALID_DOCUMENT;
        }
        LOG.info("=== Document is valid ===");
        return EXIT_SUCCESS;
    }

    private static int timestamp(String[] args, Map<String, String> env, TimestampServerManager timestampManager,
                                 AuditRecord audit) throws IOException {
        Path input = Paths.get(args[1]);
        Path output = Paths.get(args[2]);
        audit.setInputFile(input.toString());
        audit.setOutputFile(output.toString());

        TsaFailoverConfig failoverConfig = EnvironmentConfig.fromEnvironment(env).getFailoverConfig();
        byte[] data = Files.readAllBytes(input);
        byte[] digest = new MessageImprintBuilder().digest(data, MessageImprintBuilder.DEFAULT_ALGORITHM);
        audit.setDocumentSha256(HexFormat.of().formatHex(digest));

        FallbackTSPSource tspSource = new FallbackTSPSource(timestampManager, failoverConfig);
        long started = System.currentTimeMillis();
        TimestampBinary token;
        try {
            token = tspSource.getTimeStampResponse(MessageImprintBuilder.DEFAULT_ALGORITHM, digest);
        } finally {
            audit.setTsaLatencyMs(System.currentTimeMillis() - started);
        }
        audit.setTsaUrl(tspSource.getUrlUsed());
        audit.setTsaFallbackUsed(tspSource.isFallbackUsed());

        Timestamp timestamp = Timestamp.fromEncoded(token.getBytes(), tspSource.getUrlUsed());
        TimestampVerificationResult verification = timestampManager.verifyTimestamp(timestamp, data);
        audit.setTsaGenTime(timestamp.getGenTime());
        audit.setTsaSerialNumber(timestamp.getSerialNumber());
        if (!verification.isValid()) {
            for (String error : verification.getErrors()) {
                audit.addError("TSA_ERROR: " + error);
            }
            return EXIT_TSA_ERROR;
        }

        Files.write(output, token.getBytes());
        LOG.info("TSA_OK: token from {} (genTime {}) written to {}", tspSource.getUrlUsed(), timestamp.getGenTime(), output);
        return EXIT_SUCCESS;
    }

    private static void writeAudit(AuditRecord audit, String auditPath) {
        try {
            audit.writeToFile(auditPath);
            LOG.info("Audit record written to: {}", auditPath);
        } catch (IOException e) {
            LOG.error("Failed to write audit record", e);
        }
    }
}
