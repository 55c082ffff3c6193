package cz.drbacon.pades;

import cz.drbacon.pades.report.PdfValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes each report as {@code <documentId>.validation.json}, or to one fixed file when constructed with
 * {@link #toFile(Path)}.
 */
public class JsonFileResultSink implements ValidationResultSink {

    private static final Logger LOG = LoggerFactory.getLogger(JsonFileResultSink.class);

    static final String SUFFIX = ".validation.json";

    private final Path directory;
    private final Path fixedFile;

    public JsonFileResultSink(Path directory) {
        this(directory, null);
    }

    private JsonFileResultSink(Path directory, Path fixedFile) {
        this.directory = directory;
        this.fixedFile = fixedFile;
    }

    public static JsonFileResultSink toFile(Path file) {
        return new JsonFileResultSink(null, file);
    }

    @Override
    public void store(String documentId, PdfValidationResult result) throws IOException {
        Path target = fixedFile != null ? fixedFile : directory.resolve(fileNameFor(documentId));
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        JsonSupport.mapper().writeValue(target.toFile(), result);
        LOG.info("Validation report for {} written to {}", documentId, target);
    }

    static String fileNameFor(String documentId) {
        return documentId.replaceAll("[^A-Za-z0-9._-]", "_") + SUFFIX;
    }
}
