package cz.drbacon.pades;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Documents stored as files below a base directory; the document id is the relative file name.
 */
public class FileSystemDocumentProvider implements DocumentBytesProvider {

    private final Path baseDirectory;

    public FileSystemDocumentProvider(Path baseDirectory) {
        this.baseDirectory = baseDirectory.toAbsolutePath().normalize();
    }

    @Override
    public byte[] readDocument(String documentId) throws IOException {
        Path file = resolve(documentId);
        if (!Files.isRegularFile(file)) {
            throw new NoSuchFileException(file.toString());
        }
        return Files.readAllBytes(file);
    }

    Path resolve(String documentId) {
        if (documentId == null || documentId.isEmpty()) {
            throw new IllegalArgumentException("Document id must not be empty");
        }
        Path file = baseDirectory.resolve(documentId).normalize();
        if (!file.startsWith(baseDirectory)) {
            throw new IllegalArgumentException("Document id escapes the document directory: " + documentId);
        }
        return file;
    }
}
