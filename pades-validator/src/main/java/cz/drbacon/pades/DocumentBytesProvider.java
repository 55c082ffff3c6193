package cz.drbacon.pades;

import java.io.IOException;

/**
 * Read access to stored documents, keyed by the caller's document id.
 */
public interface DocumentBytesProvider {

    /**
     * @throws IOException if the document does not exist or cannot be read
     */
    byte[] readDocument(String documentId) throws IOException;
}
