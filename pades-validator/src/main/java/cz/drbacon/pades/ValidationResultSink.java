package cz.drbacon.pades;

import cz.drbacon.pades.report.PdfValidationResult;

import java.io.IOException;

/**
 * Receives finished validation reports, e.g. to persist them next to the document.
 */
public interface ValidationResultSink {

    void store(String documentId, PdfValidationResult result) throws IOException;
}
