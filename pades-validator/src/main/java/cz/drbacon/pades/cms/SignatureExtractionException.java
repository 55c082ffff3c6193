package cz.drbacon.pades.cms;

import eu.europa.esig.dss.model.DSSException;

/**
 * The document or one of its signature objects could not be read.
 */
public class SignatureExtractionException extends DSSException {

    public SignatureExtractionException(String message) {
        super(message);
    }

    public SignatureExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
