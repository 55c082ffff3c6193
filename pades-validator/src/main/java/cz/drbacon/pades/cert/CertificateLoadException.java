package cz.drbacon.pades.cert;

import eu.europa.esig.dss.model.DSSException;

/**
 * Raised when PEM or PKCS#12 material cannot be read or does not fit together.
 */
public class CertificateLoadException extends DSSException {

    public CertificateLoadException(String message) {
        super(message);
    }

    public CertificateLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
