package cz.drbacon.pades.tsp;

import eu.europa.esig.dss.model.DSSException;

/**
 * A timestamp token or request could not be built or decoded.
 */
public class TimestampValidationException extends DSSException {

    public TimestampValidationException(String message) {
        super(message);
    }

    public TimestampValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
