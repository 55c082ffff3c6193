package cz.drbacon.pades.tsp;

import eu.europa.esig.dss.model.DSSException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Base for TSA failures surfaced after retries. Carries the classification and the attempt history.
 */
public class TsaException extends DSSException {

    private final TsaErrorType errorType;
    private final List<TsaAttempt> attempts;

    public TsaException(String message, TsaErrorType errorType, List<TsaAttempt> attempts) {
        super(message);
        this.errorType = errorType;
        this.attempts = attempts == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(attempts));
    }

    public TsaException(String message, TsaErrorType errorType, List<TsaAttempt> attempts, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
        this.attempts = attempts == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(attempts));
    }

    public TsaErrorType getErrorType() {
        return errorType;
    }

    public List<TsaAttempt> getAttempts() {
        return attempts;
    }

    /**
     * Recommended HTTP status for this error.
     */
    public int getHttpStatus() {
        return errorType.httpStatus();
    }
}
