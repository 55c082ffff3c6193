package cz.drbacon.pades.tsp;

import java.util.List;

/**
 * Protocol failure: the TSA answered, but with garbage, a rejection, or a token for another request.
 */
public class TsaResponseException extends TsaException {

    private final TsaStatus status;

    public TsaResponseException(String message, TsaErrorType errorType, TsaStatus status) {
        super(message, errorType, null);
        this.status = status;
    }

    public TsaResponseException(String message, TsaErrorType errorType, TsaStatus status, Throwable cause) {
        super(message, errorType, null, cause);
        this.status = status;
    }

    public TsaResponseException(String message, TsaErrorType errorType, TsaStatus status,
                                List<TsaAttempt> attempts, Throwable cause) {
        super(message, errorType, attempts, cause);
        this.status = status;
    }

    /**
     * @return PKIStatus of the last response, null if none could be parsed
     */
    public TsaStatus getStatus() {
        return status;
    }
}
