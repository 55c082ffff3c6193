package cz.drbacon.pades.tsp;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Transport failure: the TSA could not be reached, or every server in a failover list failed.
 */
public class TsaConnectionException extends TsaException {

    private final List<String> attemptedUrls;

    public TsaConnectionException(String message, TsaErrorType errorType, List<String> attemptedUrls,
                                  List<TsaAttempt> attempts, Throwable cause) {
        super(message, errorType, attempts, cause);
        this.attemptedUrls = Collections.unmodifiableList(new ArrayList<>(attemptedUrls));
    }

    public List<String> getAttemptedUrls() {
        return attemptedUrls;
    }
}
