package cz.drbacon.pades.tsp;

/**
 * States of a request against one TSA.
 *
 * <pre>
 * ATTEMPTING -- ok --------------------------------&gt; SUCCEEDED
 * ATTEMPTING -- failed, attempts left ------------&gt; BACKOFF -- delay --&gt; ATTEMPTING
 * ATTEMPTING -- failed, no attempts left ---------&gt; FAILED_EXHAUSTED
 * </pre>
 */
public enum RetryState {
    ATTEMPTING,
    BACKOFF,
    SUCCEEDED,
    FAILED_EXHAUSTED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED_EXHAUSTED;
    }

    /**
     * Transition out of ATTEMPTING.
     */
    public static RetryState afterAttempt(boolean succeeded, int attempt, int maxAttempts) {
        if (succeeded) {
            return SUCCEEDED;
        }
        return attempt < maxAttempts ? BACKOFF : FAILED_EXHAUSTED;
    }
}
