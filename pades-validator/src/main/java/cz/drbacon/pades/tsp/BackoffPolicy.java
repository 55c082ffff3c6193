package cz.drbacon.pades.tsp;

/**
 * Exponential backoff between TSA attempts: 1s, 2s, 4s, 8s, then capped at 10s.
 */
public final class BackoffPolicy {

    public static final long BASE_DELAY_MS = 1_000L;
    public static final long MAX_DELAY_MS = 10_000L;

    private BackoffPolicy() {
    }

    /**
     * Delay to wait after failed attempt {@code attempt} (1-based) before the next one.
     */
    public static long delayAfterAttempt(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt is 1-based, got " + attempt);
        }
        int shift = Math.min(attempt - 1, 30);
        return Math.min(BASE_DELAY_MS << shift, MAX_DELAY_MS);
    }
}
