package cz.drbacon.pades.tsp;

/**
 * Blocking wait used for backoff.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
