package cz.drbacon.pades.tsp;

/**
 * Sends one DER TimeStampReq to a TSA and returns the raw response body.
 * Implementations throw on transport errors and non-2xx replies; retry is the caller's job.
 */
@FunctionalInterface
public interface TimestampTransport {

    byte[] post(TsaConfig config, byte[] request);
}
