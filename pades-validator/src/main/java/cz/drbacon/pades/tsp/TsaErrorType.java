package cz.drbacon.pades.tsp;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.Locale;

/**
 * TSA failure classification, used for diagnostics and status mapping.
 */
public enum TsaErrorType {
    NONE,
    TSA_UNAVAILABLE,      // network/timeout/refused/5xx
    TSA_RATE_LIMITED,     // HTTP 429
    TSA_INVALID_RESPONSE, // unparseable body, token does not match request
    TSA_REJECTED,         // PKIStatus other than granted
    TSA_TLS_ERROR,        // handshake, certificate
    TSA_CLIENT_ERROR;     // HTTP 400/401/403

    /**
     * Recommended HTTP status for callers exposing TSA errors over HTTP.
     */
    public int httpStatus() {
        switch (this) {
            case TSA_UNAVAILABLE:
                return 503;
            case TSA_RATE_LIMITED:
                return 429;
            case TSA_TLS_ERROR:
            case TSA_INVALID_RESPONSE:
            case TSA_REJECTED:
                return 502;
            case TSA_CLIENT_ERROR:
                return 400;
            default:
                return 500;
        }
    }

    /**
     * Classify a transport failure by walking the cause chain, then by message patterns.
     */
    public static TsaErrorType classify(Throwable error) {
        Throwable cause = error;
        while (cause != null) {
            if (cause instanceof SocketTimeoutException
                || cause instanceof ConnectException
                || cause instanceof UnknownHostException) {
                return TSA_UNAVAILABLE;
            }
            if (cause instanceof javax.net.ssl.SSLException) {
                return TSA_TLS_ERROR;
            }
            if (cause instanceof TsaException) {
                return ((TsaException) cause).getErrorType();
            }
            cause = cause.getCause();
        }

        String message = fullMessage(error).toLowerCase(Locale.ROOT);

        if (message.contains("connection refused")
            || message.contains("connect timed out")
            || message.contains("read timed out")
            || message.contains("no route to host")
            || message.contains("network is unreachable")
            || message.contains("host is down")) {
            return TSA_UNAVAILABLE;
        }
        if (message.contains("ssl")
            || message.contains("tls")
            || message.contains("handshake")) {
            return TSA_TLS_ERROR;
        }
        if (message.contains("429") || message.contains("rate limit")) {
            return TSA_RATE_LIMITED;
        }
        if (message.contains("500")
            || message.contains("502")
            || message.contains("503")
            || message.contains("504")) {
            return TSA_UNAVAILABLE;
        }
        if (message.contains("400")
            || message.contains("401")
            || message.contains("403")) {
            return TSA_CLIENT_ERROR;
        }
        if (message.contains("invalid")
            || message.contains("parse")
            || message.contains("unexpected")
            || message.contains("malformed")) {
            return TSA_INVALID_RESPONSE;
        }

        String className = error.getClass().getSimpleName();
        if (className.contains("Connect")
            || className.contains("Socket")
            || className.contains("Timeout")) {
            return TSA_UNAVAILABLE;
        }
        return TSA_INVALID_RESPONSE;
    }

    /**
     * "Type: message &lt;- Cause: message" for the whole chain.
     */
    static String fullMessage(Throwable error) {
        StringBuilder sb = new StringBuilder();
        Throwable t = error;
        while (t != null) {
            if (sb.length() > 0) sb.append(" <- ");
            sb.append(t.getClass().getSimpleName());
            if (t.getMessage() != null) {
                sb.append(": ").append(t.getMessage());
            }
            t = t.getCause();
        }
        return sb.toString();
    }

    static String shortMessage(Throwable error) {
        if (error.getMessage() != null) {
            return error.getMessage();
        }
        if (error.getCause() != null && error.getCause().getMessage() != null) {
            return error.getCause().getMessage();
        }
        return error.getClass().getSimpleName();
    }
}
