package cz.drbacon.pades.tsp;

import cz.drbacon.pades.digest.MessageImprint;
import eu.europa.esig.dss.enumerations.DigestAlgorithm;
import eu.europa.esig.dss.model.DSSException;
import eu.europa.esig.dss.model.TimestampBinary;
import eu.europa.esig.dss.spi.x509.tsp.TSPSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;

/**
 * DSS {@link TSPSource} with primary/fallback TSA support, so DSS signature services
 * get the same retry, failover and audit behaviour as direct callers.
 *
 * Metrics of the last call are kept for audit records.
 */
public class FallbackTSPSource implements TSPSource {

    private static final Logger LOG = LoggerFactory.getLogger(FallbackTSPSource.class);

    private final transient TimestampServerManager manager;
    private final transient TsaFailoverConfig failoverConfig;
    private final transient TimestampRequestOptions options;

    // Metrics for audit
    private String urlUsed;
    private boolean fallbackUsed;
    private TsaErrorType lastErrorType = TsaErrorType.NONE;
    private String lastErrorMessage;
    private List<TsaAttempt> attemptLog = Collections.emptyList();

    public FallbackTSPSource(TimestampServerManager manager, TsaFailoverConfig failoverConfig) {
        this(manager, failoverConfig, TimestampRequestOptions.defaults());
    }

    public FallbackTSPSource(TimestampServerManager manager, TsaFailoverConfig failoverConfig,
                             TimestampRequestOptions options) {
        this.manager = manager;
        this.failoverConfig = failoverConfig;
        this.options = options;
    }

    @Override
    public TimestampBinary getTimeStampResponse(DigestAlgorithm digestAlgorithm, byte[] digest) throws DSSException {
        urlUsed = null;
        fallbackUsed = false;
        lastErrorType = TsaErrorType.NONE;
        lastErrorMessage = null;
        attemptLog = Collections.emptyList();

        TimestampRequest request = manager.createTimestampRequest(new MessageImprint(digestAlgorithm, digest), options);
        try {
            TimestampResponse response = manager.requestTimestampWithFailover(request, failoverConfig);
            urlUsed = response.getTsaUrl();
            fallbackUsed = !failoverConfig.getPrimary().getUrl().equals(urlUsed);
            if (fallbackUsed) {
                LOG.warn("Timestamp obtained from fallback TSA {}", urlUsed);
            }
            return new TimestampBinary(response.getTimestamp().getEncoded());
        } catch (TsaException e) {
            lastErrorType = e.getErrorType();
            lastErrorMessage = e.getMessage();
            attemptLog = e.getAttempts();
            throw e;
        }
    }

    public String getUrlUsed() {
        return urlUsed;
    }

    public boolean isFallbackUsed() {
        return fallbackUsed;
    }

    public TsaErrorType getLastErrorType() {
        return lastErrorType;
    }

    public String getLastErrorMessage() {
        return lastErrorMessage;
    }

    /**
     * Attempts of the last failed call; empty after a success.
     */
    public List<TsaAttempt> getAttemptLog() {
        return attemptLog;
    }
}
