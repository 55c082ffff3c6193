package cz.drbacon.pades.tsp;

import eu.europa.esig.dss.service.http.commons.TimestampDataLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;

/**
 * HTTP transport on the DSS {@link TimestampDataLoader}, which posts with
 * {@code Content-Type: application/timestamp-query}.
 */
public class DssTimestampTransport implements TimestampTransport {

    private static final Logger LOG = LoggerFactory.getLogger(DssTimestampTransport.class);

    @Override
    public byte[] post(TsaConfig config, byte[] request) {
        TimestampDataLoader dataLoader = createDataLoader(config);
        LOG.debug("POST {} ({} bytes)", config.getUrl(), request.length);
        return dataLoader.post(config.getUrl(), request);
    }

    TimestampDataLoader createDataLoader(TsaConfig config) {
        TimestampDataLoader dataLoader = new TimestampDataLoader();
        dataLoader.setTimeoutConnection(config.getTimeoutMs());
        dataLoader.setTimeoutSocket(config.getTimeoutMs());
        if (config.hasCredentials()) {
            URI uri = URI.create(config.getUrl());
            int port = uri.getPort() != -1 ? uri.getPort() : ("https".equalsIgnoreCase(uri.getScheme()) ? 443 : 80);
            dataLoader.addAuthentication(uri.getHost(), port, null, config.getUsername(), config.getPassword());
        }
        return dataLoader;
    }
}
