package cz.drbacon.pades.tsp;

import cz.drbacon.pades.digest.MessageImprintBuilder;
import cz.drbacon.pades.testsupport.TestPki;
import cz.drbacon.pades.testsupport.TestTsa;
import eu.europa.esig.dss.model.DSSException;
import eu.europa.esig.dss.model.TimestampBinary;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

class FallbackTSPSourceTest {

    private static final String PRIMARY = "https://primary.tsa.test";
    private static final String FALLBACK = "http://fallback.tsa.test";
    private static final byte[] DATA = "document".getBytes(StandardCharsets.UTF_8);

    private final TestTsa tsa = new TestTsa(TestPki.get());

    private TimestampServerManager manager(boolean primaryDown) {
        return new TimestampServerManager((config, request) -> {
            if (primaryDown && PRIMARY.equals(config.getUrl())) {
                throw new DSSException("Connection refused");
            }
            return tsa.respond(request);
        }, new InMemoryTimestampAuditLog(), millis -> { }, Clock.systemUTC(), Runnable::run);
    }

    private static TsaFailoverConfig failover() {
        return new TsaFailoverConfig(TsaConfig.of(PRIMARY).withRetryAttempts(1),
            Collections.singletonList(TsaConfig.of(FALLBACK).withRetryAttempts(1)));
    }

    @Test
    void primaryAnswers() {
        TimestampServerManager manager = manager(false);
        FallbackTSPSource source = new FallbackTSPSource(manager, failover());
        byte[] digest = new MessageImprintBuilder().digest(DATA, MessageImprintBuilder.DEFAULT_ALGORITHM);

        TimestampBinary token = source.getTimeStampResponse(MessageImprintBuilder.DEFAULT_ALGORITHM, digest);

        assertEquals(PRIMARY, source.getUrlUsed());
        assertFalse(source.isFallbackUsed());
        assertEquals(TsaErrorType.NONE, source.getLastErrorType());
        assertTrue(manager.verifyTimestamp(Timestamp.fromEncoded(token.getBytes(), PRIMARY), DATA).isValid());
    }

    @Test
    void fallbackIsRecorded() {
        FallbackTSPSource source = new FallbackTSPSource(manager(true), failover());
        byte[] digest = new MessageImprintBuilder().digest(DATA, MessageImprintBuilder.DEFAULT_ALGORITHM);

        source.getTimeStampResponse(MessageImprintBuilder.DEFAULT_ALGORITHM, digest);

        assertEquals(FALLBACK, source.getUrlUsed());
        assertTrue(source.isFallbackUsed());
        assertTrue(source.getAttemptLog().isEmpty());
    }

    @Test
    void failureKeepsMetrics() {
        TimestampServerManager manager = new TimestampServerManager((config, request) -> {
            throw new DSSException("Connection refused");
        }, new InMemoryTimestampAuditLog(), millis -> { }, Clock.systemUTC(), Runnable::run);
        FallbackTSPSource source = new FallbackTSPSource(manager, failover());
        byte[] digest = new MessageImprintBuilder().digest(DATA, MessageImprintBuilder.DEFAULT_ALGORITHM);

        assertThrows(TsaException.class,
            () -> source.getTimeStampResponse(MessageImprintBuilder.DEFAULT_ALGORITHM, digest));

        assertNull(source.getUrlUsed());
        assertEquals(TsaErrorType.TSA_UNAVAILABLE, source.getLastErrorType());
        assertTrue(source.getLastErrorMessage().startsWith("All 2 TSA servers failed"));
        assertEquals(2, source.getAttemptLog().size());
    }
}
