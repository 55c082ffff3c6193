package cz.drbacon.pades.cert;

import cz.drbacon.pades.testsupport.TestPki;
import org.junit.jupiter.api.Test;

import java.security.cert.X509Certificate;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CertificateStoreTest {

    private final TestPki pki = TestPki.get();

    @Test
    void storesAndFindsByFingerprint() {
        CertificateStore store = new CertificateStore();
        store.addIntermediate(pki.intermediate);
        store.storeCertificate(pki.leaf, CertificateSource.DOCUMENT);

        assertEquals(pki.leaf, store.getCertificate(CertificateManager.fingerprint(pki.leaf)).orElse(null));
        assertEquals(Collections.singletonList(pki.intermediate), store.getIntermediates());
        assertFalse(store.getCertificate("00").isPresent());
        assertEquals(2, store.size());
    }

    @Test
    void entriesExpireButTrustedRootsStay() {
        MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        CertificateStore store = new CertificateStore(10, Duration.ofHours(1), clock);
        store.addTrustedRoot(pki.root);
        store.addIntermediate(pki.intermediate);

        clock.now = clock.now.plus(Duration.ofHours(2));

        assertTrue(store.getIntermediates().isEmpty());
        assertFalse(store.getCertificate(CertificateManager.fingerprint(pki.intermediate)).isPresent());
        assertEquals(pki.root, store.getCertificate(CertificateManager.fingerprint(pki.root)).orElse(null));
        assertEquals(Collections.singletonList(pki.root), store.getTrustedRoots());
    }

    @Test
    void fullCacheEvictsOldestEntries() throws Exception {
        CertificateStore store = new CertificateStore(3, Duration.ofHours(1), Clock.systemUTC());
        List<X509Certificate> certificates = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            certificates.add(TestPki.issue("CN=Cached " + i, pki.leafKey.getPublic(), pki.intermediate,
                pki.intermediateKey.getPrivate(), Instant.now().minus(Duration.ofDays(1)),
                Instant.now().plus(Duration.ofDays(1)), false, false));
        }
        for (X509Certificate certificate : certificates) {
            store.storeCertificate(certificate, CertificateSource.DOCUMENT);
        }

        assertEquals(3, store.size());
        assertFalse(store.getCertificate(CertificateManager.fingerprint(certificates.get(0))).isPresent());
        assertTrue(store.getCertificate(CertificateManager.fingerprint(certificates.get(3))).isPresent());
    }

    @Test
    void clearCacheKeepsTrustedRoots() {
        CertificateStore store = new CertificateStore();
        store.addTrustedRoot(pki.root);
        store.addIntermediate(pki.intermediate);

        store.clearCache();

        assertEquals(0, store.size());
        assertTrue(store.getIntermediates().isEmpty());
        assertEquals(Collections.singletonList(pki.root), store.getTrustedRoots());

        store.removeCertificate(CertificateManager.fingerprint(pki.root));
        assertTrue(store.getTrustedRoots().isEmpty());
    }

    @Test
    void rejectsUnusableLimits() {
        assertThrows(IllegalArgumentException.class,
            () -> new CertificateStore(0, Duration.ofHours(1), Clock.systemUTC()));
        assertThrows(IllegalArgumentException.class,
            () -> new CertificateStore(10, Duration.ZERO, Clock.systemUTC()));
    }

    private static final class MutableClock extends Clock {
        private Instant now;

        private MutableClock(Instant now) {
            this.now = now;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
