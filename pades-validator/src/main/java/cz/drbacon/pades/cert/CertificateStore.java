package cz.drbacon.pades.cert;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.cert.X509Certificate;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Fingerprint-keyed certificate cache with a known-intermediates pool.
 *
 * Trusted roots are kept until removed explicitly. Every other certificate expires after the
 * configured time to live, and when the cache is full the oldest tenth of it is evicted.
 * Intermediates held here are offered as issuer candidates by
 * {@link CertificateManager#validateCertificateChain} when the supplied chain lacks them.
 *
 * Thread-safe.
 */
public class CertificateStore {

    private static final Logger LOG = LoggerFactory.getLogger(CertificateStore.class);

    public static final int DEFAULT_MAX_SIZE = 1000;
    public static final Duration DEFAULT_TIME_TO_LIVE = Duration.ofHours(24);

    private final Object lock = new Object();
    private final Map<String, Entry> cache = new LinkedHashMap<>();
    private final Map<String, X509Certificate> trustedRoots = new LinkedHashMap<>();
    private final int maxSize;
    private final Duration timeToLive;
    private final Clock clock;

    public CertificateStore() {
        this(DEFAULT_MAX_SIZE, DEFAULT_TIME_TO_LIVE, Clock.systemUTC());
    }

    public CertificateStore(int maxSize, Duration timeToLive, Clock clock) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("Cache size must be at least 1");
        }
        if (timeToLive.isNegative() || timeToLive.isZero()) {
            throw new IllegalArgumentException("Time to live must be positive");
        }
        this.maxSize = maxSize;
        this.timeToLive = timeToLive;
        this.clock = clock;
    }

    public void storeCertificate(X509Certificate certificate, CertificateSource source) {
        Objects.requireNonNull(certificate, "certificate");
        Objects.requireNonNull(source, "source");
        String fingerprint = CertificateManager.fingerprint(certificate);
        Instant now = clock.instant();
        synchronized (lock) {
            if (source == CertificateSource.TRUSTED_ROOT) {
                trustedRoots.put(fingerprint, certificate);
            }
            cache.remove(fingerprint);
            if (cache.size() >= maxSize) {
                evict(now);
            }
            cache.put(fingerprint, new Entry(certificate, source, now.plus(timeToLive)));
        }
        LOG.debug("CERT_STORE: {} {} as {}", fingerprint, certificate.getSubjectX500Principal().getName(), source);
    }

    public void addTrustedRoot(X509Certificate certificate) {
        storeCertificate(certificate, CertificateSource.TRUSTED_ROOT);
    }

    public void addIntermediate(X509Certificate certificate) {
        storeCertificate(certificate, CertificateSource.INTERMEDIATE);
    }

    /**
     * @return the certificate, or empty if unknown or expired from the cache (trusted roots never expire)
     */
    public Optional<X509Certificate> getCertificate(String fingerprint) {
        synchronized (lock) {
            Entry entry = cache.get(fingerprint);
            if (entry != null && entry.isExpired(clock.instant())) {
                cache.remove(fingerprint);
                entry = null;
            }
            if (entry != null) {
                return Optional.of(entry.certificate);
            }
            return Optional.ofNullable(trustedRoots.get(fingerprint));
        }
    }

    public void removeCertificate(String fingerprint) {
        synchronized (lock) {
            cache.remove(fingerprint);
            trustedRoots.remove(fingerprint);
        }
    }

    /**
     * Drop all cached certificates. Trusted roots stay.
     */
    public void clearCache() {
        synchronized (lock) {
            cache.clear();
        }
    }

    public List<X509Certificate> getTrustedRoots() {
        synchronized (lock) {
            return Collections.unmodifiableList(new ArrayList<>(trustedRoots.values()));
        }
    }

    /**
     * Unexpired intermediates, oldest first.
     */
    public List<X509Certificate> getIntermediates() {
        Instant now = clock.instant();
        List<X509Certificate> intermediates = new ArrayList<>();
        synchronized (lock) {
            for (Entry entry : cache.values()) {
                if (entry.source == CertificateSource.INTERMEDIATE && !entry.isExpired(now)) {
                    intermediates.add(entry.certificate);
                }
            }
        }
        return intermediates;
    }

    public int size() {
        synchronized (lock) {
            return cache.size();
        }
    }

    private void evict(Instant now) {
        cache.values().removeIf(entry -> entry.isExpired(now));
        if (cache.size() < maxSize) {
            return;
        }
        int toRemove = (int) Math.ceil(cache.size() * 0.1);
        Iterator<Entry> oldest = cache.values().iterator();
        for (int i = 0; i < toRemove && oldest.hasNext(); i++) {
            oldest.next();
            oldest.remove();
        }
        LOG.debug("CERT_STORE: evicted {} oldest entries", toRemove);
    }

    private static final class Entry {
        private final X509Certificate certificate;
        private final CertificateSource source;
        private final Instant expiresAt;

        private Entry(X509Certificate certificate, CertificateSource source, Instant expiresAt) {
            this.certificate = certificate;
            this.source = source;
            this.expiresAt = expiresAt;
        }

        private boolean isExpired(Instant now) {
            return now.isAfter(expiresAt);
        }
    }
}
