package cz.drbacon.pades.tsp;

import cz.drbacon.pades.BouncyCastleSupport;
import cz.drbacon.pades.cms.CmsSignature;
import cz.drbacon.pades.digest.MessageImprint;
import cz.drbacon.pades.digest.MessageImprintBuilder;
import eu.europa.esig.dss.enumerations.DigestAlgorithm;
import org.bouncycastle.asn1.ASN1Encodable;
import org.bouncycastle.asn1.ASN1EncodableVector;
import org.bouncycastle.asn1.ASN1Encoding;
import org.bouncycastle.asn1.ASN1ObjectIdentifier;
import org.bouncycastle.asn1.ASN1Primitive;
import org.bouncycastle.asn1.cms.Attribute;
import org.bouncycastle.asn1.cms.AttributeTable;
import org.bouncycastle.asn1.pkcs.PKCSObjectIdentifiers;
import org.bouncycastle.cms.CMSSignedData;
import org.bouncycastle.cms.SignerInformation;
import org.bouncycastle.cms.SignerInformationStore;
import org.bouncycastle.cms.jcajce.JcaSimpleSignerInfoVerifierBuilder;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.tsp.TSPException;
import org.bouncycastle.tsp.TimeStampRequest;
import org.bouncycastle.tsp.TimeStampRequestGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigInteger;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;

/**
 * RFC 3161 client: builds requests, talks to TSAs with retry and failover, verifies tokens,
 * and reads or writes the signature timestamp inside a CMS signer's unsigned attributes.
 *
 * Retry against one server follows {@link RetryState}: every failure (transport error, non-2xx,
 * unparseable body, rejected status, token not matching the request) counts as a failed attempt,
 * and attempts are separated by {@link BackoffPolicy} delays. Failover walks the servers of a
 * {@link TsaFailoverConfig} strictly in order.
 *
 * Every operation is appended to the {@link TimestampAuditLog}.
 */
public class TimestampServerManager {

    private static final Logger LOG = LoggerFactory.getLogger(TimestampServerManager.class);

    /** id-aa-signatureTimeStampToken, 1.2.840.113549.1.9.16.2.14 */
    public static final ASN1ObjectIdentifier TIMESTAMP_ATTRIBUTE = PKCSObjectIdentifiers.id_aa_signatureTimeStampToken;

    /** Identifier written by some older producers; accepted when reading only. */
    public static final ASN1ObjectIdentifier LEGACY_TIMESTAMP_ATTRIBUTE = new ASN1ObjectIdentifier("1.2.840.113549.1.9.16.1.14");

    private static final int NONCE_BITS = 128;

    private final TimestampTransport transport;
    private final TimestampAuditLog auditLog;
    private final Sleeper sleeper;
    private final Clock clock;
    private final Executor executor;
    private final MessageImprintBuilder imprintBuilder = new MessageImprintBuilder();
    private final SecureRandom random = new SecureRandom();

    public TimestampServerManager() {
        this(new DssTimestampTransport(), InMemoryTimestampAuditLog.shared());
    }

    public TimestampServerManager(TimestampTransport transport, TimestampAuditLog auditLog) {
        this(transport, auditLog, Sleeper.THREAD, Clock.systemUTC(), ForkJoinPool.commonPool());
    }

    public TimestampServerManager(TimestampTransport transport, TimestampAuditLog auditLog, Sleeper sleeper,
                                  Clock clock, Executor executor) {
        BouncyCastleSupport.ensureProvider();
        this.transport = transport;
        this.auditLog = auditLog;
        this.sleeper = sleeper;
        this.clock = clock;
        this.executor = executor;
    }

    // ---------------------------------------------------------------- request construction

    public TimestampRequest createTimestampRequest(byte[] data, TimestampRequestOptions options) {
        return createTimestampRequest(imprintBuilder.build(data, options.getHashAlgorithm()), options);
    }

    /**
     * Build a request for an imprint computed elsewhere (e.g. a digest handed over by a signing service).
     */
    public TimestampRequest createTimestampRequest(MessageImprint imprint, TimestampRequestOptions options) {
        TimeStampRequestGenerator generator = new TimeStampRequestGenerator();
        generator.setCertReq(options.isCertificateRequested());
        if (options.getPolicyOid() != null) {
            generator.setReqPolicy(new ASN1ObjectIdentifier(options.getPolicyOid()));
        }
        ASN1ObjectIdentifier algorithm = new ASN1ObjectIdentifier(imprint.getAlgorithmOid());
        TimeStampRequest request = options.isIncludeNonce()
            ? generator.generate(algorithm, imprint.getHashedMessage(), newNonce())
            : generator.generate(algorithm, imprint.getHashedMessage());
        return new TimestampRequest(imprint, request);
    }

    private BigInteger newNonce() {
        BigInteger nonce;
        do {
            nonce = new BigInteger(NONCE_BITS, random);
        } while (nonce.signum() == 0);
        return nonce;
    }

    // ---------------------------------------------------------------- transport

    /**
     * Send a request to one TSA, retrying up to {@link TsaConfig#getRetryAttempts()} times.
     *
     * @throws TsaResponseException   if the last attempt failed on the protocol level
     * @throws TsaConnectionException if the last attempt failed on the transport level
     */
    public TimestampResponse requestTimestamp(TimestampRequest request, TsaConfig config) {
        String url = config.getUrl();
        int maxAttempts = config.getRetryAttempts();
        List<TsaAttempt> attempts = new ArrayList<>();
        long started = System.nanoTime();

        int attempt = 1;
        RetryState state = RetryState.ATTEMPTING;
        TimestampResponse response = null;
        RuntimeException lastError = null;

        while (!state.isTerminal()) {
            if (state == RetryState.BACKOFF) {
                long backoff = BackoffPolicy.delayAfterAttempt(attempt);
                LOG.info("TSA {} retry {}/{} after {}ms backoff", url, attempt + 1, maxAttempts, backoff);
                try {
                    sleeper.sleep(backoff);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    auditLog.append(TimestampAuditEntry.failure(TimestampOperation.REQUEST, url,
                        "Interrupted during backoff", elapsedMs(started), clock.instant()));
                    throw new TsaConnectionException("Interrupted while waiting to retry " + url,
                        TsaErrorType.TSA_UNAVAILABLE, List.of(url), attempts, ie);
                }
                attempt++;
                state = RetryState.ATTEMPTING;
                continue;
            }

            long attemptStart = System.nanoTime();
            try {
                response = exchange(request, config);
                long elapsed = elapsedMs(attemptStart);
                attempts.add(TsaAttempt.succeeded(url, attempt, elapsed));
                LOG.info("TSA_OK: {} in {}ms (attempt {}/{})", url, elapsed, attempt, maxAttempts);
                state = RetryState.afterAttempt(true, attempt, maxAttempts);
            } catch (RuntimeException e) {
                long elapsed = elapsedMs(attemptStart);
                TsaErrorType errorType = TsaErrorType.classify(e);
                String message = TsaErrorType.shortMessage(e);
                attempts.add(TsaAttempt.failed(url, attempt, errorType, message, elapsed));
                LOG.warn("TSA_FAIL: {} {} after {}ms: {} (attempt {}/{})",
                    url, errorType, elapsed, message, attempt, maxAttempts);
                lastError = e;
                state = RetryState.afterAttempt(false, attempt, maxAttempts);
            }
        }

        if (state == RetryState.SUCCEEDED) {
            Timestamp timestamp = response.getTimestamp();
            auditLog.append(TimestampAuditEntry.success(TimestampOperation.REQUEST, url,
                String.format("granted serial=%s genTime=%s attempts=%d",
                    timestamp.getSerialNumber(), timestamp.getGenTime(), attempts.size()),
                elapsedMs(started), clock.instant()));
            return response;
        }

        TsaErrorType errorType = TsaErrorType.classify(lastError);
        String message = String.format("TSA %s failed after %d attempts: %s",
            url, attempts.size(), TsaErrorType.shortMessage(lastError));
        auditLog.append(TimestampAuditEntry.failure(TimestampOperation.REQUEST, url, message,
            elapsedMs(started), clock.instant()));
        if (lastError instanceof TsaResponseException) {
            throw new TsaResponseException(message, errorType,
                ((TsaResponseException) lastError).getStatus(), attempts, lastError);
        }
        throw new TsaConnectionException(message, errorType, List.of(url), attempts, lastError);
    }

    private TimestampResponse exchange(TimestampRequest request, TsaConfig config) {
        byte[] raw = transport.post(config, request.getEncoded());
        TimestampResponse response = TimestampResponse.parse(raw, config.getUrl());
        if (!response.isGranted()) {
            throw new TsaResponseException(String.format("TSA rejected request: status %s%s (failInfo=%d)",
                response.getStatus(),
                response.getStatusString() != null ? " '" + response.getStatusString() + "'" : "",
                response.getFailInfo()),
                TsaErrorType.TSA_REJECTED, response.getStatus());
        }
        try {
            response.toBouncyCastle().validate(request.toBouncyCastle());
        } catch (TSPException e) {
            throw new TsaResponseException("Response does not match request: " + e.getMessage(),
                TsaErrorType.TSA_INVALID_RESPONSE, response.getStatus(), e);
        }
        return response;
    }

    /**
     * Try the primary, then each fallback in order, until one grants the request.
     *
     * @throws TsaConnectionException listing every attempted URL when all servers failed
     */
    public TimestampResponse requestTimestampWithFailover(TimestampRequest request, TsaFailoverConfig failoverConfig) {
        List<TsaConfig> servers = failoverConfig.attemptOrder();
        List<String> attemptedUrls = new ArrayList<>();
        List<TsaAttempt> attempts = new ArrayList<>();
        TsaException lastError = null;

        for (int i = 0; i < servers.size(); i++) {
            TsaConfig server = servers.get(i);
            attemptedUrls.add(server.getUrl());
            try {
                TimestampResponse response = requestTimestamp(request, server);
                if (i > 0) {
                    LOG.info("TSA failover succeeded on {} after {} failed server(s)", server.getUrl(), i);
                }
                return response;
            } catch (TsaException e) {
                lastError = e;
                attempts.addAll(e.getAttempts());
                if (i + 1 < servers.size()) {
                    LOG.warn("TSA {} failed ({}), switching to {}", server.getUrl(), e.getErrorType(),
                        servers.get(i + 1).getUrl());
                } else {
                    LOG.error("TSA {} failed ({}), no servers left", server.getUrl(), e.getErrorType());
                }
            }
        }

        throw new TsaConnectionException(
            String.format("All %d TSA servers failed %s. Last error: %s",
                attemptedUrls.size(), attemptedUrls, lastError.getMessage()),
            lastError.getErrorType(), attemptedUrls, attempts, lastError);
    }

    public CompletableFuture<TimestampResponse> requestTimestampAsync(TimestampRequest request, TsaConfig config) {
        return CompletableFuture.supplyAsync(() -> requestTimestamp(request, config), executor);
    }

    public CompletableFuture<TimestampResponse> requestTimestampWithFailoverAsync(TimestampRequest request,
                                                                                  TsaFailoverConfig failoverConfig) {
        return CompletableFuture.supplyAsync(() -> requestTimestampWithFailover(request, failoverConfig), executor);
    }

    // ---------------------------------------------------------------- verification

    /**
     * Check a freshly received response: status granted, then the token against {@code originalData}.
     */
    public TimestampVerificationResult verifyTimestampResponse(TimestampResponse response, byte[] originalData) {
        long started = System.nanoTime();
        TimestampVerificationResult result;
        if (!response.isGranted()) {
            result = TimestampVerificationResult.failed("TSA did not grant the request: status " + response.getStatus());
        } else if (response.getTimestamp() == null) {
            result = TimestampVerificationResult.failed("Response carries no timestamp token");
        } else {
            result = verifyToken(response.getTimestamp(), originalData);
        }
        auditVerification(response.getTsaUrl(), result, started);
        return result;
    }

    /**
     * Check a previously obtained token against the data it should cover.
     */
    public TimestampVerificationResult verifyTimestamp(Timestamp timestamp, byte[] originalData) {
        long started = System.nanoTime();
        TimestampVerificationResult result = verifyToken(timestamp, originalData);
        auditVerification(timestamp.getTsaUrl(), result, started);
        return result;
    }

    private TimestampVerificationResult verifyToken(Timestamp timestamp, byte[] originalData) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        TstInfo info = timestamp.getInfo();

        boolean imprintMatches = false;
        try {
            DigestAlgorithm algorithm = MessageImprintBuilder.resolve(info.getImprintAlgorithmOid());
            imprintMatches = imprintBuilder.build(originalData, algorithm).matches(info.getImprintDigest());
            if (!imprintMatches) {
                errors.add("Document does not match timestamp");
            }
        } catch (IllegalArgumentException e) {
            errors.add("Unsupported imprint algorithm " + info.getImprintAlgorithmOid());
        }

        boolean signatureVerified = false;
        String tsaSubject = null;
        X509Certificate tsaCertificate = timestamp.getTsaCertificate();
        if (tsaCertificate == null) {
            warnings.add("Timestamp token carries no TSA certificate, token signature not verified");
        } else {
            tsaSubject = tsaCertificate.getSubjectX500Principal().getName();
            Instant now = clock.instant();
            if (now.isBefore(tsaCertificate.getNotBefore().toInstant())) {
                errors.add("TSA certificate not valid before " + tsaCertificate.getNotBefore().toInstant());
            } else if (now.isAfter(tsaCertificate.getNotAfter().toInstant())) {
                errors.add("TSA certificate expired at " + tsaCertificate.getNotAfter().toInstant());
            }
            try {
                timestamp.getToken().validate(new JcaSimpleSignerInfoVerifierBuilder()
                    .setProvider(BouncyCastleSupport.PROVIDER).build(tsaCertificate));
                signatureVerified = true;
            } catch (TSPException | OperatorCreationException e) {
                errors.add("Timestamp signature invalid: " + e.getMessage());
            }
        }

        return new TimestampVerificationResult(imprintMatches, signatureVerified, info, tsaSubject, errors, warnings);
    }

    private void auditVerification(String tsaUrl, TimestampVerificationResult result, long started) {
        if (result.isValid()) {
            auditLog.append(TimestampAuditEntry.success(TimestampOperation.VERIFY, tsaUrl,
                "valid genTime=" + result.getGenTime(), elapsedMs(started), clock.instant()));
        } else {
            auditLog.append(TimestampAuditEntry.failure(TimestampOperation.VERIFY, tsaUrl,
                String.join("; ", result.getErrors()), elapsedMs(started), clock.instant()));
        }
    }

    // ---------------------------------------------------------------- CMS embedding

    /**
     * Find the signature timestamp among the signer's unsigned attributes.
     * Candidates that do not parse as a token are logged and skipped.
     */
    public Optional<Timestamp> extractTimestamp(CmsSignature signature) {
        long started = System.nanoTime();
        AttributeTable unsigned = signature.getUnsignedAttributes();
        List<Timestamp> found = new ArrayList<>();
        if (unsigned != null) {
            collectTokens(unsigned, TIMESTAMP_ATTRIBUTE, found);
            collectTokens(unsigned, LEGACY_TIMESTAMP_ATTRIBUTE, found);
        }
        if (found.size() > 1) {
            LOG.warn("Signature carries {} timestamp tokens, using the first", found.size());
        }
        Optional<Timestamp> result = found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
        auditLog.append(TimestampAuditEntry.success(TimestampOperation.EXTRACT, null,
            result.map(t -> "found serial=" + t.getSerialNumber()).orElse("none"),
            elapsedMs(started), clock.instant()));
        return result;
    }

    private static void collectTokens(AttributeTable unsigned, ASN1ObjectIdentifier oid, List<Timestamp> found) {
        ASN1EncodableVector attributes = unsigned.getAll(oid);
        for (int i = 0; i < attributes.size(); i++) {
            Attribute attribute = Attribute.getInstance(attributes.get(i));
            for (ASN1Encodable value : attribute.getAttrValues()) {
                try {
                    found.add(Timestamp.fromEncoded(value.toASN1Primitive().getEncoded(ASN1Encoding.DER), null));
                } catch (TimestampValidationException | IOException e) {
                    LOG.warn("Skipping unparseable timestamp attribute {}: {}", oid, e.getMessage());
                }
            }
        }
    }

    /**
     * Timestamp the signature value and store the token as the signer's signature timestamp,
     * replacing any previous one.
     *
     * @return a new signature; the argument is left untouched
     */
    public CmsSignature addTimestampToSignature(CmsSignature signature, TsaConfig config) {
        TimestampRequest request = createTimestampRequest(signature.getSignatureValue(), TimestampRequestOptions.defaults());
        TimestampResponse response = requestTimestamp(request, config);
        Timestamp timestamp = response.getTimestamp();

        long started = System.nanoTime();
        try {
            SignerInformation signer = signature.getSignerInformation();
            AttributeTable unsigned = signer.getUnsignedAttributes();
            if (unsigned == null) {
                unsigned = new AttributeTable(new ASN1EncodableVector());
            }
            unsigned = unsigned.remove(TIMESTAMP_ATTRIBUTE).remove(LEGACY_TIMESTAMP_ATTRIBUTE);
            unsigned = unsigned.add(TIMESTAMP_ATTRIBUTE, ASN1Primitive.fromByteArray(timestamp.getEncoded()));
            SignerInformation updated = SignerInformation.replaceUnsignedAttributes(signer, unsigned);

            CMSSignedData signedData = signature.getSignedData();
            List<SignerInformation> signers = new ArrayList<>();
            boolean replaced = false;
            for (SignerInformation existing : signedData.getSignerInfos().getSigners()) {
                if (!replaced && existing.getSID().equals(signer.getSID())) {
                    signers.add(updated);
                    replaced = true;
                } else {
                    signers.add(existing);
                }
            }
            CMSSignedData rebuilt = CMSSignedData.replaceSigners(signedData, new SignerInformationStore(signers));

            auditLog.append(TimestampAuditEntry.success(TimestampOperation.EMBED, config.getUrl(),
                "embedded serial=" + timestamp.getSerialNumber(), elapsedMs(started), clock.instant()));
            return signature.withSignedData(rebuilt, updated, timestamp);
        } catch (IOException e) {
            auditLog.append(TimestampAuditEntry.failure(TimestampOperation.EMBED, config.getUrl(),
                e.getMessage(), elapsedMs(started), clock.instant()));
            throw new TimestampValidationException("Failed to embed timestamp token: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------- audit

    public List<TimestampAuditEntry> getAuditTrail() {
        return auditLog.entries();
    }

    public void clearAuditTrail() {
        auditLog.clear();
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
