package cz.drbacon.pades.tsp;

import cz.drbacon.pades.BouncyCastleSupport;
import cz.drbacon.pades.cms.CmsSignature;
import cz.drbacon.pades.cms.CmsSignatureParser;
import cz.drbacon.pades.testsupport.TestPki;
import cz.drbacon.pades.testsupport.TestTsa;
import eu.europa.esig.dss.model.DSSException;
import org.bouncycastle.asn1.ASN1EncodableVector;
import org.bouncycastle.asn1.ASN1Primitive;
import org.bouncycastle.asn1.DEROctetString;
import org.bouncycastle.asn1.cms.AttributeTable;
import org.bouncycastle.cert.jcajce.JcaCertStore;
import org.bouncycastle.cms.CMSProcessableByteArray;
import org.bouncycastle.cms.CMSSignedData;
import org.bouncycastle.cms.CMSSignedDataGenerator;
import org.bouncycastle.cms.SignerInformation;
import org.bouncycastle.cms.SignerInformationStore;
import org.bouncycastle.cms.jcajce.JcaSignerInfoGeneratorBuilder;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;
import org.bouncycastle.operator.jcajce.JcaDigestCalculatorProviderBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class TimestampServerManagerTest {

    private static final byte[] DATA = "Hello, timestamp!".getBytes(StandardCharsets.UTF_8);
    private static final String PRIMARY = "https://primary.tsa.test/tsr";
    private static final String FALLBACK = "https://fallback.tsa.test/tsr";

    private final TestPki pki = TestPki.get();
    private final TestTsa tsa = new TestTsa(pki);

    private InMemoryTimestampAuditLog auditLog;
    private List<Long> sleeps;

    @BeforeEach
    void setUp() {
        auditLog = new InMemoryTimestampAuditLog();
        sleeps = new ArrayList<>();
    }

    private TimestampServerManager manager(TimestampTransport transport) {
        return new TimestampServerManager(transport, auditLog, sleeps::add, Clock.systemUTC(), Runnable::run);
    }

    private List<TimestampAuditEntry> requestEntries() {
        return auditLog.entries().stream()
            .filter(e -> e.getOperation() == TimestampOperation.REQUEST)
            .collect(Collectors.toList());
    }

    @Test
    void requestCarriesImprintAndNonce() {
        TimestampRequest request = manager(tsa.transport())
            .createTimestampRequest(DATA, TimestampRequestOptions.defaults().withPolicyOid(TestTsa.POLICY_OID));

        assertEquals("SHA256", request.getMessageImprint().getAlgorithmName());
        assertNotNull(request.getNonce());
        assertTrue(request.getNonce().signum() > 0);
        assertTrue(request.isCertificateRequested());
        assertEquals(TestTsa.POLICY_OID, request.getPolicyOid());

        TimestampRequest withoutNonce = manager(tsa.transport())
            .createTimestampRequest(DATA, TimestampRequestOptions.defaults().withNonce(false));
        assertNull(withoutNonce.getNonce());
    }

    @Test
    void grantedTokenVerifiesAgainstOriginalData() {
        TimestampServerManager manager = manager(tsa.transport());
        TimestampRequest request = manager.createTimestampRequest(DATA, TimestampRequestOptions.defaults());

        TimestampResponse response = manager.requestTimestamp(request, TsaConfig.of(PRIMARY));
        TimestampVerificationResult result = manager.verifyTimestampResponse(response, DATA);

        assertTrue(response.isGranted());
        assertEquals(PRIMARY, response.getTsaUrl());
        assertTrue(result.isValid(), result.getErrors().toString());
        assertTrue(result.isImprintMatches());
        assertTrue(result.isSignatureVerified());
        assertEquals(TestTsa.POLICY_OID, result.getPolicyOid());
        assertEquals(1, result.getAccuracy().getSeconds());
        assertTrue(result.getTsaCertificateSubject().contains("CN=Test TSA"));
        assertNotNull(result.getGenTime());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void tokenDoesNotCoverOtherData() {
        TimestampServerManager manager = manager(tsa.transport());
        TimestampResponse response = manager.requestTimestamp(
            manager.createTimestampRequest(DATA, TimestampRequestOptions.defaults()), TsaConfig.of(PRIMARY));

        TimestampVerificationResult result = manager.verifyTimestamp(response.getTimestamp(),
            "Different data".getBytes(StandardCharsets.UTF_8));

        assertFalse(result.isValid());
        assertFalse(result.isImprintMatches());
        assertTrue(result.isSignatureVerified());
        assertTrue(result.getErrors().contains("Document does not match timestamp"));
    }

    @Test
    void retriesWithBackoffUntilGranted() {
        TimestampTransport transport = mock(TimestampTransport.class);
        when(transport.post(any(), any()))
            .thenThrow(new DSSException("Connection refused"))
            .thenThrow(new DSSException("HTTP 503 Service Unavailable"))
            .thenAnswer(invocation -> tsa.respond(invocation.getArgument(1)));
        TimestampServerManager manager = manager(transport);

        TimestampResponse response = manager.requestTimestamp(
            manager.createTimestampRequest(DATA, TimestampRequestOptions.defaults()), TsaConfig.of(PRIMARY));

        assertTrue(response.isGranted());
        verify(transport, times(3)).post(any(), any());
        assertEquals(Arrays.asList(1000L, 2000L), sleeps);
        List<TimestampAuditEntry> requests = requestEntries();
        assertEquals(1, requests.size());
        assertTrue(requests.get(0).isSuccess());
        assertTrue(requests.get(0).getResult().contains("attempts=3"));
    }

    @Test
    void exhaustedRetriesReportEveryAttempt() {
        TimestampTransport transport = mock(TimestampTransport.class);
        when(transport.post(any(), any())).thenThrow(new DSSException("Connection refused"));
        TimestampServerManager manager = manager(transport);
        TimestampRequest request = manager.createTimestampRequest(DATA, TimestampRequestOptions.defaults());

        TsaConnectionException e = assertThrows(TsaConnectionException.class,
            () -> manager.requestTimestamp(request, TsaConfig.of(PRIMARY)));

        assertEquals(TsaErrorType.TSA_UNAVAILABLE, e.getErrorType());
        assertEquals(503, e.getHttpStatus());
        assertEquals(3, e.getAttempts().size());
        assertTrue(e.getAttempts().stream().noneMatch(TsaAttempt::isSuccess));
        assertEquals(Arrays.asList(1000L, 2000L), sleeps);
        assertEquals(1, requestEntries().size());
        assertFalse(requestEntries().get(0).isSuccess());
    }

    @Test
    void rejectionIsAProtocolError() {
        TimestampServerManager manager = manager((config, request) -> tsa.rejection());
        TimestampRequest request = manager.createTimestampRequest(DATA, TimestampRequestOptions.defaults());

        TsaResponseException e = assertThrows(TsaResponseException.class,
            () -> manager.requestTimestamp(request, TsaConfig.of(PRIMARY).withRetryAttempts(1)));

        assertEquals(TsaErrorType.TSA_REJECTED, e.getErrorType());
        assertEquals(TsaStatus.REJECTION, e.getStatus());
        assertTrue(e.getMessage().contains("algorithm not supported"), e.getMessage());
    }

    @Test
    void responseForAnotherRequestIsInvalid() {
        TimestampServerManager manager = manager(tsa.transport());
        TimestampRequest other = manager.createTimestampRequest(DATA, TimestampRequestOptions.defaults());
        TimestampServerManager replaying = manager((config, request) -> tsa.respond(other.getEncoded()));
        TimestampRequest request = replaying.createTimestampRequest(DATA, TimestampRequestOptions.defaults());

        TsaResponseException e = assertThrows(TsaResponseException.class,
            () -> replaying.requestTimestamp(request, TsaConfig.of(PRIMARY).withRetryAttempts(1)));

        assertEquals(TsaErrorType.TSA_INVALID_RESPONSE, e.getErrorType());
    }

    @Test
    void garbageBodyIsInvalidResponse() {
        TimestampServerManager manager = manager((config, request) -> new byte[] {1, 2, 3});
        TimestampRequest request = manager.createTimestampRequest(DATA, TimestampRequestOptions.defaults());

        TsaResponseException e = assertThrows(TsaResponseException.class,
            () -> manager.requestTimestamp(request, TsaConfig.of(PRIMARY).withRetryAttempts(1)));

        assertEquals(TsaErrorType.TSA_INVALID_RESPONSE, e.getErrorType());
    }

    @Test
    void failsOverToNextServerInOrder() {
        List<String> calledUrls = new ArrayList<>();
        TimestampServerManager manager = manager((config, request) -> {
            calledUrls.add(config.getUrl());
            if (PRIMARY.equals(config.getUrl())) {
                throw new DSSException("Connection refused");
            }
            return tsa.respond(request);
        });
        TsaFailoverConfig failover = new TsaFailoverConfig(TsaConfig.of(PRIMARY).withRetryAttempts(1),
            Collections.singletonList(TsaConfig.of(FALLBACK)));

        TimestampResponse response = manager.requestTimestampWithFailover(
            manager.createTimestampRequest(DATA, TimestampRequestOptions.defaults()), failover);

        assertEquals(FALLBACK, response.getTsaUrl());
        assertEquals(Arrays.asList(PRIMARY, FALLBACK), calledUrls);
        List<TimestampAuditEntry> requests = requestEntries();
        assertEquals(2, requests.size());
        assertFalse(requests.get(0).isSuccess());
        assertEquals(PRIMARY, requests.get(0).getTsaUrl());
        assertTrue(requests.get(1).isSuccess());
        assertEquals(FALLBACK, requests.get(1).getTsaUrl());
    }

    @Test
    void allServersFailing() {
        TimestampServerManager manager = manager((config, request) -> {
            throw new DSSException("Connection refused");
        });
        TsaFailoverConfig failover = new TsaFailoverConfig(TsaConfig.of(PRIMARY).withRetryAttempts(1),
            Collections.singletonList(TsaConfig.of(FALLBACK).withRetryAttempts(1)));
        TimestampRequest request = manager.createTimestampRequest(DATA, TimestampRequestOptions.defaults());

        TsaConnectionException e = assertThrows(TsaConnectionException.class,
            () -> manager.requestTimestampWithFailover(request, failover));

        assertEquals(Arrays.asList(PRIMARY, FALLBACK), e.getAttemptedUrls());
        assertEquals(2, e.getAttempts().size());
        assertTrue(e.getMessage().startsWith("All 2 TSA servers failed"), e.getMessage());
    }

    @Test
    void failoverStopsAtConfiguredLimit() {
        List<String> calledUrls = new ArrayList<>();
        TimestampServerManager manager = manager((config, request) -> {
            calledUrls.add(config.getUrl());
            throw new DSSException("Connection refused");
        });
        TsaFailoverConfig failover = new TsaFailoverConfig(TsaConfig.of(PRIMARY).withRetryAttempts(1),
            Collections.singletonList(TsaConfig.of(FALLBACK)), 1);
        TimestampRequest request = manager.createTimestampRequest(DATA, TimestampRequestOptions.defaults());

        assertThrows(TsaConnectionException.class, () -> manager.requestTimestampWithFailover(request, failover));
        assertEquals(Collections.singletonList(PRIMARY), calledUrls);
    }

    @Test
    void asyncRequestCompletes() throws Exception {
        TimestampServerManager manager = manager(tsa.transport());
        TimestampRequest request = manager.createTimestampRequest(DATA, TimestampRequestOptions.defaults());

        TimestampResponse response = manager.requestTimestampWithFailoverAsync(request,
            TsaFailoverConfig.single(TsaConfig.of(PRIMARY))).get();

        assertTrue(response.isGranted());
    }

    @Test
    void asyncSingleServerRequestCompletes() throws Exception {
        TimestampServerManager manager = manager(tsa.transport());
        TimestampRequest request = manager.createTimestampRequest(DATA, TimestampRequestOptions.defaults());

        TimestampResponse response = manager.requestTimestampAsync(request, TsaConfig.of(PRIMARY)).get();

        assertTrue(response.isGranted());
        assertTrue(manager.verifyTimestampResponse(response, DATA).isValid());
        assertEquals(1, requestEntries().size());
    }

    @Test
    void asyncSingleServerFailureCompletesExceptionally() {
        TimestampTransport transport = mock(TimestampTransport.class);
        when(transport.post(any(), any())).thenThrow(new DSSException("Connection refused"));
        TimestampServerManager manager = manager(transport);
        TimestampRequest request = manager.createTimestampRequest(DATA, TimestampRequestOptions.defaults());

        ExecutionException e = assertThrows(ExecutionException.class,
            () -> manager.requestTimestampAsync(request, TsaConfig.of(PRIMARY)).get());

        assertInstanceOf(TsaConnectionException.class, e.getCause());
        assertEquals(3, ((TsaConnectionException) e.getCause()).getAttempts().size());
    }

    @Test
    void embedsAndExtractsSignatureTimestamp() throws Exception {
        TimestampServerManager manager = manager(tsa.transport());
        CmsSignature plain = signedCms(DATA);
        assertFalse(manager.extractTimestamp(plain).isPresent());

        CmsSignature stamped = manager.addTimestampToSignature(plain, TsaConfig.of(PRIMARY));
        assertTrue(stamped.hasTimestamp());
        assertFalse(plain.hasTimestamp());

        CmsSignature reparsed = new CmsSignatureParser().parse(stamped.getEncoded(), DATA);
        Optional<Timestamp> extracted = manager.extractTimestamp(reparsed);
        assertTrue(extracted.isPresent());
        assertEquals(stamped.getTimestamp().getSerialNumber(), extracted.get().getSerialNumber());
        assertTrue(manager.verifyTimestamp(extracted.get(), reparsed.getSignatureValue()).isValid());

        List<TimestampOperation> operations = auditLog.entries().stream()
            .map(TimestampAuditEntry::getOperation).collect(Collectors.toList());
        assertTrue(operations.containsAll(Arrays.asList(
            TimestampOperation.REQUEST, TimestampOperation.EMBED, TimestampOperation.EXTRACT, TimestampOperation.VERIFY)));
    }

    @Test
    void readsLegacyAttributeAndSkipsGarbage() throws Exception {
        TimestampServerManager manager = manager(tsa.transport());
        CmsSignature plain = signedCms(DATA);
        TimestampRequest request = manager.createTimestampRequest(plain.getSignatureValue(),
            TimestampRequestOptions.defaults());
        byte[] token = TimestampResponse.parse(tsa.respond(request.getEncoded()), null).getTimestamp().getEncoded();

        AttributeTable unsigned = new AttributeTable(new ASN1EncodableVector())
            .add(TimestampServerManager.TIMESTAMP_ATTRIBUTE, new DEROctetString(new byte[] {1, 2, 3}))
            .add(TimestampServerManager.LEGACY_TIMESTAMP_ATTRIBUTE, ASN1Primitive.fromByteArray(token));
        SignerInformation signer = SignerInformation.replaceUnsignedAttributes(plain.getSignerInformation(), unsigned);
        CMSSignedData rebuilt = CMSSignedData.replaceSigners(plain.getSignedData(), new SignerInformationStore(signer));

        Optional<Timestamp> extracted = manager.extractTimestamp(new CmsSignatureParser().parse(rebuilt.getEncoded(), DATA));

        assertTrue(extracted.isPresent());
        assertTrue(manager.verifyTimestamp(extracted.get(), plain.getSignatureValue()).isValid());
    }

    private CmsSignature signedCms(byte[] content) throws Exception {
        CMSSignedDataGenerator generator = new CMSSignedDataGenerator();
        generator.addSignerInfoGenerator(new JcaSignerInfoGeneratorBuilder(
            new JcaDigestCalculatorProviderBuilder().setProvider(BouncyCastleSupport.PROVIDER).build())
            .build(new JcaContentSignerBuilder("SHA256withRSA").setProvider(BouncyCastleSupport.PROVIDER)
                .build(pki.leafKey.getPrivate()), pki.leaf));
        generator.addCertificates(new JcaCertStore(pki.signerChain()));
        CMSSignedData signedData = generator.generate(new CMSProcessableByteArray(content), false);
        return new CmsSignatureParser().parse(signedData.getEncoded(), content);
    }
}
