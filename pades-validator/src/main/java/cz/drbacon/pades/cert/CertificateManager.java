package cz.drbacon.pades.cert;

import cz.drbacon.pades.BouncyCastleSupport;
import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.asn1.x500.RDN;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x500.style.BCStyle;
import org.bouncycastle.asn1.x500.style.IETFUtils;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.openssl.PEMEncryptedKeyPair;
import org.bouncycastle.openssl.PEMException;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;
import org.bouncycastle.openssl.jcajce.JceOpenSSLPKCS8DecryptorProviderBuilder;
import org.bouncycastle.openssl.jcajce.JcePEMDecryptorProviderBuilder;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.pkcs.PKCS8EncryptedPrivateKeyInfo;
import org.bouncycastle.pkcs.PKCSException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.StringReader;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.MessageDigest;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.SecureRandom;
import java.security.Signature;
import java.security.cert.Certificate;
import java.security.cert.CertificateEncodingException;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Enumeration;
import java.util.HexFormat;
import java.util.List;

/**
 * Loads certificates and keys, and validates certificate paths against caller-supplied trusted roots.
 *
 * Path building starts at the leaf and looks for each issuer first among the remaining supplied
 * certificates, then among the intermediates known to the {@link CertificateStore}, then among
 * the trusted roots. Every hop is checked for name chaining, signature
 * and validity window; the path must end in a trusted root. Broken rules are returned as
 * {@link ChainViolation}s, never thrown.
 */
public class CertificateManager {

    private static final Logger LOG = LoggerFactory.getLogger(CertificateManager.class);

    static final int MAX_PATH_LENGTH = 16;

    public static final String REVOCATION_NOT_CHECKED =
        "Revocation status not checked (no CRL/OCSP source configured)";

    private final Clock clock;
    private final RevocationChecker revocationChecker;
    private final CertificateStore store;
    private final JcaX509CertificateConverter converter;

    public CertificateManager() {
        this(Clock.systemUTC(), null);
    }

    public CertificateManager(Clock clock, RevocationChecker revocationChecker) {
        this(clock, revocationChecker, new CertificateStore());
    }

    /**
     * @param clock             source of "now" for validity windows
     * @param revocationChecker optional; when null revocation is reported as not checked
     * @param store             known certificates; its intermediates complete incomplete chains
     */
    public CertificateManager(Clock clock, RevocationChecker revocationChecker, CertificateStore store) {
        BouncyCastleSupport.ensureProvider();
        this.clock = clock;
        this.revocationChecker = revocationChecker;
        this.store = store;
        this.converter = new JcaX509CertificateConverter().setProvider(BouncyCastleSupport.PROVIDER);
    }

    // ---------------------------------------------------------------- loading

    /**
     * Load every certificate from a PEM bundle, in file order. Non-certificate PEM objects are skipped.
     */
    public List<X509Certificate> loadCertificates(String pem) {
        List<X509Certificate> certificates = new ArrayList<>();
        try (PEMParser parser = new PEMParser(new StringReader(pem))) {
            Object object;
            while ((object = parser.readObject()) != null) {
                if (object instanceof X509CertificateHolder) {
                    certificates.add(converter.getCertificate((X509CertificateHolder) object));
                } else {
                    LOG.debug("Skipping PEM object of type {}", object.getClass().getSimpleName());
                }
            }
        } catch (IOException | CertificateException e) {
            throw new CertificateLoadException("Failed to parse PEM certificates: " + e.getMessage(), e);
        }
        if (certificates.isEmpty()) {
            throw new CertificateLoadException("No certificate found in PEM input");
        }
        return certificates;
    }

    /**
     * Load signing credentials from a PEM certificate (optionally followed by its chain) and a PEM private key.
     *
     * @param password required for encrypted keys, ignored otherwise; may be null
     */
    public SigningCredentials loadFromPem(String certificatePem, String privateKeyPem, char[] password) {
        List<X509Certificate> chain = loadCertificates(certificatePem);
        PrivateKey privateKey = readPrivateKey(privateKeyPem, password);
        X509Certificate certificate = chain.get(0);
        if (!keyMatchesCertificate(privateKey, certificate.getPublicKey())) {
            throw new CertificateLoadException("Private key does not match certificate " + displayName(certificate));
        }
        LOG.info("CERT_LOAD_OK: PEM credentials for {}", displayName(certificate));
        return new SigningCredentials(privateKey, certificate, chain);
    }

    /**
     * Load the first key entry of a PKCS#12 container.
     */
    public SigningCredentials loadFromPkcs12(byte[] pkcs12, char[] password) {
        try {
            KeyStore keyStore = KeyStore.getInstance("PKCS12");
            keyStore.load(new ByteArrayInputStream(pkcs12), password);
            Enumeration<String> aliases = keyStore.aliases();
            while (aliases.hasMoreElements()) {
                String alias = aliases.nextElement();
                if (!keyStore.isKeyEntry(alias)) {
                    continue;
                }
                PrivateKey key = (PrivateKey) keyStore.getKey(alias, password);
                Certificate[] rawChain = keyStore.getCertificateChain(alias);
                if (rawChain == null || rawChain.length == 0) {
                    throw new CertificateLoadException("Key entry '" + alias + "' has no certificate");
                }
                List<X509Certificate> chain = new ArrayList<>();
                for (Certificate cert : rawChain) {
                    chain.add((X509Certificate) cert);
                }
                LOG.info("CERT_LOAD_OK: PKCS#12 entry '{}' for {}", alias, displayName(chain.get(0)));
                return new SigningCredentials(key, chain.get(0), chain);
            }
        } catch (IOException | GeneralSecurityException e) {
            throw new CertificateLoadException("Failed to load PKCS#12: " + e.getMessage(), e);
        }
        throw new CertificateLoadException("PKCS#12 contains no private key entry");
    }

    private PrivateKey readPrivateKey(String pem, char[] password) {
        JcaPEMKeyConverter keyConverter = new JcaPEMKeyConverter().setProvider(BouncyCastleSupport.PROVIDER);
        try (PEMParser parser = new PEMParser(new StringReader(pem))) {
            Object object;
            while ((object = parser.readObject()) != null) {
                if (object instanceof PEMKeyPair) {
                    return keyConverter.getKeyPair((PEMKeyPair) object).getPrivate();
                }
                if (object instanceof PrivateKeyInfo) {
                    return keyConverter.getPrivateKey((PrivateKeyInfo) object);
                }
                if (object instanceof PEMEncryptedKeyPair) {
                    requirePassword(password);
                    PEMKeyPair decrypted = ((PEMEncryptedKeyPair) object).decryptKeyPair(
                        new JcePEMDecryptorProviderBuilder().setProvider(BouncyCastleSupport.PROVIDER).build(password));
                    return keyConverter.getKeyPair(decrypted).getPrivate();
                }
                if (object instanceof PKCS8EncryptedPrivateKeyInfo) {
                    requirePassword(password);
                    PrivateKeyInfo info = ((PKCS8EncryptedPrivateKeyInfo) object).decryptPrivateKeyInfo(
                        new JceOpenSSLPKCS8DecryptorProviderBuilder().setProvider(BouncyCastleSupport.PROVIDER).build(password));
                    return keyConverter.getPrivateKey(info);
                }
            }
        } catch (PEMException | PKCSException e) {
            throw new CertificateLoadException("Failed to decrypt private key (wrong password?): " + e.getMessage(), e);
        } catch (IOException | OperatorCreationException e) {
            throw new CertificateLoadException("Failed to parse private key: " + e.getMessage(), e);
        }
        throw new CertificateLoadException("No private key found in PEM input");
    }

    private static void requirePassword(char[] password) {
        if (password == null || password.length == 0) {
            throw new CertificateLoadException("Private key is encrypted but no password was given");
        }
    }

    private static boolean keyMatchesCertificate(PrivateKey privateKey, PublicKey publicKey) {
        String algorithm = probeAlgorithm(publicKey.getAlgorithm());
        if (algorithm == null) {
            LOG.warn("Cannot check key pairing for key algorithm {}", publicKey.getAlgorithm());
            return true;
        }
        try {
            byte[] probe = new byte[32];
            new SecureRandom().nextBytes(probe);
            Signature signer = Signature.getInstance(algorithm, BouncyCastleSupport.PROVIDER);
            signer.initSign(privateKey);
            signer.update(probe);
            byte[] signature = signer.sign();
            Signature verifier = Signature.getInstance(algorithm, BouncyCastleSupport.PROVIDER);
            verifier.initVerify(publicKey);
            verifier.update(probe);
            return verifier.verify(signature);
        } catch (GeneralSecurityException e) {
            LOG.debug("Key pairing probe failed: {}", e.getMessage());
            return false;
        }
    }

    private static String probeAlgorithm(String keyAlgorithm) {
        switch (keyAlgorithm) {
            case "RSA":
                return "SHA256withRSA";
            case "EC":
            case "ECDSA":
                return "SHA256withECDSA";
            case "DSA":
                return "SHA256withDSA";
            case "Ed25519":
                return "Ed25519";
            case "Ed448":
                return "Ed448";
            default:
                return null;
        }
    }

    public CertificateStore getStore() {
        return store;
    }

    // ---------------------------------------------------------------- info

    public CertificateInfo getCertificateInfo(X509Certificate certificate) {
        return new CertificateInfo(certificate, commonName(certificate), fingerprint(certificate));
    }

    /**
     * SHA-256 over the DER encoding, lower-case hex.
     */
    public static String fingerprint(X509Certificate certificate) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(certificate.getEncoded()));
        } catch (CertificateEncodingException | java.security.NoSuchAlgorithmException e) {
            throw new IllegalStateException("Failed to compute certificate fingerprint", e);
        }
    }

    static String commonName(X509Certificate certificate) {
        X500Name subject = X500Name.getInstance(certificate.getSubjectX500Principal().getEncoded());
        RDN[] rdns = subject.getRDNs(BCStyle.CN);
        if (rdns.length == 0) {
            return null;
        }
        return IETFUtils.valueToString(rdns[0].getFirst().getValue());
    }

    private String displayName(X509Certificate certificate) {
        return getCertificateInfo(certificate).getDisplayName();
    }

    // ---------------------------------------------------------------- validation

    public CertificateValidationResult validateCertificate(X509Certificate certificate,
                                                           Collection<X509Certificate> trustedRoots) {
        if (certificate == null) {
            throw new IllegalArgumentException("Certificate must not be null");
        }
        return validateCertificateChain(Collections.singletonList(certificate), trustedRoots);
    }

    /**
     * Build and check the path from {@code chain.get(0)} to one of {@code trustedRoots}.
     *
     * @param chain        leaf first, then any intermediates in any order
     * @param trustedRoots anchors; the path is trusted only if it ends in one of them
     * @throws IllegalArgumentException if either collection is null or empty
     */
    public CertificateValidationResult validateCertificateChain(List<X509Certificate> chain,
                                                                Collection<X509Certificate> trustedRoots) {
        if (chain == null || chain.isEmpty()) {
            throw new IllegalArgumentException("Certificate chain must not be empty");
        }
        if (trustedRoots == null || trustedRoots.isEmpty()) {
            throw new IllegalArgumentException("Trusted root set must not be empty");
        }

        Instant now = clock.instant();
        List<ChainViolation> violations = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        List<CertificateInfo> path = new ArrayList<>();

        List<X509Certificate> remaining = new ArrayList<>(chain.subList(1, chain.size()));
        List<X509Certificate> known = store.getIntermediates();
        X509Certificate current = chain.get(0);
        CertificateInfo currentInfo = getCertificateInfo(current);
        CertificateInfo leafInfo = currentInfo;
        path.add(currentInfo);

        boolean trusted = false;
        while (true) {
            if (isTrustedRoot(current, trustedRoots)) {
                trusted = true;
                break;
            }
            if (path.size() > MAX_PATH_LENGTH) {
                violations.add(new ChainViolation(ChainRule.PATH_TOO_LONG, currentInfo,
                    "Certificate path exceeds " + MAX_PATH_LENGTH + " certificates"));
                break;
            }

            X509Certificate parent = findIssuer(current, remaining);
            boolean parentIsRoot = false;
            if (parent != null) {
                remaining.remove(parent);
            } else {
                parent = findIssuer(current, known);
                if (parent != null) {
                    known.remove(parent);
                    LOG.debug("Issuer of {} taken from certificate store", currentInfo.getDisplayName());
                } else {
                    parent = findIssuer(current, trustedRoots);
                    parentIsRoot = parent != null;
                }
            }

            if (parent == null) {
                if (remaining.isEmpty()) {
                    violations.add(new ChainViolation(ChainRule.UNTRUSTED_ROOT, currentInfo,
                        "No trusted root found for issuer " + current.getIssuerX500Principal().getName()));
                    break;
                }
                // next supplied certificate does not chain; report and keep walking it
                parent = remaining.remove(0);
                violations.add(new ChainViolation(ChainRule.ISSUER_MISMATCH, currentInfo,
                    "Issuer " + current.getIssuerX500Principal().getName()
                        + " does not match subject " + parent.getSubjectX500Principal().getName()
                        + " of the next certificate"));
            } else {
                verifyHop(current, currentInfo, parent, violations);
            }

            checkRevocation(current, currentInfo, parent, now, violations, warnings);

            current = parent;
            currentInfo = getCertificateInfo(parent);
            path.add(currentInfo);
            if (parentIsRoot) {
                trusted = true;
                break;
            }
        }

        boolean notExpired = true;
        for (CertificateInfo info : path) {
            if (now.isBefore(info.getNotBefore())) {
                notExpired = false;
                violations.add(new ChainViolation(ChainRule.NOT_YET_VALID, info,
                    "Certificate not valid before " + info.getNotBefore()));
            } else if (now.isAfter(info.getNotAfter())) {
                notExpired = false;
                violations.add(new ChainViolation(ChainRule.EXPIRED, info,
                    "Certificate expired at " + info.getNotAfter()));
            }
        }

        if (revocationChecker == null) {
            warnings.add(REVOCATION_NOT_CHECKED);
        }

        List<String> errors = new ArrayList<>();
        boolean chainValid = true;
        for (ChainViolation violation : violations) {
            errors.add(labelFor(violation, path) + ": " + violation.getMessage());
            if (violation.getRule() == ChainRule.ISSUER_MISMATCH
                || violation.getRule() == ChainRule.SIGNATURE_INVALID
                || violation.getRule() == ChainRule.PATH_TOO_LONG) {
                chainValid = false;
            }
        }

        CertificateValidationResult result = new CertificateValidationResult(leafInfo, chainValid, notExpired,
            trusted, revocationChecker != null, path, violations, errors, warnings);
        if (result.isValid()) {
            LOG.debug("CHAIN_OK: {} ({} certificates)", leafInfo.getDisplayName(), path.size());
        } else {
            LOG.info("CHAIN_FAIL: {} {}", leafInfo.getDisplayName(), errors);
        }
        return result;
    }

    private void verifyHop(X509Certificate child, CertificateInfo childInfo, X509Certificate parent,
                           List<ChainViolation> violations) {
        try {
            child.verify(parent.getPublicKey());
        } catch (GeneralSecurityException e) {
            violations.add(new ChainViolation(ChainRule.SIGNATURE_INVALID, childInfo,
                "Signature does not verify with key of " + parent.getSubjectX500Principal().getName()));
        }
    }

    private void checkRevocation(X509Certificate certificate, CertificateInfo info, X509Certificate issuer,
                                 Instant now, List<ChainViolation> violations, List<String> warnings) {
        if (revocationChecker == null) {
            return;
        }
        RevocationStatus status = revocationChecker.check(certificate, issuer, now);
        if (status == RevocationStatus.REVOKED) {
            violations.add(new ChainViolation(ChainRule.REVOKED, info, "Certificate has been revoked"));
        } else if (status == RevocationStatus.UNKNOWN) {
            warnings.add(info.getDisplayName() + ": revocation status unknown");
        }
    }

    private static boolean isTrustedRoot(X509Certificate certificate, Collection<X509Certificate> trustedRoots) {
        for (X509Certificate root : trustedRoots) {
            if (root.equals(certificate)) {
                return true;
            }
        }
        return false;
    }

    private static X509Certificate findIssuer(X509Certificate child, Collection<X509Certificate> candidates) {
        for (X509Certificate candidate : candidates) {
            if (candidate.equals(child)) {
                continue;
            }
            if (candidate.getSubjectX500Principal().equals(child.getIssuerX500Principal())) {
                return candidate;
            }
        }
        return null;
    }

    private static String labelFor(ChainViolation violation, List<CertificateInfo> path) {
        for (CertificateInfo info : path) {
            if (info.getFingerprint().equals(violation.getFingerprint())) {
                return info.getDisplayName();
            }
        }
        return violation.getFingerprint();
    }
}
