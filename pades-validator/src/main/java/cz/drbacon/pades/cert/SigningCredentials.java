package cz.drbacon.pades.cert;

import java.security.PrivateKey;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Private key with its certificate and the chain that came with it (signer first).
 */
public final class SigningCredentials {

    private final PrivateKey privateKey;
    private final X509Certificate certificate;
    private final List<X509Certificate> certificateChain;

    public SigningCredentials(PrivateKey privateKey, X509Certificate certificate, List<X509Certificate> certificateChain) {
        this.privateKey = Objects.requireNonNull(privateKey, "privateKey");
        this.certificate = Objects.requireNonNull(certificate, "certificate");
        List<X509Certificate> chain = new ArrayList<>();
        chain.add(certificate);
        for (X509Certificate cert : certificateChain) {
            if (!cert.equals(certificate)) {
                chain.add(cert);
            }
        }
        this.certificateChain = Collections.unmodifiableList(chain);
    }

    public PrivateKey getPrivateKey() {
        return privateKey;
    }

    public X509Certificate getCertificate() {
        return certificate;
    }

    public List<X509Certificate> getCertificateChain() {
        return certificateChain;
    }
}
