package cz.drbacon.pades;

import org.bouncycastle.jce.provider.BouncyCastleProvider;

import java.security.Security;

/**
 * Registers the BouncyCastle JCA provider once per JVM.
 */
public final class BouncyCastleSupport {

    public static final String PROVIDER = BouncyCastleProvider.PROVIDER_NAME;

    private BouncyCastleSupport() {
    }

    public static synchronized void ensureProvider() {
        if (Security.getProvider(PROVIDER) == null) {
            Security.addProvider(new BouncyCastleProvider());
        }
    }
}
