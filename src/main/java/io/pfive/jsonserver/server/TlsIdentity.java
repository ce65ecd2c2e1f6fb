// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.jsonserver.server;

import nl.altindag.ssl.SSLFactory;
import nl.altindag.ssl.jetty.util.JettySslUtils;
import nl.altindag.ssl.pem.util.PemUtils;
import org.eclipse.jetty.util.ssl.SslContextFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.X509ExtendedKeyManager;
import java.io.IOException;
import java.lang.invoke.MethodHandles;
import java.nio.file.Files;
import java.nio.file.Path;

/// The certificate chain and private key a TLS listener presents to clients, loaded once from PEM
/// files as created by OpenSSL or shipped by certificate authorities. This avoids the Java
/// keystore system entirely. Clients are not asked for certificates.
///
/// A loaded identity is immutable and may be shared by several listeners. Each listener gets its
/// own Jetty SslContextFactory (a lifecycle component owned by that listener's connector) built
/// from the same underlying SSL context.
public final class TlsIdentity {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private static final String CERTIFICATE_MARKER = "CERTIFICATE-----";
    // Matches PKCS#8 "PRIVATE KEY" as well as PKCS#1 "RSA PRIVATE KEY" and "EC PRIVATE KEY".
    private static final String PRIVATE_KEY_MARKER = "PRIVATE KEY-----";

    private final Path certificatePath;
    private final Path keyPath;
    private final SSLFactory sslFactory;

    private TlsIdentity (Path certificatePath, Path keyPath, SSLFactory sslFactory) {
        this.certificatePath = certificatePath;
        this.keyPath = keyPath;
        this.sslFactory = sslFactory;
    }

    /// @throws TlsIdentityException if either file is missing or unreadable, the key file holds no
    /// private key, or the PEM content cannot be parsed.
    public static TlsIdentity load (Path certificatePath, Path keyPath) {
        String certificatePem = readPem(certificatePath, "Certificate");
        String keyPem = readPem(keyPath, "Private key");
        if (!certificatePem.contains(CERTIFICATE_MARKER)) {
            throw new TlsIdentityException("No certificate found in " + certificatePath);
        }
        if (!keyPem.contains(PRIVATE_KEY_MARKER)) {
            throw new TlsIdentityException("No private key found in " + keyPath);
        }
        try {
            X509ExtendedKeyManager keyManager = PemUtils.loadIdentityMaterial(certificatePath, keyPath);
            SSLFactory sslFactory = SSLFactory.builder()
                .withIdentityMaterial(keyManager)
                .withDefaultTrustMaterial()
                .build();
            LOG.info("Loaded TLS identity from {} and {}", certificatePath, keyPath);
            return new TlsIdentity(certificatePath, keyPath, sslFactory);
        } catch (RuntimeException e) {
            throw new TlsIdentityException(String.format("Failed to load TLS identity from %s and %s: %s",
                certificatePath, keyPath, e.getMessage()), e);
        }
    }

    private static String readPem (Path path, String what) {
        if (!Files.isRegularFile(path) || !Files.isReadable(path)) {
            throw new TlsIdentityException(what + " file not found or not readable: " + path);
        }
        try {
            return Files.readString(path);
        } catch (IOException e) {
            throw new TlsIdentityException(what + " file could not be read: " + path, e);
        }
    }

    /// A new Jetty server-side TLS context for one connector.
    SslContextFactory.Server newServerContextFactory () {
        SslContextFactory.Server factory = JettySslUtils.forServer(sslFactory);
        factory.setNeedClientAuth(false);
        factory.setWantClientAuth(false);
        return factory;
    }

    public Path certificatePath () {
        return certificatePath;
    }

    public Path keyPath () {
        return keyPath;
    }

    @Override
    public String toString () {
        return "TlsIdentity<%s, %s>".formatted(certificatePath, keyPath);
    }

}
