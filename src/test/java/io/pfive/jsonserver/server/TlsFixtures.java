// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.jsonserver.server;

import nl.altindag.ssl.SSLFactory;
import nl.altindag.ssl.pem.util.PemUtils;

import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.nio.file.Path;

/// The self-signed certificate for localhost and 127.0.0.1 under src/test/resources/tls.
abstract class TlsFixtures {

    static Path resource (String name) {
        try {
            return Path.of(TlsFixtures.class.getResource("/tls/" + name).toURI());
        } catch (URISyntaxException e) {
            throw new RuntimeException(e);
        }
    }

    static Path certificate () {
        return resource("cert.pem");
    }

    static Path privateKey () {
        return resource("key.pem");
    }

    /// An HTTP/1.1 client that trusts only the test certificate.
    static HttpClient trustingClient () {
        SSLFactory sslFactory = SSLFactory.builder()
            .withTrustMaterial(PemUtils.loadTrustMaterial(certificate()))
            .build();
        return HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .sslContext(sslFactory.getSslContext())
            .build();
    }

}
