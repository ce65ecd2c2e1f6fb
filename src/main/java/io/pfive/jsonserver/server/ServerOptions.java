// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.jsonserver.server;

import io.pfive.jsonserver.Configuration;
import io.pfive.jsonserver.websocket.EnvelopePolicy;

import java.time.Duration;

/// Everything needed to start one listener besides the actor itself.
///
/// @param port TCP port on all interfaces, or 0 to let the operating system choose one.
/// @param tls the identity to present, or null to serve plain text.
/// @param envelopePolicy how strictly WebSocket frames are checked; ignored for HTTP.
/// @param idleTimeout how long a WebSocket connection may sit idle before it is closed.
/// @param sniHostCheck whether HTTPS requests must name a host matching the certificate.
public record ServerOptions (
    int port,
    Transport transport,
    TlsIdentity tls,
    EnvelopePolicy envelopePolicy,
    Duration idleTimeout,
    boolean sniHostCheck
) {

    /// Jetty's own default, made explicit so it shows up in logs and configuration.
    public static final Duration DEFAULT_IDLE_TIMEOUT = Duration.ofSeconds(30);

    public ServerOptions {
        if (port < 0 || port > 0xFFFF) {
            throw new IllegalArgumentException("Port must be between 0 and 65535, found " + port);
        }
        if (transport == null) throw new IllegalArgumentException("Transport must be specified.");
        if (envelopePolicy == null) envelopePolicy = EnvelopePolicy.STRICT;
        if (idleTimeout == null) idleTimeout = DEFAULT_IDLE_TIMEOUT;
        if (idleTimeout.isNegative() || idleTimeout.isZero()) {
            throw new IllegalArgumentException("Idle timeout must be positive, found " + idleTimeout);
        }
    }

    public static ServerOptions http (int port) {
        return new ServerOptions(port, Transport.HTTP, null, EnvelopePolicy.STRICT, DEFAULT_IDLE_TIMEOUT, false);
    }

    public static ServerOptions websocket (int port) {
        return new ServerOptions(port, Transport.WEBSOCKET, null, EnvelopePolicy.STRICT, DEFAULT_IDLE_TIMEOUT, false);
    }

    public ServerOptions withTls (TlsIdentity tls) {
        return new ServerOptions(port, transport, tls, envelopePolicy, idleTimeout, sniHostCheck);
    }

    public ServerOptions withEnvelopePolicy (EnvelopePolicy envelopePolicy) {
        return new ServerOptions(port, transport, tls, envelopePolicy, idleTimeout, sniHostCheck);
    }

    public ServerOptions withIdleTimeout (Duration idleTimeout) {
        return new ServerOptions(port, transport, tls, envelopePolicy, idleTimeout, sniHostCheck);
    }

    public ServerOptions withSniHostCheck (boolean sniHostCheck) {
        return new ServerOptions(port, transport, tls, envelopePolicy, idleTimeout, sniHostCheck);
    }

    public boolean secure () {
        return tls != null;
    }

    public String scheme () {
        return transport.scheme(secure());
    }

    /// Reads the listener settings, loading the TLS identity when it is enabled.
    /// @throws TlsIdentityException if TLS is enabled and its files cannot be loaded.
    public static ServerOptions fromConfiguration (Configuration config) {
        Transport transport = config.enumVal(Configuration.TRANSPORT, Transport.class, Transport.HTTP);
        TlsIdentity tls = null;
        if (config.boolVal(Configuration.TLS_ENABLED, false)) {
            tls = TlsIdentity.load(config.pathVal(Configuration.TLS_CERT_FILE), config.pathVal(Configuration.TLS_KEY_FILE));
        }
        EnvelopePolicy envelopePolicy = config.enumVal(Configuration.WEBSOCKET_ENVELOPE, EnvelopePolicy.class,
            EnvelopePolicy.STRICT);
        int idleSeconds = config.intVal(Configuration.WEBSOCKET_IDLE_TIMEOUT_SECONDS,
            (int) DEFAULT_IDLE_TIMEOUT.toSeconds());
        return new ServerOptions(config.intVal(Configuration.PORT), transport, tls, envelopePolicy,
            Duration.ofSeconds(idleSeconds), config.boolVal(Configuration.ENABLE_SNI, false));
    }

}
