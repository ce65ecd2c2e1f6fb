// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.jsonserver;

import io.pfive.jsonserver.server.ServerOptions;
import io.pfive.jsonserver.server.TlsIdentityException;
import io.pfive.jsonserver.server.Transport;
import io.pfive.jsonserver.websocket.EnvelopePolicy;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigurationTest {

    private static Configuration config (String... keyValues) {
        Properties properties = new Properties();
        for (int i = 0; i < keyValues.length; i += 2) {
            properties.setProperty(keyValues[i], keyValues[i + 1]);
        }
        return new Configuration(properties);
    }

    @Test
    void typedValues () {
        Configuration config = config("port", "8080", "tls-enabled", "yes", "transport", "WebSocket");
        assertThat(config.intVal("port")).isEqualTo(8080);
        assertThat(config.boolVal("tls-enabled")).isTrue();
        assertThat(config.enumVal("transport", Transport.class, Transport.HTTP)).isEqualTo(Transport.WEBSOCKET);
        assertThat(config.boolVal("enable-sni", false)).isFalse();
    }

    @Test
    void malformedValuesNameTheKey () {
        assertThatThrownBy(() -> config("port", "eighty").intVal("port")).hasMessageContaining("'port'");
        assertThatThrownBy(() -> config("tls-enabled", "maybe").boolVal("tls-enabled")).hasMessageContaining("true/false");
        assertThatThrownBy(() -> config("transport", "smoke").enumVal("transport", Transport.class, Transport.HTTP))
            .hasMessageContaining("[http, websocket]");
        assertThatThrownBy(() -> config().intVal("port")).hasMessage("Missing configuration key: port");
        assertThatThrownBy(() -> config("prot", "80")).hasMessage("Unknown configuration key: prot");
    }

    @Test
    void serverOptionsFromMinimalConfiguration () {
        ServerOptions options = ServerOptions.fromConfiguration(config("port", "9000"));
        assertThat(options.port()).isEqualTo(9000);
        assertThat(options.transport()).isEqualTo(Transport.HTTP);
        assertThat(options.secure()).isFalse();
        assertThat(options.envelopePolicy()).isEqualTo(EnvelopePolicy.STRICT);
        assertThat(options.idleTimeout()).isEqualTo(ServerOptions.DEFAULT_IDLE_TIMEOUT);
    }

    @Test
    void serverOptionsFromFullConfiguration () {
        ServerOptions options = ServerOptions.fromConfiguration(config(
            "transport", "websocket",
            "port", "0",
            "websocket-envelope", "lenient",
            "websocket-idle-timeout-seconds", "90",
            "enable-sni", "true"));
        assertThat(options.scheme()).isEqualTo("ws");
        assertThat(options.envelopePolicy()).isEqualTo(EnvelopePolicy.LENIENT);
        assertThat(options.idleTimeout()).isEqualTo(Duration.ofSeconds(90));
        assertThat(options.sniHostCheck()).isTrue();
    }

    @Test
    void tlsFilesAreLoadedWhenEnabled () {
        Configuration missingFiles = config("port", "0", "tls-enabled", "true",
            "tls-cert-file", "no/such/cert.pem", "tls-key-file", "no/such/key.pem");
        assertThatThrownBy(() -> ServerOptions.fromConfiguration(missingFiles))
            .isInstanceOf(TlsIdentityException.class);
    }

    @Test
    void loadsPropertiesFile (@TempDir Path dir) throws Exception {
        Path file = Files.writeString(dir.resolve("conf.properties"), "# comment\ntransport=http\nport=1234\n");
        assertThat(Configuration.load(file).intVal("port")).isEqualTo(1234);
        assertThatThrownBy(() -> Configuration.load(dir.resolve("absent.properties")))
            .hasMessageContaining("Cannot read configuration file");
    }

}
