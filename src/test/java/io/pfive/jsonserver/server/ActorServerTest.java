// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.jsonserver.server;

import io.pfive.jsonserver.example.Calculator;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ActorServerTest {

    @Test
    void ephemeralPortIsReported () {
        try (ActorServer server = ActorServer.start(Calculator.REGISTRY, Calculator::new, ServerOptions.http(0))) {
            assertThat(server.port()).isPositive();
            assertThat(server.uri()).isEqualTo(URI.create("http://localhost:" + server.port()));
            assertThat(server.isRunning()).isTrue();
        }
    }

    @Test
    void closeReleasesThePort () throws Exception {
        ActorServer first = ActorServer.start(Calculator.REGISTRY, Calculator::new, ServerOptions.http(0));
        int port = first.port();
        first.close();
        assertThat(first.isRunning()).isFalse();
        // Closing twice is harmless.
        first.close();

        try (ActorServer second = ActorServer.start(Calculator.REGISTRY, Calculator::new, ServerOptions.http(port))) {
            HttpResponse<String> response = HttpClient.newHttpClient().send(
                HttpRequest.newBuilder(second.uri().resolve("/info"))
                    .timeout(Duration.ofSeconds(10))
                    .POST(HttpRequest.BodyPublishers.ofString("{}"))
                    .build(),
                HttpResponse.BodyHandlers.ofString());
            assertThat(response.body()).isEqualTo("\"Simple JSON Calculator v1.0\"");
        }
    }

    @Test
    void portInUseFailsToStart () {
        try (ActorServer server = ActorServer.start(Calculator.REGISTRY, Calculator::new, ServerOptions.http(0))) {
            assertThatThrownBy(() -> ActorServer.start(Calculator.REGISTRY, Calculator::new,
                    ServerOptions.websocket(server.port())))
                .isInstanceOf(ListenerBindException.class)
                .hasMessageContaining("port " + server.port());
            assertThat(server.isRunning()).isTrue();
        }
    }

    @Test
    void optionsAreValidated () {
        assertThatThrownBy(() -> ServerOptions.http(70000)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ServerOptions.http(0).withIdleTimeout(Duration.ZERO))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(ServerOptions.websocket(0).scheme()).isEqualTo("ws");
    }

}
