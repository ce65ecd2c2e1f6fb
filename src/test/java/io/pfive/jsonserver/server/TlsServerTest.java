// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.jsonserver.server;

import io.pfive.jsonserver.example.Calculator;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class TlsServerTest {

    private static TlsIdentity identity;

    @BeforeAll
    static void loadIdentity () {
        identity = TlsIdentity.load(TlsFixtures.certificate(), TlsFixtures.privateKey());
    }

    private static HttpResponse<String> post (HttpClient client, URI uri, String json) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(uri)
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(json))
            .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void httpsEndToEnd () throws Exception {
        ActorHandle<Calculator> handle = ActorHandle.create(Calculator.REGISTRY, Calculator::new);
        try (ActorServer server = ActorServer.https(handle, 0, identity)) {
            assertThat(server.uri().getScheme()).isEqualTo("https");
            HttpResponse<String> response = post(TlsFixtures.trustingClient(), server.uri().resolve("/divide"),
                "{\"a\": 20, \"b\": 4}");
            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.body()).isEqualTo("{\"Ok\":5.0}");
        }
    }

    @Test
    void ipAddressIsAcceptedWithoutSniCheck () throws Exception {
        ActorHandle<Calculator> handle = ActorHandle.create(Calculator.REGISTRY, Calculator::new);
        try (ActorServer server = ActorServer.https(handle, 0, identity)) {
            URI byAddress = URI.create("https://127.0.0.1:" + server.port() + "/info");
            assertThat(post(TlsFixtures.trustingClient(), byAddress, "{}").body())
                .isEqualTo("\"Simple JSON Calculator v1.0\"");
        }
    }

    @Test
    void wssEndToEnd () throws Exception {
        ActorHandle<Calculator> handle = ActorHandle.create(Calculator.REGISTRY, Calculator::new);
        try (ActorServer server = ActorServer.wss(handle, 0, identity)) {
            assertThat(server.uri().getScheme()).isEqualTo("wss");
            WebSocketTestClient client = WebSocketTestClient.connect(TlsFixtures.trustingClient(), server.uri());
            assertThat(client.call("{\"method\": \"multiply\", \"params\": {\"a\": 6, \"b\": 7}}")).isEqualTo("42.0");
            assertThat(client.call("{\"method\": \"get_memory\", \"params\": {}}")).isEqualTo("42.0");
            client.close();
        }
    }

    @Test
    void plainTextClientDoesNotDisturbListener () throws Exception {
        ActorHandle<Calculator> handle = ActorHandle.create(Calculator.REGISTRY, Calculator::new);
        try (ActorServer server = ActorServer.https(handle, 0, identity)) {
            try (Socket socket = new Socket()) {
                socket.connect(new InetSocketAddress("localhost", server.port()), 5000);
                socket.setSoTimeout(5000);
                OutputStream out = socket.getOutputStream();
                out.write("POST /info HTTP/1.1\r\nHost: localhost\r\nContent-Length: 2\r\n\r\n{}"
                    .getBytes(StandardCharsets.US_ASCII));
                out.flush();
                InputStream in = socket.getInputStream();
                try {
                    // Drain whatever the server sends until it closes the connection.
                    while (in.read() >= 0) { }
                } catch (IOException e) {
                    // Reset or silence is as acceptable as an orderly close.
                }
            }
            HttpResponse<String> response = post(TlsFixtures.trustingClient(), server.uri().resolve("/info"), "{}");
            assertThat(response.body()).isEqualTo("\"Simple JSON Calculator v1.0\"");
        }
    }

    @Test
    void identityIsSharedByListeners () throws Exception {
        try (ActorServer first = ActorServer.https(ActorHandle.create(Calculator.REGISTRY, Calculator::new), 0, identity);
             ActorServer second = ActorServer.https(ActorHandle.create(Calculator.REGISTRY, Calculator::new), 0, identity)) {
            HttpClient client = TlsFixtures.trustingClient();
            assertThat(post(client, first.uri().resolve("/add"), "{\"a\": 1, \"b\": 1}").body()).isEqualTo("2.0");
            assertThat(post(client, second.uri().resolve("/add"), "{\"a\": 2, \"b\": 2}").body()).isEqualTo("4.0");
        }
    }

}
