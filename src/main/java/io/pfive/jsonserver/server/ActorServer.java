// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.jsonserver.server;

import io.pfive.jsonserver.dispatch.Dispatcher;
import io.pfive.jsonserver.dispatch.MethodRegistry;
import io.pfive.jsonserver.http.handler.CorsHandler;
import io.pfive.jsonserver.http.handler.DispatchHandler;
import io.pfive.jsonserver.http.handler.ExceptionHandler;
import io.pfive.jsonserver.websocket.DispatchEndpoint;
import org.eclipse.jetty.http.UriCompliance;
import org.eclipse.jetty.server.Handler;
import org.eclipse.jetty.server.HttpConfiguration;
import org.eclipse.jetty.server.HttpConnectionFactory;
import org.eclipse.jetty.server.SecureRequestCustomizer;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.server.SslConnectionFactory;
import org.eclipse.jetty.server.handler.ContextHandler;
import org.eclipse.jetty.util.thread.QueuedThreadPool;
import org.eclipse.jetty.websocket.server.WebSocketUpgradeHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.net.URI;
import java.util.function.Supplier;

/// A running listener exposing one actor over one transport, optionally behind TLS. Starting it
/// binds the port and returns once connections are being accepted; each connection is then served
/// on Jetty's thread pool until [#close()] stops everything.
///
/// ```java
/// try (ActorServer server = ActorServer.http(ActorHandle.create(Calculator.REGISTRY, Calculator::new), 8080)) {
///     server.join();
/// }
/// ```
public class ActorServer implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private final Server server;
    private final ServerConnector connector;
    private final ServerOptions options;
    private final String actorName;

    private ActorServer (Server server, ServerConnector connector, ServerOptions options, String actorName) {
        this.server = server;
        this.connector = connector;
        this.options = options;
        this.actorName = actorName;
    }

    /// Take the actor out of the handle and serve it until closed.
    /// @throws IllegalStateException if the handle has already been served.
    /// @throws ListenerBindException if the listener cannot be started.
    public static <A> ActorServer start (ActorHandle<A> handle, ServerOptions options) {
        Dispatcher<A> dispatcher = handle.transfer();
        String actorName = handle.registry().actorType().getSimpleName();

        QueuedThreadPool threadPool = new QueuedThreadPool();
        threadPool.setName("actor-server");
        Server server = new Server(threadPool);

        HttpConfiguration httpConf = new HttpConfiguration();
        httpConf.setSendServerVersion(false);
        // Allow "//add": empty leading segments are stripped off the method name rather than rejected.
        httpConf.setUriCompliance(UriCompliance.DEFAULT.with("actor-server",
            UriCompliance.Violation.AMBIGUOUS_EMPTY_SEGMENT));
        HttpConnectionFactory http1 = new HttpConnectionFactory(httpConf);
        ServerConnector connector;
        if (options.secure()) {
            SecureRequestCustomizer secureRequestCustomizer = new SecureRequestCustomizer();
            // Allow plain IP addresses and names the certificate does not list, unless configured.
            secureRequestCustomizer.setSniHostCheck(options.sniHostCheck());
            httpConf.addCustomizer(secureRequestCustomizer);
            SslConnectionFactory tls = new SslConnectionFactory(options.tls().newServerContextFactory(),
                http1.getProtocol());
            connector = new ServerConnector(server, tls, http1);
        } else {
            connector = new ServerConnector(server, http1);
        }
        connector.setPort(options.port());
        server.addConnector(connector);
        server.setHandler(switch (options.transport()) {
            case HTTP -> httpHandler(dispatcher);
            case WEBSOCKET -> webSocketHandler(server, dispatcher, options);
        });

        try {
            server.start();
        } catch (Exception e) {
            LOG.error("Could not start {} listener on port {}: {}", options.scheme(), options.port(), e.toString());
            try {
                server.stop();
            } catch (Exception stopException) {
                e.addSuppressed(stopException);
            }
            throw new ListenerBindException(String.format("Failed to start %s listener on port %d: %s",
                options.scheme(), options.port(), e.getMessage()), e);
        }
        ActorServer actorServer = new ActorServer(server, connector, options, actorName);
        LOG.info("Serving actor {} at {}", actorName, actorServer.uri());
        return actorServer;
    }

    /// Create the actor inside a fresh handle and serve it immediately.
    public static <A> ActorServer start (MethodRegistry<A> registry, Supplier<? extends A> factory,
                                         ServerOptions options) {
        return start(ActorHandle.create(registry, factory), options);
    }

    public static <A> ActorServer http (ActorHandle<A> handle, int port) {
        return start(handle, ServerOptions.http(port));
    }

    public static <A> ActorServer websocket (ActorHandle<A> handle, int port) {
        return start(handle, ServerOptions.websocket(port));
    }

    public static <A> ActorServer https (ActorHandle<A> handle, int port, TlsIdentity tls) {
        return start(handle, ServerOptions.http(port).withTls(tls));
    }

    public static <A> ActorServer wss (ActorHandle<A> handle, int port, TlsIdentity tls) {
        return start(handle, ServerOptions.websocket(port).withTls(tls));
    }

    /// Error handling wraps CORS so even error responses carry the CORS headers.
    private static Handler httpHandler (Dispatcher<?> dispatcher) {
        return new ExceptionHandler(new CorsHandler(new DispatchHandler(dispatcher)));
    }

    /// Accept the upgrade on any path. Each connection gets its own endpoint but all of them share
    /// the dispatcher, and thus the actor.
    private static Handler webSocketHandler (Server server, Dispatcher<?> dispatcher, ServerOptions options) {
        ContextHandler context = new ContextHandler("/");
        WebSocketUpgradeHandler upgradeHandler = WebSocketUpgradeHandler.from(server, context, container -> {
            container.setIdleTimeout(options.idleTimeout());
            container.addMapping("/*", (upgradeRequest, upgradeResponse, callback) ->
                new DispatchEndpoint(dispatcher, options.envelopePolicy()));
        });
        context.setHandler(upgradeHandler);
        return context;
    }

    /// The bound port, which differs from the requested one when that was 0.
    public int port () {
        return connector.getLocalPort();
    }

    public ServerOptions options () {
        return options;
    }

    /// Where clients on this machine can reach the server.
    public URI uri () {
        return URI.create(options.scheme() + "://localhost:" + port());
    }

    public boolean isRunning () {
        return server.isRunning();
    }

    /// Block the calling thread until the server stops.
    public void join () throws InterruptedException {
        server.join();
    }

    /// Stop accepting connections, close open ones, and release the port and threads.
    @Override
    public void close () {
        if (server.isStopped()) return;
        int boundPort = port();
        try {
            server.stop();
            LOG.info("Stopped serving actor {} on port {}", actorName, boundPort);
        } catch (Exception e) {
            throw new RuntimeException("Failed to stop server for actor " + actorName, e);
        }
    }

}
