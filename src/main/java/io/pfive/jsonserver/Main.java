// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.jsonserver;

import io.pfive.jsonserver.dispatch.ActorDocumentation;
import io.pfive.jsonserver.example.Calculator;
import io.pfive.jsonserver.server.ActorServer;
import io.pfive.jsonserver.server.ServerOptions;
import io.pfive.jsonserver.server.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.nio.file.Path;

/// Serves a [Calculator] on the single listener described by a configuration file.
///
/// Usage: `Main [--docs] [config-file]`. The configuration file defaults to conf/conf.properties.
/// With --docs, prints the Markdown reference for the calculator's methods instead of serving.
/// Any failure to start the listener (bad configuration, unreadable TLS files, port in use) is
/// logged and ends the process with status 1.
public class Main {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    public static void main (String[] args) throws InterruptedException {
        boolean docs = false;
        Path configPath = Configuration.DEFAULT_PATH;
        for (String arg : args) {
            if (arg.equals("--docs")) docs = true;
            else configPath = Path.of(arg);
        }
        ActorServer server;
        try {
            ServerOptions options = ServerOptions.fromConfiguration(Configuration.load(configPath));
            if (docs) {
                String baseUrl = Transport.HTTP.scheme(options.secure()) + "://localhost:" + options.port();
                System.out.println(ActorDocumentation.markdown(Calculator.REGISTRY, baseUrl));
                return;
            }
            server = ActorServer.start(Calculator.REGISTRY, Calculator::new, options);
        } catch (RuntimeException e) {
            LOG.error("Failed to start: {}", e.getMessage(), e);
            System.exit(1);
            return;
        }
        Runtime.getRuntime().addShutdownHook(new Thread(server::close, "shutdown"));
        server.join();
    }

}
