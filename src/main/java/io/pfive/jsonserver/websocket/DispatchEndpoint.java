// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.jsonserver.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.pfive.jsonserver.dispatch.Dispatcher;
import io.pfive.jsonserver.util.JsonUtil;
import org.eclipse.jetty.websocket.api.Callback;
import org.eclipse.jetty.websocket.api.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.nio.ByteBuffer;
import java.util.Optional;

/// The server side of one WebSocket connection. Every text frame is one call: it is unwrapped
/// according to the [EnvelopePolicy], dispatched, and the dispatcher's output is sent back as a
/// single text frame.
///
/// Jetty delivers the next frame only after onWebSocketText returns (auto-demand), and dispatch
/// completes before it returns, so replies always go out in the order the calls arrived. Binary
/// frames are acknowledged and dropped; ping and pong are handled by Jetty itself.
public class DispatchEndpoint implements Session.Listener.AutoDemanding {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    public static final String INVALID_FORMAT_MESSAGE =
        "Invalid message format. Expected {\"method\": \"method_name\", \"params\": {...}}";
    public static final String PARSE_ERROR_PREFIX = "JSON parse error: ";

    private final Dispatcher<?> dispatcher;
    private final EnvelopePolicy policy;
    // Read from whichever thread completes a send.
    private volatile Session session;

    public DispatchEndpoint (Dispatcher<?> dispatcher, EnvelopePolicy policy) {
        this.dispatcher = dispatcher;
        this.policy = policy;
    }

    @Override
    public void onWebSocketOpen (Session session) {
        this.session = session;
        LOG.debug("WebSocket session opened from {}", session.getRemoteSocketAddress());
    }

    @Override
    public void onWebSocketText (String message) {
        String reply = reply(message);
        session.sendText(reply, Callback.from(() -> { }, this::sendFailed));
    }

    @Override
    public void onWebSocketBinary (ByteBuffer payload, Callback callback) {
        // Calls must be text frames. Release the buffer and carry on.
        callback.succeed();
    }

    @Override
    public void onWebSocketClose (int statusCode, String reason) {
        LOG.debug("WebSocket session closed with status {} {}", statusCode, reason);
        this.session = null;
    }

    @Override
    public void onWebSocketError (Throwable cause) {
        // Jetty closes the session after reporting the error, other sessions are unaffected.
        LOG.warn("WebSocket connection error: {}", cause.toString());
    }

    private void sendFailed (Throwable cause) {
        LOG.warn("Failed to send WebSocket response: {}", cause.toString());
        Session current = this.session;
        if (current != null) {
            current.close();
        }
    }

    /// Compute the reply frame for one incoming text frame. Never throws.
    public String reply (String message) {
        JsonNode json;
        try {
            json = JsonUtil.objectMapper.readTree(message);
        } catch (JsonProcessingException e) {
            return JsonUtil.errorObject(PARSE_ERROR_PREFIX + JsonUtil.briefMessage(e));
        }
        if (json == null || json.isMissingNode()) {
            return JsonUtil.errorObject(PARSE_ERROR_PREFIX + "EOF while parsing a value");
        }
        Optional<Envelope> envelope = policy.extract(json);
        if (envelope.isEmpty()) {
            return JsonUtil.errorObject(INVALID_FORMAT_MESSAGE);
        }
        return dispatcher.dispatch(envelope.get().method(), envelope.get().paramsJson());
    }

}
