// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.jsonserver.websocket;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/// How strictly an incoming frame must match `{"method": "...", "params": {...}}`. This is a
/// per-listener configuration choice and applies to every frame on every connection.
public enum EnvelopePolicy {

    /// Both fields are required and the method must be a string. Anything else is answered with an
    /// invalid-format error and never reaches the dispatcher.
    STRICT,

    /// Missing params default to an empty object. A missing or non-string method becomes the
    /// empty name, which no registry contains, so the dispatcher answers with an unknown-method
    /// error.
    LENIENT;

    static final String EMPTY_PARAMS = "{}";
    static final String NO_METHOD = "";

    /// @return the envelope, or empty if the message does not satisfy this policy.
    public Optional<Envelope> extract (JsonNode message) {
        JsonNode method = message.get("method");
        JsonNode params = message.get("params");
        if (this == STRICT) {
            if (method == null || !method.isTextual() || params == null) {
                return Optional.empty();
            }
            return Optional.of(new Envelope(method.textValue(), params.toString()));
        }
        String methodName = (method != null && method.isTextual()) ? method.textValue() : NO_METHOD;
        String paramsJson = params != null ? params.toString() : EMPTY_PARAMS;
        return Optional.of(new Envelope(methodName, paramsJson));
    }

}
