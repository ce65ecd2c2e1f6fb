// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.jsonserver.websocket;

/// The method name and parameter JSON carried by one WebSocket text frame. Over HTTP the same two
/// pieces travel as the request path and body.
public record Envelope (String method, String paramsJson) { }
