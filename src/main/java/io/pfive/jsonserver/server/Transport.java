// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.jsonserver.server;

/// The two ways of reaching an actor. One listener serves exactly one of them.
public enum Transport {

    /// One call per `POST /<method>` request.
    HTTP("http", "https"),

    /// Many calls over one upgraded connection, each frame carrying `{"method", "params"}`.
    WEBSOCKET("ws", "wss");

    public final String plainScheme;
    public final String secureScheme;

    Transport (String plainScheme, String secureScheme) {
        this.plainScheme = plainScheme;
        this.secureScheme = secureScheme;
    }

    public String scheme (boolean secure) {
        return secure ? secureScheme : plainScheme;
    }

}
