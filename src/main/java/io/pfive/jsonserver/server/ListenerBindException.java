// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.jsonserver.server;

/// A listener could not be started, most often because the port is already in use. This points to
/// a misconfiguration the caller must fix, so it is not retried.
public class ListenerBindException extends RuntimeException {
    public ListenerBindException (String message, Throwable cause) {
        super(message, cause);
    }
}
