// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.jsonserver.server;

/// The certificate or private key of a TLS listener could not be loaded. This is detected once at
/// startup and is fatal to the listener: no connection is ever accepted with a broken identity.
public class TlsIdentityException extends RuntimeException {
    public TlsIdentityException (String message) {
        super(message);
    }
    public TlsIdentityException (String message, Throwable cause) {
        super(message, cause);
    }
}
