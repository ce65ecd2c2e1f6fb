// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.jsonserver.dispatch;

/// The JSON parameters of a call do not fit the shape declared by the method. The message is sent
/// back to the client, so it should describe the mismatch without any Java stack detail.
public class ParameterDecodingException extends RuntimeException {
    public ParameterDecodingException (String message) {
        super(message);
    }
}
