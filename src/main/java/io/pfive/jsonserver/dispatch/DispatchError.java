// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.jsonserver.dispatch;

import io.pfive.jsonserver.util.JsonUtil;

/// The application-level failures of a dispatch. None of these are exceptions or transport errors:
/// each is turned into a JSON string literal and returned as the response body or frame, so
/// clients can rely on the message prefixes below.
public enum DispatchError {

    MALFORMED_JSON("Failed to parse JSON: %2$s"),
    UNKNOWN_METHOD("Unknown method: %1$s"),
    BAD_PARAMETERS("Failed to deserialize parameters for %1$s: %2$s"),
    INVOCATION_FAILED("Method %1$s failed: %2$s"),
    RESULT_NOT_SERIALIZABLE("Failed to serialize result for %1$s: %2$s");

    private final String format;

    DispatchError (String format) {
        this.format = format;
    }

    /// The human-readable message, given the method name and the reason for failure.
    public String message (String methodName, String reason) {
        return String.format(format, methodName, reason);
    }

    /// The message as JSON text, ready to be sent.
    public String encode (String methodName, String reason) {
        return JsonUtil.jsonString(message(methodName, reason));
    }

}
