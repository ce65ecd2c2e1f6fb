// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.jsonserver.util;

/// Thrown when someone calls get() on an Err instead of an Ok variant of Ret. Actor code calling
/// other actor code can use this to turn an expected failure into an exception, which the
/// dispatcher then reports as a failed invocation.
public class MissingReturnValueException extends RuntimeException {
    public MissingReturnValueException (String message) {
        super(message);
    }
}
