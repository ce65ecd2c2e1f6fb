// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.jsonserver.http.exception;

/// Superclass for all exceptions representing problems with an HTTP request that are detected
/// before it reaches the dispatcher, and which translate directly into an HTTP status code and a
/// plain-text message. Throwing them avoids calling Jetty response helpers at every place we
/// bail out of a handler; they are all caught in one wrapping ExceptionHandler.
///
/// Nothing the dispatcher reports becomes one of these. An unknown method or unparseable JSON is
/// an ordinary 200 response carrying an error string.
public abstract class HttpServerException extends RuntimeException {
    public HttpServerException (String message) {
        super(message);
    }
    public abstract ErrorType errorType ();
    public enum ErrorType {
        REQUEST(400),
        // INTERNAL_SERVER(500), // Internal server errors should always be unexpected, so not created intentionally.
        METHOD(405);
        public final int httpCode;
        ErrorType (int httpCode) {
            this.httpCode = httpCode;
        }
    }
}
