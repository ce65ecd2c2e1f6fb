// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.jsonserver.http.exception;

/// Any HTTP verb other than POST (calls) and OPTIONS (CORS preflight). Clients match on the exact
/// response body, so the message is fixed.
public class MethodNotAllowedException extends HttpServerException {

    public static final String MESSAGE = "Method Not Allowed";

    public final String httpMethod;

    public MethodNotAllowedException (String httpMethod) {
        super(MESSAGE);
        this.httpMethod = httpMethod;
    }

    @Override
    public ErrorType errorType () {
        return ErrorType.METHOD;
    }

}
