// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.jsonserver.util;

import org.eclipse.jetty.http.HttpHeader;
import org.eclipse.jetty.http.HttpStatus;
import org.eclipse.jetty.http.MimeTypes;
import org.eclipse.jetty.server.Response;
import org.eclipse.jetty.util.BufferUtil;
import org.eclipse.jetty.util.Callback;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/// Static utility methods for working with Jetty handlers. Each respond method completes the
/// response and returns true, so a handler can end with `return respondText(...)`.
public abstract class JettyUtil {

    public static final String CORS_ALLOW_ORIGIN = "*";
    public static final String CORS_ALLOW_METHODS = "POST, OPTIONS";
    public static final String CORS_ALLOW_HEADERS = "Content-Type";

    public static boolean respondServerError (String message, Response response, Callback callback) {
        return respondText(HttpStatus.INTERNAL_SERVER_ERROR_500, message, response, callback);
    }

    /// Plain text body. The content type is exactly "text/plain" with no charset parameter, which
    /// some clients compare literally; the body is UTF-8 regardless.
    public static boolean respondText (int code, String message, Response response, Callback callback) {
        response.setStatus(code);
        response.getHeaders().put(HttpHeader.CONTENT_TYPE, MimeTypes.Type.TEXT_PLAIN.asString());
        response.write(true, wrapString(message), callback);
        return true;
    }

    /// Respond with text that is already serialized JSON, with the proper content type header and
    /// a 200 OK response code.
    public static boolean respondJsonText (String json, Response response, Callback callback) {
        response.setStatus(HttpStatus.OK_200);
        response.getHeaders().put(HttpHeader.CONTENT_TYPE, MimeTypes.Type.APPLICATION_JSON.asString());
        response.write(true, wrapString(json), callback);
        return true;
    }

    /// 200 OK with no body at all, as for a CORS preflight.
    public static boolean respondEmpty (Response response, Callback callback) {
        response.setStatus(HttpStatus.OK_200);
        response.getHeaders().put(HttpHeader.CONTENT_LENGTH, 0L);
        response.write(true, BufferUtil.EMPTY_BUFFER, callback);
        return true;
    }

    /// Headers allowing browser pages from any origin to call the API.
    public static void addCorsHeaders (Response response) {
        response.getHeaders().put("Access-Control-Allow-Origin", CORS_ALLOW_ORIGIN);
        response.getHeaders().put("Access-Control-Allow-Methods", CORS_ALLOW_METHODS);
        response.getHeaders().put("Access-Control-Allow-Headers", CORS_ALLOW_HEADERS);
    }

    /// Convert a String to a UTF-8 ByteBuffer, typically for writing to an HTTP response body.
    public static ByteBuffer wrapString (String string) {
        // Alternatively: StandardCharsets.UTF_8.encode(s); but implementation looks slightly more complex.
        return ByteBuffer.wrap(string.getBytes(StandardCharsets.UTF_8));
    }

}
