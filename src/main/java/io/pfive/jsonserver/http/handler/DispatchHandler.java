// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.jsonserver.http.handler;

import io.pfive.jsonserver.dispatch.Dispatcher;
import io.pfive.jsonserver.http.exception.InvalidRequestException;
import io.pfive.jsonserver.http.exception.MethodNotAllowedException;
import org.eclipse.jetty.http.HttpMethod;
import org.eclipse.jetty.io.Content;
import org.eclipse.jetty.server.Handler;
import org.eclipse.jetty.server.Request;
import org.eclipse.jetty.server.Response;
import org.eclipse.jetty.util.Callback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.invoke.MethodHandles;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

import static io.pfive.jsonserver.util.JettyUtil.respondJsonText;

/// Maps `POST /<method>` onto one dispatcher call. The request body, whatever its declared content
/// type, is passed verbatim as the JSON parameters and the dispatcher's output is the response
/// body. Everything the dispatcher reports, including unknown methods and unparseable JSON, goes
/// back as 200 application/json: only problems at the HTTP level produce other status codes.
///
/// Expected to be wrapped in a [CorsHandler] (which answers OPTIONS) and an [ExceptionHandler]
/// (which turns the exceptions thrown here into 400 and 405 responses).
public class DispatchHandler extends Handler.Abstract {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private final Dispatcher<?> dispatcher;

    public DispatchHandler (Dispatcher<?> dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public boolean handle (Request request, Response response, Callback callback) throws Exception {
        if (!HttpMethod.POST.is(request.getMethod())) {
            throw new MethodNotAllowedException(request.getMethod());
        }
        String methodName = methodName(request.getHttpURI().getPath());
        String body = readUtf8Body(request);
        LOG.debug("HTTP call to {} from {}", methodName, Request.getRemoteAddr(request));
        String result = dispatcher.dispatch(methodName, body);
        return respondJsonText(result, response, callback);
    }

    /// The whole path after any leading slashes. Further segments are not interpreted, so
    /// "/a/b" asks for a method literally named "a/b", which no registry accepts.
    static String methodName (String path) {
        if (path == null) return "";
        int start = 0;
        while (start < path.length() && path.charAt(start) == '/') start++;
        return path.substring(start);
    }

    /// Reads the body fully. A decoder that reports malformed input is used rather than
    /// new String(bytes, UTF_8), which would silently substitute replacement characters.
    static String readUtf8Body (Request request) {
        ByteBuffer bytes;
        try {
            bytes = Content.Source.asByteBuffer(request);
        } catch (IOException e) {
            throw new InvalidRequestException("Failed to read request body: " + e.getMessage());
        }
        try {
            return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(bytes)
                .toString();
        } catch (CharacterCodingException e) {
            throw new InvalidRequestException("Invalid UTF-8 in request body");
        }
    }

}
