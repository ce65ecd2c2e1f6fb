// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.jsonserver.http.handler;

import io.pfive.jsonserver.http.exception.HttpServerException;
import org.eclipse.jetty.server.Handler;
import org.eclipse.jetty.server.Request;
import org.eclipse.jetty.server.Response;
import org.eclipse.jetty.util.Callback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.lang.invoke.MethodHandles;

import static io.pfive.jsonserver.util.JettyUtil.respondServerError;
import static io.pfive.jsonserver.util.JettyUtil.respondText;

/// This handler wraps other handlers to catch any exceptions they produce. These exceptions are
/// converted into plain-text messages in the response body with appropriate HTTP response codes.
/// This allows bailing out of simple checks (wrong verb, unreadable body) without yielding Jetty's
/// general-purpose HTML error page.
public class ExceptionHandler extends Handler.Wrapper {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    public ExceptionHandler (Handler handler) {
        super(handler);
    }

    @Override
    public boolean handle (Request request, Response response, Callback callback) throws Exception {
        try {
            return super.handle(request, response, callback);
        } catch (HttpServerException e) {
            // These errors are expected in normal operation, so don't log stack traces.
            LOG.debug("{} {} rejected with {}: {}", request.getMethod(), request.getHttpURI().getPath(),
                e.errorType().httpCode, e.getMessage());
            return respondText(e.errorType().httpCode, e.getMessage(), response, callback);
        } catch (Throwable t) {
            // Catch-all for other Exceptions and Throwables that are unexpected and not associated
            // with HTTP codes. Here we want to log the whole stack trace and return the exception
            // type to facilitate debugging.
            return respondServerError(condenseAndLog(t), response, callback);
        }
    }

    public static String condenseAndLog (Throwable throwable) {
        StringWriter stringWriter = new StringWriter();
        PrintWriter printWriter = new PrintWriter(stringWriter);
        throwable.printStackTrace(printWriter);
        String trace = stringWriter.toString();
        LOG.info("Reporting error in HTTP response: \n" + trace);
        return briefThrowableMessage(throwable);
    }

    /// Create a one-line message consisting of only the exception class name and its message (if
    /// any). Some exceptions may be constructed with no message so getMessage returns null.
    public static String briefThrowableMessage (Throwable throwable) {
        String message = throwable.getMessage();
        String className = throwable.getClass().getSimpleName();
        if (message == null) {
            return className;
        } else {
            return className + ": " + message;
        }
    }

}
