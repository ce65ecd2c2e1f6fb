// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.jsonserver.http.handler;

import org.eclipse.jetty.http.HttpMethod;
import org.eclipse.jetty.server.Handler;
import org.eclipse.jetty.server.Request;
import org.eclipse.jetty.server.Response;
import org.eclipse.jetty.util.Callback;

import static io.pfive.jsonserver.util.JettyUtil.addCorsHeaders;
import static io.pfive.jsonserver.util.JettyUtil.respondEmpty;

/// Lets browser pages on any origin call the actor. Every response passing through here carries
/// the CORS headers, and OPTIONS preflight requests on any path are answered directly with an
/// empty 200 response without reaching the wrapped handler.
public class CorsHandler extends Handler.Wrapper {

    public CorsHandler (Handler handler) {
        super(handler);
    }

    @Override
    public boolean handle (Request request, Response response, Callback callback) throws Exception {
        addCorsHeaders(response);
        if (HttpMethod.OPTIONS.is(request.getMethod())) {
            return respondEmpty(response, callback);
        }
        return super.handle(request, response, callback);
    }

}
