// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.jsonserver.dispatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.pfive.jsonserver.util.JsonUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.lang.invoke.MethodHandles;
import java.util.Optional;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;

/// Binds a [MethodRegistry] to one actor instance and turns (method name, JSON text) into JSON
/// text. This is the only behavior shared by every transport, so HTTP and WebSocket callers see
/// identical results for identical calls.
///
/// Dispatch never throws. Every problem a client can cause (bad JSON, unknown method, parameters
/// of the wrong shape) and every failure of the operation itself comes back as a JSON string
/// literal describing the problem. Whether an operation succeeded at the application level is
/// expressed only by its own result type, for example [io.pfive.jsonserver.util.Ret].
///
/// Instances are safe to share across threads as long as the actor is. Operations run on the
/// calling thread and are not serialized against each other here: an actor with mutable state
/// must synchronize it internally.
public class Dispatcher<A> {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private final MethodRegistry<A> registry;
    private final A actor;

    public Dispatcher (MethodRegistry<A> registry, A actor) {
        if (registry == null || actor == null) {
            throw new IllegalArgumentException("Registry and actor must both be supplied.");
        }
        this.registry = registry;
        this.actor = actor;
    }

    public MethodRegistry<A> registry () {
        return registry;
    }

    public String dispatch (String methodName, String rawJson) {
        JsonNode params;
        try {
            params = JsonUtil.objectMapper.readTree(rawJson == null ? "" : rawJson);
            if (params == null || params.isMissingNode()) {
                return DispatchError.MALFORMED_JSON.encode(methodName, "EOF while parsing a value");
            }
        } catch (JsonProcessingException e) {
            return DispatchError.MALFORMED_JSON.encode(methodName, JsonUtil.briefMessage(e));
        }

        Optional<MethodDescriptor<A>> found = registry.lookup(methodName);
        if (found.isEmpty()) {
            return DispatchError.UNKNOWN_METHOD.encode(methodName, null);
        }
        MethodDescriptor<A> method = found.get();

        Object decoded;
        try {
            decoded = method.decode(params);
        } catch (ParameterDecodingException e) {
            return DispatchError.BAD_PARAMETERS.encode(methodName, e.getMessage());
        }

        Object result;
        try {
            result = await(method.invoke(actor, decoded));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return DispatchError.INVOCATION_FAILED.encode(methodName, "interrupted while waiting for result");
        } catch (Throwable t) {
            return DispatchError.INVOCATION_FAILED.encode(methodName, condenseAndLog(methodName, t));
        }

        try {
            return JsonUtil.objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            return DispatchError.RESULT_NOT_SERIALIZABLE.encode(methodName, JsonUtil.briefMessage(e));
        }
    }

    /// Operations may return a CompletionStage when they wait on I/O. The calling transport
    /// thread waits for it; there is no timeout.
    private static Object await (Object result) throws Throwable {
        if (result instanceof CompletionStage<?> stage) {
            try {
                return stage.toCompletableFuture().get();
            } catch (ExecutionException e) {
                throw e.getCause() == null ? e : e.getCause();
            }
        }
        return result;
    }

    /// Log the whole stack trace, since an operation throwing is unexpected, but only return a
    /// one-line summary to be sent to the client.
    private static String condenseAndLog (String methodName, Throwable throwable) {
        StringWriter stringWriter = new StringWriter();
        throwable.printStackTrace(new PrintWriter(stringWriter));
        LOG.info("Method {} threw, reporting to client: \n{}", methodName, stringWriter);
        String message = throwable.getMessage();
        String className = throwable.getClass().getSimpleName();
        return message == null ? className : className + ": " + message;
    }

}
