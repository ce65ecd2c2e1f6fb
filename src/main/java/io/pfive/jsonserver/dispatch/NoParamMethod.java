// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.jsonserver.dispatch;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/// A method taking no parameters. Any JSON object is accepted and ignored.
class NoParamMethod<A, R> extends MethodDescriptor<A> {

    private final MethodRegistry.NoParamInvoker<A, R> invoker;

    NoParamMethod (String name, String description, Class<R> resultType, MethodRegistry.NoParamInvoker<A, R> invoker) {
        super(name, description, List.of(), resultType);
        this.invoker = invoker;
    }

    @Override
    public Object decode (JsonNode params) {
        requireObject(params);
        return params;
    }

    @Override
    public Object invoke (A actor, Object decodedParams) throws Exception {
        return invoker.invoke(actor);
    }

}
