// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.jsonserver.dispatch;

import com.fasterxml.jackson.databind.JsonNode;

import java.lang.reflect.Type;
import java.util.List;

/// Everything the dispatcher needs to know about one exposed operation of actor type A: its wire
/// name, how to turn a JSON value into its arguments, and how to call it. The parameter and
/// result types are kept for generating documentation and are not consulted during dispatch.
///
/// Instances are immutable and hold no reference to any actor instance, so a single registry can
/// back any number of actors of the same type.
public abstract class MethodDescriptor<A> {

    private final String name;
    private final String description;
    private final List<ParamInfo> params;
    private final Type resultType;

    protected MethodDescriptor (String name, String description, List<ParamInfo> params, Type resultType) {
        this.name = name;
        this.description = description == null ? "" : description;
        this.params = List.copyOf(params);
        this.resultType = resultType;
    }

    public String name () {
        return name;
    }

    public String description () {
        return description;
    }

    public List<ParamInfo> params () {
        return params;
    }

    public Type resultType () {
        return resultType;
    }

    /// Convert the parsed request value into whatever argument representation [#invoke] expects.
    /// @throws ParameterDecodingException if the value does not match the declared parameters.
    public abstract Object decode (JsonNode params);

    /// Call the operation. The returned value is serialized as the response. A CompletionStage is
    /// awaited by the dispatcher before serialization.
    public abstract Object invoke (A actor, Object decodedParams) throws Exception;

    /// Every method receives its parameters as a JSON object keyed on parameter name, including
    /// methods without parameters which accept any object (normally `{}`).
    protected static void requireObject (JsonNode params) {
        if (params == null || !params.isObject()) {
            String found = params == null ? "nothing" : params.getNodeType().name().toLowerCase();
            throw new ParameterDecodingException("expected a JSON object of named parameters, found " + found);
        }
    }

    @Override
    public String toString () {
        return "MethodDescriptor<%s%s>".formatted(name, params.stream().map(ParamInfo::name).toList());
    }

}
