// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.jsonserver.dispatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.pfive.jsonserver.util.JsonUtil;

import java.lang.reflect.RecordComponent;
import java.util.ArrayList;
import java.util.List;

/// A method whose parameters are the components of a record type P. The record is the explicit
/// parameter struct: its component names are the JSON keys and Jackson builds it through the
/// canonical constructor, so missing keys and mistyped values are rejected before the call.
class RecordMethod<A, P extends Record, R> extends MethodDescriptor<A> {

    private final Class<P> paramType;
    private final MethodRegistry.Invoker<A, P, R> invoker;

    RecordMethod (String name, String description, Class<P> paramType, Class<R> resultType,
                  MethodRegistry.Invoker<A, P, R> invoker) {
        super(name, description, componentsOf(paramType), resultType);
        this.paramType = paramType;
        this.invoker = invoker;
    }

    private static List<ParamInfo> componentsOf (Class<? extends Record> recordType) {
        List<ParamInfo> params = new ArrayList<>();
        for (RecordComponent component : recordType.getRecordComponents()) {
            params.add(new ParamInfo(component.getName(), component.getGenericType()));
        }
        return params;
    }

    @Override
    public Object decode (JsonNode params) {
        requireObject(params);
        try {
            return JsonUtil.objectMapper.treeToValue(params, paramType);
        } catch (JsonProcessingException e) {
            throw new ParameterDecodingException(JsonUtil.briefMessage(e));
        } catch (IllegalArgumentException e) {
            throw new ParameterDecodingException(e.getMessage());
        }
    }

    @Override
    public Object invoke (A actor, Object decodedParams) throws Exception {
        return invoker.invoke(actor, paramType.cast(decodedParams));
    }

}
