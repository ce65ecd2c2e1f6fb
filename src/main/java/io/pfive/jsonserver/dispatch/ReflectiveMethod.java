// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.jsonserver.dispatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectReader;
import io.pfive.jsonserver.util.JsonUtil;

import java.io.IOException;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Parameter;
import java.util.ArrayList;
import java.util.List;

/// A method found by scanning an actor class for [Exposed] annotations. Each Java parameter is
/// decoded separately from the member of the params object with the same name, using a reader
/// prepared once for the parameter's full generic type.
class ReflectiveMethod<A> extends MethodDescriptor<A> {

    private final Method method;
    private final ObjectReader[] readers;
    private final Class<?>[] rawTypes;

    private ReflectiveMethod (String name, String description, List<ParamInfo> params, Method method) {
        super(name, description, params, method.getGenericReturnType());
        this.method = method;
        this.readers = new ObjectReader[params.size()];
        this.rawTypes = method.getParameterTypes();
        for (int i = 0; i < readers.length; i++) {
            readers[i] = JsonUtil.objectMapper.readerFor(
                JsonUtil.objectMapper.getTypeFactory().constructType(params.get(i).type()));
        }
    }

    /// @throws IllegalArgumentException if the parameter names were not kept by the compiler and
    /// are not supplied with [Param].
    static <A> ReflectiveMethod<A> of (Method method) {
        Exposed exposed = method.getAnnotation(Exposed.class);
        String name = exposed.name().isEmpty() ? method.getName() : exposed.name();
        List<ParamInfo> params = new ArrayList<>();
        for (Parameter parameter : method.getParameters()) {
            Param param = parameter.getAnnotation(Param.class);
            String paramName;
            if (param != null) {
                paramName = param.value();
            } else if (parameter.isNamePresent()) {
                paramName = parameter.getName();
            } else {
                throw new IllegalArgumentException(String.format(
                    "Parameter names of %s.%s are not available. Compile with -parameters or annotate with @Param.",
                    method.getDeclaringClass().getSimpleName(), method.getName()));
            }
            params.add(new ParamInfo(paramName, parameter.getParameterizedType()));
        }
        // Public methods of package-private actor classes are not callable through reflection otherwise.
        method.setAccessible(true);
        return new ReflectiveMethod<>(name, exposed.description(), params, method);
    }

    @Override
    public Object decode (JsonNode params) {
        requireObject(params);
        Object[] args = new Object[readers.length];
        for (int i = 0; i < readers.length; i++) {
            String paramName = params().get(i).name();
            JsonNode value = params.get(paramName);
            if (value == null) {
                throw new ParameterDecodingException("missing field `" + paramName + "`");
            }
            if (value.isNull() && rawTypes[i].isPrimitive()) {
                throw new ParameterDecodingException(String.format(
                    "invalid null for field `%s` of type %s", paramName, rawTypes[i].getName()));
            }
            try {
                args[i] = readers[i].readValue(value);
            } catch (JsonProcessingException e) {
                throw new ParameterDecodingException("field `" + paramName + "`: " + JsonUtil.briefMessage(e));
            } catch (IOException e) {
                throw new ParameterDecodingException("field `" + paramName + "`: " + e.getMessage());
            }
        }
        return args;
    }

    @Override
    public Object invoke (A actor, Object decodedParams) throws Exception {
        try {
            return method.invoke(actor, (Object[]) decodedParams);
        } catch (InvocationTargetException e) {
            // Report what the actor method threw, not the reflection wrapper.
            Throwable cause = e.getCause();
            if (cause instanceof Exception exception) throw exception;
            if (cause instanceof Error error) throw error;
            throw e;
        }
    }

}
