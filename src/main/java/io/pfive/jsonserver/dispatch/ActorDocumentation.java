// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.jsonserver.dispatch;

import java.lang.reflect.GenericArrayType;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/// Generates a Markdown reference for an actor from its runtime registry: a summary table, then for
/// each method its parameters, result type, and example HTTP, WebSocket and JavaScript payloads.
/// Example values are placeholders chosen by parameter type.
public abstract class ActorDocumentation {

    public static String markdown (MethodRegistry<?> registry, String baseUrl) {
        StringBuilder doc = new StringBuilder();
        doc.append("# Actor `").append(registry.actorType().getSimpleName()).append("`\n\n");
        doc.append("This actor provides JSON-based method dispatch for the following methods:\n\n");
        doc.append("| Method | Parameters | Return Type |\n");
        doc.append("|--------|------------|-------------|\n");
        for (MethodDescriptor<?> method : registry.descriptors()) {
            String params = method.params().isEmpty() ? "None" : method.params().stream()
                    .map(p -> "`%s`: `%s`".formatted(p.name(), typeName(p.type())))
                    .collect(Collectors.joining(", "));
            doc.append("| `%s` | %s | `%s` |\n".formatted(method.name(), params, typeName(method.resultType())));
        }
        doc.append('\n');
        for (MethodDescriptor<?> method : registry.descriptors()) {
            appendMethod(doc, method, baseUrl);
        }
        return doc.toString();
    }

    private static void appendMethod (StringBuilder doc, MethodDescriptor<?> method, String baseUrl) {
        List<ParamInfo> params = method.params();
        doc.append("---\n");
        doc.append("## Method `").append(method.name()).append("`\n\n");
        if (!method.description().isBlank()) {
            doc.append(method.description()).append("\n\n");
        }
        if (params.isEmpty()) {
            doc.append("- **Parameters:** None\n");
        } else {
            doc.append("- **Parameters:**\n");
            for (ParamInfo param : params) {
                doc.append("  - `%s`: `%s`\n".formatted(param.name(), typeName(param.type())));
            }
        }
        doc.append("- **Returns:** `").append(typeName(method.resultType())).append("`\n\n");

        doc.append("**HTTP:** `POST ").append(baseUrl).append('/').append(method.name()).append("` with body:\n");
        doc.append("```json\n").append(examplePayload(params, "")).append("\n```\n\n");

        // A persistent connection cannot use the URL to carry the method name, so it goes in the frame.
        doc.append("**WebSocket frame:**\n");
        doc.append("```json\n");
        doc.append("{\n  \"method\": \"").append(method.name()).append("\",\n");
        doc.append("  \"params\": ").append(examplePayload(params, "  ")).append("\n}\n");
        doc.append("```\n\n");

        doc.append("**JavaScript:**\n");
        doc.append("```js\n");
        doc.append("result = await fetch(\"").append(baseUrl).append('/').append(method.name()).append("\", {\n");
        doc.append("  method: 'POST',\n");
        doc.append("  headers: { 'Content-Type': 'application/json' },\n");
        doc.append("  body: JSON.stringify(").append(examplePayload(params, "  ")).append(")\n");
        doc.append("});\n");
        doc.append("```\n\n");
    }

    private static String examplePayload (List<ParamInfo> params, String indent) {
        if (params.isEmpty()) return "{}";
        String body = params.stream()
                .map(p -> "%s  \"%s\": %s".formatted(indent, p.name(), exampleValue(p.type())))
                .collect(Collectors.joining(",\n"));
        return "{\n" + body + "\n" + indent + "}";
    }

    static String exampleValue (Type type) {
        Class<?> raw = rawClass(type);
        if (raw == null) return "\"value\"";
        if (raw == int.class || raw == long.class || raw == short.class || raw == byte.class
                || raw == Integer.class || raw == Long.class || raw == Short.class || raw == Byte.class) {
            return "42";
        }
        if (raw == double.class || raw == float.class || raw == Double.class || raw == Float.class) return "3.14";
        if (raw == boolean.class || raw == Boolean.class) return "true";
        if (raw == char.class || raw == Character.class) return "\"x\"";
        if (CharSequence.class.isAssignableFrom(raw)) return "\"example\"";
        if (raw == Optional.class) return "null";
        if (raw.isArray() || Collection.class.isAssignableFrom(raw)) return "[]";
        if (Map.class.isAssignableFrom(raw)) return "{}";
        return "\"value\"";
    }

    /// A compact name: simple class names with type arguments, `void` for no result.
    static String typeName (Type type) {
        if (type instanceof Class<?> c) {
            return c.getSimpleName();
        }
        if (type instanceof ParameterizedType p) {
            String args = Arrays.stream(p.getActualTypeArguments())
                    .map(ActorDocumentation::typeName)
                    .collect(Collectors.joining(", "));
            return typeName(p.getRawType()) + "<" + args + ">";
        }
        if (type instanceof GenericArrayType g) {
            return typeName(g.getGenericComponentType()) + "[]";
        }
        return type.getTypeName();
    }

    private static Class<?> rawClass (Type type) {
        if (type instanceof Class<?> c) return c;
        if (type instanceof ParameterizedType p && p.getRawType() instanceof Class<?> c) return c;
        if (type instanceof GenericArrayType) return Object[].class;
        return null;
    }

}
