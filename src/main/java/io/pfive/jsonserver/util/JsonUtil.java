// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.jsonserver.util;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.guava.GuavaModule;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;

/// Static JSON helpers shared by the dispatcher and both transports.
public abstract class JsonUtil {

    /// Create Object mapper adding modules to handle Guava collection types like ImmutableList and
    /// JDK Optional (absent is null on the wire) in actor parameters and results. Parameter decoding is deliberately strict: a client that sends "5" for an int
    /// or 2.5 for a long, or leaves out a parameter, gets a deserialization error rather than a
    /// silently coerced or defaulted value. Unknown keys are ignored.
    public static final ObjectMapper objectMapper = JsonMapper.builder()
            .addModule(new GuavaModule())
            .addModule(new Jdk8Module())
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
            .enable(DeserializationFeature.FAIL_ON_MISSING_CREATOR_PROPERTIES)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT)
            .disable(MapperFeature.ALLOW_COERCION_OF_SCALARS)
            .build();

    // Used when even encoding a plain string fails, which should never happen.
    private static final String FALLBACK_ERROR_JSON = "\"Serialization error\"";

    /// Encode a String as a JSON string literal, including the surrounding quotes.
    public static String jsonString (String string) {
        try {
            return objectMapper.writeValueAsString(string);
        } catch (JsonProcessingException e) {
            return FALLBACK_ERROR_JSON;
        }
    }

    /// A single-key object {"error": message}, as text.
    public static String errorObject (String message) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("error", message);
        return node.toString();
    }

    /// Jackson messages embed a dump of the source and a long location suffix. Keep only the
    /// original message, followed by line and column when the parser knows them.
    public static String briefMessage (JsonProcessingException e) {
        String message = e.getOriginalMessage();
        if (message == null) {
            message = e.getClass().getSimpleName();
        }
        JsonLocation location = e.getLocation();
        if (location != null && location.getLineNr() > 0) {
            return "%s at line %d column %d".formatted(message, location.getLineNr(), location.getColumnNr());
        }
        return message;
    }

}
