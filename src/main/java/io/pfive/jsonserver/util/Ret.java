// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.jsonserver.util;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;
import java.util.function.Function;

/// The return value of an operation, containing either a result or an error.
///
/// Java has Optional and Either. The former is just like null in that it doesn't tell you why the
/// object is not present (failure or success with no object). The latter depends on the order (left
/// and right) so is not typesafe. Ok and Err are subclasses of abstract Ret as this avoids having
/// an empty field in every instance.
///
/// Actor operations return a Ret when the caller needs to distinguish success from failure. Over
/// the wire it becomes a single-key JSON object, either `{"Ok": value}` or `{"Err": "message"}`,
/// so a failed operation is still an ordinary successful response at the transport level.
@JsonSerialize(using = Ret.JsonWriter.class)
public abstract class Ret<T> {

    public static final String OK_KEY = "Ok";
    public static final String ERR_KEY = "Err";

    public boolean isErr () {
        return false;
    }

    public boolean isOk () {
        return false;
    }

    /// If the return value is Ok, returns the value. If it is an error, throw an exception.
    public final T get () {
        return getOrThrow(MissingReturnValueException::new);
    }

    public abstract T getOrThrow (Function<String, RuntimeException> exceptionFactory);

    /// Returns the error message. Will throw an exception if a return value is present instead of error.
    public abstract String errorMessage ();

    // Convenience factory methods to allow static imports and creating return values without using the 'new' operator.
    // That is: return ok(x); or return err("Description"); rather than return new Ret.Ok<>(x);

    public static <T> Ret<T> ok (T result) {
        return new Ok<>(result);
    }

    public static <T> Ret<T> err (String message) {
        return new Err<>(message);
    }

    /// Re-type an error so it can be returned from a function with a different parametric type, as
    /// in the Rust ? operator. Calling this on an Ok is a programming error.
    public abstract <X> Ret<X> propagate ();

    /// An Ok or Err instance should never wrap a null reference. The whole point is to eliminate
    /// null references.
    private static void checkNotNull (Object o) {
        if (o == null) {
            throw new IllegalArgumentException("Supplied result or error must not be null.");
        }
    }

    // Java already defines an Error type, which essentially means "very bad exception you should not catch".
    // Use a different name (Err), scoped as an inner class of Ret to avoid confusion with this Error type.

    /// When an operation fails, an Err instance must be provided to explain why.
    public static class Err<T> extends Ret<T> {
        public final String message; // Cannot be null.
        public Err (String message) {
            checkNotNull(message);
            this.message = message;
        }

        @Override
        public boolean isErr () {
            return true;
        }

        @Override
        public <X> Ret<X> propagate () {
            return new Err<>(this.message);
        }

        @Override
        public T getOrThrow (Function<String, RuntimeException> exceptionFactory) {
            throw exceptionFactory.apply(message);
        }

        @Override
        public String errorMessage () {
            return message;
        }

        @Override
        public String toString () {
            return "Err<%s>".formatted(message);
        }
    }

    public static class Ok<T> extends Ret<T> {
        public final T result; // Cannot be null.
        public Ok (T result) {
            checkNotNull(result);
            this.result = result;
        }

        @Override
        public boolean isOk () {
            return true;
        }

        @Override
        public <X> Ret<X> propagate () {
            throw new IllegalStateException("Only errors can be propagated.");
        }

        @Override
        public T getOrThrow (Function<String, RuntimeException> exceptionFactory) {
            return result;
        }

        @Override
        public String errorMessage () {
            throw new IllegalStateException("This is not an error, so has no error message.");
        }

        @Override
        public String toString () {
            return "Ok<%s>".formatted(result.toString());
        }
    }

    /// Writes the single-key object form. The Ok value goes through the normal serializers, so any
    /// type the ObjectMapper can handle may be wrapped.
    @SuppressWarnings("rawtypes")
    public static class JsonWriter extends StdSerializer<Ret> {
        public JsonWriter () {
            super(Ret.class);
        }

        @Override
        public void serialize (Ret value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeStartObject();
            if (value.isErr()) {
                gen.writeStringField(ERR_KEY, value.errorMessage());
            } else {
                gen.writeFieldName(OK_KEY);
                provider.defaultSerializeValue(value.get(), gen);
            }
            gen.writeEndObject();
        }
    }

}
