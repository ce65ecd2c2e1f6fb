// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.jsonserver.dispatch;

import com.google.common.collect.ImmutableMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;

/// The immutable table from wire method name to [MethodDescriptor] for one actor type. It is built
/// once, usually into a static final field of the actor class, and shared without locking by every
/// dispatcher and connection serving actors of that type.
///
/// There are two ways to build one. The builder registers each operation explicitly with a record
/// type describing its parameters:
///
/// ```java
/// record AddParams (int a, int b) { }
/// static final MethodRegistry<Counter> REGISTRY = MethodRegistry.builder(Counter.class)
///     .method("add", AddParams.class, Integer.class, (counter, p) -> counter.add(p.a(), p.b()))
///     .method("total", Integer.class, Counter::total)
///     .build();
/// ```
///
/// Alternatively [#scan(Class)] registers every public instance method carrying [Exposed]. In
/// both cases a name may be registered only once; there is no overwriting.
public class MethodRegistry<A> {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private final Class<A> actorType;
    private final ImmutableMap<String, MethodDescriptor<A>> methods;

    private MethodRegistry (Class<A> actorType, Map<String, MethodDescriptor<A>> methods) {
        this.actorType = actorType;
        this.methods = ImmutableMap.copyOf(methods);
    }

    public Class<A> actorType () {
        return actorType;
    }

    public Optional<MethodDescriptor<A>> lookup (String name) {
        return Optional.ofNullable(methods.get(name));
    }

    /// Method names in registration order (declaration order is not available through reflection,
    /// so scanned registries are sorted by name).
    public Set<String> names () {
        return methods.keySet();
    }

    public Collection<MethodDescriptor<A>> descriptors () {
        return methods.values();
    }

    public int size () {
        return methods.size();
    }

    public static <A> Builder<A> builder (Class<A> actorType) {
        return new Builder<>(actorType);
    }

    /// Register every public, non-static method of the actor class (including inherited ones) that
    /// is annotated with [Exposed]. Anything else, whatever its visibility, stays unreachable.
    /// @throws IllegalArgumentException on a duplicate wire name or missing parameter names.
    public static <A> MethodRegistry<A> scan (Class<A> actorType) {
        Builder<A> builder = new Builder<>(actorType);
        // getMethods() returns only public methods, in no particular order.
        Method[] methods = actorType.getMethods();
        Arrays.sort(methods, Comparator.comparing(Method::getName));
        for (Method method : methods) {
            // javac copies annotations onto the bridge methods it generates for generic and
            // covariant overrides. Only the real method is registered.
            if (method.isBridge() || method.isSynthetic()) continue;
            if (!method.isAnnotationPresent(Exposed.class)) continue;
            if (Modifier.isStatic(method.getModifiers())) {
                LOG.warn("Ignoring @Exposed on static method {}.{}", actorType.getSimpleName(), method.getName());
                continue;
            }
            builder.add(ReflectiveMethod.of(method));
        }
        return builder.build();
    }

    /// Calls an operation whose parameters arrive as a record.
    @FunctionalInterface
    public interface Invoker<A, P, R> {
        R invoke (A actor, P params) throws Exception;
    }

    /// Calls an operation that takes no parameters.
    @FunctionalInterface
    public interface NoParamInvoker<A, R> {
        R invoke (A actor) throws Exception;
    }

    public static class Builder<A> {

        private final Class<A> actorType;
        private final Map<String, MethodDescriptor<A>> methods = new LinkedHashMap<>();

        private Builder (Class<A> actorType) {
            this.actorType = actorType;
        }

        public <P extends Record, R> Builder<A> method (String name, Class<P> paramType, Class<R> resultType,
                                                        Invoker<A, P, R> invoker) {
            return method(name, "", paramType, resultType, invoker);
        }

        public <P extends Record, R> Builder<A> method (String name, String description, Class<P> paramType,
                                                        Class<R> resultType, Invoker<A, P, R> invoker) {
            return add(new RecordMethod<>(name, description, paramType, resultType, invoker));
        }

        public <R> Builder<A> method (String name, Class<R> resultType, NoParamInvoker<A, R> invoker) {
            return method(name, "", resultType, invoker);
        }

        public <R> Builder<A> method (String name, String description, Class<R> resultType,
                                      NoParamInvoker<A, R> invoker) {
            return add(new NoParamMethod<>(name, description, resultType, invoker));
        }

        Builder<A> add (MethodDescriptor<A> descriptor) {
            String name = descriptor.name();
            checkArgument(name != null && !name.isBlank(), "Method name must not be blank.");
            // The HTTP adapter takes the whole path after the leading slash as the name.
            checkArgument(!name.contains("/"), "Method name '%s' must not contain a slash.", name);
            checkArgument(!methods.containsKey(name), "Method name '%s' is registered more than once on %s.",
                name, actorType.getSimpleName());
            methods.put(name, descriptor);
            return this;
        }

        public MethodRegistry<A> build () {
            MethodRegistry<A> registry = new MethodRegistry<>(actorType, methods);
            LOG.debug("Built method registry for {} with methods {}", actorType.getSimpleName(), registry.names());
            return registry;
        }

    }

}
