// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.jsonserver.server;

import io.pfive.jsonserver.dispatch.Dispatcher;
import io.pfive.jsonserver.dispatch.MethodRegistry;

import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/// Owns one actor instance before it is handed to a server. The instance is created inside the
/// handle from a factory, so no caller ever holds a reference to it. Until the handle is served,
/// calls may be made directly through [#dispatch(String, String)], for example in tests or from a
/// command line. Serving it with [ActorServer] moves the actor into the server; the handle is then
/// empty and direct calls fail, so nothing can touch the actor behind the server's back.
public final class ActorHandle<A> {

    private final MethodRegistry<A> registry;
    private final AtomicReference<Dispatcher<A>> dispatcher;

    private ActorHandle (MethodRegistry<A> registry, A actor) {
        this.registry = registry;
        this.dispatcher = new AtomicReference<>(new Dispatcher<>(registry, actor));
    }

    public static <A> ActorHandle<A> create (MethodRegistry<A> registry, Supplier<? extends A> factory) {
        A actor = factory.get();
        if (actor == null) throw new IllegalArgumentException("Actor factory returned null.");
        return new ActorHandle<>(registry, actor);
    }

    public MethodRegistry<A> registry () {
        return registry;
    }

    public boolean isServed () {
        return dispatcher.get() == null;
    }

    /// Call the actor directly, with the same results a remote client would see.
    /// @throws IllegalStateException if the actor has already been handed to a server.
    public String dispatch (String methodName, String rawJson) {
        Dispatcher<A> current = dispatcher.get();
        if (current == null) throw alreadyServed();
        return current.dispatch(methodName, rawJson);
    }

    /// Give up the actor, leaving this handle empty. Succeeds at most once.
    Dispatcher<A> transfer () {
        Dispatcher<A> taken = dispatcher.getAndSet(null);
        if (taken == null) throw alreadyServed();
        return taken;
    }

    private IllegalStateException alreadyServed () {
        return new IllegalStateException("Actor " + registry.actorType().getSimpleName() +
            " has already been handed to a server.");
    }

}
