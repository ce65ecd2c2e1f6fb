// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.jsonserver.dispatch;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/// Marks a public instance method of an actor class as callable over the network. Only methods
/// carrying this annotation are picked up by [MethodRegistry#scan(Class)]; being public is
/// necessary but not sufficient.
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface Exposed {

    /// Wire name of the method. Defaults to the Java method name.
    String name () default "";

    /// One or more sentences copied into the generated documentation.
    String description () default "";

}
