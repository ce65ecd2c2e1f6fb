// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.jsonserver.example;

import io.pfive.jsonserver.dispatch.Exposed;
import io.pfive.jsonserver.dispatch.MethodRegistry;
import io.pfive.jsonserver.util.Ret;

import java.util.concurrent.atomic.AtomicInteger;

import static io.pfive.jsonserver.util.Ret.err;
import static io.pfive.jsonserver.util.Ret.ok;

/// A small named actor whose operations are found by scanning for [Exposed] annotations, with
/// parameter names taken from the compiled method signatures.
public class Greeter {

    public static final MethodRegistry<Greeter> REGISTRY = MethodRegistry.scan(Greeter.class);

    private final String name;
    private final AtomicInteger counter = new AtomicInteger();

    public Greeter (String name) {
        this.name = name;
    }

    @Exposed(description = "Add two whole numbers.")
    public int add (int a, int b) {
        return a + b;
    }

    @Exposed(description = "Divide a by b, failing on division by zero.")
    public Ret<Double> divide (double a, double b) {
        return b == 0 ? err("Division by zero") : ok(a / b);
    }

    @Exposed(description = "Greet someone, introducing this actor by name.")
    public String greet (String name) {
        return "Hello %s, I'm %s!".formatted(name, this.name);
    }

    @Exposed(description = "Health check with a fixed response.")
    public String ping () {
        return "pong";
    }

    @Exposed(name = "is_even", description = "Whether the number is even.")
    public boolean isEven (int number) {
        return number % 2 == 0;
    }

    @Exposed(name = "calculate_area", description = "Area of a rectangle.")
    public double calculateArea (double width, double height) {
        return width * height;
    }

    @Exposed(description = "Add one to the counter and return its new value.")
    public int increment () {
        return counter.incrementAndGet();
    }

    @Exposed(name = "get_counter", description = "Current value of the counter.")
    public int counter () {
        return counter.get();
    }

    @Exposed(description = "Name and counter of this actor.")
    public String info () {
        return "Greeter '%s' with counter %d".formatted(name, counter.get());
    }

    /// Public but not exposed: unreachable over the network.
    public void reset () {
        counter.set(0);
    }

}
