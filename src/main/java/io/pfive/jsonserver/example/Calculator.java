// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.jsonserver.example;

import io.pfive.jsonserver.dispatch.MethodRegistry;
import io.pfive.jsonserver.util.Ret;

import static io.pfive.jsonserver.util.Ret.err;
import static io.pfive.jsonserver.util.Ret.ok;

/// A calculator with one memory cell holding the most recent result. Its operations are
/// registered explicitly, each with a record describing its parameters.
///
/// Many connections may call the same instance at once, so the memory is guarded by the
/// instance lock.
public class Calculator {

    public static final String INFO = "Simple JSON Calculator v1.0";

    public record Operands (double a, double b) { }

    public static final MethodRegistry<Calculator> REGISTRY = MethodRegistry.builder(Calculator.class)
        .method("add", "Add two numbers.", Operands.class, Double.class, (c, p) -> c.add(p.a(), p.b()))
        .method("subtract", "Subtract b from a.", Operands.class, Double.class, (c, p) -> c.subtract(p.a(), p.b()))
        .method("multiply", "Multiply two numbers.", Operands.class, Double.class, (c, p) -> c.multiply(p.a(), p.b()))
        .method("divide", "Divide a by b, failing on division by zero.", Operands.class, Ret.class,
            (c, p) -> c.divide(p.a(), p.b()))
        .method("divide_rounded", "Divide a by b and round to the nearest whole number.", Operands.class,
            Ret.class, (c, p) -> c.divideRounded(p.a(), p.b()))
        .method("get_memory", "The most recent result.", Double.class, Calculator::memory)
        .method("clear_memory", "Reset the memory to zero.", String.class, Calculator::clearMemory)
        .method("info", "Name and version of this calculator.", String.class, Calculator::info)
        .build();

    private double memory = 0;

    public double add (double a, double b) {
        return remember(a + b);
    }

    public double subtract (double a, double b) {
        return remember(a - b);
    }

    public double multiply (double a, double b) {
        return remember(a * b);
    }

    public Ret<Double> divide (double a, double b) {
        if (b == 0) return err("Division by zero");
        return ok(remember(a / b));
    }

    public Ret<Long> divideRounded (double a, double b) {
        Ret<Double> quotient = divide(a, b);
        if (quotient.isOk()) return ok(Math.round(quotient.get()));
        return quotient.propagate();
    }

    public synchronized double memory () {
        return memory;
    }

    public synchronized String clearMemory () {
        memory = 0;
        return "Memory cleared";
    }

    public String info () {
        return INFO;
    }

    private synchronized double remember (double result) {
        memory = result;
        return result;
    }

}
