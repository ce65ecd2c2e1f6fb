// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.jsonserver.example;

import io.pfive.jsonserver.dispatch.Dispatcher;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CalculatorTest {

    private final Dispatcher<Calculator> calculator = new Dispatcher<>(Calculator.REGISTRY, new Calculator());

    @Test
    void arithmetic () {
        assertThat(calculator.dispatch("add", "{\"a\": 10.5, \"b\": 5.2}")).isEqualTo("15.7");
        assertThat(calculator.dispatch("subtract", "{\"a\": 10, \"b\": 4}")).isEqualTo("6.0");
        assertThat(calculator.dispatch("multiply", "{\"a\": 2.5, \"b\": 4}")).isEqualTo("10.0");
        assertThat(calculator.dispatch("divide", "{\"a\": 20.0, \"b\": 4.0}")).isEqualTo("{\"Ok\":5.0}");
        assertThat(calculator.dispatch("divide", "{\"a\": 10.0, \"b\": 0.0}")).isEqualTo("{\"Err\":\"Division by zero\"}");
    }

    @Test
    void roundedDivisionPassesErrorsThrough () {
        assertThat(calculator.dispatch("divide_rounded", "{\"a\": 7, \"b\": 2}")).isEqualTo("{\"Ok\":4}");
        assertThat(calculator.dispatch("divide_rounded", "{\"a\": 7, \"b\": 0}"))
            .isEqualTo("{\"Err\":\"Division by zero\"}");
        assertThat(new Calculator().divideRounded(-7, 2).get()).isEqualTo(-3L);
    }

    @Test
    void memoryHoldsLastResult () {
        calculator.dispatch("multiply", "{\"a\": 3, \"b\": 3}");
        assertThat(calculator.dispatch("get_memory", "{}")).isEqualTo("9.0");
        // A failed division leaves the memory alone.
        calculator.dispatch("divide", "{\"a\": 1, \"b\": 0}");
        assertThat(calculator.dispatch("get_memory", "{}")).isEqualTo("9.0");
        assertThat(calculator.dispatch("clear_memory", "{}")).isEqualTo("\"Memory cleared\"");
        assertThat(calculator.dispatch("get_memory", "{}")).isEqualTo("0.0");
    }

    @Test
    void infoAndUnknownMethod () {
        assertThat(calculator.dispatch("info", "{}")).isEqualTo("\"Simple JSON Calculator v1.0\"");
        assertThat(calculator.dispatch("unknown", "{}")).isEqualTo("\"Unknown method: unknown\"");
    }

}
