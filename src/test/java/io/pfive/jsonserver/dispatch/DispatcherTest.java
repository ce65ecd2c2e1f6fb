// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.jsonserver.dispatch;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DispatcherTest {

    private final Dispatcher<TestActor> dispatcher = new Dispatcher<>(TestActor.REGISTRY, new TestActor());

    @Test
    void callsMethodWithNamedParameters () {
        assertThat(dispatcher.dispatch("add", "{\"a\": 5, \"b\": 3}")).isEqualTo("8");
        assertThat(dispatcher.dispatch("greet", "{\"name\": \"World\"}")).isEqualTo("\"Hello, World!\"");
        assertThat(dispatcher.dispatch("echo", "{\"words\": [\"a\", \"b\"]}")).isEqualTo("[\"a\",\"b\"]");
    }

    @Test
    void parameterOrderDoesNotMatter () {
        assertThat(dispatcher.dispatch("add", "{\"b\": 3, \"a\": 5}")).isEqualTo("8");
    }

    @Test
    void unknownKeysAreIgnored () {
        assertThat(dispatcher.dispatch("add", "{\"a\": 1, \"b\": 2, \"c\": 99}")).isEqualTo("3");
    }

    @Test
    void zeroParameterMethodAcceptsAnyObject () {
        assertThat(dispatcher.dispatch("ping", "{}")).isEqualTo("\"pong\"");
        assertThat(dispatcher.dispatch("ping", "{\"ignored\": true}")).isEqualTo("\"pong\"");
    }

    @Test
    void optionalValuesMapToNull () {
        assertThat(dispatcher.dispatch("shout", "{\"nickname\": \"bo\"}")).isEqualTo("\"BO\"");
        assertThat(dispatcher.dispatch("shout", "{\"nickname\": null}")).isEqualTo("null");
    }

    @Test
    void unknownMethod () {
        assertThat(dispatcher.dispatch("unknown_method", "{}")).isEqualTo("\"Unknown method: unknown_method\"");
        assertThat(dispatcher.dispatch("", "{}")).isEqualTo("\"Unknown method: \"");
    }

    @Test
    void malformedJsonIsReportedBeforeMethodLookup () {
        assertThat(dispatcher.dispatch("add", "{invalid")).startsWith("\"Failed to parse JSON: ");
        assertThat(dispatcher.dispatch("no_such_method", "{invalid")).startsWith("\"Failed to parse JSON: ");
        assertThat(dispatcher.dispatch("ping", "")).isEqualTo("\"Failed to parse JSON: EOF while parsing a value\"");
        assertThat(dispatcher.dispatch("ping", "{} {}")).startsWith("\"Failed to parse JSON: ");
    }

    @Test
    void parametersOfTheWrongShape () {
        String prefix = "\"Failed to deserialize parameters for add: ";
        assertThat(dispatcher.dispatch("add", "{\"a\": 5}")).startsWith(prefix);
        assertThat(dispatcher.dispatch("add", "{\"a\": \"five\", \"b\": 3}")).startsWith(prefix);
        assertThat(dispatcher.dispatch("add", "{\"a\": 5.5, \"b\": 3}")).startsWith(prefix);
        assertThat(dispatcher.dispatch("add", "{\"a\": null, \"b\": 3}")).startsWith(prefix);
        assertThat(dispatcher.dispatch("add", "[5, 3]")).startsWith(prefix);
        assertThat(dispatcher.dispatch("ping", "42"))
            .startsWith("\"Failed to deserialize parameters for ping: expected a JSON object");
    }

    @Test
    void resultTypeCarriesApplicationErrors () {
        assertThat(dispatcher.dispatch("divide", "{\"a\": 10, \"b\": 4}")).isEqualTo("{\"Ok\":2.5}");
        assertThat(dispatcher.dispatch("divide", "{\"a\": 10, \"b\": 0}")).isEqualTo("{\"Err\":\"Division by zero\"}");
    }

    @Test
    void thrownExceptionBecomesInvocationError () {
        assertThat(dispatcher.dispatch("explode", "{}"))
            .isEqualTo("\"Method explode failed: IllegalStateException: kaboom\"");
    }

    @Test
    void unserializableResult () {
        assertThat(dispatcher.dispatch("opaque", "{}")).startsWith("\"Failed to serialize result for opaque: ");
    }

    @Test
    void completionStagesAreAwaited () {
        assertThat(dispatcher.dispatch("later", "{}")).isEqualTo("42");
        assertThat(dispatcher.dispatch("laterFailing", "{}"))
            .isEqualTo("\"Method laterFailing failed: IllegalArgumentException: no result\"");
    }

    @Test
    void repeatedCallsGiveIdenticalResults () {
        String first = dispatcher.dispatch("greet", "{\"name\": \"again\"}");
        assertThat(dispatcher.dispatch("greet", "{\"name\": \"again\"}")).isEqualTo(first);
    }

    @Test
    void concurrentCallsLoseNoUpdates () throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<String>> futures = new ArrayList<>();
            for (int i = 0; i < 400; i++) {
                futures.add(executor.submit(() -> dispatcher.dispatch("increment", "{}")));
            }
            for (Future<String> future : futures) {
                future.get();
            }
        } finally {
            executor.shutdown();
        }
        assertThat(dispatcher.dispatch("count", "{}")).isEqualTo("400");
    }

    @Test
    void requiresActor () {
        assertThatThrownBy(() -> new Dispatcher<>(TestActor.REGISTRY, null))
            .isInstanceOf(IllegalArgumentException.class);
    }

}
