package work.cliforge.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.cliforge.plan.ActionPlan;
import work.cliforge.plan.ActionPlanner;
import work.cliforge.runtime.ExecutionContext.CancellationToken;
import work.cliforge.spec.SpecificationLoader;

class ActionExecutorTest {
    private static final String SPEC = """
        name: app
        flags:
          - name: host
        commands:
          - name: sync
            args:
              - name: id
                required: true
            action:
              steps:
                - name: first
                  url: "${flag.host}/items/${arg.id}"
                - name: second
                  method: put
                  url: "${flag.host}/next/${step.first.body.next}"
                  headers:
                    X-Count: "${step.first.status}"
                  body:
                    previous: "${step.first.body}"
              output:
                format: text
                data: "${step.second.body.result}"
        """;

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
    private final List<HttpStepRequest> sent = new ArrayList<>();

    private static ActionPlan plan() {
        var spec = SpecificationLoader.fromString(SPEC);
        return ActionPlanner.plan(spec.flags(), spec.commands().get(0), "sync");
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void laterStepsResolveAgainstEarlierResults() {
        StepTransport transport = (request, token) -> {
            sent.add(request);
            return request.url().endsWith("/items/42")
                ? new HttpStepResponse(200, "{\"next\":\"n1\"}")
                : new HttpStepResponse(201, "{\"result\":\"done\"}");
        };
        new ActionExecutor(plan(), transport).execute(Map.of("host", "http://h"), List.of("42"), new ExecutionContext(out));

        assertEquals("http://h/items/42", sent.get(0).url());
        assertEquals("GET", sent.get(0).method());
        var second = sent.get(1);
        assertEquals("PUT", second.method());
        assertEquals("http://h/next/n1", second.url());
        assertEquals(Map.of("X-Count", "200"), second.headers());
        assertEquals("{\"previous\":{\"next\":\"n1\"}}", second.body().orElseThrow());
        assertEquals("done\n", output());
    }

    @Test
    void failingStepAbortsBeforeOutputAndNamesTheStep() {
        StepTransport transport = (request, token) -> {
            sent.add(request);
            if (sent.size() == 2) {
                throw new IOException("connection refused");
            }
            return new HttpStepResponse(200, "{}");
        };
        var executor = new ActionExecutor(plan(), transport);
        var ex = assertThrows(
            StepExecutionException.class,
            () -> executor.execute(Map.of("host", "http://h"), List.of("1"), new ExecutionContext(out))
        );
        assertEquals("second", ex.step());
        assertEquals("step \"second\" failed: connection refused", ex.getMessage());
        assertEquals("step_failed", ex.code());
        assertEquals("", output());
    }

    @Test
    void nonSuccessStatusFailsTheStep() {
        StepTransport transport = (request, token) -> new HttpStepResponse(404, "{\"errors\":[]}");
        var executor = new ActionExecutor(plan(), transport);
        var ex = assertThrows(
            StepExecutionException.class,
            () -> executor.execute(Map.of("host", "http://h"), List.of("1"), new ExecutionContext(out))
        );
        assertEquals("step \"first\" failed: HTTP 404: {\"errors\":[]}", ex.getMessage());
    }

    @Test
    void cancelledScopeStopsBeforeTheNextStep() {
        var token = new CancellationToken();
        StepTransport transport = (request, t) -> {
            sent.add(request);
            token.cancel();
            return new HttpStepResponse(200, "{}");
        };
        var executor = new ActionExecutor(plan(), transport);
        var ex = assertThrows(
            StepExecutionException.class,
            () -> executor.execute(Map.of("host", "http://h"), List.of("1"), new ExecutionContext(out, token))
        );
        assertEquals(1, sent.size());
        assertEquals("second", ex.step());
        assertInstanceOf(ExecutionContext.ExecutionCancelledException.class, ex.getCause());
    }

    @Test
    void headersMustBeAnObject() {
        var spec = SpecificationLoader.fromString("""
            name: app
            commands:
              - name: go
                action:
                  steps:
                    - name: bad
                      url: http://h
                      headers: "X-Token: 1"
            """);
        var plan = ActionPlanner.plan(spec.flags(), spec.commands().get(0), "go");
        StepTransport transport = (request, token) -> new HttpStepResponse(200, "");
        var ex = assertThrows(
            StepExecutionException.class,
            () -> new ActionExecutor(plan, transport).execute(Map.of(), List.of(), new ExecutionContext(out))
        );
        assertTrue(ex.getMessage().endsWith("headers must resolve to an object"), ex.getMessage());
    }

    @Test
    void missingOptionalArgIsNull() {
        var spec = SpecificationLoader.fromString("""
            name: app
            commands:
              - name: show
                args:
                  - name: label
                action:
                  output:
                    format: text
                    data: "label=${arg.label}"
            """);
        var plan = ActionPlanner.plan(spec.flags(), spec.commands().get(0), "show");
        new ActionExecutor(plan, (request, token) -> null).execute(Map.of(), List.of(), new ExecutionContext(out));
        assertEquals("label=null\n", output());
    }
}
