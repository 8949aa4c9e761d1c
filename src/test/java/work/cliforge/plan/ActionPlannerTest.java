package work.cliforge.plan;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.cliforge.expr.Expression;
import work.cliforge.render.RenderException;
import work.cliforge.spec.SpecificationLoader;
import work.cliforge.value.Value;

class ActionPlannerTest {
    private static final String SPEC = """
        name: vault
        flags:
          - name: address
        commands:
          - name: kv
            flags:
              - name: mount
            commands:
              - name: get
                args:
                  - name: path
                    required: true
                  - name: version
                flags:
                  - name: field
                action:
                  steps:
                    - name: read
                      method: post
                      url: "${flag.address}/v1/${arg.path}"
                    - name: meta
                      url: "${flag.address}/meta"
                  output:
                    format: table
              - name: ping
                action:
                  output:
                    format: text
        """;

    @Test
    void plansVisibleNamesStepsAndOutput() {
        var spec = SpecificationLoader.fromString(SPEC);
        var get = spec.commands().get(0).commands().get(0);
        var plan = ActionPlanner.plan(spec.flags(), get, "kv get");

        assertEquals("kv get", plan.commandPath());
        assertEquals(List.of("address", "field"), plan.flagNames());
        assertEquals(List.of("path", "version"), plan.argNames());
        assertEquals(1, plan.argPosition("version"));
        assertEquals("POST", plan.steps().get(0).method());
        assertEquals("GET", plan.steps().get(1).method());
        var output = plan.output().orElseThrow();
        assertEquals(OutputFormat.TABLE, output.format());
        assertEquals(Expression.step("meta"), output.data());
    }

    @Test
    void dataIsNullWithoutSteps() {
        var spec = SpecificationLoader.fromString(SPEC);
        var ping = spec.commands().get(0).commands().get(1);
        var plan = ActionPlanner.plan(spec.flags(), ping, "kv ping");
        assertEquals(Expression.literal(Value.NULL), plan.output().orElseThrow().data());
    }

    @Test
    void usageListsRequiredAndOptionalArgs() {
        var spec = SpecificationLoader.fromString(SPEC);
        var shape = CommandShape.of(spec.commands().get(0).commands().get(0));
        assertEquals("get <path> [version]", shape.usage());
        assertEquals(new ArityPolicy(1, 2), shape.arity());
    }

    @Test
    void unknownFormatsAreRenderErrors() {
        var ex = assertThrows(RenderException.class, () -> OutputFormat.parse("yaml"));
        assertEquals("render_error", ex.code());
        assertEquals(OutputFormat.JSON, OutputFormat.parse(null));
        assertEquals(OutputFormat.TEXT, OutputFormat.parse("Text"));
    }
}
