package work.cliforge.render;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.cliforge.plan.OutputFormat;
import work.cliforge.value.Value;
import work.cliforge.value.Values;

class OutputRendererTest {
    private static Map<String, Object> record(Object... entries) {
        var map = new LinkedHashMap<String, Object>();
        for (int i = 0; i < entries.length; i += 2) {
            map.put((String) entries[i], entries[i + 1]);
        }
        return map;
    }

    @Test
    void tableWithExplicitColumns() {
        var rows = Values.fromJava(List.of(
            record("id", 1, "name", "alpha", "status", "ok"),
            record("id", 2, "name", "beta")
        ));
        var rendered = OutputRenderer.render(OutputFormat.TABLE, rows, List.of("id", "name", "status"));
        assertEquals("id\tname\tstatus\n1\talpha\tok\n2\tbeta\t\n", rendered);
    }

    @Test
    void tableColumnsDefaultToFirstRecordOrder() {
        var rows = Values.fromJava(List.of(
            record("zeta", "z", "alpha", "a"),
            record("alpha", "b", "extra", "ignored")
        ));
        assertEquals("zeta\talpha\nz\ta\n\tb\n", OutputRenderer.render(OutputFormat.TABLE, rows, List.of()));
    }

    @Test
    void presentNullsPrintAndNonRecordsAreSkipped() {
        var rows = Values.fromJava(Arrays.asList(record("id", null), "stray", record("id", 3)));
        assertEquals("id\nnull\n3\n", OutputRenderer.render(OutputFormat.TABLE, rows, List.of()));
    }

    @Test
    void emptyTableWithoutColumnsPrintsNothing() {
        assertEquals("", OutputRenderer.render(OutputFormat.TABLE, Values.fromJava(List.of()), List.of()));
        assertEquals("id\n", OutputRenderer.render(OutputFormat.TABLE, Values.fromJava(List.of()), List.of("id")));
    }

    @Test
    void tableRequiresAnArray() {
        var ex = assertThrows(
            RenderException.class,
            () -> OutputRenderer.render(OutputFormat.TABLE, Values.fromJava(Map.of("a", 1)), List.of())
        );
        assertEquals("table output requires an array", ex.getMessage());
    }

    @Test
    void jsonIsPrettyWithTrailingNewline() {
        var rendered = OutputRenderer.render(OutputFormat.JSON, Values.fromJava(record("a", 1, "b", null)), List.of());
        assertEquals("{\n  \"a\": 1,\n  \"b\": null\n}\n", rendered);
        assertEquals("null\n", OutputRenderer.render(OutputFormat.JSON, Value.NULL, List.of()));
    }

    @Test
    void textUsesTheDefaultRepresentation() {
        assertEquals("[a, b]\n", OutputRenderer.render(OutputFormat.TEXT, Values.fromJava(List.of("a", "b")), List.of()));
        assertEquals("plain\n", OutputRenderer.render(OutputFormat.TEXT, Value.of("plain"), List.of()));
    }
}
