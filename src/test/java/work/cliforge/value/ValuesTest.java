package work.cliforge.value;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ValuesTest {
    @Test
    void defaultRepresentationMatchesJavaToString() {
        var map = new LinkedHashMap<String, Object>();
        map.put("id", 7);
        map.put("tags", Arrays.asList("a", null));
        map.put("nested", Map.of("ok", true));
        map.put("none", null);

        var value = Values.fromJava(map);
        assertEquals(String.valueOf(map), Values.stringify(value));
        assertEquals("{id=7, tags=[a, null], nested={ok=true}, none=null}", Values.stringify(value));
    }

    @Test
    void stringsAreVerbatimAndNullIsSpelledOut() {
        assertEquals("plain", Values.stringify(Value.of("plain")));
        assertEquals("null", Values.stringify(Value.NULL));
        assertEquals("2.5", Values.stringify(Value.of(2.5)));
    }

    @Test
    void convertsBackToPlainJavaInOrder() {
        var items = new ArrayList<Object>();
        items.add(1L);
        items.add(null);
        var map = new LinkedHashMap<String, Object>();
        map.put("z", items);
        map.put("a", "x");

        var java = Values.toJava(Values.fromJava(map));
        assertEquals(map, java);
        assertEquals(List.of("z", "a"), List.copyOf(((Map<?, ?>) java).keySet()));
    }

    @Test
    void lookupIsLenient() {
        var value = Values.fromJava(Map.of("body", Map.of("data", "text")));
        assertEquals(Value.of("text"), Values.lookup(value, List.of("body", "data")));
        assertEquals(Value.NULL, Values.lookup(value, List.of("body", "data", "deeper")));
        assertEquals(Value.NULL, Values.lookup(value, List.of("status")));
        assertEquals(value, Values.lookup(value, List.of()));
        assertNull(Values.toJava(Values.lookup(Value.of("scalar"), List.of("x"))));
    }
}
