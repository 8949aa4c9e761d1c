package work.cliforge.value;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;

/**
 * Jackson configuration shared by step bodies, {@code jsonencode} and json output.
 */
public final class JsonCodec {
    private static final ObjectMapper JSON = new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    private static final ObjectWriter PRETTY = JSON.writer(new JsonPrinter());

    private JsonCodec() {}

    public static String compact(Value value) throws JsonProcessingException {
        return JSON.writeValueAsString(Values.toJava(value));
    }

    public static String pretty(Value value) throws JsonProcessingException {
        return PRETTY.writeValueAsString(Values.toJava(value));
    }

    /**
     * Parses a response body: JSON when it is a complete JSON document, otherwise the raw text. Empty text is null.
     */
    public static Value parseLenient(String text) {
        if (text == null || text.isEmpty()) {
            return Value.NULL;
        }
        try {
            return Values.fromJava(JSON.readValue(text, Object.class));
        } catch (JsonProcessingException notJson) {
            return new Value.StringValue(text);
        }
    }
}
