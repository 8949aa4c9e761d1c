package work.cliforge.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Fully resolved HTTP step request. Header order follows the specification.
 */
public record HttpStepRequest(String method, String url, Map<String, String> headers, Optional<String> body) {
    public HttpStepRequest {
        headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        body = body == null ? Optional.empty() : body;
    }
}
