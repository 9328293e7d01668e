package info.isaksson.erland.fmuhandler.reduce;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Reads reduction configs.
 *
 * <pre>{@code
 * {
 *   "keep_elements":   ["*.gain", {"Motor": ["J", "R*"]}],
 *   "delete_elements": ["*"]
 * }
 * }</pre>
 *
 * <p>An entry is either a pattern or an object mapping a component name to parameter patterns;
 * {@code {"Motor": ["J"]}} is short for {@code "Motor.J"}. Missing lists are empty, other keys are
 * ignored.</p>
 */
public final class ReductionConfigJson {

    public static final String KEEP_ELEMENTS = "keep_elements";
    public static final String DELETE_ELEMENTS = "delete_elements";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ReductionConfigJson() {}

    public static ReductionConfig read(Path path) throws IOException {
        if (path == null) throw new IllegalArgumentException("path is null");
        try (var in = Files.newInputStream(path)) {
            return fromTree(MAPPER.readTree(in));
        }
    }

    public static ReductionConfig readFromString(String json) throws IOException {
        if (json == null) throw new IllegalArgumentException("json is null");
        return fromTree(MAPPER.readTree(json));
    }

    private static ReductionConfig fromTree(JsonNode root) throws IOException {
        if (root == null || !root.isObject()) {
            throw invalid("top level must be a JSON object");
        }
        return ReductionConfig.ofGlobs(globs(root, KEEP_ELEMENTS), globs(root, DELETE_ELEMENTS));
    }

    static List<String> globs(JsonNode root, String key) throws IOException {
        List<String> out = new ArrayList<>();
        JsonNode list = root.get(key);
        if (list == null || list.isNull()) return out;
        if (!list.isArray()) {
            throw invalid(key + " must be an array");
        }
        for (JsonNode element : list) {
            if (element.isTextual()) {
                out.add(element.asText());
            } else if (element.isObject()) {
                Iterator<Map.Entry<String, JsonNode>> fields = element.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> component = fields.next();
                    if (!component.getValue().isArray()) {
                        throw invalid(key + ": parameters of " + component.getKey() + " must be an array");
                    }
                    for (JsonNode parameter : component.getValue()) {
                        if (!parameter.isTextual()) {
                            throw invalid(key + ": parameter names of " + component.getKey() + " must be strings");
                        }
                        out.add(component.getKey() + "." + parameter.asText());
                    }
                }
            } else {
                throw invalid(key + " entries must be strings or objects, found " + element.getNodeType());
            }
        }
        return out;
    }

    private static JsonMappingException invalid(String message) {
        return JsonMappingException.from((JsonParser) null, "Invalid reduction config: " + message);
    }
}
