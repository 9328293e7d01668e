package info.isaksson.erland.fmuhandler.reduce;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class ReductionConfigJsonTest {

    private static List<String> globs(List<NamePattern> patterns) {
        return patterns.stream().map(p -> p.glob).collect(Collectors.toList());
    }

    @Test
    void expandsComponentObjects() throws IOException {
        ReductionConfig config = ReductionConfigJson.readFromString("""
                {
                  "keep_elements": ["*.gain", {"Motor": ["J", "R*"], "Gear": ["ratio"]}],
                  "delete_elements": ["*"],
                  "comment": "ignored"
                }
                """);

        assertEquals(List.of("*.gain", "Motor.J", "Motor.R*", "Gear.ratio"), globs(config.keep));
        assertEquals(List.of("*"), globs(config.delete));
    }

    @Test
    void keepWinsOverDelete() throws IOException {
        ReductionConfig config = ReductionConfigJson.readFromString("""
                {"keep_elements": [{"Motor": ["J"]}], "delete_elements": ["Motor.*", "Load.m"]}
                """);

        assertFalse(config.shouldDelete("Motor.J"));
        assertTrue(config.shouldDelete("Motor.R"));
        assertTrue(config.shouldDelete("Load.m"));
        assertFalse(config.shouldDelete("Load.d"));
    }

    @Test
    void missingListsAreEmpty() throws IOException {
        ReductionConfig config = ReductionConfigJson.readFromString("{}");
        assertTrue(config.keep.isEmpty());
        assertTrue(config.isEmpty());
        assertFalse(config.shouldDelete("anything"));
    }

    @Test
    void rejectsWrongShapes() {
        assertThrows(JsonProcessingException.class, () -> ReductionConfigJson.readFromString("[]"));
        assertThrows(JsonProcessingException.class, () -> ReductionConfigJson.readFromString("{\"delete_elements\": \"*\"}"));
        assertThrows(JsonProcessingException.class, () -> ReductionConfigJson.readFromString("{\"delete_elements\": [1]}"));
        assertThrows(JsonProcessingException.class,
                () -> ReductionConfigJson.readFromString("{\"delete_elements\": [{\"Motor\": \"J\"}]}"));
        assertThrows(JsonProcessingException.class, () -> ReductionConfigJson.readFromString("{not json"));
    }
}
