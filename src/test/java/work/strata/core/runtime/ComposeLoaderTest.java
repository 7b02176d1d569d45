package work.strata.core.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ComposeLoaderTest {
    @Test
    void expandsShortOperationNames() {
        assertEquals("strata://container/exec@1", ComposeLoader.canonicalizeId("container/exec"));
        assertEquals("strata://container/exec@1", ComposeLoader.canonicalizeId("./container/exec"));
        assertEquals("strata://container/exec@2", ComposeLoader.canonicalizeId("container/exec@2"));
        assertEquals("strata://file/contents@1", ComposeLoader.canonicalizeId("strata://file/contents@1"));
    }

    @Test
    void parsesStepsWithNestedValues() throws IOException {
        String yaml = String.join("\n",
            "compose:",
            "  - call: container/exec",
            "    in:",
            "      id: $.container",
            "      args: [echo, 1]",
            "    out:",
            "      container: id"
        );

        var steps = ComposeLoader.parseCompose(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));

        assertEquals(1, steps.size());
        assertEquals("strata://container/exec@1", steps.get(0).get("call"));
        @SuppressWarnings("unchecked")
        var in = (Map<String, Object>) steps.get(0).get("in");
        assertEquals(List.of("echo", 1), in.get("args"));
    }

    @Test
    void rejectsNonListCompose() {
        var in = new ByteArrayInputStream("compose: nope\n".getBytes(StandardCharsets.UTF_8));
        assertThrows(IOException.class, () -> ComposeLoader.parseCompose(in));
    }

    @Test
    void documentsWithoutComposeHaveNoSteps() throws IOException {
        var in = new ByteArrayInputStream("name: empty\n".getBytes(StandardCharsets.UTF_8));
        assertTrue(ComposeLoader.parseCompose(in).isEmpty());
    }

    @Test
    void loadsLocalFiles() {
        var steps = ComposeLoader.loadFromLocalFile(Path.of("src", "test", "resources", "composes", "pipeline.yaml"));
        assertEquals("strata://query/container@1", steps.get(0).get("call"));
        assertEquals("strata://file/contents@1", steps.get(steps.size() - 1).get("call"));
    }
}
