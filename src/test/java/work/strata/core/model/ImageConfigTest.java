package work.strata.core.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ImageConfigTest {
    @Test
    void withVariableMovesTheBindingToTheEnd() {
        var config = ImageConfig.EMPTY.withEnv(List.of("A=1", "B=2"));
        assertEquals(List.of("B=2", "A=9"), config.withVariable("A", "9").env());
    }

    @Test
    void withVariableDropsEveryEarlierBinding() {
        var config = ImageConfig.EMPTY.withEnv(List.of("A=1", "A=2", "AB=3"));
        assertEquals(List.of("AB=3", "A=4"), config.withVariable("A", "4").env());
    }

    @Test
    void readsAndRemovesVariables() {
        var config = ImageConfig.EMPTY.withEnv(List.of("PATH=/bin", "HOME=/root"));
        assertEquals(Optional.of("/root"), config.variable("HOME"));
        assertEquals(Optional.empty(), config.variable("HOM"));
        assertEquals(List.of("PATH=/bin"), config.withoutVariable("HOME").env());
    }

    @Test
    void unsetAndEmptyFieldsAreEqual() {
        var explicit = new ImageConfig("", null, List.of(), null, null, null, "", null, null);
        assertEquals(ImageConfig.EMPTY, explicit);
    }

    @Test
    void parsesOciConfigDocuments() {
        String document = "{"
            + "\"architecture\":\"amd64\",\"os\":\"linux\","
            + "\"config\":{\"Env\":[\"PATH=/bin\"],\"WorkingDir\":\"/app\",\"Entrypoint\":[\"/entry\"],"
            + "\"User\":\"1000\",\"Hostname\":\"ignored\",\"Labels\":{\"a\":\"b\"}},"
            + "\"rootfs\":{\"type\":\"layers\",\"diff_ids\":[]}"
            + "}";

        var image = Image.parse("docker.io/library/app:latest", document.getBytes(StandardCharsets.UTF_8));

        assertEquals("amd64", image.architecture());
        assertEquals(List.of("PATH=/bin"), image.config().env());
        assertEquals("/app", image.config().workingDir());
        assertEquals(List.of("/entry"), image.config().entrypoint());
        assertEquals("1000", image.config().user());
        assertTrue(image.config().labels().containsKey("a"));
    }
}
