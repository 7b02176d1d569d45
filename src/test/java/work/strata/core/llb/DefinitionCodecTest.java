package work.strata.core.llb;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.strata.core.error.DecodingException;

class DefinitionCodecTest {
    private static final State ALPINE = State.image("docker.io/library/alpine:latest");

    @Test
    void scratchMarshalsToTheEmptyDefinition() {
        var definition = DefinitionCodec.marshal(State.scratch(), Platform.DEFAULT);
        assertTrue(definition.isEmpty());
        assertTrue(DefinitionCodec.unmarshal(definition).isScratch());
    }

    @Test
    void unmarshalRebuildsTheSameState() {
        var exec = ALPINE.file("etc/motd", "hello").run(RunSpec.builder()
            .args(List.of("/bin/sh", "-c", "true"))
            .env("A", "1")
            .dir("/work")
            .mount("/data", State.scratch().file("seed", "x"), "sub")
            .mount("/tmp", State.scratch())
            .build());

        for (State state : List.of(exec.root(), exec.mount("/data"), exec.mountAt(1))) {
            assertEquals(state, DefinitionCodec.unmarshal(DefinitionCodec.marshal(state, null)));
        }
    }

    @Test
    void marshalingIsStable() {
        var state = ALPINE.file("a.txt", "a").file("b.txt", "b");
        var first = DefinitionCodec.marshal(state, Platform.DEFAULT);
        var second = DefinitionCodec.marshal(state, Platform.DEFAULT);

        assertEquals(first, second);
        assertEquals(first.digest(), second.digest());
        assertTrue(first.digest().startsWith("sha256:"));
    }

    @Test
    void sharedInputsAreWrittenOnce() {
        var exec = ALPINE.run(RunSpec.builder()
            .args(List.of("true"))
            .mount("/alpine", ALPINE)
            .build());

        var definition = DefinitionCodec.marshal(exec.root(), null);

        // source, exec, output
        assertEquals(3, definition.nodes().size());
    }

    @Test
    void platformChangesTheDefinitionButNotTheState() {
        var linuxArm = Platform.parse("linux/arm64/v8");
        var stamped = DefinitionCodec.marshal(ALPINE, linuxArm);
        var plain = DefinitionCodec.marshal(ALPINE, null);

        assertNotEquals(stamped, plain);
        assertEquals(DefinitionCodec.unmarshal(stamped), DefinitionCodec.unmarshal(plain));
    }

    @Test
    void rejectsMalformedDefinitions() {
        assertThrows(DecodingException.class, () -> DefinitionCodec.unmarshal(new Definition(List.of("not json"))));
        assertThrows(DecodingException.class, () -> DefinitionCodec.unmarshal(new Definition(List.of("{\"kind\":\"source\"}"))));
        assertThrows(DecodingException.class, () -> DefinitionCodec.unmarshal(
            new Definition(List.of("{\"inputs\":[{\"digest\":\"sha256:missing\",\"output\":0}],\"kind\":\"output\"}"))));
    }
}
