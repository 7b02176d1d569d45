package work.strata.core.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;
import work.strata.core.error.InvalidReferenceException;

class ImageReferenceTest {
    @Test
    void normalizesOfficialImages() {
        assertEquals("docker.io/library/alpine:latest", ImageReference.parse("alpine").withDefaultTag().toString());
        assertEquals("docker.io/library/alpine:3.19", ImageReference.parse("alpine:3.19").withDefaultTag().toString());
        assertEquals("docker.io/library/alpine:latest", ImageReference.parse("index.docker.io/library/alpine").withDefaultTag().toString());
    }

    @Test
    void keepsUserImagesAndCustomRegistries() {
        assertEquals("docker.io/acme/tool:latest", ImageReference.parse("acme/tool").withDefaultTag().toString());
        assertEquals("ghcr.io/acme/tool:1.0", ImageReference.parse("ghcr.io/acme/tool:1.0").toString());
        assertEquals("localhost:5000/tool:latest", ImageReference.parse("localhost:5000/tool").withDefaultTag().toString());
    }

    @Test
    void digestReferencesGetNoDefaultTag() {
        String digest = "sha256:" + "a".repeat(64);
        var reference = ImageReference.parse("alpine@" + digest).withDefaultTag();
        assertEquals(null, reference.tag());
        assertEquals("docker.io/library/alpine@" + digest, reference.toString());
    }

    @Test
    void rejectsMalformedReferences() {
        assertThrows(InvalidReferenceException.class, () -> ImageReference.parse(""));
        assertThrows(InvalidReferenceException.class, () -> ImageReference.parse("Alpine"));
        assertThrows(InvalidReferenceException.class, () -> ImageReference.parse("alpine:"));
        assertThrows(InvalidReferenceException.class, () -> ImageReference.parse("alpine@sha256:short"));
        assertThrows(InvalidReferenceException.class, () -> ImageReference.parse("a".repeat(64).replace('a', 'f')));
        var ex = assertThrows(InvalidReferenceException.class, () -> ImageReference.parse("bad//path"));
        assertEquals("invalid_reference", ex.code());
    }
}
