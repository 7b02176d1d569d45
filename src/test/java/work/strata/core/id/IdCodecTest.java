package work.strata.core.id;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import org.junit.jupiter.api.Test;
import work.strata.core.error.DecodingException;
import work.strata.core.llb.DefinitionCodec;
import work.strata.core.llb.State;
import work.strata.core.model.ContainerMount;
import work.strata.core.model.ContainerPayload;
import work.strata.core.model.ImageConfig;

class IdCodecTest {
    private static final ContainerMount DATA = new ContainerMount(
        DefinitionCodec.marshal(State.scratch().file("seed.txt", "data"), null), "", "/data");
    private static final ContainerMount CACHE = new ContainerMount(
        DefinitionCodec.marshal(State.scratch().file("seed.txt", "cache"), null), "sub", "/cache");

    @Test
    void roundTripsPayloads() {
        var payload = ContainerPayload.scratch()
            .withFs(DefinitionCodec.marshal(State.image("docker.io/library/alpine:latest"), null))
            .withConfig(ImageConfig.EMPTY.withVariable("A", "1").withWorkingDir("/src"))
            .withMount(DATA)
            .withMount(CACHE);

        String id = IdCodec.encode(payload);

        assertEquals(payload, IdCodec.decode(id, ContainerPayload.class, ContainerPayload::scratch));
    }

    @Test
    void equalPayloadsShareOneIdentity() {
        var first = ContainerPayload.scratch().withConfig(ImageConfig.EMPTY.withUser("root")).withMount(DATA);
        var second = ContainerPayload.scratch().withMount(DATA).withConfig(ImageConfig.EMPTY.withUser("root"));

        assertEquals(IdCodec.encode(first), IdCodec.encode(second));
    }

    @Test
    void mountOrderIsPartOfTheIdentity() {
        var ordered = ContainerPayload.scratch().withMount(DATA).withMount(CACHE);
        var reversed = ContainerPayload.scratch().withMount(CACHE).withMount(DATA);

        assertNotEquals(IdCodec.encode(ordered), IdCodec.encode(reversed));
    }

    @Test
    void identitiesAreUrlSafeWithoutPadding() {
        String id = IdCodec.encode(ContainerPayload.scratch().withConfig(ImageConfig.EMPTY.withVariable("K", "v?>~")));
        assertTrue(id.matches("[A-Za-z0-9_-]+"), id);
    }

    @Test
    void emptyIdDecodesToScratch() {
        assertEquals(ContainerPayload.scratch(), IdCodec.decode("", ContainerPayload.class, ContainerPayload::scratch));
        assertEquals(ContainerPayload.scratch(), IdCodec.decode(null, ContainerPayload.class, ContainerPayload::scratch));
    }

    @Test
    void scratchPayloadRoundTripsThroughANonEmptyId() {
        String id = IdCodec.encode(ContainerPayload.scratch());
        assertNotEquals("", id);
        assertEquals(ContainerPayload.scratch(), IdCodec.decode(id, ContainerPayload.class, ContainerPayload::scratch));
    }

    @Test
    void rejectsMalformedBase64() {
        var ex = assertThrows(DecodingException.class, () -> IdCodec.decode("not base64!", ContainerPayload.class, ContainerPayload::scratch));
        assertEquals("decoding_error", ex.code());
    }

    @Test
    void rejectsNonJsonContent() {
        String id = encodeRaw("definitely not json");
        assertThrows(DecodingException.class, () -> IdCodec.decode(id, ContainerPayload.class, ContainerPayload::scratch));
    }

    @Test
    void rejectsUnknownVersion() {
        String id = encodeRaw("{\"payload\":{},\"v\":2}");
        var ex = assertThrows(DecodingException.class, () -> IdCodec.decode(id, ContainerPayload.class, ContainerPayload::scratch));
        assertTrue(ex.getMessage().contains("version"));
    }

    @Test
    void rejectsUnknownPayloadFields() {
        String id = encodeRaw("{\"payload\":{\"bogus\":true},\"v\":1}");
        assertThrows(DecodingException.class, () -> IdCodec.decode(id, ContainerPayload.class, ContainerPayload::scratch));
    }

    @Test
    void describesPayloadsAsJson() {
        String described = IdCodec.describe(ContainerPayload.scratch().withConfig(ImageConfig.EMPTY.withEnv(List.of("A=1"))));
        assertTrue(described.contains("\"Env\""), described);
    }

    private static String encodeRaw(String json) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(json.getBytes(StandardCharsets.UTF_8));
    }
}
