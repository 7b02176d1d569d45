package work.strata.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import work.strata.core.error.ConfigParseException;

/**
 * The parts of an OCI image configuration document the core reads.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Image(String architecture, String os, ImageConfig config) {
    private static final ObjectMapper JSON = new ObjectMapper();

    public Image {
        config = config == null ? ImageConfig.EMPTY : config;
    }

    public static Image parse(String reference, byte[] document) {
        if (document == null || document.length == 0) {
            throw new ConfigParseException(reference, new IOException("empty document"));
        }
        try {
            Image image = JSON.readValue(document, Image.class);
            if (image == null) {
                throw new ConfigParseException(reference, new IOException("null document"));
            }
            return image;
        } catch (IOException ex) {
            throw new ConfigParseException(reference, ex);
        }
    }
}
