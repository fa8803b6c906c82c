package me.golemcore.deck.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.deck.domain.model.GenerationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GenerationResultCodecTest {

    private static final String PARSE_ERROR = "Could not parse generation result: ";

    private GenerationResultCodec codec;

    @BeforeEach
    void setUp() {
        codec = new GenerationResultCodec(new ObjectMapper());
    }

    @Test
    void shouldPrefixEncodedPayloadWithMarker() {
        String encoded = codec.encode(true, "Created 2 slides", 2,
                List.of("slides/slide_1.html", "slides/slide_2.html"));

        assertTrue(encoded.startsWith(GenerationResultCodec.MARKER + " {"));
        assertTrue(encoded.contains("\"slide_count\":2"));
        assertTrue(codec.isCompletionText(encoded));
    }

    @Test
    void shouldDecodeWhatWasEncoded() {
        GenerationResult original = GenerationResult.builder()
                .success(true)
                .message("Created 2 slides")
                .slideCount(2)
                .slideFiles(List.of("slides/slide_1.html", "slides/slide_2.html"))
                .build();

        GenerationResult decoded = codec.decode(codec.encode(original));

        assertTrue(decoded.isSuccess());
        assertEquals("Created 2 slides", decoded.getMessage());
        assertEquals(2, decoded.getSlideCount());
        assertEquals(original.getSlideFiles(), decoded.getSlideFiles());
    }

    @Test
    void shouldDecodeMarkerFoundInsideSurroundingText() {
        GenerationResult decoded = codec.decode("Result follows. " + GenerationResultCodec.MARKER
                + " {\"success\":false,\"message\":\"nope\",\"slide_count\":0,\"slide_files\":[]}");

        assertFalse(decoded.isSuccess());
        assertEquals("nope", decoded.getMessage());
        assertEquals(0, decoded.getSlideFiles().size());
    }

    @Test
    void shouldAcceptWholeFloatingSlideCount() {
        GenerationResult decoded = codec.decode(GenerationResultCodec.MARKER
                + " {\"success\":true,\"message\":\"ok\",\"slide_count\":3.0,\"slide_files\":[\"a\"]}");

        assertTrue(decoded.isSuccess());
        assertEquals(3, decoded.getSlideCount());
    }

    @Test
    void shouldFailWhenMarkerIsMissing() {
        GenerationResult decoded = codec.decode("{\"success\":true}");

        assertFalse(decoded.isSuccess());
        assertTrue(decoded.getMessage().startsWith(PARSE_ERROR));
    }

    @Test
    void shouldFailOnMalformedJson() {
        GenerationResult decoded = codec.decode(GenerationResultCodec.MARKER + " {not json");

        assertFalse(decoded.isSuccess());
        assertTrue(decoded.getMessage().startsWith(PARSE_ERROR));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "{\"success\":\"yes\",\"message\":\"m\",\"slide_count\":1,\"slide_files\":[]}",
            "{\"message\":\"m\",\"slide_count\":1,\"slide_files\":[]}",
            "{\"success\":true,\"message\":\"m\",\"slide_count\":\"two\",\"slide_files\":[]}",
            "{\"success\":true,\"message\":\"m\",\"slide_count\":1.5,\"slide_files\":[]}",
            "{\"success\":true,\"message\":\"m\",\"slide_count\":4294967298,\"slide_files\":[]}",
            "{\"success\":true,\"message\":\"m\",\"slide_count\":1,\"slide_files\":\"slides/slide_1.html\"}",
            "{\"success\":true,\"message\":\"m\",\"slide_count\":1,\"slide_files\":[1]}",
            "{\"success\":true,\"message\":7,\"slide_count\":1,\"slide_files\":[]}",
            "[true]"
    })
    void shouldRejectPayloadWithWrongShape(String payload) {
        GenerationResult decoded = codec.decode(GenerationResultCodec.MARKER + " " + payload);

        assertFalse(decoded.isSuccess());
        assertTrue(decoded.getMessage().startsWith(PARSE_ERROR), decoded.getMessage());
    }
}
