package com.openapi.simpleDeref.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openapi.simpleDeref.model.Encoding;
import com.openapi.simpleDeref.model.Header;
import com.openapi.simpleDeref.model.JsonSchema;
import com.openapi.simpleDeref.model.ParameterStyle;
import com.openapi.simpleDeref.reference.ReferenceOr;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EncodingCodecTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private OpenApiReader reader;
    private OpenApiWriter writer;

    @BeforeEach
    void setUp() {
        reader = new OpenApiReader();
        writer = new OpenApiWriter();
    }

    @Test
    @DisplayName("Should survive a round trip with non-default settings")
    void testRoundTripWithNonDefaults() throws Exception {
        Encoding encoding = new Encoding(
            List.of("application/xml", "application/json"),
            Map.of("X-Rate", ReferenceOr.component("RateLimit", Header.class),
                "X-Trace", ReferenceOr.value(Header.of(ReferenceOr.value(JsonSchema.ofType("string"))))),
            ParameterStyle.DEEP_OBJECT,
            true,
            true,
            Map.of("x-custom", mapper.readTree("{\"nested\": [1, 2]}")));

        ObjectNode encoded = writer.write(encoding);

        assertThat(encoded.get("contentType").asText()).isEqualTo("application/xml, application/json");
        assertThat(encoded.get("style").asText()).isEqualTo("deepObject");
        assertThat(encoded.get("explode").asBoolean()).isTrue();
        assertThat(encoded.get("allowReserved").asBoolean()).isTrue();
        assertThat(encoded.get("headers").get("X-Rate").get("$ref").asText()).isEqualTo("#/components/headers/RateLimit");
        assertThat(reader.readEncoding(encoded)).isEqualTo(encoding);
    }

    @Test
    @DisplayName("Should omit style, explode and allowReserved when they equal their defaults")
    void testDefaultsAreOmitted() throws Exception {
        Encoding encoding = Encoding.of(List.of("text/plain"));

        ObjectNode encoded = writer.write(encoding);

        assertThat(encoded.has("style")).isFalse();
        assertThat(encoded.has("explode")).isFalse();
        assertThat(encoded.has("allowReserved")).isFalse();
        assertThat(encoded.get("contentType").asText()).isEqualTo("text/plain");

        Encoding decoded = reader.readEncoding(encoded);
        assertThat(decoded.style()).isEqualTo(ParameterStyle.FORM);
        assertThat(decoded.explode()).isTrue();
        assertThat(decoded.allowReserved()).isFalse();
        assertThat(decoded).isEqualTo(encoding);
    }

    @Test
    void testExplodeDefaultFollowsDeclaredStyle() throws Exception {
        Encoding decoded = reader.readEncoding(mapper.readTree("{\"style\": \"spaceDelimited\"}"));

        assertThat(decoded.style()).isEqualTo(ParameterStyle.SPACE_DELIMITED);
        assertThat(decoded.explode()).isFalse();

        Encoding formNotExploded = new Encoding(null, null, ParameterStyle.FORM, false, false, null);
        ObjectNode encoded = writer.write(formNotExploded);
        assertThat(encoded.has("style")).isFalse();
        assertThat(encoded.get("explode").asBoolean()).isFalse();
        assertThat(reader.readEncoding(encoded)).isEqualTo(formNotExploded);
    }

    @Test
    @DisplayName("Should keep x- extensions and drop other unknown keys")
    void testExtensionsSurviveUnknownKeysDoNot() throws Exception {
        JsonNode source = mapper.readTree("""
            {
              "contentType": "image/png , image/jpeg",
              "x-custom": {"level": 3},
              "x-flag": true,
              "unknownField": "dropped"
            }
            """);

        Encoding decoded = reader.readEncoding(source);
        ObjectNode encoded = writer.write(decoded);

        assertThat(decoded.contentTypes()).containsExactly("image/png", "image/jpeg");
        assertThat(decoded.vendorExtensions()).containsOnlyKeys("x-custom", "x-flag");
        assertThat(encoded.get("x-custom")).isEqualTo(source.get("x-custom"));
        assertThat(encoded.get("x-flag").asBoolean()).isTrue();
        assertThat(encoded.has("unknownField")).isFalse();
    }

    @Test
    @DisplayName("Should keep the model unchanged when the written or read JSON is edited afterwards")
    void testJsonEditsDoNotReachTheModel() throws Exception {
        ObjectNode level = (ObjectNode) mapper.readTree("{\"level\": 3}");
        Encoding encoding = new Encoding(List.of("text/plain"), null, ParameterStyle.FORM, true, false,
            Map.of("x-custom", level));
        Encoding copy = new Encoding(List.of("text/plain"), null, ParameterStyle.FORM, true, false,
            Map.of("x-custom", mapper.readTree("{\"level\": 3}")));

        level.put("level", 1);
        ObjectNode encoded = writer.write(encoding);
        ((ObjectNode) encoded.get("x-custom")).put("level", 99);

        assertThat(encoding).isEqualTo(copy);
        assertThat(encoding.vendorExtensions().get("x-custom").get("level").asInt()).isEqualTo(3);

        ObjectNode input = (ObjectNode) mapper.readTree("{\"contentType\": \"text/plain\", \"x-custom\": {\"level\": 3}}");
        Encoding decoded = reader.readEncoding(input);
        ((ObjectNode) input.get("x-custom")).put("level", 42);

        assertThat(decoded).isEqualTo(copy);
    }

    @Test
    @SuppressWarnings("deprecation")
    void testSingularContentType() {
        assertThat(Encoding.of(List.of("text/plain")).contentType()).isEqualTo("text/plain");
        assertThat(Encoding.of(List.of("text/plain", "text/html")).contentType()).isNull();
        assertThat(Encoding.of(List.of()).contentType()).isNull();
        assertThat(writer.write(Encoding.of(List.of())).has("contentType")).isFalse();
    }

    @Test
    void testInvalidStyleIsRejectedWithPath() throws Exception {
        JsonNode source = mapper.readTree("{\"style\": \"sideways\"}");

        assertThatThrownBy(() -> reader.readEncoding(source))
            .isInstanceOfSatisfying(OpenApiFormatException.class,
                e -> assertThat(e.getPath()).isEqualTo("#/style"));
    }
}
