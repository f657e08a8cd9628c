package io.github.simbo1905.cue.jsonschema;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class JsonPointerTest extends JsonSchemaTestBase {

    @Test
    void tokensUnescape() {
        assertThat(JsonPointer.tokens("/a~1b/c~0d")).containsExactly("a/b", "c~d");
        assertThat(JsonPointer.tokens("")).isEmpty();
        assertThat(JsonPointer.tokens("/")).containsExactly("");
    }

    @Test
    void tildeZeroOneIsNotASlash() {
        assertThat(JsonPointer.tokens("/~01")).containsExactly("~1");
    }

    @Test
    void fromTokensEscapes() {
        assertThat(JsonPointer.fromTokens(List.of("a/b", "c~d"))).isEqualTo("/a~1b/c~0d");
        assertThat(JsonPointer.fromTokens(List.of())).isEmpty();
    }

    @Test
    void lookupWalksObjectsAndArrays() {
        final JsonNode doc = json("{\"items\":[{\"type\":\"string\"},{\"type\":\"integer\"}],\"a/b\":true}");
        assertThat(JsonPointer.lookup(doc, "/items/1/type")).map(JsonNode::textValue).contains("integer");
        assertThat(JsonPointer.lookup(doc, "/a~1b")).map(JsonNode::booleanValue).contains(true);
        assertThat(JsonPointer.lookup(doc, "")).contains(doc);
    }

    @Test
    void lookupMisses() {
        final JsonNode doc = json("{\"items\":[1,2]}");
        assertThat(JsonPointer.lookup(doc, "/missing")).isEmpty();
        assertThat(JsonPointer.lookup(doc, "/items/01")).isEmpty();
        assertThat(JsonPointer.lookup(doc, "/items/-")).isEmpty();
        assertThat(JsonPointer.lookup(doc, "/items/5")).isEmpty();
        assertThat(JsonPointer.lookup(doc, "/items/0/deeper")).isEmpty();
    }
}
