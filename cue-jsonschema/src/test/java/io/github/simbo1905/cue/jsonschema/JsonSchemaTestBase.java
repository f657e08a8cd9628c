package io.github.simbo1905.cue.jsonschema;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.simbo1905.cue.AstValue;
import io.github.simbo1905.cue.Path;
import io.github.simbo1905.cue.Selector;
import io.github.simbo1905.cue.Value;
import io.github.simbo1905.cue.ast.Printer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/// Base class for translator tests: a per-test banner and helpers for reading JSON
/// and CUE sources.
public class JsonSchemaTestBase extends JsonSchemaLoggingConfig {

    protected static final ObjectMapper MAPPER = new ObjectMapper();

    @BeforeEach
    void announce(TestInfo testInfo) {
        final String cls = testInfo.getTestClass().map(Class::getSimpleName).orElse("UnknownTest");
        final String name = testInfo.getTestMethod().map(java.lang.reflect.Method::getName)
                .orElseGet(testInfo::getDisplayName);
        SchemaLogging.LOG.info(() -> "TEST: " + cls + "#" + name);
    }

    protected static JsonNode json(String text) {
        try {
            return MAPPER.readTree(text);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    /// Extracts the schema and prints the result.
    protected static String extract(String schema) {
        return Printer.format(JsonSchema.extract(json(schema)));
    }

    protected static String extract(String schema, ExtractConfig cfg) {
        return Printer.format(JsonSchema.extract(json(schema), cfg));
    }

    /// The field `x` of the given CUE source.
    protected static Value fieldX(String source) {
        return field(AstValue.parse(source), "x");
    }

    protected static Value field(Value root, String name) {
        final Selector sel = name.startsWith("#") ? Selector.def(name) : Selector.str(name);
        return root.lookupPath(Path.of(sel)).orElseThrow();
    }

    /// The generated schema for `x`, without `$schema`.
    protected static JsonNode generateX(String source) {
        return body(JsonSchema.generate(fieldX(source)));
    }

    protected static List<JsonNode> elements(JsonNode array) {
        final List<JsonNode> out = new ArrayList<>();
        array.elements().forEachRemaining(out::add);
        return out;
    }

    protected static JsonNode body(JsonNode generated) {
        final ObjectNode copy = ((ObjectNode) generated).deepCopy();
        copy.remove("$schema");
        return copy;
    }
}
