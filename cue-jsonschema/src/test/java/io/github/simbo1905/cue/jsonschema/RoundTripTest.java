package io.github.simbo1905.cue.jsonschema;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.simbo1905.cue.AstValue;
import io.github.simbo1905.cue.ast.File;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

/// Schemas that survive extraction followed by generation unchanged.
class RoundTripTest extends JsonSchemaTestBase {

    @ParameterizedTest
    @ValueSource(strings = {
            "{\"oneOf\": [{\"const\": 1}, {\"const\": 2}]}",
            "{\"enum\": [\"a\", \"b\"]}",
            "{\"type\": \"string\"}",
            "{\"type\": \"integer\", \"minimum\": 1, \"maximum\": 10}",
            """
            {
              "type": "object",
              "properties": {"a": {"type": "string"}, "b": {"type": "integer"}},
              "required": ["a"],
              "additionalProperties": false
            }
            """
    })
    void extractThenGenerate(String schema) {
        final File extracted = JsonSchema.extract(json(schema));
        final JsonNode generated = JsonSchema.generate(AstValue.of(extracted));
        assertThat(body(generated)).isEqualTo(json(schema));
    }
}
