package io.github.simbo1905.cue.jsonschema;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.simbo1905.cue.Value;
import io.github.simbo1905.cue.ast.File;
import io.github.simbo1905.cue.ast.Sanitizer;

import java.util.List;
import java.util.Objects;

import static io.github.simbo1905.cue.jsonschema.SchemaLogging.LOG;

/// Translation between JSON Schema documents and CUE.
///
/// [#extract] turns a JSON Schema into CUE syntax that accepts at least every instance
/// the schema accepts. [#generate] goes the other way for values that JSON Schema can
/// express.
///
/// Both collect every problem they find and report them together as a
/// [JsonSchemaException]; no partial result is returned.
///
/// ```java
/// JsonNode schema = new ObjectMapper().readTree("{\"type\":\"string\",\"minLength\":2}");
/// File f = JsonSchema.extract(schema, ExtractConfig.DEFAULT.withPkgName("example"));
/// String cue = Printer.format(f);
/// ```
public final class JsonSchema {

  private JsonSchema() {
  }

  public static File extract(JsonNode schema) {
    return extract(schema, ExtractConfig.DEFAULT);
  }

  /// Converts a JSON Schema document to a CUE file.
  /// @throws IllegalArgumentException if the configuration is unusable, such as a relative ID
  /// @throws JsonSchemaException listing every problem found in the document
  public static File extract(JsonNode schema, ExtractConfig cfg) {
    Objects.requireNonNull(schema, "schema");
    final ExtractConfig resolved = (cfg == null ? ExtractConfig.DEFAULT : cfg).resolved();
    LOG.fine(() -> "extract: root=" + resolved.root() + " id=" + resolved.id() + " version=" + resolved.defaultVersion());
    final Decoder d = new Decoder(resolved);
    final File f = d.decode(schema);
    if (!d.errors.isEmpty()) {
      throw new JsonSchemaException(d.errors);
    }
    if (f == null) {
      throw new JsonSchemaException(List.of(new SchemaError("#", "no schema produced")));
    }
    return Sanitizer.sanitize(f);
  }

  public static JsonNode generate(Value value) {
    return generate(value, GenerateConfig.DEFAULT);
  }

  /// Converts a value to a JSON Schema document.
  /// @throws IllegalArgumentException if the configuration asks for an unsupported version
  /// @throws JsonSchemaException listing every problem found in the value
  public static JsonNode generate(Value value, GenerateConfig cfg) {
    Objects.requireNonNull(value, "value");
    final GenerateConfig resolved = (cfg == null ? GenerateConfig.DEFAULT : cfg).resolved();
    LOG.fine(() -> "generate: path=" + value.path() + " explicitOpen=" + resolved.explicitOpen());
    final Generator g = new Generator(resolved);
    final JsonNode out = g.generate(value);
    if (!g.errors().isEmpty()) {
      throw new JsonSchemaException(g.errors());
    }
    return out;
  }
}
