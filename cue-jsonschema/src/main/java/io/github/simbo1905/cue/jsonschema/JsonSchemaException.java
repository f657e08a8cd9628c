package io.github.simbo1905.cue.jsonschema;

import java.util.List;
import java.util.stream.Collectors;

/// Thrown at the end of a translation that found problems. The message lists
/// every problem, one per line, each with its location.
public final class JsonSchemaException extends RuntimeException {
  private final List<SchemaError> errors;

  JsonSchemaException(List<SchemaError> errors) {
    super(format(errors));
    this.errors = List.copyOf(errors);
  }

  public List<SchemaError> errors() {
    return errors;
  }

  private static String format(List<SchemaError> errors) {
    if (errors.isEmpty()) {
      throw new IllegalArgumentException("no errors to report");
    }
    return errors.stream().map(SchemaError::toString).collect(Collectors.joining("\n"));
  }
}
