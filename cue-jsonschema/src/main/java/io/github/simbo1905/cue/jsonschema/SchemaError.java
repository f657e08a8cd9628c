package io.github.simbo1905.cue.jsonschema;

import java.util.Objects;

/// One problem found while translating. The location is a JSON Pointer into the
/// input document for extraction, or a value path for generation.
public record SchemaError(String location, String message) {

  public SchemaError {
    Objects.requireNonNull(location, "location");
    Objects.requireNonNull(message, "message");
  }

  @Override
  public String toString() {
    return location.isEmpty() ? message : location + ": " + message;
  }
}
