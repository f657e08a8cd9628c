package io.github.simbo1905.cue.jsonschema;

import io.github.simbo1905.cue.Path;

import java.net.URI;
import java.util.Objects;

/// The location of a schema that needs a name in the output.
///
/// @param id the absolute URI of the schema, with a JSON Pointer or anchor fragment
/// @param isLocal whether the schema is inside the document being extracted
/// @param path for local schemas, the path of the schema from the document root
public record SchemaLoc(URI id, boolean isLocal, Path path) {

  public SchemaLoc {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(path, "path");
  }

  @Override
  public String toString() {
    if (isLocal) {
      return "id=" + id + " localPath=" + path;
    }
    return "id=" + id;
  }
}
