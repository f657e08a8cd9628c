package io.github.simbo1905.cue.jsonschema;

import io.github.simbo1905.cue.Path;

import java.util.Objects;

/// Where a schema lives in the output: an import path (empty for the package being
/// generated) and the path of the schema within that package.
public record CueLocation(String importPath, Path path) {

  public CueLocation {
    Objects.requireNonNull(importPath, "importPath");
    Objects.requireNonNull(path, "path");
  }

  static CueLocation local(Path path) {
    return new CueLocation("", path);
  }

  public boolean isLocal() {
    return importPath.isEmpty();
  }
}
