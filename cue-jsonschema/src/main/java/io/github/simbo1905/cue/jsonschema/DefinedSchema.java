package io.github.simbo1905.cue.jsonschema;

import io.github.simbo1905.cue.Path;
import io.github.simbo1905.cue.ast.Expr;

/// A schema that is given a name in the output, or a reference to one that lives elsewhere.
final class DefinedSchema {
  /// Empty for schemas in the package being generated.
  final String importPath;
  final Path path;
  /// The syntax of the schema; null when only references to it have been seen.
  Expr schema;
  String comment;

  DefinedSchema(String importPath, Path path) {
    this.importPath = importPath;
    this.path = path;
  }
}
