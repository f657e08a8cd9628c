package io.github.simbo1905.cue.jsonschema;

import java.util.Set;

/// A schema keyword: the phase it is decoded in, the versions that define it, and
/// what it does.
///
/// Phases order keywords whose effect depends on others. For example `required`
/// needs the fields `properties` made, and `additionalProperties` needs both those
/// and the pattern fields.
record Keyword(String name, int phase, Set<Version> versions, Handler handler) {

  @FunctionalInterface
  interface Handler {
    /// Applies the keyword with value n to the schema being decoded in s.
    void apply(String key, SchemaNode n, State s);
  }
}
