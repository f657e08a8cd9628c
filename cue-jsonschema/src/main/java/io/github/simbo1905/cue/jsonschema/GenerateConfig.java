package io.github.simbo1905.cue.jsonschema;

import io.github.simbo1905.cue.Path;
import io.github.simbo1905.cue.Selector;
import io.github.simbo1905.cue.Value;

import java.util.stream.Collectors;

/// Configuration for [JsonSchema#generate].
///
/// @param version the JSON Schema version to write; only [Version#DRAFT2020_12] is supported
/// @param nameFunc names the `$defs` entry for a reference, null for [#defaultName]
/// @param explicitOpen never close objects implicitly, and mark explicitly open ones
///   with `additionalProperties: true`
public record GenerateConfig(Version version, NameFunc nameFunc, boolean explicitOpen) {

  public static final GenerateConfig DEFAULT = new GenerateConfig(null, null, false);

  /// Maps a reference, given as the root value it was resolved from and the path
  /// within it, to a definition name. An empty name inlines the referenced value.
  @FunctionalInterface
  public interface NameFunc {
    String name(Value root, Path path);
  }

  public GenerateConfig withVersion(Version v) {
    return new GenerateConfig(v, nameFunc, explicitOpen);
  }

  public GenerateConfig withNameFunc(NameFunc v) {
    return new GenerateConfig(version, v, explicitOpen);
  }

  public GenerateConfig withExplicitOpen(boolean v) {
    return new GenerateConfig(version, nameFunc, v);
  }

  /// Joins the selectors of the path with `.`.
  public static String defaultName(Value root, Path path) {
    return path.selectors().stream().map(Selector::toString).collect(Collectors.joining("."));
  }

  /// Fills in defaults.
  /// @throws IllegalArgumentException for a version other than 2020-12
  GenerateConfig resolved() {
    final Version v = version == null ? Version.DRAFT2020_12 : version;
    if (v != Version.DRAFT2020_12) {
      throw new IllegalArgumentException(
          "only version " + Version.DRAFT2020_12 + " is supported for generating JSON Schema for now");
    }
    return new GenerateConfig(v, nameFunc == null ? GenerateConfig::defaultName : nameFunc, explicitOpen);
  }
}
