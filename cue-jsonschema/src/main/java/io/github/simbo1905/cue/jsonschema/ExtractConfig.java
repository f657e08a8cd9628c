package io.github.simbo1905.cue.jsonschema;

import io.github.simbo1905.cue.Path;
import io.github.simbo1905.cue.ast.Expr;
import io.github.simbo1905.cue.ast.Label;

import java.net.URI;
import java.util.List;

/// Configuration for [JsonSchema#extract].
///
/// @param pkgName package clause for the output, or null for none
/// @param id base URI of the document when it declares no `$id`; must be absolute
/// @param root JSON Pointer fragment (`#/components/schemas`) selecting the schemas to extract
/// @param allowNonExistentRoot treat a missing root as an empty set of definitions
/// @param singleRoot the root names one schema rather than an object of definitions
/// @param map maps the JSON Pointer tokens of a definition to output labels
/// @param mapURL maps a schema URI (without fragment) to an import location
/// @param mapRef maps a schema location to an output location; overrides map and mapURL
/// @param defineSchema told about local schemas that mapRef placed in another package
/// @param strict shorthand for strictFeatures and strictKeywords
/// @param strictFeatures report keywords and regexp features that are known but unsupported
/// @param strictKeywords report unknown keywords and keywords used in the wrong version
/// @param defaultVersion version used when the document has no `$schema`, null for the default
/// @param openOnlyWhenExplicit leave objects open unless the schema explicitly closes them
public record ExtractConfig(
    String pkgName,
    String id,
    String root,
    boolean allowNonExistentRoot,
    boolean singleRoot,
    MapFunc map,
    MapURLFunc mapURL,
    MapRefFunc mapRef,
    DefineSchemaFunc defineSchema,
    boolean strict,
    boolean strictFeatures,
    boolean strictKeywords,
    Version defaultVersion,
    boolean openOnlyWhenExplicit) {

  /// Used as the base URI of a document when neither it nor the configuration names one.
  public static final String DEFAULT_ROOT_ID = "https://cue.jsonschema.invalid";
  static final String DEFAULT_ROOT_ID_HOST = "cue.jsonschema.invalid";

  public static final ExtractConfig DEFAULT = new ExtractConfig(
      null, null, null, false, false, null, null, null, null, false, false, false, null, false);

  /// Maps the JSON Pointer tokens of a local schema to output labels.
  /// Throws [IllegalArgumentException] when the tokens cannot be mapped.
  @FunctionalInterface
  public interface MapFunc {
    List<Label> map(List<String> tokens);
  }

  /// Maps a schema URI without fragment to an import location.
  /// Throws [IllegalArgumentException] when the URI cannot be mapped.
  @FunctionalInterface
  public interface MapURLFunc {
    CueLocation map(URI uri);
  }

  /// Maps a schema location to an output location.
  /// Throws [IllegalArgumentException] when the location cannot be mapped.
  @FunctionalInterface
  public interface MapRefFunc {
    CueLocation map(SchemaLoc loc);
  }

  @FunctionalInterface
  public interface DefineSchemaFunc {
    void define(String importPath, Path path, Expr schema, String comment);
  }

  public ExtractConfig withPkgName(String v) {
    return new ExtractConfig(v, id, root, allowNonExistentRoot, singleRoot, map, mapURL, mapRef, defineSchema,
        strict, strictFeatures, strictKeywords, defaultVersion, openOnlyWhenExplicit);
  }

  public ExtractConfig withId(String v) {
    return new ExtractConfig(pkgName, v, root, allowNonExistentRoot, singleRoot, map, mapURL, mapRef, defineSchema,
        strict, strictFeatures, strictKeywords, defaultVersion, openOnlyWhenExplicit);
  }

  public ExtractConfig withRoot(String v) {
    return new ExtractConfig(pkgName, id, v, allowNonExistentRoot, singleRoot, map, mapURL, mapRef, defineSchema,
        strict, strictFeatures, strictKeywords, defaultVersion, openOnlyWhenExplicit);
  }

  public ExtractConfig withAllowNonExistentRoot(boolean v) {
    return new ExtractConfig(pkgName, id, root, v, singleRoot, map, mapURL, mapRef, defineSchema,
        strict, strictFeatures, strictKeywords, defaultVersion, openOnlyWhenExplicit);
  }

  public ExtractConfig withSingleRoot(boolean v) {
    return new ExtractConfig(pkgName, id, root, allowNonExistentRoot, v, map, mapURL, mapRef, defineSchema,
        strict, strictFeatures, strictKeywords, defaultVersion, openOnlyWhenExplicit);
  }

  public ExtractConfig withMap(MapFunc v) {
    return new ExtractConfig(pkgName, id, root, allowNonExistentRoot, singleRoot, v, mapURL, mapRef, defineSchema,
        strict, strictFeatures, strictKeywords, defaultVersion, openOnlyWhenExplicit);
  }

  public ExtractConfig withMapURL(MapURLFunc v) {
    return new ExtractConfig(pkgName, id, root, allowNonExistentRoot, singleRoot, map, v, mapRef, defineSchema,
        strict, strictFeatures, strictKeywords, defaultVersion, openOnlyWhenExplicit);
  }

  public ExtractConfig withMapRef(MapRefFunc v) {
    return new ExtractConfig(pkgName, id, root, allowNonExistentRoot, singleRoot, map, mapURL, v, defineSchema,
        strict, strictFeatures, strictKeywords, defaultVersion, openOnlyWhenExplicit);
  }

  public ExtractConfig withDefineSchema(DefineSchemaFunc v) {
    return new ExtractConfig(pkgName, id, root, allowNonExistentRoot, singleRoot, map, mapURL, mapRef, v,
        strict, strictFeatures, strictKeywords, defaultVersion, openOnlyWhenExplicit);
  }

  public ExtractConfig withStrict(boolean v) {
    return new ExtractConfig(pkgName, id, root, allowNonExistentRoot, singleRoot, map, mapURL, mapRef, defineSchema,
        v, strictFeatures, strictKeywords, defaultVersion, openOnlyWhenExplicit);
  }

  public ExtractConfig withStrictFeatures(boolean v) {
    return new ExtractConfig(pkgName, id, root, allowNonExistentRoot, singleRoot, map, mapURL, mapRef, defineSchema,
        strict, v, strictKeywords, defaultVersion, openOnlyWhenExplicit);
  }

  public ExtractConfig withStrictKeywords(boolean v) {
    return new ExtractConfig(pkgName, id, root, allowNonExistentRoot, singleRoot, map, mapURL, mapRef, defineSchema,
        strict, strictFeatures, v, defaultVersion, openOnlyWhenExplicit);
  }

  public ExtractConfig withDefaultVersion(Version v) {
    return new ExtractConfig(pkgName, id, root, allowNonExistentRoot, singleRoot, map, mapURL, mapRef, defineSchema,
        strict, strictFeatures, strictKeywords, v, openOnlyWhenExplicit);
  }

  public ExtractConfig withOpenOnlyWhenExplicit(boolean v) {
    return new ExtractConfig(pkgName, id, root, allowNonExistentRoot, singleRoot, map, mapURL, mapRef, defineSchema,
        strict, strictFeatures, strictKeywords, defaultVersion, v);
  }

  /// Fills in defaults (mapping functions, version, root ID, empty names) and
  /// expands strict into its two parts.
  ExtractConfig resolved() {
    final MapFunc m = map != null ? map : DefaultMappings::map;
    final MapURLFunc mu = mapURL != null ? mapURL : DefaultMappings::mapURL;
    final MapRefFunc mr = mapRef != null ? mapRef : loc -> DefaultMappings.mapRef(loc, m, mu);
    return new ExtractConfig(
        pkgName == null ? "" : pkgName,
        id == null || id.isEmpty() ? DEFAULT_ROOT_ID : id,
        root == null ? "" : root,
        allowNonExistentRoot,
        singleRoot,
        m,
        mu,
        mr,
        defineSchema,
        strict,
        strict || strictFeatures,
        strict || strictKeywords,
        defaultVersion == null ? Version.DEFAULT : defaultVersion,
        openOnlyWhenExplicit);
  }
}
