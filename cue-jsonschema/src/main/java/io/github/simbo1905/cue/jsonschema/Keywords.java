package io.github.simbo1905.cue.jsonschema;

import io.github.simbo1905.cue.ast.Printer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import static io.github.simbo1905.cue.jsonschema.Version.ALL_DRAFTS;
import static io.github.simbo1905.cue.jsonschema.Version.DRAFT2019_09;
import static io.github.simbo1905.cue.jsonschema.Version.DRAFT2020_12;
import static io.github.simbo1905.cue.jsonschema.Version.DRAFT4;
import static io.github.simbo1905.cue.jsonschema.Version.DRAFT6;
import static io.github.simbo1905.cue.jsonschema.Version.DRAFT7;
import static io.github.simbo1905.cue.jsonschema.Version.K8S;
import static io.github.simbo1905.cue.jsonschema.Version.OPENAPI_LIKE;
import static io.github.simbo1905.cue.jsonschema.Version.OPENAPI_ONLY;
import static io.github.simbo1905.cue.jsonschema.Version.union;
import static io.github.simbo1905.cue.jsonschema.Version.vfrom;
import static io.github.simbo1905.cue.jsonschema.Version.vto;

/// Every keyword the decoder knows, by name.
final class Keywords {

  private static final Set<Version> ALL = union(ALL_DRAFTS, OPENAPI_LIKE);

  private static final Map<String, Keyword> KEYWORDS;

  static {
    final Map<String, Keyword> m = new LinkedHashMap<>();
    // Phase 0: the schema version decides how everything else is read.
    p(m, "$schema", 0, ALL, ReferenceConstraints::schema);
    p(m, "$dynamicAnchor", 0, vfrom(DRAFT2020_12), Keywords::notImplemented);
    p(m, "$dynamicRef", 0, vfrom(DRAFT2020_12), Keywords::notImplemented);
    p(m, "$recursiveAnchor", 0, Set.of(DRAFT2019_09), Keywords::notImplemented);
    p(m, "$recursiveRef", 0, Set.of(DRAFT2019_09), Keywords::notImplemented);
    p(m, "$vocabulary", 0, vfrom(DRAFT2019_09), Keywords::notImplemented);

    // Phase 1: identity, and values other keywords read.
    p(m, "$id", 1, vfrom(DRAFT6), ReferenceConstraints::id);
    p(m, "id", 1, vto(DRAFT4), ReferenceConstraints::id);
    p(m, "$anchor", 1, vfrom(DRAFT2019_09), GenericConstraints::noop);
    p(m, "$comment", 1, vfrom(DRAFT7), GenericConstraints::noop);
    p(m, "if", 1, vfrom(DRAFT7), CombinatorConstraints::ifKeyword);
    p(m, "then", 1, vfrom(DRAFT7), CombinatorConstraints::thenKeyword);
    p(m, "else", 1, vfrom(DRAFT7), CombinatorConstraints::elseKeyword);
    p(m, "minContains", 1, vfrom(DRAFT2019_09), ArrayConstraints::minContains);
    p(m, "maxContains", 1, vfrom(DRAFT2019_09), ArrayConstraints::maxContains);
    p(m, "exclusiveMaximum", 1, ALL, NumberConstraints::exclusiveMaximum);
    p(m, "exclusiveMinimum", 1, ALL, NumberConstraints::exclusiveMinimum);
    p(m, "x-kubernetes-preserve-unknown-fields", 1, K8S, KubernetesConstraints::preserveUnknownFields);

    // Phase 2: most keywords.
    p(m, "$defs", 2, vfrom(DRAFT2019_09), GenericConstraints::definitions);
    p(m, "definitions", 2, ALL_DRAFTS, GenericConstraints::definitions);
    p(m, "$ref", 2, ALL, ReferenceConstraints::ref);
    p(m, "const", 2, vfrom(DRAFT6), GenericConstraints::constKeyword);
    p(m, "enum", 2, ALL, GenericConstraints::enumKeyword);
    p(m, "type", 2, ALL, GenericConstraints::type);
    p(m, "default", 2, ALL, GenericConstraints::noop);
    p(m, "examples", 2, vfrom(DRAFT6), GenericConstraints::examples);
    p(m, "title", 2, ALL, GenericConstraints::title);
    p(m, "description", 2, ALL, GenericConstraints::description);
    p(m, "deprecated", 2, union(vfrom(DRAFT2019_09), OPENAPI_ONLY), GenericConstraints::deprecated);
    p(m, "nullable", 2, OPENAPI_LIKE, GenericConstraints::nullable);
    p(m, "format", 2, ALL, Format::constraint);
    p(m, "properties", 2, ALL, ObjectConstraints::properties);
    p(m, "propertyNames", 2, vfrom(DRAFT6), ObjectConstraints::propertyNames);
    p(m, "minProperties", 2, ALL, ObjectConstraints::minProperties);
    p(m, "maxProperties", 2, ALL, ObjectConstraints::maxProperties);
    p(m, "prefixItems", 2, vfrom(DRAFT2020_12), ArrayConstraints::prefixItems);
    p(m, "minItems", 2, ALL, ArrayConstraints::minItems);
    p(m, "maxItems", 2, ALL, ArrayConstraints::maxItems);
    p(m, "uniqueItems", 2, ALL, ArrayConstraints::uniqueItems);
    p(m, "multipleOf", 2, ALL, NumberConstraints::multipleOf);
    p(m, "pattern", 2, ALL, StringConstraints::pattern);
    p(m, "minLength", 2, ALL, StringConstraints::minLength);
    p(m, "maxLength", 2, ALL, StringConstraints::maxLength);
    p(m, "contentEncoding", 2, vfrom(DRAFT7), GenericConstraints::noop);
    p(m, "contentMediaType", 2, vfrom(DRAFT7), GenericConstraints::noop);
    p(m, "x-kubernetes-int-or-string", 2, K8S, KubernetesConstraints::intOrString);
    p(m, "x-kubernetes-list-map-keys", 2, K8S, GenericConstraints::noop);
    p(m, "x-kubernetes-list-type", 2, K8S, GenericConstraints::noop);
    p(m, "x-kubernetes-map-type", 2, K8S, GenericConstraints::noop);
    p(m, "x-kubernetes-patch-merge-key", 2, K8S, GenericConstraints::noop);
    p(m, "x-kubernetes-patch-strategy", 2, K8S, GenericConstraints::noop);
    p(m, "x-kubernetes-validations", 2, K8S, GenericConstraints::noop);
    p(m, "x-kubernetes-group-version-kind", 2, K8S, GenericConstraints::noop);
    p(m, "dependentRequired", 2, vfrom(DRAFT2019_09), Keywords::notImplemented);
    p(m, "dependentSchemas", 2, vfrom(DRAFT2019_09), Keywords::notImplemented);
    p(m, "dependencies", 2, vto(DRAFT7), Keywords::notImplemented);
    p(m, "unevaluatedItems", 2, vfrom(DRAFT2019_09), Keywords::notImplemented);
    p(m, "unevaluatedProperties", 2, vfrom(DRAFT2019_09), Keywords::notImplemented);
    p(m, "readOnly", 2, union(vfrom(DRAFT7), OPENAPI_ONLY), Keywords::notImplemented);
    p(m, "writeOnly", 2, union(vfrom(DRAFT7), OPENAPI_ONLY), Keywords::notImplemented);
    p(m, "discriminator", 2, OPENAPI_ONLY, Keywords::notImplemented);
    p(m, "xml", 2, OPENAPI_ONLY, Keywords::notImplemented);
    p(m, "externalDocs", 2, OPENAPI_ONLY, Keywords::notImplemented);
    p(m, "example", 2, OPENAPI_ONLY, Keywords::notImplemented);

    // Phase 3: keywords that combine what earlier phases built.
    p(m, "allOf", 3, ALL, CombinatorConstraints::allOf);
    p(m, "anyOf", 3, ALL, CombinatorConstraints::anyOf);
    p(m, "oneOf", 3, ALL, CombinatorConstraints::oneOf);
    p(m, "not", 3, ALL, CombinatorConstraints::not);
    p(m, "required", 3, ALL, ObjectConstraints::required);
    p(m, "patternProperties", 3, ALL_DRAFTS, ObjectConstraints::patternProperties);
    p(m, "maximum", 3, ALL, NumberConstraints::maximum);
    p(m, "minimum", 3, ALL, NumberConstraints::minimum);
    p(m, "contains", 3, vfrom(DRAFT6), ArrayConstraints::contains);
    p(m, "items", 3, ALL, ArrayConstraints::items);

    // Phase 4: keywords about whatever nothing else covered.
    p(m, "additionalProperties", 4, ALL, ObjectConstraints::additionalProperties);
    p(m, "additionalItems", 4, vto(DRAFT2019_09), ArrayConstraints::additionalItems);
    p(m, "x-kubernetes-embedded-resource", 4, K8S, KubernetesConstraints::embeddedResource);

    KEYWORDS = Collections.unmodifiableMap(m);
  }

  private Keywords() {
  }

  /// The keyword with the given name, or null.
  static Keyword lookup(String name) {
    return KEYWORDS.get(name);
  }

  private static void p(Map<String, Keyword> m, String name, int phase, Set<Version> versions, Keyword.Handler h) {
    m.put(name, new Keyword(name, phase, versions, h));
  }

  /// Keywords that are recognized but have no translation yet.
  private static void notImplemented(String key, SchemaNode n, State s) {
    if (s.cfg().strictFeatures()) {
      s.errf(n, "keyword %s not yet implemented", Printer.quote(key));
    }
  }
}
