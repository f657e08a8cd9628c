package io.github.simbo1905.cue.jsonschema;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/// A JSON Schema dialect. The drafts form one lineage ordered by release;
/// OpenAPI and Kubernetes each stand alone.
public enum Version {
  DRAFT4("http://json-schema.org/draft-04/schema#", true),
  DRAFT6("http://json-schema.org/draft-06/schema#", true),
  DRAFT7("http://json-schema.org/draft-07/schema#", true),
  DRAFT2019_09("https://json-schema.org/draft/2019-09/schema", true),
  DRAFT2020_12("https://json-schema.org/draft/2020-12/schema", true),
  OPENAPI("OpenAPI 3.0", false),
  KUBERNETES_API("Kubernetes API", false),
  KUBERNETES_CRD("Kubernetes CRD", false);

  /// The version assumed when neither `$schema` nor configuration names one.
  public static final Version DEFAULT = DRAFT2020_12;

  /// Every draft in the JSON Schema lineage.
  static final Set<Version> ALL_DRAFTS = vfrom(DRAFT4);
  static final Set<Version> OPENAPI_ONLY = set(EnumSet.of(OPENAPI));
  static final Set<Version> K8S = set(EnumSet.of(KUBERNETES_API, KUBERNETES_CRD));
  static final Set<Version> OPENAPI_LIKE = set(EnumSet.of(OPENAPI, KUBERNETES_API, KUBERNETES_CRD));

  private final String text;
  private final boolean draft;

  Version(String text, boolean draft) {
    this.text = text;
    this.draft = draft;
  }

  /// Reports whether this version is a member of the set.
  public boolean is(Set<Version> versions) {
    return versions.contains(this);
  }

  /// The drafts from v onwards.
  static Set<Version> vfrom(Version v) {
    final EnumSet<Version> out = EnumSet.noneOf(Version.class);
    for (Version x : values()) {
      if (x.draft && x.ordinal() >= v.ordinal()) {
        out.add(x);
      }
    }
    return set(out);
  }

  /// The drafts up to and including v.
  static Set<Version> vto(Version v) {
    final EnumSet<Version> out = EnumSet.noneOf(Version.class);
    for (Version x : values()) {
      if (x.draft && x.ordinal() <= v.ordinal()) {
        out.add(x);
      }
    }
    return set(out);
  }

  /// The union of version sets.
  @SafeVarargs
  static Set<Version> union(Set<Version>... sets) {
    final EnumSet<Version> out = EnumSet.noneOf(Version.class);
    for (Set<Version> s : sets) {
      out.addAll(s);
    }
    return set(out);
  }

  private static Set<Version> set(EnumSet<Version> s) {
    return Collections.unmodifiableSet(s);
  }

  /// Parses a `$schema` URI. The scheme may be http or https and a trailing
  /// empty fragment is optional.
  public static Optional<Version> parse(String uri) {
    String s = uri.endsWith("#") ? uri.substring(0, uri.length() - 1) : uri;
    if (s.startsWith("https://")) {
      s = s.substring("https://".length());
    } else if (s.startsWith("http://")) {
      s = s.substring("http://".length());
    } else {
      return Optional.empty();
    }
    for (Version v : values()) {
      if (!v.draft) {
        continue;
      }
      final String candidate = v.text.replaceFirst("^https?://", "").replaceFirst("#$", "");
      if (candidate.equals(s)) {
        return Optional.of(v);
      }
    }
    return Optional.empty();
  }

  @Override
  public String toString() {
    return text;
  }
}
