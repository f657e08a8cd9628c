package io.github.simbo1905.cue.jsonschema;

import io.github.simbo1905.cue.ast.BasicLit;
import io.github.simbo1905.cue.ast.Ident;
import io.github.simbo1905.cue.ast.Printer;
import io.github.simbo1905.cue.ast.SelectorExpr;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

import static io.github.simbo1905.cue.jsonschema.Version.ALL_DRAFTS;
import static io.github.simbo1905.cue.jsonschema.Version.DRAFT2019_09;
import static io.github.simbo1905.cue.jsonschema.Version.DRAFT6;
import static io.github.simbo1905.cue.jsonschema.Version.DRAFT7;
import static io.github.simbo1905.cue.jsonschema.Version.K8S;
import static io.github.simbo1905.cue.jsonschema.Version.OPENAPI_LIKE;
import static io.github.simbo1905.cue.jsonschema.Version.OPENAPI_ONLY;
import static io.github.simbo1905.cue.jsonschema.Version.union;
import static io.github.simbo1905.cue.jsonschema.Version.vfrom;

/// Known values of the `format` keyword. Formats with no counterpart in the output
/// are accepted and add nothing.
///
/// The Kubernetes names come from the apiextensions JSON schema types.
enum Format {
  BINARY("binary", OPENAPI_ONLY),
  BSONOBJECTID("bsonobjectid", K8S),
  BYTE("byte", OPENAPI_LIKE),
  CIDR("cidr", K8S),
  CREDITCARD("creditcard", K8S),
  DATA("data", OPENAPI_ONLY),
  DATE("date", union(vfrom(DRAFT7), OPENAPI_LIKE)) {
    @Override
    void apply(SchemaNode n, State s) {
      s.add(n, CoreType.STRING, State.pkgCall("time", "Format", BasicLit.string("2006-01-02")));
    }
  },
  DATE_TIME("date-time", union(ALL_DRAFTS, OPENAPI_LIKE)) {
    @Override
    void apply(SchemaNode n, State s) {
      // Stricter than RFC 3339: no lower-case T or Z, no leap seconds.
      s.add(n, CoreType.STRING, SelectorExpr.of(Ident.imported("time"), "Time"));
    }
  },
  DATETIME("datetime", K8S) {
    @Override
    void apply(SchemaNode n, State s) {
      DATE_TIME.apply(n, s);
    }
  },
  DOUBLE("double", OPENAPI_LIKE),
  DURATION("duration", union(vfrom(DRAFT2019_09), K8S)),
  EMAIL("email", union(ALL_DRAFTS, OPENAPI_LIKE)),
  FLOAT("float", OPENAPI_LIKE),
  HEXCOLOR("hexcolor", K8S),
  HOSTNAME("hostname", union(ALL_DRAFTS, OPENAPI_LIKE)),
  IDN_EMAIL("idn-email", vfrom(DRAFT7)),
  IDN_HOSTNAME("idn-hostname", vfrom(DRAFT7)),
  INT32("int32", OPENAPI_LIKE) {
    @Override
    void apply(SchemaNode n, State s) {
      s.add(n, CoreType.NUMBER, new Ident("int32"));
    }
  },
  INT64("int64", OPENAPI_LIKE) {
    @Override
    void apply(SchemaNode n, State s) {
      s.add(n, CoreType.NUMBER, new Ident("int64"));
    }
  },
  IPV4("ipv4", union(ALL_DRAFTS, OPENAPI_LIKE)),
  IPV6("ipv6", union(ALL_DRAFTS, OPENAPI_LIKE)),
  IRI("iri", vfrom(DRAFT7)) {
    @Override
    void apply(SchemaNode n, State s) {
      URI.apply(n, s);
    }
  },
  IRI_REFERENCE("iri-reference", vfrom(DRAFT7)) {
    @Override
    void apply(SchemaNode n, State s) {
      URI_REFERENCE.apply(n, s);
    }
  },
  ISBN("isbn", K8S),
  ISBN10("isbn10", K8S),
  ISBN13("isbn13", K8S),
  JSON_POINTER("json-pointer", vfrom(DRAFT6)),
  MAC("mac", K8S),
  PASSWORD("password", OPENAPI_LIKE),
  REGEX("regex", vfrom(DRAFT7)) {
    @Override
    void apply(SchemaNode n, State s) {
      // Backreferences and other Perl idioms are rejected.
      s.add(n, CoreType.STRING, SelectorExpr.of(Ident.imported("regexp"), "Valid"));
    }
  },
  RELATIVE_JSON_POINTER("relative-json-pointer", vfrom(DRAFT7)),
  RGBCOLOR("rgbcolor", K8S),
  SSN("ssn", K8S),
  TIME("time", vfrom(DRAFT7)),
  UINT32("uint32", K8S) {
    @Override
    void apply(SchemaNode n, State s) {
      s.add(n, CoreType.NUMBER, new Ident("uint32"));
    }
  },
  UINT64("uint64", K8S) {
    @Override
    void apply(SchemaNode n, State s) {
      s.add(n, CoreType.NUMBER, new Ident("uint64"));
    }
  },
  // Non-ASCII URIs pass too.
  URI("uri", union(ALL_DRAFTS, OPENAPI_LIKE)) {
    @Override
    void apply(SchemaNode n, State s) {
      s.add(n, CoreType.STRING, SelectorExpr.of(Ident.imported("net"), "AbsURL"));
    }
  },
  URI_REFERENCE("uri-reference", vfrom(DRAFT6)) {
    @Override
    void apply(SchemaNode n, State s) {
      s.add(n, CoreType.STRING, SelectorExpr.of(Ident.imported("net"), "URL"));
    }
  },
  URI_TEMPLATE("uri-template", vfrom(DRAFT6)),
  UUID("uuid", union(vfrom(DRAFT2019_09), K8S)),
  UUID3("uuid3", K8S),
  UUID4("uuid4", K8S),
  UUID5("uuid5", K8S);

  private static final Map<String, Format> BY_NAME;

  static {
    final Map<String, Format> m = new HashMap<>();
    for (Format f : values()) {
      m.put(f.formatName, f);
    }
    BY_NAME = Collections.unmodifiableMap(m);
  }

  private final String formatName;
  private final Set<Version> versions;

  Format(String formatName, Set<Version> versions) {
    this.formatName = formatName;
    this.versions = versions;
  }

  /// Adds whatever the format constrains. Most formats add nothing.
  void apply(SchemaNode n, State s) {
  }

  static Format lookup(String name) {
    return BY_NAME.get(name);
  }

  /// The `format` keyword. OpenAPI allows any format value, so unknown names are only
  /// errors under strict keywords outside OpenAPI-like versions.
  static void constraint(String key, SchemaNode n, State s) {
    final String name = s.strValue(n);
    if (name == null) {
      return;
    }
    final boolean report = s.cfg().strictKeywords() && !s.schemaVersion.is(OPENAPI_LIKE);
    final Format f = lookup(name);
    if (f == null) {
      if (report) {
        s.errf(n, "unknown format %s", Printer.quote(name));
      }
      return;
    }
    if (!s.schemaVersion.is(f.versions)) {
      if (report) {
        s.errf(n, "format %s is not recognized in schema version %s", Printer.quote(name), s.schemaVersion);
      }
      return;
    }
    f.apply(n, s);
  }
}
