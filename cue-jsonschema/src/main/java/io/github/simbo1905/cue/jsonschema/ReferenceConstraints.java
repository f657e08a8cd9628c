package io.github.simbo1905.cue.jsonschema;

import io.github.simbo1905.cue.Path;
import io.github.simbo1905.cue.ast.BottomLit;
import io.github.simbo1905.cue.ast.Expr;
import io.github.simbo1905.cue.ast.Printer;

import java.net.URI;
import java.util.Optional;

import static io.github.simbo1905.cue.jsonschema.SchemaLogging.LOG;

/// `$schema`, `$id` and `$ref`.
///
/// A reference to a schema in the same document names the target node, which is then
/// decoded as a definition wherever it sits. Anything else goes through
/// [ExtractConfig#mapRef()] to become a reference into another package.
final class ReferenceConstraints {

  private ReferenceConstraints() {
  }

  static void schema(String key, SchemaNode n, State s) {
    if (!s.isRoot && !s.schemaVersion.is(Version.vfrom(Version.DRAFT2019_09))) {
      s.errf(n, "$schema can only appear at the root in JSON Schema version %s", s.schemaVersion);
      return;
    }
    final String str = s.strValue(n);
    if (str == null) {
      return;
    }
    final Optional<Version> v = Version.parse(str);
    if (v.isEmpty()) {
      // Unknown dialects are read as the default version.
      if (s.cfg().strictFeatures()) {
        s.errf(n, "invalid $schema URL %s: unknown schema version", Printer.quote(str));
      }
      return;
    }
    s.schemaVersion = v.get();
    s.schemaVersionPresent = true;
  }

  static void id(String key, SchemaNode n, State s) {
    final URI u = s.resolveURI(n);
    if (u == null) {
      return;
    }
    if (u.getRawFragment() != null && !u.getRawFragment().isEmpty()) {
      // A plain-name fragment is an anchor, indexed before decoding.
      if (s.cfg().strictFeatures()) {
        s.errf(n, "$id URI may not contain a fragment");
      }
      return;
    }
    s.id = DefaultMappings.withoutFragment(u);
  }

  static void ref(String key, SchemaNode n, State s) {
    final URI u = s.resolveURI(n);
    if (u == null) {
      s.all.add(n, new BottomLit());
      return;
    }
    final Expr expr = makeRef(n, u, s);
    s.all.add(n, expr == null ? new BottomLit() : expr);
  }

  private static Expr makeRef(SchemaNode n, URI u, State s) {
    final Decoder d = s.d;
    final String fragment = u.getFragment() == null ? "" : u.getFragment();
    final SchemaNode docBase = documentFor(u, s);
    if (docBase != null) {
      final Optional<SchemaNode> target;
      if (fragment.isEmpty() || fragment.startsWith("/")) {
        target = docBase.lookup(fragment);
      } else {
        target = Optional.ofNullable(d.anchorIndex.get(u.toString()));
      }
      if (target.isEmpty()) {
        s.errf(n, "reference to non-existent schema");
        return null;
      }
      return localRef(n, target.get(), s);
    }
    if (!fragment.isEmpty() && !fragment.startsWith("/")) {
      final SchemaNode anchored = d.anchorIndex.get(u.toString());
      if (anchored != null) {
        return localRef(n, anchored, s);
      }
    }
    return externalRef(n, u, s);
  }

  /// The node u's document starts at, or null when u names another document.
  private static SchemaNode documentFor(URI u, State s) {
    final State schemaRoot = s.schemaRoot();
    if (State.sameSchemaRoot(u, schemaRoot.id)) {
      return schemaRoot.pos;
    }
    if (State.sameSchemaRoot(u, s.d.rootId)) {
      return s.d.docRoot;
    }
    return s.d.idIndex.get(DefaultMappings.withoutFragment(u).toString());
  }

  private static Expr localRef(SchemaNode n, SchemaNode target, State s) {
    DefinedSchema def = s.d.defForValue.get(target);
    if (def == null) {
      s.ensureDefinition(target);
      def = s.addDefinition(target);
      if (def == null) {
        return null;
      }
    }
    StructuredLog.finer(LOG, "ref.local", "from", n.location(), "to", target.location(), "path", def.path);
    return s.refExpr(n, def.importPath, def.path);
  }

  private static Expr externalRef(SchemaNode n, URI u, State s) {
    final Decoder d = s.d;
    final String idStr = u.toString();
    DefinedSchema def = d.defs.get(idStr);
    if (def == null) {
      final CueLocation loc;
      try {
        loc = s.cfg().mapRef().map(new SchemaLoc(u, false, Path.EMPTY));
      } catch (IllegalArgumentException e) {
        // Report each unmappable document once.
        if (d.mapURLErrors.add(DefaultMappings.withoutFragment(u).toString())) {
          s.errf(n, "cannot determine CUE location for JSON Schema location %s: %s", u, e.getMessage());
        }
        return null;
      }
      def = new DefinedSchema(loc.importPath(), loc.path());
      d.defs.put(idStr, def);
    }
    StructuredLog.finer(LOG, "ref.external", "from", n.location(), "to", idStr, "import", def.importPath);
    return s.refExpr(n, def.importPath, def.path);
  }
}
