package io.github.simbo1905.cue.jsonschema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.github.simbo1905.cue.Path;
import io.github.simbo1905.cue.Selector;
import io.github.simbo1905.cue.ast.Attribute;
import io.github.simbo1905.cue.ast.Decl;
import io.github.simbo1905.cue.ast.File;
import io.github.simbo1905.cue.ast.Package;
import io.github.simbo1905.cue.ast.Printer;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static io.github.simbo1905.cue.jsonschema.SchemaLogging.LOG;

/// Converts one JSON Schema document into a file. An instance is used once.
///
/// Decoding runs in passes. A `$ref` may be met before the schema it names, and
/// the mapping chosen for a schema can depend on whether it is referenced at all, so
/// a pass that discovers new definitions is followed by another one. References to
/// nodes outside the regular schema walk are decoded as extra schemas.
final class Decoder {

  private static final int MAX_PASSES = 10;

  final ExtractConfig cfg;
  final List<SchemaError> errors = new ArrayList<>();
  /// URLs already reported as unmappable.
  final Set<String> mapURLErrors = new HashSet<>();

  final URI rootId;
  SchemaNode docRoot;

  /// Nodes known to need a name. A null value marks a node that has been referenced
  /// but not yet visited.
  final Map<SchemaNode, DefinedSchema> defForValue = new LinkedHashMap<>();
  /// The null entries of [#defForValue].
  int danglingRefs;
  /// Named schemas by URI, including external ones.
  final Map<String, DefinedSchema> defs = new LinkedHashMap<>();

  StructBuilder builder = new StructBuilder();
  boolean needAnotherPass;

  /// Schemas with an `$id`, by URI without fragment.
  final Map<String, SchemaNode> idIndex = new HashMap<>();
  /// Schemas with an `$anchor` (or a fragment-only `$id`), by URI with fragment.
  final Map<String, SchemaNode> anchorIndex = new HashMap<>();

  Decoder(ExtractConfig cfg) {
    this.cfg = cfg;
    try {
      this.rootId = new URI(cfg.id());
    } catch (URISyntaxException e) {
      throw new IllegalArgumentException(
          String.format("invalid Config.ID value %s: %s", Printer.quote(cfg.id()), e.getMessage()), e);
    }
    if (!rootId.isAbsolute()) {
      throw new IllegalArgumentException(String.format("Config.ID %s is not absolute URI", Printer.quote(cfg.id())));
    }
  }

  /// Returns the file for the document, or null when decoding could not proceed.
  /// Errors are left in [#errors].
  File decode(JsonNode doc) {
    docRoot = SchemaNode.root(doc);
    SchemaNode v = docRoot;
    SchemaNode defsRoot = null;
    if (!cfg.root().isEmpty()) {
      final String rootPointer;
      try {
        rootPointer = parseRootRef(cfg.root());
      } catch (IllegalArgumentException e) {
        errors.add(new SchemaError("#", String.format("invalid Config.Root value %s: %s",
            Printer.quote(cfg.root()), e.getMessage())));
        return null;
      }
      SchemaNode root = docRoot.lookup(rootPointer).orElse(null);
      if (root == null && !cfg.allowNonExistentRoot()) {
        errors.add(new SchemaError("#", String.format("root value at path %s does not exist", cfg.root())));
        return null;
      }
      if (cfg.singleRoot()) {
        v = root == null ? new SchemaNode(rootPointer, JsonNodeFactory.instance.objectNode(), pointerPath(rootPointer)) : root;
      } else {
        if (root == null) {
          root = new SchemaNode(rootPointer, JsonNodeFactory.instance.objectNode(), pointerPath(rootPointer));
        }
        if (!root.isObject()) {
          errors.add(new SchemaError(root.location(), String.format(
              "value at path %s must be struct containing definitions but is actually %s",
              cfg.root(), root.json())));
          return null;
        }
        defsRoot = root;
      }
    }
    indexIds(docRoot, rootId, cfg.defaultVersion());

    State rootInfo = null;
    final List<SchemaNode> extraSchemas = new ArrayList<>();
    int basePass = 0;
    for (int pass = 0; ; pass++) {
      if (pass > MAX_PASSES) {
        errors.add(new SchemaError(v.location(), "internal error: too many passes without resolution"));
        return null;
      }
      StructuredLog.fine(LOG, "extract.pass", "pass", pass, "dangling", danglingRefs);
      final State root = new State(this, null, docRoot);
      root.schemaVersion = cfg.defaultVersion();
      root.id = rootId;
      root.isRoot = true;
      root.allowedTypes = CoreType.ALL_TYPES;
      root.knownTypes = CoreType.ALL_TYPES;

      if (defsRoot != null) {
        GenericConstraints.definitions("schemas", defsRoot, root);
      } else {
        final State.Decoded decoded = root.schemaState(v, CoreType.ALL_TYPES, s -> s.isRoot = true);
        if (decoded.info().allowedTypes.isEmpty()) {
          root.errf(v, "constraints are not possible to satisfy");
          return null;
        }
        if (!builder.put(Path.EMPTY, decoded.expr(), decoded.info().comment())) {
          root.errf(v, "duplicate definition at root");
          return null;
        }
        rootInfo = decoded.info();
      }
      if (danglingRefs > 0 && pass == basePass + 1) {
        // Two passes have not resolved these, so they refer to nodes that are not
        // otherwise schemas. Decode them as if they sat directly under the root.
        for (Map.Entry<SchemaNode, DefinedSchema> e : defForValue.entrySet()) {
          if (e.getValue() == null) {
            extraSchemas.add(e.getKey());
            basePass = pass;
          }
        }
      }
      for (SchemaNode n : extraSchemas) {
        root.schema(n);
      }
      if (!needAnotherPass && danglingRefs == 0) {
        break;
      }
      builder = new StructBuilder();
      for (DefinedSchema def : defs.values()) {
        def.schema = null;
      }
      needAnotherPass = false;
    }

    if (cfg.defineSchema() != null) {
      for (DefinedSchema def : defs.values()) {
        if (def.schema != null && !def.importPath.isEmpty()) {
          cfg.defineSchema().define(def.importPath, def.path, def.schema, def.comment);
        }
      }
    }
    final File f;
    try {
      f = builder.syntax();
    } catch (IllegalArgumentException e) {
      errors.add(new SchemaError(v.location(), "cannot build final syntax: " + e.getMessage()));
      return null;
    }
    final List<Decl> preamble = new ArrayList<>();
    if (!cfg.pkgName().isEmpty()) {
      preamble.add(new Package(cfg.pkgName()));
    }
    if (rootInfo != null && rootInfo.schemaVersionPresent) {
      preamble.add(Attribute.of("jsonschema", "schema=" + Printer.quote(rootInfo.schemaVersion.toString())));
    }
    if (rootInfo != null && rootInfo.deprecated) {
      preamble.add(Attribute.of("deprecated", ""));
    }
    f.decls().addAll(0, preamble);
    return f;
  }

  /// Converts a root reference such as `#/components/schemas` to a JSON Pointer.
  static String parseRootRef(String str) {
    final URI u;
    try {
      u = new URI(str);
    } catch (URISyntaxException e) {
      throw new IllegalArgumentException("invalid JSON reference: " + e.getMessage(), e);
    }
    if (u.isOpaque() || u.getHost() != null || (u.getPath() != null && !u.getPath().isEmpty())) {
      throw new IllegalArgumentException("external references (" + str + ") not supported in Root");
    }
    String fragment = u.getFragment() == null ? "" : u.getFragment();
    // `#/` names the document root.
    if (fragment.endsWith("/")) {
      fragment = fragment.substring(0, fragment.length() - 1);
    }
    return fragment;
  }

  /// Records every `$id` and `$anchor` below n so references can find them.
  private void indexIds(SchemaNode n, URI base, Version version) {
    if (n.json().isArray()) {
      for (SchemaNode e : n.elements()) {
        indexIds(e, base, version);
      }
      return;
    }
    if (!n.isObject()) {
      return;
    }
    URI b = base;
    Version ver = version;
    final JsonNode schemaKw = n.json().get("$schema");
    if (schemaKw != null && schemaKw.isTextual()) {
      ver = Version.parse(schemaKw.textValue()).orElse(ver);
    }
    final JsonNode idKw = n.json().get(ver == Version.DRAFT4 ? "id" : "$id");
    if (idKw != null && idKw.isTextual()) {
      try {
        final URI u = State.resolve(b, new URI(idKw.textValue()));
        final String fragment = u.getFragment();
        if (fragment != null && !fragment.isEmpty()) {
          if (!fragment.startsWith("/")) {
            anchorIndex.put(u.toString(), n);
          }
        } else {
          b = DefaultMappings.withoutFragment(u);
          idIndex.put(b.toString(), n);
        }
      } catch (URISyntaxException | IllegalArgumentException e) {
        LOG.finer(() -> "ignoring unparseable id at " + n + ": " + e.getMessage());
      }
    }
    final JsonNode anchorKw = n.json().get("$anchor");
    if (anchorKw != null && anchorKw.isTextual()) {
      anchorIndex.put(State.withFragment(b, anchorKw.textValue()).toString(), n);
    }
    for (Map.Entry<String, SchemaNode> m : n.members()) {
      // Values of these keywords are data, not schemas.
      if (m.getKey().equals("const") || m.getKey().equals("enum") || m.getKey().equals("default")
          || m.getKey().equals("examples")) {
        continue;
      }
      indexIds(m.getValue(), b, ver);
    }
  }

  /// The selectors of a JSON Pointer, all as regular field names.
  static Path pointerPath(String pointer) {
    Path p = Path.EMPTY;
    for (String token : JsonPointer.tokens(pointer)) {
      p = p.append(Selector.str(token));
    }
    return p;
  }
}
