package io.github.simbo1905.cue.jsonschema;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.simbo1905.cue.Kind;
import io.github.simbo1905.cue.Kinds;
import io.github.simbo1905.cue.Path;
import io.github.simbo1905.cue.ast.Attribute;
import io.github.simbo1905.cue.ast.BasicLit;
import io.github.simbo1905.cue.ast.BinaryExpr;
import io.github.simbo1905.cue.ast.BottomLit;
import io.github.simbo1905.cue.ast.CallExpr;
import io.github.simbo1905.cue.ast.Decl;
import io.github.simbo1905.cue.ast.Ellipsis;
import io.github.simbo1905.cue.ast.EmbedDecl;
import io.github.simbo1905.cue.ast.Expr;
import io.github.simbo1905.cue.ast.Field;
import io.github.simbo1905.cue.ast.Ident;
import io.github.simbo1905.cue.ast.ListLit;
import io.github.simbo1905.cue.ast.Op;
import io.github.simbo1905.cue.ast.Printer;
import io.github.simbo1905.cue.ast.SelectorExpr;
import io.github.simbo1905.cue.ast.StructLit;
import io.github.simbo1905.cue.ast.UnaryExpr;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import static io.github.simbo1905.cue.jsonschema.SchemaLogging.LOG;

/// The decoding state of one schema node. Keyword handlers accumulate constraints
/// here; [#finalizeSchema()] turns them into a single expression.
///
/// Child states are made for every subschema. They start from the parent's version and
/// the set of types the parent still allows.
final class State {

  static final int NUM_PHASES = 5;

  private static final BigInteger MAX_UINT64 = new BigInteger("18446744073709551615");

  /// The expression a schema translated to, and the state that produced it.
  record Decoded(Expr expr, State info) {}

  /// How open an object schema is.
  enum Openness {
    IMPLICITLY_OPEN,
    /// e.g. `additionalProperties: true`
    EXPLICITLY_OPEN,
    /// e.g. `additionalProperties: false`
    EXPLICITLY_CLOSED,
    /// a pattern covers every field not otherwise named
    ALL_FIELDS_COVERED
  }

  /// Conjuncts recorded against one type, with the nodes they came from.
  static final class Constraints {
    final List<Expr> exprs = new ArrayList<>();
    final List<SchemaNode> nodes = new ArrayList<>();

    void add(SchemaNode n, Expr x) {
      if (!isTop(x)) {
        exprs.add(x);
        nodes.add(n);
      }
    }

    boolean isEmpty() {
      return exprs.isEmpty();
    }
  }

  final Decoder d;
  final State up;
  final SchemaNode pos;

  // What is known about the schema once it has been decoded.
  Kinds allowedTypes;
  Kinds knownTypes;
  String title = "";
  String description = "";
  /// The absolute URI of the schema when it has an ID; the base for references within it.
  URI id;
  boolean deprecated;
  Version schemaVersion;
  boolean schemaVersionPresent;
  boolean hasConstraints;

  final Map<CoreType, Constraints> types = new EnumMap<>(CoreType.class);
  final Constraints all = new Constraints();
  Expr nullable;

  // For OpenAPI and draft 4, where the exclusive keywords are booleans.
  boolean exclusiveMin;
  boolean exclusiveMax;

  boolean isRoot;

  BigInteger minContains;
  BigInteger maxContains;

  SchemaNode ifConstraint;
  SchemaNode thenConstraint;
  SchemaNode elseConstraint;

  StructLit obj;
  SchemaNode objN;
  final List<Expr> patterns = new ArrayList<>();

  ListLit list;
  /// Whether `items` held an array, as opposed to `items: []` meaning nothing.
  boolean listItemsIsArray;

  // Kubernetes CRD: properties and additionalProperties are exclusive.
  boolean hasProperties;
  boolean hasAdditionalProperties;

  // OpenAPI: items is mandatory with type array.
  boolean hasItems;
  boolean isArray;

  /// Before 2019-09, keywords next to `$ref` are ignored.
  boolean hasRefKeyword;

  /// Inherited by subschemas, reset inside properties and additionalProperties.
  boolean preserveUnknownFields;

  Openness openness = Openness.IMPLICITLY_OPEN;

  State(Decoder d, State up, SchemaNode pos) {
    this.d = d;
    this.up = up;
    this.pos = pos;
    for (CoreType t : CoreType.values()) {
      types.put(t, new Constraints());
    }
  }

  ExtractConfig cfg() {
    return d.cfg;
  }

  Expr schema(SchemaNode n) {
    return schemaState(n, CoreType.ALL_TYPES, null).expr();
  }

  Decoded schemaState(SchemaNode n, Kinds allowed) {
    return schemaState(n, allowed, null);
  }

  /// Decodes n as a subschema of this one. init, when not null, runs on the new state
  /// before any keyword.
  Decoded schemaState(SchemaNode n, Kinds allowed, Consumer<State> init) {
    final State s = new State(d, this, n);
    s.schemaVersion = schemaVersion;
    s.allowedTypes = allowed;
    s.knownTypes = CoreType.ALL_TYPES;
    s.isRoot = isRoot && n.equals(pos);
    s.preserveUnknownFields = preserveUnknownFields;
    if (init != null) {
      init.accept(s);
    }
    final Expr expr = s.decode(n);
    return new Decoded(s.maybeDefine(expr), s);
  }

  private Expr decode(SchemaNode n) {
    final JsonNode json = n.json();
    if (json.isBoolean()) {
      if (schemaVersion.is(Version.vfrom(Version.DRAFT6))) {
        // From draft 6, true and false are schemas that always pass or fail.
        return boolSchema(json.booleanValue());
      }
      return errf(n, "boolean schemas not supported in %s", schemaVersion);
    }
    if (!json.isObject()) {
      return errf(n, "schema expects mapping node, found %s", n.kindName());
    }
    final List<Map.Entry<String, SchemaNode>> members = n.members();
    for (int pass = 0; pass < NUM_PHASES; pass++) {
      for (Map.Entry<String, SchemaNode> member : members) {
        dispatch(pass, member.getKey(), member.getValue());
      }
      if (schemaVersion == Version.KUBERNETES_CRD && isRoot) {
        // A CRD root is always a resource.
        final Keyword k = Keywords.lookup("x-kubernetes-embedded-resource");
        if (k.phase() == pass) {
          k.handler().apply(k.name(), n, this);
        }
      }
    }
    if (id != null) {
      ensureDefinition(pos);
    }
    CombinatorConstraints.ifThenElse(this);
    if (schemaVersion == Version.KUBERNETES_CRD && hasProperties && hasAdditionalProperties) {
      errf(n, "additionalProperties may not be combined with properties in %s", schemaVersion);
    }
    if (schemaVersion.is(Version.OPENAPI_LIKE) && isArray && !hasItems) {
      errf(n, "\"items\" must be present when the \"type\" is \"array\" in %s", schemaVersion);
    }
    final Expr expr = finalizeSchema();
    hasConstraints = computeHasConstraints();
    return expr;
  }

  private void dispatch(int pass, String key, SchemaNode value) {
    if (pass == 0 && key.equals("$ref")) {
      hasRefKeyword = true;
    }
    final Keyword k = Keywords.lookup(key);
    if (k == null) {
      // x- keywords are plainly not meant to be JSON Schema keywords.
      if (key.startsWith("x-")) {
        return;
      }
      if (pass == 0 && cfg().strictKeywords()) {
        warnUnrecognizedKeyword(key, value, "unknown keyword " + Printer.quote(key));
      }
      return;
    }
    if (k.phase() != pass) {
      return;
    }
    if (!schemaVersion.is(k.versions())) {
      warnUnrecognizedKeyword(key, value,
          "keyword " + Printer.quote(key) + " is not supported in JSON schema version " + schemaVersion);
      return;
    }
    // Pass 0 holds $schema, which may itself decide whether $ref siblings count.
    if (pass > 0 && !schemaVersion.is(Version.vfrom(Version.DRAFT2019_09)) && hasRefKeyword && !key.equals("$ref")) {
      warnUnrecognizedKeyword(key, value, "ignoring keyword " + Printer.quote(key) + " alongside $ref");
      return;
    }
    StructuredLog.finestSampled(LOG, "keyword", 16, "key", key, "phase", pass, "at", value.location());
    k.handler().apply(key, value, this);
  }

  private void warnUnrecognizedKeyword(String key, SchemaNode n, String msg) {
    if (!cfg().strictKeywords()) {
      return;
    }
    // OpenAPI-like versions turn on strict keywords by default, so x- keys stay legal there.
    if (schemaVersion.is(Version.OPENAPI_LIKE) && key.startsWith("x-")) {
      return;
    }
    errf(n, "%s", msg);
  }

  // Definitions and references

  /// Replaces expr with a reference when the node needs a name, placing expr at that name.
  private Expr maybeDefine(Expr expr) {
    final DefinedSchema def = definedSchemaForNode(pos);
    if (def == null || def.path.isEmpty()) {
      return expr;
    }
    def.schema = expr;
    def.comment = comment();
    if (def.importPath.isEmpty()) {
      if (!d.builder.put(def.path, expr, comment())) {
        errf(pos, "redefinition of schema CUE path %s", def.path);
        return expr;
      }
    }
    return refExpr(pos, def.importPath, def.path);
  }

  /// Returns the definition for n, or null when n does not need one.
  DefinedSchema definedSchemaForNode(SchemaNode n) {
    if (!d.defForValue.containsKey(n)) {
      return null;
    }
    DefinedSchema def = d.defForValue.get(n);
    if (def != null) {
      return def;
    }
    // Referred to before it was seen: references made so far were provisional.
    d.needAnotherPass = true;
    def = addDefinition(n);
    if (def == null) {
      return null;
    }
    d.defForValue.put(n, def);
    d.danglingRefs--;
    return def;
  }

  /// Makes sure n will be given a name in the output.
  void ensureDefinition(SchemaNode n) {
    if (!d.defForValue.containsKey(n)) {
      d.defForValue.put(n, null);
      d.danglingRefs++;
    }
  }

  DefinedSchema addDefinition(SchemaNode n) {
    // The nearest enclosing schema with an ID that also encloses n.
    URI base = d.rootId;
    SchemaNode basePos = d.docRoot;
    for (State st = this; st != null; st = st.up) {
      if (st.id != null && st.pos.contains(n)) {
        base = st.id;
        basePos = st.pos;
        break;
      }
    }
    final URI locId = withFragment(base, n.relativeTo(basePos));
    final String idStr = locId.toString();
    DefinedSchema def = d.defs.get(idStr);
    if (def != null) {
      return def;
    }
    final SchemaLoc loc = new SchemaLoc(locId, true, n.path());
    final CueLocation mapped;
    try {
      mapped = cfg().mapRef().map(loc);
    } catch (IllegalArgumentException e) {
      errf(n, "cannot get reference for %s: %s", loc, e.getMessage());
      return null;
    }
    def = new DefinedSchema(mapped.importPath(), mapped.path());
    d.defs.put(idStr, def);
    LOG.finer(() -> "define " + idStr + " as " + mapped);
    return def;
  }

  /// A reference to path in the given package, or within the output when importPath is empty.
  Expr refExpr(SchemaNode n, String importPath, Path path) {
    if (importPath.isEmpty()) {
      try {
        return d.builder.getRef(path);
      } catch (IllegalArgumentException e) {
        return errf(n, "cannot generate reference: %s", e.getMessage());
      }
    }
    if (Ident.qualifier(importPath).isEmpty()) {
      return errf(n, "cannot determine package name from import path %s", Printer.quote(importPath));
    }
    try {
      return StructBuilder.pathRefSyntax(path, Ident.imported(importPath));
    } catch (IllegalArgumentException e) {
      return errf(n, "cannot determine CUE path: %s", e.getMessage());
    }
  }

  /// The nearest enclosing state with its own ID. The root state always has one.
  State schemaRoot() {
    for (State s = this; s != null; s = s.up) {
      if (s.id != null) {
        return s;
      }
    }
    throw new IllegalStateException("no schema root with an ID");
  }

  /// Parses a URI from n and resolves it against the enclosing schema ID.
  URI resolveURI(SchemaNode n) {
    final String str = strValue(n);
    if (str == null) {
      return null;
    }
    final URI u;
    try {
      u = new URI(str);
    } catch (URISyntaxException e) {
      errf(n, "invalid JSON reference: %s", e.getMessage());
      return null;
    }
    if (u.isAbsolute()) {
      if (ExtractConfig.DEFAULT_ROOT_ID_HOST.equals(u.getHost())) {
        errf(n, "invalid use of default root ID host (%s) in URI", ExtractConfig.DEFAULT_ROOT_ID_HOST);
        return null;
      }
      return u;
    }
    return resolve(schemaRoot().id, u);
  }

  static URI resolve(URI base, URI ref) {
    if (ref.toString().isEmpty()) {
      return DefaultMappings.withoutFragment(base);
    }
    final boolean fragmentOnly = ref.getScheme() == null
        && ref.getRawSchemeSpecificPart().isEmpty()
        && ref.getRawFragment() != null;
    if (base.isOpaque() && fragmentOnly) {
      return withFragment(base, ref.getFragment());
    }
    if (!base.isOpaque() && base.getRawAuthority() != null && base.getRawPath().isEmpty() && !fragmentOnly) {
      // URI.resolve drops the separator when the base has no path.
      return base.resolve("/").resolve(ref);
    }
    return base.resolve(ref);
  }

  /// u with the given fragment; an empty fragment means none.
  static URI withFragment(URI u, String fragment) {
    if (fragment.isEmpty()) {
      return DefaultMappings.withoutFragment(u);
    }
    return DefaultMappings.withFragment(u, fragment);
  }

  /// Reports whether two URIs name the same document; scheme and fragment do not count.
  static boolean sameSchemaRoot(URI u1, URI u2) {
    if (u1.isOpaque() || u2.isOpaque()) {
      return u1.isOpaque() && u2.isOpaque()
          && u1.getRawSchemeSpecificPart().equals(u2.getRawSchemeSpecificPart());
    }
    return Objects.equals(u1.getHost(), u2.getHost())
        && Objects.equals(emptyIfNull(u1.getPath()), emptyIfNull(u2.getPath()));
  }

  private static String emptyIfNull(String s) {
    return s == null ? "" : s;
  }

  // Constraint accumulation

  void add(SchemaNode n, CoreType t, Expr x) {
    types.get(t).add(n, x);
  }

  StructLit object(SchemaNode n) {
    if (obj == null) {
      obj = new StructLit();
      objN = n;
    }
    return obj;
  }

  /// Sets what follows the fixed elements of the current list: `...`, `...T`, or nothing
  /// for a closed list.
  void setListTail(Expr tail) {
    final List<Expr> elts = list.elts();
    if (!elts.isEmpty() && elts.get(elts.size() - 1) instanceof Ellipsis) {
      elts.remove(elts.size() - 1);
    }
    if (tail != null) {
      elts.add(tail);
    }
  }

  Attribute idTag() {
    return Attribute.of("jsonschema", "id=" + Printer.quote(id.toString()));
  }

  private void finalizeObject() {
    if (obj == null && schemaVersion == Version.KUBERNETES_CRD
        && allowedTypes.has(Kind.STRUCT) && preserveUnknownFields) {
      // Preserving unknown fields needs an explicit ellipsis.
      object(pos);
    }
    if (obj == null) {
      return;
    }
    if (preserveUnknownFields) {
      openness = Openness.EXPLICITLY_OPEN;
    }
    Expr e = obj;
    if (cfg().openOnlyWhenExplicit() && openness == Openness.IMPLICITLY_OPEN) {
      LOG.finest(() -> "object left implicitly open at " + pos);
    } else if (openness == Openness.EXPLICITLY_CLOSED) {
      e = CallExpr.builtin("close", obj);
    } else if (openness != Openness.ALL_FIELDS_COVERED) {
      obj.add(new Ellipsis());
    }
    add(objN, CoreType.OBJECT, e);
  }

  /// Builds the expression for everything recorded so far.
  Expr finalizeSchema() {
    if (allowedTypes.isEmpty()) {
      // Not necessarily a problem: this may be one arm of a combinator.
      return errorDisallowed();
    }
    finalizeObject();

    // List and struct literals go last; List.sort is stable.
    sortLast(types.get(CoreType.ARRAY), ListLit.class);
    sortLast(types.get(CoreType.OBJECT), StructLit.class);

    final List<Expr> conjuncts = new ArrayList<>();
    final List<Expr> disjuncts = new ArrayList<>();

    boolean needsTypeDisjunction = !allowedTypes.equals(knownTypes);
    if (!needsTypeDisjunction) {
      for (CoreType t : CoreType.values()) {
        if (!types.get(t).isEmpty() && allows(t)) {
          needsTypeDisjunction = true;
          break;
        }
      }
    }

    if (needsTypeDisjunction) {
      int npossible = 0;
      int nexcluded = 0;
      final List<SchemaError> excluded = new ArrayList<>();
      for (CoreType t : CoreType.values()) {
        final Constraints c = types.get(t);
        if (!c.isEmpty()) {
          npossible++;
          if (!allows(t)) {
            nexcluded++;
            for (SchemaNode n : c.nodes) {
              excluded.add(new SchemaError(n.location(),
                  "constraint not allowed because type " + t.typeName() + " is excluded"));
            }
            continue;
          }
          disjuncts.add(BinaryExpr.join(Op.AND, c.exprs));
        } else if (allows(t)) {
          npossible++;
          if (!knownTypes.intersect(t.kinds()).isEmpty()) {
            disjuncts.add(t.toExpr(cfg().openOnlyWhenExplicit()));
          }
        }
      }
      if (nexcluded == npossible) {
        d.errors.addAll(excluded);
      }
    }
    conjuncts.addAll(all.exprs);
    if (!disjuncts.isEmpty()) {
      conjuncts.add(BinaryExpr.join(Op.OR, disjuncts));
    }

    // With no conjuncts, every disjunct was implied by the combinators in all.
    Expr e = conjuncts.isEmpty() ? Ident.top() : BinaryExpr.join(Op.AND, conjuncts);
    if (nullable != null) {
      e = BinaryExpr.join(Op.OR, nullable, e);
    }
    if (id != null) {
      if (e instanceof StructLit st) {
        st.elts().add(0, idTag());
      } else {
        e = StructLit.of(idTag(), new EmbedDecl(e));
      }
    }
    // Every allowed type is now spelled out.
    knownTypes = allowedTypes;
    return e;
  }

  private boolean allows(CoreType t) {
    return !allowedTypes.intersect(t.kinds()).isEmpty();
  }

  private static void sortLast(Constraints c, Class<?> type) {
    final List<Integer> order = new ArrayList<>();
    for (int i = 0; i < c.exprs.size(); i++) {
      order.add(i);
    }
    order.sort(Comparator.comparing(i -> type.isInstance(c.exprs.get(i))));
    final List<Expr> exprs = new ArrayList<>();
    final List<SchemaNode> nodes = new ArrayList<>();
    for (int i : order) {
      exprs.add(c.exprs.get(i));
      nodes.add(c.nodes.get(i));
    }
    c.exprs.clear();
    c.exprs.addAll(exprs);
    c.nodes.clear();
    c.nodes.addAll(nodes);
  }

  private boolean computeHasConstraints() {
    if (!all.isEmpty()) {
      return true;
    }
    for (Constraints c : types.values()) {
      if (!c.isEmpty()) {
        return true;
      }
    }
    return !patterns.isEmpty()
        || !title.isEmpty()
        || !description.isEmpty()
        || obj != null
        || id != null;
  }

  /// Title and description joined as a doc comment, or null when both are empty.
  String comment() {
    String doc = title.strip();
    if (!description.isEmpty()) {
      if (!doc.isEmpty()) {
        doc += "\n\n";
      }
      doc = (doc + description).strip();
    }
    return doc.isEmpty() ? null : doc;
  }

  // Value helpers

  /// Records an error at n and returns a placeholder expression.
  Expr errf(SchemaNode n, String format, Object... args) {
    final String msg = String.format(format, args);
    d.errors.add(new SchemaError(n.location(), msg));
    LOG.fine(() -> "ERROR: " + n.location() + ": " + msg);
    return new BottomLit();
  }

  /// The string value of n, or null after recording an error.
  String strValue(SchemaNode n) {
    if (!n.json().isTextual()) {
      errf(n, "invalid string");
      return null;
    }
    return n.json().textValue();
  }

  boolean boolValue(SchemaNode n) {
    if (!n.json().isBoolean()) {
      errf(n, "invalid bool");
      return false;
    }
    return n.json().booleanValue();
  }

  /// The number at n as a literal.
  Expr number(SchemaNode n) {
    final JsonNode json = n.json();
    if (!json.isNumber()) {
      return errf(n, "invalid number");
    }
    if (outOfRange(json)) {
      return errf(n, "number out of range: %s", json.asText());
    }
    if (json.isIntegralNumber()) {
      return BasicLit.integer(json.bigIntegerValue());
    }
    return BasicLit.number(json.decimalValue());
  }

  /// A non-negative whole number. Floats with no fractional part are accepted.
  /// Returns null after recording an error.
  BigInteger uintValue(SchemaNode n) {
    final JsonNode json = n.json();
    if (!json.isNumber()) {
      errf(n, "invalid uint");
      return null;
    }
    if (outOfRange(json)) {
      errf(n, "invalid uint: number out of range: %s", json.asText());
      return null;
    }
    final BigDecimal v = json.decimalValue();
    if (v.signum() != 0 && v.stripTrailingZeros().scale() > 0) {
      errf(n, "invalid uint: %s is not a whole number", json);
      return null;
    }
    final BigInteger i = v.toBigInteger();
    if (i.signum() < 0 || i.compareTo(MAX_UINT64) > 0) {
      errf(n, "invalid uint: %s is out of bounds", json);
      return null;
    }
    return i;
  }

  // Literals beyond the double range are read as infinities.
  private static boolean outOfRange(JsonNode json) {
    return json.isFloatingPointNumber() && !Double.isFinite(json.doubleValue());
  }

  Expr uint(SchemaNode n) {
    final BigInteger i = uintValue(n);
    return i == null ? new BottomLit() : BasicLit.integer(i);
  }

  /// The regular expression at n as a string literal, or null when it is invalid or
  /// uses features the output cannot express.
  Expr regexpValue(SchemaNode n) {
    final String s = strValue(n);
    if (s == null || !checkRegexp(n, s)) {
      return null;
    }
    return BasicLit.string(s);
  }

  /// Reports whether s is a regular expression the output can use. Lookaround,
  /// backreferences, atomic groups and possessive quantifiers are never supported;
  /// those and unknown character classes are errors only under strict features.
  boolean checkRegexp(SchemaNode n, String s) {
    final String perl = RegexpSyntax.unsupportedPerlSyntax(s);
    if (perl != null) {
      if (cfg().strictFeatures()) {
        errf(n, "unsupported Perl regexp syntax in %s: %s", Printer.quote(s), perl);
      }
      return false;
    }
    try {
      Pattern.compile(s);
      return true;
    } catch (PatternSyntaxException e) {
      if (e.getDescription().contains("property")) {
        if (cfg().strictFeatures()) {
          errf(n, "unsupported regexp character class in %s: %s", Printer.quote(s), e.getDescription());
        }
        return false;
      }
      errf(n, "invalid regexp %s: %s", Printer.quote(s), e.getDescription());
      return false;
    }
  }

  /// The JSON value at n as a literal; objects become closed structs of required fields.
  Expr constValue(SchemaNode n) {
    final JsonNode json = n.json();
    if (json.isArray()) {
      final List<Expr> a = new ArrayList<>();
      for (SchemaNode e : n.elements()) {
        a.add(constValue(e));
      }
      return new ListLit(a);
    }
    if (json.isObject()) {
      final List<Decl> a = new ArrayList<>();
      for (Map.Entry<String, SchemaNode> m : n.members()) {
        a.add(new Field(Field.stringLabel(m.getKey()), Field.Constraint.REQUIRED, constValue(m.getValue())));
      }
      return CallExpr.builtin("close", new StructLit(a));
    }
    if (json.isNull()) {
      return BasicLit.nullLit();
    }
    if (json.isBoolean()) {
      return BasicLit.bool(json.booleanValue());
    }
    if (json.isNumber()) {
      return number(n);
    }
    if (json.isTextual()) {
      return BasicLit.string(json.textValue());
    }
    return errf(n, "invalid non-concrete value");
  }

  List<SchemaNode> listItems(String name, SchemaNode n, boolean allowEmpty) {
    if (!n.json().isArray()) {
      errf(n, "value of %s must be an array, found %s", Printer.quote(name), n.kindName());
    }
    final List<SchemaNode> a = n.elements();
    if (!allowEmpty && a.isEmpty()) {
      errf(n, "array for %s must be non-empty", Printer.quote(name));
    }
    return a;
  }

  /// `!~"^(a|b)$"` for the named fields of decls, or nothing when there are none.
  static List<Expr> excludeFields(List<Decl> decls) {
    final StringBuilder sb = new StringBuilder("^(");
    boolean first = true;
    boolean any = false;
    for (Decl d : decls) {
      if (!(d instanceof Field f)) {
        continue;
      }
      final String name = f.labelName();
      if (name != null && !name.isEmpty()) {
        if (!first) {
          sb.append('|');
        }
        sb.append(RegexpSyntax.quoteMeta(name));
        first = false;
        any = true;
      }
    }
    if (decls.isEmpty() || !any) {
      return List.of();
    }
    sb.append(")$");
    return List.of(new UnaryExpr(Op.NMAT, BasicLit.string(sb.toString())));
  }

  /// A call to a function of an imported package, such as `strings.MinRunes(3)`.
  static Expr pkgCall(String pkg, String fn, Expr... args) {
    return CallExpr.of(SelectorExpr.of(Ident.imported(pkg), fn), args);
  }

  static Expr errorDisallowed() {
    return CallExpr.builtin("error", BasicLit.string("disallowed"));
  }

  static Expr boolSchema(boolean ok) {
    return ok ? Ident.top() : errorDisallowed();
  }

  static boolean isTop(Expr e) {
    return e instanceof Ident id && id.isTop() && id.importPath() == null;
  }

  /// A field `label: _ @tag(value)`.
  static Field addTag(String label, String tag, String value) {
    return new Field(Field.stringLabel(label), Ident.top()).addAttr(Attribute.of(tag, value));
  }
}
