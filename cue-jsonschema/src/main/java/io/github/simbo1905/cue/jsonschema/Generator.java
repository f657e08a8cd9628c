package io.github.simbo1905.cue.jsonschema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.simbo1905.cue.Expression;
import io.github.simbo1905.cue.FieldInfo;
import io.github.simbo1905.cue.Kind;
import io.github.simbo1905.cue.Kinds;
import io.github.simbo1905.cue.Operator;
import io.github.simbo1905.cue.PatternConstraint;
import io.github.simbo1905.cue.Reference;
import io.github.simbo1905.cue.Value;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

import static io.github.simbo1905.cue.jsonschema.SchemaLogging.LOG;
import static io.github.simbo1905.cue.jsonschema.SchemaObjects.FACTORY;

/// Builds a JSON Schema from a value. The value is first turned into an [Item] tree,
/// which [Passes] simplifies before it is rendered.
///
/// Every builtin the decoder writes is recognized here and turned back into the keyword
/// it came from. Builtins with no JSON Schema counterpart accept anything.
final class Generator {

  // Go reference-time layouts accepted by time.Format.
  private static final String RFC3339 = "2006-01-02T15:04:05Z07:00";
  private static final String RFC3339_NANO = "2006-01-02T15:04:05.999999999Z07:00";
  private static final String DATE_ONLY = "2006-01-02";
  private static final String TIME_ONLY = "15:04:05";

  private final GenerateConfig cfg;
  private final List<SchemaError> errors = new ArrayList<>();

  // Keyed by `$defs` name. A null value marks a definition still being built.
  private final Map<String, Item> defs = new TreeMap<>();
  private final Interner interner = new Interner();

  Generator(GenerateConfig cfg) {
    this.cfg = cfg;
  }

  List<SchemaError> errors() {
    return errors;
  }

  /// The complete schema document for v, or null when errors were found.
  ObjectNode generate(Value v) {
    for (String problem : v.validate()) {
      addError(v, "%s", problem);
    }
    if (!errors.isEmpty()) {
      return null;
    }
    JsonNode node = simplify(makeItem(v), interner).render();
    if (node.isBoolean()) {
      if (!node.booleanValue()) {
        if (errors.isEmpty()) {
          addError(v, "schema cannot be satisfied");
        }
        return null;
      }
      node = FACTORY.objectNode();
    }
    final ObjectNode out = FACTORY.objectNode();
    out.put("$schema", cfg.version().toString());
    if (!defs.isEmpty()) {
      final ObjectNode d = FACTORY.objectNode();
      defs.forEach((name, it) -> d.set(name, simplify(it, interner).render()));
      out.set("$defs", d);
    }
    node.fields().forEachRemaining(m -> out.set(m.getKey(), m.getValue()));
    StructuredLog.fine(LOG, "generate.done", "path", v.path(), "defs", defs.size(), "items", interner.size(),
        "errors", errors.size());
    return errors.isEmpty() ? SchemaObjects.sorted(out) : null;
  }

  static Item simplify(Item it, Interner in) {
    return Passes.enumFromConst(Passes.mergeAllOf(it, in), in);
  }

  /// The item for v in naive form. Equal items share one instance.
  Item makeItem(Value v) {
    return interner.intern(buildItem(v));
  }

  private Item buildItem(Value v) {
    final Optional<Reference> ref = v.reference();
    if (ref.isPresent()) {
      final String name = cfg.nameFunc().name(ref.get().root(), ref.get().path());
      if (name != null && !name.isEmpty()) {
        if (!defs.containsKey(name)) {
          // Reserve the name first so that a cycle back to it ends here.
          defs.put(name, null);
          StructuredLog.finer(LOG, "generate.def", "name", name, "path", ref.get().path());
          defs.put(name, makeItem(v.dereference()));
        }
        return new Item.Ref(name);
      }
    }
    if (v.isBottom()) {
      return new Item.False();
    }
    final Expression e = v.expr();
    switch (e.op()) {
      case AND -> {
        return new Item.AllOf(makeItems(e.args()));
      }
      case OR -> {
        return new Item.AnyOf(makeItems(e.args()));
      }
      case REGEX_MATCH, NOT_REGEX_MATCH -> {
        return regexp(e);
      }
      case EQUAL, NOT_EQUAL -> {
        final Value arg = e.args().get(0);
        if (!arg.isConcrete()) {
          // Not expressible, so accept anything.
          return new Item.True();
        }
        final Item c = new Item.Const(json(arg.decode()));
        return e.op() == Operator.EQUAL ? c : new Item.Not(c);
      }
      case LESS_THAN, LESS_THAN_EQUAL, GREATER_THAN, GREATER_THAN_EQUAL -> {
        return bound(e);
      }
      case CALL -> {
        return call(v, e);
      }
      default -> {
        // Plain values, handled below.
      }
    }
    final Kinds kind = v.incompleteKind();
    if (v.isConcrete() && !kind.has(Kind.STRUCT) && !kind.has(Kind.LIST)) {
      return new Item.Const(json(v.decode()));
    }
    if (kind.isTop()) {
      return new Item.True();
    }
    final List<Item> elems = new ArrayList<>();
    final Item.Type type = new Item.Type(kind);
    if (!type.names().isEmpty()) {
      elems.add(type);
    }
    if (kind.equals(Kinds.STRUCT)) {
      final Item.Properties props = struct(v);
      if (!props.isEmpty()) {
        elems.add(props);
      }
    } else if (kind.equals(Kinds.LIST)) {
      elems.addAll(list(v));
    }
    return switch (elems.size()) {
      case 0 -> new Item.True();
      case 1 -> elems.get(0);
      default -> new Item.AllOf(elems);
    };
  }

  private List<Item> makeItems(List<Value> values) {
    final List<Item> out = new ArrayList<>(values.size());
    for (Value v : values) {
      out.add(makeItem(v));
    }
    return out;
  }

  private Item regexp(Expression e) {
    final Value arg = e.args().get(0);
    final String re = stringArg(arg);
    if (re == null) {
      return new Item.False();
    }
    final Item m = new Item.Pattern(re);
    return Item.AllOf.of(new Item.Type(Kinds.STRING), e.op() == Operator.REGEX_MATCH ? m : new Item.Not(m));
  }

  private Item bound(Expression e) {
    final Value arg = e.args().get(0);
    final Kinds kind = arg.incompleteKind();
    if (!kind.isEmpty() && Kinds.NUMBER.containsAll(kind)) {
      if (!arg.isConcrete()) {
        return new Item.True();
      }
      final BigDecimal n = decimalArg(arg);
      if (n == null) {
        return new Item.False();
      }
      return Item.AllOf.of(new Item.Bounds(e.op(), n), new Item.Type(Kinds.NUMBER));
    }
    if (kind.equals(Kinds.STRING)) {
      // String ordering has no keyword.
      return new Item.Type(Kinds.STRING);
    }
    addError(arg, "bad argument to unary comparison");
    return new Item.False();
  }

  private Item call(Value v, Expression e) {
    final List<Value> args = e.args();
    final String fn = e.function();
    return switch (fn) {
      case "matchN" -> arity(v, fn, args, 2) ? matchN(args.get(0), args.get(1)) : new Item.False();
      case "matchIf" -> {
        if (!arity(v, fn, args, 3)) {
          yield new Item.False();
        }
        yield new Item.IfThenElse(makeItem(args.get(0)), branch(args.get(1)), branch(args.get(2)));
      }
      case "list.MatchN" -> arity(v, fn, args, 2) ? contains(args.get(0), args.get(1)) : new Item.False();
      case "list.MinItems", "list.MaxItems" -> withType(Kinds.LIST, v, fn, args,
          n -> new Item.ItemsBounds(fn.endsWith("MinItems"), n));
      case "list.UniqueItems" -> arity(v, fn, args, 0)
          ? Item.AllOf.of(new Item.Type(Kinds.LIST), new Item.UniqueItems())
          : new Item.False();
      case "struct.MinFields", "struct.MaxFields" -> withType(Kinds.STRUCT, v, fn, args,
          n -> new Item.PropertyBounds(fn.endsWith("MinFields"), n));
      case "strings.MinRunes", "strings.MaxRunes" -> withType(Kinds.STRING, v, fn, args,
          n -> new Item.LengthBounds(fn.endsWith("MinRunes"), n));
      case "math.MultipleOf" -> {
        if (!arity(v, fn, args, 1)) {
          yield new Item.False();
        }
        final BigDecimal n = decimalArg(args.get(0));
        yield n == null ? new Item.False() : Item.AllOf.of(new Item.Type(Kinds.NUMBER), new Item.MultipleOf(n));
      }
      case "time.Format" -> arity(v, fn, args, 1) ? timeFormat(args.get(0)) : new Item.False();
      case "time.Time" -> format(v, fn, args, "date-time");
      case "net.AbsURL" -> format(v, fn, args, "uri");
      case "net.URL" -> format(v, fn, args, "uri-reference");
      case "regexp.Valid" -> format(v, fn, args, "regex");
      // The evaluator already applies close with one argument.
      case "close" -> arity(v, fn, args, 1) ? makeItem(args.get(0)) : new Item.False();
      case "error" -> new Item.False();
      default -> {
        StructuredLog.fine(LOG, "generate.call.unknown", "path", v.path(), "function", fn);
        yield new Item.True();
      }
    };
  }

  @FunctionalInterface
  private interface CountItem {
    Item make(long n);
  }

  private Item withType(Kinds kind, Value v, String fn, List<Value> args, CountItem make) {
    if (!arity(v, fn, args, 1)) {
      return new Item.False();
    }
    final Long n = longArg(args.get(0));
    if (n == null) {
      return new Item.False();
    }
    return Item.AllOf.of(new Item.Type(kind), make.make(n));
  }

  private Item format(Value v, String fn, List<Value> args, String format) {
    if (!arity(v, fn, args, 0)) {
      return new Item.False();
    }
    return Item.AllOf.of(new Item.Type(Kinds.STRING), new Item.Format(format));
  }

  private Item timeFormat(Value layoutArg) {
    final String layout = stringArg(layoutArg);
    if (layout == null) {
      return new Item.False();
    }
    final String format = switch (layout) {
      case RFC3339, RFC3339_NANO -> "date-time";
      case DATE_ONLY -> "date";
      case TIME_ONLY -> "time";
      default -> null;
    };
    if (format == null) {
      // Other layouts only say that the value is a string.
      return new Item.Type(Kinds.STRING);
    }
    return Item.AllOf.of(new Item.Type(Kinds.STRING), new Item.Format(format));
  }

  /// matchN counts that correspond to a combinator: 0 is `not`, 1 is `oneOf`,
  /// `>=1` is `anyOf` and all of them is `allOf`.
  private Item matchN(Value count, Value schemas) {
    final List<Item> items = makeItems(schemas.elements());
    final Expression ce = count.expr();
    if (ce.op() == Operator.GREATER_THAN_EQUAL && BigInteger.ONE.equals(integer(ce.args().get(0)))) {
      if (items.isEmpty()) {
        return new Item.False();
      }
      return items.size() == 1 ? items.get(0) : new Item.AnyOf(items);
    }
    final BigInteger n = integer(count);
    if (n != null && n.signum() == 0) {
      if (items.isEmpty()) {
        return new Item.True();
      }
      return new Item.Not(items.size() == 1 ? items.get(0) : new Item.AnyOf(items));
    }
    if (BigInteger.ONE.equals(n)) {
      if (items.isEmpty()) {
        return new Item.False();
      }
      return items.size() == 1 ? items.get(0) : new Item.OneOf(items);
    }
    if (n != null && n.equals(BigInteger.valueOf(items.size()))) {
      return new Item.AllOf(items);
    }
    StructuredLog.fine(LOG, "generate.matchN.unsupported", "path", count.path(), "count", count);
    return new Item.True();
  }

  // A top branch of matchIf is left out.
  private Item branch(Value v) {
    final Item it = makeItem(v);
    return it instanceof Item.True ? null : it;
  }

  private Item contains(Value count, Value elem) {
    Long min = null;
    Long max = null;
    final Expression ce = count.expr();
    final List<Value> bounds = ce.op() == Operator.AND ? ce.args() : List.of(count);
    for (Value b : bounds) {
      final Expression be = b.expr();
      if (be.op() == Operator.NO_OP && b.isConcrete()) {
        min = longArg(b);
        max = min;
        continue;
      }
      final Long n = be.args().size() == 1 ? longArg(be.args().get(0)) : null;
      if (n == null) {
        addError(b, "cannot express list.MatchN count %s in JSON Schema", b);
        return new Item.False();
      }
      switch (be.op()) {
        case GREATER_THAN_EQUAL -> min = n;
        case GREATER_THAN -> min = n + 1;
        case LESS_THAN_EQUAL -> max = n;
        case LESS_THAN -> max = n - 1;
        default -> {
          addError(b, "cannot express list.MatchN count %s in JSON Schema", b);
          return new Item.False();
        }
      }
    }
    if (min == null || min < 0) {
      min = 0L;
    }
    if (max != null && (max < 0 || min > max)) {
      // No list has such a number of matches.
      return new Item.False();
    }
    if (min == 1L) {
      // One match is what contains means on its own.
      min = null;
    }
    return Item.AllOf.of(new Item.Type(Kinds.LIST), new Item.Contains(makeItem(elem), min, max));
  }

  private Item.Properties struct(Value v) {
    final SortedMap<String, Item> properties = new TreeMap<>();
    final List<String> required = new ArrayList<>();
    final SortedMap<String, Item> patterns = new TreeMap<>();
    Item additional = null;
    for (FieldInfo f : v.fields()) {
      final String name = f.selector().unquoted();
      // A concrete regular field may be left out since its value is known.
      if (f.required() || !f.optional() && !f.value().isConcrete()) {
        required.add(name);
      }
      Item it = makeItem(f.value());
      if (!f.doc().isEmpty()) {
        it = Item.AllOf.of(it, new Item.Description(String.join("\n", f.doc())));
      }
      properties.put(name, it);
    }
    for (PatternConstraint p : v.patterns()) {
      final Item it = makeItem(p.value());
      final String re = labelPattern(p.pattern());
      if (re != null) {
        patterns.merge(re, it, (a, b) -> Item.AllOf.of(a, b));
      } else if (coversOtherFields(p.pattern())) {
        additional = additional == null ? it : Item.AllOf.of(additional, it);
      } else {
        StructuredLog.fine(LOG, "generate.pattern.unsupported", "path", v.path(), "pattern", p.pattern());
      }
    }
    if (additional == null) {
      if (cfg.explicitOpen()) {
        if (v.isExplicitlyOpen()) {
          additional = new Item.True();
        }
      } else if (v.isClosed()) {
        additional = new Item.False();
      }
    }
    return new Item.Properties(properties, required, additional, patterns);
  }

  // The regexp of a `[=~re]` label, allowing exclusions alongside it.
  private static String labelPattern(Value pattern) {
    String re = null;
    for (Value c : conjuncts(pattern)) {
      final Expression ce = c.expr();
      if (ce.op() == Operator.REGEX_MATCH && re == null && ce.args().get(0).isConcrete()
          && ce.args().get(0).decode() instanceof String s) {
        re = s;
      } else if (ce.op() != Operator.NOT_REGEX_MATCH) {
        return null;
      }
    }
    return re;
  }

  // Any string, or only exclusions of names matched elsewhere.
  private static boolean coversOtherFields(Value pattern) {
    if (pattern.isTop()) {
      return true;
    }
    if (pattern.incompleteKind().equals(Kinds.STRING) && pattern.expr().op() == Operator.NO_OP
        && !pattern.isConcrete()) {
      return true;
    }
    for (Value c : conjuncts(pattern)) {
      if (c.expr().op() != Operator.NOT_REGEX_MATCH) {
        return false;
      }
    }
    return true;
  }

  private static List<Value> conjuncts(Value v) {
    final Expression e = v.expr();
    return e.op() == Operator.AND ? e.args() : List.of(v);
  }

  /// A closed list has an exact length; an open one a minimum length.
  private List<Item> list(Value v) {
    final List<Item> prefix = makeItems(v.elements());
    final long n = prefix.size();
    final List<Item> out = new ArrayList<>();
    final Optional<Value> rest = v.rest();
    if (rest.isEmpty()) {
      out.add(new Item.Items(prefix, new Item.False()));
      if (n > 0) {
        out.add(new Item.ItemsBounds(true, n));
      }
      out.add(new Item.ItemsBounds(false, n));
      return out;
    }
    Item r = makeItem(rest.get());
    if (r instanceof Item.True) {
      r = null;
    }
    if (!prefix.isEmpty() || r != null) {
      out.add(new Item.Items(prefix, r));
    }
    if (n > 0) {
      out.add(new Item.ItemsBounds(true, n));
    }
    return out;
  }

  private boolean arity(Value v, String fn, List<Value> args, int want) {
    if (args.size() == want) {
      return true;
    }
    addError(v, "%s expects %d argument%s, got %d", fn, want, want == 1 ? "" : "s", args.size());
    return false;
  }

  private String stringArg(Value arg) {
    if (arg.isConcrete() && arg.decode() instanceof String s) {
      return s;
    }
    addError(arg, "expected a concrete string, found %s", arg);
    return null;
  }

  private Long longArg(Value arg) {
    final BigInteger i = integer(arg);
    if (i == null || i.bitLength() >= 64) {
      addError(arg, "expected an integer, found %s", arg);
      return null;
    }
    return i.longValue();
  }

  private BigDecimal decimalArg(Value arg) {
    if (arg.isConcrete()) {
      final Object o = arg.decode();
      if (o instanceof BigInteger i) {
        return new BigDecimal(i);
      }
      if (o instanceof BigDecimal d) {
        return d;
      }
    }
    addError(arg, "expected a number, found %s", arg);
    return null;
  }

  private static BigInteger integer(Value v) {
    return v.isConcrete() && v.decode() instanceof BigInteger i ? i : null;
  }

  /// Converts a decoded concrete value to JSON.
  static JsonNode json(Object o) {
    if (o instanceof String s) {
      return FACTORY.textNode(s);
    }
    if (o instanceof BigInteger i) {
      return SchemaObjects.number(new BigDecimal(i));
    }
    if (o instanceof BigDecimal d) {
      return SchemaObjects.number(d);
    }
    if (o instanceof Boolean b) {
      return FACTORY.booleanNode(b);
    }
    if (o instanceof List<?> list) {
      final ArrayNode a = FACTORY.arrayNode();
      for (Object e : list) {
        a.add(json(e));
      }
      return a;
    }
    if (o instanceof Map<?, ?> map) {
      final ObjectNode obj = FACTORY.objectNode();
      map.forEach((k, e) -> obj.set(k.toString(), json(e)));
      return obj;
    }
    if (o == Value.Null.INSTANCE) {
      return FACTORY.nullNode();
    }
    throw new IllegalStateException("unexpected decoded value " + o);
  }

  private void addError(Value at, String format, Object... args) {
    final SchemaError err = new SchemaError(at.path().toString(), String.format(format, args));
    StructuredLog.fine(LOG, "generate.error", "path", err.location(), "message", err.message());
    errors.add(err);
  }
}
