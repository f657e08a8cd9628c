package io.github.simbo1905.cue.jsonschema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.simbo1905.cue.Kind;
import io.github.simbo1905.cue.Kinds;
import io.github.simbo1905.cue.Operator;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.UnaryOperator;

import static io.github.simbo1905.cue.jsonschema.SchemaObjects.FACTORY;
import static io.github.simbo1905.cue.jsonschema.SchemaObjects.count;
import static io.github.simbo1905.cue.jsonschema.SchemaObjects.number;
import static io.github.simbo1905.cue.jsonschema.SchemaObjects.single;

/// The intermediate form of a generated schema. Each item renders as a boolean
/// schema or a schema object; the rewrite passes in [Passes] work on items so they
/// only need [#apply] to reach every child.
///
/// Items are immutable and compare structurally. A [Generator] keeps one instance of
/// each distinct item through its [Interner].
sealed interface Item {

  /// Renders this item as a boolean schema or a schema object.
  JsonNode render();

  /// Returns this item with f applied to each direct child, or this item itself when
  /// nothing changed. f is not applied to the item itself.
  Item apply(UnaryOperator<Item> f);

  /// Accepts any value.
  record True() implements Item {
    @Override
    public JsonNode render() {
      return BooleanNode.TRUE;
    }

    @Override
    public Item apply(UnaryOperator<Item> f) {
      return this;
    }
  }

  /// Accepts no value.
  record False() implements Item {
    @Override
    public JsonNode render() {
      return BooleanNode.FALSE;
    }

    @Override
    public Item apply(UnaryOperator<Item> f) {
      return this;
    }
  }

  record AllOf(List<Item> elems) implements Item {
    public AllOf {
      elems = List.copyOf(elems);
    }

    static AllOf of(Item... elems) {
      return new AllOf(List.of(elems));
    }

    /// A schema object is already a conjunction, so members are folded into one object
    /// unless they share a keyword or use keywords that interact.
    @Override
    public JsonNode render() {
      final List<JsonNode> unmerged = new ArrayList<>();
      final ObjectNode merged = FACTORY.objectNode();
      for (Item e : elems) {
        final JsonNode node = e.render();
        if (node.isBoolean()) {
          if (!node.booleanValue()) {
            return node;
          }
          continue;
        }
        if (SchemaObjects.conflicts(merged, node)) {
          unmerged.add(node);
          continue;
        }
        node.fields().forEachRemaining(m -> merged.set(m.getKey(), m.getValue()));
      }
      if (unmerged.isEmpty()) {
        return SchemaObjects.sorted(merged);
      }
      if (!merged.isEmpty()) {
        unmerged.add(SchemaObjects.sorted(merged));
      }
      return single("allOf", list(unmerged));
    }

    @Override
    public Item apply(UnaryOperator<Item> f) {
      final List<Item> out = applyAll(elems, f);
      return out == elems ? this : new AllOf(out);
    }
  }

  record AnyOf(List<Item> elems) implements Item {
    public AnyOf {
      elems = List.copyOf(elems);
    }

    @Override
    public JsonNode render() {
      return single("anyOf", renderAll(elems));
    }

    @Override
    public Item apply(UnaryOperator<Item> f) {
      final List<Item> out = applyAll(elems, f);
      return out == elems ? this : new AnyOf(out);
    }
  }

  record OneOf(List<Item> elems) implements Item {
    public OneOf {
      elems = List.copyOf(elems);
    }

    @Override
    public JsonNode render() {
      return single("oneOf", renderAll(elems));
    }

    @Override
    public Item apply(UnaryOperator<Item> f) {
      final List<Item> out = applyAll(elems, f);
      return out == elems ? this : new OneOf(out);
    }
  }

  record Not(Item elem) implements Item {
    public Not {
      Objects.requireNonNull(elem, "elem");
    }

    @Override
    public JsonNode render() {
      return single("not", elem.render());
    }

    @Override
    public Item apply(UnaryOperator<Item> f) {
      final Item e = f.apply(elem);
      return e == elem ? this : new Not(e);
    }
  }

  record Const(JsonNode value) implements Item {
    public Const {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public JsonNode render() {
      return single("const", value);
    }

    @Override
    public Item apply(UnaryOperator<Item> f) {
      return this;
    }
  }

  record EnumOf(List<JsonNode> values) implements Item {
    public EnumOf {
      values = List.copyOf(values);
    }

    @Override
    public JsonNode render() {
      return single("enum", list(values));
    }

    @Override
    public Item apply(UnaryOperator<Item> f) {
      return this;
    }
  }

  /// A reference to an entry of `$defs`.
  record Ref(String defName) implements Item {
    @Override
    public JsonNode render() {
      return single("$ref", FACTORY.textNode("#/$defs/" + JsonPointer.escape(defName)));
    }

    @Override
    public Item apply(UnaryOperator<Item> f) {
      return this;
    }
  }

  /// The `type` keyword. Kinds are kept with float widened to number, since JSON
  /// Schema has no float-only type, and without bytes, which JSON cannot hold.
  record Type(Kinds kinds) implements Item {
    public Type {
      if (kinds.has(Kind.FLOAT)) {
        kinds = kinds.union(Kinds.NUMBER);
      }
      kinds = kinds.without(Kinds.BYTES);
    }

    Type intersect(Type other) {
      return new Type(kinds.intersect(other.kinds));
    }

    List<String> names() {
      final List<String> out = new ArrayList<>();
      if (kinds.containsAll(Kinds.NUMBER)) {
        out.add("number");
      }
      for (Kind k : kinds.kinds()) {
        switch (k) {
          case NULL -> out.add("null");
          case BOOL -> out.add("boolean");
          case INT -> {
            if (!kinds.has(Kind.FLOAT)) {
              out.add("integer");
            }
          }
          case STRING -> out.add("string");
          case LIST -> out.add("array");
          case STRUCT -> out.add("object");
          default -> {
          }
        }
      }
      return out;
    }

    @Override
    public JsonNode render() {
      final List<String> names = names();
      if (names.isEmpty()) {
        return BooleanNode.FALSE;
      }
      if (names.size() == 1) {
        return single("type", FACTORY.textNode(names.get(0)));
      }
      final ArrayNode a = FACTORY.arrayNode();
      names.forEach(a::add);
      return single("type", a);
    }

    @Override
    public Item apply(UnaryOperator<Item> f) {
      return this;
    }
  }

  record Format(String format) implements Item {
    @Override
    public JsonNode render() {
      return single("format", FACTORY.textNode(format));
    }

    @Override
    public Item apply(UnaryOperator<Item> f) {
      return this;
    }
  }

  record Pattern(String regexp) implements Item {
    @Override
    public JsonNode render() {
      return single("pattern", FACTORY.textNode(regexp));
    }

    @Override
    public Item apply(UnaryOperator<Item> f) {
      return this;
    }
  }

  /// A numeric bound; the operator is one of the four comparisons.
  record Bounds(Operator op, BigDecimal n) implements Item {
    @Override
    public JsonNode render() {
      final String keyword = switch (op) {
        case LESS_THAN -> "exclusiveMaximum";
        case LESS_THAN_EQUAL -> "maximum";
        case GREATER_THAN -> "exclusiveMinimum";
        case GREATER_THAN_EQUAL -> "minimum";
        default -> throw new IllegalStateException("unexpected bound operator " + op);
      };
      return single(keyword, number(n));
    }

    @Override
    public Item apply(UnaryOperator<Item> f) {
      return this;
    }
  }

  record MultipleOf(BigDecimal n) implements Item {
    @Override
    public JsonNode render() {
      return single("multipleOf", number(n));
    }

    @Override
    public Item apply(UnaryOperator<Item> f) {
      return this;
    }
  }

  /// `minLength` for a lower bound, `maxLength` otherwise.
  record LengthBounds(boolean lower, long n) implements Item {
    @Override
    public JsonNode render() {
      return single(lower ? "minLength" : "maxLength", count(n));
    }

    @Override
    public Item apply(UnaryOperator<Item> f) {
      return this;
    }
  }

  record ItemsBounds(boolean lower, long n) implements Item {
    @Override
    public JsonNode render() {
      return single(lower ? "minItems" : "maxItems", count(n));
    }

    @Override
    public Item apply(UnaryOperator<Item> f) {
      return this;
    }
  }

  record PropertyBounds(boolean lower, long n) implements Item {
    @Override
    public JsonNode render() {
      return single(lower ? "minProperties" : "maxProperties", count(n));
    }

    @Override
    public Item apply(UnaryOperator<Item> f) {
      return this;
    }
  }

  record UniqueItems() implements Item {
    @Override
    public JsonNode render() {
      return single("uniqueItems", BooleanNode.TRUE);
    }

    @Override
    public Item apply(UnaryOperator<Item> f) {
      return this;
    }
  }

  record Description(String text) implements Item {
    @Override
    public JsonNode render() {
      return single("description", FACTORY.textNode(text));
    }

    @Override
    public Item apply(UnaryOperator<Item> f) {
      return this;
    }
  }

  /// `prefixItems` and `items`. A null rest leaves elements after the prefix unconstrained.
  record Items(List<Item> prefix, Item rest) implements Item {
    public Items {
      prefix = List.copyOf(prefix);
    }

    @Override
    public JsonNode render() {
      final ObjectNode o = FACTORY.objectNode();
      if (!prefix.isEmpty()) {
        o.set("prefixItems", renderAll(prefix));
      }
      if (rest != null) {
        o.set("items", rest.render());
      }
      return SchemaObjects.sorted(o);
    }

    @Override
    public Item apply(UnaryOperator<Item> f) {
      final List<Item> p = applyAll(prefix, f);
      final Item r = rest == null ? null : f.apply(rest);
      return p == prefix && r == rest ? this : new Items(p, r);
    }
  }

  /// `contains` with optional `minContains` and `maxContains`.
  record Contains(Item elem, Long min, Long max) implements Item {
    @Override
    public JsonNode render() {
      final ObjectNode o = FACTORY.objectNode();
      o.set("contains", elem.render());
      if (min != null) {
        o.set("minContains", count(min));
      }
      if (max != null) {
        o.set("maxContains", count(max));
      }
      return SchemaObjects.sorted(o);
    }

    @Override
    public Item apply(UnaryOperator<Item> f) {
      final Item e = f.apply(elem);
      return e == elem ? this : new Contains(e, min, max);
    }
  }

  /// Object keywords. A null additional leaves undeclared properties unconstrained.
  record Properties(SortedMap<String, Item> properties, List<String> required, Item additional,
                    SortedMap<String, Item> patterns) implements Item {
    public Properties {
      properties = Collections.unmodifiableSortedMap(new TreeMap<>(properties));
      required = List.copyOf(required);
      patterns = Collections.unmodifiableSortedMap(new TreeMap<>(patterns));
    }

    boolean isEmpty() {
      return properties.isEmpty() && required.isEmpty() && additional == null && patterns.isEmpty();
    }

    @Override
    public JsonNode render() {
      final ObjectNode o = FACTORY.objectNode();
      if (!properties.isEmpty()) {
        o.set("properties", renderAll(properties));
      }
      if (!required.isEmpty()) {
        final ArrayNode a = FACTORY.arrayNode();
        required.forEach(a::add);
        o.set("required", a);
      }
      if (additional != null) {
        o.set("additionalProperties", additional.render());
      }
      if (!patterns.isEmpty()) {
        o.set("patternProperties", renderAll(patterns));
      }
      return SchemaObjects.sorted(o);
    }

    @Override
    public Item apply(UnaryOperator<Item> f) {
      final SortedMap<String, Item> p = applyAll(properties, f);
      final SortedMap<String, Item> pp = applyAll(patterns, f);
      final Item a = additional == null ? null : f.apply(additional);
      if (p == properties && pp == patterns && a == additional) {
        return this;
      }
      return new Properties(p, required, a, pp);
    }
  }

  /// `if` with at least one of `then` and `else`; a null branch is absent.
  record IfThenElse(Item ifElem, Item thenElem, Item elseElem) implements Item {
    @Override
    public JsonNode render() {
      final ObjectNode o = FACTORY.objectNode();
      o.set("if", ifElem.render());
      if (thenElem != null) {
        o.set("then", thenElem.render());
      }
      if (elseElem != null) {
        o.set("else", elseElem.render());
      }
      return SchemaObjects.sorted(o);
    }

    @Override
    public Item apply(UnaryOperator<Item> f) {
      final Item i = f.apply(ifElem);
      final Item t = thenElem == null ? null : f.apply(thenElem);
      final Item e = elseElem == null ? null : f.apply(elseElem);
      return i == ifElem && t == thenElem && e == elseElem ? this : new IfThenElse(i, t, e);
    }
  }

  private static ArrayNode list(List<JsonNode> nodes) {
    final ArrayNode a = FACTORY.arrayNode();
    nodes.forEach(a::add);
    return a;
  }

  private static ArrayNode renderAll(List<Item> items) {
    final ArrayNode a = FACTORY.arrayNode();
    for (Item it : items) {
      a.add(it.render());
    }
    return a;
  }

  private static ObjectNode renderAll(Map<String, Item> items) {
    final ObjectNode o = FACTORY.objectNode();
    items.forEach((k, v) -> o.set(k, v.render()));
    return o;
  }

  // The same list instance when f changed nothing.
  private static List<Item> applyAll(List<Item> items, UnaryOperator<Item> f) {
    List<Item> out = null;
    for (int i = 0; i < items.size(); i++) {
      final Item e = items.get(i);
      final Item e1 = f.apply(e);
      if (e1 != e && out == null) {
        out = new ArrayList<>(items);
      }
      if (out != null) {
        out.set(i, e1);
      }
    }
    return out == null ? items : out;
  }

  private static SortedMap<String, Item> applyAll(SortedMap<String, Item> items, UnaryOperator<Item> f) {
    SortedMap<String, Item> out = null;
    for (Map.Entry<String, Item> m : items.entrySet()) {
      final Item e1 = f.apply(m.getValue());
      if (e1 != m.getValue()) {
        if (out == null) {
          out = new TreeMap<>(items);
        }
        out.put(m.getKey(), e1);
      }
    }
    return out == null ? items : out;
  }
}
