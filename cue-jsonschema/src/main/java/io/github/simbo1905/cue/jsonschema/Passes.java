package io.github.simbo1905.cue.jsonschema;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/// Rewrites applied to a generated [Item] tree before it is rendered. Each pass is
/// stable: applying it to its own output changes nothing. Every item a pass returns
/// is canonical in the given [Interner].
final class Passes {

  private Passes() {
  }

  /// Flattens nested `allOf` items into one, dropping repeated members and members
  /// that accept anything, and intersecting `type` members. A single remaining
  /// member replaces the `allOf`.
  static Item mergeAllOf(Item it, Interner in) {
    if (!(it instanceof Item.AllOf all)) {
      return in.intern(it.apply(e -> mergeAllOf(e, in)));
    }
    final List<Item> conjuncts = new ArrayList<>();
    flatten(all, conjuncts);
    final List<Item> out = new ArrayList<>();
    int typeAt = -1;
    for (Item e : conjuncts) {
      final Item e1 = mergeAllOf(e, in);
      if (e1 instanceof Item.False) {
        return e1;
      }
      if (e1 instanceof Item.True || containsSame(out, e1)) {
        continue;
      }
      if (e1 instanceof Item.Type t) {
        if (typeAt >= 0) {
          final Item.Type both = ((Item.Type) out.get(typeAt)).intersect(t);
          if (both.names().isEmpty()) {
            return in.intern(new Item.False());
          }
          out.set(typeAt, in.intern(both));
          continue;
        }
        typeAt = out.size();
      }
      out.add(e1);
    }
    final Item merged = switch (out.size()) {
      case 0 -> new Item.True();
      case 1 -> out.get(0);
      default -> new Item.AllOf(out);
    };
    return in.intern(merged);
  }

  // Members are canonical, so identity is equality.
  private static boolean containsSame(List<Item> items, Item it) {
    for (Item e : items) {
      if (e == it) {
        return true;
      }
    }
    return false;
  }

  private static void flatten(Item.AllOf all, List<Item> out) {
    for (Item e : all.elems()) {
      if (e instanceof Item.AllOf nested) {
        flatten(nested, out);
      } else {
        out.add(e);
      }
    }
  }

  /// Replaces an `anyOf` whose members are all constants of one JSON type with an
  /// `enum` of those constants. An empty `anyOf` is left alone.
  static Item enumFromConst(Item it, Interner in) {
    if (!(it instanceof Item.AnyOf any) || any.elems().isEmpty()) {
      return in.intern(it.apply(e -> enumFromConst(e, in)));
    }
    final List<JsonNode> values = new ArrayList<>();
    for (Item e : any.elems()) {
      if (!(e instanceof Item.Const c)
          || !values.isEmpty() && values.get(0).getNodeType() != c.value().getNodeType()) {
        return in.intern(it.apply(e1 -> enumFromConst(e1, in)));
      }
      values.add(c.value());
    }
    return in.intern(new Item.EnumOf(values));
  }
}
