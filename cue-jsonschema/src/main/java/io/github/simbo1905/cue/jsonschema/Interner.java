package io.github.simbo1905.cue.jsonschema;

import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Map;

/// Canonical [Item] instances for one generation. Items that are equal come back as the
/// same instance, so the rewrite passes can compare them with `==`.
///
/// Not thread safe; each [Generator] owns one.
final class Interner {

  private final Map<Item, Item> byValue = new HashMap<>();
  private final Map<Item, Boolean> canonical = new IdentityHashMap<>();

  /// The canonical instance equal to it, with every child canonical too. Null stays null.
  @SuppressWarnings("unchecked")
  <T extends Item> T intern(T it) {
    if (it == null || canonical.containsKey(it)) {
      return it;
    }
    final Item withChildren = it.apply(this::intern);
    final Item c = byValue.computeIfAbsent(withChildren, k -> k);
    canonical.put(c, Boolean.TRUE);
    return (T) c;
  }

  int size() {
    return byValue.size();
  }
}
