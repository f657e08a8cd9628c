package io.github.simbo1905.cue.jsonschema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Building and ordering generated schema objects.
final class SchemaObjects {

  static final JsonNodeFactory FACTORY = JsonNodeFactory.instance;

  /// Keywords whose meaning depends on each other. Two of them from one group must
  /// come from the same source schema object.
  static final List<Set<String>> KEYWORD_GROUPS = List.of(
      Set.of("properties", "patternProperties", "additionalProperties"),
      Set.of("contains", "maxContains", "minContains"),
      Set.of("items", "additionalItems", "prefixItems"),
      Set.of("if", "then", "else"));

  private static final Map<String, Set<String>> INTERACTIONS;
  private static final Map<String, Integer> PRIORITY;

  static {
    final Map<String, Set<String>> interactions = new HashMap<>();
    final Map<String, Integer> priority = new HashMap<>();
    priority.put("$schema", 0);
    priority.put("$defs", 1);
    priority.put("type", 2);
    final int base = priority.size();
    for (int i = 0; i < KEYWORD_GROUPS.size(); i++) {
      for (String k : KEYWORD_GROUPS.get(i)) {
        interactions.put(k, KEYWORD_GROUPS.get(i));
        priority.put(k, base + i + 1);
      }
    }
    INTERACTIONS = Collections.unmodifiableMap(interactions);
    PRIORITY = Collections.unmodifiableMap(priority);
  }

  /// `$schema` first, then `$defs`, `type`, the keyword groups, and everything else;
  /// lexical within a rank.
  static final Comparator<String> KEYWORD_ORDER =
      Comparator.<String>comparingInt(k -> PRIORITY.getOrDefault(k, 1000)).thenComparing(Comparator.naturalOrder());

  private SchemaObjects() {
  }

  static ObjectNode single(String keyword, JsonNode value) {
    final ObjectNode o = FACTORY.objectNode();
    o.set(keyword, value);
    return o;
  }

  /// Reports whether folding next into target would change what either means.
  static boolean conflicts(ObjectNode target, JsonNode next) {
    final Iterator<String> names = next.fieldNames();
    while (names.hasNext()) {
      final String name = names.next();
      if (target.has(name)) {
        return true;
      }
      for (String other : INTERACTIONS.getOrDefault(name, Set.of())) {
        if (target.has(other)) {
          return true;
        }
      }
    }
    return false;
  }

  /// A copy of o with its keywords in [#KEYWORD_ORDER].
  static ObjectNode sorted(ObjectNode o) {
    final List<String> names = new ArrayList<>();
    o.fieldNames().forEachRemaining(names::add);
    names.sort(KEYWORD_ORDER);
    final ObjectNode out = FACTORY.objectNode();
    for (String name : names) {
      out.set(name, o.get(name));
    }
    return out;
  }

  static JsonNode count(long n) {
    return number(BigDecimal.valueOf(n));
  }

  /// Integral values are written without a fraction or exponent.
  static JsonNode number(BigDecimal n) {
    final BigDecimal stripped = n.stripTrailingZeros();
    if (stripped.scale() <= 0) {
      final BigInteger i = stripped.toBigInteger();
      if (i.bitLength() < 32) {
        return FACTORY.numberNode(i.intValue());
      }
      if (i.bitLength() < 64) {
        return FACTORY.numberNode(i.longValue());
      }
      return FACTORY.numberNode(i);
    }
    return FACTORY.numberNode(stripped);
  }
}
