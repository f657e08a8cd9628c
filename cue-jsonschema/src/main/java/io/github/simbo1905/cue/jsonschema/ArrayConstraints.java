package io.github.simbo1905.cue.jsonschema;

import io.github.simbo1905.cue.ast.BasicLit;
import io.github.simbo1905.cue.ast.BinaryExpr;
import io.github.simbo1905.cue.ast.Ellipsis;
import io.github.simbo1905.cue.ast.Expr;
import io.github.simbo1905.cue.ast.ListLit;
import io.github.simbo1905.cue.ast.Op;
import io.github.simbo1905.cue.ast.UnaryExpr;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/// Array keywords. Positional schemas build a list literal whose tail ellipsis
/// says what may follow them.
final class ArrayConstraints {

  private ArrayConstraints() {
  }

  static void prefixItems(String key, SchemaNode n, State s) {
    prefix(key, n, s);
  }

  static void items(String key, SchemaNode n, State s) {
    s.hasItems = true;
    if (n.json().isArray()) {
      if (!s.schemaVersion.is(Version.vto(Version.DRAFT2019_09))) {
        s.errf(n, "from version %s onwards, the value of \"items\" must be an object or a boolean",
            Version.DRAFT2020_12);
        return;
      }
      s.listItemsIsArray = true;
      prefix(key, n, s);
      return;
    }
    if (!n.isObject() && !n.json().isBoolean()) {
      s.errf(n, "value of \"items\" must be an object or boolean");
      return;
    }
    final boolean closed = n.json().isBoolean() && !n.json().booleanValue();
    if (s.list != null) {
      // Schemas after the positional ones.
      s.setListTail(closed ? null : tail(s.schema(n)));
      return;
    }
    if (closed) {
      s.add(n, CoreType.ARRAY, new ListLit(List.of()));
      return;
    }
    s.add(n, CoreType.ARRAY, ListLit.of(tail(s.schema(n))));
  }

  static void additionalItems(String key, SchemaNode n, State s) {
    if (!n.isObject() && !n.json().isBoolean()) {
      s.errf(n, "value of \"additionalItems\" must be an object or boolean");
      return;
    }
    if (!s.listItemsIsArray || s.list == null) {
      // Only means something after an array of items.
      return;
    }
    if (n.json().isBoolean() && !n.json().booleanValue()) {
      s.setListTail(null);
      return;
    }
    s.setListTail(tail(s.schema(n)));
  }

  static void contains(String key, SchemaNode n, State s) {
    final Expr x = s.schema(n);
    final BigInteger min = s.minContains == null ? BigInteger.ONE : s.minContains;
    Expr count = new UnaryExpr(Op.GEQ, BasicLit.integer(min));
    if (s.maxContains != null) {
      count = BinaryExpr.join(Op.AND, count, new UnaryExpr(Op.LEQ, BasicLit.integer(s.maxContains)));
    }
    s.add(n, CoreType.ARRAY, State.pkgCall("list", "MatchN", count, x));
  }

  static void minContains(String key, SchemaNode n, State s) {
    s.minContains = s.uintValue(n);
  }

  static void maxContains(String key, SchemaNode n, State s) {
    s.maxContains = s.uintValue(n);
  }

  static void minItems(String key, SchemaNode n, State s) {
    s.add(n, CoreType.ARRAY, State.pkgCall("list", "MinItems", s.uint(n)));
  }

  static void maxItems(String key, SchemaNode n, State s) {
    s.add(n, CoreType.ARRAY, State.pkgCall("list", "MaxItems", s.uint(n)));
  }

  static void uniqueItems(String key, SchemaNode n, State s) {
    if (!s.boolValue(n)) {
      return;
    }
    if (s.schemaVersion.is(Version.K8S)) {
      s.errf(n, "cannot set uniqueItems to true in a Kubernetes schema");
      return;
    }
    s.add(n, CoreType.ARRAY, State.pkgCall("list", "UniqueItems"));
  }

  // [s0, s1, ...] open until a later keyword says otherwise.
  private static void prefix(String key, SchemaNode n, State s) {
    final List<Expr> elts = new ArrayList<>();
    for (SchemaNode item : s.listItems(key, n, true)) {
      elts.add(s.schema(item));
    }
    elts.add(new Ellipsis());
    s.list = new ListLit(elts);
    s.add(n, CoreType.ARRAY, s.list);
  }

  private static Ellipsis tail(Expr elem) {
    return State.isTop(elem) ? new Ellipsis() : new Ellipsis(elem);
  }
}
