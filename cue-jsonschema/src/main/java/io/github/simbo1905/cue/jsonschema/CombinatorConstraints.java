package io.github.simbo1905.cue.jsonschema;

import io.github.simbo1905.cue.Kinds;
import io.github.simbo1905.cue.ast.BasicLit;
import io.github.simbo1905.cue.ast.CallExpr;
import io.github.simbo1905.cue.ast.Expr;
import io.github.simbo1905.cue.ast.Ident;
import io.github.simbo1905.cue.ast.ListLit;
import io.github.simbo1905.cue.ast.Op;
import io.github.simbo1905.cue.ast.UnaryExpr;

import java.util.ArrayList;
import java.util.List;

/// `allOf`, `anyOf`, `oneOf`, `not` and `if`/`then`/`else`, all written with
/// `matchN` and `matchIf`.
final class CombinatorConstraints {

  private CombinatorConstraints() {
  }

  static void allOf(String key, SchemaNode n, State s) {
    final List<SchemaNode> items = s.listItems("allOf", n, false);
    if (items.isEmpty()) {
      s.errf(n, "allOf requires at least one subschema");
      return;
    }
    Kinds knownTypes = Kinds.NONE;
    final List<Expr> a = new ArrayList<>();
    for (SchemaNode v : items) {
      final State.Decoded sub = s.schemaState(v, s.allowedTypes);
      s.allowedTypes = s.allowedTypes.intersect(sub.info().allowedTypes);
      if (sub.info().hasConstraints) {
        // knownTypes only avoids redundant disjunctions, so a union is enough here.
        knownTypes = knownTypes.union(sub.info().knownTypes);
        a.add(sub.expr());
      }
    }
    if (a.isEmpty()) {
      return;
    }
    s.knownTypes = s.knownTypes.intersect(knownTypes);
    if (a.size() == 1) {
      s.all.add(n, a.get(0));
      return;
    }
    s.all.add(n, matchN(BasicLit.integer(items.size()), a));
  }

  static void anyOf(String key, SchemaNode n, State s) {
    final List<SchemaNode> items = s.listItems("anyOf", n, false);
    if (items.isEmpty()) {
      s.errf(n, "anyOf requires at least one subschema");
      return;
    }
    Kinds types = Kinds.NONE;
    Kinds knownTypes = Kinds.NONE;
    final List<Expr> a = new ArrayList<>();
    for (SchemaNode v : items) {
      final State.Decoded sub = s.schemaState(v, s.allowedTypes);
      if (sub.info().allowedTypes.isEmpty()) {
        continue;
      }
      types = types.union(sub.info().allowedTypes);
      knownTypes = knownTypes.union(sub.info().knownTypes);
      a.add(sub.expr());
    }
    if (a.isEmpty()) {
      s.allowedTypes = Kinds.NONE;
      return;
    }
    if (a.size() == 1) {
      s.all.add(n, a.get(0));
      return;
    }
    s.allowedTypes = s.allowedTypes.intersect(types);
    s.knownTypes = s.knownTypes.intersect(knownTypes);
    s.all.add(n, matchN(new UnaryExpr(Op.GEQ, BasicLit.integer(1)), a));
  }

  static void oneOf(String key, SchemaNode n, State s) {
    final List<SchemaNode> items = s.listItems("oneOf", n, false);
    if (items.isEmpty()) {
      s.errf(n, "oneOf requires at least one subschema");
      return;
    }
    Kinds types = Kinds.NONE;
    Kinds knownTypes = Kinds.NONE;
    boolean needsConstraint = false;
    final List<Expr> a = new ArrayList<>();
    for (SchemaNode v : items) {
      final State.Decoded sub = s.schemaState(v, s.allowedTypes);
      if (sub.info().allowedTypes.isEmpty()) {
        continue;
      }
      // Unconstrained arms that overlap still need the exactly-one check.
      if (sub.info().hasConstraints || !types.intersect(sub.info().allowedTypes).isEmpty()) {
        needsConstraint = true;
      }
      types = types.union(sub.info().allowedTypes);
      knownTypes = knownTypes.union(sub.info().knownTypes);
      a.add(sub.expr());
    }
    s.allowedTypes = s.allowedTypes.intersect(types);
    if (a.isEmpty() || !needsConstraint) {
      return;
    }
    s.knownTypes = s.knownTypes.intersect(knownTypes);
    if (a.size() == 1) {
      s.all.add(n, a.get(0));
      return;
    }
    s.all.add(n, matchN(BasicLit.integer(1), a));
  }

  static void not(String key, SchemaNode n, State s) {
    s.all.add(n, matchN(BasicLit.integer(0), List.of(s.schema(n))));
  }

  static void ifKeyword(String key, SchemaNode n, State s) {
    s.ifConstraint = n;
  }

  static void thenKeyword(String key, SchemaNode n, State s) {
    s.thenConstraint = n;
  }

  static void elseKeyword(String key, SchemaNode n, State s) {
    s.elseConstraint = n;
  }

  /// Runs once all keywords are seen, since it needs all three of `if`, `then`
  /// and `else`.
  static void ifThenElse(State s) {
    if (s.ifConstraint == null || (s.thenConstraint == null && s.elseConstraint == null)) {
      return;
    }
    final State.Decoded ifSub = s.schemaState(s.ifConstraint, s.allowedTypes);
    Expr thenExpr = Ident.top();
    Expr elseExpr = Ident.top();
    if (s.thenConstraint != null) {
      // then only applies where if matched, so it is limited by both.
      thenExpr = s.schemaState(s.thenConstraint, s.allowedTypes.intersect(ifSub.info().allowedTypes)).expr();
    }
    if (s.elseConstraint != null) {
      elseExpr = s.schemaState(s.elseConstraint, s.allowedTypes).expr();
    }
    s.all.add(s.pos, CallExpr.builtin("matchIf", ifSub.expr(), thenExpr, elseExpr));
  }

  private static Expr matchN(Expr count, List<Expr> schemas) {
    return CallExpr.builtin("matchN", count, new ListLit(schemas));
  }
}
