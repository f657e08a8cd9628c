package io.github.simbo1905.cue.jsonschema;

import io.github.simbo1905.cue.ast.Expr;
import io.github.simbo1905.cue.ast.Op;
import io.github.simbo1905.cue.ast.UnaryExpr;

final class StringConstraints {

  private StringConstraints() {
  }

  static void pattern(String key, SchemaNode n, State s) {
    final Expr re = s.regexpValue(n);
    if (re != null) {
      s.add(n, CoreType.STRING, new UnaryExpr(Op.MAT, re));
    }
  }

  static void minLength(String key, SchemaNode n, State s) {
    s.add(n, CoreType.STRING, State.pkgCall("strings", "MinRunes", s.uint(n)));
  }

  static void maxLength(String key, SchemaNode n, State s) {
    s.add(n, CoreType.STRING, State.pkgCall("strings", "MaxRunes", s.uint(n)));
  }
}
