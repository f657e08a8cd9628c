package io.github.simbo1905.cue.jsonschema;

import io.github.simbo1905.cue.ast.BottomLit;
import io.github.simbo1905.cue.ast.Expr;
import io.github.simbo1905.cue.ast.Op;
import io.github.simbo1905.cue.ast.Printer;
import io.github.simbo1905.cue.ast.UnaryExpr;

/// Numeric bounds and `multipleOf`.
///
/// Draft 4 and OpenAPI write `exclusiveMinimum: true` next to `minimum`; later
/// drafts give the bound itself. Both forms are decoded before `minimum` so the
/// right operator can be picked.
final class NumberConstraints {

  private NumberConstraints() {
  }

  static void exclusiveMaximum(String key, SchemaNode n, State s) {
    if (boolForm(s)) {
      if (checkForm(key, n, s)) {
        s.exclusiveMax = n.json().booleanValue();
      }
      return;
    }
    if (checkForm(key, n, s)) {
      s.add(n, CoreType.NUMBER, new UnaryExpr(Op.LSS, s.number(n)));
    }
  }

  static void exclusiveMinimum(String key, SchemaNode n, State s) {
    if (boolForm(s)) {
      if (checkForm(key, n, s)) {
        s.exclusiveMin = n.json().booleanValue();
      }
      return;
    }
    if (checkForm(key, n, s)) {
      s.add(n, CoreType.NUMBER, new UnaryExpr(Op.GTR, s.number(n)));
    }
  }

  static void maximum(String key, SchemaNode n, State s) {
    s.add(n, CoreType.NUMBER, new UnaryExpr(s.exclusiveMax ? Op.LSS : Op.LEQ, s.number(n)));
  }

  static void minimum(String key, SchemaNode n, State s) {
    s.add(n, CoreType.NUMBER, new UnaryExpr(s.exclusiveMin ? Op.GTR : Op.GEQ, s.number(n)));
  }

  static void multipleOf(String key, SchemaNode n, State s) {
    final Expr x = s.number(n);
    if (x instanceof BottomLit) {
      return;
    }
    if (n.json().decimalValue().signum() <= 0) {
      s.errf(n, "%s must be strictly greater than 0", Printer.quote(key));
      return;
    }
    s.add(n, CoreType.NUMBER, State.pkgCall("math", "MultipleOf", x));
  }

  private static boolean boolForm(State s) {
    return s.schemaVersion == Version.DRAFT4 || s.schemaVersion.is(Version.OPENAPI_LIKE);
  }

  /// Reports whether the value has the form this version expects, recording an
  /// error when it does not.
  private static boolean checkForm(String key, SchemaNode n, State s) {
    if (boolForm(s)) {
      if (!n.json().isBoolean()) {
        s.errf(n, "value of %s must be a boolean in %s", Printer.quote(key), s.schemaVersion);
        return false;
      }
      return true;
    }
    if (!n.json().isNumber()) {
      s.errf(n, "value of %s must be a number in %s", Printer.quote(key), s.schemaVersion);
      return false;
    }
    return true;
  }
}
