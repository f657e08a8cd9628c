package io.github.simbo1905.cue.jsonschema;

import io.github.simbo1905.cue.Kinds;
import io.github.simbo1905.cue.ast.Attribute;
import io.github.simbo1905.cue.ast.BasicLit;
import io.github.simbo1905.cue.ast.BinaryExpr;
import io.github.simbo1905.cue.ast.Decl;
import io.github.simbo1905.cue.ast.Expr;
import io.github.simbo1905.cue.ast.Field;
import io.github.simbo1905.cue.ast.Ident;
import io.github.simbo1905.cue.ast.ListLit;
import io.github.simbo1905.cue.ast.Op;
import io.github.simbo1905.cue.ast.Printer;
import io.github.simbo1905.cue.ast.StructLit;
import io.github.simbo1905.cue.ast.UnaryExpr;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/// Object keywords. Fields go into the state's struct literal, which is closed or
/// opened once every keyword has run.
final class ObjectConstraints {

  private ObjectConstraints() {
  }

  static void properties(String key, SchemaNode n, State s) {
    s.hasProperties = true;
    final StructLit obj = s.object(n);
    if (!n.isObject()) {
      s.errf(n, "\"properties\" expected an object, found %s", n.kindName());
    }
    for (Map.Entry<String, SchemaNode> m : n.members()) {
      final String name = m.getKey();
      final State.Decoded sub = s.schemaState(m.getValue(), CoreType.ALL_TYPES, st -> st.preserveUnknownFields = false);
      final Field f = new Field(Field.stringLabel(name), Field.Constraint.OPTIONAL, sub.expr());
      final String doc = sub.info().comment();
      if (doc != null) {
        f.addDoc(doc);
      }
      if (sub.info().deprecated) {
        if (sub.expr() instanceof StructLit) {
          // An attribute after a struct would read as part of it.
          obj.add(State.addTag(name, "deprecated", ""));
        } else {
          f.addAttr(Attribute.of("deprecated", ""));
        }
      }
      obj.add(f);
    }
  }

  static void required(String key, SchemaNode n, State s) {
    if (!n.json().isArray()) {
      s.errf(n, "value of \"required\" must be list of strings, found %s", n.kindName());
      return;
    }
    final StructLit obj = s.object(n);
    final Map<String, Field> fields = new HashMap<>();
    for (Decl d : obj.elts()) {
      if (d instanceof Field f && f.labelName() != null) {
        fields.put(f.labelName(), f);
      }
    }
    for (SchemaNode item : s.listItems("required", n, true)) {
      final String name = s.strValue(item);
      if (name == null) {
        continue;
      }
      final Field f = fields.get(name);
      if (f == null) {
        final Field added = new Field(Field.stringLabel(name), Field.Constraint.REQUIRED, Ident.top());
        fields.put(name, added);
        obj.add(added);
        continue;
      }
      if (f.constraint() == Field.Constraint.REQUIRED) {
        s.errf(item, "duplicate required field %s", Printer.quote(name));
      }
      f.constraint(Field.Constraint.REQUIRED);
    }
  }

  static void patternProperties(String key, SchemaNode n, State s) {
    if (!n.isObject()) {
      s.errf(n, "value of \"patternProperties\" must be an object, found %s", n.kindName());
    }
    final StructLit obj = s.object(n);
    final List<Expr> existing = State.excludeFields(obj.elts());
    for (Map.Entry<String, SchemaNode> m : n.members()) {
      final String pattern = m.getKey();
      if (!s.checkRegexp(m.getValue(), pattern)) {
        continue;
      }
      // additionalProperties applies only where no pattern does.
      s.patterns.add(new UnaryExpr(Op.NMAT, BasicLit.string(pattern)));

      final List<Expr> label = new ArrayList<>();
      label.add(new UnaryExpr(Op.MAT, BasicLit.string(pattern)));
      label.addAll(existing);
      obj.add(new Field(ListLit.of(BinaryExpr.join(Op.AND, label)), s.schema(m.getValue())));
    }
  }

  static void additionalProperties(String key, SchemaNode n, State s) {
    if (n.json().isBoolean()) {
      s.hasAdditionalProperties = true;
      s.openness = n.json().booleanValue() ? State.Openness.EXPLICITLY_OPEN : State.Openness.EXPLICITLY_CLOSED;
      s.object(n);
      return;
    }
    if (!n.isObject()) {
      s.errf(n, "value of \"additionalProperties\" must be an object or boolean");
      return;
    }
    s.hasAdditionalProperties = true;
    final StructLit obj = s.object(n);
    final List<Expr> existing = new ArrayList<>(s.patterns);
    existing.addAll(State.excludeFields(obj.elts()));
    final Expr schema = s.schemaState(n, CoreType.ALL_TYPES, st -> st.preserveUnknownFields = false).expr();
    if (State.isTop(schema)) {
      s.openness = State.Openness.EXPLICITLY_OPEN;
      return;
    }
    s.openness = State.Openness.ALL_FIELDS_COVERED;
    final Expr label = existing.isEmpty() ? new Ident("string") : BinaryExpr.join(Op.AND, existing);
    obj.add(new Field(ListLit.of(label), schema));
  }

  static void propertyNames(String key, SchemaNode n, State s) {
    final Expr names = s.schemaState(n, Kinds.STRING).expr();
    if (!State.isTop(names)) {
      s.add(n, CoreType.OBJECT, StructLit.of(new Field(ListLit.of(names), Ident.top())));
    }
  }

  static void minProperties(String key, SchemaNode n, State s) {
    s.add(n, CoreType.OBJECT, State.pkgCall("struct", "MinFields", s.uint(n)));
  }

  static void maxProperties(String key, SchemaNode n, State s) {
    s.add(n, CoreType.OBJECT, State.pkgCall("struct", "MaxFields", s.uint(n)));
  }
}
