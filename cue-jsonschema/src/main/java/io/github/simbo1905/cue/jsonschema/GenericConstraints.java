package io.github.simbo1905.cue.jsonschema;

import io.github.simbo1905.cue.Kinds;
import io.github.simbo1905.cue.ast.BasicLit;
import io.github.simbo1905.cue.ast.BinaryExpr;
import io.github.simbo1905.cue.ast.Expr;
import io.github.simbo1905.cue.ast.Ident;
import io.github.simbo1905.cue.ast.Op;
import io.github.simbo1905.cue.ast.Printer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/// Keywords that apply to any type: definitions, literal values, types and annotations.
final class GenericConstraints {

  private GenericConstraints() {
  }

  static void noop(String key, SchemaNode n, State s) {
  }

  /// `$defs`, `definitions`, and the members of a configured root.
  static void definitions(String key, SchemaNode n, State s) {
    if (!n.isObject()) {
      s.errf(n, "%s expected an object, found %s", Printer.quote(key), n.kindName());
      return;
    }
    for (Map.Entry<String, SchemaNode> m : n.members()) {
      // Definitions are always named, whether or not anything refers to them.
      s.ensureDefinition(m.getValue());
      s.schema(m.getValue());
    }
  }

  static void constKeyword(String key, SchemaNode n, State s) {
    s.all.add(n, s.constValue(n));
    s.allowedTypes = s.allowedTypes.intersect(kindOf(n));
    s.knownTypes = s.knownTypes.intersect(kindOf(n));
  }

  static void enumKeyword(String key, SchemaNode n, State s) {
    final List<Expr> a = new ArrayList<>();
    Kinds types = Kinds.NONE;
    for (SchemaNode x : s.listItems("enum", n, true)) {
      if (s.allowedTypes.intersect(kindOf(x)).isEmpty()) {
        // Enum values that cannot possibly match add nothing.
        continue;
      }
      types = types.union(kindOf(x));
      a.add(s.constValue(x));
    }
    s.allowedTypes = s.allowedTypes.intersect(types);
    s.knownTypes = s.knownTypes.intersect(types);
    if (!a.isEmpty()) {
      s.all.add(n, BinaryExpr.join(Op.OR, a));
    }
  }

  static void examples(String key, SchemaNode n, State s) {
    if (!n.json().isArray()) {
      s.errf(n, "value of \"examples\" must be an array, found %s", n.kindName());
    }
  }

  static void deprecated(String key, SchemaNode n, State s) {
    if (s.boolValue(n)) {
      s.deprecated = true;
    }
  }

  static void description(String key, SchemaNode n, State s) {
    final String str = s.strValue(n);
    if (str != null) {
      s.description = str;
    }
  }

  static void title(String key, SchemaNode n, State s) {
    final String str = s.strValue(n);
    if (str != null) {
      s.title = str;
    }
  }

  static void nullable(String key, SchemaNode n, State s) {
    if (s.boolValue(n)) {
      s.nullable = BasicLit.nullLit();
    }
  }

  static void type(String key, SchemaNode n, State s) {
    Kinds types = Kinds.NONE;
    if (n.json().isTextual()) {
      types = typeKinds(s, n, n.json().textValue());
    } else if (n.json().isArray()) {
      for (SchemaNode item : n.elements()) {
        if (!item.json().isTextual()) {
          s.errf(item, "type value should be a string");
          return;
        }
        types = types.union(typeKinds(s, item, item.json().textValue()));
      }
    } else {
      s.errf(n, "value of \"type\" must be a string or list of strings");
    }
    s.allowedTypes = s.allowedTypes.intersect(types);
  }

  private static Kinds typeKinds(State s, SchemaNode n, String name) {
    switch (name) {
      case "null":
        return Kinds.NULL;
      case "boolean":
        return Kinds.BOOL;
      case "object":
        return Kinds.STRUCT;
      case "array":
        s.isArray = true;
        return Kinds.LIST;
      case "string":
        return Kinds.STRING;
      case "number":
        return Kinds.NUMBER;
      case "integer":
        s.add(n, CoreType.NUMBER, new Ident("int"));
        return Kinds.NUMBER;
      default:
        s.errf(n, "unknown type %s", Printer.quote(name));
        return Kinds.NONE;
    }
  }

  /// The kind of a literal value; numbers count as any number.
  private static Kinds kindOf(SchemaNode n) {
    final Kinds k = n.kind();
    return k.equals(Kinds.INT) || k.equals(Kinds.FLOAT) ? Kinds.NUMBER : k;
  }
}
