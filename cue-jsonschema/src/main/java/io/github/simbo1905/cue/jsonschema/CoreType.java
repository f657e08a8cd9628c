package io.github.simbo1905.cue.jsonschema;

import io.github.simbo1905.cue.Kinds;
import io.github.simbo1905.cue.ast.BasicLit;
import io.github.simbo1905.cue.ast.Ellipsis;
import io.github.simbo1905.cue.ast.Expr;
import io.github.simbo1905.cue.ast.Ident;
import io.github.simbo1905.cue.ast.ListLit;
import io.github.simbo1905.cue.ast.StructLit;

/// The JSON Schema instance types, each with the output kinds it covers.
enum CoreType {
  NULL("null", Kinds.NULL),
  BOOL("bool", Kinds.BOOL),
  // both int and float
  NUMBER("number", Kinds.NUMBER),
  STRING("string", Kinds.STRING),
  ARRAY("array", Kinds.LIST),
  OBJECT("object", Kinds.STRUCT);

  /// Every kind a JSON value can have.
  static final Kinds ALL_TYPES = Kinds.BOOL
      .union(Kinds.LIST)
      .union(Kinds.NULL)
      .union(Kinds.NUMBER)
      .union(Kinds.STRING)
      .union(Kinds.STRUCT);

  private final String typeName;
  private final Kinds kinds;

  CoreType(String typeName, Kinds kinds) {
    this.typeName = typeName;
    this.kinds = kinds;
  }

  String typeName() {
    return typeName;
  }

  Kinds kinds() {
    return kinds;
  }

  /// The expression accepting any value of this type. Objects are written `{...}`
  /// unless only explicit openness counts, when they are written `{}`.
  Expr toExpr(boolean openOnlyWhenExplicit) {
    return switch (this) {
      case NULL -> BasicLit.nullLit();
      case BOOL -> new Ident("bool");
      case NUMBER -> new Ident("number");
      case STRING -> new Ident("string");
      case ARRAY -> ListLit.of(new Ellipsis());
      case OBJECT -> openOnlyWhenExplicit ? new StructLit() : StructLit.of(new Ellipsis());
    };
  }
}
