package io.github.simbo1905.cue.jsonschema;

import io.github.simbo1905.cue.Kinds;
import io.github.simbo1905.cue.ast.BinaryExpr;
import io.github.simbo1905.cue.ast.Decl;
import io.github.simbo1905.cue.ast.Ellipsis;
import io.github.simbo1905.cue.ast.Field;
import io.github.simbo1905.cue.ast.Ident;
import io.github.simbo1905.cue.ast.Op;
import io.github.simbo1905.cue.ast.StructLit;

import java.util.HashSet;
import java.util.Set;

/// The `x-kubernetes-*` extensions that change what a schema accepts.
final class KubernetesConstraints {

  private KubernetesConstraints() {
  }

  static void preserveUnknownFields(String key, SchemaNode n, State s) {
    s.preserveUnknownFields = s.boolValue(n);
  }

  static void intOrString(String key, SchemaNode n, State s) {
    if (!s.boolValue(n)) {
      return;
    }
    final Kinds types = Kinds.INT.union(Kinds.STRING);
    s.allowedTypes = s.allowedTypes.intersect(types);
    s.knownTypes = s.knownTypes.intersect(types);
    s.all.add(n, BinaryExpr.join(Op.OR, new Ident("int"), new Ident("string")));
  }

  /// A resource embedded in another must say what it is, and may carry metadata.
  /// Also applied at the root of every CRD schema, where n is the schema itself.
  static void embeddedResource(String key, SchemaNode n, State s) {
    if (n.json().isBoolean() && !n.json().booleanValue()) {
      return;
    }
    final StructLit obj = s.object(n);
    final Set<String> names = new HashSet<>();
    for (Decl d : obj.elts()) {
      if (d instanceof Field f && f.labelName() != null) {
        names.add(f.labelName());
      }
    }
    if (!names.contains("apiVersion")) {
      obj.add(new Field(Field.stringLabel("apiVersion"), Field.Constraint.REQUIRED, new Ident("string")));
    }
    if (!names.contains("kind")) {
      obj.add(new Field(Field.stringLabel("kind"), Field.Constraint.REQUIRED, new Ident("string")));
    }
    if (!names.contains("metadata")) {
      obj.add(new Field(Field.stringLabel("metadata"), Field.Constraint.OPTIONAL, StructLit.of(new Ellipsis())));
    }
  }
}
