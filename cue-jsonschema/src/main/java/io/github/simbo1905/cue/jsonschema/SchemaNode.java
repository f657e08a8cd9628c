package io.github.simbo1905.cue.jsonschema;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.simbo1905.cue.Kind;
import io.github.simbo1905.cue.Kinds;
import io.github.simbo1905.cue.Path;
import io.github.simbo1905.cue.Selector;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// A node of the input document together with where it sits. Two nodes are the
/// same schema exactly when their pointers are equal.
///
/// @param pointer JSON Pointer from the document root, empty for the root
/// @param json the node itself
/// @param path the same location as a path of regular and index selectors
record SchemaNode(String pointer, JsonNode json, Path path) {

  SchemaNode {
    Objects.requireNonNull(pointer, "pointer");
    Objects.requireNonNull(json, "json");
    Objects.requireNonNull(path, "path");
  }

  static SchemaNode root(JsonNode json) {
    return new SchemaNode("", json, Path.EMPTY);
  }

  /// Finds the node a pointer addresses, starting from this node.
  Optional<SchemaNode> lookup(String relPointer) {
    SchemaNode current = this;
    for (String token : JsonPointer.tokens(relPointer)) {
      final JsonNode j = current.json;
      if (j.isObject() && j.has(token)) {
        current = current.member(token);
      } else if (j.isArray()) {
        final Optional<JsonNode> found = JsonPointer.lookup(j, "/" + JsonPointer.escape(token));
        if (found.isEmpty()) {
          return Optional.empty();
        }
        current = current.element(Integer.parseInt(token));
      } else {
        return Optional.empty();
      }
    }
    return Optional.of(current);
  }

  SchemaNode member(String key) {
    return new SchemaNode(pointer + "/" + JsonPointer.escape(key), json.get(key), path.append(Selector.str(key)));
  }

  SchemaNode element(int i) {
    return new SchemaNode(pointer + "/" + i, json.get(i), path.append(Selector.index(i)));
  }

  /// Object members in document order; empty for anything but an object.
  List<Map.Entry<String, SchemaNode>> members() {
    final List<Map.Entry<String, SchemaNode>> out = new ArrayList<>();
    final Iterator<String> names = json.fieldNames();
    while (names.hasNext()) {
      final String name = names.next();
      out.add(Map.entry(name, member(name)));
    }
    return out;
  }

  /// Array elements; empty for anything but an array.
  List<SchemaNode> elements() {
    final List<SchemaNode> out = new ArrayList<>();
    if (json.isArray()) {
      for (int i = 0; i < json.size(); i++) {
        out.add(element(i));
      }
    }
    return out;
  }

  /// The kind of the node in the output type system.
  Kinds kind() {
    if (json.isNull()) {
      return Kinds.NULL;
    }
    if (json.isBoolean()) {
      return Kinds.BOOL;
    }
    if (json.isIntegralNumber()) {
      return Kinds.INT;
    }
    if (json.isNumber()) {
      return Kinds.FLOAT;
    }
    if (json.isTextual()) {
      return Kinds.STRING;
    }
    if (json.isArray()) {
      return Kinds.LIST;
    }
    if (json.isObject()) {
      return Kinds.STRUCT;
    }
    return Kinds.NONE;
  }

  /// The kind name used in messages: `struct`, `list`, `string` and so on.
  String kindName() {
    final List<Kind> kinds = kind().kinds();
    return kinds.isEmpty() ? "_|_" : kinds.get(0).typeName();
  }

  boolean isObject() {
    return json.isObject();
  }

  /// The location used in error messages.
  String location() {
    return "#" + pointer;
  }

  /// Reports whether n is this node or lies below it.
  boolean contains(SchemaNode n) {
    return pointer.isEmpty() || n.pointer.equals(pointer) || n.pointer.startsWith(pointer + "/");
  }

  /// The pointer of this node relative to an ancestor.
  String relativeTo(SchemaNode ancestor) {
    if (!ancestor.contains(this)) {
      throw new IllegalStateException("value " + location() + " is not inside " + ancestor.location());
    }
    return pointer.substring(ancestor.pointer.length());
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof SchemaNode other && pointer.equals(other.pointer);
  }

  @Override
  public int hashCode() {
    return pointer.hashCode();
  }

  @Override
  public String toString() {
    return location();
  }
}
