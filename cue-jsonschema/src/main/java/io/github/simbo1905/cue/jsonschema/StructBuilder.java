package io.github.simbo1905.cue.jsonschema;

import io.github.simbo1905.cue.Path;
import io.github.simbo1905.cue.Selector;
import io.github.simbo1905.cue.ast.BasicLit;
import io.github.simbo1905.cue.ast.Decl;
import io.github.simbo1905.cue.ast.EmbedDecl;
import io.github.simbo1905.cue.ast.Expr;
import io.github.simbo1905.cue.ast.Field;
import io.github.simbo1905.cue.ast.File;
import io.github.simbo1905.cue.ast.Ident;
import io.github.simbo1905.cue.ast.IndexExpr;
import io.github.simbo1905.cue.ast.Label;
import io.github.simbo1905.cue.ast.SelectorExpr;
import io.github.simbo1905.cue.ast.StructLit;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/// Builds a struct from values placed at arbitrary paths, and hands out reference
/// expressions to those paths before the struct exists.
///
/// Entries are emitted sorted by selector type and then by name. A node holding both
/// a value and child entries becomes a struct literal that embeds the value.
final class StructBuilder {

  static final String ROOT_IDENT_NAME = "_schema";

  private final Node root = new Node();
  // Identifiers referring to top level entries, keyed by the entry's selector.
  private final Map<Selector, List<Ident>> refIdents = new HashMap<>();
  private final List<Ident> rootRefIdents = new ArrayList<>();

  private static final class Node {
    Expr value;
    String comment;
    final TreeMap<Selector, Node> entries = new TreeMap<>();
  }

  /// Associates value with path. Returns false when the path already holds a value.
  boolean put(Path path, Expr value, String comment) {
    final Node n = entryForPath(path);
    if (n.value != null) {
      return false;
    }
    n.value = value;
    n.comment = comment;
    return true;
  }

  /// Returns a reference expression to path within the struct. The identifier at its
  /// start is bound to the referenced value once [#syntax()] has run.
  Expr getRef(Path path) {
    final List<Selector> sels = path.selectors();
    if (sels.isEmpty()) {
      final Ident ref = new Ident(ROOT_IDENT_NAME);
      rootRefIdents.add(ref);
      return ref;
    }
    final Label base = labelForSelector(sels.get(0));
    if (!(base instanceof Ident baseIdent)) {
      throw new IllegalArgumentException(
          "initial element of path \"" + path + "\" must be expressed as an identifier");
    }
    refIdents.computeIfAbsent(sels.get(0), k -> new ArrayList<>()).add(baseIdent);
    return pathRefSyntax(new Path(sels.subList(1, sels.size())), baseIdent);
  }

  /// Returns the file holding the whole struct.
  File syntax() {
    final List<Decl> decls = new ArrayList<>();
    appendDecls(root, decls, new ArrayDeque<>());
    for (Decl decl : decls) {
      if (decl instanceof Field f) {
        final Selector sel = Selector.fromLabel(f.label());
        for (Ident ident : refIdents.getOrDefault(sel, List.of())) {
          ident.bind(f.value());
        }
      }
    }
    final File file;
    if (rootRefIdents.isEmpty()) {
      file = new File(decls);
    } else {
      final Expr rootExpr = exprFromDecls(decls);
      for (Ident ident : rootRefIdents) {
        ident.bind(rootExpr);
      }
      final Expr rootRef = getRef(Path.EMPTY);
      ((Ident) rootRef).bind(rootExpr);
      file = new File(List.of(new EmbedDecl(rootRef), new Field(new Ident(ROOT_IDENT_NAME), rootExpr)));
    }
    if (root.comment != null && !root.comment.isEmpty()) {
      file.doc().addAll(root.comment.lines().toList());
    }
    return file;
  }

  private Node entryForPath(Path path) {
    Node n = root;
    for (Selector sel : path.selectors()) {
      n = n.entries.computeIfAbsent(sel, k -> new Node());
    }
    return n;
  }

  private void appendDecls(Node n, List<Decl> decls, Deque<Selector> path) {
    if (n.value != null && !n.entries.isEmpty()) {
      // A value with entries beneath it: gather everything into a struct at this path.
      final List<Decl> inner = new ArrayList<>();
      appendField(inner, Path.EMPTY, n.value, null);
      appendEntries(n, inner, new ArrayDeque<>());
      appendField(decls, pathOf(path), exprFromDecls(inner), n.comment);
      return;
    }
    if (n.value != null) {
      appendField(decls, pathOf(path), n.value, n.comment);
    }
    appendEntries(n, decls, path);
  }

  private void appendEntries(Node n, List<Decl> decls, Deque<Selector> path) {
    for (Map.Entry<Selector, Node> e : n.entries.entrySet()) {
      path.addLast(e.getKey());
      appendDecls(e.getValue(), decls, path);
      path.removeLast();
    }
  }

  private static Path pathOf(Deque<Selector> path) {
    return new Path(new ArrayList<>(path));
  }

  // The root node's comment becomes the file comment, so an empty path takes none.
  private static void appendField(List<Decl> decls, Path path, Expr value, String comment) {
    if (path.isEmpty()) {
      appendDeclsExpr(decls, value);
      return;
    }
    final StructLit wrapped = (StructLit) exprAtPath(path, value);
    final Decl elt = wrapped.elts().get(0);
    if (comment != null && !comment.isEmpty() && elt instanceof Field f) {
      comment.lines().forEach(f::addDoc);
    }
    decls.add(elt);
  }

  /// A single embedded expression stands for itself; anything else becomes a struct.
  static Expr exprFromDecls(List<Decl> decls) {
    if (decls.size() == 1 && decls.get(0) instanceof EmbedDecl embed) {
      return embed.expr();
    }
    return new StructLit(decls);
  }

  /// Appends expr to decls, splicing struct literals in place.
  static void appendDeclsExpr(List<Decl> decls, Expr expr) {
    if (expr instanceof StructLit s) {
      decls.addAll(s.elts());
    } else {
      decls.add(new EmbedDecl(expr));
    }
  }

  /// Returns `{a: {b: {c: expr}}}` for the path `a.b.c`.
  static Expr exprAtPath(Path path, Expr expr) {
    final List<Selector> sels = path.selectors();
    Expr out = expr;
    for (int i = sels.size() - 1; i >= 0; i--) {
      out = StructLit.of(new Field(labelForSelector(sels.get(i)), out));
    }
    return out;
  }

  /// Returns an expression that looks up path inside the value of root.
  static Expr pathRefSyntax(Path path, Expr root) {
    Expr expr = root;
    for (Selector sel : path.selectors()) {
      if (sel.type() == Selector.Type.INDEX) {
        expr = new IndexExpr(expr, BasicLit.integer(sel.index()));
      } else {
        expr = new SelectorExpr(expr, labelForSelector(sel));
      }
    }
    return expr;
  }

  static Label labelForSelector(Selector sel) {
    return switch (sel.type()) {
      case STRING -> Field.stringLabel(sel.name());
      case DEFINITION, HIDDEN -> new Ident(sel.name());
      case INDEX -> throw new IllegalArgumentException(
          "cannot form label for selector \"" + sel + "\" with type " + sel.type());
    };
  }
}
