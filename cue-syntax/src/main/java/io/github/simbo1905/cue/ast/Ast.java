package io.github.simbo1905.cue.ast;

import java.util.function.Consumer;

/// Tree traversal helpers.
public final class Ast {

    private Ast() {}

    /// Visits node and every node below it in pre-order, labels included.
    public static void walk(Node node, Consumer<Node> visitor) {
        if (node == null) {
            return;
        }
        visitor.accept(node);
        if (node instanceof File f) {
            f.decls().forEach(d -> walk(d, visitor));
        } else if (node instanceof StructLit s) {
            s.elts().forEach(d -> walk(d, visitor));
        } else if (node instanceof ListLit l) {
            l.elts().forEach(e -> walk(e, visitor));
        } else if (node instanceof Field f) {
            walk(f.label(), visitor);
            walk(f.value(), visitor);
        } else if (node instanceof EmbedDecl e) {
            walk(e.expr(), visitor);
        } else if (node instanceof Ellipsis e) {
            walk(e.type(), visitor);
        } else if (node instanceof UnaryExpr u) {
            walk(u.x(), visitor);
        } else if (node instanceof BinaryExpr b) {
            walk(b.x(), visitor);
            walk(b.y(), visitor);
        } else if (node instanceof CallExpr c) {
            walk(c.fun(), visitor);
            c.args().forEach(a -> walk(a, visitor));
        } else if (node instanceof SelectorExpr s) {
            walk(s.x(), visitor);
        } else if (node instanceof IndexExpr ix) {
            walk(ix.x(), visitor);
            walk(ix.index(), visitor);
        }
    }
}
