package io.github.simbo1905.cue.ast;

import java.util.ArrayList;
import java.util.List;

/// Formats syntax trees as source text. Structs are printed one declaration per line
/// with tab indentation, lists on a single line, and parentheses only where operator
/// precedence requires them.
public final class Printer {

    private static final int UNARY_PRECEDENCE = 7;
    private static final int PRIMARY_PRECEDENCE = 8;

    private final StringBuilder out = new StringBuilder();
    private int indent;

    private Printer() {}

    /// Formats a node. Files end with a trailing newline, other nodes do not.
    public static String format(Node node) {
        final Printer p = new Printer();
        if (node instanceof File f) {
            p.file(f);
        } else if (node instanceof Decl d) {
            p.decl(d);
        } else {
            p.expr((Expr) node, 0);
        }
        return p.out.toString();
    }

    /// Quotes s as a double-quoted string literal.
    public static String quote(String s) {
        final var sb = new StringBuilder(s.length() + 2).append('"');
        for (int i = 0; i < s.length(); i++) {
            final char c = s.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
                default -> {
                    if (c < 0x20) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.append('"').toString();
    }

    private void file(File f) {
        doc(f.doc());
        final List<ImportDecl> imports = new ArrayList<>();
        final List<Decl> rest = new ArrayList<>();
        String pkg = null;
        for (Decl d : f.decls()) {
            if (d instanceof Package p) {
                pkg = p.name();
            } else if (d instanceof ImportDecl i) {
                imports.add(i);
            } else {
                rest.add(d);
            }
        }
        boolean section = false;
        if (pkg != null) {
            out.append("package ").append(pkg).append('\n');
            section = true;
        }
        if (!imports.isEmpty()) {
            if (section) {
                out.append('\n');
            }
            if (imports.size() == 1) {
                out.append("import ").append(quote(imports.get(0).path())).append('\n');
            } else {
                out.append("import (\n");
                for (ImportDecl i : imports) {
                    out.append('\t').append(quote(i.path())).append('\n');
                }
                out.append(")\n");
            }
            section = true;
        }
        Decl prev = null;
        boolean prevMultiline = false;
        for (Decl d : rest) {
            if (section && (prev == null || prevMultiline || sectionBreak(prev, d))) {
                out.append('\n');
            }
            final int start = out.length();
            decl(d);
            prevMultiline = out.indexOf("\n", start) >= 0;
            out.append('\n');
            prev = d;
            section = true;
        }
    }

    private static boolean sectionBreak(Decl prev, Decl d) {
        if (prev instanceof Attribute != d instanceof Attribute) {
            return true;
        }
        return d instanceof Field f && !f.doc().isEmpty();
    }

    private void doc(List<String> lines) {
        for (String line : lines) {
            out.append(line.isEmpty() ? "//" : "// " + line).append('\n');
            tabs();
        }
    }

    private void tabs() {
        out.append("\t".repeat(indent));
    }

    private void decl(Decl d) {
        if (d instanceof Field f) {
            field(f);
        } else if (d instanceof EmbedDecl e) {
            expr(e.expr(), 0);
        } else if (d instanceof Ellipsis e) {
            expr(e, 0);
        } else if (d instanceof Attribute a) {
            out.append(a.text());
        } else if (d instanceof Package p) {
            out.append("package ").append(p.name());
        } else if (d instanceof ImportDecl i) {
            out.append("import ").append(quote(i.path()));
        }
    }

    private void field(Field f) {
        doc(f.doc());
        label(f.label());
        if (f.constraint() == Field.Constraint.OPTIONAL) {
            out.append('?');
        } else if (f.constraint() == Field.Constraint.REQUIRED) {
            out.append('!');
        }
        out.append(": ");
        expr(f.value(), 0);
        for (Attribute a : f.attrs()) {
            out.append(' ').append(a.text());
        }
    }

    private void label(Label l) {
        if (l instanceof Ident id) {
            out.append(id.name());
        } else if (l instanceof BasicLit lit) {
            out.append(lit.isString() && !Ident.isPlainLabel(lit.value()) ? quote(lit.value()) : lit.value());
        } else {
            out.append('[');
            elements(((ListLit) l).elts());
            out.append(']');
        }
    }

    private void expr(Expr e, int precedence) {
        if (e instanceof Ident id) {
            out.append(id.name());
        } else if (e instanceof BasicLit lit) {
            out.append(lit.isString() ? quote(lit.value()) : lit.value());
        } else if (e instanceof BottomLit) {
            out.append("_|_");
        } else if (e instanceof StructLit s) {
            struct(s);
        } else if (e instanceof ListLit l) {
            out.append('[');
            elements(l.elts());
            out.append(']');
        } else if (e instanceof Ellipsis el) {
            out.append("...");
            if (el.type() != null) {
                expr(el.type(), PRIMARY_PRECEDENCE);
            }
        } else if (e instanceof UnaryExpr u) {
            final boolean parens = precedence > UNARY_PRECEDENCE;
            open(parens);
            out.append(u.op().token());
            expr(u.x(), PRIMARY_PRECEDENCE);
            close(parens);
        } else if (e instanceof BinaryExpr b) {
            final int p = b.op().precedence();
            final boolean parens = p < precedence;
            open(parens);
            expr(b.x(), p);
            out.append(' ').append(b.op().token()).append(' ');
            expr(b.y(), p + 1);
            close(parens);
        } else if (e instanceof CallExpr c) {
            expr(c.fun(), PRIMARY_PRECEDENCE);
            out.append('(');
            elements(c.args());
            out.append(')');
        } else if (e instanceof SelectorExpr s) {
            expr(s.x(), PRIMARY_PRECEDENCE);
            out.append('.');
            label(s.sel());
        } else if (e instanceof IndexExpr ix) {
            expr(ix.x(), PRIMARY_PRECEDENCE);
            out.append('[');
            expr(ix.index(), 0);
            out.append(']');
        }
    }

    private void open(boolean parens) {
        if (parens) {
            out.append('(');
        }
    }

    private void close(boolean parens) {
        if (parens) {
            out.append(')');
        }
    }

    private void elements(List<? extends Expr> elts) {
        for (int i = 0; i < elts.size(); i++) {
            if (i > 0) {
                out.append(", ");
            }
            expr(elts.get(i), 0);
        }
    }

    private void struct(StructLit s) {
        if (s.elts().isEmpty()) {
            out.append("{}");
            return;
        }
        out.append("{\n");
        indent++;
        for (Decl d : s.elts()) {
            tabs();
            decl(d);
            out.append('\n');
        }
        indent--;
        tabs();
        out.append('}');
    }
}
