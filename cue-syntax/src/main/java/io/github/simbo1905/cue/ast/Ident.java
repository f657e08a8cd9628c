package io.github.simbo1905.cue.ast;

import java.util.Objects;
import java.util.Set;

/// An identifier. Identifiers are mutable in one respect: the node they
/// resolve to can be bound after construction, which lets reference
/// expressions be created before their target exists.
public final class Ident implements Label {

    private static final Set<String> RESERVED = Set.of(
            "null", "true", "false", "if", "for", "in", "let", "import", "package", "_|_");

    private static final Set<String> PREDECLARED = Set.of(
            "string", "int", "float", "number", "bool", "bytes", "close", "error", "matchN", "matchIf",
            "int8", "int16", "int32", "int64", "uint", "uint8", "uint16", "uint32", "uint64",
            "byte", "rune", "float32", "float64", "len", "and", "or", "div", "mod");

    private final String name;
    private final String importPath;
    private Node node;

    public Ident(String name) {
        this(name, null);
    }

    private Ident(String name, String importPath) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.importPath = importPath;
    }

    /// The top value `_`.
    public static Ident top() {
        return new Ident("_");
    }

    /// An identifier referring to the package with the given import path.
    /// The name is the path qualifier (`a/b:c` gives `c`) or else the last path element.
    public static Ident imported(String importPath) {
        Objects.requireNonNull(importPath, "importPath must not be null");
        return new Ident(qualifier(importPath), importPath);
    }

    /// Returns the package qualifier implied by an import path, or the empty string.
    public static String qualifier(String importPath) {
        final int colon = importPath.lastIndexOf(':');
        if (colon >= 0) {
            return importPath.substring(colon + 1);
        }
        final String last = importPath.substring(importPath.lastIndexOf('/') + 1);
        final int at = last.indexOf('@');
        final String base = at >= 0 ? last.substring(0, at) : last;
        return isValidIdent(base) ? base : "";
    }

    /// Reports whether s can be written as an identifier without quoting.
    public static boolean isValidIdent(String s) {
        if (s == null || s.isEmpty() || RESERVED.contains(s)) {
            return false;
        }
        int i = 0;
        if (s.startsWith("_#")) {
            i = 2;
        } else if (s.charAt(0) == '#') {
            i = 1;
        }
        if (i == s.length()) {
            return s.equals("#");
        }
        final char first = s.charAt(i);
        if (!(Character.isLetter(first) || first == '_' || first == '$')) {
            return false;
        }
        for (int j = i + 1; j < s.length(); j++) {
            final char c = s.charAt(j);
            if (!(Character.isLetterOrDigit(c) || c == '_' || c == '$')) {
                return false;
            }
        }
        return true;
    }

    /// Reports whether a regular field called s can be labelled with a bare identifier
    /// without turning it into a definition, a hidden field or a predeclared name.
    public static boolean isPlainLabel(String s) {
        return isValidIdent(s) && !s.startsWith("#") && !s.startsWith("_") && !PREDECLARED.contains(s);
    }

    public String name() {
        return name;
    }

    /// The import path for package identifiers, otherwise null.
    public String importPath() {
        return importPath;
    }

    /// The node this identifier is bound to, or null when unbound.
    public Node node() {
        return node;
    }

    public void bind(Node target) {
        this.node = target;
    }

    public boolean isTop() {
        return name.equals("_");
    }

    public boolean isDefinition() {
        return name.startsWith("#") || name.startsWith("_#");
    }

    public boolean isHidden() {
        return name.startsWith("_") && !isTop();
    }

    @Override
    public String toString() {
        return name;
    }
}
