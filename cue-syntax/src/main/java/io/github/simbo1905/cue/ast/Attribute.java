package io.github.simbo1905.cue.ast;

import java.util.Objects;

/// An attribute such as `@jsonschema(id="x")`, kept as its raw source text.
public record Attribute(String text) implements Decl {

    public Attribute {
        Objects.requireNonNull(text, "text must not be null");
        if (!text.startsWith("@")) {
            throw new IllegalArgumentException("attribute must start with '@': " + text);
        }
    }

    /// Builds `@name(body)`.
    public static Attribute of(String name, String body) {
        return new Attribute("@" + name + "(" + body + ")");
    }

    public String name() {
        final int paren = text.indexOf('(');
        return paren < 0 ? text.substring(1) : text.substring(1, paren);
    }

    public String body() {
        final int paren = text.indexOf('(');
        if (paren < 0 || !text.endsWith(")")) {
            return "";
        }
        return text.substring(paren + 1, text.length() - 1);
    }
}
