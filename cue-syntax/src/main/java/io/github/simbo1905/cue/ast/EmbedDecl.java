package io.github.simbo1905.cue.ast;

import java.util.Objects;

/// An expression embedded in a struct, unified with the struct it appears in.
public record EmbedDecl(Expr expr) implements Decl {
    public EmbedDecl {
        Objects.requireNonNull(expr, "expr must not be null");
    }
}
