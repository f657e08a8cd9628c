package io.github.simbo1905.cue.ast;

/// `...` or `...T`. In a list it types the remaining elements; in a struct it opens the struct.
/// The type is null for a bare ellipsis.
public record Ellipsis(Expr type) implements Expr, Decl {

    public Ellipsis() {
        this(null);
    }
}
