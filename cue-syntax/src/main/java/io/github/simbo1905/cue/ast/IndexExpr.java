package io.github.simbo1905.cue.ast;

import java.util.Objects;

/// An index expression `x[index]`.
public record IndexExpr(Expr x, Expr index) implements Expr {
    public IndexExpr {
        Objects.requireNonNull(x, "x must not be null");
        Objects.requireNonNull(index, "index must not be null");
    }
}
