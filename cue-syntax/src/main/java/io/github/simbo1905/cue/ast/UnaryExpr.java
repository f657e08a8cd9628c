package io.github.simbo1905.cue.ast;

import java.util.Objects;

/// A unary expression such as `>=2`, `=~"re"` or `!x`.
public record UnaryExpr(Op op, Expr x) implements Expr {
    public UnaryExpr {
        Objects.requireNonNull(op, "op must not be null");
        Objects.requireNonNull(x, "x must not be null");
    }
}
