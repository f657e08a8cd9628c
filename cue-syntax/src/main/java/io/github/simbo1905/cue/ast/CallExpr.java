package io.github.simbo1905.cue.ast;

import java.util.List;
import java.util.Objects;

/// A call `fun(args...)`.
public record CallExpr(Expr fun, List<Expr> args) implements Expr {

    public CallExpr {
        Objects.requireNonNull(fun, "fun must not be null");
        args = List.copyOf(args);
    }

    public static CallExpr of(Expr fun, Expr... args) {
        return new CallExpr(fun, List.of(args));
    }

    /// Calls a builtin function that is not part of any package, such as `close`.
    public static CallExpr builtin(String name, Expr... args) {
        return new CallExpr(new Ident(name), List.of(args));
    }
}
