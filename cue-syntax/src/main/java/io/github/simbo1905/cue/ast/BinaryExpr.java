package io.github.simbo1905.cue.ast;

import java.util.List;
import java.util.Objects;

/// A binary expression `x op y`.
public record BinaryExpr(Op op, Expr x, Expr y) implements Expr {

    public BinaryExpr {
        Objects.requireNonNull(op, "op must not be null");
        Objects.requireNonNull(x, "x must not be null");
        Objects.requireNonNull(y, "y must not be null");
    }

    /// Joins the operands into a left-nested chain. A single operand is returned as is.
    /// @throws IllegalArgumentException if there are no operands
    public static Expr join(Op op, List<? extends Expr> operands) {
        if (operands.isEmpty()) {
            throw new IllegalArgumentException("no operands to join with " + op);
        }
        Expr result = operands.get(0);
        for (int i = 1; i < operands.size(); i++) {
            result = new BinaryExpr(op, result, operands.get(i));
        }
        return result;
    }

    public static Expr join(Op op, Expr... operands) {
        return join(op, List.of(operands));
    }
}
