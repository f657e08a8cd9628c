package io.github.simbo1905.cue;

import java.util.List;
import java.util.Objects;

/// A value decomposed into its operator and operands. For [Operator#CALL] the
/// function holds the qualified builtin name, such as `strings.MinRunes`.
public record Expression(Operator op, List<Value> args, String function) {

    public Expression {
        Objects.requireNonNull(op, "op must not be null");
        args = List.copyOf(args);
    }

    public static Expression noOp() {
        return new Expression(Operator.NO_OP, List.of(), null);
    }
}
