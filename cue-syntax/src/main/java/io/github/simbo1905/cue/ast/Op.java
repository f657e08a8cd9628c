package io.github.simbo1905.cue.ast;

/// Operators with their source token and binary precedence.
/// Unary-only operators have precedence 0.
public enum Op {
    OR("|", 1),
    AND("&", 2),
    EQL("==", 4),
    NEQ("!=", 4),
    LSS("<", 4),
    LEQ("<=", 4),
    GTR(">", 4),
    GEQ(">=", 4),
    MAT("=~", 4),
    NMAT("!~", 4),
    ADD("+", 5),
    SUB("-", 5),
    MUL("*", 6),
    QUO("/", 6),
    NOT("!", 0);

    private final String token;
    private final int precedence;

    Op(String token, int precedence) {
        this.token = token;
        this.precedence = precedence;
    }

    public String token() {
        return token;
    }

    public int precedence() {
        return precedence;
    }

    public static Op binary(String token) {
        for (Op op : values()) {
            if (op.precedence > 0 && op.token.equals(token)) {
                return op;
            }
        }
        return null;
    }

    public static Op unary(String token) {
        return switch (token) {
            case "!" -> NOT;
            case "-" -> SUB;
            case "+" -> ADD;
            case "==" -> EQL;
            case "!=" -> NEQ;
            case "<" -> LSS;
            case "<=" -> LEQ;
            case ">" -> GTR;
            case ">=" -> GEQ;
            case "=~" -> MAT;
            case "!~" -> NMAT;
            default -> null;
        };
    }
}
