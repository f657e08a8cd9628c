package io.github.simbo1905.cue.ast;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;

/// A scalar literal. String values are held unquoted; numbers keep their source text.
public record BasicLit(Kind kind, String value) implements Label {

    public enum Kind { NULL, TRUE, FALSE, INT, FLOAT, STRING }

    public BasicLit {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(value, "value must not be null");
    }

    public static BasicLit string(String s) {
        return new BasicLit(Kind.STRING, s);
    }

    public static BasicLit integer(long n) {
        return new BasicLit(Kind.INT, Long.toString(n));
    }

    public static BasicLit integer(BigInteger n) {
        return new BasicLit(Kind.INT, n.toString());
    }

    /// A numeric literal, INT when the value has no fractional part in its text form.
    public static BasicLit number(String text) {
        final boolean isFloat = text.indexOf('.') >= 0 || text.indexOf('e') >= 0 || text.indexOf('E') >= 0;
        return new BasicLit(isFloat ? Kind.FLOAT : Kind.INT, text);
    }

    public static BasicLit number(BigDecimal n) {
        return number(n.toString());
    }

    public static BasicLit bool(boolean b) {
        return b ? new BasicLit(Kind.TRUE, "true") : new BasicLit(Kind.FALSE, "false");
    }

    public static BasicLit nullLit() {
        return new BasicLit(Kind.NULL, "null");
    }

    public boolean isString() {
        return kind == Kind.STRING;
    }

    public boolean isNumber() {
        return kind == Kind.INT || kind == Kind.FLOAT;
    }
}
