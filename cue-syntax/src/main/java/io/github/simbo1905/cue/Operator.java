package io.github.simbo1905.cue;

/// The top-level operation of a value's expression.
public enum Operator {
    NO_OP,
    AND,
    OR,
    CALL,
    EQUAL,
    NOT_EQUAL,
    LESS_THAN,
    LESS_THAN_EQUAL,
    GREATER_THAN,
    GREATER_THAN_EQUAL,
    REGEX_MATCH,
    NOT_REGEX_MATCH,
    NOT,
    OTHER
}
