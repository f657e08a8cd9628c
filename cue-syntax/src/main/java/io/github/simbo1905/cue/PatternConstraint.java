package io.github.simbo1905.cue;

/// A pattern constraint `[pattern]: value` of a struct value.
public record PatternConstraint(Value pattern, Value value) {}
