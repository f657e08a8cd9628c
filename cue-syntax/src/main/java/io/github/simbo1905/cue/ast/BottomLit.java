package io.github.simbo1905.cue.ast;

/// The bottom value `_|_`.
public record BottomLit() implements Expr {}
