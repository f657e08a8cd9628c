package io.github.simbo1905.cue;

/// The target of a reference: the root value it was resolved from and the path within it.
public record Reference(Value root, Path path) {}
