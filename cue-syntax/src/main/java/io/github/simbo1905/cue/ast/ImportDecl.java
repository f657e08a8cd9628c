package io.github.simbo1905.cue.ast;

import java.util.Objects;

/// A single import of a package path.
public record ImportDecl(String path) implements Decl {
    public ImportDecl {
        Objects.requireNonNull(path, "path must not be null");
    }
}
