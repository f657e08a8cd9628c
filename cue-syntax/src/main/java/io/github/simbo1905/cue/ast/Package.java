package io.github.simbo1905.cue.ast;

import java.util.Objects;

/// The package clause of a file.
public record Package(String name) implements Decl {
    public Package {
        Objects.requireNonNull(name, "name must not be null");
    }
}
