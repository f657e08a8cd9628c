package io.github.simbo1905.cue;

/// A single kind of value.
public enum Kind {
    NULL("null"),
    BOOL("bool"),
    INT("int"),
    FLOAT("float"),
    STRING("string"),
    BYTES("bytes"),
    LIST("list"),
    STRUCT("struct");

    private final String typeName;

    Kind(String typeName) {
        this.typeName = typeName;
    }

    int bit() {
        return 1 << ordinal();
    }

    /// The name of the builtin type of this kind.
    public String typeName() {
        return typeName;
    }
}
