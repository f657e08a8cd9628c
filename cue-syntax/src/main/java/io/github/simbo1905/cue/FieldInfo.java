package io.github.simbo1905.cue;

import java.util.List;

/// A regular field of a struct value.
public record FieldInfo(Selector selector, Value value, boolean optional, boolean required, List<String> doc) {
    public FieldInfo {
        doc = List.copyOf(doc);
    }
}
