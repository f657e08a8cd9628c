package io.github.simbo1905.cue;

import java.util.ArrayList;
import java.util.List;

/// A sequence of selectors from a root value.
public record Path(List<Selector> selectors) {

    public static final Path EMPTY = new Path(List.of());

    public Path {
        selectors = List.copyOf(selectors);
    }

    public static Path of(Selector... selectors) {
        return new Path(List.of(selectors));
    }

    public Path append(Selector sel) {
        final List<Selector> out = new ArrayList<>(selectors);
        out.add(sel);
        return new Path(out);
    }

    public boolean isEmpty() {
        return selectors.isEmpty();
    }

    /// Reports whether any selector names a definition.
    public boolean hasDefinition() {
        for (Selector s : selectors) {
            if (s.isDefinition()) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder();
        for (Selector s : selectors) {
            if (s.type() == Selector.Type.INDEX) {
                sb.append('[').append(s.index()).append(']');
            } else {
                if (sb.length() > 0) {
                    sb.append('.');
                }
                sb.append(s);
            }
        }
        return sb.toString();
    }
}
