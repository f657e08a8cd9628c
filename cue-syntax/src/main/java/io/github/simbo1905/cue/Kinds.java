package io.github.simbo1905.cue;

import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

/// A set of kinds, used for the possible kinds of an incomplete value.
public record Kinds(int mask) {

    public static final Kinds NONE = new Kinds(0);
    public static final Kinds NULL = of(Kind.NULL);
    public static final Kinds BOOL = of(Kind.BOOL);
    public static final Kinds INT = of(Kind.INT);
    public static final Kinds FLOAT = of(Kind.FLOAT);
    public static final Kinds NUMBER = of(Kind.INT, Kind.FLOAT);
    public static final Kinds STRING = of(Kind.STRING);
    public static final Kinds BYTES = of(Kind.BYTES);
    public static final Kinds LIST = of(Kind.LIST);
    public static final Kinds STRUCT = of(Kind.STRUCT);
    public static final Kinds TOP = new Kinds((1 << Kind.values().length) - 1);

    public static Kinds of(Kind... kinds) {
        int m = 0;
        for (Kind k : kinds) {
            m |= k.bit();
        }
        return new Kinds(m);
    }

    public Kinds union(Kinds other) {
        return new Kinds(mask | other.mask);
    }

    public Kinds intersect(Kinds other) {
        return new Kinds(mask & other.mask);
    }

    public Kinds without(Kinds other) {
        return new Kinds(mask & ~other.mask);
    }

    public boolean has(Kind k) {
        return (mask & k.bit()) != 0;
    }

    /// Reports whether every kind in other is also in this set.
    public boolean containsAll(Kinds other) {
        return (mask & other.mask) == other.mask;
    }

    public boolean isEmpty() {
        return mask == 0;
    }

    public boolean isTop() {
        return mask == TOP.mask;
    }

    public List<Kind> kinds() {
        final List<Kind> out = new ArrayList<>();
        for (Kind k : Kind.values()) {
            if (has(k)) {
                out.add(k);
            }
        }
        return out;
    }

    @Override
    public String toString() {
        if (isTop()) {
            return "_";
        }
        if (isEmpty()) {
            return "_|_";
        }
        final StringJoiner j = new StringJoiner("|");
        for (Kind k : kinds()) {
            j.add(k.typeName());
        }
        return j.toString();
    }
}
