package io.github.simbo1905.cue;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class KindsTest extends CueTestBase {

    @Test
    void kindSetsPrintAsDisjunctions() {
        assertThat(Kinds.NUMBER.toString()).isEqualTo("int|float");
        assertThat(Kinds.TOP.toString()).isEqualTo("_");
        assertThat(Kinds.NONE.toString()).isEqualTo("_|_");
        assertThat(Kinds.NUMBER.intersect(Kinds.INT)).isEqualTo(Kinds.INT);
        assertThat(Kinds.TOP.without(Kinds.NULL).has(Kind.NULL)).isFalse();
    }

    @Test
    void pathsQuoteNonIdentifierNames() {
        final Path p = Path.of(Selector.str("a"), Selector.index(0), Selector.str("b-c"));
        assertThat(p.toString()).isEqualTo("a[0].\"b-c\"");
        assertThat(Path.of(Selector.def("#x"), Selector.str("y")).hasDefinition()).isTrue();
    }

    @Test
    void selectorsSortByTypeThenName() {
        final List<Selector> sels = new ArrayList<>(List.of(Selector.def("#b"), Selector.str("z"), Selector.str("a")));
        Collections.sort(sels);
        assertThat(sels).extracting(Selector::toString).containsExactly("a", "z", "#b");
    }
}
