package io.github.simbo1905.cue.jsonschema;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.github.simbo1905.cue.Kinds;
import io.github.simbo1905.cue.Operator;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.assertj.core.api.Assertions.assertThat;

/// Random item trees put through the rewrite passes.
class SimplifyPropertyTest extends JsonSchemaLoggingConfig {

    private static final JsonNodeFactory F = JsonNodeFactory.instance;

    @Provide
    Arbitrary<Item> items() {
        return itemArbitrary(3);
    }

    @SuppressWarnings("unchecked")
    private static Arbitrary<Item> itemArbitrary(int depth) {
        final Arbitrary<Item> leaves = Arbitraries.of(
                new Item.True(),
                new Item.False(),
                new Item.Type(Kinds.INT),
                new Item.Type(Kinds.NUMBER),
                new Item.Type(Kinds.STRING),
                new Item.Type(Kinds.STRING.union(Kinds.NULL)),
                new Item.Const(F.textNode("a")),
                new Item.Const(F.textNode("b")),
                new Item.Const(F.numberNode(1)),
                new Item.Bounds(Operator.GREATER_THAN_EQUAL, BigDecimal.ZERO),
                new Item.LengthBounds(true, 2),
                new Item.Pattern("^x"),
                new Item.Format("date"),
                new Item.Ref("#A"));
        if (depth == 0) {
            return leaves;
        }
        final Arbitrary<Item> child = itemArbitrary(depth - 1);
        final Arbitrary<List<Item>> children = child.list().ofMinSize(0).ofMaxSize(3);
        return (Arbitrary<Item>) (Arbitrary<?>) Arbitraries.oneOf(
                leaves,
                children.map(Item.AllOf::new),
                children.map(Item.AnyOf::new),
                children.map(Item.OneOf::new),
                child.map(Item.Not::new),
                child.map(e -> new Item.Properties(new TreeMap<>(Map.of("p", e)), List.of("p"), null, new TreeMap<>())),
                child.map(e -> new Item.Items(List.of(), e)));
    }

    @Property(tries = 300)
    void simplifyIsStable(@ForAll("items") Item item) {
        final Item once = Generator.simplify(item, new Interner());
        assertThat(Generator.simplify(once, new Interner())).isEqualTo(once);
    }

    @Property(tries = 300)
    void mergedTreesHaveNoNestedOrTrivialConjuncts(@ForAll("items") Item item) {
        assertNoNestedAllOf(Passes.mergeAllOf(item, new Interner()));
    }

    @Property(tries = 300)
    void renderingIsRepeatable(@ForAll("items") Item item) {
        final Item once = Generator.simplify(item, new Interner());
        assertThat(once.render().toString()).isEqualTo(once.render().toString());
    }

    @Property(tries = 300)
    void equalSubtreesAreOneInstance(@ForAll("items") Item item) {
        final List<Item> nodes = new ArrayList<>();
        collect(Generator.simplify(item, new Interner()), nodes);
        for (Item a : nodes) {
            for (Item b : nodes) {
                if (a.equals(b)) {
                    assertThat(a).isSameAs(b);
                }
            }
        }
    }

    private static void collect(Item it, List<Item> out) {
        out.add(it);
        it.apply(e -> {
            collect(e, out);
            return e;
        });
    }

    private static void assertNoNestedAllOf(Item it) {
        if (it instanceof Item.AllOf all) {
            assertThat(all.elems()).hasSizeGreaterThan(1);
            assertThat(all.elems()).noneMatch(e -> e instanceof Item.AllOf || e instanceof Item.True
                    || e instanceof Item.False);
            assertThat(all.elems()).doesNotHaveDuplicates();
        }
        it.apply(e -> {
            assertNoNestedAllOf(e);
            return e;
        });
    }
}
