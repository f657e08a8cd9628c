package io.github.simbo1905.cue.jsonschema;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.github.simbo1905.cue.Kinds;
import io.github.simbo1905.cue.Operator;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.assertj.core.api.Assertions.assertThat;

class PassesTest extends JsonSchemaTestBase {

    private static final JsonNodeFactory F = JsonNodeFactory.instance;

    private static final Item INT = new Item.Type(Kinds.INT);
    private static final Item MIN = new Item.Bounds(Operator.GREATER_THAN_EQUAL, BigDecimal.ONE);

    private static Item merge(Item it) {
        return Passes.mergeAllOf(it, new Interner());
    }

    private static Item enums(Item it) {
        return Passes.enumFromConst(it, new Interner());
    }

    @Test
    void mergeAllOfFlattensAndDropsTrivialMembers() {
        final Item nested = Item.AllOf.of(new Item.True(), Item.AllOf.of(INT, MIN), Item.AllOf.of(MIN));
        assertThat(merge(nested)).isEqualTo(Item.AllOf.of(INT, MIN));
    }

    @Test
    void mergeAllOfDropsEqualMembersBuiltSeparately() {
        final Item a = new Item.Not(new Item.Pattern("^a"));
        final Item b = new Item.Not(new Item.Pattern("^a"));
        assertThat(a).isNotSameAs(b);
        assertThat(merge(Item.AllOf.of(a, INT, b))).isEqualTo(Item.AllOf.of(a, INT));
    }

    @Test
    void mergeAllOfIntersectsTypes() {
        final Item both = Item.AllOf.of(new Item.Type(Kinds.NUMBER), MIN, INT);
        assertThat(merge(both)).isEqualTo(Item.AllOf.of(INT, MIN));
        assertThat(merge(Item.AllOf.of(INT, new Item.Type(Kinds.STRING)))).isEqualTo(new Item.False());
    }

    @Test
    void mergeAllOfCollapsesTrivialConjunctions() {
        assertThat(merge(Item.AllOf.of())).isEqualTo(new Item.True());
        assertThat(merge(Item.AllOf.of(new Item.True(), INT))).isEqualTo(INT);
        assertThat(merge(Item.AllOf.of(INT, new Item.False()))).isEqualTo(new Item.False());
    }

    @Test
    void mergeAllOfReachesNestedItems() {
        final Item inProperties = new Item.Properties(
                new TreeMap<>(Map.of("a", Item.AllOf.of(INT, new Item.True()))), List.of(), null, new TreeMap<>());
        final Item merged = merge(new Item.Not(inProperties));
        assertThat(merged).isEqualTo(new Item.Not(new Item.Properties(
                new TreeMap<>(Map.of("a", INT)), List.of(), null, new TreeMap<>())));
    }

    @Test
    void unchangedItemsAreReturnedAsIs() {
        final Item already = new Item.AnyOf(List.of(INT, new Item.Type(Kinds.STRING)));
        assertThat(merge(already)).isSameAs(already);
        assertThat(enums(already)).isSameAs(already);
    }

    @Test
    void enumFromConstNeedsOneKindOfValue() {
        final Item strings = new Item.AnyOf(List.of(new Item.Const(F.textNode("a")), new Item.Const(F.textNode("b"))));
        assertThat(enums(strings))
                .isEqualTo(new Item.EnumOf(List.of(F.textNode("a"), F.textNode("b"))));

        final Item mixed = new Item.AnyOf(List.of(new Item.Const(F.textNode("a")), new Item.Const(F.numberNode(1))));
        assertThat(enums(mixed)).isEqualTo(mixed);
    }

    @Test
    void enumFromConstLeavesEmptyAnyOf() {
        final Item empty = new Item.AnyOf(List.of());
        assertThat(enums(empty)).isEqualTo(empty);
    }

    @Test
    void enumFromConstRewritesInsideOtherItems() {
        final Item inner = new Item.AnyOf(List.of(new Item.Const(F.numberNode(1)), new Item.Const(F.numberNode(2))));
        final Item outer = new Item.AnyOf(List.of(inner, INT));
        assertThat(enums(outer)).isEqualTo(new Item.AnyOf(List.of(
                new Item.EnumOf(List.of(F.numberNode(1), F.numberNode(2))), INT)));
    }

    @Test
    void internerSharesEqualSubtrees() {
        final Interner in = new Interner();
        final Item first = in.intern(Item.AllOf.of(new Item.Type(Kinds.STRING), new Item.Pattern("^a")));
        final Item.Not second = in.intern(new Item.Not(
                Item.AllOf.of(new Item.Type(Kinds.STRING), new Item.Pattern("^a"))));
        assertThat(second.elem()).isSameAs(first);
        assertThat(in.intern(new Item.Type(Kinds.STRING))).isSameAs(((Item.AllOf) first).elems().get(0));
        assertThat(in.intern((Item) null)).isNull();
    }

    @Test
    void renderFoldsCompatibleKeywords() {
        final Item it = Item.AllOf.of(INT, MIN, new Item.Description("count"));
        assertThat(it.render()).isEqualTo(json("{\"type\": \"integer\", \"minimum\": 1, \"description\": \"count\"}"));
        assertThat(it.render().fieldNames().next()).isEqualTo("type");
    }

    @Test
    void renderKeepsRepeatedKeywordsApart() {
        final Item it = Item.AllOf.of(MIN, new Item.Bounds(Operator.GREATER_THAN_EQUAL, BigDecimal.TEN));
        assertThat(it.render()).isEqualTo(json("{\"allOf\": [{\"minimum\": 10}, {\"minimum\": 1}]}"));
    }

    @Test
    void typeNamesWidenFloat() {
        assertThat(new Item.Type(Kinds.FLOAT).names()).containsExactly("number");
        assertThat(new Item.Type(Kinds.INT.union(Kinds.NULL)).names()).containsExactly("null", "integer");
        assertThat(new Item.Type(Kinds.BYTES).render()).isEqualTo(json("false"));
    }
}
