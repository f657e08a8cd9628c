package io.github.simbo1905.cue;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AstValueTest extends CueTestBase {

    private static Value field(Value root, String name) {
        return root.lookupPath(Path.of(Selector.str(name))).orElseThrow();
    }

    @Test
    void resolvesReferencesToDefinitions() {
        final Value root = AstValue.parse("""
                #Name: string
                person: {
                \tname: #Name
                \tage?: int32
                }
                """);
        final Value person = field(root, "person");
        final List<FieldInfo> fields = person.fields();

        assertThat(fields).extracting(f -> f.selector().toString()).containsExactly("name", "age");
        assertThat(fields.get(1).optional()).isTrue();

        final Value name = fields.get(0).value();
        assertThat(name.reference()).hasValueSatisfying(r -> assertThat(r.path().toString()).isEqualTo("#Name"));
        assertThat(name.dereference().incompleteKind()).isEqualTo(Kinds.STRING);
        assertThat(person.isClosed()).isFalse();
    }

    @Test
    void expandsSizedIntegerTypes() {
        final Value age = field(AstValue.parse("age: int32\n"), "age");
        final Expression e = age.expr();

        assertThat(e.op()).isEqualTo(Operator.AND);
        assertThat(e.args()).hasSize(3);
        assertThat(e.args().get(1).expr().op()).isEqualTo(Operator.GREATER_THAN_EQUAL);
        assertThat(e.args().get(1).expr().args().get(0).decode()).isEqualTo(BigInteger.valueOf(-2147483648L));
        assertThat(age.incompleteKind()).isEqualTo(Kinds.INT);
        assertThat(age.reference()).isEmpty();
    }

    @Test
    void tracksClosedness() {
        final Value root = AstValue.parse("""
                #A: {
                \tx: int
                }
                b: close({
                \ty: int
                })
                c: {
                \tz: int
                \t...
                }
                """);
        assertThat(root.lookupPath(Path.of(Selector.def("#A"))).orElseThrow().isClosed()).isTrue();
        assertThat(field(root, "b").isClosed()).isTrue();
        assertThat(field(root, "c").isClosed()).isFalse();
        assertThat(field(root, "c").isExplicitlyOpen()).isTrue();
    }

    @Test
    void singleEmbeddingIsTheValue() {
        final Value root = AstValue.parse("""
                _schema
                _schema: {
                \tnext?: _schema
                }
                """);
        assertThat(root.reference()).hasValueSatisfying(r -> assertThat(r.path().toString()).isEqualTo("_schema"));
        assertThat(root.incompleteKind()).isEqualTo(Kinds.STRUCT);

        final FieldInfo next = root.fields().get(0);
        assertThat(next.selector().toString()).isEqualTo("next");
        assertThat(next.value().reference()).hasValueSatisfying(r -> assertThat(r.path().toString()).isEqualTo("_schema"));
    }

    @Test
    void embeddingWithFieldsIsAConjunction() {
        final Value root = AstValue.parse("""
                #Base
                extra?: int
                #Base: {
                \tbase?: string
                }
                """);
        final Expression e = root.expr();
        assertThat(e.op()).isEqualTo(Operator.AND);
        assertThat(e.args()).hasSize(2);
        assertThat(e.args().get(0).reference()).isPresent();
        assertThat(e.args().get(1).fields()).extracting(f -> f.selector().toString()).containsExactly("extra");
    }

    @Test
    void decomposesOperatorsAndBuiltins() {
        final Value root = AstValue.parse("""
                a: int | string
                b: >=1 & <10
                c: =~"^x"
                d: strings.MaxRunes(5)
                e: time.Time
                f: error("nope")
                """);
        assertThat(field(root, "a").expr().op()).isEqualTo(Operator.OR);
        assertThat(field(root, "a").incompleteKind().toString()).isEqualTo("int|string");

        final Expression b = field(root, "b").expr();
        assertThat(b.op()).isEqualTo(Operator.AND);
        assertThat(b.args()).extracting(v -> v.expr().op())
                .containsExactly(Operator.GREATER_THAN_EQUAL, Operator.LESS_THAN);
        assertThat(field(root, "b").incompleteKind()).isEqualTo(Kinds.NUMBER);

        final Expression c = field(root, "c").expr();
        assertThat(c.op()).isEqualTo(Operator.REGEX_MATCH);
        assertThat(c.args().get(0).decode()).isEqualTo("^x");

        final Expression d = field(root, "d").expr();
        assertThat(d.op()).isEqualTo(Operator.CALL);
        assertThat(d.function()).isEqualTo("strings.MaxRunes");
        assertThat(d.args().get(0).decode()).isEqualTo(BigInteger.valueOf(5));
        assertThat(field(root, "d").incompleteKind()).isEqualTo(Kinds.STRING);

        assertThat(field(root, "e").expr().function()).isEqualTo("time.Time");
        assertThat(field(root, "e").expr().args()).isEmpty();

        assertThat(field(root, "f").isBottom()).isTrue();
        assertThat(field(root, "f").errorMessage()).contains("nope");
    }

    @Test
    void decodesConcreteValues() {
        final Value root = AstValue.parse("""
                g: 5
                h: [1, "x", null, 2.5]
                s: {
                \tk: true
                \to?: 1
                }
                """);
        assertThat(field(root, "g").isConcrete()).isTrue();
        assertThat(field(root, "g").kind()).isEqualTo(Kinds.INT);
        assertThat(field(root, "h").decode()).isEqualTo(
                List.of(BigInteger.ONE, "x", Value.Null.INSTANCE, new java.math.BigDecimal("2.5")));
        assertThat(field(root, "s").decode()).isEqualTo(java.util.Map.of("k", true));
    }

    @Test
    void listsExposeElementsAndRest() {
        final Value root = AstValue.parse("""
                l: [int, ...string]
                k: [int]
                """);
        assertThat(field(root, "l").elements()).hasSize(1);
        assertThat(field(root, "l").rest()).hasValueSatisfying(r -> assertThat(r.incompleteKind()).isEqualTo(Kinds.STRING));
        assertThat(field(root, "k").rest()).isEmpty();
        assertThat(field(root, "k").isConcrete()).isFalse();
    }

    @Test
    void exposesPatternConstraints() {
        final Value m = field(AstValue.parse("""
                m: {
                \t[=~"^x-"]: string
                \t[string]: int
                }
                """), "m");
        assertThat(m.fields()).isEmpty();
        assertThat(m.patterns()).hasSize(2);
        assertThat(m.patterns().get(0).pattern().expr().op()).isEqualTo(Operator.REGEX_MATCH);
        assertThat(m.patterns().get(1).value().incompleteKind()).isEqualTo(Kinds.INT);
    }

    @Test
    void validateReportsUnresolvedReferences() {
        final Value root = AstValue.parse("""
                a: #Missing
                b: strings.MinRunes(1)
                """);
        assertThat(root.validate()).containsExactly("reference \"#Missing\" not found");
        assertThat(field(root, "a").isBottom()).isTrue();
    }
}
