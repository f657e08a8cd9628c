package io.github.simbo1905.cue.ast;

import io.github.simbo1905.cue.CueTestBase;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ParserTest extends CueTestBase {

    @Test
    void formattedSourceRoundTrips() {
        final String src = """
                package p

                import "strings"

                // Doc line.
                #Foo: {
                \tname!: string & strings.MinRunes(1)
                \ttags?: [...string]
                \t[=~"^x-"]: _
                \t...
                }

                x: #Foo | null @deprecated()
                """;
        final File file = Parser.parseFile(src);

        assertThat(file.packageName()).isEqualTo("p");
        assertThat(file.imports()).containsExactly(new ImportDecl("strings"));
        assertThat(Printer.format(file)).isEqualTo(src);
    }

    @Test
    void attachesLeadingCommentsAsDoc() {
        final File file = Parser.parseFile("""
                // About a.
                a: 1 // trailing
                b: 2
                """);
        final Field a = (Field) file.decls().get(0);
        final Field b = (Field) file.decls().get(1);
        assertThat(a.doc()).containsExactly("About a.");
        assertThat(b.doc()).isEmpty();
    }

    @Test
    void expandsFieldShorthand() {
        final File file = Parser.parseFile("a: b?: c: 1\n");
        final Field a = (Field) file.decls().get(0);
        assertThat(a.value()).isInstanceOf(StructLit.class);
        final Field b = ((StructLit) a.value()).fields().get(0);
        assertThat(b.labelName()).isEqualTo("b");
        assertThat(b.constraint()).isEqualTo(Field.Constraint.OPTIONAL);
        assertThat(Printer.format(a)).isEqualTo("a: {\n\tb?: {\n\t\tc: 1\n\t}\n}");
    }

    @Test
    void parsesExpressions() {
        assertThat(Printer.format(Parser.parseExpr(">=1 & <=10"))).isEqualTo(">=1 & <=10");
        assertThat(Parser.parseExpr("-1")).isEqualTo(new BasicLit(BasicLit.Kind.INT, "-1"));
        assertThat(Parser.parseExpr("1.5e3")).isEqualTo(new BasicLit(BasicLit.Kind.FLOAT, "1.5e3"));
        assertThat(Parser.parseExpr("_|_")).isInstanceOf(BottomLit.class);
        assertThat(Printer.format(Parser.parseExpr("(a | b) & c"))).isEqualTo("(a | b) & c");
        assertThat(Printer.format(Parser.parseExpr("#.\"a-b\"[0]"))).isEqualTo("#.\"a-b\"[0]");
        assertThat(Printer.format(Parser.parseExpr("matchN(>=1, [int, {a: 1}])")))
                .isEqualTo("matchN(>=1, [int, {\n\ta: 1\n}])");
    }

    @Test
    void distinguishesPatternLabelsFromEmbeddedLists() {
        final File file = Parser.parseFile("[string]: int\n[1, 2]\n");
        assertThat(file.decls().get(0)).isInstanceOfSatisfying(Field.class, f -> assertThat(f.isPattern()).isTrue());
        assertThat(file.decls().get(1)).isInstanceOf(EmbedDecl.class);
    }

    @Test
    void decodesStringEscapes() {
        assertThat(Parser.parseExpr("\"a\\n\\u0041\\\"\"")).isEqualTo(BasicLit.string("a\nA\""));
    }

    @Test
    void reportsPositionOfErrors() {
        assertThatThrownBy(() -> Parser.parseFile("a: {"))
                .isInstanceOf(CueParseException.class)
                .hasMessageContaining("unterminated struct");
        assertThatThrownBy(() -> Parser.parseFile("a: 1 b: 2"))
                .isInstanceOf(CueParseException.class)
                .hasMessageContaining("expected ',' or newline")
                .hasMessageContaining("1:6");
        assertThatThrownBy(() -> Parser.parseExpr("a ="))
                .isInstanceOf(CueParseException.class)
                .hasMessageContaining("unexpected character '='");
    }
}
