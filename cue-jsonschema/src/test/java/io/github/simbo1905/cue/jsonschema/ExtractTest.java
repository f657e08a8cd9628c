package io.github.simbo1905.cue.jsonschema;

import io.github.simbo1905.cue.ast.Ident;
import io.github.simbo1905.cue.ast.Label;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExtractTest extends JsonSchemaTestBase {

    private static final String DRAFT4 = "http://json-schema.org/draft-04/schema#";
    private static final String DRAFT7 = "http://json-schema.org/draft-07/schema#";

    @Nested
    class Strings {

        @Test
        void lengthBoundsBecomeRuneCounts() {
            final String out = extract("{\"type\":\"string\",\"minLength\":2,\"maxLength\":5}",
                    ExtractConfig.DEFAULT.withPkgName("example"));
            assertThat(out).isEqualTo("""
                    package example

                    import "strings"

                    strings.MinRunes(2) & strings.MaxRunes(5)
                    """);
        }

        @Test
        void typeOnly() {
            assertThat(extract("{\"type\":\"string\"}")).isEqualTo("string\n");
        }

        @Test
        void enumOfStrings() {
            assertThat(extract("{\"enum\":[\"a\",\"b\"]}")).isEqualTo("\"a\" | \"b\"\n");
        }

        @Test
        void patternIsAMatch() {
            assertThat(extract("{\"type\":\"string\",\"pattern\":\"^[a-z]+$\"}"))
                    .isEqualTo("=~\"^[a-z]+$\"\n");
        }

        @Test
        void invalidPatternIsReported() {
            assertThatThrownBy(() -> extract("{\"type\":\"string\",\"pattern\":\"(\"}"))
                    .isInstanceOf(JsonSchemaException.class)
                    .hasMessageContaining("invalid regexp");
        }

        @Test
        void lookaheadDroppedUnlessStrict() {
            final String schema = "{\"type\":\"string\",\"pattern\":\"^(?=a)\"}";
            assertThat(extract(schema)).isEqualTo("string\n");
            assertThatThrownBy(() -> extract(schema, ExtractConfig.DEFAULT.withStrictFeatures(true)))
                    .isInstanceOf(JsonSchemaException.class)
                    .hasMessageContaining("unsupported Perl regexp syntax");
        }
    }

    @Nested
    class Numbers {

        @Test
        void integerBounds() {
            final String out = extract("{\"type\":\"integer\",\"minimum\":0,\"exclusiveMaximum\":10}");
            assertThat(out).contains("int").contains(">=0").contains("<10").doesNotContain("number");
        }

        @Test
        void draft4BooleanExclusiveMinimum() {
            final String out = extract("{\"$schema\":\"" + DRAFT4 + "\",\"type\":\"number\","
                    + "\"minimum\":1,\"exclusiveMinimum\":true}");
            assertThat(out).contains(">1").doesNotContain(">=1");
        }

        @Test
        void draft4RejectsNumericExclusiveMinimum() {
            assertThatThrownBy(() -> extract("{\"$schema\":\"" + DRAFT4 + "\",\"exclusiveMinimum\":3}"))
                    .isInstanceOf(JsonSchemaException.class)
                    .hasMessageContaining("value of \"exclusiveMinimum\" must be a boolean in " + DRAFT4);
        }

        @Test
        void multipleOfMustBePositive() {
            assertThatThrownBy(() -> extract("{\"multipleOf\":0}"))
                    .isInstanceOf(JsonSchemaException.class)
                    .hasMessageContaining("\"multipleOf\" must be strictly greater than 0");
        }

        @Test
        void multipleOfImportsMath() {
            assertThat(extract("{\"type\":\"number\",\"multipleOf\":3}"))
                    .isEqualTo("import \"math\"\n\nmath.MultipleOf(3)\n");
        }

        @ParameterizedTest
        @ValueSource(strings = {
                "{\"type\":\"integer\",\"maximum\":1e400}",
                "{\"minLength\":1e400}",
                "{\"multipleOf\":1e400}",
                "{\"const\":1e400}",
                "{\"enum\":[1,-1e400]}"})
        void numbersBeyondDoubleRangeAreReported(String schema) {
            assertThatThrownBy(() -> extract(schema))
                    .isInstanceOf(JsonSchemaException.class)
                    .hasMessageContaining("number out of range");
        }
    }

    @Nested
    class Objects {

        @Test
        void closedObjectWithRequiredField() {
            final String out = extract("""
                    {"type":"object",
                     "properties":{"a":{"type":"string"},"b":{"type":"integer"}},
                     "required":["a"],
                     "additionalProperties":false}
                    """);
            assertThat(out).isEqualTo("close({\n\ta!: string\n\tb?: int\n})\n");
        }

        @Test
        void implicitlyOpenObjectGetsEllipsis() {
            assertThat(extract("{\"type\":\"object\",\"properties\":{\"a\":{\"type\":\"string\"}}}"))
                    .isEqualTo("a?: string\n...\n");
        }

        @Test
        void openOnlyWhenExplicitLeavesOutEllipsis() {
            assertThat(extract("{\"type\":\"object\",\"properties\":{\"a\":{\"type\":\"string\"}}}",
                    ExtractConfig.DEFAULT.withOpenOnlyWhenExplicit(true)))
                    .isEqualTo("a?: string\n");
        }

        @Test
        void additionalPropertiesSchemaExcludesNamedFields() {
            final String out = extract("""
                    {"type":"object",
                     "properties":{"a":{"type":"string"}},
                     "additionalProperties":{"type":"integer"}}
                    """);
            assertThat(out).isEqualTo("a?: string\n[!~\"^(a)$\"]: int\n");
        }

        @Test
        void patternPropertiesWithoutType() {
            final String out = extract("{\"patternProperties\":{\"^x-\":{\"type\":\"string\"}}}");
            assertThat(out)
                    .startsWith("null | bool | number | string | [...] | {")
                    .contains("[=~\"^x-\"]: string");
        }

        @Test
        void requiredWithoutPropertiesAddsTopField() {
            assertThat(extract("{\"type\":\"object\",\"required\":[\"id\"]}"))
                    .isEqualTo("id!: _\n...\n");
        }

        @Test
        void duplicateRequiredIsReported() {
            assertThatThrownBy(() -> extract("{\"properties\":{\"a\":{}},\"required\":[\"a\",\"a\"]}"))
                    .isInstanceOf(JsonSchemaException.class)
                    .hasMessageContaining("duplicate required field \"a\"");
        }

        @Test
        void descriptionBecomesFieldDoc() {
            final String out = extract("""
                    {"type":"object",
                     "properties":{"a":{"type":"string","description":"The a."}}}
                    """);
            assertThat(out).contains("// The a.\na?: string");
        }

        @Test
        void titleBecomesFileDoc() {
            assertThat(extract("{\"title\":\"T\",\"type\":\"string\"}")).contains("// T").endsWith("string\n");
        }

        @Test
        void constObjectIsClosed() {
            assertThat(extract("{\"const\":{\"a\":1}}")).isEqualTo("close({\n\ta!: 1\n})\n");
        }
    }

    @Nested
    class Arrays {

        @Test
        void itemsAndCounts() {
            final String out = extract("{\"type\":\"array\",\"items\":{\"type\":\"string\"},"
                    + "\"minItems\":1,\"uniqueItems\":true}");
            assertThat(out).isEqualTo("import \"list\"\n\nlist.MinItems(1) & list.UniqueItems() & [...string]\n");
        }

        @Test
        void prefixItemsClosedByItemsFalse() {
            assertThat(extract("{\"prefixItems\":[{\"type\":\"integer\"}],\"items\":false}"))
                    .contains("[int]");
        }

        @Test
        void draft7ArrayItemsWithAdditionalItems() {
            final String out = extract("{\"$schema\":\"" + DRAFT7 + "\",\"type\":\"array\","
                    + "\"items\":[{\"type\":\"string\"}],\"additionalItems\":false}");
            assertThat(out).contains("[string]");
        }

        @Test
        void arrayItemsRejectedFrom2020() {
            assertThatThrownBy(() -> extract("{\"items\":[{\"type\":\"string\"}]}"))
                    .isInstanceOf(JsonSchemaException.class)
                    .hasMessageContaining("the value of \"items\" must be an object or a boolean");
        }

        @Test
        void containsWithMinimum() {
            assertThat(extract("{\"type\":\"array\",\"contains\":{\"type\":\"integer\"},\"minContains\":2}"))
                    .contains("list.MatchN(>=2, int)");
        }
    }

    @Nested
    class Combinators {

        @Test
        void oneOfBecomesMatchN() {
            assertThat(extract("{\"oneOf\":[{\"const\":1},{\"const\":2}]}")).isEqualTo("matchN(1, [1, 2])\n");
        }

        @Test
        void anyOfNeedsAtLeastOne() {
            assertThat(extract("{\"anyOf\":[{\"type\":\"string\"},{\"type\":\"integer\"}]}"))
                    .isEqualTo("matchN(>=1, [string, int])\n");
        }

        @Test
        void notMatchesNone() {
            assertThat(extract("{\"not\":{\"type\":\"string\"}}")).isEqualTo("matchN(0, [string])\n");
        }

        @Test
        void ifThenWithoutElse() {
            assertThat(extract("{\"if\":{\"type\":\"string\"},\"then\":{\"minLength\":1}}"))
                    .isEqualTo("import \"strings\"\n\nmatchIf(string, strings.MinRunes(1), _)\n");
        }

        @Test
        void emptyOneOfIsReported() {
            assertThatThrownBy(() -> extract("{\"oneOf\":[]}"))
                    .isInstanceOf(JsonSchemaException.class)
                    .hasMessageContaining("oneOf requires at least one subschema");
        }
    }

    @Nested
    class References {

        @Test
        void definitionDefinedOnce() {
            final String out = extract("{\"$ref\":\"#/$defs/foo\",\"$defs\":{\"foo\":{\"type\":\"integer\"}}}");
            assertThat(out).isEqualTo("#foo\n#foo: int\n");
        }

        @Test
        void rootReferenceNamesTheSchema() {
            final String out = extract("{\"properties\":{\"next\":{\"$ref\":\"#\"}}}");
            assertThat(out)
                    .startsWith("_schema\n_schema: ")
                    .contains("next?: _schema");
        }

        @Test
        void missingTargetIsReported() {
            assertThatThrownBy(() -> extract("{\"$ref\":\"#/$defs/missing\"}"))
                    .isInstanceOf(JsonSchemaException.class)
                    .hasMessageContaining("reference to non-existent schema");
        }

        @Test
        void externalReferenceImportsPackage() {
            final String out = extract("{\"$ref\":\"https://example.com/schemas/foo.json#/$defs/bar\"}");
            assertThat(out)
                    .contains("import \"example.com/schemas/foo.json:foo\"")
                    .contains("foo.#bar");
        }

        @Test
        void draft7IgnoresKeywordsBesideRefWhenStrict() {
            final String schema = "{\"$schema\":\"" + DRAFT7 + "\",\"$ref\":\"#/definitions/a\","
                    + "\"type\":\"string\",\"definitions\":{\"a\":{\"type\":\"integer\"}}}";
            assertThatThrownBy(() -> extract(schema, ExtractConfig.DEFAULT.withStrictKeywords(true)))
                    .isInstanceOf(JsonSchemaException.class)
                    .hasMessageContaining("ignoring keyword \"type\" alongside $ref");
        }
    }

    @Nested
    class Versions {

        @Test
        void draft4DateTime() {
            final String out = extract("{\"$schema\":\"" + DRAFT4 + "\",\"type\":\"string\",\"format\":\"date-time\"}");
            assertThat(out)
                    .contains("import \"time\"")
                    .contains("@jsonschema(schema=\"" + DRAFT4 + "\")")
                    .endsWith("time.Time\n");
        }

        @Test
        void draft4DateIgnoredWhenLenient() {
            final String out = extract("{\"$schema\":\"" + DRAFT4 + "\",\"type\":\"string\",\"format\":\"date\"}");
            assertThat(out).endsWith("string\n").doesNotContain("time.");
        }

        @Test
        void draft4DateRejectedWhenStrict() {
            final String schema = "{\"$schema\":\"" + DRAFT4 + "\",\"type\":\"string\",\"format\":\"date\"}";
            assertThatThrownBy(() -> extract(schema, ExtractConfig.DEFAULT.withStrictKeywords(true)))
                    .isInstanceOf(JsonSchemaException.class)
                    .hasMessageContaining("format \"date\" is not recognized in schema version " + DRAFT4);
        }

        @Test
        void keywordFromLaterVersionRejectedWhenStrict() {
            assertThatThrownBy(() -> extract("{\"$schema\":\"" + DRAFT4 + "\",\"const\":1}",
                    ExtractConfig.DEFAULT.withStrictKeywords(true)))
                    .isInstanceOf(JsonSchemaException.class)
                    .hasMessageContaining("keyword \"const\" is not supported in JSON schema version " + DRAFT4);
        }

        @Test
        void booleanSchemaInDraft4() {
            assertThatThrownBy(() -> extract("true", ExtractConfig.DEFAULT.withDefaultVersion(Version.DRAFT4)))
                    .isInstanceOf(JsonSchemaException.class)
                    .hasMessageContaining("boolean schemas not supported in " + DRAFT4);
        }

        @Test
        void booleanTrueAcceptsAnything() {
            assertThat(extract("true")).isEqualTo("_\n");
        }

        @Test
        void deprecatedBecomesAttribute() {
            assertThat(extract("{\"deprecated\":true,\"type\":\"string\"}")).contains("@deprecated()");
        }

        @Test
        void openApiNullable() {
            assertThat(extract("{\"type\":\"string\",\"nullable\":true}",
                    ExtractConfig.DEFAULT.withDefaultVersion(Version.OPENAPI)))
                    .isEqualTo("null | string\n");
        }

        @Test
        void openApiArrayNeedsItems() {
            assertThatThrownBy(() -> extract("{\"type\":\"array\"}",
                    ExtractConfig.DEFAULT.withDefaultVersion(Version.OPENAPI)))
                    .isInstanceOf(JsonSchemaException.class)
                    .hasMessageContaining("\"items\" must be present when the \"type\" is \"array\" in OpenAPI 3.0");
        }
    }

    @Nested
    class Strictness {

        @Test
        void unknownKeywordIgnoredWhenLenient() {
            assertThat(extract("{\"foo\":1}")).isEqualTo("_\n");
        }

        @Test
        void unknownKeywordRejectedWhenStrict() {
            assertThatThrownBy(() -> extract("{\"foo\":1}", ExtractConfig.DEFAULT.withStrictKeywords(true)))
                    .isInstanceOf(JsonSchemaException.class)
                    .hasMessageContaining("unknown keyword \"foo\"");
        }

        @Test
        void extensionKeywordsAlwaysIgnored() {
            assertThat(extract("{\"x-vendor\":1}", ExtractConfig.DEFAULT.withStrict(true))).isEqualTo("_\n");
        }

        @Test
        void unimplementedKeywordRejectedWhenStrict() {
            assertThatThrownBy(() -> extract("{\"dependentRequired\":{}}",
                    ExtractConfig.DEFAULT.withStrictFeatures(true)))
                    .isInstanceOf(JsonSchemaException.class)
                    .hasMessageContaining("keyword \"dependentRequired\" not yet implemented");
        }

        @Test
        void everyProblemIsCollected() {
            final JsonSchemaException e = org.junit.jupiter.api.Assertions.assertThrows(JsonSchemaException.class,
                    () -> extract("{\"type\":5,\"minLength\":\"x\"}"));
            assertThat(e.errors()).hasSizeGreaterThanOrEqualTo(2);
            assertThat(e.errors()).extracting(SchemaError::location).contains("#/type", "#/minLength");
        }
    }

    @Nested
    class Roots {

        @Test
        void definitionsUnderCustomRoot() {
            final ExtractConfig cfg = ExtractConfig.DEFAULT
                    .withRoot("#/components/schemas")
                    .withMap(tokens -> List.<Label>of(new Ident("#" + tokens.get(tokens.size() - 1))));
            final String out = extract("""
                    {"components":{"schemas":{"A":{"type":"string"},"B":{"type":"integer"}}}}
                    """, cfg);
            assertThat(out).isEqualTo("#A: string\n#B: int\n");
        }

        @Test
        void singleRootSelectsOneSchema() {
            assertThat(extract("{\"a\":{\"type\":\"string\"}}",
                    ExtractConfig.DEFAULT.withRoot("#/a").withSingleRoot(true)))
                    .isEqualTo("string\n");
        }

        @Test
        void missingRootIsReported() {
            assertThatThrownBy(() -> extract("{}", ExtractConfig.DEFAULT.withRoot("#/missing")))
                    .isInstanceOf(JsonSchemaException.class)
                    .hasMessageContaining("root value at path #/missing does not exist");
        }

        @Test
        void relativeIdIsRejected() {
            assertThatThrownBy(() -> extract("{}", ExtractConfig.DEFAULT.withId("relative")))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "{\"type\":\"boolean\"}                    | bool",
            "{\"type\":\"null\"}                       | null",
            "{\"type\":\"number\"}                     | number",
            "{\"type\":\"string\",\"format\":\"uri\"}      | net.AbsURL",
            "{\"type\":\"string\",\"format\":\"date-time\"} | time.Time",
            "{\"type\":\"object\",\"minProperties\":1}   | struct.MinFields(1)",
            "{\"const\":\"x\"}                         | \"x\""
    })
    void singleConstraint(String schema, String expected) {
        assertThat(extract(schema)).endsWith(expected + "\n");
    }
}
