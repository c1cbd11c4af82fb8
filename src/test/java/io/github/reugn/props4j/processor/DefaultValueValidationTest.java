package io.github.reugn.props4j.processor;

import com.google.testing.compile.Compilation;
import com.google.testing.compile.JavaFileObjects;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import javax.tools.JavaFileObject;

import static com.google.testing.compile.CompilationSubject.assertThat;
import static io.github.reugn.props4j.util.CompileHelper.compile;

/**
 * Tests for @DefaultValue literal validation.
 * <p>
 * Covers:
 * <ul>
 *   <li>Literal parsing for the wrapper types</li>
 *   <li>Type suffixes on numeric literals</li>
 *   <li>The "null" literal</li>
 *   <li>Unsupported property types</li>
 * </ul>
 */
@DisplayName("@DefaultValue Validation")
class DefaultValueValidationTest {

    private static JavaFileObject property(String type, String literal) {
        return JavaFileObjects.forSourceString("test.Args",
                """
                        package test;

                        import io.github.reugn.props4j.annotation.DefaultValue;
                        import io.github.reugn.props4j.annotation.InputType;

                        @InputType
                        public abstract class Args {
                            @DefaultValue("%s")
                            public abstract %s value();
                        }
                        """.formatted(literal, type));
    }

    @Nested
    @DisplayName("Literal Parsing")
    class LiteralParsing {

        @ParameterizedTest(name = "{0} accepts \"{1}\"")
        @CsvSource({
                "Integer, 42",
                "Integer, -7",
                "Long, 100L",
                "Double, 2.5",
                "Double, 1e3d",
                "Float, 1.5f",
                "Byte, 127",
                "Short, 1024",
                "Boolean, true",
                "Boolean, false",
                "Character, x",
                "String, hello world"
        })
        void validLiterals(String type, String literal) {
            assertThat(compile(property(type, literal))).succeeded();
        }

        @ParameterizedTest(name = "{0} rejects \"{1}\"")
        @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
                "Integer   | abc | 'abc' is not a valid integer.",
                "Long      | 1.5 | '1.5' is not a valid long.",
                "Byte      | 300 | '300' is not a valid byte.",
                "Double    | two | 'two' is not a valid double.",
                "Boolean   | yes | 'yes' is not a valid boolean. Use 'true' or 'false'.",
                "Character | ab  | 'ab' is not a valid char."
        })
        void invalidLiterals(String type, String literal, String message) {
            Compilation compilation = compile(property(type, literal));
            assertThat(compilation).failed();
            assertThat(compilation).hadErrorContaining(message);
        }

        @Test
        @DisplayName("Error when empty literal on a non-String property")
        void emptyNonString() {
            Compilation compilation = compile(property("Integer", ""));
            assertThat(compilation).failed();
            assertThat(compilation).hadErrorContaining("@DefaultValue(\"\") is only valid for String properties.");
        }

        @Test
        @DisplayName("OK for empty String literal")
        void emptyString() {
            assertThat(compile(property("String", ""))).succeeded();
        }
    }

    @Nested
    @DisplayName("Null Literal")
    class NullLiteral {

        @Test
        @DisplayName("OK for \"null\" on any reference type")
        void nullOnCollection() {
            assertThat(compile(property("java.util.List<String>", "null"))).succeeded();
        }

        @Test
        @DisplayName("OK for \"null\" on Optional")
        void nullOnOptional() {
            assertThat(compile(property("java.util.Optional<Integer>", "null"))).succeeded();
        }
    }

    @Nested
    @DisplayName("Unsupported Types")
    class UnsupportedTypes {

        @Test
        @DisplayName("Error when literal default on a collection type")
        void collectionType() {
            Compilation compilation = compile(property("java.util.List<String>", "a,b"));
            assertThat(compilation).failed();
            assertThat(compilation).hadErrorContaining(
                    "@DefaultValue is not supported for type 'List'. Only String, wrapper types and \"null\" are supported.");
        }

        @Test
        @DisplayName("Error when literal default on an Optional type")
        void optionalType() {
            Compilation compilation = compile(property("java.util.Optional<String>", "x"));
            assertThat(compilation).failed();
            assertThat(compilation).hadErrorContaining("@DefaultValue is not supported for type 'Optional'.");
        }
    }
}
