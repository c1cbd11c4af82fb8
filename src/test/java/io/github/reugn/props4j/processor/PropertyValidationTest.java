package io.github.reugn.props4j.processor;

import com.google.testing.compile.Compilation;
import com.google.testing.compile.JavaFileObjects;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import javax.tools.JavaFileObject;

import static com.google.testing.compile.CompilationSubject.assertThat;
import static io.github.reugn.props4j.util.CompileHelper.compile;

/**
 * Tests for property, wire name and getter validations.
 */
@DisplayName("Property Validations")
class PropertyValidationTest {

    private static JavaFileObject inputType(String body) {
        return JavaFileObjects.forSourceString("test.Args",
                """
                        package test;

                        import io.github.reugn.props4j.annotation.*;

                        @InputType
                        public abstract class Args {
                        %s
                        }
                        """.formatted(body));
    }

    @Nested
    @DisplayName("Property Types")
    class PropertyTypesValidation {

        @Test
        @DisplayName("Error when property has a primitive type")
        void primitiveType() {
            Compilation compilation = compile(inputType("public abstract int port();"));
            assertThat(compilation).failed();
            assertThat(compilation).hadErrorContaining(
                    "Property 'port' must have a reference type. Use Integer instead of int.");
        }

        @Test
        @DisplayName("Error when property has a primitive boolean type")
        void primitiveBoolean() {
            Compilation compilation = compile(inputType("public abstract boolean enabled();"));
            assertThat(compilation).failed();
            assertThat(compilation).hadErrorContaining("Use Boolean instead of boolean.");
        }

        @Test
        @DisplayName("Error when property declares type parameters")
        void typeParameters() {
            Compilation compilation = compile(inputType("public abstract <T> java.util.List<T> items();"));
            assertThat(compilation).failed();
            assertThat(compilation).hadErrorContaining("Property 'items' cannot declare type parameters.");
        }

        @Test
        @DisplayName("OK for arrays, collections and wrapped types")
        void referenceTypes() {
            Compilation compilation = compile(inputType("""
                    public abstract String[] tags();
                    public abstract java.util.Map<String, java.util.List<Integer>> ports();
                    public abstract java.util.Optional<String> region();
                    public abstract java.util.concurrent.CompletableFuture<java.util.Optional<Long>> size();
                    """));
            assertThat(compilation).succeeded();
        }
    }

    @Nested
    @DisplayName("Reserved Names")
    class ReservedNames {

        @Test
        @DisplayName("Error when property is named toString")
        void toStringProperty() {
            Compilation compilation = compile(inputType("public abstract String toString();"));
            assertThat(compilation).failed();
            assertThat(compilation).hadErrorContaining("'toString' is reserved and cannot be used as a property name.");
        }

        @Test
        @DisplayName("Error when property is named valueStore")
        void valueStoreProperty() {
            Compilation compilation = compile(inputType("public abstract String valueStore();"));
            assertThat(compilation).failed();
            assertThat(compilation).hadErrorContaining("'valueStore' is reserved");
        }
    }

    @Nested
    @DisplayName("Wire Names")
    class WireNames {

        @Test
        @DisplayName("Error when @Property wire name is empty")
        void emptyWireName() {
            Compilation compilation = compile(inputType("""
                    @Property("")
                    public abstract String name();
                    """));
            assertThat(compilation).failed();
            assertThat(compilation).hadErrorContaining("Wire name must not be empty.");
        }

        @Test
        @DisplayName("Error when two properties share a wire name")
        void duplicateWireName() {
            Compilation compilation = compile(inputType("""
                    @Property("id")
                    public abstract String name();

                    @Property("id")
                    public abstract String key();
                    """));
            assertThat(compilation).failed();
            assertThat(compilation).hadErrorContaining("Duplicate wire name 'id': already used by 'name'.");
        }

        @Test
        @DisplayName("Error when a getter reuses a property wire name")
        void getterDuplicatesProperty() {
            Compilation compilation = compile(inputType("""
                    public abstract String name();

                    @Getter("name")
                    public String displayName() {
                        return "x";
                    }
                    """));
            assertThat(compilation).failed();
            assertThat(compilation).hadErrorContaining("Duplicate wire name 'name': already used by 'name'.");
        }

        @Test
        @DisplayName("Error when @Property is on a concrete method")
        void propertyOnConcreteMethod() {
            Compilation compilation = compile(inputType("""
                    @Property("label")
                    public String label() {
                        return "x";
                    }
                    """));
            assertThat(compilation).failed();
            assertThat(compilation).hadErrorContaining(
                    "@Property can only be applied to abstract, zero-argument, non-void property methods.");
        }

        @Test
        @DisplayName("Error when @DefaultValue is on a setter")
        void defaultValueOnSetter() {
            Compilation compilation = compile(inputType("""
                    public abstract String name();

                    @DefaultValue("x")
                    public abstract void name(String value);
                    """));
            assertThat(compilation).failed();
            assertThat(compilation).hadErrorContaining(
                    "@DefaultValue can only be applied to abstract, zero-argument, non-void property methods.");
        }
    }

    @Nested
    @DisplayName("Getters")
    class Getters {

        @Test
        @DisplayName("Error when @Getter method takes arguments")
        void getterWithArguments() {
            Compilation compilation = compile(inputType("""
                    @Getter
                    public String lookup(String key) {
                        return key;
                    }
                    """));
            assertThat(compilation).failed();
            assertThat(compilation).hadErrorContaining(
                    "@Getter can only be applied to instance methods taking no arguments and returning a value.");
        }

        @Test
        @DisplayName("Error when @Getter method is static")
        void staticGetter() {
            Compilation compilation = compile(inputType("""
                    @Getter
                    public static String region() {
                        return "eu";
                    }
                    """));
            assertThat(compilation).failed();
            assertThat(compilation).hadErrorContaining("@Getter can only be applied to instance methods");
        }

        @Test
        @DisplayName("Error when abstract @Getter has a primitive type")
        void primitiveAbstractGetter() {
            Compilation compilation = compile(inputType("""
                    @Getter("node_count")
                    public abstract int nodes();
                    """));
            assertThat(compilation).failed();
            assertThat(compilation).hadErrorContaining(
                    "Getter 'nodes' must have a reference type. Use Integer instead of int.");
        }

        @Test
        @DisplayName("OK for concrete @Getter with a primitive type")
        void primitiveConcreteGetter() {
            Compilation compilation = compile(inputType("""
                    @Getter
                    public int nodes() {
                        return 3;
                    }
                    """));
            assertThat(compilation).succeeded();
        }
    }
}
