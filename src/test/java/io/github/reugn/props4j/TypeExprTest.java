package io.github.reugn.props4j;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Type;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TypeExpr")
class TypeExprTest {

    @SuppressWarnings("unused")
    private static final class Fields<T extends Comparable<T>> {
        String plain;
        int primitive;
        String[] array;
        Optional<String> optional;
        CompletableFuture<List<Integer>> future;
        CompletionStage<String> stage;
        Future<Optional<Long>> plainFuture;
        Map<String, ? extends Number> wildcard;
        List<?> unbounded;
        T variable;
        List<String>[] genericArray;
    }

    private static Type fieldType(String name) {
        try {
            return Fields.class.getDeclaredField(name).getGenericType();
        } catch (NoSuchFieldException e) {
            throw new AssertionError(e);
        }
    }

    @Nested
    @DisplayName("From Reflection")
    class FromReflection {

        @Test
        @DisplayName("Classes become plain types")
        void plainTypes() {
            assertThat(TypeExpr.of(fieldType("plain"))).isEqualTo(TypeExpr.plain(String.class));
            assertThat(TypeExpr.of(fieldType("primitive"))).isEqualTo(TypeExpr.plain(int.class));
            assertThat(TypeExpr.of(fieldType("array"))).isEqualTo(TypeExpr.plain(String[].class));
        }

        @Test
        @DisplayName("Optional becomes a union with ABSENT")
        void optional() {
            assertThat(TypeExpr.of(fieldType("optional")))
                    .isEqualTo(TypeExpr.union(TypeExpr.plain(String.class), TypeExpr.ABSENT));
        }

        @Test
        @DisplayName("Future and CompletionStage subtypes become deferred")
        void deferred() {
            assertThat(TypeExpr.of(fieldType("future"))).isEqualTo(
                    TypeExpr.deferred(TypeExpr.parameterized(List.class, TypeExpr.plain(Integer.class))));
            assertThat(TypeExpr.of(fieldType("stage"))).isEqualTo(TypeExpr.deferred(TypeExpr.plain(String.class)));
            assertThat(TypeExpr.of(fieldType("plainFuture")))
                    .isEqualTo(TypeExpr.deferred(TypeExpr.optional(TypeExpr.plain(Long.class))));
        }

        @Test
        @DisplayName("Wildcards resolve to their upper bound")
        void wildcards() {
            assertThat(TypeExpr.of(fieldType("wildcard"))).isEqualTo(TypeExpr.parameterized(Map.class,
                    TypeExpr.plain(String.class), TypeExpr.plain(Number.class)));
            assertThat(TypeExpr.of(fieldType("unbounded")))
                    .isEqualTo(TypeExpr.parameterized(List.class, TypeExpr.plain(Object.class)));
        }

        @Test
        @DisplayName("Type variables and generic arrays are erased")
        void erasure() {
            assertThat(TypeExpr.of(fieldType("variable"))).isEqualTo(TypeExpr.plain(Comparable.class));
            assertThat(TypeExpr.of(fieldType("genericArray"))).isEqualTo(TypeExpr.plain(List[].class));
        }
    }

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("A union needs two alternatives")
        void unionArity() {
            assertThatThrownBy(() -> TypeExpr.union(TypeExpr.plain(String.class)))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("at least two alternatives");
        }

        @Test
        @DisplayName("Parameterized arguments are copied")
        void argumentsCopied() {
            TypeExpr.Parameterized type = (TypeExpr.Parameterized) TypeExpr.parameterized(List.class,
                    TypeExpr.plain(String.class));

            assertThatThrownBy(() -> type.arguments().add(TypeExpr.ABSENT))
                    .isInstanceOf(UnsupportedOperationException.class);
        }

        @Test
        @DisplayName("toString reads like source")
        void readable() {
            assertThat(TypeExpr.optional(TypeExpr.plain(String.class))).hasToString("String | Absent");
            assertThat(TypeExpr.parameterized(Map.class, TypeExpr.plain(String.class), TypeExpr.plain(Integer.class)))
                    .hasToString("Map<String, Integer>");
            assertThat(TypeExpr.deferred(TypeExpr.plain(Long.class))).hasToString("Deferred<Long>");
        }

        @Test
        @DisplayName("Deferred wrappers are recognized by subtype")
        void deferredWrapper() {
            assertThat(TypeExpr.isDeferredWrapper(CompletableFuture.class)).isTrue();
            assertThat(TypeExpr.isDeferredWrapper(Future.class)).isTrue();
            assertThat(TypeExpr.isDeferredWrapper(Optional.class)).isFalse();
        }
    }
}
