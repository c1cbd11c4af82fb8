package io.github.reugn.props4j;

import java.lang.reflect.Array;
import java.lang.reflect.GenericArrayType;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Future;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Declared type of a property, as an explicit type algebra.
 *
 * <p><b>Shapes:</b>
 * <table border="1">
 *   <caption>Type expression shapes</caption>
 *   <tr><th>Shape</th><th>Java source form</th></tr>
 *   <tr><td>{@link Plain}</td><td>{@code String}, {@code Integer}, {@code int}, {@code String[]}</td></tr>
 *   <tr><td>{@link Parameterized}</td><td>{@code List<String>}, {@code Map<String, Integer>}</td></tr>
 *   <tr><td>{@link Deferred}</td><td>{@code CompletionStage<T>}, {@code CompletableFuture<T>}, {@code Future<T>}</td></tr>
 *   <tr><td>{@link Union}</td><td>{@code Optional<T>} is the union {@code [T, ABSENT]}</td></tr>
 *   <tr><td>{@link #ABSENT}</td><td>the explicit "no value" alternative of a union</td></tr>
 * </table>
 *
 * <p>Expressions are built either by generated code, through the static factories, or from
 * reflection through {@link #of(Type)}. Both paths produce equal expressions for the same
 * declared type.
 *
 * @see TypeUnwrapper
 */
public interface TypeExpr {

    /**
     * The absent-type alternative.
     */
    TypeExpr ABSENT = AbsentType.INSTANCE;

    static TypeExpr plain(Class<?> type) {
        return new Plain(type);
    }

    static TypeExpr parameterized(Class<?> rawType, TypeExpr... arguments) {
        return new Parameterized(rawType, List.of(arguments));
    }

    static TypeExpr deferred(TypeExpr value) {
        return new Deferred(value);
    }

    static TypeExpr union(TypeExpr... alternatives) {
        return new Union(List.of(alternatives));
    }

    /**
     * Builds the optional form of {@code value}: the two-alternative union {@code [value, ABSENT]}.
     */
    static TypeExpr optional(TypeExpr value) {
        return new Union(List.of(value, ABSENT));
    }

    /**
     * Converts a reflective type into a type expression.
     * <ul>
     *   <li>{@code Optional<T>} becomes {@code optional(of(T))}</li>
     *   <li>a {@link CompletionStage} or {@link Future} subtype with one type argument becomes
     *       {@code deferred(of(T))}</li>
     *   <li>any other parameterized type becomes {@link Parameterized}</li>
     *   <li>wildcards are replaced by their upper bound</li>
     *   <li>type variables and generic arrays are erased</li>
     * </ul>
     *
     * @param type the reflective type, e.g. {@code Field.getGenericType()}
     * @return the equivalent type expression
     */
    static TypeExpr of(Type type) {
        Objects.requireNonNull(type, "type");
        if (type instanceof Class) {
            return plain((Class<?>) type);
        }
        if (type instanceof ParameterizedType) {
            ParameterizedType pt = (ParameterizedType) type;
            Class<?> raw = (Class<?>) pt.getRawType();
            Type[] args = pt.getActualTypeArguments();
            if (args.length == 1 && raw == Optional.class) {
                return optional(of(args[0]));
            }
            if (args.length == 1 && isDeferredWrapper(raw)) {
                return deferred(of(args[0]));
            }
            return new Parameterized(raw, Stream.of(args).map(TypeExpr::of).collect(Collectors.toList()));
        }
        if (type instanceof WildcardType) {
            return of(((WildcardType) type).getUpperBounds()[0]);
        }
        if (type instanceof TypeVariable || type instanceof GenericArrayType) {
            return plain(erase(type));
        }
        throw new IllegalArgumentException("Unsupported type: " + type);
    }

    /**
     * Checks whether a raw class is a single-argument deferred value wrapper.
     */
    static boolean isDeferredWrapper(Class<?> rawType) {
        return CompletionStage.class.isAssignableFrom(rawType) || Future.class.isAssignableFrom(rawType);
    }

    private static Class<?> erase(Type type) {
        if (type instanceof Class) {
            return (Class<?>) type;
        }
        if (type instanceof ParameterizedType) {
            return (Class<?>) ((ParameterizedType) type).getRawType();
        }
        if (type instanceof GenericArrayType) {
            Class<?> component = erase(((GenericArrayType) type).getGenericComponentType());
            return Array.newInstance(component, 0).getClass();
        }
        if (type instanceof WildcardType) {
            return erase(((WildcardType) type).getUpperBounds()[0]);
        }
        if (type instanceof TypeVariable) {
            return erase(((TypeVariable<?>) type).getBounds()[0]);
        }
        return Object.class;
    }

    /**
     * A non-generic type.
     */
    record Plain(Class<?> type) implements TypeExpr {
        public Plain {
            Objects.requireNonNull(type, "type");
        }

        @Override
        public String toString() {
            return type.getSimpleName();
        }
    }

    /**
     * A generic type other than the deferred and optional wrappers.
     */
    record Parameterized(Class<?> rawType, List<TypeExpr> arguments) implements TypeExpr {
        public Parameterized {
            Objects.requireNonNull(rawType, "rawType");
            arguments = List.copyOf(arguments);
        }

        @Override
        public String toString() {
            return rawType.getSimpleName() + arguments.stream()
                    .map(TypeExpr::toString)
                    .collect(Collectors.joining(", ", "<", ">"));
        }
    }

    /**
     * A value produced asynchronously; {@code value} is the payload type.
     */
    record Deferred(TypeExpr value) implements TypeExpr {
        public Deferred {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String toString() {
            return "Deferred<" + value + ">";
        }
    }

    /**
     * A union of at least two alternatives, in declaration order.
     */
    record Union(List<TypeExpr> alternatives) implements TypeExpr {
        public Union {
            alternatives = List.copyOf(alternatives);
            if (alternatives.size() < 2) {
                throw new IllegalArgumentException("A union needs at least two alternatives, got " + alternatives);
            }
        }

        @Override
        public String toString() {
            return alternatives.stream()
                    .map(TypeExpr::toString)
                    .collect(Collectors.joining(" | "));
        }
    }

    /**
     * The explicit absent alternative; a singleton.
     */
    enum AbsentType implements TypeExpr {
        INSTANCE;

        @Override
        public String toString() {
            return "Absent";
        }
    }
}
