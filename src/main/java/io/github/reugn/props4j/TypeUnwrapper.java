package io.github.reugn.props4j;

import java.util.List;

/**
 * Strips wrapper layers from a declared property type to expose its concrete payload type.
 *
 * <p>A property is modelled as at most one layer of deferred value wrapping around at most one
 * layer of optionality, so each step runs exactly once:
 * <pre>{@code
 * Deferred<Optional<String>>            -> String
 * Deferred<Optional<Optional<String>>>  -> Optional<String>
 * Optional<Deferred<String>>            -> Deferred<String>
 * }</pre>
 *
 * <p>Only the two-alternative union {@code [T, ABSENT]} counts as an optional. Wider unions are
 * returned unchanged even when one of their alternatives is {@link TypeExpr#ABSENT}.
 */
public final class TypeUnwrapper {

    private TypeUnwrapper() {
    }

    /**
     * Unwraps one deferred layer, then one optional layer.
     *
     * @param type the declared type
     * @return the payload type
     */
    public static TypeExpr unwrap(TypeExpr type) {
        TypeExpr value = type;
        if (value instanceof TypeExpr.Deferred) {
            value = ((TypeExpr.Deferred) value).value();
        }
        return unwrapOptional(value);
    }

    /**
     * Unwraps the {@code T} of a two-alternative union {@code [T, ABSENT]}.
     * The absent alternative may sit on either side.
     *
     * @param type the declared type
     * @return {@code T} for an optional, otherwise {@code type} itself
     */
    public static TypeExpr unwrapOptional(TypeExpr type) {
        if (!(type instanceof TypeExpr.Union)) {
            return type;
        }
        List<TypeExpr> alternatives = ((TypeExpr.Union) type).alternatives();
        if (alternatives.size() != 2) {
            return type;
        }
        TypeExpr first = alternatives.get(0);
        TypeExpr second = alternatives.get(1);
        if (second == TypeExpr.ABSENT && first != TypeExpr.ABSENT) {
            return first;
        }
        if (first == TypeExpr.ABSENT && second != TypeExpr.ABSENT) {
            return second;
        }
        return type;
    }
}
