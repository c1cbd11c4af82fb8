package io.github.reugn.props4j;

import java.util.Map;
import java.util.function.Function;

/**
 * Parses {@code @DefaultValue} literals into values of the annotated property's type.
 *
 * <p>Accepts the same literals the annotation processor accepts: {@code "null"} for any type,
 * any text for {@code String}, and numeric, boolean or single-character literals for the
 * corresponding wrapper types. Numeric literals may carry a Java type suffix ({@code 10L},
 * {@code 1.5f}). Primitive types parse like their wrappers.
 */
final class Literals {

    private static final Map<Class<?>, Function<String, Object>> PARSERS = Map.of(
            Integer.class, Integer::valueOf,
            Long.class, Long::valueOf,
            Double.class, Double::valueOf,
            Float.class, Float::valueOf,
            Byte.class, Byte::valueOf,
            Short.class, Short::valueOf,
            Boolean.class, Literals::parseBoolean,
            Character.class, Literals::parseCharacter
    );

    private static final Map<Class<?>, Class<?>> WRAPPERS = Map.of(
            int.class, Integer.class,
            long.class, Long.class,
            double.class, Double.class,
            float.class, Float.class,
            byte.class, Byte.class,
            short.class, Short.class,
            boolean.class, Boolean.class,
            char.class, Character.class
    );

    private Literals() {
    }

    /**
     * Parses a literal.
     *
     * @param literal      the literal text
     * @param declaredType the property type, primitive or reference
     * @return the parsed value, {@code null} for the {@code "null"} literal
     * @throws IllegalArgumentException if the literal does not parse for {@code declaredType}, or the
     *                                  type does not support literal defaults
     */
    static Object parse(String literal, Class<?> declaredType) {
        Class<?> type = WRAPPERS.getOrDefault(declaredType, declaredType);
        if ("null".equals(literal)) {
            if (declaredType.isPrimitive()) {
                throw new IllegalArgumentException("'null' is not a valid default for primitive type "
                        + declaredType.getName() + ".");
            }
            return null;
        }
        if (type == String.class) {
            return literal;
        }
        Function<String, Object> parser = PARSERS.get(type);
        if (parser == null) {
            throw new IllegalArgumentException("@DefaultValue is not supported for type " + type.getName());
        }
        String clean = type == Character.class || type == Boolean.class
                ? literal
                : literal.replaceAll("[LlDdFf]$", "");
        try {
            return parser.apply(clean);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("'" + literal + "' is not a valid "
                    + type.getSimpleName().toLowerCase() + ".", e);
        }
    }

    private static Object parseBoolean(String literal) {
        if (!"true".equals(literal) && !"false".equals(literal)) {
            throw new IllegalArgumentException("'" + literal + "' is not a valid boolean. Use 'true' or 'false'.");
        }
        return Boolean.valueOf(literal);
    }

    private static Object parseCharacter(String literal) {
        if (literal.length() != 1) {
            throw new IllegalArgumentException("'" + literal + "' is not a valid char.");
        }
        return literal.charAt(0);
    }
}
