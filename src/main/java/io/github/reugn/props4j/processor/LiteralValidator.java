package io.github.reugn.props4j.processor;

import javax.lang.model.element.Element;
import javax.lang.model.type.TypeMirror;
import java.util.Set;

/**
 * Validates {@code @DefaultValue} literals against the property type.
 * <p>
 * Property types are reference types, so the supported literal targets are:
 * <ul>
 *   <li>Numeric wrappers (Integer, Long, Double, Float, Byte, Short)</li>
 *   <li>Boolean</li>
 *   <li>Character</li>
 *   <li>String, accepting any text</li>
 *   <li>{@code "null"}, accepted for every property type</li>
 * </ul>
 *
 * @see ValidationUtils
 */
final class LiteralValidator {

    static final Set<String> NUMERIC_TYPES = Set.of(
            "java.lang.Integer",
            "java.lang.Long",
            "java.lang.Double",
            "java.lang.Float",
            "java.lang.Byte",
            "java.lang.Short"
    );

    static final String BOOLEAN_TYPE = "java.lang.Boolean";

    static final String CHAR_TYPE = "java.lang.Character";

    static final String STRING_TYPE = "java.lang.String";

    private LiteralValidator() {
    }

    /**
     * Checks whether literal defaults other than {@code "null"} can be declared for a type.
     *
     * @param typeStr the fully qualified type name
     * @return {@code true} for String and the wrapper types
     */
    static boolean supportsLiterals(String typeStr) {
        return NUMERIC_TYPES.contains(typeStr)
                || BOOLEAN_TYPE.equals(typeStr)
                || CHAR_TYPE.equals(typeStr)
                || STRING_TYPE.equals(typeStr);
    }

    /**
     * Validates that a string literal value can be parsed as the target type.
     *
     * @param value            the string value to validate
     * @param type             the property type
     * @param annotatedElement the element to report errors against
     * @param errorReporter    callback for reporting errors
     * @return {@code true} if the value is valid, {@code false} if an error was reported
     */
    static boolean validateParseable(String value, TypeMirror type,
                                     Element annotatedElement, ErrorReporter errorReporter) {
        String typeStr = type.toString();

        // "null" is valid for any property type
        if ("null".equals(value)) {
            return true;
        }

        if (!supportsLiterals(typeStr)) {
            errorReporter.error(annotatedElement,
                    "@DefaultValue is not supported for type '" + getSimpleTypeName(typeStr)
                            + "'. Only String, wrapper types and \"null\" are supported.");
            return false;
        }

        if (value.isEmpty() && !STRING_TYPE.equals(typeStr)) {
            errorReporter.error(annotatedElement,
                    "@DefaultValue(\"\") is only valid for String properties.");
            return false;
        }

        if (NUMERIC_TYPES.contains(typeStr)) {
            return validateNumericLiteral(value, typeStr, annotatedElement, errorReporter);
        }

        if (BOOLEAN_TYPE.equals(typeStr)) {
            if (!"true".equals(value) && !"false".equals(value)) {
                errorReporter.error(annotatedElement,
                        "'" + value + "' is not a valid boolean. Use 'true' or 'false'.");
                return false;
            }
            return true;
        }

        if (CHAR_TYPE.equals(typeStr) && value.length() != 1) {
            errorReporter.error(annotatedElement, "'" + value + "' is not a valid char.");
            return false;
        }

        return true;
    }

    /**
     * Validates a numeric literal value can be parsed as the specified type.
     *
     * @param value            the string value to parse
     * @param typeStr          the target numeric type
     * @param annotatedElement the element to report errors against
     * @param errorReporter    callback for reporting errors
     * @return {@code true} if the value is valid, {@code false} if an error was reported
     */
    static boolean validateNumericLiteral(String value, String typeStr,
                                          Element annotatedElement, ErrorReporter errorReporter) {
        // Remove type suffixes for parsing
        String cleanValue = value.replaceAll("[LlDdFf]$", "");

        try {
            switch (typeStr) {
                case "java.lang.Integer" -> Integer.parseInt(cleanValue);
                case "java.lang.Long" -> Long.parseLong(cleanValue);
                case "java.lang.Double" -> Double.parseDouble(cleanValue);
                case "java.lang.Float" -> Float.parseFloat(cleanValue);
                case "java.lang.Byte" -> Byte.parseByte(cleanValue);
                case "java.lang.Short" -> Short.parseShort(cleanValue);
                default -> throw new IllegalStateException("Not a numeric type: " + typeStr);
            }
        } catch (NumberFormatException e) {
            String simpleType = getSimpleTypeName(typeStr);
            errorReporter.error(annotatedElement,
                    "'" + value + "' is not a valid " + simpleType.toLowerCase() + ".");
            return false;
        }
        return true;
    }

    /**
     * Gets a simple type name for error messages.
     * Removes package prefix if present.
     *
     * @param typeStr the fully qualified type string
     * @return the simple type name
     */
    static String getSimpleTypeName(String typeStr) {
        String raw = typeStr.contains("<") ? typeStr.substring(0, typeStr.indexOf('<')) : typeStr;
        int lastDot = raw.lastIndexOf('.');
        return lastDot >= 0 ? raw.substring(lastDot + 1) : raw;
    }
}
