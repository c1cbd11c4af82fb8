package io.github.reugn.props4j.processor;

import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.MethodSpec;
import com.squareup.javapoet.TypeName;

import javax.lang.model.element.Element;
import javax.lang.model.element.ExecutableElement;
import javax.lang.model.element.PackageElement;
import javax.lang.model.element.TypeElement;
import javax.lang.model.type.TypeMirror;

/**
 * Shared utilities for code generation in props4j.
 *
 * <p>Centralizes the runtime class names generated code refers to, the naming rule of
 * generated classes and the conversion of {@code @DefaultValue} literals to Java expressions.
 *
 * <p><b>Default Expression Examples:</b>
 * <ul>
 *   <li>{@code @DefaultValue("42")} on {@code Integer} → Integer.valueOf("42")</li>
 *   <li>{@code @DefaultValue("hello")} on {@code String} → "hello"</li>
 *   <li>{@code @DefaultValue("100L")} on {@code Long} → Long.valueOf("100")</li>
 *   <li>{@code @DefaultValue("c")} on {@code Character} → 'c'</li>
 *   <li>{@code @DefaultValue("null")} → null</li>
 * </ul>
 *
 * @see AccessorGenerator
 * @see RegistrationGenerator
 */
final class CodeGenUtils {

    /**
     * Suffix appended to the declaration name to form the generated class name.
     * Must match the runtime registry's companion lookup.
     */
    static final String GENERATED_SUFFIX = "Impl";

    static final String RUNTIME_PACKAGE = "io.github.reugn.props4j";

    static final ClassName PROPERTY_TYPES = ClassName.get(RUNTIME_PACKAGE, "PropertyTypes");
    static final ClassName PROPERTY_HOLDER = ClassName.get(RUNTIME_PACKAGE, "PropertyHolder");
    static final ClassName PROPERTY_DESCRIPTOR = ClassName.get(RUNTIME_PACKAGE, "PropertyDescriptor");
    static final ClassName TYPE_DECLARATION = ClassName.get(RUNTIME_PACKAGE, "TypeDeclaration");
    static final ClassName TYPE_EXPR = ClassName.get(RUNTIME_PACKAGE, "TypeExpr");
    static final ClassName VALUE_STORE = ClassName.get(RUNTIME_PACKAGE, "ValueStore");

    /**
     * Name of the value store field and accessor of generated classes.
     */
    static final String VALUE_STORE_NAME = "valueStore";

    private CodeGenUtils() {
    }

    // ==================== NAMING ====================

    /**
     * Returns the class generated for a declaration: the chain of enclosing class names joined
     * by {@code _}, followed by {@link #GENERATED_SUFFIX}, in the declaration's package.
     *
     * <p><b>Example:</b> {@code com.acme.Storage.BucketArgs} → {@code com.acme.Storage_BucketArgsImpl}
     *
     * @param declaration the declaration class
     * @param packageName its package
     * @return the generated class name
     */
    static ClassName generatedClassName(TypeElement declaration, String packageName) {
        StringBuilder simpleName = new StringBuilder(declaration.getSimpleName());
        for (Element e = declaration.getEnclosingElement(); e instanceof TypeElement; e = e.getEnclosingElement()) {
            simpleName.insert(0, e.getSimpleName() + "_");
        }
        return ClassName.get(packageName, simpleName + GENERATED_SUFFIX);
    }

    static String packageName(TypeElement type) {
        Element e = type;
        while (!(e instanceof PackageElement)) {
            e = e.getEnclosingElement();
        }
        return ((PackageElement) e).getQualifiedName().toString();
    }

    /**
     * Copies throws declarations from a method or constructor to a generated one.
     *
     * @param original      the source method or constructor
     * @param methodBuilder the JavaPoet {@link MethodSpec.Builder} to add exceptions to
     */
    static void copyThrowsDeclarations(ExecutableElement original, MethodSpec.Builder methodBuilder) {
        for (TypeMirror thrown : original.getThrownTypes()) {
            methodBuilder.addException(TypeName.get(thrown));
        }
    }

    // ==================== TYPE CONVERSION ====================

    /**
     * Converts a {@code @DefaultValue} literal to a Java expression of the property type.
     *
     * <p>The literal has already been validated by {@link LiteralValidator}.
     *
     * @param value the literal
     * @param type  the property type
     * @return a valid Java expression for the default value
     */
    static String convertDefaultValue(String value, TypeMirror type) {
        if ("null".equals(value)) {
            return "null";
        }

        // valueOf parses exactly like the runtime literal parser, leading zeros and NaN included
        String clean = value.replaceAll("[LlDdFf]$", "");
        return switch (type.toString()) {
            case "java.lang.Boolean" -> value;
            case "java.lang.Integer", "java.lang.Long", "java.lang.Double",
                    "java.lang.Float", "java.lang.Byte", "java.lang.Short" ->
                    LiteralValidator.getSimpleTypeName(type.toString()) + ".valueOf(\"" + clean + "\")";
            case "java.lang.Character" -> "'" + escapeChar(value.charAt(0)) + "'";
            case "java.lang.String" -> "\"" + escapeString(value) + "\"";
            default -> throw new IllegalStateException("No literal form for type " + type);
        };
    }

    // ==================== STRING UTILITIES ====================

    /**
     * Escapes special characters in a string for use in a Java string literal.
     * <p>
     * Handles: {@code \n}, {@code \r}, {@code \t}, {@code \\}, {@code \"}, {@code \'}
     *
     * @param s the string to escape
     * @return the escaped string (without surrounding quotes)
     */
    static String escapeString(String s) {
        StringBuilder sb = new StringBuilder();
        for (char c : s.toCharArray()) {
            sb.append(escapeChar(c));
        }
        return sb.toString();
    }

    /**
     * Escapes a single character for use in a Java literal.
     *
     * @param c the character to escape
     * @return the escaped representation (e.g., '\n' → "\\n")
     */
    static String escapeChar(char c) {
        return switch (c) {
            case '\n' -> "\\n";
            case '\r' -> "\\r";
            case '\t' -> "\\t";
            case '\\' -> "\\\\";
            case '"' -> "\\\"";
            case '\'' -> "\\'";
            default -> String.valueOf(c);
        };
    }
}
