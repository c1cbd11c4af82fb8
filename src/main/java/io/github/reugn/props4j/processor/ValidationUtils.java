package io.github.reugn.props4j.processor;

import io.github.reugn.props4j.TypeKind;
import io.github.reugn.props4j.annotation.DefaultValue;
import io.github.reugn.props4j.annotation.Property;

import javax.lang.model.element.Element;
import javax.lang.model.element.ElementKind;
import javax.lang.model.element.ExecutableElement;
import javax.lang.model.element.Modifier;
import javax.lang.model.element.NestingKind;
import javax.lang.model.element.TypeElement;
import javax.lang.model.type.TypeMirror;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static io.github.reugn.props4j.processor.DeclarationModel.GetterInfo;
import static io.github.reugn.props4j.processor.DeclarationModel.PropertyInfo;

/**
 * Compile-time validation of property type declarations.
 *
 * <p>Each check reports every problem it finds through the {@link ErrorReporter} and returns
 * whether the checked element is usable, so a single compilation reports all errors at once.
 *
 * <p><b>Declaration checks:</b>
 * <ul>
 *   <li>The class is abstract, not private, top-level or static nested, and not generic</li>
 *   <li>It has at least one non-private constructor for the generated class to call</li>
 * </ul>
 *
 * <p><b>Property checks:</b>
 * <ul>
 *   <li>The property type is a reference type other than a type variable</li>
 *   <li>The name is not reserved ({@code valueStore}, {@code equals}, {@code hashCode}, {@code toString})</li>
 *   <li>Wire names are non-empty and unique within the class</li>
 *   <li>{@code @DefaultValue} literals parse for the property type ({@link LiteralValidator})</li>
 * </ul>
 *
 * <p><b>Example Error Messages:</b>
 * <pre>
 * error: @InputType can only be applied to abstract classes.
 * error: Property 'port' must have a reference type. Use Integer instead of int.
 * error: Duplicate wire name 'bucketName': already used by 'name'.
 * </pre>
 *
 * @see LiteralValidator
 * @see PropertyScanner
 */
final class ValidationUtils {

    /**
     * Method names the generated class implements itself.
     */
    static final Set<String> RESERVED_NAMES = Set.of("valueStore", "equals", "hashCode", "toString");

    private ValidationUtils() {
    }

    // ==================== DECLARATION VALIDATION ====================

    /**
     * Validates the shape of an annotated declaration class.
     *
     * @param type          the annotated element
     * @param kind          the kind the annotation declares
     * @param errorReporter callback for reporting compilation errors
     * @return {@code true} if a subclass can be generated for it
     */
    static boolean validateDeclaration(TypeElement type, TypeKind kind, ErrorReporter errorReporter) {
        String annotation = kind.annotation();
        if (type.getKind() != ElementKind.CLASS) {
            errorReporter.error(type, annotation + " can only be applied to abstract classes.");
            return false;
        }

        boolean valid = true;
        if (!type.getModifiers().contains(Modifier.ABSTRACT)) {
            errorReporter.error(type, annotation + " can only be applied to abstract classes. "
                    + "Declare " + type.getSimpleName() + " abstract.");
            valid = false;
        }
        if (!type.getTypeParameters().isEmpty()) {
            errorReporter.error(type, annotation + " cannot be applied to generic classes.");
            valid = false;
        }

        NestingKind nesting = type.getNestingKind();
        if (nesting == NestingKind.LOCAL || nesting == NestingKind.ANONYMOUS) {
            errorReporter.error(type, annotation + " cannot be applied to local classes.");
            return false;
        }
        if (nesting == NestingKind.MEMBER && !type.getModifiers().contains(Modifier.STATIC)) {
            errorReporter.error(type, annotation + " cannot be applied to inner classes. "
                    + "Declare " + type.getSimpleName() + " static.");
            valid = false;
        }

        // The generated class lives next to the top-level class and must see the declaration
        for (Element e = type; e instanceof TypeElement; e = e.getEnclosingElement()) {
            if (e.getModifiers().contains(Modifier.PRIVATE)) {
                errorReporter.error(type, annotation + " classes must not be private, nor nested "
                        + "in private classes: " + e.getSimpleName() + " is private.");
                valid = false;
                break;
            }
        }
        return valid;
    }

    /**
     * Validates that the declaration offers a constructor the generated class can call.
     *
     * @param type          the declaration
     * @param constructors  its non-private constructors
     * @param errorReporter callback for reporting compilation errors
     * @return {@code true} if at least one constructor is accessible
     */
    static boolean validateConstructors(TypeElement type, List<ExecutableElement> constructors,
                                        ErrorReporter errorReporter) {
        if (constructors.isEmpty()) {
            errorReporter.error(type, type.getSimpleName()
                    + " has only private constructors. The generated class cannot extend it.");
            return false;
        }
        return true;
    }

    // ==================== PROPERTY VALIDATION ====================

    /**
     * Validates an abstract, zero-argument, non-void method used as a property declaration.
     *
     * <p>Continues after the first failure to report all issues of the method at once.
     *
     * @param method        the property method
     * @param errorReporter callback for reporting compilation errors
     * @return {@code true} if an accessor can be generated for it
     */
    static boolean validatePropertyMethod(ExecutableElement method, ErrorReporter errorReporter) {
        boolean valid = true;
        String name = method.getSimpleName().toString();

        if (RESERVED_NAMES.contains(name)) {
            errorReporter.error(method, "'" + name + "' is reserved and cannot be used as a property name.");
            valid = false;
        }
        if (!method.getTypeParameters().isEmpty()) {
            errorReporter.error(method, "Property '" + name + "' cannot declare type parameters.");
            valid = false;
        }
        if (!validateAccessorType(method, "Property '" + name + "'", errorReporter)) {
            valid = false;
        }
        return valid;
    }

    /**
     * Validates the return type of an accessor the processor implements.
     *
     * @param method        the abstract accessor
     * @param description   the accessor as named in messages, e.g. {@code "Property 'port'"}
     * @param errorReporter callback for reporting compilation errors
     * @return {@code true} if the type can hold an absent ({@code null}) value
     */
    static boolean validateAccessorType(ExecutableElement method, String description, ErrorReporter errorReporter) {
        TypeMirror type = method.getReturnType();
        if (type.getKind().isPrimitive()) {
            errorReporter.error(method, description + " must have a reference type. Use "
                    + boxedName(type) + " instead of " + type + ".");
            return false;
        }
        if (type.getKind() == javax.lang.model.type.TypeKind.TYPEVAR) {
            errorReporter.error(method, description + " cannot have a type variable as its type.");
            return false;
        }
        return true;
    }

    /**
     * Validates a wire name given through {@code @Property} or {@code @Getter}.
     *
     * @param wireName      the name
     * @param element       the element to report errors against
     * @param errorReporter callback for reporting compilation errors
     * @return {@code true} if the name is non-empty
     */
    static boolean validateWireName(String wireName, Element element, ErrorReporter errorReporter) {
        if (wireName.isEmpty()) {
            errorReporter.error(element, "Wire name must not be empty.");
            return false;
        }
        return true;
    }

    /**
     * Validates the {@code @DefaultValue} of a property, if present.
     *
     * @param method        the property method
     * @param errorReporter callback for reporting compilation errors
     * @return {@code true} if absent or parseable for the property type
     */
    static boolean validateDefaultValue(ExecutableElement method, ErrorReporter errorReporter) {
        DefaultValue defaultValue = method.getAnnotation(DefaultValue.class);
        if (defaultValue == null) {
            return true;
        }
        return LiteralValidator.validateParseable(defaultValue.value(), method.getReturnType(),
                method, errorReporter);
    }

    /**
     * Validates that {@code @Property} and {@code @DefaultValue} only annotate property methods.
     *
     * @param method        a method that is not a property declaration
     * @param errorReporter callback for reporting compilation errors
     * @return {@code true} if neither annotation is present
     */
    static boolean validateNoPropertyAnnotations(ExecutableElement method, ErrorReporter errorReporter) {
        boolean valid = true;
        if (method.getAnnotation(Property.class) != null) {
            errorReporter.error(method, "@Property can only be applied to abstract, zero-argument, "
                    + "non-void property methods. Use @Getter(\"wireName\") to name the wire property of a getter.");
            valid = false;
        }
        if (method.getAnnotation(DefaultValue.class) != null) {
            errorReporter.error(method, "@DefaultValue can only be applied to abstract, zero-argument, "
                    + "non-void property methods.");
            valid = false;
        }
        return valid;
    }

    /**
     * Validates that no two properties, and no two getters, share a wire name.
     *
     * @param properties    own and inherited properties
     * @param getters       {@code @Getter} methods
     * @param type          the declaration, to report inherited conflicts against
     * @param errorReporter callback for reporting compilation errors
     * @return {@code true} if every wire name is used once
     */
    static boolean validateUniqueWireNames(List<PropertyInfo> properties, List<GetterInfo> getters,
                                           TypeElement type, ErrorReporter errorReporter) {
        boolean valid = true;
        Map<String, String> seen = new HashMap<>();
        for (PropertyInfo property : properties) {
            String previous = seen.putIfAbsent(property.wireName(), property.fieldName());
            if (previous != null) {
                errorReporter.error(reportTarget(property.method(), type), "Duplicate wire name '"
                        + property.wireName() + "': already used by '" + previous + "'.");
                valid = false;
            }
        }
        for (GetterInfo getter : getters) {
            String name = getter.method().getSimpleName().toString();
            String previous = seen.putIfAbsent(getter.wireName(), name);
            if (previous != null) {
                errorReporter.error(reportTarget(getter.method(), type), "Duplicate wire name '"
                        + getter.wireName() + "': already used by '" + previous + "'.");
                valid = false;
            }
        }
        return valid;
    }

    private static Element reportTarget(ExecutableElement method, TypeElement type) {
        return method.getEnclosingElement().equals(type) ? method : type;
    }

    private static String boxedName(TypeMirror primitive) {
        return switch (primitive.getKind()) {
            case INT -> "Integer";
            case CHAR -> "Character";
            default -> {
                String name = primitive.toString();
                yield Character.toUpperCase(name.charAt(0)) + name.substring(1);
            }
        };
    }
}
