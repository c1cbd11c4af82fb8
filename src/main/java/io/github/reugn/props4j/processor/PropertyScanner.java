package io.github.reugn.props4j.processor;

import io.github.reugn.props4j.TypeKind;
import io.github.reugn.props4j.annotation.DefaultValue;
import io.github.reugn.props4j.annotation.Getter;
import io.github.reugn.props4j.annotation.InputType;
import io.github.reugn.props4j.annotation.OutputType;
import io.github.reugn.props4j.annotation.Property;

import javax.annotation.processing.ProcessingEnvironment;
import javax.lang.model.element.Element;
import javax.lang.model.element.ExecutableElement;
import javax.lang.model.element.Modifier;
import javax.lang.model.element.TypeElement;
import javax.lang.model.type.DeclaredType;
import javax.lang.model.type.TypeMirror;
import javax.lang.model.util.ElementFilter;
import javax.lang.model.util.Elements;
import javax.lang.model.util.Types;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static io.github.reugn.props4j.processor.DeclarationModel.GetterInfo;
import static io.github.reugn.props4j.processor.DeclarationModel.PropertyInfo;
import static io.github.reugn.props4j.processor.DeclarationModel.SetterInfo;

/**
 * Discovers the properties, getters, setters and constructors of a declaration class.
 *
 * <p><b>Member classification:</b>
 * <table border="1">
 *   <caption>How declared methods are read</caption>
 *   <tr><th>Method</th><th>Meaning</th></tr>
 *   <tr><td>abstract, no parameters, non-void</td><td>property; the method name is the in-memory name</td></tr>
 *   <tr><td>{@code @Getter}, no parameters, non-void</td><td>getter; implemented when abstract</td></tr>
 *   <tr><td>abstract {@code void name(T)} matching a property</td><td>placeholder setter (input types only)</td></tr>
 *   <tr><td>concrete {@code void name(T)} matching a property</td><td>user setter, kept as written</td></tr>
 *   <tr><td>any other abstract method</td><td>error</td></tr>
 * </table>
 *
 * <p>Only the class's own methods become its registered properties. Abstract methods inherited
 * from a superclass carrying the same kind annotation are implemented by the generated class
 * with that superclass's wire names; any other inherited abstract method is an error.
 *
 * @see DeclarationModel
 * @see ValidationUtils
 */
final class PropertyScanner {

    private final Elements elementUtils;
    private final Types typeUtils;

    PropertyScanner(ProcessingEnvironment processingEnv) {
        this.elementUtils = processingEnv.getElementUtils();
        this.typeUtils = processingEnv.getTypeUtils();
    }

    /**
     * Scans and validates a declaration.
     *
     * @param type          the annotated class
     * @param kind          the kind its annotation declares
     * @param errorReporter callback for reporting compilation errors
     * @return the model, or {@code null} if any error was reported
     */
    DeclarationModel scan(TypeElement type, TypeKind kind, ErrorReporter errorReporter) {
        if (!ValidationUtils.validateDeclaration(type, kind, errorReporter)) {
            return null;
        }

        OwnMembers own = scanOwn(type, errorReporter);
        boolean valid = own.valid();

        List<ExecutableElement> members = ElementFilter.methodsIn(elementUtils.getAllMembers(type));

        // Decorated superclasses, farthest first
        Map<ExecutableElement, PropertyInfo> superProperties = new HashMap<>();
        Map<ExecutableElement, GetterInfo> superGetters = new HashMap<>();
        List<OwnMembers> ancestors = new ArrayList<>();
        for (TypeElement s = superclassOf(type); s != null; s = superclassOf(s)) {
            TypeKind superKind = kindOf(s);
            if (superKind == null) {
                continue;
            }
            if (superKind != kind) {
                errorReporter.error(type, type.getSimpleName() + " is declared " + kind.annotation()
                        + " but extends " + s.getSimpleName() + ", declared " + superKind.annotation()
                        + ". Cannot apply @InputType and @OutputType more than once.");
                valid = false;
                continue;
            }
            OwnMembers scanned = scanOwn(s, ErrorReporter.silent());
            ancestors.add(0, scanned);
            scanned.properties().forEach(p -> superProperties.put(p.method(), p));
            scanned.getters().forEach(g -> superGetters.put(g.method(), g));
        }

        List<PropertyInfo> inherited = new ArrayList<>();
        List<GetterInfo> getters = new ArrayList<>();
        for (OwnMembers ancestor : ancestors) {
            for (PropertyInfo property : ancestor.properties()) {
                if (members.contains(property.method()) && !isOverridden(property.method(), members, type)) {
                    inherited.add(property);
                }
            }
            for (GetterInfo getter : ancestor.getters()) {
                if (members.contains(getter.method()) && !isOverridden(getter.method(), members, type)) {
                    getters.add(getter);
                }
            }
        }
        getters.addAll(own.getters());

        List<PropertyInfo> all = new ArrayList<>(inherited);
        all.addAll(own.properties());

        // Abstract methods left for the generated class
        List<ExecutableElement> pendingSetters = new ArrayList<>(own.otherAbstract());
        for (ExecutableElement member : members) {
            if (member.getEnclosingElement().equals(type)
                    || !member.getModifiers().contains(Modifier.ABSTRACT)
                    || isOverridden(member, members, type)
                    || superProperties.containsKey(member)
                    || superGetters.containsKey(member)
                    || isValueStoreAccessor(member)) {
                continue;
            }
            pendingSetters.add(member);
        }
        if (!validateSetterCandidates(type, kind, pendingSetters, all, errorReporter)) {
            valid = false;
        }
        if (!ValidationUtils.validateUniqueWireNames(all, getters, type, errorReporter)) {
            valid = false;
        }

        List<ExecutableElement> constructors = new ArrayList<>();
        for (ExecutableElement constructor : ElementFilter.constructorsIn(type.getEnclosedElements())) {
            if (!constructor.getModifiers().contains(Modifier.PRIVATE)) {
                constructors.add(constructor);
            }
        }
        if (!ValidationUtils.validateConstructors(type, constructors, errorReporter)) {
            valid = false;
        }

        if (!valid) {
            return null;
        }

        List<SetterInfo> setters = kind == TypeKind.INPUT ? collectSetters(all, members, type) : List.of();
        return new DeclarationModel(type, kind, own.properties(), inherited, getters, setters,
                constructors, isMapping(type), declaresEquals(members));
    }

    // ==================== OWN MEMBERS ====================

    /**
     * Classifies the methods declared directly by {@code type}.
     */
    private OwnMembers scanOwn(TypeElement type, ErrorReporter errorReporter) {
        boolean valid = true;
        List<PropertyInfo> properties = new ArrayList<>();
        List<GetterInfo> getters = new ArrayList<>();
        List<ExecutableElement> otherAbstract = new ArrayList<>();

        for (ExecutableElement method : ElementFilter.methodsIn(type.getEnclosedElements())) {
            boolean isAbstract = method.getModifiers().contains(Modifier.ABSTRACT);
            boolean accessorShape = method.getParameters().isEmpty()
                    && method.getReturnType().getKind() != javax.lang.model.type.TypeKind.VOID;
            Getter getter = method.getAnnotation(Getter.class);

            if (getter != null) {
                valid &= ValidationUtils.validateNoPropertyAnnotations(method, errorReporter);
                if (!accessorShape || method.getModifiers().contains(Modifier.STATIC)) {
                    errorReporter.error(method, "@Getter can only be applied to instance methods "
                            + "taking no arguments and returning a value.");
                    valid = false;
                    continue;
                }
                String wireName = getter.value().isEmpty() ? method.getSimpleName().toString() : getter.value();
                if (isAbstract) {
                    valid &= ValidationUtils.validateAccessorType(method,
                            "Getter '" + method.getSimpleName() + "'", errorReporter);
                }
                getters.add(new GetterInfo(method, wireName, isAbstract));
            } else if (isAbstract && accessorShape) {
                PropertyInfo property = scanProperty(method, errorReporter);
                if (property == null) {
                    valid = false;
                } else {
                    properties.add(property);
                }
            } else if (isAbstract) {
                valid &= ValidationUtils.validateNoPropertyAnnotations(method, errorReporter);
                otherAbstract.add(method);
            } else {
                valid &= ValidationUtils.validateNoPropertyAnnotations(method, errorReporter);
            }
        }
        return new OwnMembers(properties, getters, otherAbstract, valid);
    }

    private PropertyInfo scanProperty(ExecutableElement method, ErrorReporter errorReporter) {
        boolean valid = ValidationUtils.validatePropertyMethod(method, errorReporter);

        Property property = method.getAnnotation(Property.class);
        String wireName = property != null ? property.value() : method.getSimpleName().toString();
        valid &= ValidationUtils.validateWireName(wireName, method, errorReporter);

        if (valid) {
            valid = ValidationUtils.validateDefaultValue(method, errorReporter);
        }
        if (!valid) {
            return null;
        }

        DefaultValue defaultValue = method.getAnnotation(DefaultValue.class);
        return new PropertyInfo(method, wireName, defaultValue != null ? defaultValue.value() : null);
    }

    // ==================== SETTERS ====================

    /**
     * Checks that every remaining abstract method is a placeholder setter of an input type.
     */
    private boolean validateSetterCandidates(TypeElement type, TypeKind kind, List<ExecutableElement> candidates,
                                             List<PropertyInfo> properties, ErrorReporter errorReporter) {
        boolean valid = true;
        for (ExecutableElement candidate : candidates) {
            String name = candidate.getSimpleName().toString();
            PropertyInfo property = properties.stream()
                    .filter(p -> p.fieldName().equals(name))
                    .findFirst()
                    .orElse(null);
            Element target = candidate.getEnclosingElement().equals(type) ? candidate : type;
            String where = target == type ? "Inherited abstract method '"
                    + candidate.getEnclosingElement().getSimpleName() + "." + name + "'" : "Abstract method '" + name + "'";

            boolean setterShape = candidate.getParameters().size() == 1
                    && candidate.getReturnType().getKind() == javax.lang.model.type.TypeKind.VOID;
            if (property == null || !setterShape) {
                errorReporter.error(target, where + " is not a property declaration. Properties take "
                        + "no arguments and return a value; implement other methods in " + type.getSimpleName() + ".");
                valid = false;
            } else if (kind == TypeKind.OUTPUT) {
                errorReporter.error(target, "@OutputType properties are read-only. Remove the setter '"
                        + name + "' or declare " + type.getSimpleName() + " @InputType.");
                valid = false;
            } else if (!typeUtils.isSameType(candidate.getParameters().get(0).asType(), property.type())) {
                errorReporter.error(target, "Setter '" + name + "' must take a single '"
                        + property.type() + "' argument to match its property.");
                valid = false;
            }
        }
        return valid;
    }

    /**
     * Pairs every input property with its placeholder setter, or none when one must be
     * synthesized. Properties with a concrete setter anywhere in the hierarchy are skipped.
     */
    private List<SetterInfo> collectSetters(List<PropertyInfo> properties, List<ExecutableElement> members,
                                            TypeElement type) {
        List<SetterInfo> setters = new ArrayList<>();
        for (PropertyInfo property : properties) {
            ExecutableElement placeholder = null;
            boolean userSetter = false;
            for (ExecutableElement member : members) {
                if (!isSetterOf(member, property) || isOverridden(member, members, type)) {
                    continue;
                }
                if (member.getModifiers().contains(Modifier.ABSTRACT)) {
                    placeholder = member;
                } else {
                    userSetter = true;
                }
            }
            if (!userSetter) {
                setters.add(new SetterInfo(property, placeholder));
            }
        }
        return setters;
    }

    private boolean isSetterOf(ExecutableElement method, PropertyInfo property) {
        return method.getSimpleName().contentEquals(property.fieldName())
                && method.getParameters().size() == 1
                && method.getReturnType().getKind() == javax.lang.model.type.TypeKind.VOID
                && typeUtils.isSameType(method.getParameters().get(0).asType(), property.type());
    }

    // ==================== HIERARCHY ====================

    private boolean isOverridden(ExecutableElement method, List<ExecutableElement> members, TypeElement type) {
        for (ExecutableElement member : members) {
            if (!member.equals(method) && elementUtils.overrides(member, method, type)) {
                return true;
            }
        }
        return false;
    }

    private boolean declaresEquals(List<ExecutableElement> members) {
        for (ExecutableElement member : members) {
            if (member.getSimpleName().contentEquals("equals")
                    && member.getParameters().size() == 1
                    && member.getParameters().get(0).asType().toString().equals("java.lang.Object")
                    && !((TypeElement) member.getEnclosingElement()).getQualifiedName().contentEquals("java.lang.Object")) {
                return true;
            }
        }
        return false;
    }

    private boolean isMapping(TypeElement type) {
        TypeElement map = elementUtils.getTypeElement("java.util.Map");
        return typeUtils.isAssignable(typeUtils.erasure(type.asType()), typeUtils.erasure(map.asType()));
    }

    private static boolean isValueStoreAccessor(ExecutableElement method) {
        return method.getSimpleName().contentEquals("valueStore") && method.getParameters().isEmpty();
    }

    private static TypeElement superclassOf(TypeElement type) {
        TypeMirror superclass = type.getSuperclass();
        if (!(superclass instanceof DeclaredType)) {
            return null;
        }
        TypeElement element = (TypeElement) ((DeclaredType) superclass).asElement();
        return element.getQualifiedName().contentEquals("java.lang.Object") ? null : element;
    }

    /**
     * Returns the kind declared on {@code type}, or {@code null} if it carries neither annotation.
     */
    static TypeKind kindOf(TypeElement type) {
        if (type.getAnnotation(InputType.class) != null) {
            return TypeKind.INPUT;
        }
        if (type.getAnnotation(OutputType.class) != null) {
            return TypeKind.OUTPUT;
        }
        return null;
    }

    private record OwnMembers(List<PropertyInfo> properties, List<GetterInfo> getters,
                              List<ExecutableElement> otherAbstract, boolean valid) {
    }
}
