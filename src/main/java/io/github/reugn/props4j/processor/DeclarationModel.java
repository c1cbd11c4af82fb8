package io.github.reugn.props4j.processor;

import io.github.reugn.props4j.TypeKind;

import javax.lang.model.element.ExecutableElement;
import javax.lang.model.element.TypeElement;
import javax.lang.model.type.TypeMirror;
import java.util.ArrayList;
import java.util.List;

/**
 * Everything the generators need to know about one {@code @InputType} or {@code @OutputType}
 * declaration, as produced by {@link PropertyScanner}.
 *
 * <p>Properties and getters are split by origin: {@code own} entries come from the class
 * itself and make up its registered properties, {@code inherited} entries come from decorated
 * superclasses of the same kind and only need implementing.
 *
 * @param element      the declaration class
 * @param kind         the kind tag
 * @param properties   own properties first declared by this class, in declaration order
 * @param inherited    abstract properties inherited from decorated superclasses
 * @param getters      {@code @Getter} methods of the class and of its decorated superclasses
 * @param setters      input type setters to implement or synthesize
 * @param constructors non-private constructors of the declaration
 * @param mapping      {@code true} if the declaration is a {@link java.util.Map}
 * @param userEquals   {@code true} if {@code equals(Object)} is declared below {@link Object}
 */
record DeclarationModel(TypeElement element,
                        TypeKind kind,
                        List<PropertyInfo> properties,
                        List<PropertyInfo> inherited,
                        List<GetterInfo> getters,
                        List<SetterInfo> setters,
                        List<ExecutableElement> constructors,
                        boolean mapping,
                        boolean userEquals) {

    /**
     * @return own and inherited properties, inherited first
     */
    List<PropertyInfo> allProperties() {
        List<PropertyInfo> all = new ArrayList<>(inherited);
        all.addAll(properties);
        return all;
    }

    /**
     * A generated class holds a value store unless it is a mapping output type.
     */
    boolean holdsValueStore() {
        return !(mapping && kind == TypeKind.OUTPUT);
    }

    /**
     * A property declaration: an abstract, zero-argument, non-void method.
     *
     * @param method         the abstract getter
     * @param wireName       the wire name, {@code @Property} value or the method name
     * @param defaultLiteral the {@code @DefaultValue} literal, or {@code null} if none
     */
    record PropertyInfo(ExecutableElement method, String wireName, String defaultLiteral) {

        /**
         * @return the in-memory name
         */
        String fieldName() {
            return method.getSimpleName().toString();
        }

        TypeMirror type() {
            return method.getReturnType();
        }

        boolean hasDefault() {
            return defaultLiteral != null;
        }
    }

    /**
     * A {@code @Getter} method.
     *
     * @param method    the annotated method
     * @param wireName  the explicit wire name, or the method name
     * @param needsBody {@code true} if the method is still abstract in the declaration
     */
    record GetterInfo(ExecutableElement method, String wireName, boolean needsBody) {
    }

    /**
     * A setter of an input type property.
     *
     * @param property    the property written
     * @param placeholder the abstract setter to implement, or {@code null} to synthesize one
     */
    record SetterInfo(PropertyInfo property, ExecutableElement placeholder) {
    }
}
