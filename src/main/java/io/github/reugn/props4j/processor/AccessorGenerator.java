package io.github.reugn.props4j.processor;

import com.squareup.javapoet.AnnotationSpec;
import com.squareup.javapoet.FieldSpec;
import com.squareup.javapoet.MethodSpec;
import com.squareup.javapoet.ParameterSpec;
import com.squareup.javapoet.TypeName;

import javax.lang.model.element.ExecutableElement;
import javax.lang.model.element.Modifier;
import javax.lang.model.type.DeclaredType;
import javax.lang.model.type.TypeMirror;
import java.util.ArrayList;
import java.util.List;

import static io.github.reugn.props4j.processor.CodeGenUtils.PROPERTY_TYPES;
import static io.github.reugn.props4j.processor.CodeGenUtils.VALUE_STORE;
import static io.github.reugn.props4j.processor.CodeGenUtils.VALUE_STORE_NAME;
import static io.github.reugn.props4j.processor.DeclarationModel.GetterInfo;
import static io.github.reugn.props4j.processor.DeclarationModel.PropertyInfo;
import static io.github.reugn.props4j.processor.DeclarationModel.SetterInfo;

/**
 * Generates the accessors of a generated property class.
 *
 * <p>Every accessor goes through the access protocol of {@code PropertyTypes}, so a generated
 * class keeps no per-property storage:
 * <pre>{@code
 * private ValueStore valueStore;
 *
 * @Override
 * public synchronized ValueStore valueStore() {
 *     if (valueStore == null) {
 *         valueStore = new ValueStore();
 *     }
 *     return valueStore;
 * }
 *
 * @Override
 * public String name() {
 *     return (String) PropertyTypes.get(this, "bucketName");
 * }
 *
 * @Override
 * public void name(String value) {
 *     PropertyTypes.set(this, "bucketName", value);
 * }
 * }</pre>
 *
 * <p>The store field has no initializer: a declaration constructor may write properties before
 * the generated class's field initializers would run.
 */
final class AccessorGenerator {

    private AccessorGenerator() {
    }

    // ==================== VALUE STORE ====================

    static FieldSpec valueStoreField() {
        return FieldSpec.builder(VALUE_STORE, VALUE_STORE_NAME, Modifier.PRIVATE).build();
    }

    static MethodSpec valueStoreAccessor() {
        return MethodSpec.methodBuilder(VALUE_STORE_NAME)
                .addAnnotation(Override.class)
                .addModifiers(Modifier.PUBLIC, Modifier.SYNCHRONIZED)
                .returns(VALUE_STORE)
                .beginControlFlow("if ($N == null)", VALUE_STORE_NAME)
                .addStatement("$N = new $T()", VALUE_STORE_NAME, VALUE_STORE)
                .endControlFlow()
                .addStatement("return $N", VALUE_STORE_NAME)
                .build();
    }

    // ==================== GETTERS ====================

    /**
     * Generates the getters of every property and the bodies of abstract {@code @Getter} methods.
     *
     * @param model the scanned declaration
     * @return the getter implementations
     */
    static List<MethodSpec> generateGetters(DeclarationModel model) {
        List<MethodSpec> methods = new ArrayList<>();
        for (PropertyInfo property : model.allProperties()) {
            methods.add(generateGetter(property.method(), property.wireName()));
        }
        for (GetterInfo getter : model.getters()) {
            if (getter.needsBody()) {
                methods.add(generateGetter(getter.method(), getter.wireName()));
            }
        }
        return methods;
    }

    private static MethodSpec generateGetter(ExecutableElement method, String wireName) {
        MethodSpec.Builder builder = MethodSpec.overriding(method);
        TypeMirror type = method.getReturnType();
        if (isOptional(type)) {
            builder.addStatement("return $T.getOptional(this, $S)", PROPERTY_TYPES, wireName);
        } else {
            if (isParameterized(type)) {
                builder.addAnnotation(AnnotationSpec.builder(SuppressWarnings.class)
                        .addMember("value", "$S", "unchecked")
                        .build());
            }
            builder.addStatement("return ($T) $T.get(this, $S)", TypeName.get(type), PROPERTY_TYPES, wireName);
        }
        return builder.build();
    }

    // ==================== SETTERS ====================

    /**
     * Generates the setters of an input type: implementations of placeholder setters, and a
     * public setter for every property declared without one.
     *
     * @param model the scanned declaration
     * @return the setter implementations
     */
    static List<MethodSpec> generateSetters(DeclarationModel model) {
        List<MethodSpec> methods = new ArrayList<>();
        for (SetterInfo setter : model.setters()) {
            PropertyInfo property = setter.property();
            MethodSpec.Builder builder;
            String parameter;
            if (setter.placeholder() != null) {
                builder = MethodSpec.overriding(setter.placeholder());
                parameter = setter.placeholder().getParameters().get(0).getSimpleName().toString();
            } else {
                parameter = "value";
                builder = MethodSpec.methodBuilder(property.fieldName())
                        .addModifiers(Modifier.PUBLIC)
                        .addParameter(ParameterSpec.builder(TypeName.get(property.type()), parameter).build());
            }
            if (isOptional(property.type())) {
                builder.addStatement("$T.setOptional(this, $S, $N)", PROPERTY_TYPES, property.wireName(), parameter);
            } else {
                builder.addStatement("$T.set(this, $S, $N)", PROPERTY_TYPES, property.wireName(), parameter);
            }
            methods.add(builder.build());
        }
        return methods;
    }

    // ==================== TYPE CHECKS ====================

    private static boolean isOptional(TypeMirror type) {
        return type instanceof DeclaredType
                && ((DeclaredType) type).asElement().toString().equals("java.util.Optional");
    }

    private static boolean isParameterized(TypeMirror type) {
        return type instanceof DeclaredType && !((DeclaredType) type).getTypeArguments().isEmpty();
    }
}
