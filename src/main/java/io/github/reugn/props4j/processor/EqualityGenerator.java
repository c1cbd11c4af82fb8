package io.github.reugn.props4j.processor;

import com.squareup.javapoet.MethodSpec;

import javax.lang.model.element.Modifier;
import java.util.List;

import static io.github.reugn.props4j.processor.CodeGenUtils.PROPERTY_TYPES;

/**
 * Generates structural {@code equals} and {@code hashCode} over the value store.
 *
 * <p>Two instances are equal when they have the same runtime class and equal value stores.
 * Nothing is generated when the declaration already defines {@code equals(Object)} below
 * {@link Object}, or is a {@link java.util.Map} keeping its own equality.
 */
final class EqualityGenerator {

    private EqualityGenerator() {
    }

    /**
     * @param model the scanned declaration
     * @return {@code equals} and {@code hashCode}, or nothing when the class keeps its own
     */
    static List<MethodSpec> generate(DeclarationModel model) {
        if (model.userEquals() || model.mapping()) {
            return List.of();
        }
        MethodSpec equals = MethodSpec.methodBuilder("equals")
                .addAnnotation(Override.class)
                .addModifiers(Modifier.PUBLIC)
                .returns(boolean.class)
                .addParameter(Object.class, "other")
                .addStatement("return $T.valuesEqual(this, other)", PROPERTY_TYPES)
                .build();
        MethodSpec hashCode = MethodSpec.methodBuilder("hashCode")
                .addAnnotation(Override.class)
                .addModifiers(Modifier.PUBLIC)
                .returns(int.class)
                .addStatement("return $T.valuesHashCode(this)", PROPERTY_TYPES)
                .build();
        return List.of(equals, hashCode);
    }
}
