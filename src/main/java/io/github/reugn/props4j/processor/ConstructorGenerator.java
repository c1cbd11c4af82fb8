package io.github.reugn.props4j.processor;

import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.MethodSpec;
import com.squareup.javapoet.ParameterSpec;
import com.squareup.javapoet.ParameterizedTypeName;
import com.squareup.javapoet.TypeName;
import com.squareup.javapoet.WildcardTypeName;
import io.github.reugn.props4j.TypeKind;

import javax.lang.model.element.ExecutableElement;
import javax.lang.model.element.Modifier;
import javax.lang.model.element.VariableElement;
import javax.lang.model.util.Elements;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static io.github.reugn.props4j.processor.CodeGenUtils.PROPERTY_TYPES;
import static io.github.reugn.props4j.processor.CodeGenUtils.copyThrowsDeclarations;

/**
 * Generates the constructors of a generated property class.
 *
 * <p><b>Generation Modes:</b>
 * <table border="1">
 *   <caption>Constructors by declaration</caption>
 *   <tr><th>Declaration</th><th>Output</th></tr>
 *   <tr>
 *     <td>{@code @OutputType}, no explicit constructor, not a {@link Map}</td>
 *     <td>Payload constructor {@code (Map<String, ?>)} and static {@code fromPayload(Object)}</td>
 *   </tr>
 *   <tr>
 *     <td>Anything else</td>
 *     <td>One constructor per non-private declaration constructor, calling {@code super}</td>
 *   </tr>
 * </table>
 *
 * <p><b>Payload Mode Example:</b>
 * <pre>{@code
 * public BucketResultImpl(Map<String, ?> values) {
 *     super();
 *     PropertyTypes.initialize(this, values);
 * }
 *
 * public static BucketResultImpl fromPayload(Object payload) {
 *     return new BucketResultImpl(PropertyTypes.requireMapping(BucketResultImpl.class, payload));
 * }
 * }</pre>
 *
 * <p>Mirrored constructors copy the {@code throws} declarations of the original.
 */
final class ConstructorGenerator {

    static final String PAYLOAD_FACTORY = "fromPayload";

    private static final TypeName PAYLOAD_TYPE = ParameterizedTypeName.get(ClassName.get(Map.class),
            ClassName.get(String.class), WildcardTypeName.subtypeOf(Object.class));

    private ConstructorGenerator() {
    }

    /**
     * Generates constructors, and the payload factory where one applies.
     *
     * @param model         the scanned declaration
     * @param generatedType the generated class
     * @param elementUtils  element utilities, to recognize implicit constructors
     * @return constructors followed by factory methods
     */
    static List<MethodSpec> generate(DeclarationModel model, ClassName generatedType, Elements elementUtils) {
        if (usesPayloadConstructor(model, elementUtils)) {
            return generatePayloadConstructor(generatedType);
        }
        List<MethodSpec> methods = new ArrayList<>();
        for (ExecutableElement constructor : model.constructors()) {
            methods.add(mirrorConstructor(constructor));
        }
        return methods;
    }

    /**
     * An output type built from a payload: only the compiler-provided constructor exists.
     */
    static boolean usesPayloadConstructor(DeclarationModel model, Elements elementUtils) {
        return model.kind() == TypeKind.OUTPUT
                && !model.mapping()
                && model.constructors().size() == 1
                && elementUtils.getOrigin(model.constructors().get(0)) == Elements.Origin.MANDATED;
    }

    private static List<MethodSpec> generatePayloadConstructor(ClassName generatedType) {
        MethodSpec constructor = MethodSpec.constructorBuilder()
                .addJavadoc("Creates an instance holding the entries of {@code values}.\n")
                .addModifiers(Modifier.PUBLIC)
                .addParameter(PAYLOAD_TYPE, "values")
                .addStatement("super()")
                .addStatement("$T.initialize(this, values)", PROPERTY_TYPES)
                .build();

        MethodSpec factory = MethodSpec.methodBuilder(PAYLOAD_FACTORY)
                .addJavadoc("Creates an instance from an untyped payload, which must be a {@link $T}.\n", Map.class)
                .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
                .returns(generatedType)
                .addParameter(Object.class, "payload")
                .addStatement("return new $T($T.requireMapping($T.class, payload))",
                        generatedType, PROPERTY_TYPES, generatedType)
                .build();
        return List.of(constructor, factory);
    }

    private static MethodSpec mirrorConstructor(ExecutableElement constructor) {
        MethodSpec.Builder builder = MethodSpec.constructorBuilder();
        if (constructor.getModifiers().contains(Modifier.PUBLIC)
                || constructor.getModifiers().contains(Modifier.PROTECTED)) {
            builder.addModifiers(Modifier.PUBLIC);
        }

        List<String> names = new ArrayList<>();
        for (VariableElement parameter : constructor.getParameters()) {
            String name = parameter.getSimpleName().toString();
            builder.addParameter(ParameterSpec.builder(TypeName.get(parameter.asType()), name).build());
            names.add(name);
        }
        builder.varargs(constructor.isVarArgs());
        copyThrowsDeclarations(constructor, builder);

        builder.addStatement("super($L)", String.join(", ", names));
        return builder.build();
    }
}
