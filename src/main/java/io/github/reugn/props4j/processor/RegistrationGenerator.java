package io.github.reugn.props4j.processor;

import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.CodeBlock;
import io.github.reugn.props4j.TypeKind;

import static io.github.reugn.props4j.processor.CodeGenUtils.PROPERTY_DESCRIPTOR;
import static io.github.reugn.props4j.processor.CodeGenUtils.PROPERTY_TYPES;
import static io.github.reugn.props4j.processor.CodeGenUtils.TYPE_DECLARATION;
import static io.github.reugn.props4j.processor.CodeGenUtils.convertDefaultValue;
import static io.github.reugn.props4j.processor.DeclarationModel.GetterInfo;
import static io.github.reugn.props4j.processor.DeclarationModel.PropertyInfo;

/**
 * Generates the static initializer registering a generated class with the runtime.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * static {
 *     PropertyTypes.markAsInputType(BucketArgsImpl.class, TypeDeclaration.builder(BucketArgs.class)
 *             .property("name", PropertyDescriptor.of("bucketName").withType(TypeExpr.plain(String.class)))
 *             .property("replicas", PropertyDescriptor.of("replicas", Integer.valueOf("3")).withType(TypeExpr.plain(Integer.class)))
 *             .getter("bucketName", TypeExpr.plain(String.class))
 *             .getter("replicas", TypeExpr.plain(Integer.class))
 *             .build());
 * }
 * }</pre>
 *
 * <p>Only the declaration's own properties are registered as properties. Inherited properties
 * and {@code @Getter} methods appear in the getters table.
 */
final class RegistrationGenerator {

    private final TypeExprGenerator typeExprGenerator;

    RegistrationGenerator(TypeExprGenerator typeExprGenerator) {
        this.typeExprGenerator = typeExprGenerator;
    }

    /**
     * @param model         the scanned declaration
     * @param generatedType the generated class
     * @return the body of the static initializer
     */
    CodeBlock generate(DeclarationModel model, ClassName generatedType) {
        String method = model.kind() == TypeKind.INPUT ? "markAsInputType" : "markAsOutputType";

        CodeBlock.Builder declaration = CodeBlock.builder()
                .add("$T.builder($T.class)", TYPE_DECLARATION, ClassName.get(model.element()));
        for (PropertyInfo property : model.properties()) {
            declaration.add("\n.property($S, $L)", property.fieldName(), descriptor(property));
        }
        for (PropertyInfo property : model.allProperties()) {
            declaration.add("\n.getter($S, $L)", property.wireName(), typeExprGenerator.generate(property.type()));
        }
        for (GetterInfo getter : model.getters()) {
            declaration.add("\n.getter($S, $L)", getter.wireName(),
                    typeExprGenerator.generate(getter.method().getReturnType()));
        }
        declaration.add("\n.build()");

        return CodeBlock.builder()
                .addStatement("$T.$N($T.class, $L)", PROPERTY_TYPES, method, generatedType, declaration.build())
                .build();
    }

    private CodeBlock descriptor(PropertyInfo property) {
        CodeBlock type = typeExprGenerator.generate(property.type());
        if (property.hasDefault()) {
            return CodeBlock.of("$T.of($S, $L).withType($L)", PROPERTY_DESCRIPTOR, property.wireName(),
                    convertDefaultValue(property.defaultLiteral(), property.type()), type);
        }
        return CodeBlock.of("$T.of($S).withType($L)", PROPERTY_DESCRIPTOR, property.wireName(), type);
    }
}
