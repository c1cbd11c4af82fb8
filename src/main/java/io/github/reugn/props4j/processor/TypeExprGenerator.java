package io.github.reugn.props4j.processor;

import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.CodeBlock;
import com.squareup.javapoet.TypeName;

import javax.annotation.processing.ProcessingEnvironment;
import javax.lang.model.element.TypeElement;
import javax.lang.model.type.DeclaredType;
import javax.lang.model.type.TypeMirror;
import javax.lang.model.type.WildcardType;
import javax.lang.model.util.Elements;
import javax.lang.model.util.Types;
import java.util.ArrayList;
import java.util.List;

import static io.github.reugn.props4j.processor.CodeGenUtils.TYPE_EXPR;

/**
 * Emits the {@code TypeExpr} construction expression of a declared type.
 *
 * <p>The emitted expression builds the same value that {@code TypeExpr.of(Type)} derives by
 * reflection from the compiled member:
 * <table border="1">
 *   <caption>Declared type to emitted expression</caption>
 *   <tr><th>Declared type</th><th>Emitted</th></tr>
 *   <tr><td>{@code String}, {@code String[]}</td><td>{@code TypeExpr.plain(String.class)}</td></tr>
 *   <tr><td>{@code Optional<String>}</td><td>{@code TypeExpr.optional(TypeExpr.plain(String.class))}</td></tr>
 *   <tr><td>{@code CompletableFuture<String>}</td><td>{@code TypeExpr.deferred(TypeExpr.plain(String.class))}</td></tr>
 *   <tr><td>{@code List<String>}</td><td>{@code TypeExpr.parameterized(List.class, TypeExpr.plain(String.class))}</td></tr>
 *   <tr><td>{@code ? extends Number}</td><td>the upper bound</td></tr>
 *   <tr><td>{@code T extends Number}</td><td>{@code TypeExpr.plain(Number.class)}</td></tr>
 * </table>
 */
final class TypeExprGenerator {

    private final Types typeUtils;
    private final TypeMirror completionStage;
    private final TypeMirror future;

    TypeExprGenerator(ProcessingEnvironment processingEnv) {
        this.typeUtils = processingEnv.getTypeUtils();
        Elements elementUtils = processingEnv.getElementUtils();
        this.completionStage = erasure(elementUtils, "java.util.concurrent.CompletionStage");
        this.future = erasure(elementUtils, "java.util.concurrent.Future");
    }

    /**
     * Builds the expression for {@code type}.
     *
     * @param type a declared property or getter type
     * @return an expression of type {@code TypeExpr}
     */
    CodeBlock generate(TypeMirror type) {
        switch (type.getKind()) {
            case DECLARED -> {
                DeclaredType declared = (DeclaredType) type;
                TypeElement element = (TypeElement) declared.asElement();
                ClassName raw = ClassName.get(element);
                List<? extends TypeMirror> arguments = declared.getTypeArguments();
                if (arguments.isEmpty()) {
                    return CodeBlock.of("$T.plain($T.class)", TYPE_EXPR, raw);
                }
                if (arguments.size() == 1 && element.getQualifiedName().contentEquals("java.util.Optional")) {
                    return CodeBlock.of("$T.optional($L)", TYPE_EXPR, generate(arguments.get(0)));
                }
                if (arguments.size() == 1 && isDeferredWrapper(declared)) {
                    return CodeBlock.of("$T.deferred($L)", TYPE_EXPR, generate(arguments.get(0)));
                }
                List<CodeBlock> blocks = new ArrayList<>();
                blocks.add(CodeBlock.of("$T.class", raw));
                for (TypeMirror argument : arguments) {
                    blocks.add(generate(argument));
                }
                return CodeBlock.of("$T.parameterized($L)", TYPE_EXPR, CodeBlock.join(blocks, ", "));
            }
            case WILDCARD -> {
                TypeMirror bound = ((WildcardType) type).getExtendsBound();
                return bound != null ? generate(bound) : CodeBlock.of("$T.plain($T.class)", TYPE_EXPR, Object.class);
            }
            default -> {
                // Primitives, arrays and type variables, erased like Class literals
                return CodeBlock.of("$T.plain($T.class)", TYPE_EXPR, TypeName.get(typeUtils.erasure(type)));
            }
        }
    }

    private boolean isDeferredWrapper(DeclaredType type) {
        TypeMirror raw = typeUtils.erasure(type);
        return typeUtils.isAssignable(raw, completionStage) || typeUtils.isAssignable(raw, future);
    }

    private TypeMirror erasure(Elements elementUtils, String name) {
        return typeUtils.erasure(elementUtils.getTypeElement(name).asType());
    }
}
