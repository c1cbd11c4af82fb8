package io.github.reugn.props4j.processor;

import com.google.auto.service.AutoService;
import com.squareup.javapoet.AnnotationSpec;
import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.JavaFile;
import com.squareup.javapoet.TypeName;
import com.squareup.javapoet.TypeSpec;
import io.github.reugn.props4j.TypeKind;
import io.github.reugn.props4j.annotation.InputType;
import io.github.reugn.props4j.annotation.OutputType;

import javax.annotation.processing.AbstractProcessor;
import javax.annotation.processing.Messager;
import javax.annotation.processing.ProcessingEnvironment;
import javax.annotation.processing.Processor;
import javax.annotation.processing.RoundEnvironment;
import javax.annotation.processing.SupportedAnnotationTypes;
import javax.annotation.processing.SupportedOptions;
import javax.annotation.processing.SupportedSourceVersion;
import javax.lang.model.SourceVersion;
import javax.lang.model.element.Element;
import javax.lang.model.element.Modifier;
import javax.lang.model.element.TypeElement;
import javax.tools.Diagnostic;
import java.io.IOException;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Annotation processor for props4j: generates the implementation class of every
 * {@link InputType} and {@link OutputType} declaration.
 *
 * <p>Registered via {@link com.google.auto.service.AutoService} for automatic discovery by the
 * Java compiler.
 *
 * <p><b>Generated Output:</b>
 * <pre>
 * {@code // Source
 * @InputType
 * public abstract class BucketArgs {
 *     @Property("bucketName")
 *     public abstract String name();
 * }
 *
 * // Generated: BucketArgsImpl.java
 * public final class BucketArgsImpl extends BucketArgs implements PropertyHolder {
 *     static { PropertyTypes.markAsInputType(BucketArgsImpl.class, ...); }
 *     private ValueStore valueStore;
 *
 *     public BucketArgsImpl() { super(); }
 *     public synchronized ValueStore valueStore() { ... }
 *     public String name() { return (String) PropertyTypes.get(this, "bucketName"); }
 *     public void name(String value) { PropertyTypes.set(this, "bucketName", value); }
 *     public boolean equals(Object other) { return PropertyTypes.valuesEqual(this, other); }
 *     public int hashCode() { return PropertyTypes.valuesHashCode(this); }
 * }}
 * </pre>
 *
 * <p><b>Processing Pipeline:</b>
 * <ol>
 *   <li><b>Collection</b>: gather the classes carrying either annotation; a class carrying
 *       both is rejected</li>
 *   <li><b>Scanning</b>: classify members and validate via {@link PropertyScanner}</li>
 *   <li><b>Generation</b>: write {@code {ClassName}Impl}</li>
 * </ol>
 *
 * <p><b>Options</b> (passed with {@code -A}):
 * <table border="1">
 *   <caption>Processor options</caption>
 *   <tr><th>Option</th><th>Default</th><th>Effect</th></tr>
 *   <tr><td>{@code props4j.verbose}</td><td>{@code false}</td>
 *       <td>Prints a note for every generated class</td></tr>
 *   <tr><td>{@code props4j.generatedAnnotation}</td><td>{@code true}</td>
 *       <td>Marks generated classes with {@code @javax.annotation.processing.Generated}</td></tr>
 * </table>
 *
 * <p><b>Delegation:</b>
 * <ul>
 *   <li>{@link RegistrationGenerator}: static registration of the class metadata</li>
 *   <li>{@link ConstructorGenerator}: mirrored or payload constructors</li>
 *   <li>{@link AccessorGenerator}: value store, getters and setters</li>
 *   <li>{@link EqualityGenerator}: structural equality</li>
 * </ul>
 *
 * @see PropertyScanner
 * @see ValidationUtils
 */
@AutoService(Processor.class)
@SupportedAnnotationTypes({
        "io.github.reugn.props4j.annotation.InputType",
        "io.github.reugn.props4j.annotation.OutputType"
})
@SupportedOptions({
        PropertyTypeProcessor.OPTION_VERBOSE,
        PropertyTypeProcessor.OPTION_GENERATED_ANNOTATION
})
@SupportedSourceVersion(SourceVersion.RELEASE_17)
public class PropertyTypeProcessor extends AbstractProcessor {

    static final String OPTION_VERBOSE = "props4j.verbose";
    static final String OPTION_GENERATED_ANNOTATION = "props4j.generatedAnnotation";

    private ErrorReporter errorReporter;
    private Messager messager;
    private PropertyScanner scanner;
    private RegistrationGenerator registrationGenerator;
    private boolean verbose;
    private boolean generatedAnnotation;

    /**
     * Creates a new PropertyTypeProcessor instance.
     *
     * <p>This no-arg constructor is required for annotation processor discovery via
     * {@link java.util.ServiceLoader}. The processor is not usable until
     * {@link #init(ProcessingEnvironment)} is called by the compiler.
     */
    public PropertyTypeProcessor() {
        // Required for ServiceLoader-based processor discovery
    }

    @Override
    public synchronized void init(ProcessingEnvironment processingEnv) {
        super.init(processingEnv);
        this.messager = processingEnv.getMessager();
        this.errorReporter = (element, message) -> messager.printMessage(Diagnostic.Kind.ERROR, message, element);
        this.scanner = new PropertyScanner(processingEnv);
        this.registrationGenerator = new RegistrationGenerator(new TypeExprGenerator(processingEnv));
        this.verbose = Boolean.parseBoolean(processingEnv.getOptions().get(OPTION_VERBOSE));
        this.generatedAnnotation = !"false".equalsIgnoreCase(processingEnv.getOptions().get(OPTION_GENERATED_ANNOTATION));
    }

    /**
     * Processes {@code @InputType} and {@code @OutputType} declarations.
     *
     * <p>Errors are reported via the {@link Messager} and processing continues with the next
     * declaration, so a single compilation reports as many errors as possible.
     *
     * @param annotations the annotation types being processed in this round
     * @param roundEnv    the environment for this processing round
     * @return {@code true} to claim the annotations
     */
    @Override
    public boolean process(Set<? extends TypeElement> annotations, RoundEnvironment roundEnv) {
        Set<Element> declarations = new LinkedHashSet<>(roundEnv.getElementsAnnotatedWith(InputType.class));
        declarations.addAll(roundEnv.getElementsAnnotatedWith(OutputType.class));

        for (Element element : declarations) {
            boolean input = element.getAnnotation(InputType.class) != null;
            boolean output = element.getAnnotation(OutputType.class) != null;
            if (input && output) {
                errorReporter.error(element, "Cannot apply @InputType and @OutputType more than once.");
                continue;
            }
            if (!(element instanceof TypeElement)) {
                continue;
            }

            TypeElement type = (TypeElement) element;
            DeclarationModel model = scanner.scan(type, input ? TypeKind.INPUT : TypeKind.OUTPUT, errorReporter);
            if (model == null) {
                continue;
            }
            try {
                generatePropertyClass(model);
            } catch (IOException e) {
                errorReporter.error(type, "Failed to generate property class: " + e.getMessage());
            }
        }
        return true;
    }

    // ==================== GENERATION ====================

    /**
     * Writes the {@code {ClassName}Impl} class of a scanned declaration.
     *
     * @param model the scanned declaration
     * @throws IOException if writing the generated source file fails
     */
    private void generatePropertyClass(DeclarationModel model) throws IOException {
        TypeElement declaration = model.element();
        String packageName = CodeGenUtils.packageName(declaration);
        ClassName declarationType = ClassName.get(declaration);
        ClassName generatedType = CodeGenUtils.generatedClassName(declaration, packageName);

        TypeSpec.Builder builder = TypeSpec.classBuilder(generatedType)
                .addModifiers(Modifier.PUBLIC, Modifier.FINAL)
                .superclass(TypeName.get(declaration.asType()))
                .addOriginatingElement(declaration)
                .addJavadoc("$L implementation of {@link $T}.\n", model.kind().annotation(), declarationType)
                .addJavadoc("<p>Generated by props4j annotation processor.\n");
        if (generatedAnnotation) {
            builder.addAnnotation(AnnotationSpec.builder(ClassName.get("javax.annotation.processing", "Generated"))
                    .addMember("value", "$S", PropertyTypeProcessor.class.getCanonicalName())
                    .build());
        }

        builder.addStaticBlock(registrationGenerator.generate(model, generatedType));
        if (model.holdsValueStore()) {
            builder.addSuperinterface(CodeGenUtils.PROPERTY_HOLDER)
                    .addField(AccessorGenerator.valueStoreField());
        }
        builder.addMethods(ConstructorGenerator.generate(model, generatedType, processingEnv.getElementUtils()));
        if (model.holdsValueStore()) {
            builder.addMethod(AccessorGenerator.valueStoreAccessor());
        }
        builder.addMethods(AccessorGenerator.generateGetters(model));
        if (model.kind() == TypeKind.INPUT) {
            builder.addMethods(AccessorGenerator.generateSetters(model));
        }
        builder.addMethods(EqualityGenerator.generate(model));

        JavaFile.builder(packageName, builder.build())
                .addFileComment("Generated by props4j annotation processor. Do not modify.")
                .build()
                .writeTo(processingEnv.getFiler());

        if (verbose) {
            messager.printMessage(Diagnostic.Kind.NOTE, "Generated " + generatedType.canonicalName()
                    + " for " + model.kind().annotation() + " " + declarationType.simpleName()
                    + " (" + model.properties().size() + " properties, " + model.getters().size()
                    + " getters)", declaration);
        }
    }
}
