/**
 * Annotation processor implementation for props4j.
 * <p>
 * This package contains the compile-time processor that generates the implementation class of
 * every {@link io.github.reugn.props4j.annotation.InputType} and
 * {@link io.github.reugn.props4j.annotation.OutputType} declaration.
 * <p>
 * <b>Internal implementation</b> - not part of the public API.
 *
 * <p><b>Architecture:</b>
 * <pre>
 * PropertyTypeProcessor (entry point)
 *     ├── PropertyScanner        - DeclarationModel
 *     ├── RegistrationGenerator  ── TypeExprGenerator
 *     ├── ConstructorGenerator
 *     ├── AccessorGenerator
 *     └── EqualityGenerator
 *
 * Support utilities:
 *     ├── CodeGenUtils     - Runtime class names, generated names, default expressions
 *     ├── ValidationUtils  - Compile-time validation checks
 *     ├── LiteralValidator - @DefaultValue literal parsing
 *     └── ErrorReporter    - Error reporting interface
 * </pre>
 *
 * @see io.github.reugn.props4j.annotation
 * @see io.github.reugn.props4j.PropertyTypes
 */
package io.github.reugn.props4j.processor;
