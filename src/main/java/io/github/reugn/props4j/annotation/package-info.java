/**
 * Annotations declaring typed property classes.
 * <p>
 * This package provides:
 * <ul>
 *   <li>{@link io.github.reugn.props4j.annotation.InputType} - Settable property class backed by a value store</li>
 *   <li>{@link io.github.reugn.props4j.annotation.OutputType} - Read-only property class initialized from a payload</li>
 *   <li>{@link io.github.reugn.props4j.annotation.Property} - Explicit wire name for a property</li>
 *   <li>{@link io.github.reugn.props4j.annotation.DefaultValue} - Literal default recorded in the property descriptor</li>
 *   <li>{@link io.github.reugn.props4j.annotation.Getter} - Tags a user-authored accessor as a property getter</li>
 * </ul>
 * <p>
 * {@code @InputType} and {@code @OutputType} are processed by
 * {@link io.github.reugn.props4j.processor.PropertyTypeProcessor}, generating a
 * {@code {ClassName}Impl} class per declaration.
 *
 * @see io.github.reugn.props4j.processor.PropertyTypeProcessor
 */
package io.github.reugn.props4j.annotation;
