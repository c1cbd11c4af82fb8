/**
 * Runtime of typed property classes.
 * <p>
 * Classes generated for {@code @InputType} and {@code @OutputType} declarations register their
 * {@link io.github.reugn.props4j.TypeMetadata} here when they are initialized, and route every
 * accessor through {@link io.github.reugn.props4j.PropertyTypes}:
 * <ul>
 *   <li>{@link io.github.reugn.props4j.PropertyDescriptor} - Wire name, default and declared type of a property</li>
 *   <li>{@link io.github.reugn.props4j.ValueStore} - Per-instance wire name to value map</li>
 *   <li>{@link io.github.reugn.props4j.TypeExpr} - Declared types as an explicit algebra</li>
 *   <li>{@link io.github.reugn.props4j.TypeUnwrapper} - Strips deferred and optional wrappers</li>
 * </ul>
 *
 * @see io.github.reugn.props4j.annotation
 */
package io.github.reugn.props4j;
