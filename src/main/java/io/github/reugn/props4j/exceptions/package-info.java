/**
 * Unchecked exceptions signalling violations of the property type contracts.
 * <p>
 * Every exception here marks a programming-time error: none is retried or wrapped by the
 * library, all propagate to the caller unmodified.
 */
package io.github.reugn.props4j.exceptions;
