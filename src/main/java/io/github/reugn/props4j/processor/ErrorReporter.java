package io.github.reugn.props4j.processor;

import javax.lang.model.element.Element;

/**
 * Interface for reporting compilation errors.
 */
@FunctionalInterface
interface ErrorReporter {
    /**
     * Reports an error on the given element.
     *
     * @param element the element where the error occurred
     * @param message the error message
     */
    void error(Element element, String message);

    /**
     * A reporter dropping every error, for re-scanning declarations already validated in
     * their own processing step.
     */
    static ErrorReporter silent() {
        return (element, message) -> {
            // reported when the element itself is processed
        };
    }
}
