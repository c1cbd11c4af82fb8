package io.github.reugn.props4j;

/**
 * Capability of reaching the {@link ValueStore} of an instance.
 *
 * <p>Implemented by every generated property type (except those extending {@link java.util.Map},
 * which use their own entries). Hand-written classes implement it to take part in
 * {@link PropertyTypes#get} and {@link PropertyTypes#set}.
 */
public interface PropertyHolder {

    /**
     * Returns the value store of this instance, creating it on first use.
     * Must return the same store on every call.
     *
     * @return the value store; never {@code null}
     */
    ValueStore valueStore();
}
