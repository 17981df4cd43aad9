package org.digraph.store;

import org.digraph.core.NotFoundException;
import org.digraph.core.PropertyValue;

import java.util.List;

/**
 * Keyed values attached to node tuples.
 *
 * <p>A tuple of one node addresses a node property, a tuple of two nodes an edge property;
 * longer tuples are accepted as well. Each key may additionally carry a store-wide default
 * that is returned when no specific value is set. Values, including defaults, may be
 * {@code null}; presence is reported through {@link PropertyValue}.</p>
 *
 * @param <N> node type.
 */
public interface PropertyStore<N> {

    /**
     * Returns whether a specific value is set for {@code key} on {@code nodes}. Defaults are not considered.
     */
    boolean hasProperty(String key, List<N> nodes);

    /**
     * Returns the specific value set for {@code key} on {@code nodes}, if any. Defaults are not considered.
     */
    PropertyValue<Object> findProperty(String key, List<N> nodes);

    /**
     * Returns the specific value if set, else the key's default if set, else {@code valueIfAbsent}.
     */
    default Object getProperty(String key, List<N> nodes, Object valueIfAbsent) {
        return findProperty(key, nodes).or(lookupPropertyDefault(key)).orElse(valueIfAbsent);
    }

    void setProperty(String key, Object value, List<N> nodes);

    /**
     * Removes the specific value for {@code key} on {@code nodes}. No-op if none is set.
     */
    void delProperty(String key, List<N> nodes);

    boolean hasPropertyDefault(String key);

    PropertyValue<Object> lookupPropertyDefault(String key);

    /**
     * Returns the default of {@code key}.
     *
     * @throws NotFoundException if the key has no default.
     */
    default Object getPropertyDefault(String key) {
        PropertyValue<Object> value = lookupPropertyDefault(key);
        if (!value.isPresent()) {
            throw new NotFoundException("no default for property key: " + key);
        }
        return value.get();
    }

    void setPropertyDefault(String key, Object value);

    /**
     * Removes the default of {@code key}. No-op if none is set.
     */
    void delPropertyDefault(String key);
}
