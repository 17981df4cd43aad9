package org.digraph.store;

import it.unimi.dsi.fastutil.objects.Object2ObjectOpenHashMap;
import org.digraph.core.PropertyValue;

import java.util.List;
import java.util.Objects;

/**
 * Property store keyed by {@code key -> node tuple -> value}, with per-key defaults.
 *
 * <p>Node tuples are copied into immutable lists, so callers may reuse their argument lists.
 * Not thread-safe.</p>
 *
 * @param <N> node type.
 */
public final class MapPropertyStore<N> implements PropertyStore<N> {

    private final Object2ObjectOpenHashMap<String, Object2ObjectOpenHashMap<List<N>, Object>> values =
            new Object2ObjectOpenHashMap<>();
    private final Object2ObjectOpenHashMap<String, Object> defaults = new Object2ObjectOpenHashMap<>();

    @Override
    public boolean hasProperty(String key, List<N> nodes) {
        Object2ObjectOpenHashMap<List<N>, Object> byNodes = values.get(key);
        return byNodes != null && byNodes.containsKey(nodes);
    }

    @Override
    public PropertyValue<Object> findProperty(String key, List<N> nodes) {
        Object2ObjectOpenHashMap<List<N>, Object> byNodes = values.get(key);
        if (byNodes == null || !byNodes.containsKey(nodes)) {
            return PropertyValue.absent();
        }
        return PropertyValue.of(byNodes.get(nodes));
    }

    @Override
    public void setProperty(String key, Object value, List<N> nodes) {
        Objects.requireNonNull(key, "key");
        Object2ObjectOpenHashMap<List<N>, Object> byNodes = values.get(key);
        if (byNodes == null) {
            byNodes = new Object2ObjectOpenHashMap<>();
            values.put(key, byNodes);
        }
        byNodes.put(copyTuple(nodes), value);
    }

    @Override
    public void delProperty(String key, List<N> nodes) {
        Object2ObjectOpenHashMap<List<N>, Object> byNodes = values.get(key);
        if (byNodes == null) {
            return;
        }
        byNodes.remove(nodes);
        if (byNodes.isEmpty()) {
            values.remove(key);
        }
    }

    @Override
    public boolean hasPropertyDefault(String key) {
        return defaults.containsKey(key);
    }

    @Override
    public PropertyValue<Object> lookupPropertyDefault(String key) {
        if (!defaults.containsKey(key)) {
            return PropertyValue.absent();
        }
        return PropertyValue.of(defaults.get(key));
    }

    @Override
    public void setPropertyDefault(String key, Object value) {
        defaults.put(Objects.requireNonNull(key, "key"), value);
    }

    @Override
    public void delPropertyDefault(String key) {
        defaults.remove(key);
    }

    private static <N> List<N> copyTuple(List<N> nodes) {
        List<N> tuple = List.copyOf(Objects.requireNonNull(nodes, "nodes"));
        if (tuple.isEmpty()) {
            throw new IllegalArgumentException("node tuple must contain at least one node");
        }
        return tuple;
    }
}
