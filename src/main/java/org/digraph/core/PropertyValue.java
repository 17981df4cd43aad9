package org.digraph.core;

import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Result of a property lookup that tells "set to {@code null}" apart from "not set".
 *
 * <p>Unlike {@link java.util.Optional}, a present value may be {@code null}.</p>
 *
 * @param <V> value type.
 */
public final class PropertyValue<V> {
    private static final PropertyValue<?> ABSENT = new PropertyValue<>(false, null);

    private final boolean present;
    private final V value;

    private PropertyValue(boolean present, V value) {
        this.present = present;
        this.value = value;
    }

    /**
     * Returns a present lookup result holding {@code value}, which may be {@code null}.
     */
    public static <V> PropertyValue<V> of(V value) {
        return new PropertyValue<>(true, value);
    }

    @SuppressWarnings("unchecked")
    public static <V> PropertyValue<V> absent() {
        return (PropertyValue<V>) ABSENT;
    }

    public boolean isPresent() {
        return present;
    }

    /**
     * Returns the value.
     *
     * @throws NoSuchElementException if no value is present.
     */
    public V get() {
        if (!present) {
            throw new NoSuchElementException("No property value present");
        }
        return value;
    }

    public V orElse(V other) {
        return present ? value : other;
    }

    /**
     * Returns this result when present, otherwise {@code other}.
     */
    public PropertyValue<V> or(PropertyValue<V> other) {
        return present ? this : Objects.requireNonNull(other, "other");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PropertyValue<?> that)) {
            return false;
        }
        return present == that.present && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(present, value);
    }

    @Override
    public String toString() {
        return present ? "PropertyValue[" + value + "]" : "PropertyValue.absent";
    }
}
