package com.pingidentity.scim2.model;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Three-state holder for a SCIM attribute value.
 *
 * <p>A SCIM attribute can be:</p>
 * <ul>
 *   <li><b>absent</b> - not provided at all, omitted from the JSON representation</li>
 *   <li><b>null</b> - provided as an explicit JSON {@code null}</li>
 *   <li><b>a value</b> - provided with a non-null value (which may still be empty)</li>
 * </ul>
 *
 * <p>Keeping "absent" and "null" apart is what lets the codec reproduce exactly the keys
 * it was given. Instances are immutable.</p>
 *
 * @param <T> the value type
 */
public final class AttributeValue<T> {

    private static final AttributeValue<?> ABSENT = new AttributeValue<>(false, null);
    private static final AttributeValue<?> NULL = new AttributeValue<>(true, null);

    private final boolean defined;
    private final T value;

    private AttributeValue(boolean defined, T value) {
        this.defined = defined;
        this.value = value;
    }

    /**
     * @return the shared "not provided" instance
     */
    @SuppressWarnings("unchecked")
    public static <T> AttributeValue<T> absent() {
        return (AttributeValue<T>) ABSENT;
    }

    /**
     * @return the shared "explicit null" instance
     */
    @SuppressWarnings("unchecked")
    public static <T> AttributeValue<T> ofNull() {
        return (AttributeValue<T>) NULL;
    }

    /**
     * Wrap a non-null value.
     *
     * @param value the value, must not be null
     * @return a holder carrying the value
     * @throws NullPointerException if value is null
     */
    public static <T> AttributeValue<T> of(T value) {
        return new AttributeValue<>(true, Objects.requireNonNull(value, "value"));
    }

    /**
     * Wrap a value that may be null; null maps to the explicit-null state, never to absent.
     */
    public static <T> AttributeValue<T> ofNullable(T value) {
        return value == null ? ofNull() : of(value);
    }

    /**
     * Wrap a value that may be null; null maps to absent. Used where a Java null means
     * "not supplied", as in convenience constructors.
     */
    public static <T> AttributeValue<T> ofOptional(T value) {
        return value == null ? absent() : of(value);
    }

    /** True when the attribute was not provided. */
    public boolean isAbsent() {
        return !defined;
    }

    /** True when the attribute was provided, either with a value or as null. */
    public boolean isDefined() {
        return defined;
    }

    /** True when the attribute was provided as an explicit null. */
    public boolean isNull() {
        return defined && value == null;
    }

    /** True when the attribute carries a non-null value. */
    public boolean hasValue() {
        return value != null;
    }

    /**
     * @return the value
     * @throws NoSuchElementException when absent or null
     */
    public T get() {
        if (value == null) {
            throw new NoSuchElementException(defined ? "Attribute is null" : "Attribute is absent");
        }
        return value;
    }

    public T orElse(T other) {
        return value != null ? value : other;
    }

    /**
     * Transform the value, keeping the absent and null states as they are.
     */
    public <R> AttributeValue<R> map(Function<? super T, ? extends R> mapper) {
        if (value == null) {
            return defined ? ofNull() : absent();
        }
        return ofNullable(mapper.apply(value));
    }

    public Optional<T> toOptional() {
        return Optional.ofNullable(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AttributeValue)) {
            return false;
        }
        AttributeValue<?> that = (AttributeValue<?>) o;
        return defined == that.defined && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(defined, value);
    }

    @Override
    public String toString() {
        if (!defined) {
            return "<absent>";
        }
        return value == null ? "null" : String.valueOf(value);
    }
}
