package io.concourse.driver.resolve;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A single supplied argument, classified once by shape so the resolver never re-inspects raw types.
 */
public final class ArgumentValue {

    public enum Shape {
        INTEGER,
        DECIMAL,
        TEXT,
        OTHER,
        COLLECTION
    }

    private final Shape shape;
    private final Object scalar;
    private final List<ArgumentValue> elements;

    private ArgumentValue(Shape shape, Object scalar, List<ArgumentValue> elements) {
        this.shape = shape;
        this.scalar = scalar;
        this.elements = elements;
    }

    /**
     * Classifies a raw value. Collections and arrays, primitive ones included, become {@link Shape#COLLECTION}; their
     * elements must be non-null scalars.
     *
     * @throws IllegalArgumentException for null, null elements or nested collections.
     */
    public static ArgumentValue of(Object raw) {
        if (raw == null) {
            throw new IllegalArgumentException("argument value must not be null");
        }
        if (raw instanceof ArgumentValue) {
            return (ArgumentValue) raw;
        }
        if (raw instanceof Collection<?> || raw.getClass().isArray()) {
            Collection<?> items = raw instanceof Collection<?> ? (Collection<?>) raw : arrayElements(raw);
            List<ArgumentValue> classified = new ArrayList<>(items.size());
            for (Object item : items) {
                if (item == null) {
                    throw new IllegalArgumentException("collection arguments must not contain null");
                }
                ArgumentValue element = of(item);
                if (element.isCollection()) {
                    throw new IllegalArgumentException("collection arguments must contain scalars only");
                }
                classified.add(element);
            }
            return new ArgumentValue(Shape.COLLECTION, null, Collections.unmodifiableList(classified));
        }
        return scalar(raw);
    }

    private static List<Object> arrayElements(Object array) {
        if (array instanceof Object[]) {
            return Arrays.asList((Object[]) array);
        }
        int length = Array.getLength(array);
        List<Object> items = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            items.add(Array.get(array, i));
        }
        return items;
    }

    private static ArgumentValue scalar(Object raw) {
        if (raw instanceof Long || raw instanceof Integer || raw instanceof Short || raw instanceof Byte) {
            return new ArgumentValue(Shape.INTEGER, ((Number) raw).longValue(), List.of());
        }
        if (raw instanceof BigInteger) {
            try {
                return new ArgumentValue(Shape.INTEGER, ((BigInteger) raw).longValueExact(), List.of());
            } catch (ArithmeticException ex) {
                throw new IllegalArgumentException("integer argument out of range: " + raw, ex);
            }
        }
        if (raw instanceof Double || raw instanceof Float || raw instanceof BigDecimal) {
            return new ArgumentValue(Shape.DECIMAL, raw, List.of());
        }
        if (raw instanceof CharSequence) {
            return new ArgumentValue(Shape.TEXT, raw.toString(), List.of());
        }
        return new ArgumentValue(Shape.OTHER, raw, List.of());
    }

    public Shape shape() {
        return shape;
    }

    public boolean isCollection() {
        return shape == Shape.COLLECTION;
    }

    public boolean isScalar() {
        return shape != Shape.COLLECTION;
    }

    public boolean isNumeric() {
        return shape == Shape.INTEGER || shape == Shape.DECIMAL;
    }

    /**
     * @return the normalized scalar: {@link Long} for integers, {@link String} for text, the original object otherwise.
     */
    public Object scalar() {
        if (isCollection()) {
            throw new IllegalStateException("collection argument has no scalar value");
        }
        return scalar;
    }

    public List<ArgumentValue> elements() {
        return elements;
    }

    public long asLong() {
        if (!isNumeric()) {
            throw new IllegalStateException(shape + " argument is not numeric");
        }
        return ((Number) scalar).longValue();
    }

    public String asText() {
        if (isCollection()) {
            throw new IllegalStateException("collection argument has no text value");
        }
        return scalar instanceof BigDecimal ? ((BigDecimal) scalar).toPlainString() : String.valueOf(scalar);
    }

    /**
     * @return true when this is a collection whose elements all have {@code elementShape}.
     */
    public boolean isCollectionOf(Shape elementShape) {
        if (!isCollection()) {
            return false;
        }
        for (ArgumentValue element : elements) {
            if (element.shape != elementShape) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ArgumentValue)) {
            return false;
        }
        ArgumentValue that = (ArgumentValue) other;
        return shape == that.shape && Objects.equals(scalar, that.scalar) && elements.equals(that.elements);
    }

    @Override
    public int hashCode() {
        return Objects.hash(shape, scalar, elements);
    }

    @Override
    public String toString() {
        return isCollection() ? elements.toString() : String.valueOf(scalar);
    }
}
