package org.helmsman.runtime.model;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A typed value stored in the simulation state or written in a rule.
 * <p>
 * The union is closed: {@link NumberValue}, {@link TextValue}, {@link BooleanValue},
 * {@link ListValue} and {@link AbsentValue}. Numbers are doubles, so integer and floating point
 * literals compare without conversion. {@link AbsentValue} is what an unset {@code events.*} path
 * reads as.
 */
public sealed interface Value permits Value.NumberValue, Value.TextValue, Value.BooleanValue,
        Value.ListValue, Value.AbsentValue {

    /**
     * A numeric value.
     *
     * @param value The number.
     */
    record NumberValue(double value) implements Value {
        @Override
        public String typeName() {
            return "number";
        }

        @Override
        public Object toJava() {
            return value;
        }

        @Override
        public String render() {
            return formatNumber(value);
        }
    }

    /**
     * A text value.
     *
     * @param value The text, never null.
     */
    record TextValue(String value) implements Value {
        public TextValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String typeName() {
            return "text";
        }

        @Override
        public Object toJava() {
            return value;
        }

        @Override
        public String render() {
            return value;
        }
    }

    /**
     * A boolean value.
     *
     * @param value The flag.
     */
    record BooleanValue(boolean value) implements Value {
        @Override
        public String typeName() {
            return "boolean";
        }

        @Override
        public Object toJava() {
            return value;
        }

        @Override
        public String render() {
            return Boolean.toString(value);
        }
    }

    /**
     * An ordered sequence of values. Only used as the right side of {@code in}.
     *
     * @param elements The elements, copied on construction.
     */
    record ListValue(List<Value> elements) implements Value {
        public ListValue {
            elements = List.copyOf(elements);
        }

        @Override
        public String typeName() {
            return "sequence";
        }

        @Override
        public Object toJava() {
            List<Object> out = new ArrayList<>(elements.size());
            for (Value element : elements) {
                out.add(element.toJava());
            }
            return out;
        }

        @Override
        public String render() {
            return elements.stream().map(Value::render).collect(Collectors.joining(", ", "[", "]"));
        }
    }

    /**
     * Marker for "nothing here": an event that was not spawned this tick.
     */
    record AbsentValue() implements Value {
        @Override
        public String typeName() {
            return "absent";
        }

        @Override
        public Object toJava() {
            return null;
        }

        @Override
        public String render() {
            return "absent";
        }
    }

    /**
     * @return the name of this value's type as used in error messages.
     */
    String typeName();

    /**
     * @return this value as a plain Java object (Double, String, Boolean, List or null).
     */
    Object toJava();

    /**
     * @return the human readable form used in explanation messages.
     */
    String render();

    /**
     * @return true for numbers, text and booleans.
     */
    default boolean isScalar() {
        return this instanceof NumberValue || this instanceof TextValue || this instanceof BooleanValue;
    }

    default boolean isAbsent() {
        return this instanceof AbsentValue;
    }

    /**
     * Wraps a plain Java object.
     *
     * @param raw A Number, String, Boolean, Collection, Value or null.
     * @return The typed value; null maps to {@link AbsentValue}.
     * @throws IllegalArgumentException if the object has no value representation.
     */
    static Value of(Object raw) {
        if (raw == null) {
            return absent();
        }
        if (raw instanceof Value value) {
            return value;
        }
        if (raw instanceof Number number) {
            return new NumberValue(number.doubleValue());
        }
        if (raw instanceof String text) {
            return new TextValue(text);
        }
        if (raw instanceof Boolean flag) {
            return new BooleanValue(flag);
        }
        if (raw instanceof Collection<?> collection) {
            List<Value> elements = new ArrayList<>(collection.size());
            for (Object element : collection) {
                elements.add(of(element));
            }
            return new ListValue(elements);
        }
        throw new IllegalArgumentException("Unsupported value type: " + raw.getClass().getName());
    }

    static Value number(double value) {
        return new NumberValue(value);
    }

    static Value text(String value) {
        return new TextValue(value);
    }

    static Value bool(boolean value) {
        return new BooleanValue(value);
    }

    static Value absent() {
        return new AbsentValue();
    }

    /**
     * Formats a number without a trailing ".0" for whole values and with at most four decimals
     * otherwise. Locale independent.
     */
    static String formatNumber(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return new DecimalFormat("0.####", DecimalFormatSymbols.getInstance(Locale.ROOT)).format(value);
    }
}
