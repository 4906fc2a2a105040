package io.flowtemplate.core.model;

import io.flowtemplate.core.error.TypeConversionException;
import io.flowtemplate.core.error.ValueIndexException;
import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Dynamic value flowing through template expressions: the data read from a {@code Context}, the
 * literals of an expression, and the arguments and results of registry functions.
 *
 * <p>
 * A sealed hierarchy of seven variants. Equality is structural and type-sensitive: an
 * {@link IntegerValue} and a {@link FloatValue} of the same magnitude are <em>not</em> equal.
 * Object field order is irrelevant to equality.
 *
 * <p>
 * Thread-safe and immutable; {@link #set(String, Value)} returns an updated copy.
 */
public sealed interface Value
        permits Value.NullValue,
                Value.BoolValue,
                Value.IntegerValue,
                Value.FloatValue,
                Value.StringValue,
                Value.ArrayValue,
                Value.ObjectValue {

    /** The null value (singleton). */
    Value NULL = new NullValue();

    Value TRUE = new BoolValue(true);

    Value FALSE = new BoolValue(false);

    // ── Factory methods ──

    static Value of(boolean value) {
        return value ? TRUE : FALSE;
    }

    static Value of(long value) {
        return new IntegerValue(value);
    }

    static Value of(double value) {
        return new FloatValue(value);
    }

    /** Wraps a string; {@code null} becomes {@link #NULL}. */
    static Value of(String value) {
        return value != null ? new StringValue(value) : NULL;
    }

    static Value array(List<Value> items) {
        return new ArrayValue(items);
    }

    static Value array(Value... items) {
        return new ArrayValue(Arrays.asList(items));
    }

    static Value object(Map<String, Value> fields) {
        return new ObjectValue(fields);
    }

    // ── Type predicates ──

    default boolean isNull() {
        return this instanceof NullValue;
    }

    default boolean isBool() {
        return this instanceof BoolValue;
    }

    /** True for both integers and floats. */
    default boolean isNumber() {
        return this instanceof IntegerValue || this instanceof FloatValue;
    }

    default boolean isString() {
        return this instanceof StringValue;
    }

    default boolean isArray() {
        return this instanceof ArrayValue;
    }

    default boolean isObject() {
        return this instanceof ObjectValue;
    }

    /** True for null, the empty string, the empty array and the empty object. */
    default boolean isEmpty() {
        if (this instanceof NullValue) {
            return true;
        }
        if (this instanceof StringValue s) {
            return s.value().isEmpty();
        }
        if (this instanceof ArrayValue a) {
            return a.items().isEmpty();
        }
        if (this instanceof ObjectValue o) {
            return o.fields().isEmpty();
        }
        return false;
    }

    /**
     * Converts this value to a boolean for conditionals and logical operators.
     *
     * <ul>
     * <li>null → false
     * <li>boolean → itself
     * <li>integer → non-zero
     * <li>float → non-zero and not NaN
     * <li>string, array, object → non-empty
     * </ul>
     */
    default boolean isTruthy() {
        if (this instanceof BoolValue b) {
            return b.value();
        }
        if (this instanceof IntegerValue i) {
            return i.value() != 0;
        }
        if (this instanceof FloatValue f) {
            return f.value() != 0.0 && !Double.isNaN(f.value());
        }
        return !isEmpty();
    }

    /** One of {@code null, boolean, integer, float, string, array, object}. */
    String typeName();

    // ── Coercions ──

    /**
     * Coerces to a boolean. Strings {@code true/yes/1/on} and {@code false/no/0/off/""} are
     * accepted case-insensitively; arrays and objects use truthiness.
     *
     * @throws TypeConversionException for any other string
     */
    default boolean asBool() {
        if (this instanceof StringValue s) {
            switch (s.value().toLowerCase(Locale.ROOT)) {
                case "true", "yes", "1", "on":
                    return true;
                case "false", "no", "0", "off", "":
                    return false;
                default:
                    throw new TypeConversionException(typeName(), "boolean");
            }
        }
        return isTruthy();
    }

    /**
     * Coerces to a 64-bit integer. Floats truncate toward zero (saturating at the {@code long}
     * range, NaN becomes 0), booleans become 1 or 0, strings must hold a decimal integer.
     *
     * @throws TypeConversionException for null, arrays, objects and unparseable strings
     */
    default long asInteger() {
        if (this instanceof IntegerValue i) {
            return i.value();
        }
        if (this instanceof FloatValue f) {
            return (long) f.value();
        }
        if (this instanceof BoolValue b) {
            return b.value() ? 1L : 0L;
        }
        if (this instanceof StringValue s && Numbers.INTEGER.matcher(s.value()).matches()) {
            try {
                return Long.parseLong(s.value());
            } catch (NumberFormatException e) {
                throw new TypeConversionException(typeName(), "integer");
            }
        }
        throw new TypeConversionException(typeName(), "integer");
    }

    /**
     * Coerces to a double. Integers widen, booleans become 1.0 or 0.0, strings must hold a decimal
     * number or one of {@code inf}, {@code infinity}, {@code nan}.
     *
     * @throws TypeConversionException for null, arrays, objects and unparseable strings
     */
    default double asFloat() {
        if (this instanceof FloatValue f) {
            return f.value();
        }
        if (this instanceof IntegerValue i) {
            return i.value();
        }
        if (this instanceof BoolValue b) {
            return b.value() ? 1.0 : 0.0;
        }
        if (this instanceof StringValue s) {
            return Numbers.parseFloat(s.value()).orElseThrow(() -> new TypeConversionException(typeName(), "float"));
        }
        throw new TypeConversionException(typeName(), "float");
    }

    /**
     * Coerces to text. Null renders as {@code "null"}; arrays and objects have no implicit text
     * form.
     *
     * @throws TypeConversionException for arrays and objects
     */
    default String asString() {
        if (this instanceof ArrayValue || this instanceof ObjectValue) {
            throw new TypeConversionException(typeName(), "string");
        }
        return toString();
    }

    // ── Navigation ──

    /**
     * Object field lookup, or array element lookup when {@code key} is a non-negative integer.
     *
     * @return the child value, or empty for any miss (including scalar receivers)
     */
    default Optional<Value> get(String key) {
        if (this instanceof ObjectValue o) {
            return Optional.ofNullable(o.fields().get(key));
        }
        if (this instanceof ArrayValue a) {
            int index = Numbers.parseIndex(key);
            if (index >= 0 && index < a.items().size()) {
                return Optional.of(a.items().get(index));
            }
        }
        return Optional.empty();
    }

    /**
     * Follows a dotted path such as {@code user.addresses.0.city}, one {@link #get} per segment.
     * An empty path returns this value.
     *
     * @return the value at the path, or empty on the first missing segment
     */
    default Optional<Value> navigate(String path) {
        if (path == null || path.isEmpty()) {
            return Optional.of(this);
        }
        Value current = this;
        for (String segment : path.split("\\.", -1)) {
            Optional<Value> next = current.get(segment);
            if (next.isEmpty()) {
                return Optional.empty();
            }
            current = next.get();
        }
        return Optional.of(current);
    }

    /**
     * Returns a copy of this value with {@code key} set to {@code value}. Objects insert or replace
     * the field; arrays replace the element at a numeric index.
     *
     * @throws ValueIndexException     if a numeric array index is out of bounds
     * @throws TypeConversionException if the key is not numeric for an array, or the receiver is
     *                                 neither array nor object
     */
    default Value set(String key, Value value) {
        Objects.requireNonNull(value, "value must not be null");
        if (this instanceof ObjectValue o) {
            Map<String, Value> copy = new LinkedHashMap<>(o.fields());
            copy.put(key, value);
            return new ObjectValue(copy);
        }
        if (this instanceof ArrayValue a) {
            int index = Numbers.parseIndex(key);
            if (index < 0) {
                if (Numbers.INTEGER.matcher(key).matches()) {
                    throw new ValueIndexException(Long.parseLong(key), a.items().size());
                }
                throw new TypeConversionException("string", "array index");
            }
            if (index >= a.items().size()) {
                throw new ValueIndexException(index, a.items().size());
            }
            List<Value> copy = new java.util.ArrayList<>(a.items());
            copy.set(index, value);
            return new ArrayValue(copy);
        }
        throw new TypeConversionException(typeName(), "object or array");
    }

    /**
     * Length of a string (in code points), array or object.
     *
     * @throws TypeConversionException for any other variant
     */
    default int length() {
        if (this instanceof StringValue s) {
            return s.value().codePointCount(0, s.value().length());
        }
        if (this instanceof ArrayValue a) {
            return a.items().size();
        }
        if (this instanceof ObjectValue o) {
            return o.fields().size();
        }
        throw new TypeConversionException(typeName(), "string, array, or object");
    }

    // ── Variants ──

    /** The absence of a value. */
    record NullValue() implements Value {
        @Override
        public String typeName() {
            return "null";
        }

        @Override
        public String toString() {
            return "null";
        }
    }

    record BoolValue(boolean value) implements Value {
        @Override
        public String typeName() {
            return "boolean";
        }

        @Override
        public String toString() {
            return Boolean.toString(value);
        }
    }

    record IntegerValue(long value) implements Value {
        @Override
        public String typeName() {
            return "integer";
        }

        @Override
        public String toString() {
            return Long.toString(value);
        }
    }

    /** A 64-bit float. Integral values print without a fractional part ({@code 3}, not {@code 3.0}). */
    record FloatValue(double value) implements Value {
        @Override
        public String typeName() {
            return "float";
        }

        @Override
        public String toString() {
            return Numbers.formatFloat(value);
        }
    }

    record StringValue(String value) implements Value {
        public StringValue {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public String typeName() {
            return "string";
        }

        @Override
        public String toString() {
            return value;
        }
    }

    /** Ordered list of values. The list is copied and unmodifiable. */
    record ArrayValue(List<Value> items) implements Value {
        public ArrayValue {
            Objects.requireNonNull(items, "items must not be null");
            items = List.copyOf(items);
        }

        @Override
        public String typeName() {
            return "array";
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder("[");
            for (int i = 0; i < items.size(); i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                sb.append(items.get(i));
            }
            return sb.append(']').toString();
        }
    }

    /** String-keyed fields. The map is copied and unmodifiable; field order does not affect equality. */
    record ObjectValue(Map<String, Value> fields) implements Value {
        public ObjectValue {
            Objects.requireNonNull(fields, "fields must not be null");
            fields.forEach((k, v) -> {
                Objects.requireNonNull(k, "field name must not be null");
                Objects.requireNonNull(v, () -> "field '" + k + "' must not be null");
            });
            fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        }

        @Override
        public String typeName() {
            return "object";
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder("{");
            boolean first = true;
            for (Map.Entry<String, Value> entry : fields.entrySet()) {
                if (!first) {
                    sb.append(", ");
                }
                first = false;
                sb.append(entry.getKey()).append(": ").append(entry.getValue());
            }
            return sb.append('}').toString();
        }
    }

    /** Number parsing and formatting shared by the variants. */
    final class Numbers {

        static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");

        private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

        private static final Pattern INDEX = Pattern.compile("\\+?\\d+");

        private Numbers() {}

        static Optional<Double> parseFloat(String text) {
            if (DECIMAL.matcher(text).matches()) {
                return Optional.of(Double.parseDouble(text));
            }
            String lower = text.toLowerCase(Locale.ROOT);
            boolean negative = lower.startsWith("-");
            String unsigned = lower.startsWith("-") || lower.startsWith("+") ? lower.substring(1) : lower;
            switch (unsigned) {
                case "inf", "infinity":
                    return Optional.of(negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY);
                case "nan":
                    return Optional.of(Double.NaN);
                default:
                    return Optional.empty();
            }
        }

        /** Parses a non-negative array index; returns -1 if {@code key} is not one. */
        static int parseIndex(String key) {
            if (key == null || !INDEX.matcher(key).matches()) {
                return -1;
            }
            try {
                return Integer.parseInt(key);
            } catch (NumberFormatException e) {
                // beyond int range: no array can hold it
                return Integer.MAX_VALUE;
            }
        }

        static String formatFloat(double value) {
            if (Double.isNaN(value)) {
                return "NaN";
            }
            if (Double.isInfinite(value)) {
                return value > 0 ? "inf" : "-inf";
            }
            if (value == 0.0) {
                return 1.0 / value < 0 ? "-0" : "0";
            }
            return new BigDecimal(Double.toString(value)).stripTrailingZeros().toPlainString();
        }
    }
}
