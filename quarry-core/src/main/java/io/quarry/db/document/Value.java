/*
 * Value.java
 *
 * This source file is part of the Quarry open source project
 *
 * Copyright 2024-2026 the Quarry project authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.quarry.db.document;

import com.google.common.collect.ImmutableList;
import com.google.common.io.BaseEncoding;
import com.google.common.primitives.UnsignedBytes;
import io.quarry.annotation.API;
import io.quarry.db.ConversionFailedException;
import io.quarry.db.QuarryArgumentException;
import io.quarry.db.TypeMismatchException;
import io.quarry.db.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * An immutable, typed value stored in a {@link Document}.
 *
 * <p>
 * Integers of every width are held as {@code long} and tagged with their {@link ValueType}. Conversions between
 * types are explicit and fallible: a conversion between unrelated types fails with {@link TypeMismatchException},
 * and a conversion that would lose information, such as narrowing {@code 300} to {@code int8} or turning
 * {@code 1.5} into an integer, fails with {@link ConversionFailedException}. Nothing is silently truncated.
 * </p>
 *
 * <p>
 * Comparison follows the query semantics rather than Java equality: numbers compare numerically across the
 * integer types and {@code float64}, {@code NULL} is only equal to {@code NULL}, and values of unrelated types
 * are neither equal nor ordered. {@link #equals(Object)} on the other hand is strict and also compares types.
 * </p>
 */
@API(API.Status.STABLE)
public final class Value {
    @Nonnull
    public static final Value NULL = new Value(ValueType.NULL, null);
    @Nonnull
    public static final Value TRUE = new Value(ValueType.BOOL, Boolean.TRUE);
    @Nonnull
    public static final Value FALSE = new Value(ValueType.BOOL, Boolean.FALSE);

    /**
     * A total order over all values for sorting: first by type family (null, bool, number, text, blob, array,
     * document), then by value within the family. Documents are not ordered among themselves.
     */
    @Nonnull
    public static final Comparator<Value> SORT_ORDER = Value::sortCompare;

    private static final double TWO_POW_63 = 0x1p63;

    @Nonnull
    private final ValueType type;
    @Nullable
    private final Object value;

    private Value(@Nonnull ValueType type, @Nullable Object value) {
        this.type = type;
        this.value = value;
    }

    @Nonnull
    public static Value ofBool(boolean b) {
        return b ? TRUE : FALSE;
    }

    @Nonnull
    public static Value ofInt8(byte i) {
        return new Value(ValueType.INT8, (long) i);
    }

    @Nonnull
    public static Value ofInt16(short i) {
        return new Value(ValueType.INT16, (long) i);
    }

    @Nonnull
    public static Value ofInt32(int i) {
        return new Value(ValueType.INT32, (long) i);
    }

    @Nonnull
    public static Value ofInt64(long i) {
        return new Value(ValueType.INT64, i);
    }

    @Nonnull
    public static Value ofDouble(double d) {
        return new Value(ValueType.FLOAT64, d);
    }

    @Nonnull
    public static Value ofText(@Nonnull String s) {
        return new Value(ValueType.TEXT, s);
    }

    @Nonnull
    public static Value ofBlob(@Nonnull byte[] b) {
        return new Value(ValueType.BLOB, b.clone());
    }

    @Nonnull
    public static Value ofArray(@Nonnull List<Value> values) {
        return new Value(ValueType.ARRAY, ImmutableList.copyOf(values));
    }

    @Nonnull
    public static Value ofDocument(@Nonnull Document document) {
        return new Value(ValueType.DOCUMENT, document);
    }

    @Nonnull
    static Value ofInteger(@Nonnull ValueType type, long l) {
        return new Value(type, l);
    }

    /**
     * Create a value from a plain Java object: {@code null}, {@link Boolean}, {@link Byte}, {@link Short},
     * {@link Integer}, {@link Long}, {@link Float}, {@link Double}, {@link String}, {@code byte[]},
     * {@link List}, {@link Document} or {@link Value}.
     * @param object the object to wrap
     * @return the corresponding value
     * @throws QuarryArgumentException if the object has an unsupported class
     */
    @Nonnull
    public static Value of(@Nullable Object object) {
        if (object == null) {
            return NULL;
        } else if (object instanceof Value) {
            return (Value) object;
        } else if (object instanceof Boolean) {
            return ofBool((Boolean) object);
        } else if (object instanceof Byte) {
            return ofInt8((Byte) object);
        } else if (object instanceof Short) {
            return ofInt16((Short) object);
        } else if (object instanceof Integer) {
            return ofInt32((Integer) object);
        } else if (object instanceof Long) {
            return ofInt64((Long) object);
        } else if (object instanceof Float || object instanceof Double) {
            return ofDouble(((Number) object).doubleValue());
        } else if (object instanceof String) {
            return ofText((String) object);
        } else if (object instanceof byte[]) {
            return ofBlob((byte[]) object);
        } else if (object instanceof List<?>) {
            final ImmutableList.Builder<Value> elements = ImmutableList.builder();
            for (Object element : (List<?>) object) {
                elements.add(of(element));
            }
            return new Value(ValueType.ARRAY, elements.build());
        } else if (object instanceof Document) {
            return ofDocument((Document) object);
        }
        throw new QuarryArgumentException("unsupported value class", LogMessageKeys.VALUE, object.getClass().getName());
    }

    @Nonnull
    public ValueType getType() {
        return type;
    }

    public boolean isNull() {
        return type == ValueType.NULL;
    }

    public boolean isNumber() {
        return type.isNumber();
    }

    public boolean isInteger() {
        return type.isInteger();
    }

    public boolean asBool() {
        expect(ValueType.BOOL);
        return (Boolean) value;
    }

    /**
     * Get the value of an integer of any width.
     * @return the integer
     * @throws TypeMismatchException if this is not an integer
     */
    public long asLong() {
        if (!type.isInteger()) {
            throw mismatch(ValueType.INT64);
        }
        return (Long) value;
    }

    /**
     * Get the value of any number as a double, without the exactness checks of {@link #convertToDouble()}.
     * @return the number as a double
     * @throws TypeMismatchException if this is not a number
     */
    public double asDouble() {
        if (type == ValueType.FLOAT64) {
            return (Double) value;
        }
        if (type.isInteger()) {
            return (Long) value;
        }
        throw mismatch(ValueType.FLOAT64);
    }

    @Nonnull
    public String asText() {
        expect(ValueType.TEXT);
        return (String) value;
    }

    @Nonnull
    public byte[] asBlob() {
        expect(ValueType.BLOB);
        return ((byte[]) value).clone();
    }

    @Nonnull
    @SuppressWarnings("unchecked")
    public List<Value> asArray() {
        expect(ValueType.ARRAY);
        return (List<Value>) value;
    }

    @Nonnull
    public Document asDocument() {
        expect(ValueType.DOCUMENT);
        return (Document) value;
    }

    private void expect(@Nonnull ValueType expected) {
        if (type != expected) {
            throw mismatch(expected);
        }
    }

    @Nonnull
    private TypeMismatchException mismatch(@Nonnull ValueType expected) {
        return new TypeMismatchException("value has unexpected type",
                LogMessageKeys.EXPECTED_TYPE, expected,
                LogMessageKeys.ACTUAL_TYPE, type);
    }

    /**
     * Convert this value to another type.
     * @param target the type to convert to
     * @return a value of type {@code target}
     * @throws TypeMismatchException if values of this type cannot be converted to {@code target}
     * @throws ConversionFailedException if this particular value cannot be represented in {@code target}
     */
    @Nonnull
    public Value convertTo(@Nonnull ValueType target) {
        if (type == target) {
            return this;
        }
        switch (target) {
            case INT8:
            case INT16:
            case INT32:
            case INT64:
                return new Value(target, toLongExact(target));
            case FLOAT64:
                return ofDouble(toDoubleExact());
            case TEXT:
                if (type == ValueType.BLOB) {
                    return ofText(decodeUtf8((byte[]) value));
                }
                break;
            case BLOB:
                if (type == ValueType.TEXT) {
                    return new Value(ValueType.BLOB, ((String) value).getBytes(StandardCharsets.UTF_8));
                }
                break;
            default:
                break;
        }
        throw new TypeMismatchException("cannot convert " + type + " to " + target,
                LogMessageKeys.EXPECTED_TYPE, target,
                LogMessageKeys.ACTUAL_TYPE, type);
    }

    public int convertToInt() {
        return (int) toLongExact(ValueType.INT32);
    }

    public long convertToLong() {
        return toLongExact(ValueType.INT64);
    }

    public double convertToDouble() {
        return toDoubleExact();
    }

    private long toLongExact(@Nonnull ValueType target) {
        final long l;
        if (type.isInteger()) {
            l = (Long) value;
        } else if (type == ValueType.FLOAT64) {
            final double d = (Double) value;
            if (Double.isNaN(d) || Double.isInfinite(d) || d != Math.rint(d)) {
                throw conversionFailed(target);
            }
            if (d < -TWO_POW_63 || d >= TWO_POW_63) {
                throw conversionFailed(target);
            }
            l = (long) d;
        } else {
            throw new TypeMismatchException("cannot convert " + type + " to " + target,
                    LogMessageKeys.EXPECTED_TYPE, target,
                    LogMessageKeys.ACTUAL_TYPE, type);
        }
        final long min;
        final long max;
        switch (target) {
            case INT8:
                min = Byte.MIN_VALUE;
                max = Byte.MAX_VALUE;
                break;
            case INT16:
                min = Short.MIN_VALUE;
                max = Short.MAX_VALUE;
                break;
            case INT32:
                min = Integer.MIN_VALUE;
                max = Integer.MAX_VALUE;
                break;
            default:
                min = Long.MIN_VALUE;
                max = Long.MAX_VALUE;
                break;
        }
        if (l < min || l > max) {
            throw conversionFailed(target);
        }
        return l;
    }

    private double toDoubleExact() {
        if (type == ValueType.FLOAT64) {
            return (Double) value;
        }
        if (!type.isInteger()) {
            throw new TypeMismatchException("cannot convert " + type + " to " + ValueType.FLOAT64,
                    LogMessageKeys.EXPECTED_TYPE, ValueType.FLOAT64,
                    LogMessageKeys.ACTUAL_TYPE, type);
        }
        final long l = (Long) value;
        final double d = l;
        if (d >= TWO_POW_63 || (long) d != l) {
            throw conversionFailed(ValueType.FLOAT64);
        }
        return d;
    }

    @Nonnull
    private ConversionFailedException conversionFailed(@Nonnull ValueType target) {
        return new ConversionFailedException("value cannot be represented in " + target,
                LogMessageKeys.EXPECTED_TYPE, target,
                LogMessageKeys.ACTUAL_TYPE, type,
                LogMessageKeys.VALUE, this);
    }

    @Nonnull
    private static String decodeUtf8(@Nonnull byte[] bytes) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new ConversionFailedException("blob is not valid UTF-8",
                    LogMessageKeys.EXPECTED_TYPE, ValueType.TEXT,
                    LogMessageKeys.ACTUAL_TYPE, ValueType.BLOB);
        }
    }

    /**
     * Whether the value counts as true in a boolean context. {@code NULL}, {@code false}, zero and empty text,
     * blobs, arrays and documents are false; everything else is true.
     * @return the truthiness of this value
     */
    public boolean isTruthy() {
        switch (type) {
            case NULL:
                return false;
            case BOOL:
                return (Boolean) value;
            case INT8:
            case INT16:
            case INT32:
            case INT64:
                return (Long) value != 0L;
            case FLOAT64:
                return (Double) value != 0.0;
            case TEXT:
                return !((String) value).isEmpty();
            case BLOB:
                return ((byte[]) value).length > 0;
            case ARRAY:
                return !asArray().isEmpty();
            case DOCUMENT:
                return !Documents.fieldNames(asDocument()).isEmpty();
            default:
                throw new IllegalStateException("unknown type " + type);
        }
    }

    /**
     * Query equality: numbers are equal across types when numerically equal, {@code NULL} equals only
     * {@code NULL}, and values of unrelated types are never equal.
     * @param other the value to compare with
     * @return whether the two values are equal
     */
    public boolean isEqualTo(@Nonnull Value other) {
        if (isNull() || other.isNull()) {
            return isNull() && other.isNull();
        }
        if (type == ValueType.DOCUMENT && other.type == ValueType.DOCUMENT) {
            return Documents.equal(asDocument(), other.asDocument());
        }
        if (type == ValueType.ARRAY && other.type == ValueType.ARRAY) {
            final List<Value> left = asArray();
            final List<Value> right = other.asArray();
            if (left.size() != right.size()) {
                return false;
            }
            for (int i = 0; i < left.size(); i++) {
                if (!left.get(i).isEqualTo(right.get(i))) {
                    return false;
                }
            }
            return true;
        }
        final Integer cmp = compareWith(other);
        return cmp != null && cmp == 0;
    }

    /**
     * Query ordering between two values.
     * @param other the value to compare with
     * @return a negative, zero or positive number, or {@code null} if the two values are not ordered with
     * respect to each other
     */
    @Nullable
    public Integer compareWith(@Nonnull Value other) {
        if (isNumber() && other.isNumber()) {
            if (isInteger() && other.isInteger()) {
                return Long.compare((Long) value, (Long) other.value);
            }
            return Double.compare(asDouble(), other.asDouble());
        }
        if (type != other.type) {
            return null;
        }
        switch (type) {
            case BOOL:
                return Boolean.compare((Boolean) value, (Boolean) other.value);
            case TEXT:
                return ((String) value).compareTo((String) other.value);
            case BLOB:
                return UnsignedBytes.lexicographicalComparator().compare((byte[]) value, (byte[]) other.value);
            case ARRAY:
                final List<Value> left = asArray();
                final List<Value> right = other.asArray();
                for (int i = 0; i < Math.min(left.size(), right.size()); i++) {
                    final Integer cmp = left.get(i).compareWith(right.get(i));
                    if (cmp == null || cmp != 0) {
                        return cmp;
                    }
                }
                return Integer.compare(left.size(), right.size());
            default:
                return null;
        }
    }

    /**
     * Get the position of this value's type family in {@link #SORT_ORDER}. All numbers share one rank.
     * @return the sort rank
     */
    public int getSortRank() {
        switch (type) {
            case NULL:
                return 0;
            case BOOL:
                return 1;
            case INT8:
            case INT16:
            case INT32:
            case INT64:
            case FLOAT64:
                return 2;
            case TEXT:
                return 3;
            case BLOB:
                return 4;
            case ARRAY:
                return 5;
            default:
                return 6;
        }
    }

    private static int sortCompare(@Nonnull Value a, @Nonnull Value b) {
        final int rank = Integer.compare(a.getSortRank(), b.getSortRank());
        if (rank != 0) {
            return rank;
        }
        if (a.type == ValueType.ARRAY) {
            final List<Value> left = a.asArray();
            final List<Value> right = b.asArray();
            for (int i = 0; i < Math.min(left.size(), right.size()); i++) {
                final int cmp = sortCompare(left.get(i), right.get(i));
                if (cmp != 0) {
                    return cmp;
                }
            }
            return Integer.compare(left.size(), right.size());
        }
        final Integer cmp = a.compareWith(b);
        return cmp == null ? 0 : cmp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final Value other = (Value) o;
        if (type != other.type) {
            return false;
        }
        switch (type) {
            case BLOB:
                return Arrays.equals((byte[]) value, (byte[]) other.value);
            case DOCUMENT:
                return Documents.toMap(asDocument()).equals(Documents.toMap(other.asDocument()));
            default:
                return Objects.equals(value, other.value);
        }
    }

    @Override
    public int hashCode() {
        switch (type) {
            case BLOB:
                return Arrays.hashCode((byte[]) value);
            case DOCUMENT:
                return Documents.toMap(asDocument()).hashCode();
            default:
                return Objects.hash(type, value);
        }
    }

    @Override
    public String toString() {
        switch (type) {
            case NULL:
                return "NULL";
            case TEXT:
                return '"' + ((String) value).replace("\"", "\\\"") + '"';
            case BLOB:
                return "\\x" + BaseEncoding.base16().lowerCase().encode((byte[]) value);
            case DOCUMENT:
                return Documents.toString(asDocument());
            default:
                return String.valueOf(value);
        }
    }
}
