/*
 * ValueTest.java
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

import io.quarry.db.ConversionFailedException;
import io.quarry.db.TypeMismatchException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link Value} conversions and comparisons.
 */
public class ValueTest {

    @Test
    public void ofPicksTypes() {
        assertEquals(ValueType.NULL, Value.of(null).getType());
        assertEquals(ValueType.BOOL, Value.of(true).getType());
        assertEquals(ValueType.INT8, Value.of((byte) 1).getType());
        assertEquals(ValueType.INT16, Value.of((short) 1).getType());
        assertEquals(ValueType.INT32, Value.of(1).getType());
        assertEquals(ValueType.INT64, Value.of(1L).getType());
        assertEquals(ValueType.FLOAT64, Value.of(1.5f).getType());
        assertEquals(ValueType.TEXT, Value.of("a").getType());
        assertEquals(ValueType.BLOB, Value.of(new byte[] {1}).getType());
        assertEquals(ValueType.ARRAY, Value.of(Arrays.asList(1, "a")).getType());
        assertEquals(ValueType.DOCUMENT, Value.of(FieldBuffer.of("a", 1)).getType());
    }

    @Test
    public void integerNarrowing() {
        assertEquals(100, Value.ofInt64(100).convertToInt());
        assertEquals(ValueType.INT8, Value.ofInt64(100).convertTo(ValueType.INT8).getType());
        assertThrows(ConversionFailedException.class, () -> Value.ofInt64(300).convertTo(ValueType.INT8));
        assertThrows(ConversionFailedException.class, () -> Value.ofInt64(1L << 40).convertToInt());
    }

    @Test
    public void floatToInteger() {
        assertEquals(3, Value.ofDouble(3.0).convertToInt());
        assertThrows(ConversionFailedException.class, () -> Value.ofDouble(3.5).convertToInt());
        assertThrows(ConversionFailedException.class, () -> Value.ofDouble(Double.NaN).convertToLong());
        assertThrows(ConversionFailedException.class, () -> Value.ofDouble(1e300).convertToLong());
    }

    @Test
    public void integerToFloat() {
        assertEquals(7.0, Value.ofInt32(7).convertToDouble());
        assertThrows(ConversionFailedException.class, () -> Value.ofInt64(Long.MAX_VALUE).convertToDouble());
    }

    @Test
    public void textAndBlob() {
        assertArrayEquals(new byte[] {'h', 'i'}, Value.ofText("hi").convertTo(ValueType.BLOB).asBlob());
        assertEquals("hi", Value.ofBlob(new byte[] {'h', 'i'}).convertTo(ValueType.TEXT).asText());
        assertThrows(ConversionFailedException.class,
                () -> Value.ofBlob(new byte[] {(byte) 0xff, (byte) 0xfe}).convertTo(ValueType.TEXT));
    }

    @ParameterizedTest
    @ValueSource(strings = {"TEXT", "BOOL", "NULL"})
    public void nonNumbersDoNotBecomeNumbers(String typeName) {
        final Value value;
        switch (ValueType.valueOf(typeName)) {
            case TEXT:
                value = Value.ofText("10");
                break;
            case BOOL:
                value = Value.TRUE;
                break;
            default:
                value = Value.NULL;
                break;
        }
        assertThrows(TypeMismatchException.class, value::convertToInt);
        assertThrows(TypeMismatchException.class, () -> value.convertTo(ValueType.FLOAT64));
    }

    @Test
    public void numbersCompareAcrossWidths() {
        assertTrue(Value.ofInt8((byte) 5).isEqualTo(Value.ofInt64(5)));
        assertTrue(Value.ofInt32(5).isEqualTo(Value.ofDouble(5.0)));
        assertEquals(-1, Integer.signum(Value.ofInt32(5).compareWith(Value.ofDouble(5.5))));
        assertFalse(Value.ofInt32(5).equals(Value.ofInt64(5)));
    }

    @Test
    public void nullEqualsOnlyNull() {
        assertTrue(Value.NULL.isEqualTo(Value.NULL));
        assertFalse(Value.NULL.isEqualTo(Value.ofInt32(0)));
        assertFalse(Value.ofText("").isEqualTo(Value.NULL));
    }

    @Test
    public void unrelatedTypesAreUnordered() {
        assertNull(Value.ofText("1").compareWith(Value.ofInt32(1)));
        assertFalse(Value.ofText("1").isEqualTo(Value.ofInt32(1)));
        assertNull(Value.TRUE.compareWith(Value.ofInt32(1)));
    }

    @Test
    public void documentsCompareByContent() {
        Value a = Value.ofDocument(FieldBuffer.of("x", 1, "y", "b"));
        Value b = Value.ofDocument(FieldBuffer.of("x", 1L, "y", "b"));
        assertTrue(a.isEqualTo(b));
        assertFalse(a.isEqualTo(Value.ofDocument(FieldBuffer.of("x", 1))));
    }

    @Test
    public void truthiness() {
        assertFalse(Value.NULL.isTruthy());
        assertFalse(Value.ofInt32(0).isTruthy());
        assertFalse(Value.ofText("").isTruthy());
        assertTrue(Value.ofDouble(0.1).isTruthy());
        assertTrue(Value.ofText("no").isTruthy());
    }

    @Test
    public void sortOrderRanksTypes() {
        List<Value> values = new ArrayList<>(Arrays.asList(
                Value.ofText("b"), Value.ofInt32(2), Value.NULL, Value.ofDouble(1.5),
                Value.TRUE, Value.ofText("a"), Value.FALSE));
        values.sort(Value.SORT_ORDER);
        assertThat(values, contains(Value.NULL, Value.FALSE, Value.TRUE, Value.ofDouble(1.5), Value.ofInt32(2),
                Value.ofText("a"), Value.ofText("b")));
    }
}
