/*
 * DocumentCodecTest.java
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

import com.apple.foundationdb.tuple.ByteArrayUtil;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link DocumentCodec}.
 */
public class DocumentCodecTest {

    @Test
    public void encodedDocumentKeepsTypesAndOrder() {
        FieldBuffer doc = FieldBuffer.of(
                "small", (byte) 3,
                "big", 1L << 40,
                "ratio", 0.25,
                "name", "ada",
                "raw", new byte[] {0, 1, 2},
                "none", null,
                "flags", Arrays.asList(true, false),
                "inner", FieldBuffer.of("x", 1));
        Document decoded = new EncodedDocument(new byte[] {1}, DocumentCodec.encode(doc));
        assertEquals(Documents.fieldNames(doc), Documents.fieldNames(decoded));
        assertEquals(ValueType.INT8, decoded.getByField("small").getType());
        assertEquals(ValueType.INT64, decoded.getByField("big").getType());
        assertEquals(ValueType.NULL, decoded.getByField("none").getType());
        assertTrue(Documents.equal(doc, decoded));
    }

    @Test
    public void sortKeysFollowValueOrder() {
        List<Value> values = Arrays.asList(
                Value.NULL, Value.FALSE, Value.TRUE,
                Value.ofInt64(-1000), Value.ofDouble(-0.5), Value.ofInt32(0), Value.ofDouble(0.5),
                Value.ofInt8((byte) 7), Value.ofInt64(1L << 40),
                Value.ofText(""), Value.ofText("a"), Value.ofText("ab"), Value.ofText("b"),
                Value.ofBlob(new byte[] {0}), Value.ofBlob(new byte[] {(byte) 0xff}));
        List<byte[]> keys = new ArrayList<>();
        for (Value value : values) {
            keys.add(DocumentCodec.encodeSortKey(value).pack());
        }
        List<byte[]> sorted = new ArrayList<>(keys);
        sorted.sort(ByteArrayUtil::compareUnsigned);
        assertEquals(keys, sorted);
    }

    @Test
    public void equalNumbersShareSortKey() {
        Comparator<byte[]> bytes = ByteArrayUtil::compareUnsigned;
        assertEquals(0, bytes.compare(
                DocumentCodec.encodeSortKey(Value.ofInt32(3)).pack(),
                DocumentCodec.encodeSortKey(Value.ofDouble(3.0)).pack()));
        assertEquals(0, bytes.compare(
                DocumentCodec.encodeSortKey(Value.ofDouble(-0.0)).pack(),
                DocumentCodec.encodeSortKey(Value.ofInt64(0)).pack()));
    }
}
