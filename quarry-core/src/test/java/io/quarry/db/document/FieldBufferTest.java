/*
 * FieldBufferTest.java
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

import io.quarry.db.FieldNotFoundException;
import io.quarry.db.QuarryArgumentException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link FieldBuffer} and {@link FieldPath}.
 */
public class FieldBufferTest {

    private static FieldBuffer nested() {
        return FieldBuffer.of(
                "name", "ada",
                "address", FieldBuffer.of("city", "london", "zip", "N1"),
                "tags", Arrays.asList("a", "b", "c"));
    }

    @Test
    public void parsePath() {
        assertThat(FieldPath.parse("a.b.0").getSegments(), contains("a", "b", "0"));
        assertEquals("a.b.0", FieldPath.parse("a.b.0").toString());
        assertThrows(QuarryArgumentException.class, () -> FieldPath.parse(""));
        assertThrows(QuarryArgumentException.class, () -> FieldPath.parse("a..b"));
    }

    @Test
    public void getValueFollowsDocumentsAndArrays() {
        FieldBuffer doc = nested();
        assertEquals(Value.ofText("london"), FieldPath.parse("address.city").getValue(doc));
        assertEquals(Value.ofText("b"), FieldPath.parse("tags.1").getValue(doc));
        assertThrows(FieldNotFoundException.class, () -> FieldPath.parse("tags.3").getValue(doc));
        assertThrows(FieldNotFoundException.class, () -> FieldPath.parse("name.first").getValue(doc));
        assertThrows(FieldNotFoundException.class, () -> FieldPath.parse("age").getValue(doc));
    }

    @Test
    public void addKeepsPosition() {
        FieldBuffer doc = FieldBuffer.of("a", 1, "b", 2);
        doc.add("a", Value.ofInt32(10));
        assertThat(Documents.fieldNames(doc), contains("a", "b"));
        assertEquals(Value.ofInt32(10), doc.getByField("a"));
    }

    @Test
    public void setNested() {
        FieldBuffer doc = nested();
        doc.set(FieldPath.parse("address.city"), Value.ofText("paris"));
        doc.set(FieldPath.parse("tags.0"), Value.ofText("z"));
        doc.set(FieldPath.parse("age"), Value.ofInt32(36));
        assertEquals(Value.ofText("paris"), FieldPath.parse("address.city").getValue(doc));
        assertEquals(Value.ofText("z"), FieldPath.parse("tags.0").getValue(doc));
        assertEquals(Value.ofInt32(36), doc.getByField("age"));
        assertThrows(FieldNotFoundException.class,
                () -> doc.set(FieldPath.parse("missing.child"), Value.ofInt32(1)));
    }

    @Test
    public void deleteNested() {
        FieldBuffer doc = nested();
        doc.delete(FieldPath.parse("address.zip"));
        doc.delete(FieldPath.parse("tags.0"));
        doc.delete(FieldPath.parse("name"));
        assertThat(Documents.fieldNames(doc), contains("address", "tags"));
        assertThat(Documents.fieldNames(doc.getByField("address").asDocument()), contains("city"));
        assertEquals(2, doc.getByField("tags").asArray().size());
        assertThrows(FieldNotFoundException.class, () -> doc.delete(FieldPath.parse("name")));
    }

    @Test
    public void copyIsIndependent() {
        FieldBuffer original = FieldBuffer.of("a", 1);
        FieldBuffer copy = FieldBuffer.copyOf(original);
        copy.add("b", Value.ofInt32(2));
        assertEquals(1, original.size());
        assertEquals(2, copy.size());
    }
}
