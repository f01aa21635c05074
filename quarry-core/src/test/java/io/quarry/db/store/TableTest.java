/*
 * TableTest.java
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

package io.quarry.db.store;

import io.quarry.db.Database;
import io.quarry.db.DocumentNotFoundException;
import io.quarry.db.DuplicateDocumentException;
import io.quarry.db.IndexAlreadyExistsException;
import io.quarry.db.IndexNotFoundException;
import io.quarry.db.QuarryArgumentException;
import io.quarry.db.TableAlreadyExistsException;
import io.quarry.db.TableNotFoundException;
import io.quarry.db.Transaction;
import io.quarry.db.cursors.Cursor;
import io.quarry.db.document.Document;
import io.quarry.db.document.FieldBuffer;
import io.quarry.db.document.Value;
import io.quarry.engine.memory.MemoryEngine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link Table}, {@link Index} and {@link Catalog}.
 */
public class TableTest {
    private Database database;
    private Transaction tx;

    @BeforeEach
    public void setUp() {
        database = new Database(new MemoryEngine());
        tx = database.begin(true);
    }

    @AfterEach
    public void tearDown() {
        tx.close();
        database.close();
    }

    private static List<Value> values(Cursor<? extends Document> cursor, String field) {
        final List<Value> values = new ArrayList<>();
        try (Cursor<? extends Document> c = cursor) {
            c.forEach(document -> values.add(document.getByField(field)));
        }
        return values;
    }

    private static List<Value> ints(int... ints) {
        final List<Value> values = new ArrayList<>();
        for (int i : ints) {
            values.add(Value.ofInt32(i));
        }
        return values;
    }

    @Test
    public void insertGetDelete() {
        Table table = tx.createTable("test");
        byte[] first = table.insert(FieldBuffer.of("a", 1));
        byte[] second = table.insert(FieldBuffer.of("a", 2));
        assertEquals(1L, Table.decodeSequenceKey(first));
        assertEquals(2L, Table.decodeSequenceKey(second));
        assertEquals(Value.ofInt32(2), table.get(second).getByField("a"));

        table.delete(first);
        assertThrows(DocumentNotFoundException.class, () -> table.get(first));
        assertThrows(DocumentNotFoundException.class, () -> table.delete(first));
        assertEquals(1, table.stream().count());
    }

    @Test
    public void replace() {
        Table table = tx.createTable("test");
        byte[] key = table.insert(FieldBuffer.of("a", 1));
        table.replace(key, FieldBuffer.of("a", 5, "b", "x"));
        assertEquals(Value.ofInt32(5), table.get(key).getByField("a"));
        assertEquals(Value.ofText("x"), table.get(key).getByField("b"));
        assertThrows(DocumentNotFoundException.class,
                () -> table.replace(Table.encodeSequenceKey(42), FieldBuffer.of("a", 1)));
    }

    @Test
    public void truncateKeepsSequence() {
        Table table = tx.createTable("test");
        table.insert(FieldBuffer.of("a", 1));
        table.insert(FieldBuffer.of("a", 2));
        table.truncate();
        assertEquals(0, table.stream().count());
        assertEquals(3L, Table.decodeSequenceKey(table.insert(FieldBuffer.of("a", 3))));
    }

    @Test
    public void primaryKey() {
        Table table = tx.createTable("users", TableConfig.newBuilder().setPrimaryKey("id").build());
        byte[] key = table.insert(FieldBuffer.of("id", 10, "name", "ada"));
        assertEquals(Value.ofText("ada"), table.get(Table.encodePrimaryKey(Value.ofInt64(10))).getByField("name"));

        assertThrows(DuplicateDocumentException.class, () -> table.insert(FieldBuffer.of("id", 10.0)));
        assertThrows(QuarryArgumentException.class, () -> table.insert(FieldBuffer.of("name", "bob")));
        assertThrows(QuarryArgumentException.class, () -> table.replace(key, FieldBuffer.of("id", 11)));
        table.replace(key, FieldBuffer.of("id", 10, "name", "grace"));
        assertEquals(Value.ofText("grace"), table.get(key).getByField("name"));
    }

    @Test
    public void primaryKeyOrder() {
        Table table = tx.createTable("users", TableConfig.newBuilder().setPrimaryKey("id").build());
        for (int id : new int[] {5, -3, 12, 0, 7}) {
            table.insert(FieldBuffer.of("id", id));
        }
        assertEquals(ints(-3, 0, 5, 7, 12), values(table.scanPrimaryKey(ScanRange.ALL, false), "id"));
        assertEquals(ints(7, 5, 0),
                values(table.scanPrimaryKey(ScanRange.between(Value.ofInt32(0), Value.ofInt32(7)), true), "id"));
        assertEquals(ints(7, 12), values(table.scanPrimaryKey(ScanRange.atLeast(Value.ofDouble(5.5)), false), "id"));
    }

    @Test
    public void indexesFollowMutations() {
        Table table = tx.createTable("test");
        Index index = tx.createIndex(IndexConfig.newBuilder()
                .setIndexName("idx_age").setTableName("test").setPath("age").build());
        byte[] a = table.insert(FieldBuffer.of("age", 30));
        table.insert(FieldBuffer.of("age", 10));
        table.insert(FieldBuffer.of("name", "no age"));
        byte[] d = table.insert(FieldBuffer.of("age", 20));

        assertEquals(ints(10, 20, 30),
                values(table.scanIndex(index, ScanRange.atLeast(Value.ofInt32(0)), false), "age"));

        table.replace(a, FieldBuffer.of("age", 5));
        table.delete(d);
        assertEquals(ints(10, 5), values(table.scanIndex(index, ScanRange.atLeast(Value.ofInt32(0)), true), "age"));
        assertThat(values(table.scanIndex(index, ScanRange.exactly(Value.NULL), false), "name"),
                contains(Value.ofText("no age")));
    }

    @Test
    public void indexIsBuiltFromExistingDocuments() {
        Table table = tx.createTable("test");
        table.insert(FieldBuffer.of("age", 2));
        table.insert(FieldBuffer.of("age", 1));
        Index index = tx.createIndex(IndexConfig.newBuilder()
                .setIndexName("idx_age").setTableName("test").setPath("age").build());
        assertEquals(ints(1, 2), values(table.scanIndex(index, ScanRange.ALL, false), "age"));
        assertThrows(IndexAlreadyExistsException.class, () -> tx.createIndex(IndexConfig.newBuilder()
                .setIndexName("idx_age").setTableName("test").setPath("other").build()));
    }

    @Test
    public void uniqueIndex() {
        Table table = tx.createTable("test");
        tx.createIndex(IndexConfig.newBuilder()
                .setIndexName("idx_email").setTableName("test").setPath("email").setUnique(true).build());
        byte[] key = table.insert(FieldBuffer.of("email", "a@example.com"));
        table.insert(FieldBuffer.of("email", "b@example.com"));
        assertThrows(DuplicateDocumentException.class, () -> table.insert(FieldBuffer.of("email", "a@example.com")));
        assertThrows(DuplicateDocumentException.class, () -> table.replace(key, FieldBuffer.of("email", "b@example.com")));
        // a rejected write leaves nothing behind
        assertEquals(2, table.stream().count());
        assertEquals(Value.ofText("a@example.com"), table.get(key).getByField("email"));

        // the same document may keep its own value
        table.replace(key, FieldBuffer.of("email", "a@example.com", "verified", true));

        table.insert(FieldBuffer.of("name", "no email"));
        table.insert(FieldBuffer.of("name", "no email either"));
        assertEquals(4, table.stream().count());
    }

    @Test
    public void uniqueIndexCannotBeBuiltOverDuplicates() {
        Table table = tx.createTable("test");
        table.insert(FieldBuffer.of("v", 1));
        table.insert(FieldBuffer.of("v", 1));
        assertThrows(DuplicateDocumentException.class, () -> tx.createIndex(IndexConfig.newBuilder()
                .setIndexName("idx_v").setTableName("test").setPath("v").setUnique(true).build()));
    }

    @Test
    public void reIndex() {
        Table table = tx.createTable("test");
        tx.createIndex(IndexConfig.newBuilder().setIndexName("idx_a").setTableName("test").setPath("a").build());
        table.insert(FieldBuffer.of("a", 2));
        table.insert(FieldBuffer.of("a", 1));
        tx.reIndex("idx_a");
        tx.reIndexAll();
        Index index = table.getIndex("idx_a");
        assertEquals(ints(1, 2), values(table.scanIndex(index, ScanRange.ALL, false), "a"));
        assertThrows(IndexNotFoundException.class, () -> tx.reIndex("nope"));
    }

    @Test
    public void catalog() {
        tx.createTable("b");
        tx.createTable("a", TableConfig.newBuilder().setPrimaryKey("x.y").build());
        assertThrows(TableAlreadyExistsException.class, () -> tx.createTable("a"));
        assertThat(tx.listTables(), contains("a", "b"));
        assertEquals(TableConfig.newBuilder().setPrimaryKey("x.y").build(), tx.getTable("a").getConfig());

        tx.createIndex(IndexConfig.newBuilder().setIndexName("idx_b").setTableName("b").setPath("f").build());
        tx.createIndex(IndexConfig.newBuilder().setIndexName("idx_a").setTableName("a").setPath("f").build());
        assertEquals(2, tx.listIndexes().size());
        assertThat(tx.listIndexes("a"), contains(tx.getIndex("idx_a").getConfig()));
        assertThrows(IndexNotFoundException.class, () -> tx.getTable("a").getIndex("idx_b"));

        tx.dropTable("b");
        assertThat(tx.listTables(), contains("a"));
        assertThrows(IndexNotFoundException.class, () -> tx.getIndex("idx_b"));
        assertThrows(TableNotFoundException.class, () -> tx.getTable("b"));
        assertThrows(TableNotFoundException.class, () -> tx.dropTable("b"));
        assertThrows(TableNotFoundException.class, () -> tx.createIndex(IndexConfig.newBuilder()
                .setIndexName("idx_c").setTableName("c").setPath("f").build()));

        tx.dropIndex("idx_a");
        assertThat(tx.listIndexes(), empty());
        assertThrows(IndexNotFoundException.class, () -> tx.dropIndex("idx_a"));
    }

    @Test
    public void catalogSurvivesCommit() {
        tx.createTable("test", TableConfig.newBuilder().setPrimaryKey("id").build())
                .insert(FieldBuffer.of("id", 1));
        tx.commit();
        tx.close();

        tx = database.begin(false);
        Table table = tx.getTable("test");
        assertEquals("id", table.getConfig().getPrimaryKey().toString());
        assertEquals(1, table.stream().count());
    }
}
