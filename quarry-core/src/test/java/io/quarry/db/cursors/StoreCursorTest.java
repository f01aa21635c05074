/*
 * StoreCursorTest.java
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

package io.quarry.db.cursors;

import io.quarry.engine.CancellationToken;
import io.quarry.engine.EngineTransaction;
import io.quarry.engine.OperationCancelledException;
import io.quarry.engine.StorageEngine;
import io.quarry.engine.Store;
import io.quarry.engine.StoreItem;
import io.quarry.engine.memory.MemoryEngine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link StoreCursor}.
 */
public class StoreCursorTest {
    private StorageEngine engine;
    private EngineTransaction tx;
    private Store store;

    @BeforeEach
    public void setUp() {
        engine = new MemoryEngine();
        tx = engine.begin(true);
        tx.createStore("s");
        store = tx.getStore("s");
        for (int k = 1; k <= 9; k += 2) {
            store.put(new byte[] {(byte) k}, new byte[] {(byte) (k * 10)});
        }
    }

    @AfterEach
    public void tearDown() {
        tx.close();
        engine.close();
    }

    private static List<Integer> keys(@Nullable byte[] low, @Nullable byte[] high, boolean reverse, Store store) {
        List<Integer> keys = new ArrayList<>();
        try (StoreCursor cursor = new StoreCursor(store, low, high, reverse)) {
            cursor.forEach((StoreItem item) -> keys.add((int) item.getKey()[0]));
        }
        return keys;
    }

    private static byte[] key(int k) {
        return new byte[] {(byte) k};
    }

    @Test
    public void wholeStore() {
        assertThat(keys(null, null, false, store), contains(1, 3, 5, 7, 9));
        assertThat(keys(null, null, true, store), contains(9, 7, 5, 3, 1));
    }

    @Test
    public void forwardRange() {
        assertThat(keys(key(3), key(7), false, store), contains(3, 5));
        assertThat(keys(key(2), key(8), false, store), contains(3, 5, 7));
        assertThat(keys(key(4), key(5), false, store), empty());
    }

    @Test
    public void reverseRangeExcludesHigh() {
        assertThat(keys(key(3), key(7), true, store), contains(5, 3));
        assertThat(keys(key(2), key(8), true, store), contains(7, 5, 3));
        assertThat(keys(null, key(20), true, store), contains(9, 7, 5, 3, 1));
        assertThat(keys(key(6), null, true, store), contains(9, 7));
        assertThat(keys(null, key(1), true, store), empty());
    }

    @Test
    public void reverseRangeAboveLastKey() {
        assertThat(keys(key(4), key(20), true, store), contains(9, 7, 5));
        assertThat(keys(key(10), key(20), true, store), empty());
        assertThat(keys(null, key(0), true, store), empty());
    }

    @Test
    public void cancellationClosesTheCursor() {
        tx.commit();
        CancellationToken token = CancellationToken.create();
        try (EngineTransaction reader = engine.begin(false, token)) {
            StoreCursor cursor = StoreCursor.all(reader.getStore("s"), false);
            assertTrue(cursor.getNext().hasNext());
            token.cancel();
            assertThrows(OperationCancelledException.class, cursor::getNext);
            assertTrue(cursor.isClosed());
            assertFalse(cursor.getNext().hasNext());
        }
    }

    @Test
    public void closesItselfAtTheEnd() {
        StoreCursor cursor = new StoreCursor(store, key(7), null, false);
        assertTrue(cursor.getNext().hasNext());
        assertFalse(cursor.isClosed());
        assertTrue(cursor.getNext().hasNext());
        assertFalse(cursor.getNext().hasNext());
        assertTrue(cursor.isClosed());
        cursor.close();
    }
}
