/*
 * MemoryStoreTest.java
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

package io.quarry.engine.memory;

import io.quarry.engine.EngineTransaction;
import io.quarry.engine.IteratorOptions;
import io.quarry.engine.KeyNotFoundException;
import io.quarry.engine.StorageEngine;
import io.quarry.engine.Store;
import io.quarry.engine.StoreContractTest;
import io.quarry.engine.StoreIterator;
import org.junit.jupiter.api.Test;

import javax.annotation.Nonnull;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link MemoryEngine}.
 */
public class MemoryStoreTest extends StoreContractTest {
    @Nonnull
    @Override
    protected StorageEngine createEngine() {
        return new MemoryEngine();
    }

    @Test
    public void readersSeeCommittedSnapshot() {
        EngineTransaction reader = engine.begin(false);
        Store before = reader.getStore(STORE);
        try (EngineTransaction writer = engine.begin(true)) {
            writer.getStore(STORE).put(key(1), value("v1"));
            assertThrows(KeyNotFoundException.class, () -> before.get(key(1)));
            writer.commit();
        }
        assertThrows(KeyNotFoundException.class, () -> before.get(key(1)));
        reader.close();
        try (EngineTransaction after = engine.begin(false)) {
            assertArrayEquals(value("v1"), after.getStore(STORE).get(key(1)));
        }
    }

    @Test
    public void mutationDuringIteration() {
        try (EngineTransaction tx = engine.begin(true)) {
            Store store = tx.getStore(STORE);
            for (int k = 1; k <= 5; k++) {
                store.put(key(k), value("v" + k));
            }
            try (StoreIterator it = store.iterator(IteratorOptions.FORWARD)) {
                it.seek(new byte[0]);
                int seen = 0;
                while (it.isValid()) {
                    store.delete(it.getItem().getKey());
                    seen++;
                    it.next();
                }
                assertEquals(5, seen);
            }
            try (StoreIterator it = store.iterator(IteratorOptions.FORWARD)) {
                it.seek(new byte[0]);
                assertFalse(it.isValid());
            }
        }
    }

    @Test
    public void returnedValuesAreCopies() {
        try (EngineTransaction tx = engine.begin(true)) {
            Store store = tx.getStore(STORE);
            byte[] v = value("abc");
            store.put(key(1), v);
            v[0] = 'z';
            byte[] read = store.get(key(1));
            read[1] = 'z';
            assertArrayEquals(value("abc"), store.get(key(1)));
        }
    }
}
