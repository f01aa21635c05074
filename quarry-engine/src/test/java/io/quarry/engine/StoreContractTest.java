/*
 * StoreContractTest.java
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

package io.quarry.engine;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.not;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Behavior every {@link StorageEngine} must share. Each backend runs these through a subclass.
 */
public abstract class StoreContractTest {
    protected static final String STORE = "contract";

    protected StorageEngine engine;

    @Nonnull
    protected abstract StorageEngine createEngine();

    @BeforeEach
    public void openEngine() {
        engine = createEngine();
        try (EngineTransaction tx = engine.begin(true)) {
            tx.createStore(STORE);
            tx.commit();
        }
    }

    @AfterEach
    public void closeEngine() {
        if (engine != null) {
            engine.close();
        }
    }

    protected static byte[] key(int k) {
        return new byte[] {(byte) k};
    }

    protected static byte[] value(String v) {
        return v.getBytes(java.nio.charset.StandardCharsets.UTF_8);
    }

    private void putAll(int... keys) {
        try (EngineTransaction tx = engine.begin(true)) {
            Store store = tx.getStore(STORE);
            for (int k : keys) {
                store.put(key(k), value("v" + k));
            }
            tx.commit();
        }
    }

    @Nonnull
    private static List<Integer> drain(@Nonnull StoreIterator it) {
        List<Integer> keys = new ArrayList<>();
        while (it.isValid()) {
            keys.add((int) it.getItem().getKey()[0]);
            it.next();
        }
        return keys;
    }

    @Test
    public void readOnlyRejectsMutations() {
        putAll(1, 2);
        try (EngineTransaction tx = engine.begin(false)) {
            Store store = tx.getStore(STORE);
            assertThrows(ReadOnlyTransactionException.class, () -> store.put(key(3), value("v3")));
            assertThrows(ReadOnlyTransactionException.class, () -> store.delete(key(1)));
            assertThrows(ReadOnlyTransactionException.class, store::truncate);
            assertThrows(ReadOnlyTransactionException.class, store::nextSequence);
            assertThrows(ReadOnlyTransactionException.class, () -> tx.createStore("other"));
            assertArrayEquals(value("v1"), store.get(key(1)));
            assertArrayEquals(value("v2"), store.get(key(2)));
            assertThrows(KeyNotFoundException.class, () -> store.get(key(3)));
        }
    }

    @Test
    public void getPutDelete() {
        try (EngineTransaction tx = engine.begin(true)) {
            Store store = tx.getStore(STORE);
            assertThrows(KeyNotFoundException.class, () -> store.get(key(9)));
            store.put(key(9), value("nine"));
            assertArrayEquals(value("nine"), store.get(key(9)));
            store.put(key(9), value("NINE"));
            assertArrayEquals(value("NINE"), store.get(key(9)));
            store.delete(key(9));
            assertThrows(KeyNotFoundException.class, () -> store.get(key(9)));
            assertThrows(KeyNotFoundException.class, () -> store.delete(key(9)));
            tx.commit();
        }
    }

    @Test
    public void rollbackDiscardsWrites() {
        putAll(1);
        try (EngineTransaction tx = engine.begin(true)) {
            Store store = tx.getStore(STORE);
            store.put(key(2), value("v2"));
            store.delete(key(1));
            tx.rollback();
        }
        try (EngineTransaction tx = engine.begin(false)) {
            Store store = tx.getStore(STORE);
            assertArrayEquals(value("v1"), store.get(key(1)));
            assertThrows(KeyNotFoundException.class, () -> store.get(key(2)));
        }
    }

    @Test
    public void truncateKeepsStoreUsable() {
        putAll(1, 2, 3);
        try (EngineTransaction tx = engine.begin(true)) {
            Store store = tx.getStore(STORE);
            store.truncate();
            for (int k = 1; k <= 3; k++) {
                final byte[] key = key(k);
                assertThrows(KeyNotFoundException.class, () -> store.get(key));
            }
            store.put(key(4), value("v4"));
            assertArrayEquals(value("v4"), store.get(key(4)));
            tx.commit();
        }
        try (EngineTransaction tx = engine.begin(false);
                StoreIterator it = tx.getStore(STORE).iterator(IteratorOptions.FORWARD)) {
            it.seek(new byte[0]);
            assertThat(drain(it), contains(4));
        }
    }

    @Test
    public void sequenceIsStrictlyIncreasing() {
        try (EngineTransaction tx = engine.begin(true)) {
            Store store = tx.getStore(STORE);
            for (long i = 1; i <= 20; i++) {
                assertEquals(i, store.nextSequence());
                store.put(key((int) i), value("x"));
                store.get(key((int) i));
            }
            tx.commit();
        }
        try (EngineTransaction tx = engine.begin(true)) {
            assertEquals(21L, tx.getStore(STORE).nextSequence());
            tx.commit();
        }
    }

    @Test
    public void sequenceSurvivesTruncate() {
        try (EngineTransaction tx = engine.begin(true)) {
            Store store = tx.getStore(STORE);
            assertEquals(1L, store.nextSequence());
            assertEquals(2L, store.nextSequence());
            store.truncate();
            assertEquals(3L, store.nextSequence());
            tx.commit();
        }
    }

    @Test
    public void forwardSeek() {
        putAll(1, 3, 5, 7);
        try (EngineTransaction tx = engine.begin(false);
                StoreIterator it = tx.getStore(STORE).iterator(IteratorOptions.FORWARD)) {
            it.seek(new byte[0]);
            assertThat(drain(it), contains(1, 3, 5, 7));
            it.seek(key(4));
            assertThat(drain(it), contains(5, 7));
            it.seek(key(5));
            assertThat(drain(it), contains(5, 7));
            it.seek(key(8));
            assertFalse(it.isValid());
            assertNull(it.getError());
        }
    }

    @Test
    public void reverseSeek() {
        putAll(1, 3, 5, 7);
        try (EngineTransaction tx = engine.begin(false);
                StoreIterator it = tx.getStore(STORE).iterator(IteratorOptions.REVERSE)) {
            it.seek(key(6));
            assertTrue(it.isValid());
            assertArrayEquals(key(5), it.getItem().getKey());

            it.seek(key(5));
            assertArrayEquals(key(5), it.getItem().getKey());

            it.seek(new byte[0]);
            assertArrayEquals(key(7), it.getItem().getKey());
            assertThat(drain(it), contains(7, 5, 3, 1));

            it.seek(key(0));
            assertFalse(it.isValid());
            assertNull(it.getError());

            it.seek(key(9));
            assertFalse(it.isValid());
            assertNull(it.getError());
        }
    }

    @Test
    public void reverseSeekOnEmptyStore() {
        try (EngineTransaction tx = engine.begin(false);
                StoreIterator it = tx.getStore(STORE).iterator(IteratorOptions.REVERSE)) {
            it.seek(new byte[0]);
            assertFalse(it.isValid());
            it.seek(key(3));
            assertFalse(it.isValid());
        }
    }

    @Test
    public void keysOrderedAsUnsignedBytes() {
        putAll(0x7f, 0x80, 0xff, 0x01);
        try (EngineTransaction tx = engine.begin(false);
                StoreIterator it = tx.getStore(STORE).iterator(IteratorOptions.FORWARD)) {
            it.seek(new byte[0]);
            List<Integer> keys = new ArrayList<>();
            while (it.isValid()) {
                keys.add(it.getItem().getKey()[0] & 0xff);
                it.next();
            }
            assertThat(keys, contains(0x01, 0x7f, 0x80, 0xff));
        }
    }

    @Test
    public void cancellationStopsEveryOperation() {
        putAll(1, 2, 3);
        CancellationToken token = CancellationToken.create();
        try (EngineTransaction tx = engine.begin(true, token)) {
            Store store = tx.getStore(STORE);
            StoreIterator it = store.iterator(IteratorOptions.FORWARD);
            it.seek(new byte[0]);
            assertTrue(it.isValid());

            token.cancel();
            assertThrows(OperationCancelledException.class, () -> store.get(key(1)));
            assertThrows(OperationCancelledException.class, () -> store.put(key(4), value("v4")));
            assertThrows(OperationCancelledException.class, () -> store.delete(key(1)));
            assertThrows(OperationCancelledException.class, store::truncate);
            assertThrows(OperationCancelledException.class, store::nextSequence);
            assertThrows(OperationCancelledException.class, () -> store.iterator(IteratorOptions.FORWARD));

            it.next();
            assertFalse(it.isValid());
            assertThat(it.getError(), instanceOf(OperationCancelledException.class));
            it.seek(new byte[0]);
            assertFalse(it.isValid());
            it.close();
            it.close();
        }
        try (EngineTransaction tx = engine.begin(false)) {
            assertArrayEquals(value("v1"), tx.getStore(STORE).get(key(1)));
        }
    }

    @Test
    public void cancelledTokenCheckedBeforeReadOnly() {
        CancellationToken token = CancellationToken.create();
        try (EngineTransaction tx = engine.begin(false, token)) {
            Store store = tx.getStore(STORE);
            token.cancel();
            assertThrows(OperationCancelledException.class, () -> store.put(key(1), value("v1")));
        }
    }

    @Test
    public void storeInvalidAfterCommit() {
        EngineTransaction tx = engine.begin(true);
        Store store = tx.getStore(STORE);
        store.put(key(1), value("v1"));
        tx.commit();
        assertThrows(TransactionClosedException.class, () -> store.get(key(1)));
        assertThrows(TransactionClosedException.class, tx::commit);
        tx.close();
    }

    @Test
    public void storeCatalog() {
        try (EngineTransaction tx = engine.begin(true)) {
            assertThrows(StoreAlreadyExistsException.class, () -> tx.createStore(STORE));
            assertThrows(StoreNotFoundException.class, () -> tx.getStore("missing"));
            tx.createStore("second");
            assertThat(tx.listStores(), hasItem("second"));
            tx.getStore("second").put(key(1), value("v1"));
            tx.commit();
        }
        try (EngineTransaction tx = engine.begin(true)) {
            tx.dropStore("second");
            assertThrows(StoreNotFoundException.class, () -> tx.getStore("second"));
            assertThrows(StoreNotFoundException.class, () -> tx.dropStore("second"));
            assertThat(tx.listStores(), not(hasItem("second")));
            tx.commit();
        }
        try (EngineTransaction tx = engine.begin(true)) {
            tx.createStore("second");
            try (StoreIterator it = tx.getStore("second").iterator(IteratorOptions.FORWARD)) {
                it.seek(new byte[0]);
                assertThat(drain(it), empty());
            }
        }
    }
}
