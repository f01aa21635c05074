/*
 * MemoryIterator.java
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

import io.quarry.engine.StorageException;
import io.quarry.engine.StoreItem;
import io.quarry.engine.StoreIterator;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Map;
import java.util.NavigableMap;

/**
 * A {@link StoreIterator} over a {@link MemoryStore}. It navigates by key rather than holding a
 * {@link java.util.Iterator} of the map, so it tolerates the store being modified between steps.
 */
class MemoryIterator implements StoreIterator {
    @Nonnull
    private final MemoryStore store;
    private final boolean reverse;
    @Nullable
    private Map.Entry<byte[], byte[]> current;
    @Nullable
    private StorageException error;
    private boolean closed;

    MemoryIterator(@Nonnull MemoryStore store, boolean reverse) {
        this.store = store;
        this.reverse = reverse;
    }

    @Override
    public void seek(@Nonnull byte[] pivot) {
        if (closed || error != null) {
            return;
        }
        try {
            final NavigableMap<byte[], byte[]> data = store.currentData();
            if (!reverse) {
                current = pivot.length == 0 ? data.firstEntry() : data.ceilingEntry(pivot);
            } else if (pivot.length == 0) {
                current = data.lastEntry();
            } else {
                // no key at or after the pivot leaves the iterator unpositioned
                Map.Entry<byte[], byte[]> entry = data.ceilingEntry(pivot);
                while (entry != null && MemoryStoreState.KEY_ORDER.compare(entry.getKey(), pivot) > 0) {
                    entry = data.lowerEntry(entry.getKey());
                }
                current = entry;
            }
        } catch (StorageException e) {
            fail(e);
        }
    }

    @Override
    public void next() {
        if (!isValid()) {
            throw new IllegalStateException("iterator is not positioned on an item");
        }
        try {
            final NavigableMap<byte[], byte[]> data = store.currentData();
            final byte[] key = current.getKey();
            current = reverse ? data.lowerEntry(key) : data.higherEntry(key);
        } catch (StorageException e) {
            fail(e);
        }
    }

    private void fail(@Nonnull StorageException e) {
        error = e;
        current = null;
    }

    @Override
    public boolean isValid() {
        return !closed && error == null && current != null;
    }

    @Nonnull
    @Override
    public StoreItem getItem() {
        if (!isValid()) {
            throw new IllegalStateException("iterator is not positioned on an item");
        }
        return new Item(current.getKey().clone(), current.getValue().clone());
    }

    @Nullable
    @Override
    public StorageException getError() {
        return error;
    }

    @Override
    public void close() {
        closed = true;
        current = null;
    }

    private static final class Item implements StoreItem {
        @Nonnull
        private final byte[] key;
        @Nonnull
        private final byte[] value;

        private Item(@Nonnull byte[] key, @Nonnull byte[] value) {
            this.key = key;
            this.value = value;
        }

        @Nonnull
        @Override
        public byte[] getKey() {
            return key;
        }

        @Nonnull
        @Override
        public byte[] getValue() {
            return value;
        }
    }
}
