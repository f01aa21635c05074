/*
 * MemoryStoreState.java
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

import com.google.common.primitives.UnsignedBytes;

import javax.annotation.Nonnull;
import java.util.Comparator;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * The contents and sequence of one in-memory store. Instances reachable from the engine's committed catalog are
 * never mutated again; a writable transaction mutates a private {@link #copy()}.
 */
class MemoryStoreState {
    @Nonnull
    static final Comparator<byte[]> KEY_ORDER = UnsignedBytes.lexicographicalComparator();

    @Nonnull
    private NavigableMap<byte[], byte[]> data;
    private long sequence;

    MemoryStoreState() {
        this(new TreeMap<>(KEY_ORDER), 0L);
    }

    private MemoryStoreState(@Nonnull NavigableMap<byte[], byte[]> data, long sequence) {
        this.data = data;
        this.sequence = sequence;
    }

    @Nonnull
    NavigableMap<byte[], byte[]> getData() {
        return data;
    }

    /**
     * Swap in an empty map. Iterators that already hold the old map keep reading it.
     */
    void truncate() {
        data = new TreeMap<>(KEY_ORDER);
    }

    long nextSequence() {
        return ++sequence;
    }

    @Nonnull
    MemoryStoreState copy() {
        // keys and values are copied on the way in and out, so sharing the arrays is safe
        return new MemoryStoreState(new TreeMap<>(data), sequence);
    }
}
