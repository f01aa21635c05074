/*
 * MemoryStore.java
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

import com.apple.foundationdb.tuple.ByteArrayUtil;
import com.google.common.base.Preconditions;
import io.quarry.engine.IteratorOptions;
import io.quarry.engine.KeyNotFoundException;
import io.quarry.engine.Store;
import io.quarry.engine.StoreIterator;
import io.quarry.util.LogMessageKeys;

import javax.annotation.Nonnull;
import java.util.NavigableMap;

/**
 * A {@link Store} view onto one store of a {@link MemoryTransaction}.
 */
class MemoryStore implements Store {
    @Nonnull
    private final MemoryTransaction transaction;
    @Nonnull
    private final String name;

    MemoryStore(@Nonnull MemoryTransaction transaction, @Nonnull String name) {
        this.transaction = transaction;
        this.name = name;
    }

    @Nonnull
    @Override
    public String getName() {
        return name;
    }

    @Override
    public void put(@Nonnull byte[] key, @Nonnull byte[] value) {
        beginMutation("put");
        Preconditions.checkArgument(key.length > 0, "key must not be empty");
        transaction.writeState(name).getData().put(key.clone(), value.clone());
    }

    @Nonnull
    @Override
    public byte[] get(@Nonnull byte[] key) {
        beginRead();
        final byte[] value = transaction.readState(name).getData().get(key);
        if (value == null) {
            throw keyNotFound(key);
        }
        return value.clone();
    }

    @Override
    public void delete(@Nonnull byte[] key) {
        beginMutation("delete");
        final NavigableMap<byte[], byte[]> data = transaction.readState(name).getData();
        if (!data.containsKey(key)) {
            throw keyNotFound(key);
        }
        transaction.writeState(name).getData().remove(key);
    }

    @Override
    public void truncate() {
        beginMutation("truncate");
        transaction.writeState(name).truncate();
    }

    @Override
    public long nextSequence() {
        beginMutation("nextSequence");
        return transaction.writeState(name).nextSequence();
    }

    @Nonnull
    @Override
    public StoreIterator iterator(@Nonnull IteratorOptions options) {
        beginRead();
        return new MemoryIterator(this, options.isReverse());
    }

    @Nonnull
    NavigableMap<byte[], byte[]> currentData() {
        beginRead();
        return transaction.readState(name).getData();
    }

    private void beginRead() {
        transaction.cancellationToken().throwIfCancelled();
        transaction.checkActive();
    }

    private void beginMutation(@Nonnull String operation) {
        beginRead();
        transaction.checkWritable(operation, name);
    }

    @Nonnull
    private KeyNotFoundException keyNotFound(@Nonnull byte[] key) {
        return new KeyNotFoundException("key not found",
                LogMessageKeys.STORE_NAME, name,
                LogMessageKeys.KEY, ByteArrayUtil.printable(key));
    }

    @Override
    public String toString() {
        return "MemoryStore{" + name + "}";
    }
}
