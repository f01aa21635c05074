/*
 * FDBStore.java
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

package io.quarry.engine.foundationdb;

import com.apple.foundationdb.subspace.Subspace;
import com.apple.foundationdb.tuple.ByteArrayUtil;
import com.apple.foundationdb.tuple.Tuple;
import com.google.common.base.Preconditions;
import io.quarry.engine.IteratorOptions;
import io.quarry.engine.KeyNotFoundException;
import io.quarry.engine.Store;
import io.quarry.engine.StoreIterator;
import io.quarry.util.LogMessageKeys;

import javax.annotation.Nonnull;

/**
 * A {@link Store} whose keys are appended to a subspace prefix.
 */
class FDBStore implements Store {
    @Nonnull
    private final FDBEngineTransaction transaction;
    @Nonnull
    private final String name;
    @Nonnull
    private final Subspace subspace;
    @Nonnull
    private final byte[] prefix;
    @Nonnull
    private final byte[] sequenceKey;

    FDBStore(@Nonnull FDBEngineTransaction transaction, @Nonnull String name, @Nonnull Subspace subspace,
             @Nonnull byte[] sequenceKey) {
        this.transaction = transaction;
        this.name = name;
        this.subspace = subspace;
        this.prefix = subspace.getKey();
        this.sequenceKey = sequenceKey;
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
        transaction.transaction().set(toStorageKey(key), value);
    }

    @Nonnull
    @Override
    public byte[] get(@Nonnull byte[] key) {
        transaction.begin();
        final byte[] value = FDBEngineExceptions.join(transaction.reader().get(toStorageKey(key)));
        if (value == null) {
            throw keyNotFound(key);
        }
        return value;
    }

    @Override
    public void delete(@Nonnull byte[] key) {
        beginMutation("delete");
        final byte[] storageKey = toStorageKey(key);
        if (FDBEngineExceptions.join(transaction.transaction().get(storageKey)) == null) {
            throw keyNotFound(key);
        }
        transaction.transaction().clear(storageKey);
    }

    @Override
    public void truncate() {
        beginMutation("truncate");
        transaction.transaction().clear(subspace.range());
    }

    @Override
    public long nextSequence() {
        beginMutation("nextSequence");
        final byte[] current = FDBEngineExceptions.join(transaction.transaction().get(sequenceKey));
        final long next = (current == null ? 0L : Tuple.fromBytes(current).getLong(0)) + 1L;
        transaction.transaction().set(sequenceKey, Tuple.from(next).pack());
        return next;
    }

    @Nonnull
    @Override
    public StoreIterator iterator(@Nonnull IteratorOptions options) {
        transaction.begin();
        return new FDBStoreIterator(transaction, prefix, options.isReverse());
    }

    @Nonnull
    private byte[] toStorageKey(@Nonnull byte[] key) {
        return ByteArrayUtil.join(prefix, key);
    }

    private void beginMutation(@Nonnull String operation) {
        transaction.begin();
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
        return "FDBStore{" + name + "}";
    }
}
