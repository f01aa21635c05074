/*
 * FDBStoreIterator.java
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

import com.apple.foundationdb.KeyValue;
import com.apple.foundationdb.ReadTransaction;
import com.apple.foundationdb.async.AsyncIterator;
import com.apple.foundationdb.tuple.ByteArrayUtil;
import io.quarry.engine.StorageException;
import io.quarry.engine.StoreItem;
import io.quarry.engine.StoreIterator;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Arrays;
import java.util.List;

/**
 * A {@link StoreIterator} reading a bounded range of a store's subspace.
 *
 * <p>
 * A reverse seek first reads the single first key at or after the pivot, the same forward seek used by forward
 * iteration. A reverse range read ending at that key then walks backward. When the forward seek lands exactly on
 * the pivot the reverse read includes it. When no key is at or after the pivot the iterator is left unpositioned.
 * </p>
 */
class FDBStoreIterator implements StoreIterator {
    @Nonnull
    private final FDBEngineTransaction transaction;
    @Nonnull
    private final byte[] prefix;
    @Nonnull
    private final byte[] end;
    private final boolean reverse;
    @Nullable
    private AsyncIterator<KeyValue> range;
    @Nullable
    private KeyValue current;
    @Nullable
    private StorageException error;
    private boolean closed;

    FDBStoreIterator(@Nonnull FDBEngineTransaction transaction, @Nonnull byte[] prefix, boolean reverse) {
        this.transaction = transaction;
        this.prefix = prefix;
        this.end = ByteArrayUtil.strinc(prefix);
        this.reverse = reverse;
    }

    @Override
    public void seek(@Nonnull byte[] pivot) {
        if (closed || error != null) {
            return;
        }
        cancelRange();
        try {
            transaction.begin();
            final ReadTransaction reader = transaction.reader();
            final byte[] start = ByteArrayUtil.join(prefix, pivot);
            if (!reverse) {
                range = reader.getRange(start, end).iterator();
            } else if (pivot.length == 0) {
                range = reader.getRange(prefix, end, ReadTransaction.ROW_LIMIT_UNLIMITED, true).iterator();
            } else {
                final List<KeyValue> landing = FDBEngineExceptions.join(reader.getRange(start, end, 1).asList());
                if (landing.isEmpty()) {
                    current = null;
                    return;
                }
                final byte[] upper;
                if (Arrays.equals(landing.get(0).getKey(), start)) {
                    upper = ByteArrayUtil.join(start, new byte[] {0x00});
                } else {
                    upper = landing.get(0).getKey();
                }
                range = reader.getRange(prefix, upper, ReadTransaction.ROW_LIMIT_UNLIMITED, true).iterator();
            }
            advance();
        } catch (RuntimeException e) {
            fail(e);
        }
    }

    @Override
    public void next() {
        if (!isValid()) {
            throw new IllegalStateException("iterator is not positioned on an item");
        }
        try {
            transaction.begin();
            advance();
        } catch (RuntimeException e) {
            fail(e);
        }
    }

    private void advance() {
        try {
            current = range != null && range.hasNext() ? range.next() : null;
        } catch (RuntimeException e) {
            throw FDBEngineExceptions.wrapException(e);
        }
    }

    private void fail(@Nonnull RuntimeException e) {
        final RuntimeException wrapped = FDBEngineExceptions.wrapException(e);
        if (!(wrapped instanceof StorageException)) {
            throw wrapped;
        }
        error = (StorageException) wrapped;
        current = null;
        cancelRange();
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
        final KeyValue kv = current;
        final byte[] key = Arrays.copyOfRange(kv.getKey(), prefix.length, kv.getKey().length);
        final byte[] value = kv.getValue();
        return new StoreItem() {
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
        };
    }

    @Nullable
    @Override
    public StorageException getError() {
        return error;
    }

    private void cancelRange() {
        if (range != null) {
            range.cancel();
            range = null;
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        current = null;
        cancelRange();
    }
}
