/*
 * StoreCursor.java
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

import com.apple.foundationdb.tuple.ByteArrayUtil;
import io.quarry.annotation.API;
import io.quarry.engine.IteratorOptions;
import io.quarry.engine.StorageException;
import io.quarry.engine.Store;
import io.quarry.engine.StoreItem;
import io.quarry.engine.StoreIterator;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * A cursor over the items of a {@link Store} whose keys lie in {@code [low, high)}.
 *
 * <p>
 * A forward cursor seeks to {@code low}. A reverse cursor seeks to {@code high} and steps over an item sitting
 * exactly on it, so that it starts from the last key before {@code high}. When no key is at or after
 * {@code high} the reverse seek leaves the iterator unpositioned, and the cursor starts from the last key instead.
 * Either bound may be {@code null} for an open end. The underlying {@link StoreIterator} is opened on the first {@link #getNext()} and closed as soon
 * as the range is exhausted, when an error occurs, or when this cursor is closed.
 * </p>
 */
@API(API.Status.INTERNAL)
public class StoreCursor implements Cursor<StoreItem> {
    private static final byte[] EMPTY = new byte[0];

    @Nonnull
    private final Store store;
    @Nullable
    private final byte[] low;
    @Nullable
    private final byte[] high;
    private final boolean reverse;
    @Nullable
    private StoreIterator iterator;
    private boolean started;
    private boolean done;

    public StoreCursor(@Nonnull Store store, @Nullable byte[] low, @Nullable byte[] high, boolean reverse) {
        this.store = store;
        this.low = low;
        this.high = high;
        this.reverse = reverse;
    }

    @Nonnull
    public static StoreCursor all(@Nonnull Store store, boolean reverse) {
        return new StoreCursor(store, null, null, reverse);
    }

    @Nonnull
    @Override
    public CursorResult<StoreItem> getNext() {
        if (done) {
            return CursorResult.exhausted();
        }
        try {
            if (!started) {
                started = true;
                iterator = store.iterator(IteratorOptions.of(reverse));
                if (!position(iterator)) {
                    finish();
                    return CursorResult.exhausted();
                }
            } else {
                iterator.next();
            }
            checkError(iterator);
            if (!iterator.isValid()) {
                finish();
                return CursorResult.exhausted();
            }
            final StoreItem item = iterator.getItem();
            if (outOfRange(item.getKey())) {
                finish();
                return CursorResult.exhausted();
            }
            return CursorResult.withNextValue(item);
        } catch (RuntimeException e) {
            finish();
            throw e;
        }
    }

    private boolean position(@Nonnull StoreIterator it) {
        if (!reverse) {
            it.seek(low == null ? EMPTY : low);
            return true;
        }
        it.seek(high == null ? EMPTY : high);
        checkError(it);
        if (high == null) {
            return true;
        }
        if (!it.isValid()) {
            // nothing at or after high: start from the last key, unless the store has keys only above high
            it.seek(EMPTY);
            checkError(it);
            return !it.isValid() || ByteArrayUtil.compareUnsigned(it.getItem().getKey(), high) < 0;
        }
        if (ByteArrayUtil.compareUnsigned(it.getItem().getKey(), high) >= 0) {
            it.next();
        }
        return true;
    }

    private boolean outOfRange(@Nonnull byte[] key) {
        if (reverse) {
            return low != null && ByteArrayUtil.compareUnsigned(key, low) < 0;
        }
        return high != null && ByteArrayUtil.compareUnsigned(key, high) >= 0;
    }

    private static void checkError(@Nonnull StoreIterator it) {
        final StorageException error = it.getError();
        if (error != null) {
            throw error;
        }
    }

    private void finish() {
        done = true;
        if (iterator != null) {
            iterator.close();
            iterator = null;
        }
    }

    @Override
    public void close() {
        finish();
    }

    /**
     * Whether the underlying iterator has been released, either because this cursor was closed or because it
     * reached the end of its range.
     * @return {@code true} once no iterator is held
     */
    @Override
    public boolean isClosed() {
        return done;
    }
}
