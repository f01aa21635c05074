/*
 * Result.java
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

package io.quarry.db.query;

import io.quarry.annotation.API;
import io.quarry.db.Transaction;
import io.quarry.db.cursors.DocumentStream;
import io.quarry.util.CloseableUtils;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * The outcome of running a statement: the stream of a {@code SELECT}, or the number of documents a mutation
 * affected.
 *
 * <p>
 * A result may own the read transaction its stream reads in. Closing the result closes the stream and then
 * that transaction.
 * </p>
 */
@API(API.Status.STABLE)
public class Result implements AutoCloseable {
    @Nonnull
    private final DocumentStream stream;
    private final long rowsAffected;
    @Nullable
    private final byte[] lastInsertKey;
    @Nullable
    private Transaction transaction;

    private Result(@Nonnull DocumentStream stream, long rowsAffected, @Nullable byte[] lastInsertKey) {
        this.stream = stream;
        this.rowsAffected = rowsAffected;
        this.lastInsertKey = lastInsertKey;
    }

    @Nonnull
    public static Result empty() {
        return new Result(DocumentStream.empty(), 0, null);
    }

    @Nonnull
    public static Result ofStream(@Nonnull DocumentStream stream) {
        return new Result(stream, 0, null);
    }

    @Nonnull
    public static Result ofRowsAffected(long rowsAffected) {
        return new Result(DocumentStream.empty(), rowsAffected, null);
    }

    @Nonnull
    public static Result ofInsert(long rowsAffected, @Nullable byte[] lastInsertKey) {
        return new Result(DocumentStream.empty(), rowsAffected, lastInsertKey);
    }

    /**
     * Get the documents of a {@code SELECT}. Empty for every other statement.
     * @return the stream, which can be consumed once
     */
    @Nonnull
    public DocumentStream getStream() {
        return stream;
    }

    public long getRowsAffected() {
        return rowsAffected;
    }

    /**
     * Get the storage key of the last document an {@code INSERT} stored.
     * @return the key, or {@code null} if nothing was inserted
     */
    @Nullable
    public byte[] getLastInsertKey() {
        return lastInsertKey == null ? null : lastInsertKey.clone();
    }

    @Nonnull
    Result withTransaction(@Nonnull Transaction owned) {
        this.transaction = owned;
        return this;
    }

    @Override
    public void close() {
        final Transaction owned = transaction;
        transaction = null;
        CloseableUtils.closeAll(stream, owned);
    }
}
