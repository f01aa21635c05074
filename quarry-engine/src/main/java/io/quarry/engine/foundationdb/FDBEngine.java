/*
 * FDBEngine.java
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

import com.apple.foundationdb.Database;
import com.apple.foundationdb.Transaction;
import com.apple.foundationdb.subspace.Subspace;
import com.apple.foundationdb.tuple.Tuple;
import io.quarry.annotation.API;
import io.quarry.engine.CancellationToken;
import io.quarry.engine.EngineTransaction;
import io.quarry.engine.StorageEngine;
import io.quarry.engine.StorageException;
import io.quarry.util.LogMessageKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A {@link StorageEngine} that keeps its stores in a FoundationDB cluster.
 *
 * <p>
 * All keys live under a root subspace. Each store has three parts:
 * </p>
 * <ul>
 *     <li>a marker key {@code (root, 0, name)} recording that the store exists</li>
 *     <li>its data in the subspace {@code (root, 1, name)}; store keys are appended to that prefix as is</li>
 *     <li>its sequence counter at {@code (root, 2, name)}</li>
 * </ul>
 *
 * <p>
 * Writer exclusivity and isolation are FoundationDB's own: conflicting transactions fail at commit and are not
 * retried here.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public class FDBEngine implements StorageEngine {
    public static final String NAME = "foundationdb";

    @Nonnull
    private static final Logger LOGGER = LoggerFactory.getLogger(FDBEngine.class);

    private static final long CATALOG = 0L;
    private static final long DATA = 1L;
    private static final long SEQUENCES = 2L;

    @Nonnull
    private final Database database;
    @Nonnull
    private final Subspace root;
    private final boolean ownsDatabase;
    @Nonnull
    private final AtomicLong transactionIds = new AtomicLong();
    private volatile boolean closed;

    /**
     * Create an engine over a database.
     * @param database the database
     * @param root the subspace holding every key of this engine
     * @param ownsDatabase whether {@link #close()} should also close the database
     */
    public FDBEngine(@Nonnull Database database, @Nonnull Subspace root, boolean ownsDatabase) {
        this.database = database;
        this.root = root;
        this.ownsDatabase = ownsDatabase;
    }

    @Nonnull
    @Override
    public String getName() {
        return NAME;
    }

    @Nonnull
    public Subspace getRoot() {
        return root;
    }

    @Nonnull
    @Override
    public EngineTransaction begin(boolean writable, @Nonnull CancellationToken cancellationToken) {
        if (closed) {
            throw new StorageException("engine is closed", LogMessageKeys.ENGINE, NAME);
        }
        cancellationToken.throwIfCancelled();
        final Transaction transaction = database.createTransaction();
        final long id = transactionIds.incrementAndGet();
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("begin fdb transaction {} writable={}", id, writable);
        }
        return new FDBEngineTransaction(this, transaction, id, writable, cancellationToken);
    }

    @Nonnull
    byte[] catalogKey(@Nonnull String storeName) {
        return root.pack(Tuple.from(CATALOG, storeName));
    }

    @Nonnull
    Subspace catalogSubspace() {
        return root.get(CATALOG);
    }

    @Nonnull
    Subspace dataSubspace(@Nonnull String storeName) {
        return root.get(DATA).get(storeName);
    }

    @Nonnull
    byte[] sequenceKey(@Nonnull String storeName) {
        return root.pack(Tuple.from(SEQUENCES, storeName));
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (ownsDatabase) {
            database.close();
        }
    }
}
