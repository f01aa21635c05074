/*
 * FDBEngineTransaction.java
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
import com.apple.foundationdb.Transaction;
import com.apple.foundationdb.subspace.Subspace;
import com.google.common.collect.ImmutableList;
import io.quarry.engine.CancellationToken;
import io.quarry.engine.EngineTransaction;
import io.quarry.engine.ReadOnlyTransactionException;
import io.quarry.engine.Store;
import io.quarry.engine.StoreAlreadyExistsException;
import io.quarry.engine.StoreNotFoundException;
import io.quarry.engine.TransactionClosedException;
import io.quarry.util.LogMessageKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * A transaction of the {@link FDBEngine}, wrapping one FoundationDB {@link Transaction}. Read-only transactions
 * read at snapshot isolation since they can never conflict.
 */
class FDBEngineTransaction implements EngineTransaction {
    @Nonnull
    private static final Logger LOGGER = LoggerFactory.getLogger(FDBEngineTransaction.class);

    private static final byte[] MARKER = new byte[0];

    @Nonnull
    private final FDBEngine engine;
    @Nonnull
    private final Transaction transaction;
    private final long id;
    private final boolean writable;
    @Nonnull
    private final CancellationToken cancellationToken;
    private boolean done;

    FDBEngineTransaction(@Nonnull FDBEngine engine, @Nonnull Transaction transaction, long id, boolean writable,
                         @Nonnull CancellationToken cancellationToken) {
        this.engine = engine;
        this.transaction = transaction;
        this.id = id;
        this.writable = writable;
        this.cancellationToken = cancellationToken;
    }

    @Override
    public boolean isWritable() {
        return writable;
    }

    @Nonnull
    @Override
    public CancellationToken getCancellationToken() {
        return cancellationToken;
    }

    @Nonnull
    @Override
    public Store getStore(@Nonnull String name) {
        begin();
        if (!storeExists(name)) {
            throw new StoreNotFoundException("store not found", LogMessageKeys.STORE_NAME, name);
        }
        return new FDBStore(this, name, engine.dataSubspace(name), engine.sequenceKey(name));
    }

    @Override
    public void createStore(@Nonnull String name) {
        begin();
        checkWritable("createStore", name);
        if (storeExists(name)) {
            throw new StoreAlreadyExistsException("store already exists", LogMessageKeys.STORE_NAME, name);
        }
        transaction.set(engine.catalogKey(name), MARKER);
    }

    @Override
    public void dropStore(@Nonnull String name) {
        begin();
        checkWritable("dropStore", name);
        if (!storeExists(name)) {
            throw new StoreNotFoundException("store not found", LogMessageKeys.STORE_NAME, name);
        }
        transaction.clear(engine.catalogKey(name));
        transaction.clear(engine.dataSubspace(name).range());
        transaction.clear(engine.sequenceKey(name));
    }

    @Nonnull
    @Override
    public List<String> listStores() {
        begin();
        final Subspace catalog = engine.catalogSubspace();
        final List<KeyValue> entries = FDBEngineExceptions.join(reader().getRange(catalog.range()).asList());
        final ImmutableList.Builder<String> names = ImmutableList.builder();
        for (KeyValue entry : entries) {
            names.add(catalog.unpack(entry.getKey()).getString(0));
        }
        return names.build();
    }

    private boolean storeExists(@Nonnull String name) {
        return FDBEngineExceptions.join(reader().get(engine.catalogKey(name))) != null;
    }

    @Nonnull
    Transaction transaction() {
        return transaction;
    }

    @Nonnull
    ReadTransaction reader() {
        return writable ? transaction : transaction.snapshot();
    }

    /**
     * Checks made at the start of every operation: cancellation first, then the transaction state.
     */
    void begin() {
        cancellationToken.throwIfCancelled();
        if (done) {
            throw new TransactionClosedException("transaction already ended", LogMessageKeys.TRANSACTION_ID, id);
        }
    }

    void checkWritable(@Nonnull String operation, @Nonnull String storeName) {
        if (!writable) {
            throw new ReadOnlyTransactionException("cannot " + operation + " in a read-only transaction",
                    LogMessageKeys.STORE_NAME, storeName,
                    LogMessageKeys.TRANSACTION_ID, id);
        }
    }

    @Override
    public void commit() {
        begin();
        done = true;
        try {
            if (writable) {
                FDBEngineExceptions.join(transaction.commit());
            }
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("committed fdb transaction {}", id);
            }
        } finally {
            transaction.close();
        }
    }

    @Override
    public void rollback() {
        if (done) {
            throw new TransactionClosedException("transaction already ended", LogMessageKeys.TRANSACTION_ID, id);
        }
        done = true;
        transaction.cancel();
        transaction.close();
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("rolled back fdb transaction {}", id);
        }
    }

    @Override
    public void close() {
        if (!done) {
            rollback();
        }
    }
}
