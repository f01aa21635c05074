/*
 * MemoryTransaction.java
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
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * A transaction of the {@link MemoryEngine}.
 */
class MemoryTransaction implements EngineTransaction {
    @Nonnull
    private static final Logger LOGGER = LoggerFactory.getLogger(MemoryTransaction.class);

    @Nonnull
    private final MemoryEngine engine;
    private final long id;
    private final boolean writable;
    @Nonnull
    private final CancellationToken cancellationToken;
    @Nonnull
    private final Map<String, MemoryStoreState> stores;
    @Nonnull
    private final Set<String> owned = new HashSet<>();
    private boolean done;

    MemoryTransaction(@Nonnull MemoryEngine engine, long id, boolean writable,
                      @Nonnull CancellationToken cancellationToken,
                      @Nonnull Map<String, MemoryStoreState> snapshot) {
        this.engine = engine;
        this.id = id;
        this.writable = writable;
        this.cancellationToken = cancellationToken;
        this.stores = writable ? new HashMap<>(snapshot) : snapshot;
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
        cancellationToken.throwIfCancelled();
        checkActive();
        if (!stores.containsKey(name)) {
            throw new StoreNotFoundException("store not found", LogMessageKeys.STORE_NAME, name);
        }
        return new MemoryStore(this, name);
    }

    @Override
    public void createStore(@Nonnull String name) {
        cancellationToken.throwIfCancelled();
        checkActive();
        checkWritable("createStore", name);
        if (stores.containsKey(name)) {
            throw new StoreAlreadyExistsException("store already exists", LogMessageKeys.STORE_NAME, name);
        }
        stores.put(name, new MemoryStoreState());
        owned.add(name);
    }

    @Override
    public void dropStore(@Nonnull String name) {
        cancellationToken.throwIfCancelled();
        checkActive();
        checkWritable("dropStore", name);
        if (stores.remove(name) == null) {
            throw new StoreNotFoundException("store not found", LogMessageKeys.STORE_NAME, name);
        }
        owned.remove(name);
    }

    @Nonnull
    @Override
    public ImmutableList<String> listStores() {
        cancellationToken.throwIfCancelled();
        checkActive();
        return ImmutableList.sortedCopyOf(stores.keySet());
    }

    @Nonnull
    MemoryStoreState readState(@Nonnull String name) {
        final MemoryStoreState state = stores.get(name);
        if (state == null) {
            throw new StoreNotFoundException("store not found", LogMessageKeys.STORE_NAME, name);
        }
        return state;
    }

    @Nonnull
    MemoryStoreState writeState(@Nonnull String name) {
        MemoryStoreState state = readState(name);
        if (owned.add(name)) {
            state = state.copy();
            stores.put(name, state);
        }
        return state;
    }

    void checkActive() {
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
        checkActive();
        done = true;
        try {
            if (writable) {
                engine.publish(id, stores);
            }
        } finally {
            engine.release(writable);
        }
    }

    @Override
    public void rollback() {
        checkActive();
        done = true;
        engine.release(writable);
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("rolled back memory transaction {}", id);
        }
    }

    @Override
    public void close() {
        if (!done) {
            rollback();
        }
    }

    @Nonnull
    CancellationToken cancellationToken() {
        return cancellationToken;
    }
}
