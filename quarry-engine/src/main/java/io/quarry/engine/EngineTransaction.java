/*
 * EngineTransaction.java
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

package io.quarry.engine;

import io.quarry.annotation.API;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * A single-use transaction against a {@link StorageEngine}. Stores obtained from a transaction are only valid
 * until it commits, rolls back or closes.
 */
@API(API.Status.STABLE)
public interface EngineTransaction extends AutoCloseable {
    boolean isWritable();

    @Nonnull
    CancellationToken getCancellationToken();

    /**
     * Get a store by name.
     * @param name the name of the store
     * @return the store, bound to this transaction
     * @throws StoreNotFoundException if there is no such store
     */
    @Nonnull
    Store getStore(@Nonnull String name);

    /**
     * Create an empty store.
     * @param name the name of the store
     * @throws StoreAlreadyExistsException if a store of that name exists
     * @throws ReadOnlyTransactionException if the transaction is read-only
     */
    void createStore(@Nonnull String name);

    /**
     * Drop a store, its contents and its sequence.
     * @param name the name of the store
     * @throws StoreNotFoundException if there is no such store
     * @throws ReadOnlyTransactionException if the transaction is read-only
     */
    void dropStore(@Nonnull String name);

    @Nonnull
    List<String> listStores();

    void commit();

    void rollback();

    /**
     * Roll back if neither {@link #commit()} nor {@link #rollback()} was called. Idempotent.
     */
    @Override
    void close();
}
