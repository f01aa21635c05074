/*
 * Store.java
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

/**
 * An ordered byte-key to byte-value map, scoped to one {@link EngineTransaction}.
 *
 * <p>
 * Keys are ordered as unsigned bytes, the same order for {@link #get}, {@link #put}, {@link #delete} and
 * {@link #iterator}. Every operation first checks the transaction's {@link CancellationToken} and fails with
 * {@link OperationCancelledException} without doing anything if it has fired. Mutations then fail with
 * {@link ReadOnlyTransactionException} if the transaction is read-only. No operation is valid once the
 * owning transaction has ended.
 * </p>
 */
@API(API.Status.STABLE)
public interface Store {
    @Nonnull
    String getName();

    /**
     * Insert or overwrite a value.
     * @param key the key; must not be empty
     * @param value the value
     */
    void put(@Nonnull byte[] key, @Nonnull byte[] value);

    /**
     * Get the value stored under a key.
     * @param key the key
     * @return a copy of the value
     * @throws KeyNotFoundException if the key is absent
     */
    @Nonnull
    byte[] get(@Nonnull byte[] key);

    /**
     * Delete a key.
     * @param key the key
     * @throws KeyNotFoundException if the key is absent
     */
    void delete(@Nonnull byte[] key);

    /**
     * Remove every key at once. The store stays usable afterwards and its sequence is not reset.
     */
    void truncate();

    /**
     * Get the next value of this store's sequence. Values start at 1 and are strictly increasing for the
     * lifetime of the backend.
     * @return the next sequence value
     */
    long nextSequence();

    @Nonnull
    StoreIterator iterator(@Nonnull IteratorOptions options);
}
