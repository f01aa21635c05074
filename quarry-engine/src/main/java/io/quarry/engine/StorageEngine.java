/*
 * StorageEngine.java
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
 * A pluggable, transactional, ordered key-value backend. Any implementation that honors the contracts of
 * {@link EngineTransaction}, {@link Store} and {@link StoreIterator} can be used by the query layer unchanged.
 */
@API(API.Status.STABLE)
public interface StorageEngine extends AutoCloseable {
    @Nonnull
    String getName();

    /**
     * Begin a transaction.
     * @param writable whether the transaction may mutate stores
     * @param cancellationToken the signal checked by every store operation in the transaction
     * @return a new transaction
     */
    @Nonnull
    EngineTransaction begin(boolean writable, @Nonnull CancellationToken cancellationToken);

    @Nonnull
    default EngineTransaction begin(boolean writable) {
        return begin(writable, CancellationToken.NONE);
    }

    @Override
    void close();
}
