/*
 * StoreIterator.java
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
import javax.annotation.Nullable;

/**
 * An ordered cursor over the entries of a {@link Store}.
 *
 * <p>
 * An iterator is in one of three states: positioned on an item, exhausted, or errored. {@link #isValid()} is
 * only {@code true} in the first. After a failure, {@link #getError()} returns it and the iterator stays invalid
 * until it is closed. A fresh iterator is unpositioned and invalid until {@link #seek} is called.
 * </p>
 *
 * <p>
 * In forward mode {@code seek(pivot)} positions on the first key greater than or equal to {@code pivot}. In
 * reverse mode it positions on the first key less than or equal to {@code pivot}, reached by a forward seek
 * followed by walking backward over the keys greater than {@code pivot}. If that forward seek finds no key, a
 * reverse seek leaves the iterator invalid without an error; it does not fall back to the last key. An empty
 * pivot means the first key (forward) or the last key (reverse).
 * </p>
 *
 * <p>
 * Iterators are not thread safe. Closing is idempotent and has no effect on the store.
 * </p>
 */
@API(API.Status.STABLE)
public interface StoreIterator extends AutoCloseable {
    /**
     * Position the iterator relative to {@code pivot}. Any earlier error is retained.
     * @param pivot the key to seek to; may be empty
     */
    void seek(@Nonnull byte[] pivot);

    /**
     * Move to the next item in iteration order. Only legal while {@link #isValid()}.
     */
    void next();

    boolean isValid();

    /**
     * Get the current item.
     * @return the current item
     * @throws IllegalStateException if the iterator is not positioned on an item
     */
    @Nonnull
    StoreItem getItem();

    /**
     * Get the error that made this iterator invalid, if any.
     * @return the error or {@code null} if the iterator is positioned or simply exhausted
     */
    @Nullable
    StorageException getError();

    @Override
    void close();
}
