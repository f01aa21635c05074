/*
 * Cursor.java
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

import io.quarry.annotation.API;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * A synchronous, forward-only pull cursor.
 *
 * <p>
 * Each call to {@link #getNext()} produces either the next element or a {@link CursorResult} explaining why
 * there is none. Once a cursor has returned a result without a value, every later call returns an equivalent
 * result. Cursors own the resources they read from and must be closed on every exit path; closing is
 * idempotent. Combinators such as {@link #filter} and {@link #limitRowsTo} wrap this cursor and take over its
 * ownership, so only the outermost cursor needs to be closed.
 * </p>
 *
 * <p>
 * Cursors are not thread safe.
 * </p>
 * @param <T> the type of elements of the cursor
 */
@API(API.Status.STABLE)
public interface Cursor<T> extends AutoCloseable {
    @Nonnull
    CursorResult<T> getNext();

    @Override
    void close();

    boolean isClosed();

    @Nonnull
    static <T> Cursor<T> fromList(@Nonnull List<? extends T> list) {
        return new ListCursor<>(list);
    }

    @Nonnull
    static <T> Cursor<T> empty() {
        return new EmptyCursor<>();
    }

    @Nonnull
    default Cursor<T> filter(@Nonnull Predicate<? super T> predicate) {
        return new FilterCursor<>(this, predicate);
    }

    @Nonnull
    default <V> Cursor<V> map(@Nonnull Function<? super T, ? extends V> function) {
        return new MapCursor<>(this, function);
    }

    @Nonnull
    default Cursor<T> skip(int skip) {
        return skip <= 0 ? this : new SkipCursor<>(this, skip);
    }

    @Nonnull
    default Cursor<T> limitRowsTo(int limit) {
        return new RowLimitedCursor<>(this, limit);
    }

    @Nonnull
    default Cursor<T> sort(@Nonnull Comparator<? super T> comparator) {
        return new MemorySortCursor<>(this, comparator);
    }

    /**
     * Count the remaining elements without keeping them.
     * @return the number of elements
     */
    default int getCount() {
        int count = 0;
        while (getNext().hasNext()) {
            count++;
        }
        return count;
    }

    default void forEach(@Nonnull Consumer<? super T> consumer) {
        CursorResult<T> result = getNext();
        while (result.hasNext()) {
            consumer.accept(result.get());
            result = getNext();
        }
    }

    @Nonnull
    default List<T> asList() {
        final List<T> list = new ArrayList<>();
        forEach(list::add);
        return Collections.unmodifiableList(list);
    }
}
