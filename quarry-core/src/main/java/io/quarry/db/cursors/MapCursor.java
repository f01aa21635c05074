/*
 * MapCursor.java
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
import java.util.function.Function;

/**
 * A cursor that applies a function to the elements of its inner cursor.
 * @param <T> the type of elements of the inner cursor
 * @param <V> the type of elements of this cursor
 */
@API(API.Status.UNSTABLE)
public class MapCursor<T, V> implements Cursor<V> {
    @Nonnull
    private final Cursor<T> inner;
    @Nonnull
    private final Function<? super T, ? extends V> function;

    public MapCursor(@Nonnull Cursor<T> inner, @Nonnull Function<? super T, ? extends V> function) {
        this.inner = inner;
        this.function = function;
    }

    @Nonnull
    @Override
    public CursorResult<V> getNext() {
        return inner.getNext().map(function);
    }

    @Override
    public void close() {
        inner.close();
    }

    @Override
    public boolean isClosed() {
        return inner.isClosed();
    }
}
