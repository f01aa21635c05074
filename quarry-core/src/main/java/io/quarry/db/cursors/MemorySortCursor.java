/*
 * MemorySortCursor.java
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
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * A cursor that reads its whole inner cursor into memory on the first {@link #getNext()} and returns the elements
 * in sorted order. The sort is stable. The inner cursor is closed as soon as it has been drained.
 * @param <T> the type of elements of the cursor
 */
@API(API.Status.UNSTABLE)
public class MemorySortCursor<T> implements Cursor<T> {
    @Nonnull
    private final Cursor<T> inner;
    @Nonnull
    private final Comparator<? super T> comparator;
    @Nullable
    private List<T> sorted;
    private int nextPosition;
    private boolean closed;

    public MemorySortCursor(@Nonnull Cursor<T> inner, @Nonnull Comparator<? super T> comparator) {
        this.inner = inner;
        this.comparator = comparator;
    }

    @Nonnull
    @Override
    public CursorResult<T> getNext() {
        if (closed) {
            return CursorResult.exhausted();
        }
        if (sorted == null) {
            final List<T> elements = new ArrayList<>();
            try {
                inner.forEach(elements::add);
            } finally {
                inner.close();
            }
            elements.sort(comparator);
            sorted = elements;
        }
        if (nextPosition >= sorted.size()) {
            return CursorResult.exhausted();
        }
        return CursorResult.withNextValue(sorted.get(nextPosition++));
    }

    @Override
    public void close() {
        closed = true;
        sorted = null;
        inner.close();
    }

    @Override
    public boolean isClosed() {
        return closed;
    }
}
